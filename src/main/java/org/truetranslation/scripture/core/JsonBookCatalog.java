package org.truetranslation.scripture.core;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;
import org.truetranslation.scripture.core.model.BookRecord;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Catalog read from a JSON array of {@code {id, name, shortName, chapters}}
 * objects. The bundled {@code default_books.json} holds the 66 books of the
 * Protestant canon and is used whenever no Bible module is selected.
 */
public class JsonBookCatalog implements BookCatalog {

    public static final String DEFAULT_RESOURCE = "/default_books.json";

    private static final Gson GSON = new Gson();
    private final List<BookRecord> books;

    private static class RawBook {
        int id;
        String name;
        String shortName;
        int chapters;
    }

    public JsonBookCatalog(InputStream inputStream) throws IOException {
        LocalizationManager loc = LocalizationManager.getInstance();
        try (InputStreamReader reader = new InputStreamReader(inputStream, StandardCharsets.UTF_8)) {
            Type type = new TypeToken<List<RawBook>>() {}.getType();
            List<RawBook> raw = GSON.fromJson(reader, type);
            if (raw == null) {
                throw new IOException(loc.getString("error.catalog.empty"));
            }
            List<BookRecord> loaded = new ArrayList<>();
            for (RawBook book : raw) {
                if (book == null) continue;
                if (book.name == null || book.name.isBlank()) {
                    throw new IOException(loc.getString("error.catalog.missingName", book.id));
                }
                loaded.add(new BookRecord(book.id, book.name, book.shortName, book.chapters));
            }
            this.books = Collections.unmodifiableList(loaded);
        } catch (JsonParseException | IllegalArgumentException e) {
            throw new IOException(loc.getString("error.catalog.invalid", e.getMessage()), e);
        }
    }

    public static JsonBookCatalog loadDefault() throws IOException {
        try (InputStream is = JsonBookCatalog.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (is == null) {
                throw new IOException(LocalizationManager.getInstance().getString("error.resource.notFound", DEFAULT_RESOURCE));
            }
            return new JsonBookCatalog(is);
        }
    }

    @Override
    public List<BookRecord> listBooks() {
        return books;
    }
}
