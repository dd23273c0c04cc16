package org.truetranslation.scripture.core;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;
import org.truetranslation.scripture.core.model.BookAbbreviationEntry;
import org.truetranslation.scripture.core.model.Testament;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Read-only lookup from book names and their common abbreviations to canonical
 * book entries. The bundled table is built once, on first use.
 */
public class AbbreviationTable {

    public static final String DEFAULT_RESOURCE = "/book_abbreviations.json";
    public static final int UNKNOWN_ORDER = 999;

    private static final Pattern NUMBERED_BOOK_SPACE = Pattern.compile("^(\\d)\\s+");

    private static final Gson GSON = new Gson();
    private static final LocalizationManager loc = LocalizationManager.getInstance();

    private final List<BookAbbreviationEntry> entries;
    private final Map<String, BookAbbreviationEntry> byName;

    // JSON shape of one entry in the abbreviation file.
    private static class RawEntry {
        String book;
        List<String> abbreviations;
        int order;
        String testament;
    }

    private static class DefaultHolder {
        static final AbbreviationTable INSTANCE = loadDefault();
    }

    private AbbreviationTable(List<BookAbbreviationEntry> entries) {
        Map<String, BookAbbreviationEntry> canonical = new LinkedHashMap<>();
        for (BookAbbreviationEntry entry : entries) {
            canonical.putIfAbsent(normalize(entry.getCanonicalName()), entry);
        }
        List<BookAbbreviationEntry> unique = new ArrayList<>(canonical.values());
        unique.sort((a, b) -> Integer.compare(a.getOrder(), b.getOrder()));

        Map<String, BookAbbreviationEntry> lookup = new HashMap<>(canonical);
        for (BookAbbreviationEntry entry : unique) {
            for (String abbreviation : entry.getAbbreviations()) {
                // Overlaps (e.g. "ez") go to the first book that claims them.
                lookup.putIfAbsent(abbreviation, entry);
            }
        }
        this.entries = Collections.unmodifiableList(unique);
        this.byName = Collections.unmodifiableMap(lookup);
    }

    public static AbbreviationTable getDefault() {
        return DefaultHolder.INSTANCE;
    }

    public static AbbreviationTable of(List<BookAbbreviationEntry> entries) {
        return new AbbreviationTable(entries);
    }

    /**
     * Reads a table in the bundled JSON format.
     *
     * @throws IOException if the stream cannot be read or does not hold a valid table
     */
    public static AbbreviationTable load(InputStream inputStream) throws IOException {
        try (InputStreamReader reader = new InputStreamReader(inputStream, StandardCharsets.UTF_8)) {
            Type type = new TypeToken<List<RawEntry>>() {}.getType();
            List<RawEntry> raw = GSON.fromJson(reader, type);
            if (raw == null || raw.isEmpty()) {
                throw new IOException(loc.getString("error.abbreviations.empty"));
            }
            List<BookAbbreviationEntry> entries = new ArrayList<>();
            for (RawEntry rawEntry : raw) {
                if (rawEntry == null || rawEntry.book == null || rawEntry.book.isBlank()) continue;
                if (rawEntry.testament == null) {
                    throw new IOException(loc.getString("error.abbreviations.missingTestament", rawEntry.book));
                }
                Set<String> abbreviations = new HashSet<>();
                if (rawEntry.abbreviations != null) {
                    rawEntry.abbreviations.stream().filter(Objects::nonNull).forEach(abbreviations::add);
                }
                entries.add(new BookAbbreviationEntry(rawEntry.book.trim(), abbreviations, rawEntry.order,
                        Testament.valueOf(rawEntry.testament.trim().toUpperCase(Locale.ROOT))));
            }
            return new AbbreviationTable(entries);
        } catch (JsonParseException | IllegalArgumentException e) {
            throw new IOException(loc.getString("error.abbreviations.invalid", e.getMessage()), e);
        }
    }

    /**
     * Loads a user supplied table, falling back to the bundled one when the file
     * is missing or unreadable.
     */
    public static AbbreviationTable loadOrDefault(Path file, int verbosity) {
        if (file == null || !Files.isRegularFile(file)) {
            if (file != null && verbosity > 0) {
                System.err.println(loc.getString("info.abbreviations.fallback", file));
            }
            return getDefault();
        }
        try (InputStream is = Files.newInputStream(file)) {
            return load(is);
        } catch (IOException e) {
            if (verbosity > 0) {
                System.err.println(loc.getString("error.abbreviations.loadFailed", file, e.getMessage()));
                System.err.println(loc.getString("info.abbreviations.fallback", file));
            }
            return getDefault();
        }
    }

    private static AbbreviationTable loadDefault() {
        try (InputStream is = AbbreviationTable.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (is == null) {
                throw new IOException(loc.getString("error.resource.notFound", DEFAULT_RESOURCE));
            }
            return load(is);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Canonical entry for a full name or abbreviation, case-insensitively.
     * "1 jn" and "1jn" are treated alike.
     */
    public Optional<BookAbbreviationEntry> resolve(String nameOrAbbreviation) {
        if (nameOrAbbreviation == null) return Optional.empty();
        String key = normalize(nameOrAbbreviation);
        BookAbbreviationEntry entry = byName.get(key);
        if (entry == null) {
            entry = byName.get(NUMBERED_BOOK_SPACE.matcher(key).replaceFirst("$1"));
        }
        return Optional.ofNullable(entry);
    }

    public int getBookOrder(String bookName) {
        return resolve(bookName).map(BookAbbreviationEntry::getOrder).orElse(UNKNOWN_ORDER);
    }

    public Optional<Testament> getTestament(String bookName) {
        return resolve(bookName).map(BookAbbreviationEntry::getTestament);
    }

    public List<BookAbbreviationEntry> entries() {
        return entries;
    }

    public int size() {
        return entries.size();
    }

    static String normalize(String text) {
        return text.trim().toLowerCase(Locale.ROOT);
    }
}
