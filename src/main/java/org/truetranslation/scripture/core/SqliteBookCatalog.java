package org.truetranslation.scripture.core;

import org.truetranslation.scripture.core.model.BookRecord;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Book catalog of a MyBible module. Names come from the {@code books} table,
 * chapter counts from the highest chapter present in {@code verses}. Books
 * without any verses are left out.
 */
public class SqliteBookCatalog implements BookCatalog {

    private final Path modulePath;
    private final int verbosity;
    private final LocalizationManager loc = LocalizationManager.getInstance();
    private List<BookRecord> books;

    public SqliteBookCatalog(Path modulePath, int verbosity) {
        this.modulePath = modulePath;
        this.verbosity = verbosity;
    }

    @Override
    public synchronized List<BookRecord> listBooks() {
        if (books == null) {
            try {
                books = Collections.unmodifiableList(readBooks());
            } catch (SQLException e) {
                if (verbosity > 0) {
                    System.err.println(loc.getString("error.catalog.readFailed", modulePath, e.getMessage()));
                }
                return List.of();
            }
        }
        return books;
    }

    /** Forgets the loaded list so the next call reads the module again. */
    public synchronized void refresh() {
        books = null;
    }

    private List<BookRecord> readBooks() throws SQLException {
        String url = "jdbc:sqlite:" + modulePath.toAbsolutePath();
        Map<Integer, Integer> chapterCounts = new HashMap<>();
        List<BookRecord> result = new ArrayList<>();

        try (Connection conn = DriverManager.getConnection(url);
             Statement stmt = conn.createStatement()) {
            try (ResultSet rs = stmt.executeQuery("SELECT book_number, MAX(chapter) AS chapters FROM verses GROUP BY book_number")) {
                while (rs.next()) {
                    chapterCounts.put(rs.getInt("book_number"), rs.getInt("chapters"));
                }
            }
            try (ResultSet rs = stmt.executeQuery("SELECT book_number, short_name, long_name FROM books ORDER BY book_number")) {
                while (rs.next()) {
                    int bookNumber = rs.getInt("book_number");
                    int chapters = chapterCounts.getOrDefault(bookNumber, 0);
                    String longName = rs.getString("long_name");
                    if (chapters < 1 || longName == null || longName.isBlank()) continue;
                    result.add(new BookRecord(bookNumber, longName.trim(), rs.getString("short_name"), chapters));
                }
            }
        }
        return result;
    }
}
