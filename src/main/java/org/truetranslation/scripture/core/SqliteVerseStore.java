package org.truetranslation.scripture.core;

import org.truetranslation.scripture.core.model.Verse;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Verse store over a directory of MyBible modules. The version id is the module
 * name, resolved to {@code <modulesDir>/<versionId>.sqlite3}. Queries run on a
 * single background thread, one chapter per call.
 */
public class SqliteVerseStore implements VerseStore, AutoCloseable {

    private static final String CHAPTER_QUERY =
            "SELECT verse, text FROM verses WHERE book_number = ? AND chapter = ? ORDER BY verse";

    private final Path modulesDir;
    private final ExecutorService executor;
    private final LocalizationManager loc = LocalizationManager.getInstance();

    public SqliteVerseStore(Path modulesDir) {
        this.modulesDir = modulesDir;
        this.executor = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "verse-store");
            thread.setDaemon(true);
            return thread;
        });
    }

    public Path modulePath(String versionId) {
        return modulesDir.resolve(versionId + ".sqlite3");
    }

    @Override
    public CompletableFuture<List<Verse>> getVerses(String versionId, int bookId, int chapter) {
        return CompletableFuture.supplyAsync(() -> {
            Path modulePath = modulePath(versionId);
            if (!Files.exists(modulePath)) {
                throw new VerseStoreException(loc.getString("error.module.notFound", modulePath));
            }
            try {
                return queryChapter(modulePath, bookId, chapter);
            } catch (SQLException e) {
                throw new VerseStoreException(loc.getString("error.store.queryFailed", versionId, bookId, chapter, e.getMessage()), e);
            }
        }, executor);
    }

    private List<Verse> queryChapter(Path modulePath, int bookId, int chapter) throws SQLException {
        List<Verse> verses = new ArrayList<>();
        String url = "jdbc:sqlite:" + modulePath.toAbsolutePath();
        try (Connection conn = DriverManager.getConnection(url);
             PreparedStatement pstmt = conn.prepareStatement(CHAPTER_QUERY)) {
            pstmt.setInt(1, bookId);
            pstmt.setInt(2, chapter);
            try (ResultSet rs = pstmt.executeQuery()) {
                while (rs.next()) {
                    verses.add(new Verse(rs.getInt("verse"), rs.getString("text")));
                }
            }
        }
        return verses;
    }

    @Override
    public void close() {
        executor.shutdown();
    }
}
