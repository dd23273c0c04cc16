package org.truetranslation.scripture.core;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Lists the Bible versions available in a modules directory. Each MyBible
 * {@code .sqlite3} file is one version; its id is the file name without the
 * extension, which is what {@link SqliteVerseStore} expects.
 */
public class VersionScanner {

    private static final Pattern NON_BIBLE_MODULE = Pattern.compile(
            ".*(commentaries|cross-?references|devotions|dictionar|plan|referencedata|subheadings).*");
    private static final Pattern EXTENSION = Pattern.compile("(?i)\\.sqlite3$");

    public static class Version {
        private final String id;
        private final String language;
        private final String description;
        private final Path path;

        public Version(String id, String language, String description, Path path) {
            this.id = id;
            this.language = language;
            this.description = description;
            this.path = path;
        }

        public String getId() { return id; }
        public String getLanguage() { return language; }
        public String getDescription() { return description; }
        public Path getPath() { return path; }
    }

    public List<Version> findVersions(Path modulesDir) throws IOException {
        List<Version> versions = new ArrayList<>();
        if (modulesDir == null || !Files.isDirectory(modulesDir)) {
            return versions;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(modulesDir, "*.{sqlite3,SQLITE3}")) {
            for (Path entry : stream) {
                String fileName = entry.getFileName().toString();
                if (Files.isRegularFile(entry) && !NON_BIBLE_MODULE.matcher(fileName.toLowerCase()).matches()) {
                    versions.add(describe(entry, EXTENSION.matcher(fileName).replaceAll("")));
                }
            }
        }
        versions.sort(Comparator.comparing(Version::getLanguage, String.CASE_INSENSITIVE_ORDER)
                .thenComparing(Version::getId, String.CASE_INSENSITIVE_ORDER));
        return versions;
    }

    private Version describe(Path modulePath, String id) {
        String url = "jdbc:sqlite:" + modulePath.toAbsolutePath();
        String language = "NA";
        String description = "NA";
        try (Connection conn = DriverManager.getConnection(url)) {
            language = infoField(conn, "language").orElse(language);
            description = infoField(conn, "description").orElse(description).replace("\r", "").replace("\n", " | ");
        } catch (SQLException e) {
            // Not a readable module; list it with placeholders so the user can see it.
        }
        return new Version(id, language, description, modulePath);
    }

    // Modules disagree on whether the info key column is "key" or "name".
    private Optional<String> infoField(Connection conn, String field) {
        for (String keyColumn : new String[] {"key", "name"}) {
            try (PreparedStatement pstmt = conn.prepareStatement("SELECT value FROM info WHERE " + keyColumn + " = ?")) {
                pstmt.setString(1, field);
                try (ResultSet rs = pstmt.executeQuery()) {
                    if (rs.next()) {
                        return Optional.ofNullable(rs.getString("value"));
                    }
                }
            } catch (SQLException e) {
                // Column does not exist in this module; try the other one.
            }
        }
        return Optional.empty();
    }
}
