package org.truetranslation.scripture.core.model;

import java.util.Objects;

/**
 * A book as the catalog knows it. The id is whatever the catalog uses as its key
 * (MyBible modules number books 10, 20, 30 ...).
 */
public class BookRecord {
    private final int id;
    private final String name;
    private final String shortName;
    private final int chapterCount;

    public BookRecord(int id, String name, String shortName, int chapterCount) {
        if (chapterCount < 1) {
            throw new IllegalArgumentException("chapterCount must be at least 1 for " + name);
        }
        this.id = id;
        this.name = Objects.requireNonNull(name, "name");
        this.shortName = shortName != null && !shortName.isBlank() ? shortName : name;
        this.chapterCount = chapterCount;
    }

    public int getId() { return id; }
    public String getName() { return name; }
    public String getShortName() { return shortName; }
    public int getChapterCount() { return chapterCount; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BookRecord)) return false;
        BookRecord that = (BookRecord) o;
        return id == that.id && chapterCount == that.chapterCount
                && name.equals(that.name) && shortName.equals(that.shortName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, shortName, chapterCount);
    }

    @Override
    public String toString() {
        return "BookRecord{" + id + ", " + name + " (" + shortName + "), chapters=" + chapterCount + '}';
    }
}
