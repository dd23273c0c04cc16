package org.truetranslation.scripture.core.model;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Bounds of one book in one version: how many chapters it has and how many
 * verses each loaded chapter has. Instances are immutable; the bounds cache
 * fills a {@link Builder} chapter by chapter and publishes the built snapshot.
 * A recorded chapter count is authoritative for its version.
 */
public class ChapterVerseInfo {
    private final int bookId;
    private final String versionId;
    private final int chapterCount;
    private final Map<Integer, Integer> perChapterVerseCount;
    private final int maxVerseSeen;

    private ChapterVerseInfo(Builder builder) {
        this.bookId = builder.bookId;
        this.versionId = builder.versionId;
        this.chapterCount = builder.chapterCount;
        this.perChapterVerseCount = Collections.unmodifiableMap(new TreeMap<>(builder.perChapterVerseCount));
        this.maxVerseSeen = builder.maxVerseSeen;
    }

    public static Builder builder(int bookId, String versionId, int chapterCount) {
        return new Builder(bookId, versionId, chapterCount);
    }

    public int getBookId() { return bookId; }
    public String getVersionId() { return versionId; }
    public int getChapterCount() { return chapterCount; }
    public int getMaxVerseSeen() { return maxVerseSeen; }

    public Map<Integer, Integer> getPerChapterVerseCount() {
        return perChapterVerseCount;
    }

    /**
     * Verse count of the chapter, or the largest count seen in the book when the
     * chapter is unknown or empty, or {@code fallback} when nothing was seen at all.
     */
    public int getMaxVerse(int chapter, int fallback) {
        Integer count = perChapterVerseCount.get(chapter);
        if (count != null && count > 0) {
            return count;
        }
        return maxVerseSeen > 0 ? maxVerseSeen : fallback;
    }

    @Override
    public String toString() {
        return "ChapterVerseInfo{book=" + bookId + ", version=" + versionId + ", chapters=" + chapterCount
                + ", loaded=" + perChapterVerseCount.size() + ", maxVerse=" + maxVerseSeen + '}';
    }

    public static class Builder {
        private final int bookId;
        private final String versionId;
        private final int chapterCount;
        private final Map<Integer, Integer> perChapterVerseCount = new TreeMap<>();
        private int maxVerseSeen;

        private Builder(int bookId, String versionId, int chapterCount) {
            this.bookId = bookId;
            this.versionId = versionId;
            this.chapterCount = chapterCount;
        }

        public Builder recordChapter(int chapter, int verseCount) {
            perChapterVerseCount.put(chapter, verseCount);
            maxVerseSeen = Math.max(maxVerseSeen, verseCount);
            return this;
        }

        // Assumed counts for chapters that could not be loaded do not raise maxVerseSeen.
        public Builder recordAssumedChapter(int chapter, int verseCount) {
            perChapterVerseCount.put(chapter, verseCount);
            return this;
        }

        public ChapterVerseInfo build() {
            return new ChapterVerseInfo(this);
        }
    }
}
