package org.truetranslation.scripture.core;

import org.truetranslation.scripture.core.model.BookRecord;
import org.truetranslation.scripture.core.model.ChapterVerseInfo;
import org.truetranslation.scripture.core.model.ParsedReference;
import org.truetranslation.scripture.core.model.ValidationResult;

import java.util.concurrent.CompletableFuture;

/**
 * Checks a parsed reference against the chapter and verse bounds of a version.
 * <p>
 * Checks run chapter, first verse, last verse, and stop at the first failure.
 * Out-of-range references come back with an auto-correction that is itself
 * valid: every numeric field is clamped, in that order, against the bounds.
 */
public class ReferenceValidator {

    private final BoundsCache boundsCache;
    private final int verbosity;
    private final LocalizationManager loc = LocalizationManager.getInstance();

    public ReferenceValidator(BoundsCache boundsCache) {
        this(boundsCache, 1);
    }

    public ReferenceValidator(BoundsCache boundsCache, int verbosity) {
        this.boundsCache = boundsCache;
        this.verbosity = verbosity;
    }

    /**
     * Never completes exceptionally; failures to obtain bounds turn into an
     * invalid result.
     */
    public CompletableFuture<ValidationResult> validate(ParsedReference reference, String versionId) {
        if (!reference.isValid() || !reference.hasBook()) {
            String error = reference.getError() != null ? reference.getError() : loc.getString("validate.error.invalid");
            return CompletableFuture.completedFuture(ValidationResult.invalid(error));
        }
        if (versionId == null || versionId.isBlank()) {
            return CompletableFuture.completedFuture(ValidationResult.invalid(loc.getString("validate.error.noVersion")));
        }

        CompletableFuture<ChapterVerseInfo> bounds;
        try {
            bounds = boundsCache.getBounds(reference.getBook(), versionId);
        } catch (RuntimeException e) {
            bounds = CompletableFuture.failedFuture(e);
        }
        return bounds
                .thenApply(info -> check(reference, info))
                .exceptionally(error -> {
                    if (verbosity > 0) {
                        System.err.println(loc.getString("error.validate.unexpected", error.getMessage()));
                    }
                    return ValidationResult.invalid(loc.getString("validate.error.unavailable"));
                });
    }

    ValidationResult check(ParsedReference reference, ChapterVerseInfo info) {
        BookRecord book = reference.getBook();
        Integer chapter = reference.getChapter();
        if (chapter == null) {
            return ValidationResult.valid();
        }

        int chapterCount = info.getChapterCount();
        if (chapter < 1 || chapter > chapterCount) {
            return ValidationResult.invalid(
                    loc.getString("validate.error.chapterRange", book.getName(), chapterCount),
                    correct(reference, info));
        }

        Integer verseStart = reference.getVerseStart();
        if (verseStart == null) {
            return ValidationResult.valid();
        }
        int maxVerse = info.getMaxVerse(chapter, boundsCache.getDefaultVerseCount());
        if (verseStart < 1 || verseStart > maxVerse) {
            return ValidationResult.invalid(
                    loc.getString("validate.error.verseRange", book.getName(), chapter, maxVerse),
                    correct(reference, info));
        }

        Integer verseEnd = reference.getVerseEnd();
        if (verseEnd != null && (verseEnd < verseStart || verseEnd > maxVerse)) {
            return ValidationResult.invalid(
                    loc.getString("validate.error.rangeEnd", book.getName(), chapter, maxVerse),
                    correct(reference, info));
        }
        return ValidationResult.valid();
    }

    /**
     * Clamps chapter, then first verse against the clamped chapter, then last
     * verse into [first verse, chapter size].
     */
    ParsedReference correct(ParsedReference reference, ChapterVerseInfo info) {
        int chapter = clamp(reference.getChapter(), 1, info.getChapterCount());
        Integer verseStart = null;
        Integer verseEnd = null;
        if (reference.getVerseStart() != null) {
            int maxVerse = info.getMaxVerse(chapter, boundsCache.getDefaultVerseCount());
            verseStart = clamp(reference.getVerseStart(), 1, maxVerse);
            if (reference.getVerseEnd() != null) {
                verseEnd = clamp(reference.getVerseEnd(), verseStart, maxVerse);
            }
        }
        return reference.withLocation(chapter, verseStart, verseEnd);
    }

    private static int clamp(int value, int min, int max) {
        return Math.max(min, Math.min(max, value));
    }
}
