package org.truetranslation.scripture.core;

import org.truetranslation.scripture.core.model.BookRecord;
import org.truetranslation.scripture.core.model.ParsedReference;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders references back to text. The output of {@link #format} parses back to
 * the same book, chapter and verses.
 */
public final class ReferenceFormatter {

    private ReferenceFormatter() {
    }

    public static String format(ParsedReference reference) {
        if (!reference.hasBook()) {
            return reference.getBookToken();
        }
        return appendLocation(reference.getBook().getName(), reference);
    }

    /** Same as {@link #format} but with the book's short name. */
    public static String formatShort(ParsedReference reference) {
        if (!reference.hasBook()) {
            return reference.getBookToken();
        }
        return appendLocation(reference.getBook().getShortName(), reference);
    }

    public static String format(BookRecord book, Integer chapter, Integer verse) {
        StringBuilder text = new StringBuilder(book.getName());
        if (chapter != null) {
            text.append(' ').append(chapter);
            if (verse != null) {
                text.append(':').append(verse);
            }
        }
        return text.toString();
    }

    private static String appendLocation(String bookName, ParsedReference reference) {
        StringBuilder text = new StringBuilder(bookName);
        if (reference.getChapter() != null) {
            text.append(' ').append(reference.getChapter());
            if (reference.getVerseStart() != null) {
                text.append(':').append(reference.getVerseStart());
                if (reference.getVerseEnd() != null && !reference.getVerseEnd().equals(reference.getVerseStart())) {
                    text.append('-').append(reference.getVerseEnd());
                }
            }
        }
        return text.toString();
    }

    /**
     * Stable key of the form {@code bookId:chapter:verse[:end]} for comparing
     * references; empty when no book is known.
     */
    public static String referenceKey(ParsedReference reference) {
        if (!reference.hasBook()) return "";
        StringBuilder key = new StringBuilder(String.valueOf(reference.getBook().getId()));
        if (reference.getChapter() != null) {
            key.append(':').append(reference.getChapter());
            if (reference.getVerseStart() != null) {
                key.append(':').append(reference.getVerseStart());
                if (reference.getVerseEnd() != null && !reference.getVerseEnd().equals(reference.getVerseStart())) {
                    key.append(':').append(reference.getVerseEnd());
                }
            }
        }
        return key.toString();
    }

    public static boolean areEqual(ParsedReference a, ParsedReference b) {
        return referenceKey(a).equals(referenceKey(b));
    }

    /**
     * Texts the user is likely to want next: chapter 1 after a bare book, verse 1
     * after a chapter, and the next verse, a two-verse range and the next chapter
     * after a verse.
     */
    public static List<String> followOnSuggestions(ParsedReference reference, int max) {
        List<String> suggestions = new ArrayList<>();
        if (!reference.hasBook() || max <= 0) {
            return suggestions;
        }
        BookRecord book = reference.getBook();
        Integer chapter = reference.getChapter();
        Integer verse = reference.getVerseStart();

        if (chapter == null) {
            suggestions.add(format(book, 1, null));
            suggestions.add(format(book, 1, 1));
        } else if (verse == null) {
            suggestions.add(format(book, chapter, 1));
        } else {
            suggestions.add(format(book, chapter, verse + 1));
            if (reference.getVerseEnd() == null) {
                suggestions.add(format(book, chapter, verse) + "-" + (verse + 1));
            }
            suggestions.add(format(book, chapter + 1, 1));
        }
        return suggestions.size() > max ? new ArrayList<>(suggestions.subList(0, max)) : suggestions;
    }
}
