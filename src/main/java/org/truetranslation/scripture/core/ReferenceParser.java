package org.truetranslation.scripture.core;

import org.truetranslation.scripture.core.model.BookMatch;
import org.truetranslation.scripture.core.model.BookRecord;
import org.truetranslation.scripture.core.model.ParsedReference;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns free text such as "jn 3:16-17", "1 John 2" or "Gen" into a
 * {@link ParsedReference}. Book names may be in any script, as module
 * catalogs are often Cyrillic or Greek. Chapter and verse numbers are only
 * checked for shape here; bounds are the validator's job.
 * <p>
 * Problems are reported through {@link ParsedReference#getError()}, never thrown.
 */
public class ReferenceParser {

    /** Book matches scoring at least this much (prefix tier and up) are accepted without asking. */
    public static final double CONFIDENT_SCORE = BookMatcher.PREFIX_MIN;

    private static final String BOOK = "(\\d?\\s*\\p{L}+(?:\\s+\\p{L}+)*)";
    private static final Pattern FULL_REFERENCE = Pattern.compile("^" + BOOK + "\\s+(\\d+):(\\d+)(?:-(\\d+))?$");
    private static final Pattern CHAPTER_REFERENCE = Pattern.compile("^" + BOOK + "\\s+(\\d+)$");
    private static final Pattern BOOK_REFERENCE = Pattern.compile("^" + BOOK + "$");
    private static final List<Pattern> GRAMMAR = List.of(FULL_REFERENCE, CHAPTER_REFERENCE, BOOK_REFERENCE);

    private final BookMatcher matcher;
    private final LocalizationManager loc = LocalizationManager.getInstance();

    public ReferenceParser(BookMatcher matcher) {
        this.matcher = matcher;
    }

    public ParsedReference parse(String raw, List<BookRecord> catalog) {
        String input = raw == null ? "" : raw.trim();
        if (input.isEmpty()) {
            return ParsedReference.empty();
        }

        for (Pattern pattern : GRAMMAR) {
            Matcher m = pattern.matcher(input);
            if (m.matches()) {
                String groupChapter = m.groupCount() >= 2 ? m.group(2) : null;
                String groupVerseStart = m.groupCount() >= 3 ? m.group(3) : null;
                String groupVerseEnd = m.groupCount() >= 4 ? m.group(4) : null;
                return resolve(m.group(1).trim(), groupChapter, groupVerseStart, groupVerseEnd, catalog);
            }
        }

        // Nothing fits the grammar; the input may still be a book name with odd spacing or punctuation.
        Optional<BookMatch> best = matcher.getBestMatch(input, catalog);
        if (best.isEmpty()) {
            return new ParsedReference(input, null, null, null, null, false, loc.getString("parse.error.invalidFormat"));
        }
        return bookOnly(input, best.get());
    }

    private ParsedReference resolve(String bookToken, String chapterText, String verseStartText,
                                    String verseEndText, List<BookRecord> catalog) {
        Optional<BookMatch> best = matcher.getBestMatch(bookToken, catalog);
        if (best.isEmpty()) {
            return new ParsedReference(bookToken, null, null, null, null, false,
                    loc.getString("parse.error.bookNotFound", bookToken));
        }
        BookMatch match = best.get();
        BookRecord book = match.getBook();

        Integer chapter = parsePositive(chapterText);
        Integer verseStart = parsePositive(verseStartText);
        Integer verseEnd = parsePositive(verseEndText);

        if (match.getScore() < CONFIDENT_SCORE) {
            return new ParsedReference(bookToken, book, chapter, verseStart, verseEnd, false,
                    loc.getString("parse.error.didYouMean", book.getName()));
        }
        if (chapterText != null && chapter == null) {
            return new ParsedReference(bookToken, book, null, null, null, false,
                    loc.getString("parse.error.invalidChapter"));
        }
        if ((verseStartText != null && verseStart == null) || (verseEndText != null && verseEnd == null)) {
            return new ParsedReference(bookToken, book, chapter, verseStart, verseEnd, false,
                    loc.getString("parse.error.invalidVerse"));
        }
        if (verseEnd != null && verseEnd < verseStart) {
            return new ParsedReference(bookToken, book, chapter, verseStart, verseEnd, false,
                    loc.getString("parse.error.invalidRange"));
        }
        return new ParsedReference(bookToken, book, chapter, verseStart, verseEnd, true, null);
    }

    private ParsedReference bookOnly(String bookToken, BookMatch match) {
        if (match.getScore() < CONFIDENT_SCORE) {
            return new ParsedReference(bookToken, match.getBook(), null, null, null, false,
                    loc.getString("parse.error.didYouMean", match.getBook().getName()));
        }
        return new ParsedReference(bookToken, match.getBook(), null, null, null, true, null);
    }

    // Null for absent, zero, negative or out-of-range numbers.
    private static Integer parsePositive(String text) {
        if (text == null) return null;
        try {
            int value = Integer.parseInt(text, 10);
            return value > 0 ? value : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
