package org.truetranslation.scripture.core;

import org.truetranslation.scripture.core.model.BookMatch;
import org.truetranslation.scripture.core.model.BookRecord;
import org.truetranslation.scripture.core.model.ParsedReference;
import org.truetranslation.scripture.core.model.Suggestion;
import org.truetranslation.scripture.core.model.SuggestionType;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Autocomplete entries for partial input. Works on the catalog alone and never
 * checks bounds, so every call is synchronous and cheap.
 */
public class SuggestionGenerator {

    public static final int BOOK_CANDIDATES = 3;
    public static final double HIGH_CONFIDENCE = 800;
    public static final double CHAPTER_PENALTY = 100;
    public static final double COMPLETE_PENALTY = 200;

    private static final Pattern TRAILING_VERSE = Pattern.compile("(\\d+):(\\d+)$");
    private static final Pattern TRAILING_CHAPTER = Pattern.compile("(\\d+)$");

    private final BookMatcher matcher;

    public SuggestionGenerator(BookMatcher matcher) {
        this.matcher = matcher;
    }

    /**
     * Book suggestions for the best few matches, plus "Book 1" and "Book 1:1"
     * for confident ones, ordered by score. Ties keep insertion order.
     */
    public List<Suggestion> generateSuggestions(String input, List<BookRecord> catalog, int limit) {
        List<Suggestion> suggestions = new ArrayList<>();
        if (input == null || input.trim().isEmpty() || limit <= 0) {
            return suggestions;
        }

        for (BookMatch match : matcher.findMatches(input.trim(), catalog, BOOK_CANDIDATES)) {
            BookRecord book = match.getBook();
            double score = match.getScore();
            suggestions.add(suggestion(book, null, null, score, SuggestionType.BOOK));

            if (score > HIGH_CONFIDENCE) {
                suggestions.add(suggestion(book, 1, null, score - CHAPTER_PENALTY, SuggestionType.CHAPTER));
                suggestions.add(suggestion(book, 1, 1, score - COMPLETE_PENALTY, SuggestionType.COMPLETE));
            }
        }

        // List.sort is stable, which keeps insertion order for equal scores.
        suggestions.sort(Comparator.comparingDouble(Suggestion::getScore).reversed());
        return suggestions.size() > limit ? new ArrayList<>(suggestions.subList(0, limit)) : suggestions;
    }

    /**
     * Suggestions once the book is known and the user keeps typing numbers.
     * {@code typed} is the text typed so far; only its trailing numbers matter.
     */
    public List<Suggestion> completionSuggestions(BookRecord book, String typed) {
        List<Suggestion> suggestions = new ArrayList<>();
        String tail = typed == null ? "" : typed.trim();

        Matcher verseMatch = TRAILING_VERSE.matcher(tail);
        Matcher chapterMatch = TRAILING_CHAPTER.matcher(tail);
        if (verseMatch.find()) {
            Integer chapter = parse(verseMatch.group(1));
            Integer verse = parse(verseMatch.group(2));
            if (chapter != null && verse != null && verse < Integer.MAX_VALUE) {
                ParsedReference reference = ParsedReference.of(book, chapter, verse, verse + 1);
                suggestions.add(new Suggestion(ReferenceFormatter.format(reference), reference, 800, SuggestionType.COMPLETE));
            }
        } else if (chapterMatch.find()) {
            Integer chapter = parse(chapterMatch.group(1));
            if (chapter != null) {
                suggestions.add(suggestion(book, chapter, 1, 900, SuggestionType.COMPLETE));
            }
        } else {
            suggestions.add(suggestion(book, 1, null, 900, SuggestionType.CHAPTER));
            suggestions.add(suggestion(book, 1, 1, 850, SuggestionType.COMPLETE));
        }
        return suggestions;
    }

    private static Suggestion suggestion(BookRecord book, Integer chapter, Integer verse, double score, SuggestionType type) {
        ParsedReference reference = ParsedReference.of(book, chapter, verse, null);
        return new Suggestion(ReferenceFormatter.format(book, chapter, verse), reference, score, type);
    }

    private static Integer parse(String digits) {
        try {
            int value = Integer.parseInt(digits);
            return value > 0 ? value : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
