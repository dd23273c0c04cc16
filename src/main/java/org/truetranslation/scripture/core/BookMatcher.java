package org.truetranslation.scripture.core;

import org.truetranslation.scripture.core.model.BookAbbreviationEntry;
import org.truetranslation.scripture.core.model.BookMatch;
import org.truetranslation.scripture.core.model.BookRecord;
import org.truetranslation.scripture.core.model.MatchType;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Scores catalog books against a typed book name.
 * <p>
 * Scores fall into fixed bands, one per {@link MatchType}, and every score is
 * clamped into its band so a weaker tier can never overtake a stronger one:
 * exact 1000, abbreviation 900, prefix 800-899, substring 600-650, fuzzy 0-400.
 * Nothing is cached; the matcher is cheap enough to run on every keystroke.
 */
public class BookMatcher {

    public static final double EXACT_SCORE = 1000;
    public static final double ABBREVIATION_SCORE = 900;
    public static final double PREFIX_MIN = 800;
    public static final double PREFIX_MAX = 899;
    public static final double SUBSTRING_MIN = 600;
    public static final double SUBSTRING_MAX = 650;
    public static final double FUZZY_MAX = 400;
    public static final double FUZZY_THRESHOLD = 0.3;

    private final AbbreviationTable abbreviations;

    public BookMatcher() {
        this(AbbreviationTable.getDefault());
    }

    public BookMatcher(AbbreviationTable abbreviations) {
        this.abbreviations = abbreviations;
    }

    public AbbreviationTable getAbbreviations() {
        return abbreviations;
    }

    /**
     * Ranked matches for {@code input}, best first. Equal scores are ordered by
     * canonical book order.
     */
    public List<BookMatch> findMatches(String input, List<BookRecord> catalog, int limit) {
        List<BookMatch> matches = new ArrayList<>();
        if (input == null || input.trim().isEmpty() || limit <= 0 || catalog == null) {
            return matches;
        }
        String normalizedInput = normalize(input);
        Optional<BookAbbreviationEntry> abbreviation = abbreviations.resolve(normalizedInput);

        for (BookRecord book : catalog) {
            BookMatch match = score(book, normalizedInput, abbreviation);
            if (match != null) {
                matches.add(match);
            }
        }

        matches.sort(Comparator.comparingDouble(BookMatch::getScore).reversed()
                .thenComparingInt(m -> abbreviations.getBookOrder(m.getBook().getName()))
                .thenComparingInt(m -> m.getBook().getId()));
        return matches.size() > limit ? new ArrayList<>(matches.subList(0, limit)) : matches;
    }

    public Optional<BookMatch> getBestMatch(String input, List<BookRecord> catalog) {
        List<BookMatch> matches = findMatches(input, catalog, 1);
        return matches.isEmpty() ? Optional.empty() : Optional.of(matches.get(0));
    }

    private BookMatch score(BookRecord book, String input, Optional<BookAbbreviationEntry> abbreviation) {
        String bookName = normalize(book.getName());
        String shortName = normalize(book.getShortName());

        if (bookName.equals(input) || shortName.equals(input)) {
            return new BookMatch(book, EXACT_SCORE, MatchType.EXACT, book.getName());
        }

        if (abbreviation.isPresent() && refersTo(abbreviation.get(), book)) {
            return new BookMatch(book, ABBREVIATION_SCORE, MatchType.ABBREVIATION, book.getName());
        }

        if (bookName.startsWith(input) || shortName.startsWith(input)) {
            double ratio = (double) input.length() / Math.min(bookName.length(), shortName.length());
            double score = clamp(PREFIX_MIN + ratio * 100, PREFIX_MIN, PREFIX_MAX);
            return new BookMatch(book, score, MatchType.PREFIX, book.getName());
        }

        String container = bookName.contains(input) ? bookName : shortName.contains(input) ? shortName : null;
        if (container != null) {
            double score = clamp(SUBSTRING_MIN + containsScore(container, input), SUBSTRING_MIN, SUBSTRING_MAX);
            return new BookMatch(book, score, MatchType.SUBSTRING, book.getName());
        }

        double similarity = similarity(bookName, input);
        if (similarity > FUZZY_THRESHOLD) {
            return new BookMatch(book, clamp(similarity * FUZZY_MAX, 0, FUZZY_MAX), MatchType.FUZZY, book.getName());
        }
        return null;
    }

    // The catalog may spell a book differently from the table ("Song of Songs"), so compare entries, not strings.
    private boolean refersTo(BookAbbreviationEntry entry, BookRecord book) {
        if (normalize(entry.getCanonicalName()).equals(normalize(book.getName()))) {
            return true;
        }
        return abbreviations.resolve(book.getName())
                .map(bookEntry -> bookEntry.getOrder() == entry.getOrder())
                .orElse(false);
    }

    // Earlier and longer matches score higher, up to 50.
    private static double containsScore(String text, String input) {
        int index = text.indexOf(input);
        if (index < 0) return 0;
        double positionScore = (double) (text.length() - index) / text.length();
        double lengthScore = (double) input.length() / text.length();
        return (positionScore + lengthScore) / 2 * 50;
    }

    /**
     * Normalized similarity in [0, 1]: {@code 1 - distance / max(len(a), len(b))}.
     * Two empty strings are identical.
     */
    public static double similarity(String a, String b) {
        String left = normalize(a);
        String right = normalize(b);
        int maxLength = Math.max(left.length(), right.length());
        if (maxLength == 0) return 1;
        return Math.max(0, 1 - (double) levenshteinDistance(left, right) / maxLength);
    }

    /**
     * Case-insensitive edit distance with unit cost insertion, deletion and
     * substitution, computed over the full matrix.
     */
    public static int levenshteinDistance(String a, String b) {
        String s1 = a.toLowerCase(Locale.ROOT);
        String s2 = b.toLowerCase(Locale.ROOT);
        int n = s1.length();
        int m = s2.length();
        int[][] matrix = new int[n + 1][m + 1];

        for (int i = 0; i <= n; i++) {
            matrix[i][0] = i;
        }
        for (int j = 0; j <= m; j++) {
            matrix[0][j] = j;
        }

        for (int i = 1; i <= n; i++) {
            char ca = s1.charAt(i - 1);
            for (int j = 1; j <= m; j++) {
                int cost = ca == s2.charAt(j - 1) ? 0 : 1;
                matrix[i][j] = Math.min(
                        Math.min(matrix[i - 1][j] + 1, matrix[i][j - 1] + 1),
                        matrix[i - 1][j - 1] + cost);
            }
        }
        return matrix[n][m];
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    static String normalize(String text) {
        return text == null ? "" : text.trim().toLowerCase(Locale.ROOT);
    }
}
