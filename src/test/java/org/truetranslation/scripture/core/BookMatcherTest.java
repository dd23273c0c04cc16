package org.truetranslation.scripture.core;

import org.junit.jupiter.api.Test;
import org.truetranslation.scripture.core.model.BookMatch;
import org.truetranslation.scripture.core.model.BookRecord;
import org.truetranslation.scripture.core.model.MatchType;

import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.*;

class BookMatcherTest {

    private final BookMatcher matcher = new BookMatcher();
    private final List<BookRecord> books = TestCatalogs.defaultBooks();

    @Test
    void testExactMatchOnNameOrShortName() {
        BookMatch byName = matcher.getBestMatch("genesis", books).orElseThrow();
        BookMatch byShortName = matcher.getBestMatch("Gen", books).orElseThrow();

        assertThat(byName.getBook().getName()).isEqualTo("Genesis");
        assertThat(byName.getMatchType()).isEqualTo(MatchType.EXACT);
        assertThat(byName.getScore()).isEqualTo(BookMatcher.EXACT_SCORE);
        assertThat(byShortName.getMatchType()).isEqualTo(MatchType.EXACT);
    }

    @Test
    void testAbbreviationMatch() {
        BookMatch match = matcher.getBestMatch("ex", books).orElseThrow();

        assertThat(match.getBook().getName()).isEqualTo("Exodus");
        assertThat(match.getMatchType()).isEqualTo(MatchType.ABBREVIATION);
        assertThat(match.getScore()).isEqualTo(BookMatcher.ABBREVIATION_SCORE);
    }

    @Test
    void testAbbreviationBeatsPrefix() {
        List<BookMatch> matches = matcher.findMatches("jud", books, 5);

        assertThat(matches.get(0).getBook().getName()).isEqualTo("Jude");
        assertThat(matches.get(1).getBook().getName()).isEqualTo("Judges");
        assertThat(matches.get(1).getMatchType()).isEqualTo(MatchType.PREFIX);
    }

    @Test
    void testPrefixScoreStaysInBand() {
        BookMatch match = matcher.getBestMatch("Gene", books).orElseThrow();

        assertThat(match.getMatchType()).isEqualTo(MatchType.PREFIX);
        assertThat(match.getScore()).isBetween(BookMatcher.PREFIX_MIN, BookMatcher.PREFIX_MAX);
    }

    @Test
    void testSubstringMatch() {
        BookMatch match = matcher.getBestMatch("esis", books).orElseThrow();

        assertThat(match.getBook().getName()).isEqualTo("Genesis");
        assertThat(match.getMatchType()).isEqualTo(MatchType.SUBSTRING);
        assertThat(match.getScore()).isBetween(BookMatcher.SUBSTRING_MIN, BookMatcher.SUBSTRING_MAX);
    }

    @Test
    void testFuzzyMatchForMisspelling() {
        BookMatch match = matcher.getBestMatch("Pslam", books).orElseThrow();

        assertThat(match.getBook().getName()).isEqualTo("Psalms");
        assertThat(match.getMatchType()).isEqualTo(MatchType.FUZZY);
        assertThat(match.getScore()).isEqualTo(200.0);
    }

    @Test
    void testNoMatchForGibberish() {
        assertThat(matcher.findMatches("Xyzzy", books, 5)).isEmpty();
        assertThat(matcher.getBestMatch("Xyzzy", books)).isEmpty();
    }

    @Test
    void testBlankInputAndZeroLimit() {
        assertThat(matcher.findMatches("", books, 5)).isEmpty();
        assertThat(matcher.findMatches("   ", books, 5)).isEmpty();
        assertThat(matcher.findMatches(null, books, 5)).isEmpty();
        assertThat(matcher.findMatches("gen", books, 0)).isEmpty();
    }

    @Test
    void testTiesFollowCanonicalOrder() {
        List<String> names = matcher.findMatches("Jo", books, 5).stream()
                .map(match -> match.getBook().getName())
                .collect(Collectors.toList());

        assertThat(names).containsExactly("Job", "Joshua", "Joel", "John", "Jonah");
    }

    @Test
    void testResultsAreSortedAndLimited() {
        List<BookMatch> matches = matcher.findMatches("j", books, 4);

        assertThat(matches).hasSize(4);
        assertThat(matches).extracting(BookMatch::getScore).isSortedAccordingTo((a, b) -> Double.compare(b, a));
    }

    @Test
    void testAlternateCatalogSpellingStillMatchesAbbreviation() {
        List<BookRecord> catalog = List.of(new BookRecord(22, "Song of Songs", "Sng", 8));

        BookMatch match = matcher.getBestMatch("song of solomon", catalog).orElseThrow();

        assertThat(match.getMatchType()).isEqualTo(MatchType.ABBREVIATION);
    }

    @Test
    void testLevenshteinDistance() {
        assertThat(BookMatcher.levenshteinDistance("kitten", "sitting")).isEqualTo(3);
        assertThat(BookMatcher.levenshteinDistance("sitting", "kitten")).isEqualTo(3);
        assertThat(BookMatcher.levenshteinDistance("John", "JOHN")).isZero();
        assertThat(BookMatcher.levenshteinDistance("", "abc")).isEqualTo(3);
        assertThat(BookMatcher.levenshteinDistance("abc", "")).isEqualTo(3);
    }

    @Test
    void testSimilarity() {
        assertThat(BookMatcher.similarity("", "")).isEqualTo(1.0);
        assertThat(BookMatcher.similarity("Psalms", "pslam")).isEqualTo(0.5);
        assertThat(BookMatcher.similarity("abc", "xyz")).isZero();
        assertThat(BookMatcher.similarity("John", "john")).isEqualTo(1.0);
    }
}
