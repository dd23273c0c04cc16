package org.truetranslation.scripture.core.model;

public class BookMatch {
    private final BookRecord book;
    private final double score;
    private final MatchType matchType;
    private final String matchedText;

    public BookMatch(BookRecord book, double score, MatchType matchType, String matchedText) {
        this.book = book;
        this.score = score;
        this.matchType = matchType;
        this.matchedText = matchedText;
    }

    public BookRecord getBook() { return book; }
    public double getScore() { return score; }
    public MatchType getMatchType() { return matchType; }
    public String getMatchedText() { return matchedText; }

    @Override
    public String toString() {
        return String.format("BookMatch{%s, %s, score=%.1f}", book.getName(), matchType, score);
    }
}
