package org.truetranslation.scripture.core.model;

import java.util.Objects;

/**
 * Result of parsing one piece of user input. Instances are immutable; the
 * {@code with...} methods return modified copies.
 * <p>
 * {@code complete} is derived: a reference is complete when it is valid and
 * names a book, a chapter and a starting verse.
 */
public class ParsedReference {
    private final String bookToken;
    private final BookRecord book;
    private final Integer chapter;
    private final Integer verseStart;
    private final Integer verseEnd;
    private final boolean valid;
    private final boolean complete;
    private final String error;

    public ParsedReference(String bookToken, BookRecord book, Integer chapter, Integer verseStart,
                           Integer verseEnd, boolean valid, String error) {
        this.bookToken = bookToken == null ? "" : bookToken;
        this.book = book;
        this.chapter = chapter;
        this.verseStart = verseStart;
        this.verseEnd = verseEnd;
        this.valid = valid;
        this.complete = valid && book != null && chapter != null && verseStart != null;
        this.error = error;
    }

    /** The state for blank input: invalid, but with nothing to complain about. */
    public static ParsedReference empty() {
        return new ParsedReference("", null, null, null, null, false, null);
    }

    public static ParsedReference of(BookRecord book, Integer chapter, Integer verseStart, Integer verseEnd) {
        return new ParsedReference(book.getName(), book, chapter, verseStart, verseEnd, true, null);
    }

    public String getBookToken() { return bookToken; }
    public BookRecord getBook() { return book; }
    public Integer getChapter() { return chapter; }
    public Integer getVerseStart() { return verseStart; }
    public Integer getVerseEnd() { return verseEnd; }
    public boolean isValid() { return valid; }
    public boolean isComplete() { return complete; }
    public String getError() { return error; }

    public boolean hasBook() { return book != null; }

    /**
     * Copy with new numeric fields, marked valid and without an error.
     */
    public ParsedReference withLocation(Integer chapter, Integer verseStart, Integer verseEnd) {
        return new ParsedReference(bookToken, book, chapter, verseStart, verseEnd, true, null);
    }

    public ParsedReference withError(String error) {
        return new ParsedReference(bookToken, book, chapter, verseStart, verseEnd, false, error);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ParsedReference)) return false;
        ParsedReference that = (ParsedReference) o;
        return valid == that.valid
                && bookToken.equals(that.bookToken)
                && Objects.equals(book, that.book)
                && Objects.equals(chapter, that.chapter)
                && Objects.equals(verseStart, that.verseStart)
                && Objects.equals(verseEnd, that.verseEnd)
                && Objects.equals(error, that.error);
    }

    @Override
    public int hashCode() {
        return Objects.hash(bookToken, book, chapter, verseStart, verseEnd, valid, error);
    }

    @Override
    public String toString() {
        return "ParsedReference{" +
                "book=" + (book != null ? book.getName() : "null") +
                ", token='" + bookToken + '\'' +
                ", chapter=" + chapter +
                ", verseStart=" + verseStart +
                ", verseEnd=" + verseEnd +
                ", valid=" + valid +
                ", complete=" + complete +
                (error != null ? ", error='" + error + '\'' : "") +
                '}';
    }
}
