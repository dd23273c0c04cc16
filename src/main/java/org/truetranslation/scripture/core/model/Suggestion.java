package org.truetranslation.scripture.core.model;

/**
 * An autocomplete entry: the text to put in the input field and the reference it stands for.
 */
public class Suggestion {
    private final String text;
    private final ParsedReference reference;
    private final double score;
    private final SuggestionType type;

    public Suggestion(String text, ParsedReference reference, double score, SuggestionType type) {
        this.text = text;
        this.reference = reference;
        this.score = score;
        this.type = type;
    }

    public String getText() { return text; }
    public ParsedReference getReference() { return reference; }
    public double getScore() { return score; }
    public SuggestionType getType() { return type; }

    @Override
    public String toString() {
        return String.format("Suggestion{'%s', %s, score=%.1f}", text, type, score);
    }
}
