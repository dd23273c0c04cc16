package org.truetranslation.scripture.core.model;

/**
 * One row of a chapter listing. Only the verse number feeds the bounds cache;
 * the text is carried for stores that have it.
 */
public class Verse {
    private final int number;
    private final String text;

    public Verse(int number, String text) {
        this.number = number;
        this.text = text;
    }

    public int getNumber() { return number; }
    public String getText() { return text; }

    @Override
    public String toString() {
        return number + " " + text;
    }
}
