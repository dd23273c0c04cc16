package org.truetranslation.scripture.core.model;

public enum SuggestionType {
    BOOK,
    CHAPTER,
    VERSE,
    COMPLETE
}
