package org.truetranslation.scripture.core.model;

/**
 * Tier a book match was found in, strongest first.
 */
public enum MatchType {
    EXACT,
    ABBREVIATION,
    PREFIX,
    SUBSTRING,
    FUZZY
}
