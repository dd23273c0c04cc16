package org.truetranslation.scripture.core.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * One row of the abbreviation table: a canonical book name, the short forms it
 * is known by, its canonical position and its testament.
 */
public class BookAbbreviationEntry {
    private final String canonicalName;
    private final Set<String> abbreviations;
    private final int order;
    private final Testament testament;

    public BookAbbreviationEntry(String canonicalName, Set<String> abbreviations, int order, Testament testament) {
        this.canonicalName = canonicalName;
        Set<String> normalized = new LinkedHashSet<>();
        for (String abbreviation : abbreviations) {
            normalized.add(abbreviation.trim().toLowerCase(Locale.ROOT));
        }
        this.abbreviations = Collections.unmodifiableSet(normalized);
        this.order = order;
        this.testament = testament;
    }

    public String getCanonicalName() { return canonicalName; }
    public Set<String> getAbbreviations() { return abbreviations; }
    public int getOrder() { return order; }
    public Testament getTestament() { return testament; }

    @Override
    public String toString() {
        return "BookAbbreviationEntry{" + canonicalName + ", order=" + order + ", " + testament + '}';
    }
}
