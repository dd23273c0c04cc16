package org.truetranslation.scripture.core;

import org.truetranslation.scripture.core.model.BookMatch;
import org.truetranslation.scripture.core.model.BookRecord;
import org.truetranslation.scripture.core.model.ChapterVerseInfo;
import org.truetranslation.scripture.core.model.ParsedReference;
import org.truetranslation.scripture.core.model.Suggestion;
import org.truetranslation.scripture.core.model.ValidationResult;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Entry point for hosts: parse, match, suggest and validate against one catalog
 * snapshot and one current Bible version.
 * <p>
 * The catalog is copied when the engine is built and again on
 * {@link #reloadCatalog()} or {@link #switchVersion(String, BookCatalog)}; it is
 * never modified in place.
 */
public class ScriptureReferenceEngine {

    private final AbbreviationTable abbreviations;
    private final BookMatcher matcher;
    private final ReferenceParser parser;
    private final SuggestionGenerator suggestions;
    private final BoundsCache boundsCache;
    private final ReferenceValidator validator;

    private volatile BookCatalog catalog;
    private volatile List<BookRecord> books;
    private volatile String versionId;

    public ScriptureReferenceEngine(BookCatalog catalog, VerseStore verseStore) {
        this(catalog, verseStore, AbbreviationTable.getDefault(), ConfigManager.DEFAULT_VERSE_COUNT, 1);
    }

    public ScriptureReferenceEngine(BookCatalog catalog, VerseStore verseStore, AbbreviationTable abbreviations,
                                    int defaultVerseCount, int verbosity) {
        this.abbreviations = Objects.requireNonNull(abbreviations, "abbreviations");
        this.matcher = new BookMatcher(abbreviations);
        this.parser = new ReferenceParser(matcher);
        this.suggestions = new SuggestionGenerator(matcher);
        this.boundsCache = new BoundsCache(verseStore, defaultVerseCount, verbosity);
        this.validator = new ReferenceValidator(boundsCache, verbosity);
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.books = List.copyOf(catalog.listBooks());
    }

    public ParsedReference parseReference(String input) {
        return parser.parse(input, books);
    }

    /** Validates against the current version. */
    public CompletableFuture<ValidationResult> validateReference(ParsedReference reference) {
        return validator.validate(reference, versionId);
    }

    public CompletableFuture<ValidationResult> validateReference(ParsedReference reference, String versionId) {
        return validator.validate(reference, versionId);
    }

    public List<BookMatch> findBookMatches(String input, int limit) {
        return matcher.findMatches(input, books, limit);
    }

    public Optional<BookMatch> getBestMatch(String input) {
        return matcher.getBestMatch(input, books);
    }

    public List<Suggestion> generateSuggestions(String input, int limit) {
        return suggestions.generateSuggestions(input, books, limit);
    }

    public List<Suggestion> completionSuggestions(BookRecord book, String typed) {
        return suggestions.completionSuggestions(book, typed);
    }

    public CompletableFuture<ChapterVerseInfo> getBounds(int bookId, String versionId) {
        Optional<BookRecord> book = findBook(bookId);
        if (book.isEmpty()) {
            return CompletableFuture.failedFuture(new IllegalArgumentException(
                    LocalizationManager.getInstance().getString("error.catalog.unknownBook", bookId)));
        }
        return boundsCache.getBounds(book.get(), versionId);
    }

    public Optional<BookRecord> findBook(int bookId) {
        return books.stream().filter(book -> book.getId() == bookId).findFirst();
    }

    /**
     * Makes {@code versionId} current. Bounds cached for another version are
     * dropped and the catalog is read again.
     */
    public void switchVersion(String versionId) {
        switchVersion(versionId, catalog);
    }

    public synchronized void switchVersion(String versionId, BookCatalog newCatalog) {
        this.catalog = Objects.requireNonNull(newCatalog, "catalog");
        this.versionId = versionId;
        if (versionId != null) {
            boundsCache.switchVersion(versionId);
        } else {
            boundsCache.clear();
        }
        reloadCatalog();
    }

    public synchronized void reloadCatalog() {
        this.books = List.copyOf(catalog.listBooks());
    }

    public List<BookRecord> getBooks() {
        return books;
    }

    public String getVersionId() {
        return versionId;
    }

    public AbbreviationTable getAbbreviations() {
        return abbreviations;
    }

    public BoundsCache getBoundsCache() {
        return boundsCache;
    }
}
