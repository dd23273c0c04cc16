package org.truetranslation.scripture.core;

import org.truetranslation.scripture.core.model.BookRecord;
import org.truetranslation.scripture.core.model.ChapterVerseInfo;
import org.truetranslation.scripture.core.model.Verse;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;

/**
 * Per-session cache of chapter and verse bounds, keyed by book and version.
 * <p>
 * A miss loads every chapter of the book from the {@link VerseStore}, one after
 * another. Callers that ask for the same book while it is loading are handed the
 * same pending future, so each key is fetched once. Asking for a different
 * version drops everything cached for the previous one.
 */
public class BoundsCache {

    private final VerseStore verseStore;
    private final int defaultVerseCount;
    private final int verbosity;
    private final Map<String, CompletableFuture<ChapterVerseInfo>> cache = new ConcurrentHashMap<>();
    private final Set<String> loadingKeys = ConcurrentHashMap.newKeySet();
    private final LocalizationManager loc = LocalizationManager.getInstance();
    private String currentVersionId;

    public BoundsCache(VerseStore verseStore) {
        this(verseStore, ConfigManager.DEFAULT_VERSE_COUNT, 1);
    }

    public BoundsCache(VerseStore verseStore, int defaultVerseCount, int verbosity) {
        this.verseStore = Objects.requireNonNull(verseStore, "verseStore");
        this.defaultVerseCount = defaultVerseCount;
        this.verbosity = verbosity;
    }

    public CompletableFuture<ChapterVerseInfo> getBounds(BookRecord book, String versionId) {
        Objects.requireNonNull(book, "book");
        Objects.requireNonNull(versionId, "versionId");
        String key = key(book.getId(), versionId);
        CompletableFuture<ChapterVerseInfo> pending;
        synchronized (this) {
            switchVersion(versionId);
            CompletableFuture<ChapterVerseInfo> existing = cache.get(key);
            if (existing != null) {
                return existing.copy();
            }
            pending = new CompletableFuture<>();
            cache.put(key, pending);
            loadingKeys.add(key);
        }

        populate(book, versionId).whenComplete((info, error) -> {
            loadingKeys.remove(key);
            if (error != null) {
                // Let the next caller retry instead of caching the failure.
                cache.remove(key, pending);
                pending.completeExceptionally(error);
            } else {
                pending.complete(info);
            }
        });
        return pending.copy();
    }

    /**
     * Makes {@code versionId} the current version. Switching to a different
     * version clears every cached and pending entry.
     */
    public synchronized void switchVersion(String versionId) {
        if (!Objects.equals(currentVersionId, versionId)) {
            if (currentVersionId != null && verbosity > 1) {
                System.err.println(loc.getString("msg.bounds.versionSwitch", currentVersionId, versionId));
            }
            cache.clear();
            loadingKeys.clear();
            currentVersionId = versionId;
        }
    }

    public synchronized void clear() {
        cache.clear();
        loadingKeys.clear();
    }

    public synchronized String getCurrentVersionId() {
        return currentVersionId;
    }

    public synchronized boolean isLoading(int bookId) {
        return currentVersionId != null && loadingKeys.contains(key(bookId, currentVersionId));
    }

    /** Bounds that have finished loading, without triggering a load. */
    public Optional<ChapterVerseInfo> getCached(int bookId, String versionId) {
        CompletableFuture<ChapterVerseInfo> future = cache.get(key(bookId, versionId));
        if (future == null || !future.isDone() || future.isCompletedExceptionally()) {
            return Optional.empty();
        }
        try {
            return Optional.of(future.get());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        } catch (ExecutionException e) {
            return Optional.empty();
        }
    }

    public int size() {
        return cache.size();
    }

    public int getDefaultVerseCount() {
        return defaultVerseCount;
    }

    public int getMaxChapter(BookRecord book, String versionId) {
        return getCached(book.getId(), versionId).map(ChapterVerseInfo::getChapterCount).orElse(book.getChapterCount());
    }

    public CompletableFuture<Integer> getMaxVerse(BookRecord book, int chapter, String versionId) {
        return getBounds(book, versionId).thenApply(info -> info.getMaxVerse(chapter, defaultVerseCount));
    }

    private CompletableFuture<ChapterVerseInfo> populate(BookRecord book, String versionId) {
        if (verbosity > 1) {
            System.err.println(loc.getString("msg.bounds.loading", book.getName(), versionId, book.getChapterCount()));
        }
        ChapterVerseInfo.Builder builder = ChapterVerseInfo.builder(book.getId(), versionId, book.getChapterCount());
        CompletableFuture<ChapterVerseInfo.Builder> chain = CompletableFuture.completedFuture(builder);
        for (int chapter = 1; chapter <= book.getChapterCount(); chapter++) {
            final int current = chapter;
            chain = chain.thenCompose(ignored -> loadChapter(builder, book, versionId, current));
        }
        // Callers only ever see the finished, immutable snapshot.
        return chain.thenApply(ChapterVerseInfo.Builder::build);
    }

    private CompletableFuture<ChapterVerseInfo.Builder> loadChapter(ChapterVerseInfo.Builder builder, BookRecord book,
                                                                    String versionId, int chapter) {
        CompletableFuture<List<Verse>> fetch;
        try {
            fetch = verseStore.getVerses(versionId, book.getId(), chapter);
            if (fetch == null) {
                fetch = CompletableFuture.failedFuture(new VerseStoreException(
                        loc.getString("error.store.noResult", book.getName(), chapter)));
            }
        } catch (RuntimeException e) {
            fetch = CompletableFuture.failedFuture(e);
        }

        return fetch.handle((verses, error) -> {
            if (error != null) {
                if (verbosity > 0) {
                    System.err.println(loc.getString("warn.bounds.chapterFailed", book.getName(), chapter,
                            rootMessage(error), defaultVerseCount));
                }
                return builder.recordAssumedChapter(chapter, defaultVerseCount);
            }
            int maxVerse = verses == null ? 0 : verses.stream().mapToInt(Verse::getNumber).max().orElse(0);
            return builder.recordChapter(chapter, maxVerse);
        });
    }

    private static String rootMessage(Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }

    private static String key(int bookId, String versionId) {
        return versionId + "#" + bookId;
    }
}
