package org.truetranslation.scripture.core;

import org.truetranslation.scripture.core.model.Verse;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Asynchronous access to the verses of a chapter. Failures are reported through
 * the returned future, usually as a {@link VerseStoreException}.
 */
public interface VerseStore {

    CompletableFuture<List<Verse>> getVerses(String versionId, int bookId, int chapter);
}
