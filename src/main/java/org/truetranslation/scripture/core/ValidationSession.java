package org.truetranslation.scripture.core;

import org.truetranslation.scripture.core.model.ParsedReference;
import org.truetranslation.scripture.core.model.ValidationResult;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Validation for one input field that the user keeps typing into.
 * <p>
 * Every {@link #submit} starts a new generation. Validation waits for the
 * debounce window to pass without further input, and a result is handed to the
 * listener only if no newer input arrived in the meantime. Stale lookups are not
 * aborted; whatever they load stays in the bounds cache.
 */
public class ValidationSession implements AutoCloseable {

    public static class Update {
        private final long generation;
        private final String input;
        private final ParsedReference reference;
        private final ValidationResult result;

        public Update(long generation, String input, ParsedReference reference, ValidationResult result) {
            this.generation = generation;
            this.input = input;
            this.reference = reference;
            this.result = result;
        }

        public long getGeneration() { return generation; }
        public String getInput() { return input; }
        public ParsedReference getReference() { return reference; }
        public ValidationResult getResult() { return result; }
    }

    private final ScriptureReferenceEngine engine;
    private final long debounceMillis;
    private final Consumer<Update> listener;
    private final ScheduledExecutorService scheduler;
    private final int verbosity;
    private final AtomicLong generation = new AtomicLong();
    private final AtomicLong discarded = new AtomicLong();
    private final LocalizationManager loc = LocalizationManager.getInstance();
    private ScheduledFuture<?> pending;

    public ValidationSession(ScriptureReferenceEngine engine, long debounceMillis, Consumer<Update> listener) {
        this(engine, debounceMillis, listener, 1);
    }

    public ValidationSession(ScriptureReferenceEngine engine, long debounceMillis, Consumer<Update> listener,
                             int verbosity) {
        this.engine = engine;
        this.debounceMillis = debounceMillis;
        this.listener = listener;
        this.verbosity = verbosity;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "reference-validation");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Parses right away and schedules validation after the debounce window.
     *
     * @return the parse result, for immediate feedback while validation is pending
     */
    public ParsedReference submit(String input) {
        ParsedReference reference = engine.parseReference(input);
        synchronized (this) {
            long current = generation.incrementAndGet();
            cancelPending();
            pending = scheduler.schedule(() -> {
                run(current, input, reference).whenComplete((update, error) -> {
                    if (error != null && verbosity > 0) {
                        System.err.println(loc.getString("error.session.deliveryFailed", input, rootMessage(error)));
                    }
                });
            }, debounceMillis, TimeUnit.MILLISECONDS);
        }
        return reference;
    }

    /**
     * Validates without waiting. The returned future holds the update, or is
     * empty when newer input superseded this one before it finished.
     */
    public CompletableFuture<Optional<Update>> validateNow(String input) {
        long current;
        synchronized (this) {
            current = generation.incrementAndGet();
            cancelPending();
        }
        return run(current, input, engine.parseReference(input));
    }

    public long currentGeneration() {
        return generation.get();
    }

    /** Number of results thrown away because newer input had arrived. */
    public long discardedCount() {
        return discarded.get();
    }

    private CompletableFuture<Optional<Update>> run(long requestGeneration, String input, ParsedReference reference) {
        return engine.validateReference(reference).thenApply(result -> {
            // New generations are only issued under this lock, so none can slip in before delivery.
            synchronized (this) {
                if (requestGeneration != generation.get()) {
                    discarded.incrementAndGet();
                    return Optional.<Update>empty();
                }
                Update update = new Update(requestGeneration, input, reference, result);
                listener.accept(update);
                return Optional.of(update);
            }
        });
    }

    private static String rootMessage(Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }

    private void cancelPending() {
        if (pending != null) {
            pending.cancel(false);
            pending = null;
        }
    }

    @Override
    public void close() {
        synchronized (this) {
            cancelPending();
        }
        scheduler.shutdownNow();
    }
}
