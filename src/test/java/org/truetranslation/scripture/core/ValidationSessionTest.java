package org.truetranslation.scripture.core;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.truetranslation.scripture.core.model.BookRecord;
import org.truetranslation.scripture.core.model.ParsedReference;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

class ValidationSessionTest {

    private FakeVerseStore store;
    private ScriptureReferenceEngine engine;
    private final List<ValidationSession.Update> updates = new CopyOnWriteArrayList<>();
    private ValidationSession session;

    @BeforeEach
    void setUp() {
        store = new FakeVerseStore(36);
        BookCatalog catalog = () -> List.of(
                new BookRecord(1, "Genesis", "Gen", 2),
                new BookRecord(43, "John", "John", 3));
        engine = new ScriptureReferenceEngine(catalog, store, AbbreviationTable.getDefault(), 31, 0);
        engine.switchVersion("KJV");
    }

    @AfterEach
    void tearDown() {
        if (session != null) session.close();
    }

    @Test
    void testStaleResultIsDiscarded() {
        session = new ValidationSession(engine, 1000, updates::add);
        store.hold(43);

        CompletableFuture<Optional<ValidationSession.Update>> first = session.validateNow("John 3:16");
        CompletableFuture<Optional<ValidationSession.Update>> second = session.validateNow("Genesis 1:1");

        assertThat(second.join()).isPresent();
        assertThat(first).isNotDone();

        store.release(43);

        assertThat(first.join()).isEmpty();
        assertThat(session.discardedCount()).isEqualTo(1);
        assertThat(updates).hasSize(1);
        assertThat(updates.get(0).getInput()).isEqualTo("Genesis 1:1");
        assertThat(updates.get(0).getGeneration()).isEqualTo(2);
        assertThat(updates.get(0).getResult().isValid()).isTrue();
    }

    @Test
    void testStaleLookupStillFillsCache() {
        session = new ValidationSession(engine, 1000, updates::add);
        store.hold(43);

        CompletableFuture<Optional<ValidationSession.Update>> first = session.validateNow("John 3:16");
        session.validateNow("Genesis 1:1").join();
        store.release(43);
        first.join();

        assertThat(engine.getBoundsCache().getCached(43, "KJV")).isPresent();
    }

    @Test
    void testDebounceValidatesOnlyLastInput() throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(1);
        session = new ValidationSession(engine, 50, update -> {
            updates.add(update);
            latch.countDown();
        });

        session.submit("J");
        session.submit("John 3");
        ParsedReference last = session.submit("John 3:16");

        assertThat(last.isComplete()).isTrue();
        assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();
        Thread.sleep(200);

        assertThat(updates).hasSize(1);
        assertThat(updates.get(0).getInput()).isEqualTo("John 3:16");
        assertThat(updates.get(0).getGeneration()).isEqualTo(session.currentGeneration());
    }

    @Test
    void testOutOfRangeInputReportsCorrection() {
        session = new ValidationSession(engine, 1000, updates::add);

        ValidationSession.Update update = session.validateNow("John 4:1").join().orElseThrow();

        assertThat(update.getResult().isValid()).isFalse();
        assertThat(update.getResult().getError()).isEqualTo("John has only 3 chapters");
        assertThat(update.getReference().getChapter()).isEqualTo(4);
    }

    @Test
    void testDeliveredUpdatesAreAlwaysCurrent() throws Exception {
        List<Long> outdated = new CopyOnWriteArrayList<>();
        session = new ValidationSession(engine, 1000, update -> {
            if (update.getGeneration() != session.currentGeneration()) {
                outdated.add(update.getGeneration());
            }
            updates.add(update);
        }, 0);

        List<CompletableFuture<Optional<ValidationSession.Update>>> results = new CopyOnWriteArrayList<>();
        Runnable typing = () -> {
            for (int i = 0; i < 200; i++) {
                results.add(session.validateNow(i % 2 == 0 ? "John 3:16" : "Genesis 1:1"));
            }
        };
        Thread first = new Thread(typing);
        Thread second = new Thread(typing);
        first.start();
        second.start();
        first.join();
        second.join();
        CompletableFuture.allOf(results.toArray(new CompletableFuture[0])).join();

        assertThat(outdated).isEmpty();
        assertThat(updates.size() + session.discardedCount()).isEqualTo(400);
    }

    @Test
    void testListenerFailureIsReportedOnDebouncedPath() throws Exception {
        PrintStream originalErr = System.err;
        ByteArrayOutputStream captured = new ByteArrayOutputStream();
        System.setErr(new PrintStream(captured, true, StandardCharsets.UTF_8));
        try {
            CountDownLatch called = new CountDownLatch(1);
            session = new ValidationSession(engine, 20, update -> {
                called.countDown();
                throw new IllegalStateException("listener broke");
            }, 1);

            session.submit("John 3:16");

            assertThat(called.await(5, TimeUnit.SECONDS)).isTrue();
            long deadline = System.currentTimeMillis() + 5000;
            while (!captured.toString(StandardCharsets.UTF_8).contains("listener broke")
                    && System.currentTimeMillis() < deadline) {
                Thread.sleep(10);
            }
            assertThat(captured.toString(StandardCharsets.UTF_8))
                    .contains("Could not deliver validation result for \"John 3:16\"")
                    .contains("listener broke");
        } finally {
            System.setErr(originalErr);
        }
    }
}
