package org.truetranslation.scripture.core;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.truetranslation.scripture.core.model.BookRecord;
import org.truetranslation.scripture.core.model.ParsedReference;
import org.truetranslation.scripture.core.model.Suggestion;
import org.truetranslation.scripture.core.model.ValidationResult;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CompletionException;

import static org.assertj.core.api.Assertions.*;

class ScriptureReferenceEngineTest {

    private FakeVerseStore store;
    private ScriptureReferenceEngine engine;

    @BeforeEach
    void setUp() throws IOException {
        store = new FakeVerseStore(31);
        engine = new ScriptureReferenceEngine(JsonBookCatalog.loadDefault(), store, AbbreviationTable.getDefault(), 31, 0);
    }

    @Test
    void testParseAndValidate() {
        engine.switchVersion("KJV");

        ParsedReference reference = engine.parseReference("Genesis 51:1");
        ValidationResult result = engine.validateReference(reference).join();

        assertThat(reference.isValid()).isTrue();
        assertThat(result.isValid()).isFalse();
        assertThat(result.getError()).isEqualTo("Genesis has only 50 chapters");
        assertThat(ReferenceFormatter.format(result.getAutoCorrection())).isEqualTo("Genesis 50:1");
    }

    @Test
    void testValidationNeedsVersion() {
        ValidationResult result = engine.validateReference(engine.parseReference("John 3:16")).join();

        assertThat(result.getError()).isEqualTo("No Bible version selected");
        assertThat(engine.validateReference(engine.parseReference("John 3:16"), "ESV").join().isValid()).isTrue();
    }

    @Test
    void testSwitchVersionDropsCachedBounds() {
        engine.switchVersion("KJV");
        engine.validateReference(engine.parseReference("Jude 1:3")).join();
        assertThat(engine.getBoundsCache().size()).isEqualTo(1);

        engine.switchVersion("ESV");

        assertThat(engine.getVersionId()).isEqualTo("ESV");
        assertThat(engine.getBoundsCache().size()).isZero();
        assertThat(engine.getBoundsCache().getCurrentVersionId()).isEqualTo("ESV");
    }

    @Test
    void testSwitchVersionWithNewCatalog() {
        BookCatalog gospelOnly = () -> List.of(new BookRecord(43, "John", "Jn", 21));

        engine.switchVersion("GOS", gospelOnly);

        assertThat(engine.getBooks()).hasSize(1);
        assertThat(engine.parseReference("Gen 1:1").getError()).isEqualTo("Book \"Gen\" not found");
        assertThat(engine.parseReference("jn 1:1").isValid()).isTrue();
    }

    @Test
    void testCatalogIsSnapshot() {
        List<BookRecord> books = engine.getBooks();

        assertThat(books).hasSize(66);
        assertThatThrownBy(() -> books.add(new BookRecord(67, "Extra", "Ext", 1)))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void testGetBoundsForUnknownBookFails() {
        assertThatThrownBy(() -> engine.getBounds(999, "KJV").join())
                .isInstanceOf(CompletionException.class)
                .hasCauseInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown book id: 999");
        assertThat(store.calls.get()).isZero();
    }

    @Test
    void testGetBoundsForKnownBook() {
        assertThat(engine.getBounds(65, "KJV").join().getChapterCount()).isEqualTo(1);
        assertThat(engine.findBook(65)).map(BookRecord::getName).contains("Jude");
        assertThat(engine.findBook(0)).isEmpty();
    }

    @Test
    void testMatchingAndSuggestions() {
        assertThat(engine.findBookMatches("ex", 1)).extracting(match -> match.getBook().getName()).containsExactly("Exodus");
        assertThat(engine.getBestMatch("Pslam")).map(match -> match.getBook().getName()).contains("Psalms");
        assertThat(engine.generateSuggestions("Gen", 3)).extracting(Suggestion::getText)
                .containsExactly("Genesis", "Genesis 1", "Genesis 1:1");
        assertThat(engine.completionSuggestions(engine.findBook(43).orElseThrow(), "John 3"))
                .extracting(Suggestion::getText).containsExactly("John 3:1");
        assertThat(engine.getAbbreviations().size()).isEqualTo(66);
    }
}
