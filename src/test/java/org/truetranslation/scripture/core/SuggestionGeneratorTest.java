package org.truetranslation.scripture.core;

import org.junit.jupiter.api.Test;
import org.truetranslation.scripture.core.model.BookRecord;
import org.truetranslation.scripture.core.model.Suggestion;
import org.truetranslation.scripture.core.model.SuggestionType;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class SuggestionGeneratorTest {

    private final SuggestionGenerator generator = new SuggestionGenerator(new BookMatcher());
    private final List<BookRecord> books = TestCatalogs.defaultBooks();

    @Test
    void testConfidentMatchAddsChapterAndVerse() {
        List<Suggestion> suggestions = generator.generateSuggestions("Gen", books, 10);

        assertThat(suggestions).extracting(Suggestion::getText)
                .containsExactly("Genesis", "Genesis 1", "Genesis 1:1", "Judges");
        assertThat(suggestions).extracting(Suggestion::getType)
                .containsExactly(SuggestionType.BOOK, SuggestionType.CHAPTER, SuggestionType.COMPLETE, SuggestionType.BOOK);
        assertThat(suggestions.get(1).getScore()).isEqualTo(900.0);
        assertThat(suggestions.get(2).getScore()).isEqualTo(800.0);
        assertThat(suggestions.get(2).getReference().isComplete()).isTrue();
    }

    @Test
    void testLimitApplies() {
        assertThat(generator.generateSuggestions("Gen", books, 2)).extracting(Suggestion::getText)
                .containsExactly("Genesis", "Genesis 1");
    }

    @Test
    void testEqualScoresKeepInsertionOrder() {
        List<Suggestion> suggestions = generator.generateSuggestions("Jo", books, 20);

        assertThat(suggestions).extracting(Suggestion::getText).containsExactly(
                "Job", "Joshua", "Joel",
                "Job 1", "Joshua 1", "Joel 1",
                "Job 1:1", "Joshua 1:1", "Joel 1:1");
    }

    @Test
    void testWeakMatchesOnlySuggestBooks() {
        List<Suggestion> suggestions = generator.generateSuggestions("Pslam", books, 10);

        assertThat(suggestions).hasSize(3);
        assertThat(suggestions).allMatch(suggestion -> suggestion.getType() == SuggestionType.BOOK);
        assertThat(suggestions.get(0).getText()).isEqualTo("Psalms");
    }

    @Test
    void testBlankInput() {
        assertThat(generator.generateSuggestions("", books, 5)).isEmpty();
        assertThat(generator.generateSuggestions(null, books, 5)).isEmpty();
        assertThat(generator.generateSuggestions("Gen", books, 0)).isEmpty();
    }

    @Test
    void testCompletionSuggestions() {
        BookRecord john = TestCatalogs.book("John");

        List<Suggestion> bookOnly = generator.completionSuggestions(john, "John");
        assertThat(bookOnly).extracting(Suggestion::getText).containsExactly("John 1", "John 1:1");
        assertThat(bookOnly).extracting(Suggestion::getScore).containsExactly(900.0, 850.0);

        List<Suggestion> chapter = generator.completionSuggestions(john, "John 3");
        assertThat(chapter).extracting(Suggestion::getText).containsExactly("John 3:1");

        List<Suggestion> verse = generator.completionSuggestions(john, "jn 3:16");
        assertThat(verse).extracting(Suggestion::getText).containsExactly("John 3:16-17");
        assertThat(verse.get(0).getType()).isEqualTo(SuggestionType.COMPLETE);
        assertThat(verse.get(0).getScore()).isEqualTo(800.0);
    }
}
