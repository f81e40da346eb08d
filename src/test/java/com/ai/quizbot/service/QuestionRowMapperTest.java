package com.ai.quizbot.service;

import com.ai.quizbot.component.ResponsePhrases;
import com.ai.quizbot.entity.Question;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class QuestionRowMapperTest {

    private final ResponsePhrases phrases = new ResponsePhrases();
    private final QuestionRowMapper mapper = new QuestionRowMapper(phrases);

    @Test
    void mapsFullRow() {
        Map<String, String> row = row(
                "Question", "Capital of France?",
                "Option 1", "Paris",
                "Option 2", "Lyon",
                "Correct Option", "1",
                "Explanation 1", "Paris is the capital.",
                "Explanation 2", "Lyon is not.");

        Question q = mapper.map(List.of(row)).get(0);

        assertThat(q.getIndex()).isZero();
        assertThat(q.getText()).isEqualTo("Capital of France?");
        assertThat(q.getOptions()).containsExactly(Map.entry(1, "Paris"), Map.entry(2, "Lyon"));
        assertThat(q.getCorrectOption()).isEqualTo(1);
        assertThat(q.explanationFor(2)).contains("Lyon is not.");
    }

    @Test
    void fallsBackToFirstColumnWhenQuestionBlank() {
        Map<String, String> row = row(
                "Sr", "Prompt from first column",
                "Question", "  ",
                "Option 1", "Yes",
                "Correct Option", "1");

        assertThat(mapper.map(List.of(row)).get(0).getText()).isEqualTo("Prompt from first column");
    }

    @Test
    void omitsBlankOptionSlotsWithoutPadding() {
        Map<String, String> row = row(
                "Question", "Sparse",
                "Option 1", "First",
                "Option 2", null,
                "Option 3", "Third",
                "Option 4", "",
                "Correct Option", "3");

        Question q = mapper.map(List.of(row)).get(0);

        assertThat(q.getOptions()).containsOnlyKeys(1, 3);
        assertThat(q.isCorrect("3")).isTrue();
    }

    @Test
    void missingExplanationsGetPlaceholder() {
        Map<String, String> row = row(
                "Question", "No explanations",
                "Option 1", "A",
                "Option 2", "B",
                "Correct Option", "2");

        Question q = mapper.map(List.of(row)).get(0);

        assertThat(q.explanationFor(1)).contains(phrases.noExplanation());
        assertThat(q.explanationFor(2)).contains(phrases.noExplanation());
    }

    @Test
    void parsesSpreadsheetNumericCorrectOption() {
        assertThat(QuestionRowMapper.parseOptionNumber("2.0")).isEqualTo(2);
        assertThat(QuestionRowMapper.parseOptionNumber(" 4 ")).isEqualTo(4);
        assertThat(QuestionRowMapper.parseOptionNumber("2.5")).isZero();
        assertThat(QuestionRowMapper.parseOptionNumber("B")).isZero();
        assertThat(QuestionRowMapper.parseOptionNumber(null)).isZero();
    }

    @Test
    void unreadableCorrectOptionKeepsQuestionButNeverScores() {
        Map<String, String> row = row(
                "Question", "Broken key",
                "Option 1", "A",
                "Correct Option", "A");

        Question q = mapper.map(List.of(row)).get(0);

        assertThat(q.getCorrectOption()).isZero();
        assertThat(q.isCorrect("1")).isFalse();
    }

    @Test
    void skipsBlankRowsAndRowsWithoutOptionsAndReindexes() {
        List<Map<String, String>> rows = new ArrayList<>();
        rows.add(row("Question", "First", "Option 1", "A", "Correct Option", "1"));
        rows.add(row("Question", null, "Option 1", null, "Correct Option", null));
        rows.add(row("Question", "No options", "Option 1", null, "Correct Option", "1"));
        rows.add(row("Question", "Second", "Option 1", "A", "Correct Option", "1"));

        List<Question> questions = mapper.map(rows);

        assertThat(questions).extracting(Question::getText).containsExactly("First", "Second");
        assertThat(questions).extracting(Question::getIndex).containsExactly(0, 1);
    }

    private static Map<String, String> row(String... keyValues) {
        Map<String, String> row = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            row.put(keyValues[i], keyValues[i + 1]);
        }
        return row;
    }
}
