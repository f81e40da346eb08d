package com.ai.quizbot.service;

import com.ai.quizbot.component.ResponsePhrases;
import com.ai.quizbot.dto.RenderedMessage;
import com.ai.quizbot.dto.ReplyOption;
import com.ai.quizbot.entity.Question;
import com.ai.quizbot.testsupport.TestQuestions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class MessageRendererTest {

    private final ResponsePhrases phrases = new ResponsePhrases();
    private final MessageRenderer renderer = new MessageRenderer(phrases);

    @ParameterizedTest
    @CsvSource({"1, BUTTONS", "2, BUTTONS", "3, BUTTONS", "4, LIST"})
    void controlShapeDependsOnOptionCount(int optionCount, RenderedMessage.Kind expected) {
        RenderedMessage message = renderer.renderQuestion(TestQuestions.withOptions(0, optionCount, 1));

        assertThat(message.getKind()).isEqualTo(expected);
        assertThat(message.getOptions()).hasSize(optionCount);
    }

    @Test
    void optionIdsAreOptionNumbers() {
        RenderedMessage message = renderer.renderQuestion(TestQuestions.withOptions(2, 3, 1));

        assertThat(message.getBody()).isEqualTo(phrases.questionBody(3, "Question text 3"));
        assertThat(message.getOptions()).extracting(ReplyOption::getId).containsExactly("1", "2", "3");
        assertThat(message.getOptions()).extracting(ReplyOption::getTitle)
                .containsExactly("Option A", "Option B", "Option C");
    }

    @Test
    void listCarriesLabelAndSectionTitle() {
        RenderedMessage message = renderer.renderQuestion(TestQuestions.withOptions(0, 4, 4));

        assertThat(message.getButtonLabel()).isEqualTo(phrases.chooseOptionButton());
        assertThat(message.getSectionTitle()).isEqualTo(phrases.chooseAnswerSection());
        assertThat(message.getOptions()).extracting(ReplyOption::getId).containsExactly("1", "2", "3", "4");
    }

    @Test
    void sparseOptionsKeepTheirSourceNumbers() {
        Question q = Question.builder()
                .index(0)
                .text("Sparse")
                .options(Map.of(2, "two"))
                .correctOption(2)
                .build();

        assertThat(renderer.renderQuestion(q).getOptions()).containsExactly(ReplyOption.of("2", "two"));
    }

    @Test
    void titlesAreTruncatedToDisplayWidth() {
        Question q = Question.builder()
                .index(0)
                .text("Long option")
                .options(Map.of(1, "Adverse Event Following Immunization"))
                .correctOption(1)
                .build();

        String title = renderer.renderQuestion(q).getOptions().get(0).getTitle();

        assertThat(title).isEqualTo("Adverse Event Follow").hasSize(MessageRenderer.TITLE_WIDTH);
    }

    @Test
    void truncationCountsCodePoints() {
        String emoji = "😀".repeat(25);

        assertThat(MessageRenderer.truncate(emoji).codePointCount(0, MessageRenderer.truncate(emoji).length()))
                .isEqualTo(MessageRenderer.TITLE_WIDTH);
        assertThat(MessageRenderer.truncate("short")).isEqualTo("short");
    }

    @Test
    void greetingHasSingleStartButton() {
        RenderedMessage greeting = renderer.renderGreeting();

        assertThat(greeting.getKind()).isEqualTo(RenderedMessage.Kind.BUTTONS);
        assertThat(greeting.getBody()).isEqualTo(phrases.greeting());
        assertThat(greeting.getOptions()).extracting(ReplyOption::getId).containsExactly(MessageRenderer.START_QUIZ_ID);
    }

    @Test
    void incorrectFeedbackNamesCorrectOptionAndItsExplanation() {
        Question q = TestQuestions.withOptions(0, 3, 2);

        RenderedMessage message = renderer.renderIncorrect(q);

        assertThat(message.getKind()).isEqualTo(RenderedMessage.Kind.TEXT);
        assertThat(message.getBody()).isEqualTo(phrases.incorrectAnswer("Option B", "Why B"));
    }

    @Test
    void incorrectFeedbackDegradesWhenCorrectOptionUnknown() {
        Question q = TestQuestions.withOptions(0, 2, 0);

        assertThat(renderer.renderIncorrect(q).getBody())
                .isEqualTo(phrases.incorrectAnswer(phrases.unknownAnswer(), phrases.noExplanation()));
    }

    @Test
    void correctFeedbackUsesChosenOptionExplanation() {
        Question q = TestQuestions.withOptions(0, 2, 1);

        assertThat(renderer.renderCorrect(q, "1").getBody()).isEqualTo(phrases.correctAnswer("Why A"));
    }

    @Test
    void completionReportsScoreOverTotal() {
        assertThat(renderer.renderCompletion(3, 5).getBody()).contains("3/5");
    }
}
