package com.ai.quizbot.service;

import com.ai.quizbot.component.ResponsePhrases;
import com.ai.quizbot.dto.RenderedMessage;
import com.ai.quizbot.dto.ReplyOption;
import com.ai.quizbot.entity.Question;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Converts questions and quiz outcomes into outbound messages.
 * Stateless: no flow logic, safe to call concurrently.
 */
@Service
public class MessageRenderer {

    public static final String START_QUIZ_ID = "start_quiz";

    /** Display width of a button or list row title. */
    public static final int TITLE_WIDTH = 20;

    private final ResponsePhrases phrases;

    public MessageRenderer(ResponsePhrases phrases) {
        this.phrases = phrases;
    }

    /**
     * Up to three options go out as reply buttons; four need a single-select list
     * because the provider caps button messages at three.
     */
    public RenderedMessage renderQuestion(Question question) {
        String body = phrases.questionBody(question.getIndex() + 1, question.getText());
        List<ReplyOption> choices = new ArrayList<>();
        for (Map.Entry<Integer, String> option : question.getOptions().entrySet()) {
            choices.add(ReplyOption.of(String.valueOf(option.getKey()), truncate(option.getValue())));
        }
        if (choices.size() <= RenderedMessage.MAX_BUTTONS) {
            return RenderedMessage.buttons(body, choices);
        }
        return RenderedMessage.list(body, phrases.chooseOptionButton(), phrases.chooseAnswerSection(), choices);
    }

    public RenderedMessage renderGreeting() {
        return RenderedMessage.buttons(phrases.greeting(),
                List.of(ReplyOption.of(START_QUIZ_ID, phrases.startButtonTitle())));
    }

    public RenderedMessage renderCorrect(Question question, String choice) {
        return RenderedMessage.text(phrases.correctAnswer(
                question.explanationFor(choice).orElse(phrases.noExplanation())));
    }

    public RenderedMessage renderIncorrect(Question question) {
        return RenderedMessage.text(phrases.incorrectAnswer(
                question.correctOptionText().orElse(phrases.unknownAnswer()),
                question.explanationFor(question.getCorrectOption()).orElse(phrases.noExplanation())));
    }

    public RenderedMessage renderCompletion(int score, int total) {
        return RenderedMessage.text(phrases.completion(score, total));
    }

    public RenderedMessage renderNoContent() {
        return RenderedMessage.text(phrases.noContent());
    }

    static String truncate(String title) {
        if (title == null) return "";
        if (title.codePointCount(0, title.length()) <= TITLE_WIDTH) return title;
        return title.substring(0, title.offsetByCodePoints(0, TITLE_WIDTH));
    }
}
