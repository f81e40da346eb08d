package com.ai.quizbot.service;

import com.ai.quizbot.entity.Question;
import com.ai.quizbot.exception.QuestionOutOfRangeException;

import java.util.Collections;
import java.util.List;

/**
 * Immutable, ordered catalog of quiz questions. Built once at startup by
 * {@link com.ai.quizbot.config.QuestionBankConfig}.
 */
public class QuestionBank {

    private static final QuestionBank EMPTY = new QuestionBank(Collections.emptyList());

    private final List<Question> questions;

    public QuestionBank(List<Question> questions) {
        this.questions = questions != null ? List.copyOf(questions) : Collections.emptyList();
    }

    public static QuestionBank empty() {
        return EMPTY;
    }

    public int count() {
        return questions.size();
    }

    public boolean isEmpty() {
        return questions.isEmpty();
    }

    public Question get(int index) {
        if (index < 0 || index >= questions.size()) {
            throw new QuestionOutOfRangeException(index, questions.size());
        }
        return questions.get(index);
    }
}
