package com.ai.quizbot.exception;

public class QuestionOutOfRangeException extends IndexOutOfBoundsException {

    public QuestionOutOfRangeException(int index, int count) {
        super("Question index " + index + " out of range [0, " + count + ")");
    }
}
