package com.ai.quizbot.conversation;

/**
 * State machine for one quiz attempt. COMPLETED is terminal: the session is
 * removed from the store as soon as it is reached.
 */
public enum QuizState {
    NEW,
    AWAITING_START,
    IN_PROGRESS,
    COMPLETED
}
