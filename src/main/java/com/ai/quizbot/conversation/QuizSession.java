package com.ai.quizbot.conversation;

import java.time.Instant;

/**
 * Per-user quiz progress. Owned by the SessionStore; callers only ever see
 * copies, or the working copy inside an atomic update.
 */
public class QuizSession {

    private final String userId;
    private QuizState state = QuizState.NEW;
    private int questionIndex;
    private int score;
    private final Instant createdAt;
    private Instant updatedAt;
    private QuizSession successor;

    public QuizSession(String userId) {
        this.userId = userId;
        this.createdAt = Instant.now();
        this.updatedAt = createdAt;
    }

    private QuizSession(QuizSession other) {
        this.userId = other.userId;
        this.state = other.state;
        this.questionIndex = other.questionIndex;
        this.score = other.score;
        this.createdAt = other.createdAt;
        this.updatedAt = other.updatedAt;
    }

    public String getUserId() {
        return userId;
    }

    public QuizState getState() {
        return state;
    }

    public int getQuestionIndex() {
        return questionIndex;
    }

    public int getScore() {
        return score;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void awaitStart() {
        transition(QuizState.AWAITING_START);
    }

    public void start() {
        questionIndex = 0;
        transition(QuizState.IN_PROGRESS);
    }

    /**
     * Abandons this session and opens a new one for the same user, already at
     * the first question. The score of this session is left as it was.
     *
     * @return the new session, which the store keeps in place of this one
     */
    public QuizSession restart() {
        QuizSession next = new QuizSession(userId);
        next.start();
        successor = next;
        return next;
    }

    /** The session that replaced this one through {@link #restart()}, or this session. */
    public QuizSession latest() {
        return successor != null ? successor.latest() : this;
    }

    public void recordAnswer(boolean correct) {
        if (correct) {
            score++;
        }
        questionIndex++;
        updatedAt = Instant.now();
    }

    public void complete() {
        transition(QuizState.COMPLETED);
    }

    public boolean isCompleted() {
        return state == QuizState.COMPLETED;
    }

    public QuizSession copy() {
        return new QuizSession(this);
    }

    private void transition(QuizState next) {
        this.state = next;
        this.updatedAt = Instant.now();
    }

    @Override
    public String toString() {
        return "QuizSession{userId=" + userId + ", state=" + state
                + ", questionIndex=" + questionIndex + ", score=" + score + "}";
    }
}
