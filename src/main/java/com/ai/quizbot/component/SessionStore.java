package com.ai.quizbot.component;

import com.ai.quizbot.conversation.QuizSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * In-memory quiz sessions keyed by user id (the sender's phone number).
 * <p>
 * {@link #update} runs inside {@link ConcurrentHashMap#compute}, so two
 * deliveries for the same user are applied one after the other while different
 * users proceed in parallel. Mutators must be quick and must not do I/O or
 * touch other keys; outbound sends happen after the update returns.
 */
@Component
public class SessionStore {

    private static final Logger log = LoggerFactory.getLogger(SessionStore.class);

    private final Map<String, QuizSession> sessions = new ConcurrentHashMap<>();

    /** Snapshot of the user's session, creating a NEW one if absent. */
    public QuizSession getOrCreate(String userId) {
        return sessions.computeIfAbsent(userId, QuizSession::new).copy();
    }

    public Optional<QuizSession> find(String userId) {
        if (userId == null) return Optional.empty();
        QuizSession session = sessions.get(userId);
        return session != null ? Optional.of(session.copy()) : Optional.empty();
    }

    /**
     * Applies {@code mutator} atomically to a working copy of the user's session
     * (created NEW if absent) and returns its result. The copy, or the session
     * that replaced it through {@link QuizSession#restart()}, is stored only if
     * the mutator returns normally; a session left COMPLETED is removed.
     */
    public <T> T update(String userId, Function<QuizSession, T> mutator) {
        Object[] result = new Object[1];
        sessions.compute(userId, (key, current) -> {
            QuizSession working = current != null ? current.copy() : new QuizSession(key);
            result[0] = mutator.apply(working);
            QuizSession next = working.latest();
            if (next.isCompleted()) {
                log.info("[{}] Session completed, removing", key);
                return null;
            }
            return next;
        });
        @SuppressWarnings("unchecked")
        T value = (T) result[0];
        return value;
    }

    public void delete(String userId) {
        if (userId == null) return;
        sessions.remove(userId);
    }

    public int size() {
        return sessions.size();
    }
}
