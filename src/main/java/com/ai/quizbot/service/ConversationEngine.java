package com.ai.quizbot.service;

import com.ai.quizbot.component.SessionStore;
import com.ai.quizbot.conversation.ParsedEvent;
import com.ai.quizbot.conversation.QuizSession;
import com.ai.quizbot.dto.RenderedMessage;
import com.ai.quizbot.entity.Question;
import com.ai.quizbot.exception.MessageSendException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Single entry for the quiz conversation: one webhook delivery at a time,
 * session transition under the store's per-user lock, then outbound sends once
 * the new state is committed. Never throws to the caller.
 */
@Service
public class ConversationEngine {

    private static final Logger log = LoggerFactory.getLogger(ConversationEngine.class);

    private final WebhookEventParser parser;
    private final SessionStore sessionStore;
    private final QuestionBank questionBank;
    private final MessageRenderer renderer;
    private final Messenger messenger;

    public ConversationEngine(WebhookEventParser parser,
                              SessionStore sessionStore,
                              QuestionBank questionBank,
                              MessageRenderer renderer,
                              Messenger messenger) {
        this.parser = parser;
        this.sessionStore = sessionStore;
        this.questionBank = questionBank;
        this.renderer = renderer;
        this.messenger = messenger;
    }

    /**
     * Processes a raw webhook body.
     *
     * @return true if the delivery was routed to a user's session, false if it was ignored
     */
    public boolean handle(String rawBody) {
        return handle(parser.parse(rawBody));
    }

    public boolean handle(ParsedEvent event) {
        if (!event.isRoutable()) {
            log.debug("Ignoring webhook delivery: {}", event.getReason());
            return false;
        }
        String userId = event.getUserId();
        List<RenderedMessage> outbound;
        try {
            outbound = sessionStore.update(userId, session -> transition(session, event));
        } catch (RuntimeException e) {
            log.error("[{}] Failed to process {}", userId, event, e);
            return false;
        }
        for (RenderedMessage message : outbound) {
            send(userId, message);
        }
        return true;
    }

    private List<RenderedMessage> transition(QuizSession session, ParsedEvent event) {
        String userId = session.getUserId();
        switch (session.getState()) {
            case NEW:
                session.awaitStart();
                log.info("[{}] New session, sending greeting", userId);
                return List.of(renderer.renderGreeting());
            case AWAITING_START:
                if (isStartAction(event)) {
                    return startQuiz(session);
                }
                log.debug("[{}] Waiting for start, re-sending greeting", userId);
                return List.of(renderer.renderGreeting());
            case IN_PROGRESS:
                if (isStartAction(event)) {
                    return restartQuiz(session);
                }
                if (event.getType() == ParsedEvent.Type.INTERACTIVE_REPLY) {
                    return answer(session, event.getReplyId());
                }
                log.debug("[{}] Ignoring {} during quiz", userId, event.getType());
                return List.of();
            default:
                return List.of();
        }
    }

    private List<RenderedMessage> startQuiz(QuizSession session) {
        if (questionBank.isEmpty()) {
            log.warn("[{}] Quiz start requested but no questions are loaded", session.getUserId());
            return List.of(renderer.renderNoContent());
        }
        session.start();
        log.info("[{}] Quiz started ({} questions)", session.getUserId(), questionBank.count());
        return List.of(renderer.renderQuestion(questionBank.get(0)));
    }

    private List<RenderedMessage> restartQuiz(QuizSession session) {
        QuizSession next = session.restart();
        log.info("[{}] Start pressed at question {} (score {}), replacing session from {} with one from {}",
                session.getUserId(), session.getQuestionIndex() + 1, session.getScore(),
                session.getCreatedAt(), next.getCreatedAt());
        return List.of(renderer.renderQuestion(questionBank.get(0)));
    }

    private List<RenderedMessage> answer(QuizSession session, String replyId) {
        Question question = questionBank.get(session.getQuestionIndex());
        if (!question.hasOption(replyId)) {
            log.info("[{}] Reply '{}' is not an option of question {}, ignoring",
                    session.getUserId(), replyId, question.getIndex() + 1);
            return List.of();
        }

        boolean correct = question.isCorrect(replyId);
        List<RenderedMessage> outbound = new ArrayList<>();
        outbound.add(correct ? renderer.renderCorrect(question, replyId) : renderer.renderIncorrect(question));
        session.recordAnswer(correct);
        log.info("[{}] Question {} answered '{}' correct={} score={}",
                session.getUserId(), question.getIndex() + 1, replyId, correct, session.getScore());

        if (session.getQuestionIndex() < questionBank.count()) {
            outbound.add(renderer.renderQuestion(questionBank.get(session.getQuestionIndex())));
        } else {
            outbound.add(renderer.renderCompletion(session.getScore(), questionBank.count()));
            session.complete();
            log.info("[{}] Quiz completed with score {}/{} (session {} to {})", session.getUserId(),
                    session.getScore(), questionBank.count(), session.getCreatedAt(), session.getUpdatedAt());
        }
        return outbound;
    }

    private static boolean isStartAction(ParsedEvent event) {
        return event.getType() == ParsedEvent.Type.INTERACTIVE_REPLY
                && MessageRenderer.START_QUIZ_ID.equals(event.getReplyId());
    }

    private void send(String to, RenderedMessage message) {
        try {
            switch (message.getKind()) {
                case BUTTONS:
                    messenger.sendButtons(to, message.getBody(), message.getOptions());
                    break;
                case LIST:
                    messenger.sendList(to, message.getBody(), message.getButtonLabel(),
                            message.getSectionTitle(), message.getOptions());
                    break;
                case TEXT:
                default:
                    messenger.sendText(to, message.getBody());
                    break;
            }
        } catch (MessageSendException e) {
            log.error("[{}] {}", to, e.getMessage());
        } catch (RuntimeException e) {
            log.error("[{}] Unexpected failure sending {} message", to, message.getKind(), e);
        }
    }
}
