package com.ai.quizbot.service;

import com.ai.quizbot.dto.ReplyOption;
import com.ai.quizbot.exception.MessageSendException;

import java.util.List;

/**
 * Outbound channel to the messaging provider. Implementations own transport,
 * credentials and any retry policy.
 */
public interface Messenger {

    /**
     * @throws MessageSendException if the provider could not be reached or rejected the message
     */
    void sendText(String to, String body);

    /**
     * @param buttons at most three entries
     * @throws MessageSendException if the provider could not be reached or rejected the message
     */
    void sendButtons(String to, String bodyText, List<ReplyOption> buttons);

    /**
     * @throws MessageSendException if the provider could not be reached or rejected the message
     */
    void sendList(String to, String bodyText, String buttonLabel, String sectionTitle, List<ReplyOption> rows);
}
