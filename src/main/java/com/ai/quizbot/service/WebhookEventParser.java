package com.ai.quizbot.service;

import com.ai.quizbot.conversation.ParsedEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

/**
 * Reads a WhatsApp Cloud API webhook delivery. Only the first message of the
 * first change is considered; the provider sends one per delivery.
 */
@Service
public class WebhookEventParser {

    private final ObjectMapper mapper = new ObjectMapper();

    public ParsedEvent parse(String rawBody) {
        if (StringUtils.isBlank(rawBody)) {
            return ParsedEvent.unrecognized("empty body");
        }
        try {
            return parse(mapper.readTree(rawBody));
        } catch (JsonProcessingException e) {
            return ParsedEvent.unrecognized("invalid JSON: " + e.getOriginalMessage());
        }
    }

    public ParsedEvent parse(JsonNode root) {
        if (root == null) {
            return ParsedEvent.unrecognized("empty body");
        }
        JsonNode value = root.path("entry").path(0).path("changes").path(0).path("value");
        JsonNode messages = value.path("messages");
        if (!messages.isArray() || messages.isEmpty()) {
            return ParsedEvent.unrecognized(value.has("statuses") ? "status update" : "no messages");
        }
        JsonNode message = messages.path(0);
        String from = message.path("from").asText("");
        if (from.isBlank()) {
            return ParsedEvent.unrecognized("message without sender");
        }

        String type = message.path("type").asText("");
        switch (type) {
            case "text":
                return ParsedEvent.text(from, message.path("text").path("body").asText(""));
            case "interactive":
                return parseInteractive(from, message.path("interactive"));
            default:
                return ParsedEvent.otherMessage(from, type.isEmpty() ? "unknown" : type);
        }
    }

    private ParsedEvent parseInteractive(String from, JsonNode interactive) {
        String subType = interactive.path("type").asText("");
        JsonNode reply;
        if ("button_reply".equals(subType)) {
            reply = interactive.path("button_reply");
        } else if ("list_reply".equals(subType)) {
            reply = interactive.path("list_reply");
        } else {
            return ParsedEvent.unrecognized("unknown interactive type '" + subType + "' from " + from);
        }
        String id = reply.path("id").asText("");
        if (id.isBlank()) {
            return ParsedEvent.unrecognized(subType + " without id from " + from);
        }
        return ParsedEvent.interactiveReply(from, id);
    }
}
