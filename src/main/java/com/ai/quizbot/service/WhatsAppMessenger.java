package com.ai.quizbot.service;

import com.ai.quizbot.dto.RenderedMessage;
import com.ai.quizbot.dto.ReplyOption;
import com.ai.quizbot.exception.MessageSendException;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Sends messages through the WhatsApp Cloud API ({@code POST /{phone-number-id}/messages}).
 */
@Service
public class WhatsAppMessenger implements Messenger {

    private static final Logger log = LoggerFactory.getLogger(WhatsAppMessenger.class);

    @Value("${whatsapp.token:}")
    private String token;

    @Value("${whatsapp.phone-number-id:}")
    private String phoneNumberId;

    @Value("${whatsapp.api-base-url:https://graph.facebook.com/v17.0}")
    private String apiBaseUrl;

    private final RestTemplate restTemplate;

    public WhatsAppMessenger(RestTemplateBuilder builder,
                             @Value("${whatsapp.connect-timeout:5s}") Duration connectTimeout,
                             @Value("${whatsapp.read-timeout:10s}") Duration readTimeout) {
        this.restTemplate = builder
                .setConnectTimeout(connectTimeout)
                .setReadTimeout(readTimeout)
                .build();
    }

    @Override
    public void sendText(String to, String body) {
        Map<String, Object> payload = basePayload(to);
        payload.put("type", "text");
        payload.put("text", Map.of("body", body));
        post(to, payload, "text");
    }

    @Override
    public void sendButtons(String to, String bodyText, List<ReplyOption> buttons) {
        if (buttons == null || buttons.isEmpty() || buttons.size() > RenderedMessage.MAX_BUTTONS) {
            throw new IllegalArgumentException("WhatsApp button messages take 1.." + RenderedMessage.MAX_BUTTONS + " buttons");
        }
        List<Map<String, Object>> replyButtons = new ArrayList<>();
        for (ReplyOption b : buttons) {
            replyButtons.add(Map.of("type", "reply", "reply", Map.of("id", b.getId(), "title", b.getTitle())));
        }
        Map<String, Object> interactive = new LinkedHashMap<>();
        interactive.put("type", "button");
        interactive.put("body", Map.of("text", bodyText));
        interactive.put("action", Map.of("buttons", replyButtons));

        Map<String, Object> payload = basePayload(to);
        payload.put("type", "interactive");
        payload.put("interactive", interactive);
        post(to, payload, "button");
    }

    @Override
    public void sendList(String to, String bodyText, String buttonLabel, String sectionTitle, List<ReplyOption> rows) {
        List<Map<String, Object>> listRows = new ArrayList<>();
        for (ReplyOption r : rows) {
            listRows.add(Map.of("id", r.getId(), "title", r.getTitle()));
        }
        Map<String, Object> section = Map.of("title", sectionTitle, "rows", listRows);
        Map<String, Object> interactive = new LinkedHashMap<>();
        interactive.put("type", "list");
        interactive.put("body", Map.of("text", bodyText));
        interactive.put("action", Map.of("button", buttonLabel, "sections", List.of(section)));

        Map<String, Object> payload = basePayload(to);
        payload.put("type", "interactive");
        payload.put("interactive", interactive);
        post(to, payload, "list");
    }

    private Map<String, Object> basePayload(String to) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("messaging_product", "whatsapp");
        payload.put("to", to);
        return payload;
    }

    private void post(String to, Map<String, Object> payload, String kind) {
        if (StringUtils.isAnyBlank(token, phoneNumberId)) {
            throw new MessageSendException("WhatsApp credentials not set; cannot send " + kind + " message to " + to);
        }
        String url = StringUtils.removeEnd(apiBaseUrl.trim(), "/") + "/" + phoneNumberId + "/messages";

        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(token);
        headers.setContentType(MediaType.APPLICATION_JSON);

        try {
            ResponseEntity<String> response = restTemplate.postForEntity(url, new HttpEntity<>(payload, headers), String.class);
            log.debug("[{}] Sent {} message: {} {}", to, kind, response.getStatusCode(), response.getBody());
        } catch (RestClientException e) {
            throw new MessageSendException("WhatsApp " + kind + " message to " + to + " failed: " + e.getMessage(), e);
        }
    }
}
