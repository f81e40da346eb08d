package com.ai.quizbot.dto;

import java.util.Collections;
import java.util.List;

/**
 * Provider-neutral outbound message. No transport detail: the Messenger maps
 * each kind onto the matching provider call.
 */
public final class RenderedMessage {

    public enum Kind {
        TEXT,
        BUTTONS,
        LIST
    }

    /** Provider limit on reply buttons per message. */
    public static final int MAX_BUTTONS = 3;

    private final Kind kind;
    private final String body;
    private final String buttonLabel;
    private final String sectionTitle;
    private final List<ReplyOption> options;

    private RenderedMessage(Kind kind, String body, String buttonLabel, String sectionTitle,
                            List<ReplyOption> options) {
        this.kind = kind;
        this.body = body != null ? body : "";
        this.buttonLabel = buttonLabel;
        this.sectionTitle = sectionTitle;
        this.options = options == null ? Collections.emptyList() : List.copyOf(options);
    }

    public static RenderedMessage text(String body) {
        return new RenderedMessage(Kind.TEXT, body, null, null, null);
    }

    public static RenderedMessage buttons(String body, List<ReplyOption> buttons) {
        if (buttons == null || buttons.isEmpty() || buttons.size() > MAX_BUTTONS) {
            throw new IllegalArgumentException("Button messages need 1.." + MAX_BUTTONS + " buttons");
        }
        return new RenderedMessage(Kind.BUTTONS, body, null, null, buttons);
    }

    public static RenderedMessage list(String body, String buttonLabel, String sectionTitle, List<ReplyOption> rows) {
        if (rows == null || rows.isEmpty()) {
            throw new IllegalArgumentException("List messages need at least one row");
        }
        return new RenderedMessage(Kind.LIST, body, buttonLabel, sectionTitle, rows);
    }

    public Kind getKind() {
        return kind;
    }

    public String getBody() {
        return body;
    }

    public String getButtonLabel() {
        return buttonLabel;
    }

    public String getSectionTitle() {
        return sectionTitle;
    }

    public List<ReplyOption> getOptions() {
        return options;
    }

    @Override
    public String toString() {
        return kind + "[" + body.replace('\n', ' ') + "] " + options;
    }
}
