package com.ai.quizbot.conversation;

/**
 * Result of parsing one inbound webhook delivery. The engine dispatches on
 * {@link Type} instead of probing the raw payload.
 */
public final class ParsedEvent {

    public enum Type {
        /** Plain text message. */
        TEXT,
        /** Button or list selection carrying an opaque reply id. */
        INTERACTIVE_REPLY,
        /** Well-formed message of a type the quiz does not interpret (image, audio, ...). */
        OTHER_MESSAGE,
        /** Payload missing the shape needed to route it; ignored. */
        UNRECOGNIZED
    }

    private final Type type;
    private final String userId;
    private final String text;
    private final String replyId;
    private final String reason;

    private ParsedEvent(Type type, String userId, String text, String replyId, String reason) {
        this.type = type;
        this.userId = userId;
        this.text = text;
        this.replyId = replyId;
        this.reason = reason;
    }

    public static ParsedEvent text(String userId, String body) {
        return new ParsedEvent(Type.TEXT, userId, body != null ? body : "", null, null);
    }

    public static ParsedEvent interactiveReply(String userId, String replyId) {
        return new ParsedEvent(Type.INTERACTIVE_REPLY, userId, null, replyId, null);
    }

    public static ParsedEvent otherMessage(String userId, String messageType) {
        return new ParsedEvent(Type.OTHER_MESSAGE, userId, null, null, messageType);
    }

    public static ParsedEvent unrecognized(String reason) {
        return new ParsedEvent(Type.UNRECOGNIZED, null, null, null, reason);
    }

    public Type getType() {
        return type;
    }

    public String getUserId() {
        return userId;
    }

    public String getText() {
        return text;
    }

    public String getReplyId() {
        return replyId;
    }

    /** Why the event was not recognised, or the raw message type for OTHER_MESSAGE. */
    public String getReason() {
        return reason;
    }

    public boolean isRoutable() {
        return type != Type.UNRECOGNIZED;
    }

    @Override
    public String toString() {
        switch (type) {
            case TEXT:
                return "TEXT from " + userId;
            case INTERACTIVE_REPLY:
                return "REPLY '" + replyId + "' from " + userId;
            case OTHER_MESSAGE:
                return "OTHER(" + reason + ") from " + userId;
            default:
                return "UNRECOGNIZED(" + reason + ")";
        }
    }
}
