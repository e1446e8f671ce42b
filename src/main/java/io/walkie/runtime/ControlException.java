package io.walkie.runtime;

/**
 * A request the daemon refuses without any state change. The message is the text
 * returned to the local client as {@code error}.
 */
public final class ControlException extends RuntimeException {
    private final Reason reason;

    public ControlException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public static ControlException notInChannel(String channel) {
        return new ControlException(Reason.NOT_IN_CHANNEL, "Not in channel: " + channel);
    }

    public static ControlException messageTooLarge(int maxBytes) {
        return new ControlException(Reason.MESSAGE_TOO_LARGE, "Message too large (max " + (maxBytes / 1024) + "KB)");
    }

    public static ControlException unknownAction(String action) {
        return new ControlException(Reason.UNKNOWN_ACTION, "Unknown action: " + action);
    }

    public static ControlException badRequest(String message) {
        return new ControlException(Reason.BAD_REQUEST, message);
    }

    public Reason reason() {
        return reason;
    }

    public enum Reason {
        NOT_IN_CHANNEL,
        MESSAGE_TOO_LARGE,
        UNKNOWN_ACTION,
        BAD_REQUEST
    }
}
