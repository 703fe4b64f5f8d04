package com.meltwater.rxjetstream;

import java.io.IOException;

/**
 * Thrown by {@link Acknowledger#confirm()} when the inbox subscription ended before the server confirmed the acknowledgment.
 *
 * The acknowledgment may still have been processed by the server.
 */
public class ConfirmationLostException extends IOException {

    private final String replyTo;
    private final String inbox;

    public ConfirmationLostException(String replyTo, String inbox) {
        this(replyTo, inbox, null);
    }

    public ConfirmationLostException(String replyTo, String inbox, Throwable cause) {
        super("Inbox subscription ended without confirmation. replyTo=" + replyTo + ", inbox=" + inbox, cause);
        this.replyTo = replyTo;
        this.inbox = inbox;
    }

    public String getReplyTo() {
        return replyTo;
    }

    public String getInbox() {
        return inbox;
    }
}
