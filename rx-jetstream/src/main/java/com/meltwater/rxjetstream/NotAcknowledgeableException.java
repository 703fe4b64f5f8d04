package com.meltwater.rxjetstream;

/**
 * Signals an attempt to acknowledge a message that has no reply subject.
 * Such messages did not come from a JetStream consumer and the server has nowhere to receive the acknowledgment.
 */
public class NotAcknowledgeableException extends IllegalStateException {

    private final String subject;

    public NotAcknowledgeableException(String subject) {
        super("No reply subject, not a JetStream message. subject=" + subject);
        this.subject = subject;
    }

    /**
     * @return the subject of the message that could not be acknowledged
     */
    public String getSubject() {
        return subject;
    }
}
