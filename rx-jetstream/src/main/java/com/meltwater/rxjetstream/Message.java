package com.meltwater.rxjetstream;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ListMultimap;

import java.util.Objects;

/**
 * This class wraps all the data delivered by the server for a given message.
 *
 * Messages delivered by a JetStream consumer carry a reply subject that the server set up for acknowledging them.
 * Use {@link Context#bind(Message)} to get a {@link JetStreamMessage} that can send those acknowledgments.
 */
public class Message {

    /**
     * The subject the message was published to.
     */
    public final String subject;

    /**
     * The subject to reply to, or null. For JetStream deliveries this is the ack subject of the message.
     */
    public final String replyTo;

    /**
     * The message headers, never null.
     */
    public final ImmutableListMultimap<String, String> headers;

    /**
     * The message body
     */
    public final Payload payload;

    public Message(String subject, String replyTo, ListMultimap<String, String> headers, Payload payload) {
        this.subject = Preconditions.checkNotNull(subject, "subject");
        this.replyTo = replyTo;
        this.headers = headers == null ? ImmutableListMultimap.of() : ImmutableListMultimap.copyOf(headers);
        this.payload = payload == null ? Payload.EMPTY : payload;
    }

    public Message(String subject, String replyTo, Payload payload) {
        this(subject, replyTo, null, payload);
    }

    public boolean hasReplyTo() {
        return replyTo != null && !replyTo.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Message message = (Message) o;
        return subject.equals(message.subject)
                && Objects.equals(replyTo, message.replyTo)
                && headers.equals(message.headers)
                && payload.equals(message.payload);
    }

    @Override
    public int hashCode() {
        int result = subject.hashCode();
        result = 31 * result + (replyTo != null ? replyTo.hashCode() : 0);
        result = 31 * result + headers.hashCode();
        result = 31 * result + payload.hashCode();
        return result;
    }

    @Override
    public String toString() {
        return "Message{" +
                "subject='" + subject + '\'' +
                ", replyTo='" + replyTo + '\'' +
                ", headers=" + headers +
                ", payload=" + payload +
                '}';
    }
}
