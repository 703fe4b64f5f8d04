package com.meltwater.rxjetstream;

import com.google.common.base.Splitter;

import java.util.List;

/**
 * Delivery metadata of a JetStream message, as encoded by the server in the reply subject of the message.
 *
 * Two layouts are understood:
 * <pre>
 * $JS.ACK.&lt;stream&gt;.&lt;consumer&gt;.&lt;delivered&gt;.&lt;streamSeq&gt;.&lt;consumerSeq&gt;.&lt;timestamp&gt;.&lt;pending&gt;
 * $JS.ACK.&lt;domain&gt;.&lt;accountHash&gt;.&lt;stream&gt;.&lt;consumer&gt;.&lt;delivered&gt;.&lt;streamSeq&gt;.&lt;consumerSeq&gt;.&lt;timestamp&gt;.&lt;pending&gt;[.&lt;token&gt;...]
 * </pre>
 *
 * @see JetStreamMessage#info()
 */
public class MessageInfo {

    private static final Splitter SUBJECT_SPLITTER = Splitter.on('.');

    private static final int V1_TOKENS = 9;
    private static final int V2_MIN_TOKENS = 11;
    private static final String NO_DOMAIN = "_";

    public final String domain;
    public final String stream;
    public final String consumer;
    public final long delivered;
    public final long streamSequence;
    public final long consumerSequence;
    public final long timestampNanos;
    public final long pending;

    public MessageInfo(String domain,
                       String stream,
                       String consumer,
                       long delivered,
                       long streamSequence,
                       long consumerSequence,
                       long timestampNanos,
                       long pending) {
        this.domain = domain;
        this.stream = stream;
        this.consumer = consumer;
        this.delivered = delivered;
        this.streamSequence = streamSequence;
        this.consumerSequence = consumerSequence;
        this.timestampNanos = timestampNanos;
        this.pending = pending;
    }

    /**
     * @param replySubject the reply subject of a delivered message
     * @return the metadata encoded in the subject
     * @throws IllegalArgumentException if the subject is not a JetStream ack subject
     */
    public static MessageInfo parse(String replySubject) {
        List<String> tokens = SUBJECT_SPLITTER.splitToList(replySubject);
        if (tokens.size() < V1_TOKENS
                || (tokens.size() > V1_TOKENS && tokens.size() < V2_MIN_TOKENS)
                || !"$JS".equals(tokens.get(0))
                || !"ACK".equals(tokens.get(1))) {
            throw new IllegalArgumentException("Not a JetStream ack subject: " + replySubject);
        }
        String domain = null;
        int offset = 2;
        if (tokens.size() >= V2_MIN_TOKENS) {
            domain = NO_DOMAIN.equals(tokens.get(2)) ? null : tokens.get(2);
            offset = 4;
        }
        try {
            return new MessageInfo(
                    domain,
                    tokens.get(offset),
                    tokens.get(offset + 1),
                    Long.parseLong(tokens.get(offset + 2)),
                    Long.parseLong(tokens.get(offset + 3)),
                    Long.parseLong(tokens.get(offset + 4)),
                    Long.parseLong(tokens.get(offset + 5)),
                    Long.parseLong(tokens.get(offset + 6)));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Malformed JetStream ack subject: " + replySubject, e);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        MessageInfo that = (MessageInfo) o;
        if (delivered != that.delivered) return false;
        if (streamSequence != that.streamSequence) return false;
        if (consumerSequence != that.consumerSequence) return false;
        if (timestampNanos != that.timestampNanos) return false;
        if (pending != that.pending) return false;
        if (domain != null ? !domain.equals(that.domain) : that.domain != null) return false;
        return stream.equals(that.stream) && consumer.equals(that.consumer);
    }

    @Override
    public int hashCode() {
        int result = domain != null ? domain.hashCode() : 0;
        result = 31 * result + stream.hashCode();
        result = 31 * result + consumer.hashCode();
        result = 31 * result + (int) (delivered ^ (delivered >>> 32));
        result = 31 * result + (int) (streamSequence ^ (streamSequence >>> 32));
        result = 31 * result + (int) (consumerSequence ^ (consumerSequence >>> 32));
        result = 31 * result + (int) (timestampNanos ^ (timestampNanos >>> 32));
        result = 31 * result + (int) (pending ^ (pending >>> 32));
        return result;
    }

    @Override
    public String toString() {
        return "{" +
                "domain:'" + domain + "'" +
                ", stream:'" + stream + "'" +
                ", consumer:'" + consumer + "'" +
                ", delivered:" + delivered +
                ", stream_sequence:" + streamSequence +
                ", consumer_sequence:" + consumerSequence +
                ", timestamp_nanos:" + timestampNanos +
                ", pending:" + pending +
                '}';
    }
}
