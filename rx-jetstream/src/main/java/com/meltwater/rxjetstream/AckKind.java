package com.meltwater.rxjetstream;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * The kinds of response used for acknowledging a processed {@link JetStreamMessage}.
 *
 * Each kind is sent as the complete body of a message published to the reply subject of the delivered message.
 *
 * @see Acknowledger#acknowledgeWith(AckKind)
 */
public enum AckKind {

    /**
     * Acknowledges that the message was completely handled.
     */
    ACK("+ACK"),

    /**
     * Signals that the message will not be processed now. The server will redeliver it
     * according to the redelivery policy and backoff of the consumer.
     */
    NAK("-NAK"),

    /**
     * When sent before the ack wait period has passed it tells the server that work is ongoing,
     * and the period is extended by another ack wait.
     */
    PROGRESS("+WPI"),

    /**
     * Acknowledges the message and requests delivery of the next message to the reply subject.
     * Only applies to pull consumers.
     */
    NEXT("+NXT"),

    /**
     * Instructs the server to stop redelivery of the message without acknowledging it as successfully processed.
     */
    TERM("+TERM");

    private final String token;
    private final byte[] bytes;

    AckKind(String token) {
        this.token = token;
        this.bytes = token.getBytes(StandardCharsets.US_ASCII);
    }

    /**
     * @return the wire token of this kind, for example {@code +ACK}
     */
    public String token() {
        return token;
    }

    /**
     * @return a new array holding the exact wire bytes of this kind
     */
    public byte[] encode() {
        return bytes.clone();
    }

    public Payload payload() {
        return new Payload(bytes);
    }

    /**
     * Maps wire bytes back to the kind they represent.
     *
     * @param token the bytes received on a reply subject
     * @return the matching kind
     * @throws IllegalArgumentException if the bytes are not one of the known tokens
     */
    public static AckKind decode(byte[] token) {
        for (AckKind kind : values()) {
            if (Arrays.equals(kind.bytes, token)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown ack token: " + new String(token, StandardCharsets.US_ASCII));
    }

    @Override
    public String toString() {
        return token;
    }
}
