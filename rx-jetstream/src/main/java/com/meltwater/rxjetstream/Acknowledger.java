package com.meltwater.rxjetstream;

import rx.Single;

import java.util.concurrent.TimeUnit;

/**
 * Used to report to the server whether processing of a delivered message succeeded or not.
 *
 * All methods return cold {@link Single}s: nothing is sent until the returned single is subscribed to,
 * and every subscription sends the acknowledgment again.
 *
 * NOTE:
 * The consuming code is expected to acknowledge a message as soon as it can. If the consumer uses an explicit
 * ack policy the server will redeliver un-acked messages when the ack wait period has passed.
 */
public interface Acknowledger {

    /**
     * Acknowledges the message with {@link AckKind#ACK}. Same as {@code acknowledgeWith(AckKind.ACK)}.
     *
     * @return a single that succeeds when the acknowledgment has been accepted for sending
     */
    Single<Void> acknowledge();

    /**
     * Sends the given kind of acknowledgment to the reply subject of the message.
     *
     * Success only means that the client accepted the message for sending, there is no confirmation from the server.
     * If the send fails the acknowledgment may or may not have reached the server, so processing must tolerate redeliveries.
     *
     * @param kind the acknowledgment to send
     * @return a single that succeeds when the acknowledgment has been accepted for sending,
     * or fails with {@link NotAcknowledgeableException} or the transport error
     */
    Single<Void> acknowledgeWith(AckKind kind);

    /**
     * Acknowledges the message with {@link AckKind#ACK} and waits until the server confirms that it got the acknowledgment.
     * Useful for exactly once processing.
     *
     * There is no built in timeout, if the server never replies the returned single never terminates.
     * Callers that need a deadline should add one, for example:
     * <pre>
     * message.confirm().timeout(5, TimeUnit.SECONDS)
     * </pre>
     * Unsubscribing releases the inbox subscription used for the confirmation.
     *
     * @return a single that succeeds when the server has confirmed, or fails with {@link NotAcknowledgeableException},
     * {@link ConfirmationLostException} or the transport error
     * @see Single#timeout(long, TimeUnit)
     */
    Single<Void> confirm();
}
