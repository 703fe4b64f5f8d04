package com.meltwater.rxjetstream;

/**
 * Listener that get notified about acknowledgments sent for {@link JetStreamMessage}s
 *
 * The methods are called on the thread that runs the acknowledgment.
 */
public interface AckEventListener {

    default void beforeAck(JetStreamMessage message, AckKind kind){}

    default void afterAck(JetStreamMessage message, AckKind kind){}

    default void afterFailedAck(JetStreamMessage message, AckKind kind, Throwable error){}

    default void confirmed(JetStreamMessage message, long confirmMillis){}

    default void confirmationLost(JetStreamMessage message, Throwable error){}
}
