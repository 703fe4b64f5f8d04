package com.meltwater.rxjetstream;

import rx.Observable;

/**
 * An open subscription on one subject, as returned by {@link Client#subscribe(String)}.
 */
public interface SubjectSubscription {

    /**
     * @return the subject this subscription receives messages from
     */
    String getSubject();

    /**
     * The messages received on the subject, starting with the first message that arrived after the subscription was made.
     *
     * The observable completes when the subscription is closed or dropped by the connection, and
     * may signal an error if the connection failed.
     *
     * @return the received messages
     */
    Observable<Message> messages();

    /**
     * Checking this method should be only for information,
     * because of the race conditions - state can change after the call.
     *
     * @return true if the subscription is still registered
     */
    boolean isOpen();

    /**
     * Removes the interest in the subject and releases the resources of the subscription.
     * Calling close more than once has no effect.
     */
    void close();
}
