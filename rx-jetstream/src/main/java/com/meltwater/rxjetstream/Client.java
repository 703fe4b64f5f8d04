package com.meltwater.rxjetstream;

import rx.Single;

import java.io.IOException;

/**
 * The core messaging operations that acknowledgments are sent with.
 *
 * Connection handling, reconnects and subject routing are the responsibility of the implementation.
 * One client is shared by every {@link JetStreamMessage} bound to a {@link Context}, so implementations
 * must allow concurrent calls of all methods without external locking.
 *
 * NOTE to implementors: It is expected that calls to these methods return (almost) immediately
 * without doing any blocking IO on the calling thread.
 */
public interface Client {

    /**
     * Publishes a message without reply subject.
     *
     * @param subject the subject to publish to
     * @param payload the message body
     *
     * @return a {@link Single} that returns a Void value when the message has been accepted for sending,
     * or an exception (typically an {@link IOException}) if the transport failed.
     */
    Single<Void> publish(String subject, Payload payload);

    /**
     * Publishes a message and sets its reply subject.
     *
     * @param subject the subject to publish to
     * @param replyTo the subject the receiver should reply to
     * @param payload the message body
     *
     * @return a {@link Single} that returns a Void value when the message has been accepted for sending,
     * or an exception if the transport failed.
     */
    Single<Void> publishWithReply(String subject, String replyTo, Payload payload);

    /**
     * Registers interest in a subject. Messages that arrive after this method has returned are
     * buffered until they are read through {@link SubjectSubscription#messages()}.
     *
     * @param subject the subject to subscribe to
     * @return the open subscription, owned by the caller
     * @throws IOException if the subscription could not be registered
     */
    SubjectSubscription subscribe(String subject) throws IOException;

    /**
     * @return a new inbox subject that is unique for this client, also under concurrent calls
     */
    String newInbox();
}
