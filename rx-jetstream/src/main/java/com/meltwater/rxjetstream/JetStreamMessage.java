package com.meltwater.rxjetstream;

import com.google.common.base.Preconditions;
import com.meltwater.rxjetstream.util.Logger;
import rx.Observable;
import rx.Single;

/**
 * A {@link Message} delivered by a JetStream consumer together with the {@link Context} that delivered it.
 *
 * The acknowledgments are sent to the reply subject of the message, which the server created for exactly that purpose.
 * A message without reply subject can not be acknowledged and all acknowledgments of it fail with a
 * {@link NotAcknowledgeableException} without any interaction with the {@link Client}.
 *
 * @see Context#bind(Message)
 */
public class JetStreamMessage implements Acknowledger {

    private final static Logger log = new Logger(JetStreamMessage.class);

    /**
     * The message as it was delivered.
     */
    public final Message message;

    /**
     * The context that delivered the message. It is shared with all other messages of the same context.
     */
    public final Context context;

    JetStreamMessage(Message message, Context context) {
        this.message = Preconditions.checkNotNull(message, "message");
        this.context = Preconditions.checkNotNull(context, "context");
    }

    /**
     * @return the delivery metadata encoded in the reply subject
     * @throws NotAcknowledgeableException if the message has no reply subject
     * @throws IllegalArgumentException if the reply subject is not a JetStream ack subject
     */
    public MessageInfo info() {
        if (!message.hasReplyTo()) {
            throw new NotAcknowledgeableException(message.subject);
        }
        return MessageInfo.parse(message.replyTo);
    }

    @Override
    public Single<Void> acknowledge() {
        return acknowledgeWith(AckKind.ACK);
    }

    @Override
    public Single<Void> acknowledgeWith(final AckKind kind) {
        Preconditions.checkNotNull(kind, "kind");
        if (!message.hasReplyTo()) {
            return notAcknowledgeable();
        }
        final String replyTo = message.replyTo;
        final Client client = context.getClient();
        final AckEventListener listener = context.getAckEventListener();
        return Single.defer(() -> {
            listener.beforeAck(this, kind);
            log.traceWithParams("Sending acknowledgment.",
                    "kind", kind,
                    "subject", message.subject,
                    "replyTo", replyTo);
            return client.publish(replyTo, kind.payload())
                    .doOnSuccess(sent -> listener.afterAck(this, kind))
                    .doOnError(error -> onFailedAck(kind, replyTo, error));
        });
    }

    @Override
    public Single<Void> confirm() {
        if (!message.hasReplyTo()) {
            return notAcknowledgeable();
        }
        final String replyTo = message.replyTo;
        final Client client = context.getClient();
        final AckEventListener listener = context.getAckEventListener();
        return Single.defer(() -> {
            final long confirmStart = System.currentTimeMillis();
            final String inbox = client.newInbox();
            // the inbox must be subscribed before the ack is sent, otherwise the confirmation can arrive unobserved
            final SubjectSubscription subscription = client.subscribe(inbox);
            log.traceWithParams("Sending acknowledgment and waiting for confirmation.",
                    "subject", message.subject,
                    "replyTo", replyTo,
                    "inbox", inbox);
            return Observable.<Void, SubjectSubscription>using(
                    () -> subscription,
                    sub -> sendAndAwaitConfirmation(client, listener, replyTo, sub),
                    SubjectSubscription::close,
                    true)
                    .toSingle()
                    .doOnSuccess(confirmed -> {
                        long confirmMillis = System.currentTimeMillis() - confirmStart;
                        log.traceWithParams("Acknowledgment confirmed.",
                                "replyTo", replyTo,
                                "confirmMillis", confirmMillis);
                        listener.confirmed(this, confirmMillis);
                    });
        });
    }

    private Observable<Void> sendAndAwaitConfirmation(Client client,
                                                      AckEventListener listener,
                                                      String replyTo,
                                                      SubjectSubscription subscription) {
        final String inbox = subscription.getSubject();
        listener.beforeAck(this, AckKind.ACK);
        return client.publishWithReply(replyTo, inbox, AckKind.ACK.payload())
                .doOnSuccess(sent -> listener.afterAck(this, AckKind.ACK))
                .doOnError(error -> onFailedAck(AckKind.ACK, replyTo, error))
                .toObservable()
                .concatMap(sent -> subscription.messages()
                        .take(1)
                        .onErrorResumeNext(error -> Observable.<Message>error(new ConfirmationLostException(replyTo, inbox, error)))
                        .switchIfEmpty(Observable.defer(() -> Observable.<Message>error(new ConfirmationLostException(replyTo, inbox))))
                        .doOnError(error -> {
                            log.warnWithParams("Inbox subscription ended before the acknowledgment was confirmed.", error,
                                    "subject", message.subject,
                                    "replyTo", replyTo,
                                    "inbox", inbox);
                            listener.confirmationLost(this, error);
                        })
                        .map(confirmation -> (Void) null));
    }

    private void onFailedAck(AckKind kind, String replyTo, Throwable error) {
        log.warnWithParams("Failed to send acknowledgment. It may or may not have reached the server.", error,
                "kind", kind,
                "subject", message.subject,
                "replyTo", replyTo);
        context.getAckEventListener().afterFailedAck(this, kind, error);
    }

    private Single<Void> notAcknowledgeable() {
        return Single.defer(() -> {
            log.debugWithParams("Refusing to acknowledge message without reply subject.",
                    "subject", message.subject);
            return Single.error(new NotAcknowledgeableException(message.subject));
        });
    }

    @Override
    public String toString() {
        return "JetStreamMessage{" +
                "message=" + message +
                '}';
    }
}
