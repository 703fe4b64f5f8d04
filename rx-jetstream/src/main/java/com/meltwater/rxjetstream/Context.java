package com.meltwater.rxjetstream;

import com.google.common.base.Preconditions;
import com.meltwater.rxjetstream.util.Logger;
import rx.Observable;

/**
 * Entry point of the JetStream api. A context binds delivered {@link Message}s to the {@link Client} that their
 * acknowledgments are sent with.
 *
 * A context is immutable and is shared by every {@link JetStreamMessage} it binds.
 *
 * @see JetStream
 */
public class Context {

    private final static Logger log = new Logger(Context.class);

    private final Client client;
    private final String apiPrefix;
    private final AckEventListener ackEventListener;

    Context(Client client, JetStreamSettings settings, AckEventListener ackEventListener) {
        this(client, Preconditions.checkNotNull(settings, "settings").resolveApiPrefix(), ackEventListener);
    }

    private Context(Client client, String apiPrefix, AckEventListener ackEventListener) {
        this.client = Preconditions.checkNotNull(client, "client");
        this.apiPrefix = apiPrefix;
        this.ackEventListener = Preconditions.checkNotNull(ackEventListener, "ackEventListener");
        log.debugWithParams("Created JetStream context.",
                "apiPrefix", apiPrefix,
                "ackEventListener", ackEventListener);
    }

    public Client getClient() {
        return client;
    }

    public String getApiPrefix() {
        return apiPrefix;
    }

    public AckEventListener getAckEventListener() {
        return ackEventListener;
    }

    /**
     * @param ackEventListener listener that will be notified about the acknowledgments of messages bound to the new context
     * @return a copy of this context using the given listener
     */
    public Context withAckEventListener(AckEventListener ackEventListener) {
        return new Context(client, apiPrefix, ackEventListener);
    }

    /**
     * Wraps a message delivered by a JetStream consumer so that it can be acknowledged through this context.
     *
     * @param message the delivered message
     * @return the message bound to this context
     */
    public JetStreamMessage bind(Message message) {
        return new JetStreamMessage(message, this);
    }

    /**
     * @return a transformer that binds every message of a stream of deliveries to this context
     */
    public Observable.Transformer<Message, JetStreamMessage> bindAll() {
        return messages -> messages.map(this::bind);
    }

    @Override
    public String toString() {
        return "Context{" +
                "apiPrefix='" + apiPrefix + '\'' +
                ", client=" + client +
                '}';
    }
}
