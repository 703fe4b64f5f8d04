package com.meltwater.rxjetstream;

/**
 * Factory methods for {@link Context}s.
 *
 * <pre>
 * Context jetStream = JetStream.newContext(client);
 * consumer.messages()
 *         .compose(jetStream.bindAll())
 *         .doOnNext(this::process)
 *         .flatMap(message -&gt; message.acknowledge().toObservable())
 *         .subscribe();
 * </pre>
 */
public final class JetStream {

    private JetStream() {}

    /**
     * @param client the client acknowledgments are sent with
     * @return a context using the default {@value JetStreamSettings#DEFAULT_API_PREFIX} api prefix
     */
    public static Context newContext(Client client) {
        return newContext(client, new JetStreamSettings());
    }

    public static Context newContext(Client client, JetStreamSettings settings) {
        return new Context(client, settings, new NoopAckEventListener());
    }

    /**
     * @param client the client acknowledgments are sent with
     * @param domain the JetStream domain, for example {@code hub}
     * @return a context using the {@code $JS.<domain>.API} api prefix
     */
    public static Context withDomain(Client client, String domain) {
        return newContext(client, new JetStreamSettings().withDomain(domain));
    }

    /**
     * @param client the client acknowledgments are sent with
     * @param prefix the api prefix, for example {@code JS.acc@hub.API}
     * @return a context using the given api prefix
     */
    public static Context withPrefix(Client client, String prefix) {
        return newContext(client, new JetStreamSettings().withApiPrefix(prefix));
    }
}
