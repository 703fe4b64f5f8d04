package com.meltwater.rxjetstream;

import org.junit.Before;
import org.junit.Test;
import rx.Observable;
import rx.Single;
import rx.Subscription;
import rx.observers.TestSubscriber;
import rx.schedulers.Schedulers;

import java.io.IOException;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static com.meltwater.rxjetstream.JetStreamMessageTest.run;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;

public class ConfirmTest {

    private static final String REPLY = "$JS.ACK.orders.durable.1.10.10.1700000000000000000.0";

    private RecordingClient client;
    private JetStreamMessageTest.RecordingAckEventListener listener;
    private Context context;

    @Before
    public void setup() throws Exception {
        client = new RecordingClient();
        listener = new JetStreamMessageTest.RecordingAckEventListener();
        context = JetStream.newContext(client).withAckEventListener(listener);
    }

    @Test
    public void subscribes_to_a_new_inbox_before_publishing_the_ack() throws Exception {
        client.withAutoConfirm(true);

        TestSubscriber<Void> result = run(jetStreamMessage().confirm());

        result.assertNoErrors();
        result.assertCompleted();
        assertThat(client.getMethods(), contains("newInbox", "subscribe", "publishWithReply"));
        String inbox = client.getCalls("newInbox").get(0).subject;
        assertThat(client.getCalls("subscribe").get(0).subject, equalTo(inbox));
        RecordingClient.Call ack = client.getCalls("publishWithReply").get(0);
        assertThat(ack.subject, equalTo(REPLY));
        assertThat(ack.replyTo, equalTo(inbox));
        assertThat(ack.body(), equalTo("+ACK"));
    }

    @Test
    public void succeeds_when_any_message_arrives_on_the_inbox() throws Exception {
        TestSubscriber<Void> result = new TestSubscriber<>();
        jetStreamMessage().confirm().subscribe(result);

        result.assertNoTerminalEvent();
        RecordingClient.RecordingSubscription inbox = onlySubscription();
        inbox.deliver(new Message(inbox.getSubject(), null, Payload.of("anything at all")));

        result.awaitTerminalEvent(5, TimeUnit.SECONDS);
        result.assertNoErrors();
        result.assertCompleted();
        assertFalse(inbox.isOpen());
        assertThat(listener.events, contains("beforeAck:+ACK", "afterAck:+ACK", "confirmed"));
    }

    @Test
    public void fails_with_confirmation_lost_when_the_inbox_closes_without_message() throws Exception {
        TestSubscriber<Void> result = new TestSubscriber<>();
        jetStreamMessage().confirm().subscribe(result);

        RecordingClient.RecordingSubscription inbox = onlySubscription();
        inbox.close();

        result.awaitTerminalEvent(5, TimeUnit.SECONDS);
        result.assertError(ConfirmationLostException.class);
        ConfirmationLostException error = (ConfirmationLostException) result.getOnErrorEvents().get(0);
        assertThat(error.getReplyTo(), equalTo(REPLY));
        assertThat(error.getInbox(), equalTo(inbox.getSubject()));
        assertThat(listener.events, contains("beforeAck:+ACK", "afterAck:+ACK", "confirmationLost:ConfirmationLostException"));
    }

    @Test
    public void fails_with_confirmation_lost_when_the_inbox_is_dropped() throws Exception {
        TestSubscriber<Void> result = new TestSubscriber<>();
        jetStreamMessage().confirm().subscribe(result);

        RecordingClient.RecordingSubscription inbox = onlySubscription();
        IOException dropped = new IOException("connection reset");
        inbox.drop(dropped);

        result.awaitTerminalEvent(5, TimeUnit.SECONDS);
        result.assertError(ConfirmationLostException.class);
        assertThat(result.getOnErrorEvents().get(0).getCause(), sameInstance((Throwable) dropped));
        assertThat(inbox.getCloseCalls(), is(1));
    }

    @Test
    public void propagates_subscribe_errors_without_publishing() throws Exception {
        IOException subscribeError = new IOException("not connected");
        client.withSubscribeError(subscribeError);

        TestSubscriber<Void> result = run(jetStreamMessage().confirm());

        result.assertError(IOException.class);
        assertThat(result.getOnErrorEvents().get(0), sameInstance((Throwable) subscribeError));
        assertThat(client.getMethods(), contains("newInbox", "subscribe"));
    }

    @Test
    public void propagates_publish_errors_and_closes_the_inbox() throws Exception {
        IOException publishError = new IOException("write failed");
        client.withPublishError(publishError);

        TestSubscriber<Void> result = run(jetStreamMessage().confirm());

        result.assertError(IOException.class);
        assertThat(result.getOnErrorEvents().get(0), sameInstance((Throwable) publishError));
        assertFalse(onlySubscription().isOpen());
        assertThat(listener.events, contains("beforeAck:+ACK", "afterFailedAck:+ACK:write failed"));
    }

    @Test
    public void unsubscribing_closes_the_inbox() throws Exception {
        TestSubscriber<Void> result = new TestSubscriber<>();
        Subscription subscription = jetStreamMessage().confirm().subscribe(result);

        RecordingClient.RecordingSubscription inbox = onlySubscription();
        assertTrue(inbox.isOpen());
        subscription.unsubscribe();

        assertFalse(inbox.isOpen());
        result.assertNoTerminalEvent();
    }

    @Test
    public void unsubscribing_while_the_ack_is_being_sent_closes_the_inbox() throws Exception {
        client.withHeldPublishes(true);
        TestSubscriber<Void> result = new TestSubscriber<>();
        Subscription subscription = jetStreamMessage().confirm().subscribe(result);

        RecordingClient.RecordingSubscription inbox = onlySubscription();
        assertThat(client.getPendingPublishes(), is(1));
        subscription.unsubscribe();

        assertThat(client.getPendingPublishes(), is(0));
        assertFalse(inbox.isOpen());
        assertThat(inbox.getCloseCalls(), is(1));

        client.releasePublishes();
        result.assertNoTerminalEvent();
        assertThat(listener.events, contains("beforeAck:+ACK"));
    }

    @Test
    public void waits_for_the_server_without_timeout_of_its_own() throws Exception {
        TestSubscriber<Void> result = new TestSubscriber<>();
        jetStreamMessage().confirm().subscribe(result);

        result.awaitTerminalEvent(300, TimeUnit.MILLISECONDS);
        result.assertNoTerminalEvent();
        assertTrue(onlySubscription().isOpen());
    }

    @Test
    public void a_caller_timeout_releases_the_inbox() throws Exception {
        TestSubscriber<Void> result = run(jetStreamMessage().confirm().timeout(100, TimeUnit.MILLISECONDS));

        result.assertError(TimeoutException.class);
        awaitClosed(onlySubscription());
        assertFalse(onlySubscription().isOpen());
    }

    @Test
    public void closes_the_inbox_once_confirmed() throws Exception {
        client.withAutoConfirm(true);

        run(jetStreamMessage().confirm()).assertCompleted();

        assertFalse(onlySubscription().isOpen());
    }

    @Test
    public void concurrent_confirms_use_distinct_inboxes() throws Exception {
        client.withAutoConfirm(true);
        int nrMessages = 200;

        TestSubscriber<Void> result = new TestSubscriber<>();
        Observable.range(0, nrMessages)
                .flatMap(i -> context.bind(new Message("orders.created", REPLY + "." + i, Payload.of("order-" + i)))
                        .confirm()
                        .subscribeOn(Schedulers.io())
                        .toObservable())
                .subscribe(result);

        result.awaitTerminalEvent(10, TimeUnit.SECONDS);
        result.assertNoErrors();
        result.assertValueCount(nrMessages);

        List<RecordingClient.Call> acks = client.getCalls("publishWithReply");
        Set<String> inboxes = new HashSet<>();
        for (RecordingClient.Call ack : acks) {
            inboxes.add(ack.replyTo);
        }
        assertThat(acks.size(), is(nrMessages));
        assertThat(inboxes.size(), is(nrMessages));
        for (RecordingClient.RecordingSubscription subscription : client.getSubscriptions()) {
            assertFalse(subscription.isOpen());
        }
    }

    @Test
    public void every_subscription_confirms_again() throws Exception {
        client.withAutoConfirm(true);
        Single<Void> confirm = jetStreamMessage().confirm();

        run(confirm).assertCompleted();
        run(confirm).assertCompleted();

        assertThat(client.getCalls("newInbox").size(), is(2));
        assertThat(client.getCalls("publishWithReply").get(0).replyTo,
                is(client.getCalls("newInbox").get(0).subject));
        assertThat(client.getCalls("publishWithReply").get(1).replyTo,
                is(client.getCalls("newInbox").get(1).subject));
    }

    @Test
    public void confirmation_lost_is_an_io_exception() throws Exception {
        assertThat(new ConfirmationLostException(REPLY, "_INBOX.1"), instanceOf(IOException.class));
    }

    private JetStreamMessage jetStreamMessage() {
        return context.bind(new Message("orders.created", REPLY, Payload.of("order")));
    }

    private static void awaitClosed(RecordingClient.RecordingSubscription subscription) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5_000;
        while (subscription.isOpen() && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
    }

    private RecordingClient.RecordingSubscription onlySubscription() {
        List<RecordingClient.RecordingSubscription> subscriptions = client.getSubscriptions();
        assertThat(subscriptions.size(), is(1));
        return subscriptions.get(0);
    }
}
