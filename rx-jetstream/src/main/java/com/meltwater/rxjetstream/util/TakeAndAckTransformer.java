package com.meltwater.rxjetstream.util;

import com.meltwater.rxjetstream.JetStreamMessage;
import rx.Observable;
import rx.Scheduler;
import rx.Subscriber;
import rx.functions.Func1;
import rx.schedulers.Schedulers;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * This transformer can be used if you want to read from a JetStream consumer 'for a while' and then stop reading, either
 * because there are no messages seen within a given timeout, or because the desired number of messages has been consumed.
 *
 * When either of the above conditions are satisfied, then the transformed observable will complete and the
 * source observable will be {@link Subscriber#unsubscribe()} from.
 *
 * It is possible to give 0 or a negative number for the max seen messages parameter which is interpreted as infinity.
 *
 * Also note that the messages that are sent to the transformed observable will be acknowledged with
 * {@link JetStreamMessage#acknowledge()} before they are passed on. The timeout is measured between messages of the
 * source, the time spent acknowledging does not count towards it. A failed acknowledgment terminates the
 * transformed observable with the error.
 *
 * @see Observable#takeUntil(Func1)
 */
public class TakeAndAckTransformer implements Observable.Transformer<JetStreamMessage, JetStreamMessage> {

    private final long takeMax;
    private final long timeout;
    private final TimeUnit timeUnit;
    private final Scheduler scheduler;

    /**
     * @param takeMax
     *            the maximum number of messages to take before completing
     *            If 0 or a negative number is given for the takeMax it means to continue consuming forever until either the
     *            timeout occurs or some other error condition is encountered.
     * @param timeoutMillis
     *            maximum duration (in millis) between emitted items before a timeout occurs and the source observable is unsubscribed from
     */
    public TakeAndAckTransformer(long takeMax, long timeoutMillis) {
        this(takeMax, timeoutMillis, TimeUnit.MILLISECONDS);
    }

    /**
     * @param timeout
     *            maximum duration between emitted items before a timeout occurs and the source observable is unsubscribed from
     * @param timeUnit
     *            the unit of time that applies to the {@code timeout} argument.
     */
    public TakeAndAckTransformer(long timeout, TimeUnit timeUnit) {
        this(0, timeout, timeUnit);
    }

    public TakeAndAckTransformer(long takeMax, long timeout, TimeUnit timeUnit) {
        this(takeMax, timeout, timeUnit, Schedulers.computation());
    }

    /**
     * @param takeMax
     *            the maximum number of messages to take before completing.
     * @param timeout
     *            maximum duration between emitted items before a timeout occurs and the source observable is unsubscribed from
     * @param timeUnit
     *            the unit of time that applies to the {@code timeout} argument.
     * @param scheduler
     *            the scheduler the idle timeout is measured on
     */
    public TakeAndAckTransformer(long takeMax, long timeout, TimeUnit timeUnit, Scheduler scheduler) {
        if (timeout <= 0) {
            throw new IllegalArgumentException("timeout must be positive, was " + timeout);
        }
        this.timeout = timeout;
        this.timeUnit = timeUnit;
        this.takeMax = takeMax;
        this.scheduler = scheduler;
    }

    @Override
    public Observable<JetStreamMessage> call(Observable<JetStreamMessage> input) {
        final AtomicLong consumedCount = new AtomicLong(0);
        // idle time is measured on the source only
        Observable<JetStreamMessage> acked = input
                .timeout(timeout, timeUnit, Observable.empty(), scheduler)
                .concatMap(message -> message.acknowledge()
                        .toObservable()
                        .map(sent -> message));
        if (takeMax <= 0) {
            return acked;
        }
        return acked.takeUntil(message -> consumedCount.incrementAndGet() >= takeMax);
    }
}
