package herald.sse;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import herald.subscription.Subscription;
import herald.subscription.SubscriptionClosedException;
import herald.subscription.SubscriptionRegistry;

/**
 * Drains one subscriber's queue into its connection until the subscription is closed, the write fails or the thread is interrupted. The subscriber is
 * unregistered on every exit path.
 */
public class StreamLoop implements Runnable {

    public enum State {
        ACTIVE, CLOSING, TERMINATED
    }

    private static final Logger log = LoggerFactory.getLogger(StreamLoop.class);

    private final SubscriptionRegistry registry;
    private final Subscription subscription;
    private final String subscriberId;
    private final EventSink sink;
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicReference<State> state = new AtomicReference<>(State.ACTIVE);
    private volatile Throwable failure;
    private volatile long framesWritten = 0;

    public StreamLoop(SubscriptionRegistry registry, Subscription subscription, EventSink sink) {
        this.registry = registry;
        this.subscription = subscription;
        this.subscriberId = subscription.getSubscriberId();
        this.sink = sink;
    }

    @Override
    public void run() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("[" + subscriberId + "] Stream loop already ran");
        }
        log.debug("[{}] Streaming events on channel {}", subscriberId, subscription.getChannelId());
        try {
            while (true) {
                byte[] frame;
                try {
                    frame = registry.receive(subscription);
                } catch (SubscriptionClosedException e) {
                    log.debug("[{}] {}", subscriberId, e.getMessage());
                    break;
                }
                sink.write(frame);
                framesWritten++;
                registry.taskDone(subscription);
            }
        } catch (InterruptedException e) {
            log.debug("[{}] Stream cancelled", subscriberId);
            Thread.currentThread().interrupt();
        } catch (IOException e) {
            failure = e;
            log.info("[{}] Error writing to connection, closing stream: {}", subscriberId, e.getMessage());
        } catch (RuntimeException e) {
            failure = e;
            log.error("[" + subscriberId + "] Error in stream loop, closing stream", e);
        } finally {
            state.set(State.CLOSING);
            // a successor may already hold the same id, only this subscription is removed
            registry.unregister(subscription);
            try {
                sink.close();
            } finally {
                state.set(State.TERMINATED);
                log.debug("[{}] Stream terminated after {} frames", subscriberId, framesWritten);
            }
        }
    }

    public State getState() {
        return state.get();
    }

    /**
     * @return the write or runtime failure that ended the stream, null if it ended normally or was cancelled
     */
    public Throwable getFailure() {
        return failure;
    }

    public long getFramesWritten() {
        return framesWritten;
    }

    public String getSubscriberId() {
        return subscriberId;
    }

    public String getChannelId() {
        return subscription.getChannelId();
    }

    public Subscription getSubscription() {
        return subscription;
    }
}
