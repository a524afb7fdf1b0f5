package herald.subscription;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Unbounded FIFO of frames for a single consumer. Offering never blocks, so a stalled consumer grows memory until its connection is torn down.
 */
public class SubscriberQueue {

    private final BlockingQueue<Frame> queue = new LinkedBlockingQueue<>();
    private final AtomicLong unfinished = new AtomicLong(0);

    /**
     * Adds a frame. The close marker is not counted as unfinished work.
     */
    public boolean offer(Frame frame) {
        if (!frame.isClose()) {
            unfinished.incrementAndGet();
        }
        return queue.offer(frame);
    }

    public Frame take() throws InterruptedException {
        return queue.take();
    }

    public Frame poll(long timeout, TimeUnit unit) throws InterruptedException {
        return queue.poll(timeout, unit);
    }

    /**
     * Marks one previously taken frame as processed.
     *
     * @throws IllegalStateException
     *             if called more times than frames were offered
     */
    public void taskDone() {
        long previous = unfinished.getAndUpdate(v -> v > 0 ? v - 1 : v);
        if (previous <= 0) {
            throw new IllegalStateException("taskDone() called more times than there were frames");
        }
    }

    public long getUnfinished() {
        return unfinished.get();
    }

    public int size() {
        return queue.size();
    }

    public boolean isEmpty() {
        return queue.isEmpty();
    }
}
