package herald.subscription;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps channel ids to the subscribers registered under them and fans published frames out to their queues.
 * <p>
 * Every subscriber is also a member of the unscoped group, so a publish without a channel id reaches all subscribers, including those that joined a
 * named channel. Membership changes are serialized on a single lock; a publish snapshots its targets under the lock and enqueues outside of it.
 * <p>
 * With exclusive channels an explicit channel id doubles as the subscriber id and may only be held by one live subscriber. With shared channels any
 * number of subscribers can join a named channel, each with a generated subscriber id. A subscriber that names no channel gets a generated id which is
 * also its personal channel.
 */
public class SubscriptionRegistry {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionRegistry.class);

    private final Object lock = new Object();
    private final Map<String,Map<String,Subscription>> channels = new LinkedHashMap<>();
    private final Map<String,Subscription> subscribers = new LinkedHashMap<>();
    private final boolean exclusiveChannels;

    public SubscriptionRegistry() {
        this(true);
    }

    public SubscriptionRegistry(boolean exclusiveChannels) {
        this.exclusiveChannels = exclusiveChannels;
    }

    public String register() throws DuplicateSubscriptionException {
        return subscribe(null).getSubscriberId();
    }

    public String register(String channelId) throws DuplicateSubscriptionException {
        return subscribe(channelId).getSubscriberId();
    }

    /**
     * Creates a new subscriber queue, optionally in a named channel.
     *
     * @param channelId
     *            channel to join, or null/blank for a personal channel
     * @return the subscription handle
     * @throws DuplicateSubscriptionException
     *             if channels are exclusive and the channel id is already in use
     */
    public Subscription subscribe(String channelId) throws DuplicateSubscriptionException {
        Subscription subscription;
        synchronized (lock) {
            String subscriberId;
            String channel;
            if (StringUtils.isBlank(channelId)) {
                subscriberId = newSubscriberId();
                channel = subscriberId;
            } else if (exclusiveChannels) {
                if (channels.containsKey(channelId) || subscribers.containsKey(channelId)) {
                    throw new DuplicateSubscriptionException(channelId);
                }
                subscriberId = channelId;
                channel = channelId;
            } else {
                subscriberId = newSubscriberId();
                channel = channelId;
            }
            subscription = new Subscription(subscriberId, channel, new SubscriberQueue());
            subscribers.put(subscriberId, subscription);
            channels.computeIfAbsent(channel, k -> new LinkedHashMap<>()).put(subscriberId, subscription);
        }
        log.debug("[{}] Registered subscriber on channel {}", subscription.getSubscriberId(), subscription.getChannelId());
        return subscription;
    }

    public boolean unregister(String subscriberId) {
        return unregister(subscriberId, null);
    }

    /**
     * Removes a subscriber. Safe to call more than once.
     *
     * @param subscriberId
     *            the subscriber to remove
     * @param channelId
     *            the channel it is expected in, or null for whichever channel it joined
     * @return false if the subscriber was not registered (in that channel)
     */
    public boolean unregister(String subscriberId, String channelId) {
        if (subscriberId == null) {
            return false;
        }
        synchronized (lock) {
            Subscription subscription = subscribers.get(subscriberId);
            if (subscription == null || (channelId != null && !channelId.equals(subscription.getChannelId()))) {
                return false;
            }
            remove(subscription);
        }
        log.debug("[{}] Unregistered subscriber", subscriberId);
        return true;
    }

    /**
     * Removes this exact subscription. A later subscriber that reuses the same id is left alone. Safe to call more than once.
     *
     * @return false if the subscription is no longer registered
     */
    public boolean unregister(Subscription subscription) {
        if (subscription == null) {
            return false;
        }
        synchronized (lock) {
            if (subscribers.get(subscription.getSubscriberId()) != subscription) {
                return false;
            }
            remove(subscription);
        }
        log.debug("[{}] Unregistered subscriber", subscription.getSubscriberId());
        return true;
    }

    public int publish(byte[] data) {
        return publish(data, null);
    }

    /**
     * Enqueues a frame for every subscriber of a channel, or for every subscriber when channelId is null. Subscribers that leave between the snapshot
     * and the enqueue may still receive the frame; it is discarded with their queue.
     *
     * @return the number of queues the frame was added to
     */
    public int publish(byte[] data, String channelId) {
        return offer(Frame.of(data), channelId);
    }

    /**
     * Sends the close frame to every current subscriber. Each stream ends once it reaches the frame.
     *
     * @return the number of subscribers signalled
     */
    public int close() {
        int count = offer(Frame.CLOSE, null);
        log.info("Sent close to {} subscribers", count);
        return count;
    }

    /**
     * Blocks until the next frame for the subscriber is available.
     *
     * @throws SubscriptionClosedException
     *             if the close frame was reached, in which case the subscriber has been unregistered, or if the subscriber is not registered
     */
    public byte[] receive(String subscriberId) throws SubscriptionClosedException, InterruptedException {
        return receive(lookup(subscriberId));
    }

    /**
     * Blocks until the next frame for this subscription is available. Each call returns a private copy of the frame.
     *
     * @throws SubscriptionClosedException
     *             if the close frame was reached or the subscription is no longer registered
     */
    public byte[] receive(Subscription subscription) throws SubscriptionClosedException, InterruptedException {
        ensureRegistered(subscription);
        return unwrap(subscription, subscription.getQueue().take());
    }

    /**
     * Same as {@link #receive(String)} but waits at most the given time.
     *
     * @return the frame, or null if none arrived in time
     */
    public byte[] poll(String subscriberId, long timeout, TimeUnit unit) throws SubscriptionClosedException, InterruptedException {
        return poll(lookup(subscriberId), timeout, unit);
    }

    public byte[] poll(Subscription subscription, long timeout, TimeUnit unit) throws SubscriptionClosedException, InterruptedException {
        ensureRegistered(subscription);
        Frame frame = subscription.getQueue().poll(timeout, unit);
        return frame == null ? null : unwrap(subscription, frame);
    }

    public boolean taskDone(String subscriberId) {
        return taskDone(get(subscriberId));
    }

    /**
     * @return false if the subscription is no longer registered
     */
    public boolean taskDone(Subscription subscription) {
        if (subscription == null || !isCurrent(subscription)) {
            return false;
        }
        subscription.getQueue().taskDone();
        return true;
    }

    public Subscription get(String subscriberId) {
        synchronized (lock) {
            return subscribers.get(subscriberId);
        }
    }

    public boolean isRegistered(String subscriberId) {
        return get(subscriberId) != null;
    }

    /**
     * @return frames waiting in the subscriber's queue, 0 if it is not registered
     */
    public int pending(String subscriberId) {
        Subscription subscription = get(subscriberId);
        return subscription == null ? 0 : subscription.getQueue().size();
    }

    public int size() {
        synchronized (lock) {
            return subscribers.size();
        }
    }

    public int channelCount() {
        synchronized (lock) {
            return channels.size();
        }
    }

    public boolean isExclusiveChannels() {
        return exclusiveChannels;
    }

    private int offer(Frame frame, String channelId) {
        List<Subscription> targets;
        synchronized (lock) {
            Map<String,Subscription> scoped = channelId == null ? subscribers : channels.get(channelId);
            if (scoped == null) {
                log.trace("No subscribers for channel {}", channelId);
                return 0;
            }
            targets = new ArrayList<>(scoped.values());
        }
        for (Subscription subscription : targets) {
            subscription.getQueue().offer(frame);
        }
        log.trace("Published {} to {} subscribers of channel {}", frame, targets.size(), channelId);
        return targets.size();
    }

    private Subscription lookup(String subscriberId) throws SubscriptionClosedException {
        Subscription subscription = get(subscriberId);
        if (subscription == null) {
            throw new SubscriptionClosedException(subscriberId, "Subscriber " + subscriberId + " is not registered");
        }
        return subscription;
    }

    private void ensureRegistered(Subscription subscription) throws SubscriptionClosedException {
        if (!isCurrent(subscription)) {
            throw new SubscriptionClosedException(subscription.getSubscriberId(), "Subscriber " + subscription.getSubscriberId() + " is not registered");
        }
    }

    private boolean isCurrent(Subscription subscription) {
        synchronized (lock) {
            return subscribers.get(subscription.getSubscriberId()) == subscription;
        }
    }

    private byte[] unwrap(Subscription subscription, Frame frame) throws SubscriptionClosedException {
        if (frame.isClose()) {
            unregister(subscription);
            throw new SubscriptionClosedException(subscription.getSubscriberId(), "Close received");
        }
        // frames are shared between subscribers
        return Arrays.copyOf(frame.getData(), frame.getData().length);
    }

    // callers hold the lock
    private void remove(Subscription subscription) {
        String subscriberId = subscription.getSubscriberId();
        subscribers.remove(subscriberId);
        Map<String,Subscription> members = channels.get(subscription.getChannelId());
        if (members == null || members.remove(subscriberId) == null) {
            throw new IllegalStateException("Subscriber " + subscriberId + " missing from channel " + subscription.getChannelId());
        }
        if (members.isEmpty()) {
            channels.remove(subscription.getChannelId());
        }
    }

    private String newSubscriberId() {
        String id = UUID.randomUUID().toString();
        while (subscribers.containsKey(id) || channels.containsKey(id)) {
            id = UUID.randomUUID().toString();
        }
        return id;
    }
}
