package herald.subscription;

public class Subscription {

    private final String subscriberId;
    private final String channelId;
    private final SubscriberQueue queue;

    public Subscription(String subscriberId, String channelId, SubscriberQueue queue) {
        this.subscriberId = subscriberId;
        this.channelId = channelId;
        this.queue = queue;
    }

    public String getSubscriberId() {
        return subscriberId;
    }

    public String getChannelId() {
        return channelId;
    }

    public SubscriberQueue getQueue() {
        return queue;
    }

    @Override
    public String toString() {
        return String.format("Subscription{id=%s, channel=%s, pending=%d}", subscriberId, channelId, queue.size());
    }
}
