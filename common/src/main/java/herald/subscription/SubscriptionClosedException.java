package herald.subscription;

/**
 * Signals that a subscription has received its close frame or is no longer registered. This is the normal end of a stream, not a fault.
 */
public class SubscriptionClosedException extends Exception {

    private static final long serialVersionUID = 1L;

    private final String subscriberId;

    public SubscriptionClosedException(String subscriberId, String message) {
        super(message);
        this.subscriberId = subscriberId;
    }

    public String getSubscriberId() {
        return subscriberId;
    }
}
