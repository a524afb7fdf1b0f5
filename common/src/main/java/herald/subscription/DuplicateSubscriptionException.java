package herald.subscription;

import herald.api.response.HeraldException;

/**
 * Raised when an explicit channel id is requested that is already owned by another live subscriber.
 */
public class DuplicateSubscriptionException extends HeraldException {

    private static final long serialVersionUID = 1L;
    private static final int BAD_REQUEST = 400;

    private final String channelId;

    public DuplicateSubscriptionException(String channelId) {
        super(BAD_REQUEST, "Channel " + channelId + " is already registered", "channel id must be unique while the subscriber is connected");
        this.channelId = channelId;
    }

    public String getChannelId() {
        return channelId;
    }
}
