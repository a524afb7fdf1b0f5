package herald.subscription;

import java.util.Arrays;

/**
 * An item in a {@link SubscriberQueue}: either an already formatted event or the {@link #CLOSE} marker.
 */
public final class Frame {

    public static final Frame CLOSE = new Frame(null);

    private final byte[] data;

    private Frame(byte[] data) {
        this.data = data;
    }

    public static Frame of(byte[] data) {
        if (data == null) {
            throw new IllegalArgumentException("frame data must not be null");
        }
        return new Frame(Arrays.copyOf(data, data.length));
    }

    public boolean isClose() {
        return this == CLOSE;
    }

    /**
     * The formatted bytes, shared by every queue the frame was published to. Must not be modified; the registry hands out copies.
     */
    public byte[] getData() {
        return data;
    }

    @Override
    public String toString() {
        return isClose() ? "Frame{CLOSE}" : "Frame{" + data.length + " bytes}";
    }
}
