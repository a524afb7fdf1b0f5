package herald.sse;

import java.io.IOException;

/**
 * The connection a {@link StreamLoop} writes frames to.
 */
public interface EventSink {

    /**
     * Writes one complete frame and waits until it has been handed to the transport.
     * The array belongs to this stream and may be handed to the transport without copying.
     *
     * @throws IOException
     *             if the peer is gone or the transport failed
     * @throws InterruptedException
     *             if the stream was cancelled while waiting
     */
    void write(byte[] frame) throws IOException, InterruptedException;

    /**
     * Releases the connection once the stream is over.
     */
    default void close() {}
}
