package herald.netty.http;

import java.io.IOException;
import java.nio.channels.ClosedChannelException;

import herald.sse.EventSink;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.handler.codec.http.DefaultHttpContent;
import io.netty.handler.codec.http.LastHttpContent;

/**
 * Writes event frames as chunks of an open HTTP response. Each write waits for the flush, so it must not be called from the channel's event loop.
 */
public class NettyEventSink implements EventSink {

    private final Channel channel;

    public NettyEventSink(Channel channel) {
        this.channel = channel;
    }

    @Override
    public void write(byte[] frame) throws IOException, InterruptedException {
        if (!channel.isActive()) {
            throw new ClosedChannelException();
        }
        ChannelFuture f = channel.writeAndFlush(new DefaultHttpContent(Unpooled.wrappedBuffer(frame)));
        f.await();
        if (!f.isSuccess()) {
            throw new IOException("Error writing to " + channel.remoteAddress(), f.cause());
        }
    }

    /**
     * Ends the chunked response and closes the connection.
     */
    @Override
    public void close() {
        if (channel.isActive()) {
            channel.writeAndFlush(LastHttpContent.EMPTY_LAST_CONTENT).addListener(ChannelFutureListener.CLOSE);
        } else {
            channel.close();
        }
    }
}
