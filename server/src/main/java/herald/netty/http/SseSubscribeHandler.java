package herald.netty.http;

import static herald.netty.Constants.NO_CACHE;
import static herald.netty.Constants.SUBSCRIBER_ID_ATTR;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import herald.Constants;
import herald.api.request.SubscribeRequest;
import herald.api.response.HeraldException;
import herald.sse.EventStreamService;
import herald.sse.StreamLoop;
import herald.subscription.Subscription;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.DefaultHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpResponse;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpUtil;
import io.netty.handler.codec.http.HttpVersion;

/**
 * Admits a subscriber and turns the connection into an event stream. Frames are written by a {@link StreamLoop} running on the stream executor until
 * the subscription closes or the connection goes away.
 */
public class SseSubscribeHandler extends SimpleChannelInboundHandler<SubscribeRequest> implements HeraldHttpHandler {

    private static final Logger LOG = LoggerFactory.getLogger(SseSubscribeHandler.class);

    private final EventStreamService eventStreamService;
    private final ExecutorService streamExecutor;

    public SseSubscribeHandler(EventStreamService eventStreamService, ExecutorService streamExecutor) {
        this.eventStreamService = eventStreamService;
        this.streamExecutor = streamExecutor;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, SubscribeRequest request) throws Exception {
        LOG.trace("Subscribe request {} on channel {}", request, ctx.channel());
        eventStreamService.subscribe(request).whenComplete((subscription, error) -> ctx.executor().execute(() -> {
            if (error != null) {
                reject(ctx, error);
            } else {
                stream(ctx, subscription);
            }
        }));
    }

    private void reject(ChannelHandlerContext ctx, Throwable error) {
        Throwable cause = error;
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        HeraldException e;
        if (cause instanceof HeraldException) {
            e = (HeraldException) cause;
        } else {
            e = new HeraldException(HttpResponseStatus.INTERNAL_SERVER_ERROR.code(), "Subscription rejected", String.valueOf(cause.getMessage()), cause);
        }
        LOG.debug("Subscription rejected: {}", e.getMessage());
        ctx.fireChannelRead(e);
    }

    private void stream(ChannelHandlerContext ctx, Subscription subscription) {
        final String subscriberId = subscription.getSubscriberId();
        final String channelId = subscription.getChannelId();
        if (!ctx.channel().isActive()) {
            LOG.debug("[{}] Connection closed before the stream started", subscriberId);
            eventStreamService.getRegistry().unregister(subscription);
            return;
        }

        HttpResponse response = new DefaultHttpResponse(HttpVersion.HTTP_1_1, HttpResponseStatus.OK);
        response.headers().set(HttpHeaderNames.CONTENT_TYPE, Constants.EVENT_STREAM_TYPE);
        response.headers().set(HttpHeaderNames.CACHE_CONTROL, NO_CACHE);
        response.headers().set(HttpHeaderNames.CONNECTION, HttpHeaderValues.KEEP_ALIVE);
        HttpUtil.setTransferEncodingChunked(response, true);
        sendResponse(ctx, response);

        ctx.channel().attr(SUBSCRIBER_ID_ATTR).set(subscriberId);
        StreamLoop loop = eventStreamService.newStreamLoop(subscription, new NettyEventSink(ctx.channel()));
        final Future<?> running;
        try {
            running = streamExecutor.submit(loop);
        } catch (RejectedExecutionException e) {
            LOG.warn("[{}] Unable to start stream, shutting down", subscriberId);
            eventStreamService.getRegistry().unregister(subscription);
            ctx.close();
            return;
        }
        LOG.info("[{}] Streaming events on channel {} to {}", subscriberId, channelId, ctx.channel().remoteAddress());

        ctx.channel().closeFuture().addListener(new ChannelFutureListener() {

            @Override
            public void operationComplete(ChannelFuture future) throws Exception {
                running.cancel(true);
                if (eventStreamService.getRegistry().unregister(subscription)) {
                    LOG.info("[{}] Channel closed, removed subscription", subscriberId);
                }
            }
        });
    }

}
