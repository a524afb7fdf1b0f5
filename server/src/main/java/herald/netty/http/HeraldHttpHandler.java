package herald.netty.http;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;

import herald.api.response.HeraldException;
import herald.api.response.HeraldExceptionResponse;
import herald.netty.Constants;
import herald.util.JsonUtil;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpVersion;

public interface HeraldHttpHandler {

    Logger LOG = LoggerFactory.getLogger(HeraldHttpHandler.class);

    /**
     * Writes the error as a JSON response and closes the connection afterwards.
     */
    default void sendHttpError(ChannelHandlerContext ctx, HeraldException e) throws JsonProcessingException {
        LOG.error("Error in pipeline, response code: {}, message: {}", e.getCode(), e.getMessage());
        byte[] buf = JsonUtil.getObjectMapper().writeValueAsBytes(new HeraldExceptionResponse(e));
        FullHttpResponse response = new DefaultFullHttpResponse(HttpVersion.HTTP_1_1, HttpResponseStatus.valueOf(e.getCode()), Unpooled.copiedBuffer(buf));
        response.headers().set(HttpHeaderNames.CONTENT_TYPE, Constants.JSON_TYPE);
        response.headers().set(HttpHeaderNames.CONTENT_LENGTH, response.content().readableBytes());
        response.headers().set(HttpHeaderNames.CONNECTION, HttpHeaderValues.CLOSE);
        e.getResponseHeaders().forEach((name, value) -> response.headers().set(name, value));
        sendResponse(ctx, response).addListener(ChannelFutureListener.CLOSE);
    }

    default ChannelFuture sendResponse(ChannelHandlerContext ctx, Object msg) {
        ChannelFuture f = ctx.writeAndFlush(msg);
        LOG.trace(Constants.LOG_RETURNING_RESPONSE, msg);
        f.addListener(future -> {
            if (!future.isSuccess()) {
                LOG.error(Constants.ERR_WRITING_RESPONSE, future.cause());
            }
        });
        return f;
    }

}
