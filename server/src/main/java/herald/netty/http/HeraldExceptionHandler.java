package herald.netty.http;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import herald.api.response.HeraldException;
import herald.netty.Constants;
import io.netty.channel.ChannelHandler.Sharable;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.HttpResponseStatus;

@Sharable
public class HeraldExceptionHandler extends SimpleChannelInboundHandler<HeraldException> implements HeraldHttpHandler {

    private static final Logger LOG = LoggerFactory.getLogger(HeraldExceptionHandler.class);

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, HeraldException msg) throws Exception {
        this.sendHttpError(ctx, msg);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) throws Exception {
        String subscriberId = ctx.channel().attr(Constants.SUBSCRIBER_ID_ATTR).get();
        if (subscriberId != null) {
            // the event stream response is already committed
            LOG.warn("[{}] Exception on streaming channel, closing: {}", subscriberId, cause.getMessage());
            ctx.close();
            return;
        }
        LOG.error("Exception in pipeline", cause);
        if (cause instanceof HeraldException) {
            this.sendHttpError(ctx, (HeraldException) cause);
        } else if (null != cause.getCause() && cause.getCause() instanceof HeraldException) {
            this.sendHttpError(ctx, (HeraldException) cause.getCause());
        } else {
            HeraldException e = new HeraldException(HttpResponseStatus.INTERNAL_SERVER_ERROR.code(), cause.getMessage(), "");
            this.sendHttpError(ctx, e);
        }
    }
}
