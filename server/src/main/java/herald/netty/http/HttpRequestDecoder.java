package herald.netty.http;

import java.util.List;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.Multimap;

import herald.api.request.SubscribeRequest;
import herald.api.response.HeraldException;
import herald.common.configuration.SseProperties;
import herald.util.HttpHeaderUtils;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToMessageDecoder;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.QueryStringDecoder;

/**
 * Turns requests for the event stream path into {@link SubscribeRequest}s. Anything else is answered with an error.
 */
public class HttpRequestDecoder extends MessageToMessageDecoder<FullHttpRequest> implements HeraldHttpHandler {

    private static final Logger LOG = LoggerFactory.getLogger(HttpRequestDecoder.class);
    private static final String LOG_RECEIVED_REQUEST = "Received HTTP request {}";
    private static final String LOG_PARSED_REQUEST = "Parsed request {}";

    private final String path;
    private final String channelParameter;

    public HttpRequestDecoder(SseProperties sseProperties) {
        this.path = sseProperties.getPath();
        this.channelParameter = sseProperties.getChannelParameter();
    }

    @Override
    protected void decode(ChannelHandlerContext ctx, FullHttpRequest msg, List<Object> out) throws Exception {

        LOG.trace(LOG_RECEIVED_REQUEST, msg);

        final QueryStringDecoder decoder = new QueryStringDecoder(msg.uri());
        if (!decoder.path().equals(path)) {
            throw new HeraldException(HttpResponseStatus.NOT_FOUND.code(), "Not found", decoder.path());
        }
        if (!msg.method().equals(HttpMethod.GET)) {
            HeraldException e = new HeraldException(HttpResponseStatus.METHOD_NOT_ALLOWED.code(), "unhandled method type", "");
            e.addResponseHeader(HttpHeaderNames.ALLOW.toString(), HttpMethod.GET.name());
            LOG.warn("Unhandled HTTP request type {}", msg.method());
            throw e;
        }
        List<String> channels = decoder.parameters().get(channelParameter);
        String channelId = null;
        if (channels != null && !channels.isEmpty() && StringUtils.isNotBlank(channels.get(0))) {
            channelId = channels.get(0);
        }
        Multimap<String,String> headers = HttpHeaderUtils.toMultimap(msg.headers());
        SubscribeRequest request = new SubscribeRequest(channelId, headers, decoder.parameters());
        LOG.trace(LOG_PARSED_REQUEST, request);
        out.add(request);
    }

}
