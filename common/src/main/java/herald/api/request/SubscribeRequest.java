package herald.api.request;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.apache.commons.lang3.builder.ToStringBuilder;
import org.apache.commons.lang3.builder.ToStringStyle;

import com.google.common.collect.ImmutableMultimap;
import com.google.common.collect.Multimap;

/**
 * A client asking to open an event stream.
 */
public class SubscribeRequest {

    private final String channelId;
    private final Multimap<String,String> headers;
    private final Map<String,List<String>> parameters;

    public SubscribeRequest(String channelId) {
        this(channelId, ImmutableMultimap.of(), Collections.emptyMap());
    }

    public SubscribeRequest(String channelId, Multimap<String,String> headers, Map<String,List<String>> parameters) {
        this.channelId = channelId;
        this.headers = headers;
        this.parameters = parameters;
    }

    /**
     * @return the requested channel, or null to let the registry assign one
     */
    public String getChannelId() {
        return channelId;
    }

    /**
     * @return request headers keyed by lower case name
     */
    public Multimap<String,String> getHeaders() {
        return headers;
    }

    public Map<String,List<String>> getParameters() {
        return parameters;
    }

    @Override
    public String toString() {
        ToStringBuilder tsb = new ToStringBuilder(this, ToStringStyle.SHORT_PREFIX_STYLE);
        tsb.append("channelId", channelId);
        tsb.append("parameters", parameters);
        return tsb.toString();
    }
}
