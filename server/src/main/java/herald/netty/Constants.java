package herald.netty;

import io.netty.util.AttributeKey;

public class Constants {

    public static final String ERR_WRITING_RESPONSE = "Error writing response to pipeline: {}";
    public static final String JSON_TYPE = "application/json";
    public static final String NO_CACHE = "no-cache";
    public static final String LOG_RETURNING_RESPONSE = "Returning response {}";
    public static final AttributeKey<String> SUBSCRIBER_ID_ATTR = AttributeKey.newInstance("subscriberId");
}
