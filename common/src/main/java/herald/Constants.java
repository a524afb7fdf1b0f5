package herald;

public class Constants {

    public static final String EVENT_STREAM_TYPE = "text/event-stream";
    public static final String LINE_SEPARATOR = "\r\n";
    public static final String DEFAULT_PATH = "/sse";
    public static final String DEFAULT_CHANNEL_PARAMETER = "channel_id";
    public static final long DEFAULT_PING_INTERVAL_SECONDS = 15;
}
