package herald.sse;

import static herald.Constants.LINE_SEPARATOR;

import java.nio.charset.StandardCharsets;
import java.util.regex.Pattern;

/**
 * Renders events in the {@code text/event-stream} wire format.
 *
 * <pre>
 * id: &lt;id&gt;\r\n
 * event: &lt;event&gt;\r\n
 * data: &lt;line&gt;\r\n      (one per line of the payload)
 * retry: &lt;millis&gt;\r\n
 * \r\n
 * </pre>
 *
 * The id, event and retry lines are only written when a value is supplied.
 */
public final class EventFormatter {

    public static final byte[] PING = (": ping" + LINE_SEPARATOR + LINE_SEPARATOR).getBytes(StandardCharsets.UTF_8);

    private static final Pattern LINE_BREAK = Pattern.compile("\r\n|\r|\n");

    private EventFormatter() {}

    public static byte[] format(String data) {
        return format(data, null, null, (Integer) null);
    }

    public static byte[] format(String data, String id, String event, Integer retry) {
        return format(data, id, event, (Object) retry);
    }

    /**
     * @param data
     *            payload, split on CR, LF and CRLF into one data line per segment
     * @param id
     *            event id, line breaks are removed
     * @param event
     *            event name, line breaks are removed
     * @param retry
     *            reconnection time in milliseconds, must be an integral number
     * @throws IllegalArgumentException
     *             if retry is not an integral number
     */
    public static byte[] format(String data, String id, String event, Object retry) {
        if (retry != null && !isIntegral(retry)) {
            throw new IllegalArgumentException("retry must be an integer, got " + retry.getClass().getSimpleName() + " " + retry);
        }
        StringBuilder buf = new StringBuilder();
        if (id != null) {
            buf.append(stripLineBreaks("id: " + id)).append(LINE_SEPARATOR);
        }
        if (event != null) {
            buf.append(stripLineBreaks("event: " + event)).append(LINE_SEPARATOR);
        }
        for (String line : LINE_BREAK.split(data == null ? "" : data, -1)) {
            buf.append("data: ").append(line).append(LINE_SEPARATOR);
        }
        if (retry != null) {
            buf.append("retry: ").append(retry).append(LINE_SEPARATOR);
        }
        buf.append(LINE_SEPARATOR);
        return buf.toString().getBytes(StandardCharsets.UTF_8);
    }

    private static String stripLineBreaks(String line) {
        return LINE_BREAK.matcher(line).replaceAll("");
    }

    private static boolean isIntegral(Object value) {
        return value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte;
    }
}
