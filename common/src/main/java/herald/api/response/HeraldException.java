package herald.api.response;

import java.util.HashMap;
import java.util.Map;

public class HeraldException extends Exception {

    private static final long serialVersionUID = 1L;
    private final int code;
    private final String details;
    private final Map<String,String> responseHeaders = new HashMap<>();

    public HeraldException(int code, String message, String details) {
        this(code, message, details, null);
    }

    public HeraldException(int code, String message, String details, Throwable error) {
        super(message, error);
        this.code = code;
        this.details = details;
    }

    public int getCode() {
        return code;
    }

    public String getDetails() {
        return details;
    }

    public void addResponseHeader(String name, String value) {
        this.responseHeaders.put(name, value);
    }

    public Map<String,String> getResponseHeaders() {
        return this.responseHeaders;
    }
}
