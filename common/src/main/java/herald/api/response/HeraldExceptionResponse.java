package herald.api.response;

import java.io.Serializable;

public class HeraldExceptionResponse implements Serializable {

    private static final long serialVersionUID = 3216748093511260375L;

    public String message;
    public String detailMessage;
    public int responseCode;

    public HeraldExceptionResponse(HeraldException e) {
        this.message = e.getMessage();
        this.detailMessage = e.getDetails();
        this.responseCode = e.getCode();
    }
}
