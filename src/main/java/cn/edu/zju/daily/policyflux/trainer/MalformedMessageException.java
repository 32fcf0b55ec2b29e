package cn.edu.zju.daily.policyflux.trainer;

import java.io.IOException;

/** A complete frame arrived but does not hold a valid trainer message. */
public class MalformedMessageException extends IOException {

    public MalformedMessageException(String message) {
        super(message);
    }

    public MalformedMessageException(String message, Throwable cause) {
        super(message, cause);
    }
}
