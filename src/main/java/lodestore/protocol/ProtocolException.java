package lodestore.protocol;

import java.io.IOException;

/**
 * Malformed RESP framing: a bad length field or a type marker that is not allowed here.
 * The byte stream cannot be resynchronised after this, so the session that hit it must end.
 */
public class ProtocolException extends IOException {

    public ProtocolException(String message) {
        super(message);
    }

    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
