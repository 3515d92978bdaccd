package lodestore.protocol;

/**
 * Type tag of a {@link RespValue}, with the marker byte that opens it on the wire.
 */
public enum RespType {
    SIMPLE_STRING(Resp.SIMPLE_STRING),  // +OK\r\n
    ERROR(Resp.ERROR),                  // -ERR msg\r\n
    INTEGER(Resp.INTEGER),              // :123\r\n
    BULK_STRING(Resp.BULK_STRING),      // $3\r\nGET\r\n  or  $-1\r\n
    ARRAY(Resp.ARRAY);                  // *2\r\n$3\r\nGET\r\n$1\r\nk\r\n  or  *-1\r\n

    private final char marker;

    RespType(char marker) {
        this.marker = marker;
    }

    public char getMarker() {
        return marker;
    }
}
