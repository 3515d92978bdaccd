package lodestore.commands;

import lodestore.protocol.RespValue;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;

/**
 * Helpers shared by the command implementations.
 */
public final class CommandSupport {

    private CommandSupport() { }

    public static RespValue wrongNumberOfArguments(List<byte[]> args) {
        return RespValue.error("ERR wrong number of arguments for '" + printable(name(args)).toLowerCase(Locale.ROOT) + "' command");
    }

    public static String name(List<byte[]> args) {
        return new String(args.get(0), StandardCharsets.UTF_8);
    }

    /**
     * Maps key or field bytes to a map key. Latin-1 is one char per byte, so {@link #keyBytes(String)}
     * gives back exactly the bytes the client sent.
     */
    public static String key(byte[] bytes) {
        return new String(bytes, StandardCharsets.ISO_8859_1);
    }

    public static byte[] keyBytes(String key) {
        return key.getBytes(StandardCharsets.ISO_8859_1);
    }

    /** Client text echoed in a reply line: CR and LF become spaces, as Redis does. */
    public static String printable(String text) {
        return text.replace('\r', ' ').replace('\n', ' ');
    }
}
