package lodestore.commands;

import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

public class CommandMetadata {
    public static final String FLAG_WRITE = "write";
    public static final String FLAG_READONLY = "readonly";
    public static final String FLAG_FAST = "fast";

    private final Set<String> flags;

    public CommandMetadata(Set<String> flags) {
        this.flags = flags != null ? Collections.unmodifiableSet(new HashSet<>(flags)) : Collections.<String>emptySet();
    }

    public static CommandMetadata of(String... flags) {
        Set<String> set = new HashSet<>();
        Collections.addAll(set, flags);
        return new CommandMetadata(set);
    }

    public Set<String> getFlags() {
        return flags;
    }

    /** Write commands are appended to the AOF before they run. */
    public boolean isWrite() {
        return flags.contains(FLAG_WRITE);
    }
}
