package com.tcpchat.command;

import java.util.Locale;

/**
 * In-band commands a joined user can send as a TEXT line starting with '/'.
 */
public enum Command {
    QUIT("/quit"),
    USERS("/users"),
    HELP("/help"),
    UNKNOWN(null);

    private final String verb;

    Command(String verb) {
        this.verb = verb;
    }

    public String getVerb() {
        return verb;
    }

    /**
     * Parses a command line. Only the first whitespace-separated token counts,
     * compared case-insensitively; anything after it is ignored.
     */
    public static Command parse(String line) {
        String trimmed = line.trim();
        if (trimmed.isEmpty()) {
            return UNKNOWN;
        }
        String token = trimmed.split("\\s+", 2)[0].toLowerCase(Locale.ROOT);
        for (Command command : values()) {
            if (token.equals(command.verb)) {
                return command;
            }
        }
        return UNKNOWN;
    }
}
