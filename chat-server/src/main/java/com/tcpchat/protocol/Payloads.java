package com.tcpchat.protocol;

import java.nio.charset.StandardCharsets;

/**
 * Helpers for the "::"-delimited payload conventions.
 */
public final class Payloads {

    public static final String DELIMITER = "::";

    private static final byte[] DELIMITER_BYTES = DELIMITER.getBytes(StandardCharsets.UTF_8);

    private Payloads() {
    }

    /**
     * Prepends {@code "<sender>::"} to a payload, leaving the original bytes untouched.
     */
    public static byte[] withSender(String sender, byte[] payload) {
        byte[] prefix = (sender + DELIMITER).getBytes(StandardCharsets.UTF_8);
        byte[] result = new byte[prefix.length + payload.length];
        System.arraycopy(prefix, 0, result, 0, prefix.length);
        System.arraycopy(payload, 0, result, prefix.length, payload.length);
        return result;
    }

    /**
     * Finds the first delimiter at or after {@code from}.
     *
     * @return index of the delimiter's first byte, or -1
     */
    public static int indexOfDelimiter(byte[] payload, int from) {
        outer:
        for (int i = Math.max(from, 0); i <= payload.length - DELIMITER_BYTES.length; i++) {
            for (int j = 0; j < DELIMITER_BYTES.length; j++) {
                if (payload[i + j] != DELIMITER_BYTES[j]) {
                    continue outer;
                }
            }
            return i;
        }
        return -1;
    }

    public static boolean containsDelimiter(String value) {
        return value.contains(DELIMITER);
    }

    static int delimiterLength() {
        return DELIMITER_BYTES.length;
    }
}
