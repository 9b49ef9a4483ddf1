package com.tcpchat.protocol;

import java.io.IOException;

/**
 * Thrown when a frame header cannot describe a valid frame: a declared length
 * of zero (no room for the type byte) or one above the configured maximum.
 *
 * Readers must treat this exactly like end of stream and drop the connection.
 */
public class MalformedFrameException extends IOException {

    private final long declaredLength;

    public MalformedFrameException(String message, long declaredLength) {
        super(message);
        this.declaredLength = declaredLength;
    }

    public long getDeclaredLength() {
        return declaredLength;
    }
}
