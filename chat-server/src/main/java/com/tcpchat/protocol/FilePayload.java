package com.tcpchat.protocol;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * A file carried by a FILE frame.
 *
 * Upload payload (client → server): {@code filename::data}.
 * Relayed payload (server → clients): {@code sender::filename::data}.
 *
 * Fields are split on the first one or two delimiters; everything after is
 * raw file bytes and may itself contain "::". Neither usernames nor file
 * names may contain the delimiter, which keeps the split unambiguous.
 */
public final class FilePayload {

    private final String sender;
    private final String fileName;
    private final byte[] data;

    private FilePayload(String sender, String fileName, byte[] data) {
        this.sender = sender;
        this.fileName = fileName;
        this.data = data;
    }

    /**
     * Builds the payload a client uploads.
     *
     * @throws IllegalArgumentException if the name is empty or contains "::"
     */
    public static byte[] upload(String fileName, byte[] data) {
        Objects.requireNonNull(fileName, "fileName");
        Objects.requireNonNull(data, "data");
        if (fileName.isEmpty() || Payloads.containsDelimiter(fileName)) {
            throw new IllegalArgumentException("File name must be non-empty and must not contain '"
                    + Payloads.DELIMITER + "': " + fileName);
        }
        return Payloads.withSender(fileName, data);
    }

    /**
     * Parses an upload payload ({@code filename::data}).
     *
     * @return the file, or empty if there is no delimiter or the name is empty
     */
    public static Optional<FilePayload> parseUpload(byte[] payload) {
        int split = Payloads.indexOfDelimiter(payload, 0);
        if (split <= 0) {
            return Optional.empty();
        }
        String fileName = new String(payload, 0, split, StandardCharsets.UTF_8);
        byte[] data = Arrays.copyOfRange(payload, split + Payloads.delimiterLength(), payload.length);
        return Optional.of(new FilePayload(null, fileName, data));
    }

    /**
     * Parses a relayed payload ({@code sender::filename::data}).
     *
     * @return the file, or empty if either delimiter is missing or the name is empty
     */
    public static Optional<FilePayload> parseRelayed(byte[] payload) {
        int first = Payloads.indexOfDelimiter(payload, 0);
        if (first < 0) {
            return Optional.empty();
        }
        int nameStart = first + Payloads.delimiterLength();
        int second = Payloads.indexOfDelimiter(payload, nameStart);
        if (second <= nameStart) {
            return Optional.empty();
        }
        String sender = new String(payload, 0, first, StandardCharsets.UTF_8);
        String fileName = new String(payload, nameStart, second - nameStart, StandardCharsets.UTF_8);
        byte[] data = Arrays.copyOfRange(payload, second + Payloads.delimiterLength(), payload.length);
        return Optional.of(new FilePayload(sender, fileName, data));
    }

    /**
     * @return the sending user for a relayed file, or null for an upload
     */
    public String getSender() {
        return sender;
    }

    public String getFileName() {
        return fileName;
    }

    public byte[] getData() {
        return data.clone();
    }

    public int getSize() {
        return data.length;
    }

    @Override
    public String toString() {
        return "FilePayload{" +
                "sender='" + sender + '\'' +
                ", fileName='" + fileName + '\'' +
                ", size=" + data.length +
                '}';
    }
}
