package com.previewstudio.orchestrator.runner;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Demultiplexes Docker's attach/logs stream for containers created without a TTY.
 *
 * Each frame is an 8-byte header followed by the payload:
 * <pre>
 *   byte 0     stream type (0 stdin, 1 stdout, 2 stderr)
 *   bytes 1-3  zero
 *   bytes 4-7  payload size, big-endian unsigned
 * </pre>
 */
public final class DockerStreamDecoder {

    private static final int HEADER_SIZE = 8;

    private DockerStreamDecoder() {}

    public enum StreamType { STDIN, STDOUT, STDERR }

    public record Frame(StreamType stream, byte[] payload) {
        public String text() {
            return new String(payload, StandardCharsets.UTF_8);
        }
    }

    /**
     * Read frames until the stream ends, handing each to {@code sink}.
     * A truncated trailing frame is delivered with whatever bytes arrived.
     */
    public static void pump(InputStream in, Consumer<Frame> sink) throws IOException {
        while (true) {
            byte[] header = in.readNBytes(HEADER_SIZE);
            if (header.length < HEADER_SIZE) return;
            if (!isHeader(header)) {
                throw new IOException("Malformed Docker stream header (type byte " + header[0] + ")");
            }
            long size = ((header[4] & 0xFFL) << 24)
                      | ((header[5] & 0xFFL) << 16)
                      | ((header[6] & 0xFFL) << 8)
                      |  (header[7] & 0xFFL);
            byte[] payload = in.readNBytes((int) Math.min(size, Integer.MAX_VALUE));
            sink.accept(new Frame(StreamType.values()[header[0]], payload));
            if (payload.length < size) return;
        }
    }

    /**
     * Decode a complete multiplexed buffer into text. Output that does not
     * start with a frame header (TTY containers) is returned as-is.
     */
    public static String decodeAll(byte[] raw) {
        if (raw.length < HEADER_SIZE || !isHeader(raw)) {
            return new String(raw, StandardCharsets.UTF_8);
        }
        StringBuilder text = new StringBuilder();
        try {
            pump(new ByteArrayInputStream(raw), frame -> text.append(frame.text()));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to decode container output", e);
        }
        return text.toString();
    }

    /** Split a chunk into trimmed, non-blank lines. */
    public static List<String> lines(String chunk) {
        List<String> lines = new ArrayList<>();
        for (String line : chunk.split("\\r?\\n")) {
            String trimmed = line.trim();
            if (!trimmed.isEmpty()) lines.add(trimmed);
        }
        return lines;
    }

    private static boolean isHeader(byte[] b) {
        return b[0] >= 0 && b[0] <= 2 && b[1] == 0 && b[2] == 0 && b[3] == 0;
    }
}
