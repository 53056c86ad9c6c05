package io.llmbridge.core.stream;

import java.io.IOException;
import java.util.Objects;
import okio.BufferedSource;

/**
 * Minimal server-sent-events reader. Returns the payload of each event, joining multi-line
 * {@code data:} fields with newlines; comment lines and other fields are skipped.
 */
public final class SseEventReader {
    private final BufferedSource source;

    public SseEventReader(BufferedSource source) {
        this.source = Objects.requireNonNull(source, "source must not be null");
    }

    /**
     * @return the next event's data, or null once the stream is exhausted
     */
    public String next() throws IOException {
        StringBuilder data = null;
        while (true) {
            String line = source.readUtf8Line();
            if (line == null) {
                return data == null ? null : data.toString();
            }
            if (line.isEmpty()) {
                if (data != null) {
                    return data.toString();
                }
                continue;
            }
            if (line.startsWith(":") || !line.startsWith("data:")) {
                continue;
            }
            String payload = line.substring(5);
            if (payload.startsWith(" ")) {
                payload = payload.substring(1);
            }
            if (data == null) {
                data = new StringBuilder(payload);
            } else {
                data.append('\n').append(payload);
            }
        }
    }
}
