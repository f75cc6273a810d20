package io.minicron.core.exec;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

// Keeps at most limit bytes and discards the rest so the child never blocks on a full pipe.
final class OutputCapture implements Runnable {
    private static final Logger LOG = LoggerFactory.getLogger(OutputCapture.class);
    static final String TRUNCATED_MARKER = "\n[truncated]";

    private final InputStream input;
    private final int limit;
    private final ByteArrayOutputStream kept = new ByteArrayOutputStream();
    private boolean truncated;
    private final Thread thread;

    OutputCapture(InputStream input, int limit, String threadName) {
        this.input = input;
        this.limit = limit;
        this.thread = new Thread(this, threadName);
        this.thread.setDaemon(true);
    }

    OutputCapture start() {
        thread.start();
        return this;
    }

    @Override
    public void run() {
        byte[] buffer = new byte[8192];
        try (InputStream in = input) {
            int read;
            while ((read = in.read(buffer)) != -1) {
                synchronized (this) {
                    int room = limit - kept.size();
                    if (room > 0) {
                        kept.write(buffer, 0, Math.min(room, read));
                    }
                    if (read > room) {
                        truncated = true;
                    }
                }
            }
        } catch (IOException e) {
            LOG.debug("{} stopped reading: {}", thread.getName(), e.getMessage());
        }
    }

    String await(long graceMillis) throws InterruptedException {
        thread.join(graceMillis);
        if (thread.isAlive()) {
            try {
                input.close();
            } catch (IOException e) {
                LOG.debug("Failed to close {}: {}", thread.getName(), e.getMessage());
            }
            thread.join(graceMillis);
        }
        synchronized (this) {
            if (!truncated) {
                return kept.toString(StandardCharsets.UTF_8);
            }
            byte[] bytes = kept.toByteArray();
            return new String(bytes, 0, completeLength(bytes), StandardCharsets.UTF_8) + TRUNCATED_MARKER;
        }
    }

    // Drops a multi-byte UTF-8 sequence that the cap cut short.
    static int completeLength(byte[] bytes) {
        int end = bytes.length;
        for (int back = 1; back <= 3 && end - back >= 0; back++) {
            int b = bytes[end - back] & 0xFF;
            if ((b & 0xC0) == 0x80) {
                continue;
            }
            int needed = b >= 0xF0 ? 4 : b >= 0xE0 ? 3 : b >= 0xC0 ? 2 : 1;
            return needed > back ? end - back : end;
        }
        return end;
    }
}
