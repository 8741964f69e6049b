package com.taskfleet.orchestrator.runtime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Drains an InputStream on a daemon thread into a size-capped buffer.
 *
 * Used for stderr of every process and for stdout of container exec calls,
 * whose output is captured whole rather than parsed incrementally.
 */
public final class StreamCollector {

    private static final Logger log = LoggerFactory.getLogger(StreamCollector.class);

    /** Output beyond this many characters is dropped; the head is kept. */
    static final int MAX_CHARS = 1_000_000;

    private final StringBuilder buffer = new StringBuilder();
    private final CountDownLatch finished = new CountDownLatch(1);

    private StreamCollector() {}

    public static StreamCollector start(InputStream in, String name) {
        StreamCollector collector = new StreamCollector();
        Thread t = new Thread(() -> collector.drain(in), name);
        t.setDaemon(true);
        t.start();
        return collector;
    }

    private void drain(InputStream in) {
        char[] chunk = new char[4096];
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            int n;
            while ((n = reader.read(chunk)) != -1) {
                synchronized (buffer) {
                    int room = MAX_CHARS - buffer.length();
                    if (room > 0) buffer.append(chunk, 0, Math.min(n, room));
                }
            }
        } catch (IOException e) {
            // The stream is closed underneath us when the process is killed.
            log.debug("Stream drain ended: {}", e.getMessage());
        } finally {
            finished.countDown();
        }
    }

    public String text() {
        synchronized (buffer) {
            return buffer.toString();
        }
    }

    /** Wait for end-of-stream, then return the text collected. */
    public String await(Duration timeout) {
        try {
            finished.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return text();
    }
}
