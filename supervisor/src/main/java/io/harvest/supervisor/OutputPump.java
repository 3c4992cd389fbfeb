package io.harvest.supervisor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.BlockingQueue;

/**
 * Copies the child's merged output into a queue line by line and always finishes with the
 * end-of-stream marker, also when the stream breaks because the child was killed.
 */
final class OutputPump implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(OutputPump.class);

    private final InputStream in;
    private final BlockingQueue<ChildLine> lines;

    OutputPump(InputStream in, BlockingQueue<ChildLine> lines) {
        this.in = in;
        this.lines = lines;
    }

    @Override
    public void run() {
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                lines.add(ChildLine.of(line));
            }
        } catch (IOException e) {
            log.debug("child output closed: {}", e.getMessage());
        } finally {
            lines.add(ChildLine.endOfStream());
        }
    }
}
