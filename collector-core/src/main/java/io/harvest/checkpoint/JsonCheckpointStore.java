package io.harvest.checkpoint;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.harvest.core.AtomicFiles;
import io.harvest.core.WorkItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Stores the checkpoint as {@code {"nextIndex":n,"items":[...]}}, rewritten whole on every save.
 */
public class JsonCheckpointStore implements CheckpointStore {
    private static final Logger log = LoggerFactory.getLogger(JsonCheckpointStore.class);
    private static final ObjectMapper M = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final Path file;

    public JsonCheckpointStore(Path file) {
        this.file = file.toAbsolutePath();
    }

    public Path file() { return file; }

    @Override
    public Checkpoint load() {
        if (!Files.exists(file)) return Checkpoint.empty();
        try {
            Stored s = M.readValue(file.toFile(), Stored.class);
            if (s == null || s.items == null || s.nextIndex < 0) {
                log.warn("checkpoint {} is incomplete, starting over", file);
                return Checkpoint.empty();
            }
            List<WorkItem> items = new ArrayList<>(s.items.size());
            for (String id : s.items) items.add(new WorkItem(id));
            return new Checkpoint(s.nextIndex, items);
        } catch (IOException | IllegalArgumentException | NullPointerException e) {
            log.warn("checkpoint {} is unreadable, starting over: {}", file, e.toString());
            return Checkpoint.empty();
        }
    }

    @Override
    public void save(int nextIndex, List<WorkItem> items) {
        Stored s = new Stored();
        s.nextIndex = nextIndex;
        s.items = items.stream().map(WorkItem::id).toList();
        try {
            AtomicFiles.write(file, out -> M.writeValue(out, s));
        } catch (IOException e) {
            throw new UncheckedIOException("cannot save checkpoint " + file, e);
        }
    }

    static final class Stored {
        @JsonProperty("nextIndex") public int nextIndex;
        @JsonProperty("items") public List<String> items;
    }
}
