package org.netpreserve.pdfharvest;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.netpreserve.pdfharvest.util.Url;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import static java.nio.file.StandardOpenOption.*;

/**
 * Durable record of every URL saved so far, kept as a JSON object keyed by URL.
 * <p>
 * Each {@link #record} rewrites the whole file into a temporary sibling and renames it over the original, so a
 * reader sees either the previous or the new version. {@link #contains} answers from memory and is only valid
 * after {@link #load()}.
 */
public class HistoryStore {
    private static final Logger log = LoggerFactory.getLogger(HistoryStore.class);
    private static final TypeReference<LinkedHashMap<String, HistoryRecord>> RECORDS_TYPE = new TypeReference<>() {
    };

    private final Path path;
    private final Clock clock;
    private final ObjectMapper mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    private final Map<String, HistoryRecord> records = new LinkedHashMap<>(); // guarded by this
    private final Set<Url> processed = ConcurrentHashMap.newKeySet();

    public HistoryStore(Path path) {
        this(path, Clock.systemUTC());
    }

    HistoryStore(Path path, Clock clock) {
        this.path = path;
        this.clock = clock;
    }

    public synchronized Map<Url, HistoryRecord> load() {
        records.clear();
        processed.clear();
        if (Files.exists(path)) {
            try {
                Map<String, HistoryRecord> saved = mapper.readValue(path.toFile(), RECORDS_TYPE);
                if (saved != null) {
                    saved.forEach((url, record) -> {
                        if (record != null) records.put(url, record);
                    });
                }
            } catch (IOException e) {
                log.atWarn().addKeyValue("path", path).setCause(e)
                        .log("Unreadable history file, starting with an empty history");
                records.clear();
            }
        }
        var result = new LinkedHashMap<Url, HistoryRecord>();
        records.forEach((url, record) -> {
            Url key = new Url(url).withoutFragment();
            processed.add(key);
            result.put(key, record);
        });
        log.info("Loaded {} history entries from {}", result.size(), path);
        return Collections.unmodifiableMap(result);
    }

    public boolean contains(Url url) {
        return processed.contains(url.withoutFragment());
    }

    /**
     * Adds an entry and persists the full history.
     *
     * @return false if the file could not be written; the URL still counts as processed for this run
     */
    public synchronized boolean record(Url url, String filename, String fingerprint) {
        Url key = url.withoutFragment();
        records.put(key.toString(), new HistoryRecord(filename, fingerprint, clock.instant()));
        processed.add(key);
        try {
            write();
            return true;
        } catch (IOException e) {
            log.atWarn().addKeyValue("url", key).addKeyValue("stage", "PERSIST").addKeyValue("path", path)
                    .log("Failed to persist history entry: {}", e.toString());
            return false;
        }
    }

    public int size() {
        return processed.size();
    }

    public Path path() {
        return path;
    }

    private void write() throws IOException {
        byte[] data = mapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(records);
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        try {
            try (FileChannel channel = FileChannel.open(tmp, CREATE, TRUNCATE_EXISTING, WRITE)) {
                ByteBuffer buffer = ByteBuffer.wrap(data);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }
            try {
                Files.move(tmp, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            try {
                Files.deleteIfExists(tmp);
            } catch (IOException e2) {
                e.addSuppressed(e2);
            }
            throw e;
        }
    }
}
