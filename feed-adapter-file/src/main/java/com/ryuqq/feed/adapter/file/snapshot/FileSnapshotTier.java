package com.ryuqq.feed.adapter.file.snapshot;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.feed.adapter.file.support.AtomicFiles;
import com.ryuqq.feed.adapter.file.support.CacheJson;
import com.ryuqq.feed.adapter.file.support.SafeNames;
import com.ryuqq.feed.core.exception.CacheCorruptException;
import com.ryuqq.feed.core.model.CacheEntry;
import com.ryuqq.feed.core.model.CacheKey;
import com.ryuqq.feed.core.model.CacheTier;
import com.ryuqq.feed.core.spi.CacheTierStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * File-backed implementation of {@link CacheTierStore}.
 *
 * <p>Every write creates a new timestamped JSON document and then atomically repoints the
 * key's {@code .latest} file at it. Older documents stay on disk until
 * {@link #purgeOlderThan(Instant)} removes them.</p>
 *
 * <p><strong>Layout:</strong></p>
 * <pre>
 * snapshot-dir/
 *   odds_api_americanfootball_nfl_odds_markets_spreads__20250907T120000123Z.json
 *   odds_api_americanfootball_nfl_odds_markets_spreads__20250907T121500456Z.json
 *   odds_api_americanfootball_nfl_odds_markets_spreads.latest   (holds the newest file name)
 * </pre>
 *
 * <p><strong>Thread Safety:</strong> writes to the same key are serialized by a per-key lock;
 * readers never lock and always see a complete document.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class FileSnapshotTier implements CacheTierStore {

    private static final Logger log = LoggerFactory.getLogger(FileSnapshotTier.class);

    static final String SNAPSHOT_SUFFIX = ".json";
    static final String POINTER_SUFFIX = ".latest";
    static final String TIMESTAMP_SEPARATOR = "__";
    static final DateTimeFormatter TIMESTAMP =
        DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmssSSS'Z'").withZone(ZoneOffset.UTC);

    private final Path directory;
    private final ObjectMapper mapper;
    private final ConcurrentHashMap<String, Object> keyLocks = new ConcurrentHashMap<>();

    /**
     * Creates the tier, creating the directory if needed.
     *
     * @param directory snapshot directory
     * @throws IllegalArgumentException if directory is null
     * @throws UncheckedIOException if the directory cannot be created
     */
    public FileSnapshotTier(Path directory) {
        this(directory, CacheJson.newMapper());
    }

    FileSnapshotTier(Path directory, ObjectMapper mapper) {
        if (directory == null) {
            throw new IllegalArgumentException("directory cannot be null");
        }
        this.directory = directory;
        this.mapper = mapper;
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create snapshot directory " + directory, e);
        }
    }

    @Override
    public CacheTier tier() {
        return CacheTier.FILE;
    }

    /**
     * {@inheritDoc}
     *
     * <p>A pointer that names a missing or unreadable document raises {@link CacheCorruptException}.
     * A document whose stored key differs from the requested key (a shortened-name collision)
     * is treated as a miss.</p>
     */
    @Override
    public Optional<CacheEntry> read(CacheKey key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        String safeName = SafeNames.of(key.getValue());
        Optional<String> latest = readPointer(pointerPath(safeName));
        if (latest.isEmpty()) {
            return Optional.empty();
        }

        Path snapshotPath = directory.resolve(latest.get());
        SnapshotDocument document;
        try {
            document = mapper.readValue(Files.readAllBytes(snapshotPath), SnapshotDocument.class);
        } catch (IOException | RuntimeException e) {
            throw new CacheCorruptException(snapshotPath.toString(), e);
        }
        if (!key.getValue().equals(document.key())) {
            log.warn("Snapshot {} belongs to key={}, not {}", snapshotPath, document.key(), key.getValue());
            return Optional.empty();
        }
        try {
            return Optional.of(document.toEntry());
        } catch (IllegalArgumentException e) {
            throw new CacheCorruptException(snapshotPath.toString(), e);
        }
    }

    @Override
    public void write(CacheEntry entry) {
        if (entry == null) {
            throw new IllegalArgumentException("entry cannot be null");
        }
        String safeName = SafeNames.of(entry.key().getValue());
        String fileName = safeName + TIMESTAMP_SEPARATOR + TIMESTAMP.format(entry.fetchedAt()) + SNAPSHOT_SUFFIX;

        synchronized (keyLocks.computeIfAbsent(safeName, name -> new Object())) {
            try {
                AtomicFiles.write(directory.resolve(fileName), mapper.writeValueAsBytes(SnapshotDocument.from(entry)));
                AtomicFiles.write(pointerPath(safeName), fileName.getBytes(StandardCharsets.UTF_8));
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to write snapshot " + fileName, e);
            }
        }
        log.debug("Wrote snapshot {} for key={}", fileName, entry.key().getValue());
    }

    /**
     * {@inheritDoc}
     *
     * <p>Only the pointer is removed; the documents stay until purged.</p>
     */
    @Override
    public void invalidate(CacheKey key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        String safeName = SafeNames.of(key.getValue());
        synchronized (keyLocks.computeIfAbsent(safeName, name -> new Object())) {
            try {
                Files.deleteIfExists(pointerPath(safeName));
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to invalidate snapshot pointer for " + key.getValue(), e);
            }
        }
    }

    @Override
    public void clear() {
        List<Path> files = listFiles();
        for (Path file : files) {
            String name = file.getFileName().toString();
            if (name.endsWith(SNAPSHOT_SUFFIX) || name.endsWith(POINTER_SUFFIX)) {
                deleteQuietly(file);
            }
        }
        log.info("Cleared snapshot directory {}", directory);
    }

    /**
     * {@inheritDoc}
     *
     * <p>Documents currently named by a {@code .latest} pointer are kept regardless of age.</p>
     */
    @Override
    public int purgeOlderThan(Instant cutoff) {
        if (cutoff == null) {
            throw new IllegalArgumentException("cutoff cannot be null");
        }
        List<Path> files = listFiles();
        Set<String> referenced = new HashSet<>();
        for (Path file : files) {
            if (file.getFileName().toString().endsWith(POINTER_SUFFIX)) {
                readPointer(file).ifPresent(referenced::add);
            }
        }

        int deleted = 0;
        for (Path file : files) {
            String name = file.getFileName().toString();
            if (!name.endsWith(SNAPSHOT_SUFFIX) || referenced.contains(name)) {
                continue;
            }
            Optional<Instant> writtenAt = timestampOf(name);
            if (writtenAt.isPresent() && writtenAt.get().isBefore(cutoff) && deleteQuietly(file)) {
                deleted++;
            }
        }
        if (deleted > 0) {
            log.info("Purged {} superseded snapshots older than {}", deleted, cutoff);
        }
        return deleted;
    }

    /**
     * Returns the snapshot directory.
     *
     * @return the directory
     */
    public Path getDirectory() {
        return directory;
    }

    static Optional<Instant> timestampOf(String fileName) {
        int separator = fileName.lastIndexOf(TIMESTAMP_SEPARATOR);
        if (separator < 0 || !fileName.endsWith(SNAPSHOT_SUFFIX)) {
            return Optional.empty();
        }
        String stamp = fileName.substring(separator + TIMESTAMP_SEPARATOR.length(),
            fileName.length() - SNAPSHOT_SUFFIX.length());
        try {
            return Optional.of(Instant.from(TIMESTAMP.parse(stamp)));
        } catch (DateTimeParseException e) {
            log.warn("Ignoring snapshot file with unparseable timestamp: {}", fileName);
            return Optional.empty();
        }
    }

    private Path pointerPath(String safeName) {
        return directory.resolve(safeName + POINTER_SUFFIX);
    }

    private Optional<String> readPointer(Path pointer) {
        try {
            String target = Files.readString(pointer, StandardCharsets.UTF_8).trim();
            return target.isEmpty() ? Optional.empty() : Optional.of(target);
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new CacheCorruptException(pointer.toString(), e);
        }
    }

    private List<Path> listFiles() {
        try (Stream<Path> stream = Files.list(directory)) {
            return stream.filter(Files::isRegularFile).collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list snapshot directory " + directory, e);
        }
    }

    private boolean deleteQuietly(Path file) {
        try {
            return Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Failed to delete snapshot file {}", file, e);
            return false;
        }
    }
}
