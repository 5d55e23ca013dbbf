package com.ryuqq.feed.adapter.file.history;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.feed.adapter.file.support.CacheJson;
import com.ryuqq.feed.core.exception.CacheCorruptException;
import com.ryuqq.feed.core.model.CacheKey;
import com.ryuqq.feed.core.model.HistoricalSnapshot;
import com.ryuqq.feed.core.spi.HistoryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Append-only {@link HistoryStore} backed by daily JSON Lines files.
 *
 * <p>Each snapshot becomes one line of {@code history-<yyyy-MM-dd>.jsonl}, where the date is the
 * UTC date of its fetch timestamp. Lines are never rewritten or removed.</p>
 *
 * <p><strong>Malformed lines:</strong> a line that cannot be decoded is logged at WARN and skipped,
 * so one torn write does not hide the rest of the day's history. An unreadable file raises
 * {@link CacheCorruptException}.</p>
 *
 * <p><strong>Thread Safety:</strong> appends are serialized on the store instance.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class JsonLinesHistoryStore implements HistoryStore {

    private static final Logger log = LoggerFactory.getLogger(JsonLinesHistoryStore.class);

    static final String FILE_PREFIX = "history-";
    static final String FILE_SUFFIX = ".jsonl";
    private static final DateTimeFormatter DAY = DateTimeFormatter.ISO_LOCAL_DATE;

    private final Path directory;
    private final ObjectMapper mapper;

    /**
     * Creates the store, creating the directory if needed.
     *
     * @param directory history directory
     * @throws IllegalArgumentException if directory is null
     * @throws UncheckedIOException if the directory cannot be created
     */
    public JsonLinesHistoryStore(Path directory) {
        if (directory == null) {
            throw new IllegalArgumentException("directory cannot be null");
        }
        this.directory = directory;
        this.mapper = CacheJson.newMapper();
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create history directory " + directory, e);
        }
    }

    @Override
    public synchronized void append(HistoricalSnapshot snapshot) {
        if (snapshot == null) {
            throw new IllegalArgumentException("snapshot cannot be null");
        }
        Path file = fileFor(snapshot.fetchTimestamp());
        try {
            String line = mapper.writeValueAsString(HistoryRecord.from(snapshot)) + "\n";
            Files.writeString(file, line, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to append history to " + file, e);
        }
    }

    @Override
    public List<HistoricalSnapshot> snapshots(CacheKey key, Instant since) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (since == null) {
            throw new IllegalArgumentException("since cannot be null");
        }
        LocalDate firstDay = LocalDate.ofInstant(since, ZoneOffset.UTC);
        List<HistoricalSnapshot> result = new ArrayList<>();
        for (Path file : dailyFiles()) {
            Optional<LocalDate> day = dayOf(file);
            if (day.isEmpty() || day.get().isBefore(firstDay)) {
                continue;
            }
            for (HistoricalSnapshot snapshot : readFile(file, key)) {
                if (!snapshot.fetchTimestamp().isBefore(since)) {
                    result.add(snapshot);
                }
            }
        }
        result.sort(Comparator.comparing(HistoricalSnapshot::fetchTimestamp));
        return result;
    }

    @Override
    public Optional<HistoricalSnapshot> latest(CacheKey key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        List<Path> files = dailyFiles();
        for (int i = files.size() - 1; i >= 0; i--) {
            Optional<HistoricalSnapshot> newest = readFile(files.get(i), key).stream()
                .max(Comparator.comparing(HistoricalSnapshot::fetchTimestamp));
            if (newest.isPresent()) {
                return newest;
            }
        }
        return Optional.empty();
    }

    /**
     * Returns the history directory.
     *
     * @return the directory
     */
    public Path getDirectory() {
        return directory;
    }

    private Path fileFor(Instant fetchTimestamp) {
        return directory.resolve(FILE_PREFIX + DAY.format(LocalDate.ofInstant(fetchTimestamp, ZoneOffset.UTC))
            + FILE_SUFFIX);
    }

    private List<Path> dailyFiles() {
        try (Stream<Path> stream = Files.list(directory)) {
            return stream
                .filter(path -> {
                    String name = path.getFileName().toString();
                    return name.startsWith(FILE_PREFIX) && name.endsWith(FILE_SUFFIX);
                })
                .sorted(Comparator.comparing(path -> path.getFileName().toString()))
                .collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list history directory " + directory, e);
        }
    }

    private Optional<LocalDate> dayOf(Path file) {
        String name = file.getFileName().toString();
        String day = name.substring(FILE_PREFIX.length(), name.length() - FILE_SUFFIX.length());
        try {
            return Optional.of(LocalDate.parse(day, DAY));
        } catch (DateTimeParseException e) {
            log.warn("Ignoring history file with unparseable date: {}", name);
            return Optional.empty();
        }
    }

    private List<HistoricalSnapshot> readFile(Path file, CacheKey key) {
        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new CacheCorruptException(file.toString(), e);
        }

        List<HistoricalSnapshot> matches = new ArrayList<>();
        for (int lineNumber = 0; lineNumber < lines.size(); lineNumber++) {
            String line = lines.get(lineNumber);
            if (line.isBlank()) {
                continue;
            }
            try {
                HistoryRecord record = mapper.readValue(line, HistoryRecord.class);
                if (key.getValue().equals(record.key())) {
                    matches.add(record.toSnapshot());
                }
            } catch (IOException | RuntimeException e) {
                log.warn("Skipping malformed history line {}:{}", file.getFileName(), lineNumber + 1, e);
            }
        }
        return matches;
    }
}
