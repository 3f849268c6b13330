package com.skanga.sqlgate.exelog;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.skanga.sqlgate.config.LogBackendKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Audit store of append-only JSON-lines files, one file per UTC calendar day named
 * {@code execution_logs_YYYY-MM-DD.jsonl}. Every entry is appended as one complete line through
 * an append-mode channel, so concurrent writers interleave at line granularity. There is no index:
 * queries scan files newest first and lines last first, stopping at the limit.
 */
public class JsonLinesLogStore implements ExecutionLogStore {
    private static final Logger logger = LoggerFactory.getLogger(JsonLinesLogStore.class);

    static final String FILE_PREFIX = "execution_logs_";
    static final String FILE_SUFFIX = ".jsonl";
    private static final Pattern FILE_NAME = Pattern.compile(
            Pattern.quote(FILE_PREFIX) + "(\\d{4}-\\d{2}-\\d{2})" + Pattern.quote(FILE_SUFFIX));

    private static final ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private static final int READ_CHUNK_SIZE = 8192;

    // Serializes appends inside this JVM; O_APPEND covers other processes
    private static final Object APPEND_LOCK = new Object();

    private final Path directory;

    public JsonLinesLogStore(Path directory) {
        this.directory = directory.toAbsolutePath().normalize();
    }

    /**
     * Line layout of the file backend.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    record LogLine(
            @JsonProperty("timestamp") Instant timestamp,
            @JsonProperty("user") String user,
            @JsonProperty("command") String command,
            @JsonProperty("result") String result,
            @JsonProperty("time_cost_ms") long timeCostMs,
            @JsonProperty("command_type") String commandType
    ) {
        static LogLine from(LogEntry entry) {
            return new LogLine(entry.executionTime(), entry.user(), entry.command(), entry.result(),
                    entry.timeCostMs(), entry.commandType());
        }

        LogEntry toEntry() {
            return new LogEntry(null, user, command, result, timestamp, timeCostMs, commandType, null);
        }
    }

    @Override
    public LogBackendKind kind() {
        return LogBackendKind.APPEND_ONLY_FILE;
    }

    @Override
    public void initialize() throws LogStoreException {
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new LogStoreException("Cannot create log directory: " + directory, e);
        }
        if (!Files.isWritable(directory)) {
            throw new LogStoreException("Log directory is not writable: " + directory);
        }
    }

    @Override
    public void append(LogEntry entry) throws LogStoreException {
        Path logFile = fileFor(entry.executionTime());
        byte[] line;
        try {
            line = (objectMapper.writeValueAsString(LogLine.from(entry)) + "\n").getBytes(StandardCharsets.UTF_8);
        } catch (JsonProcessingException e) {
            throw new LogStoreException("Failed to serialize execution log", e);
        }
        try {
            Files.createDirectories(directory);
            synchronized (APPEND_LOCK) {
                try (FileChannel channel = FileChannel.open(logFile,
                        StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND)) {
                    ByteBuffer buffer = ByteBuffer.wrap(line);
                    while (buffer.hasRemaining()) {
                        channel.write(buffer);
                    }
                }
            }
        } catch (IOException e) {
            throw new LogStoreException("Failed to append to " + logFile + ": " + e.getMessage(), e);
        }
    }

    @Override
    public List<LogEntry> query(LogQuery query) throws LogStoreException {
        List<LogEntry> matches = new ArrayList<>();
        if (!Files.isDirectory(directory)) {
            return matches;
        }
        for (Path logFile : logFilesNewestFirst(query)) {
            List<String> lines;
            try {
                lines = readLines(logFile);
            } catch (IOException e) {
                logger.warn("Skipping unreadable log file {}: {}", logFile, e.getMessage());
                continue;
            }
            for (int i = lines.size() - 1; i >= 0; i--) {
                LogEntry entry = parseLine(logFile, lines.get(i));
                if (entry != null && query.matches(entry)) {
                    matches.add(entry);
                    if (matches.size() >= query.limit()) {
                        return matches;
                    }
                }
            }
        }
        return matches;
    }

    /**
     * Daily files that can hold entries inside the query's time range, newest day first.
     */
    List<Path> logFilesNewestFirst(LogQuery query) throws LogStoreException {
        LocalDate firstDay = query.startTime() == null ? null : LocalDate.ofInstant(query.startTime(), ZoneOffset.UTC);
        LocalDate lastDay = query.endTime() == null ? null : LocalDate.ofInstant(query.endTime(), ZoneOffset.UTC);

        List<Path> logFiles = new ArrayList<>();
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, FILE_PREFIX + "*" + FILE_SUFFIX)) {
            for (Path file : files) {
                Matcher matcher = FILE_NAME.matcher(file.getFileName().toString());
                if (!matcher.matches()) {
                    continue;
                }
                LocalDate day;
                try {
                    day = LocalDate.parse(matcher.group(1));
                } catch (DateTimeParseException e) {
                    logger.debug("Ignoring log file with invalid date: {}", file);
                    continue;
                }
                if ((firstDay == null || !day.isBefore(firstDay)) && (lastDay == null || !day.isAfter(lastDay))) {
                    logFiles.add(file);
                }
            }
        } catch (IOException e) {
            throw new LogStoreException("Failed to list log directory " + directory + ": " + e.getMessage(), e);
        }
        logFiles.sort(Comparator.comparing((Path p) -> p.getFileName().toString()).reversed());
        return logFiles;
    }

    /**
     * Splits a log file on newlines while streaming it. A line that is not valid UTF-8 is
     * skipped on its own, the rest of the file is still returned.
     */
    static List<String> readLines(Path logFile) throws IOException {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        List<String> lines = new ArrayList<>();
        ByteArrayOutputStream currentLine = new ByteArrayOutputStream();
        byte[] chunk = new byte[READ_CHUNK_SIZE];
        try (InputStream in = Files.newInputStream(logFile)) {
            int read;
            while ((read = in.read(chunk)) != -1) {
                int lineStart = 0;
                for (int i = 0; i < read; i++) {
                    if (chunk[i] == '\n') {
                        currentLine.write(chunk, lineStart, i - lineStart);
                        addDecodedLine(logFile, decoder, currentLine, lines);
                        lineStart = i + 1;
                    }
                }
                currentLine.write(chunk, lineStart, read - lineStart);
            }
        }
        addDecodedLine(logFile, decoder, currentLine, lines);
        return lines;
    }

    private static void addDecodedLine(Path logFile, CharsetDecoder decoder, ByteArrayOutputStream currentLine,
                                       List<String> lines) {
        if (currentLine.size() == 0) {
            return;
        }
        try {
            lines.add(decoder.decode(ByteBuffer.wrap(currentLine.toByteArray())).toString());
        } catch (CharacterCodingException e) {
            logger.debug("Skipping log line with invalid UTF-8 in {}: {}", logFile, e.getMessage());
        } finally {
            currentLine.reset();
        }
    }

    private static LogEntry parseLine(Path logFile, String line) {
        if (line.isBlank()) {
            return null;
        }
        try {
            LogLine logLine = objectMapper.readValue(line, LogLine.class);
            if (logLine.timestamp() == null) {
                logger.debug("Skipping log line without timestamp in {}", logFile);
                return null;
            }
            return logLine.toEntry();
        } catch (JsonProcessingException | IllegalArgumentException e) {
            logger.debug("Skipping malformed log line in {}: {}", logFile, e.getMessage());
            return null;
        }
    }

    Path fileFor(Instant executionTime) {
        LocalDate day = LocalDate.ofInstant(executionTime, ZoneOffset.UTC);
        return directory.resolve(FILE_PREFIX + day + FILE_SUFFIX);
    }

    public Path directory() {
        return directory;
    }

    @Override
    public void close() {
        // Files are opened per write
    }
}
