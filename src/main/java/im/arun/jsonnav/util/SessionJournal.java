package im.arun.jsonnav.util;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Accumulates structured session entries (opens, analyses, evictions, searches).
 * With a journal directory every entry rewrites {@code <document>_<timestamp>.json}
 * there as an indented JSON array; without one, entries are only kept in memory.
 */
public class SessionJournal {
    private static final Logger logger = LoggerFactory.getLogger(SessionJournal.class);
    private static final DateTimeFormatter FILE_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final Path journalFile;
    private final List<Map<String, Object>> entries = new ArrayList<>();
    private final ObjectMapper writer = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    public static SessionJournal disabled() {
        return new SessionJournal(null, null);
    }

    public SessionJournal(String directory, String sourceName) {
        this.journalFile = directory == null ? null : prepareFile(Paths.get(directory), baseName(sourceName));
    }

    private static Path prepareFile(Path directory, String baseName) {
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            logger.error("Failed to create journal directory {}", directory, e);
        }
        return directory.resolve(baseName + "_" + LocalDateTime.now().format(FILE_STAMP) + ".json");
    }

    private static String baseName(String sourceName) {
        if (sourceName == null || sourceName.isBlank()) {
            return "Untitled";
        }
        Path fileName = Paths.get(sourceName).getFileName();
        String name = fileName == null ? sourceName : fileName.toString();
        int dot = name.lastIndexOf('.');
        return (dot > 0 ? name.substring(0, dot) : name).replaceAll("[/\\\\]", "-");
    }

    public void info(String message) {
        append("INFO", message, null);
    }

    public void info(String message, Map<String, ?> fields) {
        append("INFO", message, fields);
    }

    public void warn(String message, Map<String, ?> fields) {
        append("WARNING", message, fields);
    }

    public void error(String message, Map<String, ?> fields) {
        append("ERROR", message, fields);
    }

    private synchronized void append(String level, String message, Map<String, ?> fields) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("time", Instant.now().toString());
        entry.put("level", level);
        entry.put("message", message);
        if (fields != null) {
            entry.putAll(fields);
        }
        entries.add(entry);
        flush();
    }

    private void flush() {
        if (journalFile == null) {
            return;
        }
        try {
            writer.writeValue(journalFile.toFile(), entries);
        } catch (IOException e) {
            logger.error("Failed to write journal file: {}", journalFile, e);
        }
    }

    public synchronized List<Map<String, Object>> entries() {
        return new ArrayList<>(entries);
    }

    public Path getLogPath() {
        return journalFile;
    }
}
