package im.arun.hierconfig.util;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Structured log kept by each configuration tree.
 * Entries accumulate in memory and are mirrored to SLF4J; {@link #writeTo(Path)}
 * dumps them as a JSON array.
 */
public class TransformLog {
    private static final Logger systemLogger = LoggerFactory.getLogger(TransformLog.class);
    private final String source;
    private final List<Map<String, Object>> logData = new ArrayList<>();
    private final ObjectMapper objectMapper;

    public TransformLog() {
        this("config");
    }

    public TransformLog(String source) {
        this.source = source;
        this.objectMapper = new ObjectMapper();
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    public void info(String message) {
        info(message, Map.of());
    }

    public void info(String message, Map<String, ?> details) {
        systemLogger.debug("[{}] {} {}", source, message, details);
        log("INFO", message, details);
    }

    public void warn(String message) {
        warn(message, Map.of());
    }

    public void warn(String message, Map<String, ?> details) {
        systemLogger.warn("[{}] {} {}", source, message, details);
        log("WARNING", message, details);
    }

    private void log(String level, String message, Map<String, ?> details) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("level", level);
        entry.put("message", message);
        entry.putAll(details);
        logData.add(entry);
    }

    public List<Map<String, Object>> getEntries() {
        return Collections.unmodifiableList(logData);
    }

    /**
     * Messages of all entries in order, handy for assertions and console output.
     */
    public List<String> getMessages() {
        List<String> messages = new ArrayList<>();
        for (Map<String, Object> entry : logData) {
            messages.add(String.valueOf(entry.get("message")));
        }
        return messages;
    }

    public String getSource() {
        return source;
    }

    public void writeTo(Path logPath) throws IOException {
        Path parent = logPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        objectMapper.writeValue(logPath.toFile(), logData);
        systemLogger.info("Wrote {} log entries to {}", logData.size(), logPath);
    }
}
