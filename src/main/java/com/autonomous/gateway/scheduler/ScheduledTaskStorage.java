package com.autonomous.gateway.scheduler;

import com.autonomous.gateway.error.DatabaseException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;

/**
 * One pretty-printed JSON file per task, {@code <id>.json}, under the storage directory.
 */
@Slf4j
@Service
public class ScheduledTaskStorage {

    @Value("${scheduler.storage.path:data/scheduled_tasks}")
    private String storagePath;

    private final ObjectMapper mapper;

    public ScheduledTaskStorage() {
        this.mapper = new ObjectMapper();
        this.mapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    public void setStoragePath(String path) {
        this.storagePath = path;
    }

    /**
     * Writes to a temp file first and moves it over the old one.
     *
     * @throws DatabaseException when the file cannot be written
     */
    public void save(ScheduledTaskRecord record) {
        Path target = fileFor(record.getId());
        try {
            Files.createDirectories(target.getParent());
            Path temp = target.resolveSibling(record.getId() + ".json.tmp");
            mapper.writeValue(temp.toFile(), record);
            try {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            log.debug("Saved scheduled task {}", record.getId());
        } catch (IOException e) {
            throw new DatabaseException("Failed to save scheduled task " + record.getId() + ": " + e.getMessage(), e);
        }
    }

    /**
     * Every readable task file. Unreadable files are logged and skipped.
     */
    public List<ScheduledTaskRecord> loadAll() {
        List<ScheduledTaskRecord> records = new ArrayList<>();
        Path dir = Paths.get(storagePath);
        if (!Files.isDirectory(dir)) {
            return records;
        }
        try (DirectoryStream<Path> files = Files.newDirectoryStream(dir, "*.json")) {
            for (Path file : files) {
                try {
                    records.add(mapper.readValue(file.toFile(), ScheduledTaskRecord.class));
                } catch (IOException e) {
                    log.error("Skipping unreadable task file {}: {}", file.getFileName(), e.getMessage());
                }
            }
        } catch (IOException e) {
            throw new DatabaseException("Failed to list scheduled tasks in " + storagePath, e);
        }
        log.info("Loaded {} scheduled tasks from {}", records.size(), storagePath);
        return records;
    }

    public boolean delete(String taskId) {
        try {
            return Files.deleteIfExists(fileFor(taskId));
        } catch (IOException e) {
            throw new DatabaseException("Failed to delete scheduled task " + taskId + ": " + e.getMessage(), e);
        }
    }

    private Path fileFor(String taskId) {
        return Paths.get(storagePath, taskId + ".json");
    }
}
