package org.miniworker.monitoring;

import org.miniworker.utils.JsonUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Status store backed by a directory:
 * <ul>
 *   <li>{@code <worker_id>.json} structured snapshot</li>
 *   <li>{@code <worker_id>.stats} the same snapshot for humans</li>
 *   <li>{@code <worker_id>.pid} liveness marker</li>
 * </ul>
 * Files are written to a temp file in the same directory and renamed into place,
 * so readers never see a partial file. There is one writer per worker id.
 */
public class FileStatusStore implements StatusStore {
    private static final Logger logger = LoggerFactory.getLogger(FileStatusStore.class);

    public static final String JSON_SUFFIX = ".json";
    public static final String STATS_SUFFIX = ".stats";
    public static final String PID_SUFFIX = ".pid";

    private final Path statsDir;

    public FileStatusStore(Path statsDir) {
        this.statsDir = statsDir;
        try {
            Files.createDirectories(statsDir);
        } catch (IOException e) {
            logger.error("Cannot create stats directory {}: {}", statsDir, e.getMessage(), e);
        }
    }

    public Path statsDir() {
        return statsDir;
    }

    public Path jsonFile(String workerId) {
        return statsDir.resolve(workerId + JSON_SUFFIX);
    }

    public Path statsFile(String workerId) {
        return statsDir.resolve(workerId + STATS_SUFFIX);
    }

    public Path pidFile(String workerId) {
        return statsDir.resolve(workerId + PID_SUFFIX);
    }

    @Override
    public void write(String workerId, StatusSnapshot snapshot) {
        try {
            writeAtomically(statsFile(workerId), StatusFormatter.format(snapshot));
            writeAtomically(jsonFile(workerId), JsonUtil.prettyWriter().writeValueAsString(snapshot));
        } catch (StatusPersistenceException e) {
            logger.error("Error writing status files for {}: {}", workerId, e.getMessage(), e);
        } catch (IOException e) {
            logger.error("Error serializing status for {}: {}", workerId, e.getMessage(), e);
        }
    }

    @Override
    public Optional<StatusSnapshot> read(String workerId) {
        Path json = jsonFile(workerId);
        if (!Files.exists(json)) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(JsonUtil.mapper().readValue(json.toFile(), StatusSnapshot.class));
        } catch (IOException | RuntimeException e) {
            logger.warn("Error reading status file for {}: {}", workerId, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void writeLivenessMarker(String workerId, long pid) {
        Path pidFile = pidFile(workerId);
        try {
            writeAtomically(pidFile, Long.toString(pid));
            logger.debug("PID file written: {}", pidFile);
        } catch (StatusPersistenceException e) {
            logger.error("Error writing PID file {}: {}", pidFile, e.getMessage(), e);
        }
    }

    @Override
    public void removeLivenessMarker(String workerId) {
        Path pidFile = pidFile(workerId);
        try {
            if (Files.deleteIfExists(pidFile)) {
                logger.debug("PID file removed: {}", pidFile);
            }
        } catch (IOException e) {
            logger.error("Error removing PID file {}: {}", pidFile, e.getMessage(), e);
        }
    }

    @Override
    public Optional<Long> readLivenessMarker(String workerId) {
        Path pidFile = pidFile(workerId);
        if (!Files.exists(pidFile)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Long.parseLong(Files.readString(pidFile, StandardCharsets.UTF_8).trim()));
        } catch (IOException | NumberFormatException e) {
            logger.warn("Unreadable PID file {}: {}", pidFile, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public List<String> knownWorkerIds() {
        if (!Files.isDirectory(statsDir)) {
            return List.of();
        }
        List<String> ids = new ArrayList<>();
        try (DirectoryStream<Path> files = Files.newDirectoryStream(statsDir, "*" + JSON_SUFFIX)) {
            for (Path file : files) {
                String name = file.getFileName().toString();
                ids.add(name.substring(0, name.length() - JSON_SUFFIX.length()));
            }
        } catch (IOException e) {
            logger.error("Cannot list stats directory {}: {}", statsDir, e.getMessage(), e);
        }
        Collections.sort(ids);
        return ids;
    }

    private void writeAtomically(Path target, String content) {
        Path tmp = null;
        try {
            tmp = Files.createTempFile(statsDir, "." + target.getFileName(), ".tmp");
            Files.writeString(tmp, content, StandardCharsets.UTF_8);
            try {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            deleteQuietly(tmp);
            throw new StatusPersistenceException("Failed to write " + target, e);
        }
    }

    private void deleteQuietly(Path tmp) {
        if (tmp == null) return;
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            logger.debug("Could not remove temp file {}: {}", tmp, e.getMessage());
        }
    }
}
