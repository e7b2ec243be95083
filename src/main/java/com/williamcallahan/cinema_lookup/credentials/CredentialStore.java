package com.williamcallahan.cinema_lookup.credentials;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.cinema_lookup.config.AppConfigurationProperties;
import com.williamcallahan.cinema_lookup.exception.CorruptStateException;
import com.williamcallahan.cinema_lookup.model.Credentials;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Reads and atomically writes the persisted credential file
 */
@Component
public class CredentialStore {

    private static final Logger logger = LoggerFactory.getLogger(CredentialStore.class);

    private final Path file;
    private final ObjectMapper objectMapper;

    @Autowired
    public CredentialStore(AppConfigurationProperties properties, ObjectMapper objectMapper) {
        this(Path.of(properties.getCredentials().getFile()), objectMapper);
    }

    public CredentialStore(Path file, ObjectMapper objectMapper) {
        this.file = file;
        this.objectMapper = objectMapper;
    }

    public Path getFile() {
        return file;
    }

    /**
     * @return persisted credentials; empty when the file is missing or cannot be decoded
     */
    public Optional<Credentials> load() {
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(file.toFile(), Credentials.class));
        } catch (IOException e) {
            CorruptStateException corrupt = new CorruptStateException(file, "unreadable credential file", e);
            logger.warn("Ignoring credential file: {}", corrupt.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Writes to a temp file beside the target, then moves it over the target
     *
     * @return true when the file was replaced
     */
    public boolean save(Credentials credentials) {
        Path tempFile = null;
        try {
            Path parent = file.toAbsolutePath().getParent();
            Files.createDirectories(parent);
            tempFile = Files.createTempFile(parent, file.getFileName().toString(), ".tmp");
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(tempFile.toFile(), credentials);
            moveIntoPlace(tempFile, file);
            return true;
        } catch (IOException e) {
            logger.error("Failed to persist credentials to {}: {}", file, e.getMessage(), e);
            deleteQuietly(tempFile);
            return false;
        }
    }

    static void moveIntoPlace(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path path) {
        if (path == null) {
            return;
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            logger.debug("Could not remove temp file {}: {}", path, e.getMessage());
        }
    }
}
