package net.homeroute.adapters.persistence;

import net.homeroute.exception.RegistryStorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Reads and writes the registry JSON document on local disk.
 *
 * <p>Writes go to a temporary file in the same directory which is then moved
 * over the target, so readers never observe a half-written document.</p>
 */
public class RegistryFileRepository {

    private static final Logger log = LoggerFactory.getLogger(RegistryFileRepository.class);

    private final Path file;
    private final ObjectMapper objectMapper;

    public RegistryFileRepository(Path file, ObjectMapper objectMapper) {
        this.file = file;
        this.objectMapper = objectMapper;
    }

    public Path getFile() {
        return file;
    }

    /**
     * @return the stored document, empty when the file does not exist yet
     * @throws RegistryStorageException when the file cannot be read or is not a JSON object
     */
    public Optional<ObjectNode> read() {
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        String content;
        try {
            content = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new RegistryStorageException("Failed to read registry file " + file, ex);
        }
        try {
            JsonNode node = objectMapper.readTree(content);
            if (node instanceof ObjectNode document) {
                return Optional.of(document);
            }
            throw new RegistryStorageException("Registry file " + file + " does not contain a JSON object");
        } catch (JacksonException ex) {
            throw new RegistryStorageException("Registry file " + file + " is not valid JSON", ex);
        }
    }

    public void write(ObjectNode document) {
        Path directory = file.toAbsolutePath().getParent();
        Path temp = null;
        try {
            Files.createDirectories(directory);
            temp = Files.createTempFile(directory, file.getFileName().toString(), ".tmp");
            Files.writeString(temp, objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(document),
                StandardCharsets.UTF_8);
            moveIntoPlace(temp);
        } catch (IOException | JacksonException ex) {
            deleteQuietly(temp);
            throw new RegistryStorageException("Failed to write registry file " + file, ex);
        }
    }

    private void moveIntoPlace(Path temp) throws IOException {
        try {
            Files.move(temp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException ex) {
            log.warn("Atomic move not supported for {}, falling back to a plain replace", file);
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException cleanupFailure) {
            log.warn("Could not remove temporary registry file {}: {}", temp, cleanupFailure.getMessage());
        }
    }
}
