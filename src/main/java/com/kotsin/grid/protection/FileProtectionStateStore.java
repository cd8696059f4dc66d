package com.kotsin.grid.protection;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.kotsin.grid.config.ProtectionProps;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * JSON file next to the process. Written to a temp file and moved into place.
 */
@Repository
@ConditionalOnProperty(name = "grid.protection.store", havingValue = "file")
@Slf4j
public class FileProtectionStateStore implements ProtectionStateStore {

    private final Path file;
    private final ObjectMapper mapper = ProtectionStateJson.mapper();

    public FileProtectionStateStore(ProtectionProps props) {
        this(Path.of(props.stateFile()));
    }

    FileProtectionStateStore(Path file) {
        this.file = file;
    }

    @Override
    public Optional<ProtectionState> load() {
        if (!Files.exists(file)) return Optional.empty();
        try {
            return Optional.of(mapper.readValue(file.toFile(), ProtectionState.class));
        } catch (IOException e) {
            log.error("PROTECTION_STATE_LOAD_FAILED file={} error={}", file, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void save(ProtectionState state) {
        Path tmp = null;
        try {
            Path dir = file.toAbsolutePath().getParent();
            if (dir != null) Files.createDirectories(dir);
            tmp = Files.createTempFile(dir, file.getFileName().toString(), ".tmp");
            mapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), state);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            log.error("PROTECTION_STATE_SAVE_FAILED file={} error={}", file, e.getMessage());
            deleteTemp(tmp);
        }
    }

    private void deleteTemp(Path tmp) {
        if (tmp == null) return;
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            log.warn("PROTECTION_STATE_TMP_LEFT file={} error={}", tmp, e.getMessage());
        }
    }
}
