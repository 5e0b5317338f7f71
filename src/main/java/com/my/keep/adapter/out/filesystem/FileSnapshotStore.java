package com.my.keep.adapter.out.filesystem;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.my.keep.config.AppConfig;
import com.my.keep.domain.exception.SnapshotFormatException;
import com.my.keep.domain.exception.SnapshotStoreException;
import com.my.keep.domain.model.Snapshot;
import com.my.keep.domain.port.out.SnapshotStorePort;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * 왜: 세션 스냅샷을 단일 JSON 파일로 통째로 덮어써 보관하고, 임시 파일 후 원자적 이동으로 반쯤 쓰인 파일이 읽히지 않도록 하기 위함.
 */
@ApplicationScoped
public class FileSnapshotStore implements SnapshotStorePort {

    private static final Logger log = Logger.getLogger(FileSnapshotStore.class);

    private final Path statePath;
    private final ObjectMapper objectMapper;

    @Inject
    public FileSnapshotStore(AppConfig appConfig, ObjectMapper objectMapper) {
        this(Path.of(appConfig.keep().stateFile()), objectMapper);
    }

    public FileSnapshotStore(Path statePath, ObjectMapper objectMapper) {
        this.statePath = statePath;
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<Snapshot> load() {
        if (!Files.exists(statePath)) {
            return Optional.empty();
        }
        try {
            JsonNode state = objectMapper.readTree(statePath.toFile());
            if (state == null || state.isMissingNode() || state.isNull()) {
                throw new SnapshotFormatException("캐시 파일이 비어 있습니다: " + statePath);
            }
            return Optional.of(new Snapshot(state));
        } catch (JsonProcessingException e) {
            throw new SnapshotFormatException("캐시 파일을 해석할 수 없습니다: " + statePath, e);
        } catch (IOException e) {
            throw new SnapshotStoreException("캐시 파일 읽기 실패: " + statePath, e);
        }
    }

    @Override
    public void save(Snapshot snapshot) {
        Path target = statePath.toAbsolutePath();
        Path temp = null;
        try {
            Path parent = target.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            temp = Files.createTempFile(parent, target.getFileName().toString(), ".tmp");
            objectMapper.writeValue(temp.toFile(), snapshot.state());
            moveIntoPlace(temp, target);
        } catch (IOException e) {
            throw new SnapshotStoreException("캐시 파일 저장 실패: " + statePath, e);
        } finally {
            removeTemp(temp);
        }
    }

    @Override
    public String location() {
        return statePath.toString();
    }

    private void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void removeTemp(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warnf("임시 캐시 파일 삭제 실패: %s (%s)", temp, e.getMessage());
        }
    }
}
