package com.my.keep.domain.service;

import com.my.keep.domain.exception.KeepSyncException;
import com.my.keep.domain.model.Snapshot;
import com.my.keep.domain.port.out.KeepSession;
import com.my.keep.domain.port.out.SnapshotStorePort;
import org.jboss.logging.Logger;

import java.util.concurrent.locks.ReentrantLock;

/**
 * 왜: "원격에서 최신 상태를 받아온 뒤 스냅샷을 저장"하는 한 단계를 직렬화하여 두 동기화의 스냅샷 기록이 섞이지 않도록 하기 위함.
 */
public class SyncOrchestrator {

    private static final Logger log = Logger.getLogger(SyncOrchestrator.class);

    private final SnapshotStorePort snapshotStorePort;
    private final ReentrantLock refreshLock = new ReentrantLock();

    public SyncOrchestrator(SnapshotStorePort snapshotStorePort) {
        this.snapshotStorePort = snapshotStorePort;
    }

    public void refresh(KeepSession session) {
        refreshLock.lock();
        try {
            log.info("Google Keep 과 동기화 중...");
            try {
                session.sync();
            } catch (KeepSyncException e) {
                log.errorf("동기화 실패, 기존 캐시를 유지합니다: %s", e.getMessage());
                throw e;
            } catch (RuntimeException e) {
                log.errorf("동기화 실패, 기존 캐시를 유지합니다: %s", e.getMessage());
                throw new KeepSyncException("Google Keep 동기화 실패: " + e.getMessage(), e);
            }
            Snapshot snapshot = session.dump();
            snapshotStorePort.save(snapshot);
            log.infof("캐시를 저장했습니다: %s", snapshotStorePort.location());
        } finally {
            refreshLock.unlock();
        }
    }
}
