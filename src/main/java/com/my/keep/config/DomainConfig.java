package com.my.keep.config;

import com.my.keep.adapter.out.clock.OffsetClockAdapter;
import com.my.keep.domain.port.out.ClockPort;
import com.my.keep.domain.port.out.CredentialsPort;
import com.my.keep.domain.port.out.KeepClientPort;
import com.my.keep.domain.port.out.SnapshotStorePort;
import com.my.keep.domain.service.KeepSessionManager;
import com.my.keep.domain.service.NoteNormalizer;
import com.my.keep.domain.service.NoteQueryService;
import com.my.keep.domain.service.SyncOrchestrator;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;

/**
 * 왜: 도메인 서비스와 포트 구현을 명시적으로 연결하여 세션이 프로세스당 하나만 만들어지도록 보장하기 위함.
 */
@ApplicationScoped
public class DomainConfig {

    @Produces
    @Singleton
    public KeepSessionManager keepSessionManager(CredentialsPort credentialsPort,
                                                 SnapshotStorePort snapshotStorePort,
                                                 KeepClientPort keepClientPort) {
        return new KeepSessionManager(credentialsPort, snapshotStorePort, keepClientPort);
    }

    @Produces
    @Singleton
    public SyncOrchestrator syncOrchestrator(SnapshotStorePort snapshotStorePort) {
        return new SyncOrchestrator(snapshotStorePort);
    }

    @Produces
    @Singleton
    public NoteQueryService noteQueryService(KeepSessionManager keepSessionManager,
                                             SyncOrchestrator syncOrchestrator) {
        return new NoteQueryService(keepSessionManager, syncOrchestrator, new NoteNormalizer());
    }

    @Produces
    @ApplicationScoped
    public ClockPort clockPort() {
        return OffsetClockAdapter.system();
    }
}
