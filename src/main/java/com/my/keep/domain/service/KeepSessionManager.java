package com.my.keep.domain.service;

import com.my.keep.domain.exception.CredentialsNotConfiguredException;
import com.my.keep.domain.exception.KeepAuthenticationException;
import com.my.keep.domain.exception.SnapshotFormatException;
import com.my.keep.domain.model.Credentials;
import com.my.keep.domain.model.Snapshot;
import com.my.keep.domain.port.out.CredentialsPort;
import com.my.keep.domain.port.out.KeepClientPort;
import com.my.keep.domain.port.out.KeepSession;
import com.my.keep.domain.port.out.SnapshotStorePort;
import org.jboss.logging.Logger;

import java.util.Optional;

/**
 * 왜: 프로세스당 하나의 원격 세션만 존재하도록 최초 호출 시점에 한 번만 인증하고 이후에는 캐시된 핸들을 돌려주기 위함.
 * <p>
 * 인증 실패는 캐시하지 않으므로 다음 호출에서 다시 인증을 시도한다.
 * 자격 증명이 바뀌어도 이미 만들어진 세션은 재시작 전까지 유지된다.
 */
public class KeepSessionManager {

    private static final Logger log = Logger.getLogger(KeepSessionManager.class);

    private final CredentialsPort credentialsPort;
    private final SnapshotStorePort snapshotStorePort;
    private final KeepClientPort keepClientPort;
    private final Object creationLock = new Object();

    private volatile KeepSession session;

    public KeepSessionManager(CredentialsPort credentialsPort,
                              SnapshotStorePort snapshotStorePort,
                              KeepClientPort keepClientPort) {
        this.credentialsPort = credentialsPort;
        this.snapshotStorePort = snapshotStorePort;
        this.keepClientPort = keepClientPort;
    }

    public KeepSession getSession() {
        KeepSession current = session;
        if (current != null) {
            return current;
        }
        synchronized (creationLock) {
            if (session == null) {
                session = authenticate();
            }
            return session;
        }
    }

    public boolean isAuthenticated() {
        return session != null;
    }

    private KeepSession authenticate() {
        Credentials credentials = credentialsPort.credentials()
                .orElseThrow(() -> new CredentialsNotConfiguredException(
                        "환경 변수 KEEP_EMAIL 과 KEEP_MASTER_TOKEN 을 설정해주세요."));

        Optional<Snapshot> seed = snapshotStorePort.load();
        if (seed.isPresent()) {
            log.infof("캐시 파일에서 노트 상태를 복원합니다: %s", snapshotStorePort.location());
        } else {
            log.info("Google Keep 에 연결 중...");
        }

        KeepSession created;
        try {
            created = keepClientPort.authenticate(credentials, seed);
        } catch (KeepAuthenticationException | SnapshotFormatException e) {
            log.errorf("Google Keep 인증 실패: %s", e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            log.errorf("Google Keep 인증 실패: %s", e.getMessage());
            throw new KeepAuthenticationException("Google Keep 인증 실패: " + e.getMessage(), e);
        }
        if (created == null) {
            throw new KeepAuthenticationException("Google Keep 인증 결과 세션이 비어 있습니다.");
        }
        log.info("Google Keep 인증 성공");
        return created;
    }
}
