package com.my.keep.domain.service;

import com.my.keep.domain.model.KeepNote;
import com.my.keep.domain.model.WireNote;
import com.my.keep.domain.port.in.ListNotesUseCase;
import com.my.keep.domain.port.in.SyncNotesUseCase;
import com.my.keep.domain.port.out.KeepSession;
import org.jboss.logging.Logger;

import java.util.List;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 왜: 세션 관리, 선택적 동기화, 정규화를 하나의 조회 흐름으로 조합하기 위함.
 * <p>
 * 동기화는 쓰기 잠금, 일반 조회는 읽기 잠금 아래에서 노트 컬렉션을 복사하므로
 * 조회는 동기화 전이나 후의 상태만 보고 중간 상태는 보지 않는다.
 */
public class NoteQueryService implements ListNotesUseCase, SyncNotesUseCase {

    private static final Logger log = Logger.getLogger(NoteQueryService.class);

    private final KeepSessionManager sessionManager;
    private final SyncOrchestrator syncOrchestrator;
    private final NoteNormalizer noteNormalizer;
    private final ReadWriteLock sessionLock = new ReentrantReadWriteLock();

    public NoteQueryService(KeepSessionManager sessionManager,
                            SyncOrchestrator syncOrchestrator,
                            NoteNormalizer noteNormalizer) {
        this.sessionManager = sessionManager;
        this.syncOrchestrator = syncOrchestrator;
        this.noteNormalizer = noteNormalizer;
    }

    @Override
    public List<WireNote> listNotes(boolean sync, boolean includeTrashed, boolean includeArchived) {
        KeepSession session = sessionManager.getSession();
        if (sync) {
            refresh(session);
        }
        List<KeepNote> notes;
        sessionLock.readLock().lock();
        try {
            notes = List.copyOf(session.all());
        } finally {
            sessionLock.readLock().unlock();
        }
        List<WireNote> result = noteNormalizer.normalize(notes, includeTrashed, includeArchived);
        log.infof("%d 건의 노트를 반환합니다.", result.size());
        return result;
    }

    @Override
    public void forceSync() {
        KeepSession session = sessionManager.getSession();
        log.info("수동 동기화 요청 수신");
        refresh(session);
    }

    private void refresh(KeepSession session) {
        sessionLock.writeLock().lock();
        try {
            syncOrchestrator.refresh(session);
        } finally {
            sessionLock.writeLock().unlock();
        }
    }
}
