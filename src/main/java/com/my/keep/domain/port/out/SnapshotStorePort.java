package com.my.keep.domain.port.out;

import com.my.keep.domain.model.Snapshot;

import java.util.Optional;

/**
 * 왜: 세션 스냅샷의 영속화를 추상화해 재시작 시 전체 재동기화를 피하기 위함.
 */
public interface SnapshotStorePort {
    /**
     * 파일이 없으면 비어 있는 값을 돌려준다.
     *
     * @throws com.my.keep.domain.exception.SnapshotFormatException 저장된 내용이 올바른 JSON 이 아닐 때
     */
    Optional<Snapshot> load();

    void save(Snapshot snapshot);

    String location();
}
