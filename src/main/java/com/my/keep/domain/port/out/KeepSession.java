package com.my.keep.domain.port.out;

import com.my.keep.domain.model.KeepNote;
import com.my.keep.domain.model.Snapshot;

import java.util.List;

/**
 * 왜: 인증된 원격 세션 핸들을 도메인이 필요한 세 가지 동작으로만 노출하기 위함.
 */
public interface KeepSession {

    /**
     * 원격 최신 상태를 세션의 노트 컬렉션에 반영한다.
     *
     * @throws com.my.keep.domain.exception.KeepSyncException 동기화 호출이 실패했을 때
     */
    void sync();

    Snapshot dump();

    List<KeepNote> all();
}
