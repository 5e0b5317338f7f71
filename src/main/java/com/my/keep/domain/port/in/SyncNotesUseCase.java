package com.my.keep.domain.port.in;

/**
 * 왜: 프론트엔드의 "새로고침" 버튼이 조회와 무관하게 원격 동기화를 요청할 수 있도록 하기 위함.
 */
public interface SyncNotesUseCase {
    void forceSync();
}
