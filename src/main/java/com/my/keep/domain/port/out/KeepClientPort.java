package com.my.keep.domain.port.out;

import com.my.keep.domain.model.Credentials;
import com.my.keep.domain.model.Snapshot;

import java.util.Optional;

/**
 * 왜: 원격 Keep 프로토콜과 인증 절차를 추상화하여 도메인이 특정 클라이언트 구현에 의존하지 않도록 하기 위함.
 */
public interface KeepClientPort {
    /**
     * 왜: 저장된 스냅샷이 있으면 이를 시드로 넘겨 전체 재동기화 없이 세션을 복원하기 위함.
     *
     * @throws com.my.keep.domain.exception.KeepAuthenticationException 인증이 거부되었거나 원격에 도달할 수 없을 때
     */
    KeepSession authenticate(Credentials credentials, Optional<Snapshot> seed);
}
