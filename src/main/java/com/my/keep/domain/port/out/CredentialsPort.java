package com.my.keep.domain.port.out;

import com.my.keep.domain.model.Credentials;

import java.util.Optional;

/**
 * 왜: 자격 증명 출처(환경 변수, 설정 파일)를 도메인에서 분리하기 위함.
 */
public interface CredentialsPort {
    Optional<Credentials> credentials();
}
