package com.my.keep.domain.model;

import java.util.Objects;

/**
 * 왜: 인증 주체(이메일)와 Master Token 을 한 쌍으로 다뤄 둘 중 하나만 전달되는 실수를 막기 위함.
 */
public record Credentials(String email, String masterToken) {
    public Credentials {
        Objects.requireNonNull(email, "email");
        Objects.requireNonNull(masterToken, "masterToken");
        if (email.isBlank() || masterToken.isBlank()) {
            throw new IllegalArgumentException("이메일과 Master Token 은 비어 있을 수 없습니다.");
        }
    }

    @Override
    public String toString() {
        return "Credentials[email=" + email + ", masterToken=***]";
    }
}
