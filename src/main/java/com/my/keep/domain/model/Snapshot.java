package com.my.keep.domain.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;

/**
 * 왜: 원격 세션의 동기화 상태를 구조를 해석하지 않은 채 그대로 보관/전달하기 위함.
 * 내부 스키마는 원격 클라이언트가 소유한다.
 */
public record Snapshot(JsonNode state) {
    public Snapshot {
        Objects.requireNonNull(state, "state");
    }
}
