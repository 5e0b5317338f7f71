package com.my.keep.domain.model;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Objects;

/**
 * 왜: 체크리스트 노트의 항목 순서를 원격 서비스가 준 그대로 보존하기 위함.
 */
public record ListNote(String id,
                       String title,
                       List<ListItem> items,
                       boolean trashed,
                       boolean archived,
                       OffsetDateTime createdAt,
                       OffsetDateTime updatedAt) implements KeepNote {
    public ListNote {
        Objects.requireNonNull(id, "id");
        if (id.isBlank()) {
            throw new IllegalArgumentException("노트 id는 비어 있을 수 없습니다.");
        }
        items = items == null ? List.of() : List.copyOf(items);
    }
}
