package com.my.keep.domain.model;

import java.time.OffsetDateTime;
import java.util.Objects;

public record TextNote(String id,
                       String title,
                       String text,
                       boolean trashed,
                       boolean archived,
                       OffsetDateTime createdAt,
                       OffsetDateTime updatedAt) implements KeepNote {
    public TextNote {
        Objects.requireNonNull(id, "id");
        if (id.isBlank()) {
            throw new IllegalArgumentException("노트 id는 비어 있을 수 없습니다.");
        }
    }
}
