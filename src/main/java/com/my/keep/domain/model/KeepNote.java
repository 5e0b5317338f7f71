package com.my.keep.domain.model;

import java.time.OffsetDateTime;

/**
 * 왜: 원격 Keep 세션이 노출하는 노트/리스트를 하나의 닫힌 타입으로 묶어 정규화 단계에서 빠짐없이 분기하도록 하기 위함.
 */
public sealed interface KeepNote permits TextNote, ListNote {

    String id();

    String title();

    boolean trashed();

    boolean archived();

    OffsetDateTime createdAt();

    OffsetDateTime updatedAt();
}
