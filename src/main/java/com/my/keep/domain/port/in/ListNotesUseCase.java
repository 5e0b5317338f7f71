package com.my.keep.domain.port.in;

import com.my.keep.domain.model.WireNote;

import java.util.List;

/**
 * 왜: 노트 조회를 단일 진입점으로 수렴시켜 선택적 동기화와 정규화를 일관되게 적용하기 위함.
 */
public interface ListNotesUseCase {
    List<WireNote> listNotes(boolean sync, boolean includeTrashed, boolean includeArchived);
}
