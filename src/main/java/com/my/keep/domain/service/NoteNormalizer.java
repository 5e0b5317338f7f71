package com.my.keep.domain.service;

import com.my.keep.domain.model.KeepNote;
import com.my.keep.domain.model.ListItem;
import com.my.keep.domain.model.ListNote;
import com.my.keep.domain.model.TextNote;
import com.my.keep.domain.model.WireNote;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Comparator;
import java.util.List;

/**
 * 왜: 원격 노트/리스트를 프론트엔드 계약(WireNote)으로 변환하고 필터와 정렬 규칙을 한곳에서 보장하기 위함.
 * <p>
 * 정렬은 파싱된 수정 시각 기준 내림차순이며 수정 시각이 없는 노트는 맨 뒤로 간다.
 * 출력 시각은 UTC 밀리초 고정 자릿수이므로 문자열 비교 순서도 같다.
 */
public class NoteNormalizer {

    private static final String NAME_PREFIX = "notes/";

    private static final DateTimeFormatter WIRE_TIME =
            DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);

    private static final Comparator<KeepNote> RECENTLY_UPDATED_FIRST = Comparator.comparing(
            KeepNote::updatedAt,
            Comparator.nullsLast(Comparator.comparing(OffsetDateTime::toInstant).reversed()));

    public List<WireNote> normalize(List<? extends KeepNote> notes, boolean includeTrashed, boolean includeArchived) {
        return notes.stream()
                .filter(note -> includeTrashed || !note.trashed())
                .filter(note -> includeArchived || !note.archived())
                .sorted(RECENTLY_UPDATED_FIRST)
                .map(this::toWire)
                .toList();
    }

    WireNote toWire(KeepNote note) {
        return new WireNote(
                NAME_PREFIX + note.id(),
                orEmpty(note.title()),
                format(note.createdAt()),
                format(note.updatedAt()),
                note.trashed(),
                toBody(note)
        );
    }

    private WireNote.Body toBody(KeepNote note) {
        if (note instanceof ListNote listNote) {
            return WireNote.Body.ofList(listNote.items().stream()
                    .map(this::toItem)
                    .toList());
        }
        if (note instanceof TextNote textNote) {
            return WireNote.Body.ofText(orEmpty(textNote.text()));
        }
        throw new IllegalStateException("알 수 없는 노트 유형입니다: " + note.getClass().getName());
    }

    private WireNote.Item toItem(ListItem item) {
        return new WireNote.Item(new WireNote.TextContent(orEmpty(item.text())), item.checked());
    }

    private String format(OffsetDateTime time) {
        return time == null ? "" : WIRE_TIME.format(time.toInstant());
    }

    private String orEmpty(String value) {
        return value == null ? "" : value;
    }
}
