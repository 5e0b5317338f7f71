package com.my.keep.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Objects;

/**
 * 왜: 프론트엔드가 의존하는 노트 JSON 형식을 원격 서비스의 객체 모델과 분리해 고정하기 위함.
 * body 에는 text 또는 list 중 정확히 하나만 존재한다.
 */
public record WireNote(String name,
                       String title,
                       String createTime,
                       String updateTime,
                       boolean trashed,
                       Body body) {
    public WireNote {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(title, "title");
        Objects.requireNonNull(createTime, "createTime");
        Objects.requireNonNull(updateTime, "updateTime");
        Objects.requireNonNull(body, "body");
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Body(TextContent text, ListContent list) {
        public Body {
            if ((text == null) == (list == null)) {
                throw new IllegalArgumentException("body 에는 text 와 list 중 하나만 있어야 합니다.");
            }
        }

        public static Body ofText(String text) {
            return new Body(new TextContent(text), null);
        }

        public static Body ofList(List<Item> items) {
            return new Body(null, new ListContent(List.copyOf(items)));
        }
    }

    public record TextContent(String text) {
    }

    public record ListContent(List<Item> listItems) {
    }

    public record Item(TextContent text, boolean checked) {
    }
}
