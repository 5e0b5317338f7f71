package com.my.keep.adapter.out.keep;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.my.keep.domain.exception.SnapshotFormatException;
import com.my.keep.domain.model.KeepNote;
import com.my.keep.domain.model.ListItem;
import com.my.keep.domain.model.ListNote;
import com.my.keep.domain.model.TextNote;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 왜: Keep 동기화 API 가 내려주는 평면 노드 목록을 원본 그대로 보관하면서 도메인 노트 모델로 조립하기 위함.
 * <p>
 * 스냅샷 형식은 {@code {"keep_version": ..., "nodes": [...]}} 이며 노드는 서버 응답 JSON 을 그대로 담는다.
 */
final class KeepNodeTree {

    static final String TYPE_NOTE = "NOTE";
    static final String TYPE_LIST = "LIST";
    static final String TYPE_LIST_ITEM = "LIST_ITEM";

    private static final String VERSION_FIELD = "keep_version";
    private static final String NODES_FIELD = "nodes";

    private static final Comparator<ObjectNode> BY_SORT_VALUE_DESC =
            Comparator.comparingLong(KeepNodeTree::sortValue).reversed();

    private final Map<String, ObjectNode> nodes = new LinkedHashMap<>();
    private String version;

    private KeepNodeTree() {
    }

    static KeepNodeTree empty() {
        return new KeepNodeTree();
    }

    static KeepNodeTree restore(JsonNode state) {
        if (state == null || !state.isObject()) {
            throw new SnapshotFormatException("스냅샷 형식이 올바르지 않습니다: JSON 객체가 아닙니다.");
        }
        JsonNode restored = state.path(NODES_FIELD);
        if (!restored.isMissingNode() && !restored.isArray()) {
            throw new SnapshotFormatException("스냅샷 형식이 올바르지 않습니다: nodes 가 배열이 아닙니다.");
        }
        KeepNodeTree tree = new KeepNodeTree();
        tree.version = textOrNull(state.get(VERSION_FIELD));
        tree.merge(restored);
        return tree;
    }

    String version() {
        return version;
    }

    void version(String version) {
        this.version = version;
    }

    int size() {
        return nodes.size();
    }

    void merge(JsonNode incoming) {
        if (incoming == null || !incoming.isArray()) {
            return;
        }
        for (JsonNode node : incoming) {
            String id = textOrNull(node.get("id"));
            if (!node.isObject() || id == null) {
                continue;
            }
            if (isSet(node.path("timestamps").path("deleted"))) {
                remove(id);
                continue;
            }
            nodes.put(id, ((ObjectNode) node).deepCopy());
        }
    }

    ObjectNode dump() {
        ObjectNode state = JsonNodeFactory.instance.objectNode();
        state.put(VERSION_FIELD, version);
        ArrayNode dumped = state.putArray(NODES_FIELD);
        nodes.values().forEach(node -> dumped.add(node.deepCopy()));
        return state;
    }

    List<KeepNote> notes() {
        Map<String, List<ObjectNode>> itemsByParent = new HashMap<>();
        for (ObjectNode node : nodes.values()) {
            if (TYPE_LIST_ITEM.equals(textOrNull(node.get("type")))) {
                String parentId = textOrNull(node.get("parentId"));
                if (parentId != null) {
                    itemsByParent.computeIfAbsent(parentId, key -> new ArrayList<>()).add(node);
                }
            }
        }
        List<KeepNote> notes = new ArrayList<>();
        for (ObjectNode node : nodes.values()) {
            String id = textOrNull(node.get("id"));
            List<ObjectNode> items = itemsByParent.getOrDefault(id, List.of()).stream()
                    .sorted(BY_SORT_VALUE_DESC)
                    .toList();
            String type = textOrNull(node.get("type"));
            if (TYPE_NOTE.equals(type)) {
                notes.add(toTextNote(id, node, items));
            } else if (TYPE_LIST.equals(type)) {
                notes.add(toListNote(id, node, items));
            }
        }
        return List.copyOf(notes);
    }

    private TextNote toTextNote(String id, ObjectNode node, List<ObjectNode> items) {
        // 텍스트 노트 본문은 첫 번째 하위 항목에 들어 있다
        String text = items.isEmpty() ? null : textOrNull(items.get(0).get("text"));
        JsonNode timestamps = node.path("timestamps");
        return new TextNote(
                id,
                textOrNull(node.get("title")),
                text,
                isSet(timestamps.path("trashed")),
                node.path("isArchived").asBoolean(false),
                parseTime(timestamps.path("created")),
                parseTime(timestamps.path("updated"))
        );
    }

    private ListNote toListNote(String id, ObjectNode node, List<ObjectNode> items) {
        JsonNode timestamps = node.path("timestamps");
        return new ListNote(
                id,
                textOrNull(node.get("title")),
                items.stream()
                        .map(item -> new ListItem(textOrNull(item.get("text")), item.path("checked").asBoolean(false)))
                        .toList(),
                isSet(timestamps.path("trashed")),
                node.path("isArchived").asBoolean(false),
                parseTime(timestamps.path("created")),
                parseTime(timestamps.path("updated"))
        );
    }

    private void remove(String id) {
        nodes.remove(id);
        nodes.values().removeIf(child -> id.equals(textOrNull(child.get("parentId"))));
    }

    private static long sortValue(ObjectNode node) {
        return node.path("sortValue").asLong(0L);
    }

    private static boolean isSet(JsonNode timestamp) {
        OffsetDateTime time = parseTime(timestamp);
        return time != null && time.toInstant().isAfter(Instant.EPOCH);
    }

    private static OffsetDateTime parseTime(JsonNode timestamp) {
        String text = textOrNull(timestamp);
        if (text == null || text.isBlank()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(text).withOffsetSameInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static String textOrNull(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        return node.asText();
    }
}
