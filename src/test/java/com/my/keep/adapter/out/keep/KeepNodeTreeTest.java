package com.my.keep.adapter.out.keep;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.my.keep.domain.exception.SnapshotFormatException;
import com.my.keep.domain.model.KeepNote;
import com.my.keep.domain.model.ListItem;
import com.my.keep.domain.model.ListNote;
import com.my.keep.domain.model.TextNote;
import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class KeepNodeTreeTest {

    private static final String EPOCH = "1970-01-01T00:00:00.000Z";

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void builds_text_and_list_notes_from_nodes() throws Exception {
        KeepNodeTree tree = KeepNodeTree.empty();
        tree.merge(objectMapper.readTree("""
                [
                  {"id": "n1", "parentId": "root", "type": "NOTE", "title": "Memo", "isArchived": false,
                   "timestamps": {"created": "2024-01-01T00:00:00.000Z", "updated": "2024-01-02T00:00:00.000Z",
                                  "trashed": "%1$s", "deleted": "%1$s"}},
                  {"id": "n1-body", "parentId": "n1", "type": "LIST_ITEM", "text": "hello", "sortValue": "1",
                   "timestamps": {"deleted": "%1$s"}},
                  {"id": "l1", "parentId": "root", "type": "LIST", "title": "Todo", "isArchived": true,
                   "timestamps": {"updated": "2024-02-01T00:00:00.000Z", "trashed": "2024-02-02T00:00:00.000Z"}},
                  {"id": "i1", "parentId": "l1", "type": "LIST_ITEM", "text": "second", "checked": true, "sortValue": "100"},
                  {"id": "i2", "parentId": "l1", "type": "LIST_ITEM", "text": "first", "checked": false, "sortValue": "200"}
                ]
                """.formatted(EPOCH)));

        List<KeepNote> notes = tree.notes();

        assertThat(notes).hasSize(2);
        TextNote memo = (TextNote) notes.get(0);
        assertThat(memo.id()).isEqualTo("n1");
        assertThat(memo.title()).isEqualTo("Memo");
        assertThat(memo.text()).isEqualTo("hello");
        assertThat(memo.trashed()).isFalse();
        assertThat(memo.archived()).isFalse();
        assertThat(memo.createdAt()).isEqualTo(OffsetDateTime.parse("2024-01-01T00:00:00Z"));
        assertThat(memo.updatedAt()).isEqualTo(OffsetDateTime.parse("2024-01-02T00:00:00Z"));

        ListNote todo = (ListNote) notes.get(1);
        assertThat(todo.trashed()).isTrue();
        assertThat(todo.archived()).isTrue();
        assertThat(todo.createdAt()).isNull();
        assertThat(todo.items()).containsExactly(new ListItem("first", false), new ListItem("second", true));
    }

    @Test
    void deleted_node_removes_note_and_children() throws Exception {
        KeepNodeTree tree = KeepNodeTree.empty();
        tree.merge(objectMapper.readTree("""
                [
                  {"id": "l1", "parentId": "root", "type": "LIST"},
                  {"id": "i1", "parentId": "l1", "type": "LIST_ITEM", "text": "a"}
                ]
                """));

        tree.merge(objectMapper.readTree("""
                [{"id": "l1", "parentId": "root", "type": "LIST", "timestamps": {"deleted": "2024-05-01T00:00:00.000Z"}}]
                """));

        assertThat(tree.notes()).isEmpty();
        assertThat(tree.size()).isZero();
    }

    @Test
    void newer_node_replaces_previous_version() throws Exception {
        KeepNodeTree tree = KeepNodeTree.empty();
        tree.merge(objectMapper.readTree("[{\"id\": \"n1\", \"type\": \"NOTE\", \"title\": \"before\"}]"));

        tree.merge(objectMapper.readTree("[{\"id\": \"n1\", \"type\": \"NOTE\", \"title\": \"after\"}]"));

        assertThat(tree.notes()).extracting(KeepNote::title).containsExactly("after");
    }

    @Test
    void dump_and_restore_preserve_version_and_nodes() throws Exception {
        KeepNodeTree tree = KeepNodeTree.empty();
        tree.version("v42");
        tree.merge(objectMapper.readTree("[{\"id\": \"n1\", \"type\": \"NOTE\", \"title\": \"kept\"}]"));

        JsonNode dumped = tree.dump();
        KeepNodeTree restored = KeepNodeTree.restore(objectMapper.readTree(objectMapper.writeValueAsString(dumped)));

        assertThat(dumped.path("keep_version").asText()).isEqualTo("v42");
        assertThat(restored.version()).isEqualTo("v42");
        assertThat(restored.notes()).extracting(KeepNote::title).containsExactly("kept");
    }

    @Test
    void restore_rejects_non_object_state() throws Exception {
        assertThrows(SnapshotFormatException.class, () -> KeepNodeTree.restore(objectMapper.readTree("[1, 2]")));
        assertThrows(SnapshotFormatException.class,
                () -> KeepNodeTree.restore(objectMapper.readTree("{\"nodes\": \"oops\"}")));
    }

    @Test
    void unparseable_timestamp_is_treated_as_absent() throws Exception {
        KeepNodeTree tree = KeepNodeTree.empty();
        tree.merge(objectMapper.readTree(
                "[{\"id\": \"n1\", \"type\": \"NOTE\", \"timestamps\": {\"updated\": \"yesterday\"}}]"));

        assertThat(tree.notes().get(0).updatedAt()).isNull();
    }
}
