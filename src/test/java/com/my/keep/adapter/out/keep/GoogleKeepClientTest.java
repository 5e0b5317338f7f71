package com.my.keep.adapter.out.keep;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.my.keep.domain.exception.KeepAuthenticationException;
import com.my.keep.domain.exception.KeepSyncException;
import com.my.keep.domain.model.Credentials;
import com.my.keep.domain.model.KeepNote;
import com.my.keep.domain.model.Snapshot;
import com.my.keep.domain.port.out.ClockPort;
import com.my.keep.domain.port.out.KeepSession;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.*;

class GoogleKeepClientTest {

    private static final Credentials CREDENTIALS = new Credentials("me@example.com", "aas_et/master");

    private final ObjectMapper objectMapper = new ObjectMapper();

    private HttpClient httpClient;
    private HttpResponse<String> authResponse;
    private GoogleKeepClient client;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() throws Exception {
        httpClient = mock(HttpClient.class);
        authResponse = mock(HttpResponse.class);
        when(authResponse.statusCode()).thenReturn(200);
        when(authResponse.body()).thenReturn("Auth=ya29.token\n");
        doReturn(authResponse).when(httpClient).send(argThat(isRequestTo(GpsOAuthClient.AUTH_URI.toString())), any());
        ClockPort clockPort = () -> OffsetDateTime.parse("2024-06-01T00:00:00Z");
        client = new GoogleKeepClient(httpClient, objectMapper, clockPort, "abcdef", Duration.ofSeconds(5));
    }

    @Test
    void authenticate_syncs_and_exposes_notes() throws Exception {
        stubChanges(changes("v1", false, """
                [{"id": "n1", "parentId": "root", "type": "NOTE", "title": "Hello"},
                 {"id": "b1", "parentId": "n1", "type": "LIST_ITEM", "text": "world"}]
                """));

        KeepSession session = client.authenticate(CREDENTIALS, Optional.empty());

        List<KeepNote> notes = session.all();
        assertThat(notes).extracting(KeepNote::title).containsExactly("Hello");
        assertThat(session.dump().state().path("keep_version").asText()).isEqualTo("v1");
    }

    @Test
    void seeded_session_sends_snapshot_version_as_target() throws Exception {
        Snapshot seed = new Snapshot(objectMapper.readTree("""
                {"keep_version": "v5", "nodes": [{"id": "n1", "parentId": "root", "type": "NOTE", "title": "cached"}]}
                """));
        stubChanges(changes("v6", false, "[]"));

        KeepSession session = client.authenticate(CREDENTIALS, Optional.of(seed));

        assertThat(session.all()).extracting(KeepNote::title).containsExactly("cached");
        ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient, times(2)).send(captor.capture(), any());
        assertThat(captor.getAllValues().get(1).uri()).isEqualTo(GoogleKeepSession.CHANGES_URI);
        assertThat(captor.getAllValues().get(1).headers().firstValue("Authorization")).contains("OAuth ya29.token");
    }

    @Test
    void truncated_responses_are_followed_until_complete() throws Exception {
        stubChanges(
                changes("v1", true, "[{\"id\": \"n1\", \"type\": \"NOTE\", \"title\": \"one\"}]"),
                changes("v2", false, "[{\"id\": \"n2\", \"type\": \"NOTE\", \"title\": \"two\"}]"));

        KeepSession session = client.authenticate(CREDENTIALS, Optional.empty());

        assertThat(session.all()).extracting(KeepNote::title).containsExactly("one", "two");
        assertThat(session.dump().state().path("keep_version").asText()).isEqualTo("v2");
    }

    @Test
    void initial_sync_failure_is_authentication_error() throws Exception {
        stubChanges(error(503));

        assertThrows(KeepAuthenticationException.class, () -> client.authenticate(CREDENTIALS, Optional.empty()));
    }

    @Test
    void later_sync_failure_keeps_previous_notes() throws Exception {
        stubChanges(
                changes("v1", false, "[{\"id\": \"n1\", \"type\": \"NOTE\", \"title\": \"one\"}]"),
                error(500));
        KeepSession session = client.authenticate(CREDENTIALS, Optional.empty());

        assertThrows(KeepSyncException.class, session::sync);

        assertThat(session.all()).extracting(KeepNote::title).containsExactly("one");
    }

    @Test
    void interrupted_full_resync_keeps_previous_tree() throws Exception {
        Snapshot seed = new Snapshot(objectMapper.readTree("""
                {"keep_version": "v5", "nodes": [{"id": "n1", "parentId": "root", "type": "NOTE", "title": "cached"}]}
                """));
        stubChanges(
                changes("v6", false, "[]"),
                fullResync(),
                changes("v1", true, "[{\"id\": \"n2\", \"type\": \"NOTE\", \"title\": \"fresh\"}]"),
                error(500));
        KeepSession session = client.authenticate(CREDENTIALS, Optional.of(seed));

        assertThrows(KeepSyncException.class, session::sync);

        Snapshot dumped = session.dump();
        assertThat(dumped.state().path("keep_version").asText()).isEqualTo("v6");
        assertThat(dumped.state().path("nodes").size()).isEqualTo(1);
        assertThat(dumped.state().path("nodes").get(0).path("id").asText()).isEqualTo("n1");
        assertThat(session.all()).extracting(KeepNote::title).containsExactly("cached");
    }

    @SafeVarargs
    private void stubChanges(HttpResponse<String>... responses) throws Exception {
        HttpResponse<String> first = responses[0];
        HttpResponse<?>[] rest = new HttpResponse<?>[responses.length - 1];
        System.arraycopy(responses, 1, rest, 0, rest.length);
        doReturn(first, (Object[]) rest)
                .when(httpClient).send(argThat(isRequestTo(GoogleKeepSession.CHANGES_URI.toString())), any());
    }

    @SuppressWarnings("unchecked")
    private HttpResponse<String> changes(String toVersion, boolean truncated, String nodes) throws Exception {
        HttpResponse<String> response = mock(HttpResponse.class);
        when(response.statusCode()).thenReturn(200);
        when(response.body()).thenReturn(objectMapper.writeValueAsString(objectMapper.createObjectNode()
                .put("toVersion", toVersion)
                .put("truncated", truncated)
                .set("nodes", objectMapper.readTree(nodes))));
        return response;
    }

    @SuppressWarnings("unchecked")
    private HttpResponse<String> fullResync() {
        HttpResponse<String> response = mock(HttpResponse.class);
        when(response.statusCode()).thenReturn(200);
        when(response.body()).thenReturn("{\"forceFullResync\": true}");
        return response;
    }

    @SuppressWarnings("unchecked")
    private HttpResponse<String> error(int status) {
        HttpResponse<String> response = mock(HttpResponse.class);
        when(response.statusCode()).thenReturn(status);
        when(response.body()).thenReturn("{}");
        return response;
    }

    private static org.mockito.ArgumentMatcher<HttpRequest> isRequestTo(String uri) {
        return request -> request != null && request.uri().toString().equals(uri);
    }
}
