package com.my.keep.adapter.out.keep;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.my.keep.domain.exception.KeepSyncException;
import com.my.keep.domain.model.Credentials;
import com.my.keep.domain.model.KeepNote;
import com.my.keep.domain.model.Snapshot;
import com.my.keep.domain.port.out.ClockPort;
import com.my.keep.domain.port.out.KeepSession;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;

/**
 * 왜: Keep 변경분 API(notes/v1/changes)를 호출해 로컬 노드 트리를 최신으로 유지하는 세션 핸들을 제공하기 위함.
 * <p>
 * 동기화가 끝난 뒤에만 노트 뷰를 통째로 교체하므로 all() 은 병합 도중의 상태를 돌려주지 않는다.
 */
class GoogleKeepSession implements KeepSession {

    private static final Logger log = Logger.getLogger(GoogleKeepSession.class);

    static final URI CHANGES_URI = URI.create("https://www.googleapis.com/notes/v1/changes");

    private static final DateTimeFormatter CLIENT_TIME =
            DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);
    private static final List<String> CAPABILITIES =
            List.of("NC", "PI", "LB", "AN", "SH", "DR", "TR", "IN", "SNB", "MI", "CO");

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final ClockPort clockPort;
    private final GpsOAuthClient gpsOAuthClient;
    private final Credentials credentials;
    private final Duration requestTimeout;
    private final String clientSessionId;

    private KeepNodeTree tree;
    private volatile String accessToken;
    private volatile List<KeepNote> view;

    GoogleKeepSession(HttpClient httpClient,
                      ObjectMapper objectMapper,
                      ClockPort clockPort,
                      GpsOAuthClient gpsOAuthClient,
                      Credentials credentials,
                      String accessToken,
                      Duration requestTimeout,
                      KeepNodeTree tree) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.clockPort = clockPort;
        this.gpsOAuthClient = gpsOAuthClient;
        this.credentials = credentials;
        this.accessToken = accessToken;
        this.requestTimeout = requestTimeout;
        this.tree = tree;
        this.clientSessionId = "s--" + clockPort.now().toInstant().toEpochMilli()
                + "--" + ThreadLocalRandom.current().nextInt(1_000_000_000, Integer.MAX_VALUE);
        this.view = tree.notes();
    }

    @Override
    public synchronized void sync() {
        // 전체 재동기화는 새 트리에 받아 두었다가 모든 페이지를 받은 뒤에만 교체한다.
        KeepNodeTree target = tree;
        boolean resetOnce = false;
        boolean truncated = true;
        while (truncated) {
            JsonNode response = postChanges(buildRequest(target.version()));
            if (response.path("forceFullResync").asBoolean(false)) {
                if (resetOnce) {
                    throw new KeepSyncException("서버가 전체 재동기화를 반복해서 요청했습니다.");
                }
                log.warn("서버가 전체 재동기화를 요청해 로컬 노드를 새로 받습니다.");
                target = KeepNodeTree.empty();
                resetOnce = true;
                continue;
            }
            target.merge(response.path("nodes"));
            String toVersion = response.path("toVersion").asText(null);
            if (toVersion != null) {
                target.version(toVersion);
            }
            truncated = response.path("truncated").asBoolean(false);
        }
        tree = target;
        view = tree.notes();
        log.debugf("동기화 완료 version=%s nodes=%d", tree.version(), tree.size());
    }

    @Override
    public synchronized Snapshot dump() {
        return new Snapshot(tree.dump());
    }

    @Override
    public List<KeepNote> all() {
        return view;
    }

    private ObjectNode buildRequest(String targetVersion) {
        ObjectNode body = objectMapper.createObjectNode();
        body.putArray("nodes");
        body.put("clientTimestamp", CLIENT_TIME.format(clockPort.now().toInstant()));
        ObjectNode header = body.putObject("requestHeader");
        header.put("clientSessionId", clientSessionId);
        header.put("clientPlatform", "ANDROID");
        ObjectNode clientVersion = header.putObject("clientVersion");
        clientVersion.put("major", "9");
        clientVersion.put("minor", "9");
        clientVersion.put("build", "9");
        clientVersion.put("revision", "9");
        ArrayNode capabilities = header.putArray("capabilities");
        CAPABILITIES.forEach(type -> capabilities.addObject().put("type", type));
        if (targetVersion != null) {
            body.put("targetVersion", targetVersion);
        }
        return body;
    }

    private JsonNode postChanges(ObjectNode body) {
        HttpResponse<String> response = send(body);
        if (response.statusCode() == 401) {
            log.info("액세스 토큰이 만료되어 다시 발급합니다.");
            accessToken = gpsOAuthClient.fetchAccessToken(credentials);
            response = send(body);
        }
        if (response.statusCode() >= 400) {
            throw new KeepSyncException("Google Keep 동기화 실패 status=" + response.statusCode());
        }
        try {
            return objectMapper.readTree(response.body());
        } catch (JsonProcessingException e) {
            throw new KeepSyncException("Google Keep 동기화 응답을 해석할 수 없습니다.", e);
        }
    }

    private HttpResponse<String> send(ObjectNode body) {
        try {
            HttpRequest request = HttpRequest.newBuilder(CHANGES_URI)
                    .header("Authorization", "OAuth " + accessToken)
                    .header("Content-Type", "application/json")
                    .timeout(requestTimeout)
                    .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body)))
                    .build();
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new KeepSyncException("Google Keep 에 연결할 수 없습니다: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new KeepSyncException("Google Keep 동기화 요청이 중단되었습니다.", e);
        }
    }
}
