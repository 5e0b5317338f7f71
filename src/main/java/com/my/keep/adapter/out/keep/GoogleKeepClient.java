package com.my.keep.adapter.out.keep;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.my.keep.config.AppConfig;
import com.my.keep.domain.exception.KeepAuthenticationException;
import com.my.keep.domain.exception.KeepSyncException;
import com.my.keep.domain.model.Credentials;
import com.my.keep.domain.model.Snapshot;
import com.my.keep.domain.port.out.ClockPort;
import com.my.keep.domain.port.out.KeepClientPort;
import com.my.keep.domain.port.out.KeepSession;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Optional;

/**
 * 왜: Master Token 인증과 스냅샷 복원, 초기 변경분 동기화를 묶어 바로 사용할 수 있는 Keep 세션을 만들기 위함.
 */
@ApplicationScoped
public class GoogleKeepClient implements KeepClientPort {

    private static final Logger log = Logger.getLogger(GoogleKeepClient.class);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final ClockPort clockPort;
    private final GpsOAuthClient gpsOAuthClient;
    private final Duration requestTimeout;

    @Inject
    public GoogleKeepClient(AppConfig appConfig, ObjectMapper objectMapper, ClockPort clockPort) {
        this(HttpClient.newBuilder()
                        .connectTimeout(Duration.ofSeconds(appConfig.keep().connectTimeoutSeconds()))
                        .build(),
                objectMapper,
                clockPort,
                appConfig.keep().androidId(),
                Duration.ofSeconds(appConfig.keep().requestTimeoutSeconds()));
    }

    GoogleKeepClient(HttpClient httpClient,
                     ObjectMapper objectMapper,
                     ClockPort clockPort,
                     String androidId,
                     Duration requestTimeout) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.clockPort = clockPort;
        this.requestTimeout = requestTimeout;
        this.gpsOAuthClient = new GpsOAuthClient(httpClient, androidId, requestTimeout);
    }

    @Override
    public KeepSession authenticate(Credentials credentials, Optional<Snapshot> seed) {
        String accessToken = gpsOAuthClient.fetchAccessToken(credentials);
        KeepNodeTree tree = seed.map(snapshot -> KeepNodeTree.restore(snapshot.state()))
                .orElseGet(KeepNodeTree::empty);
        GoogleKeepSession session = new GoogleKeepSession(
                httpClient, objectMapper, clockPort, gpsOAuthClient, credentials, accessToken, requestTimeout, tree);
        try {
            session.sync();
        } catch (KeepSyncException e) {
            throw new KeepAuthenticationException("Google Keep 초기 동기화 실패: " + e.getMessage(), e);
        }
        log.infof("Google Keep 노트 %d 건을 불러왔습니다.", session.all().size());
        return session;
    }
}
