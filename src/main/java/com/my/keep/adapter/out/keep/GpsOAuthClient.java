package com.my.keep.adapter.out.keep;

import com.my.keep.domain.exception.KeepAuthenticationException;
import com.my.keep.domain.model.Credentials;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 왜: Master Token 을 Keep 동기화 API 용 OAuth 액세스 토큰으로 교환하는 안드로이드 인증 절차를 캡슐화하기 위함.
 */
class GpsOAuthClient {

    static final URI AUTH_URI = URI.create("https://android.clients.google.com/auth");

    private static final String SERVICE =
            "oauth2:https://www.googleapis.com/auth/memento https://www.googleapis.com/auth/reminders";
    private static final String APP = "com.google.android.keep";
    private static final String CLIENT_SIG = "38918a453d07199354f8b19af05ec6562ced5788";

    private final HttpClient httpClient;
    private final String androidId;
    private final Duration requestTimeout;

    GpsOAuthClient(HttpClient httpClient, String androidId, Duration requestTimeout) {
        this.httpClient = httpClient;
        this.androidId = androidId;
        this.requestTimeout = requestTimeout;
    }

    String fetchAccessToken(Credentials credentials) {
        HttpRequest request = HttpRequest.newBuilder(AUTH_URI)
                .header("Content-Type", "application/x-www-form-urlencoded")
                .header("User-Agent", "GoogleAuth/1.4")
                .timeout(requestTimeout)
                .POST(HttpRequest.BodyPublishers.ofString(encode(form(credentials))))
                .build();
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new KeepAuthenticationException("Google 인증 서버에 연결할 수 없습니다: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new KeepAuthenticationException("Google 인증 요청이 중단되었습니다.", e);
        }
        Map<String, String> fields = parseResponse(response.body());
        String token = fields.get("Auth");
        if (token == null || token.isBlank()) {
            String reason = fields.getOrDefault("Error", "status=" + response.statusCode());
            throw new KeepAuthenticationException("Google Keep 인증 실패: " + reason);
        }
        return token;
    }

    static Map<String, String> parseResponse(String body) {
        Map<String, String> fields = new LinkedHashMap<>();
        if (body == null) {
            return fields;
        }
        for (String line : body.split("\\r?\\n")) {
            int separator = line.indexOf('=');
            if (separator > 0) {
                fields.put(line.substring(0, separator).trim(), line.substring(separator + 1).trim());
            }
        }
        return fields;
    }

    private Map<String, String> form(Credentials credentials) {
        Map<String, String> form = new LinkedHashMap<>();
        form.put("accountType", "HOSTED_OR_GOOGLE");
        form.put("Email", credentials.email());
        form.put("has_permission", "1");
        form.put("EncryptedPasswd", credentials.masterToken());
        form.put("service", SERVICE);
        form.put("source", "android");
        form.put("androidId", androidId);
        form.put("app", APP);
        form.put("client_sig", CLIENT_SIG);
        form.put("device_country", "us");
        form.put("operatorCountry", "us");
        form.put("lang", "en");
        form.put("sdk_version", "17");
        form.put("google_play_services_version", "240913000");
        return form;
    }

    private String encode(Map<String, String> form) {
        return form.entrySet().stream()
                .map(entry -> URLEncoder.encode(entry.getKey(), StandardCharsets.UTF_8)
                        + "=" + URLEncoder.encode(entry.getValue(), StandardCharsets.UTF_8))
                .collect(Collectors.joining("&"));
    }
}
