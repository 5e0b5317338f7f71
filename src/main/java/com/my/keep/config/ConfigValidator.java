package com.my.keep.config;

import io.quarkus.runtime.Startup;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.nio.file.Files;
import java.nio.file.Path;

@Startup
@ApplicationScoped
public class ConfigValidator {

    private static final Logger log = Logger.getLogger(ConfigValidator.class);

    private final AppConfig appConfig;

    public ConfigValidator(AppConfig appConfig) {
        this.appConfig = appConfig;
    }

    @PostConstruct
    void validate() {
        warnIfMissing("KEEP_EMAIL", appConfig.keep().email().orElse(null));
        warnIfMissing("KEEP_MASTER_TOKEN", appConfig.keep().masterToken().orElse(null));
        reportStateFile(appConfig.keep().stateFile());
    }

    // 자격 증명이 없어도 서버는 떠야 한다. 오류는 노트 요청 시점에 CredentialsNotConfiguredException 으로 돌려준다.
    private void warnIfMissing(String name, String value) {
        if (value == null || value.isBlank()) {
            log.warnf("필수 설정이 비어 있습니다: %s (노트 요청은 실패합니다)", name);
        }
    }

    private void reportStateFile(String stateFile) {
        Path resolved = Path.of(stateFile);
        if (Files.exists(resolved)) {
            log.infof("캐시 파일을 사용합니다: %s", resolved.toAbsolutePath());
        } else {
            log.infof("캐시 파일이 없어 첫 요청에서 전체 동기화를 수행합니다: %s", resolved.toAbsolutePath());
        }
    }
}
