package com.my.keep.adapter.out.config;

import com.my.keep.config.AppConfig;
import com.my.keep.domain.model.Credentials;
import com.my.keep.domain.port.out.CredentialsPort;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.Optional;

/**
 * 왜: KEEP_EMAIL / KEEP_MASTER_TOKEN 설정을 읽어 둘 다 있을 때만 자격 증명으로 인정하기 위함.
 */
@ApplicationScoped
public class ConfigCredentialsAdapter implements CredentialsPort {

    private final AppConfig.KeepConfig keepConfig;

    public ConfigCredentialsAdapter(AppConfig appConfig) {
        this.keepConfig = appConfig.keep();
    }

    @Override
    public Optional<Credentials> credentials() {
        Optional<String> email = keepConfig.email().filter(value -> !value.isBlank());
        Optional<String> masterToken = keepConfig.masterToken().filter(value -> !value.isBlank());
        if (email.isEmpty() || masterToken.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new Credentials(email.get().trim(), masterToken.get().trim()));
    }
}
