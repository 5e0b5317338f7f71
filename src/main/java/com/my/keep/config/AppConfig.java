package com.my.keep.config;

import io.quarkus.runtime.annotations.StaticInitSafe;
import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

import java.util.Optional;

@StaticInitSafe
@ConfigMapping(prefix = "app")
public interface AppConfig {

    KeepConfig keep();

    interface KeepConfig {
        Optional<String> email();

        @WithName("master-token")
        Optional<String> masterToken();

        @WithName("state-file")
        @WithDefault("keep_state.json")
        String stateFile();

        @WithName("android-id")
        @WithDefault("0123456789abcdef")
        String androidId();

        @WithName("connect-timeout-seconds")
        @WithDefault("10")
        int connectTimeoutSeconds();

        @WithName("request-timeout-seconds")
        @WithDefault("60")
        int requestTimeoutSeconds();
    }
}
