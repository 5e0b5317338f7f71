package com.my.keep.adapter.out.health;

import com.my.keep.domain.port.out.CredentialsPort;
import com.my.keep.domain.port.out.SnapshotStorePort;
import com.my.keep.domain.service.KeepSessionManager;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

import java.nio.file.Files;
import java.nio.file.Path;

@Readiness
@ApplicationScoped
public class KeepReadinessCheck implements HealthCheck {

    private final CredentialsPort credentialsPort;
    private final SnapshotStorePort snapshotStorePort;
    private final KeepSessionManager keepSessionManager;

    public KeepReadinessCheck(CredentialsPort credentialsPort,
                              SnapshotStorePort snapshotStorePort,
                              KeepSessionManager keepSessionManager) {
        this.credentialsPort = credentialsPort;
        this.snapshotStorePort = snapshotStorePort;
        this.keepSessionManager = keepSessionManager;
    }

    @Override
    public HealthCheckResponse call() {
        boolean credentialsOk = credentialsPort.credentials().isPresent();
        String stateFile = snapshotStorePort.location();
        return HealthCheckResponse.named("keep-readiness")
                .withData("credentialsConfigured", credentialsOk)
                .withData("stateFile", stateFile)
                .withData("stateFileExists", Files.exists(Path.of(stateFile)))
                .withData("sessionAuthenticated", keepSessionManager.isAuthenticated())
                .status(credentialsOk)
                .build();
    }
}
