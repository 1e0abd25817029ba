package com.libragraph.depot.core.health;

import com.libragraph.depot.core.query.Filter;
import com.libragraph.depot.core.store.ChunkStore;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

import java.time.Duration;

@Readiness
@ApplicationScoped
public class ChunkStoreHealthCheck implements HealthCheck {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    @Inject
    ChunkStore store;

    @Override
    public HealthCheckResponse call() {
        try {
            long files = store.count(Filter.all()).await().atMost(TIMEOUT);
            return HealthCheckResponse.named("chunk-store")
                    .up()
                    .withData("versions", files)
                    .build();
        } catch (Exception e) {
            return HealthCheckResponse.named("chunk-store")
                    .down()
                    .withData("error", String.valueOf(e.getMessage()))
                    .build();
        }
    }
}
