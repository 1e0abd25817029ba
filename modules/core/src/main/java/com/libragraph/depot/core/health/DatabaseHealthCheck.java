package com.libragraph.depot.core.health;

import com.libragraph.depot.core.db.DatabaseService;
import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.HealthCheckResponseBuilder;
import org.eclipse.microprofile.health.Readiness;

@Readiness
@ApplicationScoped
@IfBuildProperty(name = "depot.chunk-store.type", stringValue = "postgres")
public class DatabaseHealthCheck implements HealthCheck {

    @Inject
    DatabaseService database;

    @Override
    public HealthCheckResponse call() {
        HealthCheckResponseBuilder response = HealthCheckResponse.named("depot-database")
                .withData("state", database.state().name());
        String version = database.serverVersion();
        if (version != null) {
            response.withData("version", version);
        }
        return response.status(database.checkSchema()).build();
    }
}
