package com.libragraph.depot.api;

import com.libragraph.depot.core.query.Filter;
import com.libragraph.depot.core.version.VersionStore;
import io.smallrye.mutiny.Uni;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.util.LinkedHashMap;
import java.util.Map;

@Path("/api/diagnostic")
@Produces(MediaType.APPLICATION_JSON)
public class DiagnosticResource {

    @ConfigProperty(name = "quarkus.application.name")
    String appName;

    @ConfigProperty(name = "quarkus.application.version")
    String appVersion;

    @ConfigProperty(name = "quarkus.profile", defaultValue = "prod")
    String profile;

    @ConfigProperty(name = "depot.chunk-store.type")
    String chunkStore;

    @ConfigProperty(name = "depot.chunk-store.chunk-size", defaultValue = "261120")
    int chunkSize;

    @Inject
    VersionStore versions;

    @GET
    @Path("/ping")
    public Map<String, String> ping() {
        return Map.of(
                "status", "ok",
                "message", "Depot is running"
        );
    }

    @GET
    @Path("/info")
    public Map<String, Object> info() {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("name", appName);
        info.put("version", appVersion);
        info.put("java", System.getProperty("java.version"));
        info.put("profile", profile);
        info.put("chunkStore", chunkStore);
        info.put("chunkSize", chunkSize);
        return info;
    }

    /** Totals across every container. */
    @GET
    @Path("/stats")
    public Map<String, Long> stats() {
        return Uni.combine().all().unis(
                        versions.containers(),
                        versions.countVersions(Filter.all()))
                .asTuple()
                .map(t -> Map.of(
                        "containers", (long) t.getItem1().size(),
                        "versions", t.getItem2().count()))
                .await().indefinitely();
    }
}
