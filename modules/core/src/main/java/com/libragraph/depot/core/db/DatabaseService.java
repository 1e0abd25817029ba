package com.libragraph.depot.core.db;

import com.libragraph.depot.core.dao.DatabaseDao;
import com.libragraph.depot.core.service.AbstractManagedService;
import io.quarkus.arc.properties.IfBuildProperty;
import io.quarkus.runtime.Startup;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jdbi.v3.core.Jdbi;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * Process-wide handle on the PostgreSQL store. Starting it probes the server and
 * applies {@value #SCHEMA_RESOURCE}; {@link #jdbi()} is only handed out while RUNNING.
 * A failed {@link #checkSchema()} marks the service failed, and the next
 * {@link #ready()} starts it again.
 */
@ApplicationScoped
@Startup
@IfBuildProperty(name = "depot.chunk-store.type", stringValue = "postgres")
public class DatabaseService extends AbstractManagedService {

    static final String SCHEMA_RESOURCE = "/db/depot-schema.sql";

    @Inject
    Jdbi jdbi;

    private volatile String serverVersion;

    public DatabaseService() {
    }

    /** For use outside CDI. */
    public DatabaseService(Jdbi jdbi) {
        this.jdbi = jdbi;
    }

    @Override
    public String serviceId() {
        return "depot-database";
    }

    @Override
    protected void doStart() throws IOException {
        serverVersion = jdbi.withExtension(DatabaseDao.class, DatabaseDao::serverVersion);
        log.infof("Connected to: %s", serverVersion);
        String script = readSchemaScript();
        jdbi.useHandle(handle -> handle.createScript(script).execute());
        log.debugf("Applied schema %s", SCHEMA_RESOURCE);
    }

    @Override
    protected void doStop() {
        log.info("Releasing depot database handle; the pool is closed by Agroal");
    }

    /** The JDBI handle; the service must be RUNNING. */
    public Jdbi jdbi() {
        State current = state();
        if (current != State.RUNNING) {
            throw new IllegalStateException("Depot database is " + current + ", not RUNNING");
        }
        return jdbi;
    }

    /** True when both depot tables are reachable. A failure marks the service failed. */
    public boolean checkSchema() {
        try {
            if (jdbi.withExtension(DatabaseDao.class, DatabaseDao::schemaPresent)) {
                return true;
            }
            fail(new IllegalStateException("Depot tables are missing"));
        } catch (Exception e) {
            fail(e);
        }
        return false;
    }

    /** Server version reported at the last start; null before the first start. */
    public String serverVersion() {
        return serverVersion;
    }

    private static String readSchemaScript() throws IOException {
        try (InputStream in = DatabaseService.class.getResourceAsStream(SCHEMA_RESOURCE)) {
            if (in == null) {
                throw new IOException("Schema resource not found: " + SCHEMA_RESOURCE);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    @PostConstruct
    void init() {
        try {
            ready().await().indefinitely();
        } catch (RuntimeException e) {
            throw new IllegalStateException("Depot database failed to start", e);
        }
    }

    @PreDestroy
    void shutdown() {
        try {
            stop();
        } catch (Exception e) {
            log.warn("Error stopping depot database", e);
        }
    }
}
