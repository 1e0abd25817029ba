package com.libragraph.depot.core.store;

import com.libragraph.depot.core.db.DatabaseService;
import com.libragraph.depot.core.query.Filter;
import com.libragraph.depot.core.service.ManagedService;
import com.libragraph.depot.util.FileId;
import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Runs without a database: every failure before a handle is opened must read as unavailable. */
class JdbiChunkStoreAvailabilityTest {

    @Test
    void failedStartIsUnavailable() {
        DatabaseService broken = new DatabaseService(null) {
            @Override
            protected void doStart() throws IOException {
                throw new IOException("Schema resource not found");
            }
        };
        JdbiChunkStore store = new JdbiChunkStore(broken, 4);

        assertThatThrownBy(() -> store.count(Filter.all()).await().indefinitely())
                .isInstanceOf(StorageUnavailableException.class)
                .hasRootCauseInstanceOf(IOException.class);
        assertThat(broken.state()).isEqualTo(ManagedService.State.FAILED);
    }

    @Test
    void databaseNotRunningIsUnavailable() {
        DatabaseService stopped = new DatabaseService(null) {
            @Override
            public Uni<Void> ready() {
                return Uni.createFrom().voidItem();
            }
        };
        JdbiChunkStore store = new JdbiChunkStore(stopped, 4);

        assertThatThrownBy(() -> store.deleteFiles(List.of(FileId.of(1))).await().indefinitely())
                .isInstanceOf(StorageUnavailableException.class)
                .hasCauseInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> store.distinctContainers().await().indefinitely())
                .isInstanceOf(StorageUnavailableException.class);
    }

    @Test
    void rejectsNonPositiveChunkSize() {
        assertThatThrownBy(() -> new JdbiChunkStore(new DatabaseService(null), 0))
                .isInstanceOf(IllegalArgumentException.class);

        JdbiChunkStore configured = new JdbiChunkStore();
        configured.chunkSize = -1;
        assertThatThrownBy(configured::validate)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("depot.chunk-store.chunk-size");
    }
}
