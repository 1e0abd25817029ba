package com.libragraph.depot.core.store;

import com.libragraph.depot.core.db.DatabaseService;
import com.libragraph.depot.core.db.JdbiProducer;
import com.libragraph.depot.core.model.FileMetadata;
import com.libragraph.depot.core.model.FileVersion;
import com.libragraph.depot.core.model.NewFile;
import com.libragraph.depot.core.query.FieldRef;
import com.libragraph.depot.core.query.Filter;
import com.libragraph.depot.core.query.Operator;
import com.libragraph.depot.core.service.ManagedService;
import com.libragraph.depot.types.FileField;
import com.libragraph.depot.util.FileId;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.postgresql.ds.PGSimpleDataSource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Testcontainers(disabledWithoutDocker = true)
class JdbiChunkStoreTest {

    @Container
    static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:16-alpine");

    private static DatabaseService database;
    private static JdbiChunkStore store;

    private String container;

    @BeforeAll
    static void startDatabase() {
        PGSimpleDataSource dataSource = new PGSimpleDataSource();
        dataSource.setUrl(POSTGRES.getJdbcUrl());
        dataSource.setUser(POSTGRES.getUsername());
        dataSource.setPassword(POSTGRES.getPassword());
        database = new DatabaseService(JdbiProducer.create(dataSource));
        store = new JdbiChunkStore(database, 4);
    }

    @AfterAll
    static void stopDatabase() throws Exception {
        database.stop();
    }

    @BeforeEach
    void isolate() {
        container = "c-" + UUID.randomUUID();
    }

    private FileVersion insert(String filename, String content, Map<String, Object> metadata) {
        NewFile file = new NewFile(filename, container, "text/plain", FileMetadata.of(metadata));
        return store.insert(file, new ByteArrayInputStream(content.getBytes(StandardCharsets.UTF_8)))
                .await().indefinitely();
    }

    private String read(FileId id) throws IOException {
        try (InputStream in = store.openStream(id).await().indefinitely()) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    @Test
    void startsAndAppliesSchema() {
        database.ready().await().indefinitely();

        assertThat(database.state()).isEqualTo(ManagedService.State.RUNNING);
        assertThat(database.serverVersion()).containsIgnoringCase("PostgreSQL");
        assertThat(database.checkSchema()).isTrue();
    }

    @Test
    void insertStoresRecordAndChunks() throws IOException {
        FileVersion v = insert("a.txt", "hello chunked world", Map.of("author", "ann"));

        assertThat(v.container()).isEqualTo(container);
        assertThat(v.length()).isEqualTo(19);
        assertThat(v.metadata().get("author")).isEqualTo("ann");
        assertThat(read(v.id())).isEqualTo("hello chunked world");
    }

    @Test
    void newerUploadsSortFirst() {
        FileVersion v1 = insert("a.txt", "1", Map.of());
        FileVersion v2 = insert("a.txt", "2", Map.of());
        FileVersion b = insert("b.txt", "3", Map.of());

        List<FileVersion> all = store.query(MetadataQuery.of(Filter.container(container))).await().indefinitely();
        List<FileVersion> latest = store.query(MetadataQuery.latestPerFilename(Filter.container(container)))
                .await().indefinitely();

        assertThat(all).extracting(FileVersion::id).containsExactly(b.id(), v2.id(), v1.id());
        assertThat(latest).extracting(FileVersion::id).containsExactly(b.id(), v2.id());
    }

    @Test
    void metadataFiltersUseJsonSemantics() {
        insert("a.txt", "1", Map.of("pages", 12, "author", "ann"));
        insert("b.txt", "2", Map.of("pages", 3));
        Filter scope = Filter.container(container);

        long morePages = store.count(Filter.and(scope,
                Filter.compare(FieldRef.metadata("pages"), Operator.GT, 5))).await().indefinitely();
        long notAnn = store.count(Filter.and(scope,
                Filter.compare(FieldRef.metadata("author"), Operator.NE, "ann"))).await().indefinitely();
        long tagged = store.count(Filter.and(scope,
                Filter.compare(FieldRef.metadata("pages"), Operator.IN, List.of(3, 4)))).await().indefinitely();

        assertThat(morePages).isEqualTo(1);
        assertThat(notAnn).isEqualTo(1);
        assertThat(tagged).isEqualTo(1);
    }

    @Test
    void idAndTimestampFiltersBind() {
        FileVersion v1 = insert("a.txt", "1", Map.of());
        FileVersion v2 = insert("a.txt", "2", Map.of());
        Filter scope = Filter.container(container);

        long byId = store.count(Filter.and(scope, Filter.eq(FileField.ID, v1.id().toString())))
                .await().indefinitely();
        long since = store.count(Filter.and(scope, Filter.compare(
                FieldRef.of(FileField.UPLOADED_AT), Operator.GTE, v2.uploadedAt().toString())))
                .await().indefinitely();

        assertThat(byId).isEqualTo(1);
        assertThat(since).isEqualTo(1);
    }

    @Test
    void deletingChunksMakesContentUnavailable() {
        FileVersion v = insert("a.txt", "content", Map.of());

        assertThat(store.deleteChunks(List.of(v.id())).await().indefinitely()).isEqualTo(2);
        assertThatThrownBy(() -> store.openStream(v.id()).await().indefinitely())
                .isInstanceOf(ContentNotFoundException.class);
        assertThat(store.deleteFiles(List.of(v.id())).await().indefinitely())
                .extracting(FileVersion::id).containsExactly(v.id());
        assertThat(store.deleteFiles(List.of(v.id())).await().indefinitely()).isEmpty();
    }

    @Test
    void renameAndReplaceMetadata() {
        FileVersion v = insert("a.txt", "1", Map.of("author", "ann"));
        String renamed = container + "-renamed";

        long moved = store.updateContainer(Filter.container(container), renamed).await().indefinitely();
        long updated = store.replaceMetadata(v.id(), FileMetadata.of(Map.of("author", "bob")))
                .await().indefinitely();

        assertThat(moved).isEqualTo(1);
        assertThat(updated).isEqualTo(1);
        assertThat(store.distinctContainers().await().indefinitely()).contains(renamed).doesNotContain(container);
        FileVersion reloaded = store.query(MetadataQuery.first(Filter.container(renamed))).await().indefinitely().get(0);
        assertThat(reloaded.metadata().asMap()).containsExactly(Map.entry("author", "bob"));
    }
}
