package com.libragraph.depot.core.store;

import com.libragraph.depot.core.dao.ChunkDao;
import com.libragraph.depot.core.dao.FileDao;
import com.libragraph.depot.core.dao.FileVersionMapper;
import com.libragraph.depot.core.db.DatabaseService;
import com.libragraph.depot.core.model.FileMetadata;
import com.libragraph.depot.core.model.FileVersion;
import com.libragraph.depot.core.model.NewFile;
import com.libragraph.depot.core.query.Filter;
import com.libragraph.depot.core.query.SqlPredicate;
import com.libragraph.depot.core.query.SqlQueryTranslator;
import com.libragraph.depot.util.FileId;
import io.quarkus.arc.properties.IfBuildProperty;
import io.smallrye.mutiny.Uni;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import org.jdbi.v3.core.HandleCallback;
import org.jdbi.v3.core.JdbiException;
import org.jdbi.v3.core.statement.SqlStatement;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Optional;

/**
 * PostgreSQL-backed {@link ChunkStore}: records in {@code depot_file}, content in
 * {@code depot_chunk}. Filters are translated to SQL by {@link SqlQueryTranslator}.
 *
 * <p>Every operation waits on {@link DatabaseService#ready()}. Reads of content
 * fetch one chunk per round trip, so no connection is held while a stream is open.
 */
@ApplicationScoped
@IfBuildProperty(name = "depot.chunk-store.type", stringValue = "postgres")
public class JdbiChunkStore implements ChunkStore {

    private static final Logger log = Logger.getLogger(JdbiChunkStore.class);

    private static final String ORDER_NEWEST_FIRST = " ORDER BY upload_date DESC, id DESC";

    @Inject
    DatabaseService database;

    @ConfigProperty(name = "depot.chunk-store.chunk-size", defaultValue = "261120")
    int chunkSize = MemoryChunkStore.DEFAULT_CHUNK_SIZE;

    private final SqlQueryTranslator translator = new SqlQueryTranslator();

    public JdbiChunkStore() {
    }

    /** For use outside CDI. */
    public JdbiChunkStore(DatabaseService database, int chunkSize) {
        this.database = database;
        this.chunkSize = MemoryChunkStore.checkChunkSize(chunkSize);
    }

    @PostConstruct
    void validate() {
        MemoryChunkStore.checkChunkSize(chunkSize);
    }

    @Override
    public Uni<FileVersion> insert(NewFile file, InputStream content) {
        return withHandle("insert " + file.container() + "/" + file.filename(), handle ->
                handle.inTransaction(tx -> {
                    FileDao files = tx.attach(FileDao.class);
                    ChunkDao chunks = tx.attach(ChunkDao.class);
                    long id = files.insert(file.filename(), file.container(), chunkSize,
                            file.contentType(), file.metadata().asMap());
                    long length = 0;
                    int n = 0;
                    try (content) {
                        byte[] piece;
                        while ((piece = content.readNBytes(chunkSize)).length > 0) {
                            chunks.insert(id, n++, piece);
                            length += piece.length;
                        }
                    } catch (IOException e) {
                        throw new UncheckedIOException(e);
                    }
                    FileVersion version = files.complete(id, length);
                    log.debugf("Stored %s/%s as %s (%d bytes, %d chunks)",
                            file.container(), file.filename(), version.id(), length, n);
                    return version;
                }));
    }

    @Override
    public Uni<InputStream> openStream(FileId id) {
        return withHandle("open " + id, handle -> {
            Optional<FileVersion> version = handle.attach(FileDao.class).findById(id.value());
            if (version.isEmpty()) {
                throw new ContentNotFoundException(id);
            }
            long length = version.get().length();
            if (length == 0) {
                return (InputStream) new ByteArrayInputStream(new byte[0]);
            }
            if (!handle.attach(ChunkDao.class).exists(id.value())) {
                throw new ContentNotFoundException(id);
            }
            return new ChunkedInputStream(id, length, this::readChunk);
        });
    }

    private Optional<byte[]> readChunk(FileId id, int n) {
        try {
            return database.jdbi().withExtension(ChunkDao.class, dao -> dao.find(id.value(), n));
        } catch (JdbiException | IllegalStateException e) {
            throw new StorageUnavailableException("Failed to read chunk " + n + " of " + id, e);
        }
    }

    @Override
    public Uni<List<FileVersion>> deleteFiles(List<FileId> ids) {
        if (ids.isEmpty()) {
            return Uni.createFrom().item(List.of());
        }
        return withHandle("delete files", handle ->
                handle.attach(FileDao.class).deleteByIds(values(ids)));
    }

    @Override
    public Uni<Long> deleteChunks(List<FileId> ids) {
        if (ids.isEmpty()) {
            return Uni.createFrom().item(0L);
        }
        return withHandle("delete chunks", handle ->
                (long) handle.attach(ChunkDao.class).deleteByFileIds(values(ids)));
    }

    @Override
    public Uni<List<FileVersion>> query(MetadataQuery query) {
        return withHandle("query", handle -> {
            SqlPredicate where = translator.translate(query.filter());
            String sql = query.latestPerFilename()
                    ? "SELECT * FROM (SELECT DISTINCT ON (filename) * FROM depot_file WHERE " + where.sql()
                        + " ORDER BY filename, upload_date DESC, id DESC) latest" + ORDER_NEWEST_FIRST
                    : "SELECT * FROM depot_file WHERE " + where.sql() + ORDER_NEWEST_FIRST;
            if (query.limit() > 0) {
                sql += " LIMIT " + query.limit();
            }
            return bindAll(handle.createQuery(sql), where.args())
                    .map(new FileVersionMapper())
                    .list();
        });
    }

    @Override
    public Uni<Long> count(Filter filter) {
        return countWhere("count", "COUNT(*)", filter);
    }

    @Override
    public Uni<Long> countDistinctFilenames(Filter filter) {
        return countWhere("count filenames", "COUNT(DISTINCT filename)", filter);
    }

    private Uni<Long> countWhere(String operation, String aggregate, Filter filter) {
        return withHandle(operation, handle -> {
            SqlPredicate where = translator.translate(filter);
            return bindAll(handle.createQuery("SELECT " + aggregate + " FROM depot_file WHERE " + where.sql()),
                    where.args())
                    .mapTo(Long.class)
                    .one();
        });
    }

    @Override
    public Uni<List<String>> distinctContainers() {
        return withHandle("list containers", handle ->
                handle.createQuery("SELECT DISTINCT container FROM depot_file ORDER BY container")
                        .mapTo(String.class)
                        .list());
    }

    @Override
    public Uni<Long> updateContainer(Filter filter, String newContainer) {
        return withHandle("update container", handle -> {
            SqlPredicate where = translator.translate(filter);
            var update = handle.createUpdate("UPDATE depot_file SET container = ? WHERE " + where.sql())
                    .bind(0, newContainer);
            List<Object> args = where.args();
            for (int i = 0; i < args.size(); i++) {
                update.bind(i + 1, args.get(i));
            }
            return (long) update.execute();
        });
    }

    @Override
    public Uni<Long> replaceMetadata(FileId id, FileMetadata metadata) {
        return withHandle("replace metadata " + id, handle ->
                (long) handle.attach(FileDao.class).replaceMetadata(id.value(), metadata.asMap()));
    }

    // -- internals --

    /**
     * Runs {@code callback} once the database is ready. A failed start, a database
     * that is not RUNNING and driver errors all surface as {@link StorageUnavailableException}.
     */
    private <T> Uni<T> withHandle(String operation, HandleCallback<T, RuntimeException> callback) {
        return database.ready()
                .map(ignored -> database.jdbi().withHandle(callback))
                .onFailure(JdbiChunkStore::isUnavailable)
                .transform(e -> new StorageUnavailableException("Chunk store " + operation + " failed", e));
    }

    private static boolean isUnavailable(Throwable e) {
        return e instanceof JdbiException
                || e instanceof IllegalStateException
                || e instanceof IOException
                || e instanceof UncheckedIOException;
    }

    private static <S extends SqlStatement<S>> S bindAll(S statement, List<Object> args) {
        for (int i = 0; i < args.size(); i++) {
            statement.bind(i, args.get(i));
        }
        return statement;
    }

    private static List<Long> values(List<FileId> ids) {
        return ids.stream().map(FileId::value).toList();
    }
}
