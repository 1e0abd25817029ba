package com.libragraph.depot.core.store;

import com.libragraph.depot.core.model.FileMetadata;
import com.libragraph.depot.core.model.FileVersion;
import com.libragraph.depot.core.model.NewFile;
import com.libragraph.depot.core.query.Filter;
import com.libragraph.depot.core.query.PredicateQueryTranslator;
import com.libragraph.depot.util.FileId;
import io.quarkus.arc.properties.IfBuildProperty;
import io.smallrye.mutiny.Uni;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * In-memory {@link ChunkStore} for development and testing.
 *
 * <p>Records and chunks live in separate maps, like the two collections of the
 * persistent store, so deleting one without the other is observable.
 */
@ApplicationScoped
@IfBuildProperty(name = "depot.chunk-store.type", stringValue = "memory")
public class MemoryChunkStore implements ChunkStore {

    private static final Logger log = Logger.getLogger(MemoryChunkStore.class);

    public static final int DEFAULT_CHUNK_SIZE = 255 * 1024;

    @ConfigProperty(name = "depot.chunk-store.chunk-size", defaultValue = "261120")
    int chunkSize = DEFAULT_CHUNK_SIZE;

    private final Clock clock;
    private final AtomicLong sequence = new AtomicLong();
    private final Map<FileId, FileVersion> files = new ConcurrentHashMap<>();
    private final Map<FileId, List<byte[]>> chunks = new ConcurrentHashMap<>();
    private final PredicateQueryTranslator translator = new PredicateQueryTranslator();

    public MemoryChunkStore() {
        this(Clock.systemUTC(), DEFAULT_CHUNK_SIZE);
    }

    public MemoryChunkStore(Clock clock, int chunkSize) {
        this.clock = clock;
        this.chunkSize = checkChunkSize(chunkSize);
    }

    @PostConstruct
    void validate() {
        checkChunkSize(chunkSize);
    }

    static int checkChunkSize(int chunkSize) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("depot.chunk-store.chunk-size must be > 0, got: " + chunkSize);
        }
        return chunkSize;
    }

    @Override
    public Uni<FileVersion> insert(NewFile file, InputStream content) {
        return Uni.createFrom().item(() -> {
            List<byte[]> pieces = new ArrayList<>();
            long length = 0;
            try (content) {
                byte[] piece;
                while ((piece = content.readNBytes(chunkSize)).length > 0) {
                    pieces.add(piece);
                    length += piece.length;
                }
            } catch (IOException e) {
                throw new StorageUnavailableException("Failed to read upload content: " + file.filename(), e);
            }
            FileId id = FileId.of(sequence.incrementAndGet());
            chunks.put(id, List.copyOf(pieces));
            FileVersion version = new FileVersion(id, file.filename(), file.container(), clock.instant(),
                    length, file.contentType(), file.metadata());
            files.put(id, version);
            log.debugf("Stored %s/%s as %s (%d bytes, %d chunks)",
                    file.container(), file.filename(), id, length, pieces.size());
            return version;
        });
    }

    @Override
    public Uni<InputStream> openStream(FileId id) {
        return Uni.createFrom().item(() -> {
            FileVersion version = files.get(id);
            List<byte[]> pieces = chunks.get(id);
            if (version == null || pieces == null) {
                throw new ContentNotFoundException(id);
            }
            if (version.length() == 0) {
                return (InputStream) new ByteArrayInputStream(new byte[0]);
            }
            return new ChunkedInputStream(id, version.length(), this::readChunk);
        });
    }

    private Optional<byte[]> readChunk(FileId id, int n) {
        List<byte[]> pieces = chunks.get(id);
        if (pieces == null || n >= pieces.size()) {
            return Optional.empty();
        }
        return Optional.of(pieces.get(n));
    }

    @Override
    public Uni<List<FileVersion>> deleteFiles(List<FileId> ids) {
        return Uni.createFrom().item(() -> ids.stream()
                .map(files::remove)
                .filter(removed -> removed != null)
                .toList());
    }

    @Override
    public Uni<Long> deleteChunks(List<FileId> ids) {
        return Uni.createFrom().item(() -> ids.stream()
                .map(chunks::remove)
                .filter(removed -> removed != null)
                .mapToLong(List::size)
                .sum());
    }

    @Override
    public Uni<List<FileVersion>> query(MetadataQuery query) {
        return Uni.createFrom().item(() -> {
            Stream<FileVersion> sorted = matching(query.filter()).sorted(FileVersion.NEWEST_FIRST);
            if (query.latestPerFilename()) {
                Map<String, FileVersion> latest = new LinkedHashMap<>();
                sorted.forEach(v -> latest.putIfAbsent(v.filename(), v));
                sorted = latest.values().stream();
            }
            if (query.limit() > 0) {
                sorted = sorted.limit(query.limit());
            }
            return sorted.toList();
        });
    }

    @Override
    public Uni<Long> count(Filter filter) {
        return Uni.createFrom().item(() -> matching(filter).count());
    }

    @Override
    public Uni<Long> countDistinctFilenames(Filter filter) {
        return Uni.createFrom().item(() -> matching(filter).map(FileVersion::filename).distinct().count());
    }

    @Override
    public Uni<List<String>> distinctContainers() {
        return Uni.createFrom().item(() -> files.values().stream()
                .map(FileVersion::container)
                .distinct()
                .sorted()
                .toList());
    }

    @Override
    public Uni<Long> updateContainer(Filter filter, String newContainer) {
        return Uni.createFrom().item(() -> {
            List<FileVersion> targets = matching(filter).toList();
            for (FileVersion v : targets) {
                files.computeIfPresent(v.id(), (id, current) -> current.withContainer(newContainer));
            }
            return (long) targets.size();
        });
    }

    @Override
    public Uni<Long> replaceMetadata(FileId id, FileMetadata metadata) {
        return Uni.createFrom().item(() ->
                files.computeIfPresent(id, (key, current) -> current.withMetadata(metadata)) != null ? 1L : 0L);
    }

    private Stream<FileVersion> matching(Filter filter) {
        Predicate<FileVersion> predicate = translator.translate(filter);
        return files.values().stream().filter(predicate);
    }
}
