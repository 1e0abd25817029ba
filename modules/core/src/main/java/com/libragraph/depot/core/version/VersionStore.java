package com.libragraph.depot.core.version;

import com.libragraph.depot.core.model.FileMetadata;
import com.libragraph.depot.core.model.FileVersion;
import com.libragraph.depot.core.model.NewFile;
import com.libragraph.depot.core.query.Filter;
import com.libragraph.depot.core.store.ChunkStore;
import com.libragraph.depot.core.store.MetadataQuery;
import com.libragraph.depot.util.FileId;
import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.infrastructure.Infrastructure;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.io.InputStream;
import java.util.List;
import java.util.Map;

/**
 * Version records over the {@link ChunkStore}: queries, counts, uploads and
 * cascading deletes that remove a record together with its chunks.
 *
 * <p>Results are ordered newest first ({@code uploadedAt} desc, then id desc).
 */
@ApplicationScoped
public class VersionStore {

    private static final Logger log = Logger.getLogger(VersionStore.class);

    @Inject
    ChunkStore store;

    public VersionStore() {
    }

    /** For use outside CDI. */
    public VersionStore(ChunkStore store) {
        this.store = store;
    }

    public Uni<List<FileVersion>> find(Filter filter) {
        return store.query(MetadataQuery.of(filter));
    }

    /** The newest matching version; fails with {@link VersionNotFoundException} when none match. */
    public Uni<FileVersion> findOne(Filter filter) {
        return store.query(MetadataQuery.first(filter))
                .map(matches -> {
                    if (matches.isEmpty()) {
                        throw VersionNotFoundException.matching(filter);
                    }
                    return matches.get(0);
                });
    }

    /** Newest version of each filename among the matches, newest first. */
    public Uni<List<FileVersion>> latestPerFilename(Filter filter) {
        return store.query(MetadataQuery.latestPerFilename(filter));
    }

    /** Distinct filenames among the matches. */
    public Uni<CountResult> countFiles(Filter filter) {
        return store.countDistinctFilenames(filter).map(CountResult::new);
    }

    public Uni<CountResult> countVersions(Filter filter) {
        return store.count(filter).map(CountResult::new);
    }

    public Uni<List<String>> containers() {
        return store.distinctContainers();
    }

    /**
     * Deletes every matching version. Ids are resolved by one read; versions
     * uploaded after it are untouched. Both counts cover only the records this
     * call removed, so versions deleted concurrently by another caller are not
     * reported.
     *
     * @param countDistinctFiles also report how many distinct filenames were deleted
     */
    public Uni<DeleteResult> deleteByFilter(Filter filter, boolean countDistinctFiles) {
        return find(filter)
                .flatMap(matches -> deleteCascade(matches.stream().map(FileVersion::id).toList()))
                .map(removed -> new DeleteResult(removed.size(), countDistinctFiles
                        ? removed.stream().map(FileVersion::filename).distinct().count()
                        : null));
    }

    /**
     * Deletes records and chunks concurrently and waits for both. The number of
     * records removed is the result; a failed chunk delete is logged and not propagated.
     */
    public Uni<CountResult> deleteByIds(List<FileId> ids) {
        return deleteCascade(ids).map(removed -> new CountResult(removed.size()));
    }

    private Uni<List<FileVersion>> deleteCascade(List<FileId> ids) {
        if (ids.isEmpty()) {
            return Uni.createFrom().item(List.of());
        }
        Uni<List<FileVersion>> records = store.deleteFiles(ids)
                .runSubscriptionOn(Infrastructure.getDefaultWorkerPool());
        Uni<Long> chunks = store.deleteChunks(ids)
                .runSubscriptionOn(Infrastructure.getDefaultWorkerPool())
                .onFailure().recoverWithItem(e -> {
                    log.warnf(e, "Partial delete: chunks of %d version(s) were not removed: %s",
                            ids.size(), ids);
                    return -1L;
                });
        return Uni.combine().all().unis(records, chunks).asTuple()
                .map(result -> {
                    List<FileVersion> removed = result.getItem1();
                    log.debugf("Deleted %d record(s), %d chunk(s) for %d id(s)",
                            Integer.valueOf(removed.size()), result.getItem2(), Integer.valueOf(ids.size()));
                    return removed;
                });
    }

    /**
     * Stores one new version. The store consumes {@code content} and assigns the id
     * and upload time.
     */
    public Uni<FileVersion> upload(String container, InputStream content, String filename,
                                   String contentType, Map<String, ?> customMetadata) {
        if (container == null || container.isBlank()) {
            return Uni.createFrom().failure(new IllegalArgumentException("container must not be blank"));
        }
        if (filename == null || filename.isBlank()) {
            return Uni.createFrom().failure(new IllegalArgumentException("filename must not be blank"));
        }
        NewFile file = new NewFile(filename, container, contentType, FileMetadata.of(customMetadata));
        return store.insert(file, content)
                .invoke(v -> log.infof("Uploaded %s/%s as %s (%d bytes)", container, filename, v.id(), v.length()));
    }

    /** Read handle on a version's content; the caller closes it. */
    public Uni<InputStream> openContent(FileVersion version) {
        return store.openStream(version.id());
    }

    /** Overwrites a version's metadata map. */
    public Uni<Void> replaceMetadata(FileId id, FileMetadata metadata) {
        return store.replaceMetadata(id, metadata)
                .invoke(updated -> {
                    if (updated == 0) {
                        throw VersionNotFoundException.withId(id);
                    }
                })
                .replaceWithVoid();
    }

    /** Moves every matching version to {@code newContainer}; returns the number moved. */
    public Uni<Long> reassignContainer(Filter filter, String newContainer) {
        if (newContainer == null || newContainer.isBlank()) {
            return Uni.createFrom().failure(new IllegalArgumentException("container must not be blank"));
        }
        return store.updateContainer(filter, newContainer);
    }
}
