package com.libragraph.depot.core.container;

import com.libragraph.depot.core.model.FileMetadata;
import com.libragraph.depot.core.model.FileVersion;
import com.libragraph.depot.core.model.UploadRequest;
import com.libragraph.depot.core.query.Filter;
import com.libragraph.depot.core.query.InvalidIdentifierException;
import com.libragraph.depot.core.version.CountResult;
import com.libragraph.depot.core.version.DeleteResult;
import com.libragraph.depot.core.version.VersionStore;
import com.libragraph.depot.types.FileField;
import com.libragraph.depot.util.FileId;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Operations on one {@code container + filename} lineage and its versions.
 */
@ApplicationScoped
public class LineageService {

    private static final Logger log = Logger.getLogger(LineageService.class);

    @Inject
    VersionStore versions;

    public LineageService() {
    }

    /** For use outside CDI. */
    public LineageService(VersionStore versions) {
        this.versions = versions;
    }

    /** Newest version of the file. */
    public Uni<FileVersion> currentFile(String container, String filename) {
        return versions.findOne(Filter.lineage(container, filename));
    }

    /** Deletes every version of the file. */
    public Uni<DeleteResult> deleteFile(String container, String filename) {
        return versions.deleteByFilter(Filter.lineage(container, filename), true);
    }

    /** All versions matching {@code filter}, newest first. */
    public Uni<List<FileVersion>> versions(String container, String filename, Filter filter) {
        return versions.find(Filter.and(Filter.lineage(container, filename), filter));
    }

    public Uni<CountResult> countVersions(String container, String filename, Filter filter) {
        return versions.countVersions(Filter.and(Filter.lineage(container, filename), filter));
    }

    /**
     * One version by id.
     *
     * @throws InvalidIdentifierException (as failure) if {@code versionId} is malformed
     */
    public Uni<FileVersion> version(String container, String filename, String versionId) {
        return Uni.createFrom().item(() -> versionFilter(container, filename, versionId))
                .flatMap(versions::findOne);
    }

    /**
     * Merges {@code overlay} into a version's metadata; overlay keys win and the
     * container is never changed. Returns the updated record.
     */
    public Uni<FileVersion> updateVersion(String container, String filename, String versionId,
                                          Map<String, ?> overlay) {
        return version(container, filename, versionId)
                .flatMap(current -> {
                    FileMetadata merged = current.metadata().merge(overlay);
                    return versions.replaceMetadata(current.id(), merged)
                            .replaceWith(current.withMetadata(merged));
                });
    }

    public Uni<DeleteResult> deleteVersion(String container, String filename, String versionId) {
        return Uni.createFrom().item(() -> versionFilter(container, filename, versionId))
                .flatMap(filter -> versions.deleteByFilter(filter, false));
    }

    /** Uploads each request in order. */
    public Uni<List<FileVersion>> upload(String container, List<UploadRequest> uploads) {
        return Multi.createFrom().iterable(uploads)
                .onItem().transformToUniAndConcatenate(u -> versions.upload(
                        container, u.content(), u.filename(), u.contentType(), u.metadata()))
                .collect().asList();
    }

    /**
     * Uploads, then deletes every older version of each uploaded filename.
     * The two phases are not atomic: a failure in the second leaves older
     * versions in place next to the new ones.
     */
    public Uni<List<FileVersion>> replace(String container, List<UploadRequest> uploads) {
        return upload(container, uploads).flatMap(created -> {
            Map<String, List<FileId>> kept = new LinkedHashMap<>();
            for (FileVersion v : created) {
                kept.computeIfAbsent(v.filename(), f -> new ArrayList<>()).add(v.id());
            }
            if (kept.isEmpty()) {
                return Uni.createFrom().item(created);
            }
            List<Uni<DeleteResult>> prunes = new ArrayList<>();
            kept.forEach((filename, ids) -> prunes.add(versions.deleteByFilter(
                    Filter.and(Filter.lineage(container, filename), Filter.notIn(FileField.ID, ids)), false)
                    .invoke(result -> log.debugf("Replaced %s/%s: pruned %d older version(s)",
                            container, filename, result.versionsDeleted()))));
            return Uni.join().all(prunes).andFailFast().replaceWith(created);
        });
    }

    private static Filter versionFilter(String container, String filename, String versionId) {
        FileId id = parseId(versionId);
        return Filter.and(Filter.lineage(container, filename), Filter.eq(FileField.ID, id));
    }

    private static FileId parseId(String versionId) {
        try {
            return FileId.parse(String.valueOf(versionId));
        } catch (IllegalArgumentException e) {
            throw new InvalidIdentifierException(versionId, e);
        }
    }
}
