package com.libragraph.depot.core.store;

import com.libragraph.depot.core.model.FileMetadata;
import com.libragraph.depot.core.model.FileVersion;
import com.libragraph.depot.core.model.NewFile;
import com.libragraph.depot.core.query.Filter;
import com.libragraph.depot.util.FileId;
import io.smallrye.mutiny.Uni;

import java.io.InputStream;
import java.util.List;

/**
 * Chunked object store holding one metadata record per file plus its content chunks.
 *
 * <p>Records and chunks are separate collections keyed by {@link FileId}; no
 * operation spans both except {@link #insert}. All I/O failures surface as
 * {@link StorageUnavailableException}.
 */
public interface ChunkStore {

    /**
     * Consumes {@code content} into chunks and creates the record. The store assigns
     * the id and the {@code uploadedAt} instant.
     */
    Uni<FileVersion> insert(NewFile file, InputStream content);

    /**
     * Opens a lazy read handle over a file's chunks. The caller closes it.
     *
     * @throws ContentNotFoundException if the record or its chunks are gone
     */
    Uni<InputStream> openStream(FileId id);

    /**
     * Deletes metadata records and returns the ones this call removed. Missing ids,
     * including records removed concurrently by another caller, are ignored.
     */
    Uni<List<FileVersion>> deleteFiles(List<FileId> ids);

    /** Deletes the chunks of the given files; returns the number of chunks removed. */
    Uni<Long> deleteChunks(List<FileId> ids);

    /** Matching records, newest first ({@code uploadedAt} desc, then id desc). */
    Uni<List<FileVersion>> query(MetadataQuery query);

    Uni<Long> count(Filter filter);

    Uni<Long> countDistinctFilenames(Filter filter);

    /** Distinct container names, sorted ascending. */
    Uni<List<String>> distinctContainers();

    /** Sets the container of every matching record; returns the number updated. */
    Uni<Long> updateContainer(Filter filter, String newContainer);

    /** Overwrites one record's metadata; returns 0 when the record is gone. */
    Uni<Long> replaceMetadata(FileId id, FileMetadata metadata);
}
