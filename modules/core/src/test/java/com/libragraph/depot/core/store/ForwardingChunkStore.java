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
 * Delegates every call; tests override single methods to inject failures.
 */
public class ForwardingChunkStore implements ChunkStore {

    protected final ChunkStore delegate;

    public ForwardingChunkStore(ChunkStore delegate) {
        this.delegate = delegate;
    }

    @Override
    public Uni<FileVersion> insert(NewFile file, InputStream content) {
        return delegate.insert(file, content);
    }

    @Override
    public Uni<InputStream> openStream(FileId id) {
        return delegate.openStream(id);
    }

    @Override
    public Uni<List<FileVersion>> deleteFiles(List<FileId> ids) {
        return delegate.deleteFiles(ids);
    }

    @Override
    public Uni<Long> deleteChunks(List<FileId> ids) {
        return delegate.deleteChunks(ids);
    }

    @Override
    public Uni<List<FileVersion>> query(MetadataQuery query) {
        return delegate.query(query);
    }

    @Override
    public Uni<Long> count(Filter filter) {
        return delegate.count(filter);
    }

    @Override
    public Uni<Long> countDistinctFilenames(Filter filter) {
        return delegate.countDistinctFilenames(filter);
    }

    @Override
    public Uni<List<String>> distinctContainers() {
        return delegate.distinctContainers();
    }

    @Override
    public Uni<Long> updateContainer(Filter filter, String newContainer) {
        return delegate.updateContainer(filter, newContainer);
    }

    @Override
    public Uni<Long> replaceMetadata(FileId id, FileMetadata metadata) {
        return delegate.replaceMetadata(id, metadata);
    }
}
