package com.libragraph.depot.core.dao;

import com.libragraph.depot.core.model.FileVersion;
import org.jdbi.v3.json.Json;
import org.jdbi.v3.sqlobject.config.RegisterRowMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.customizer.BindList;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Metadata records of stored files. Dynamic filter queries go through
 * {@link com.libragraph.depot.core.store.JdbiChunkStore} directly.
 */
@RegisterRowMapper(FileVersionMapper.class)
public interface FileDao {

    /** Creates the record with a zero length; content is attached before {@link #complete}. */
    @SqlQuery("INSERT INTO depot_file (filename, container, chunk_size, content_type, metadata) " +
            "VALUES (:filename, :container, :chunkSize, :contentType, CAST(:metadata AS jsonb)) " +
            "RETURNING id")
    long insert(@Bind("filename") String filename,
                @Bind("container") String container,
                @Bind("chunkSize") int chunkSize,
                @Bind("contentType") String contentType,
                @Bind("metadata") @Json Map<String, Object> metadata);

    /** Records the final length and stamps the upload time. */
    @SqlQuery("UPDATE depot_file SET length = :length, upload_date = clock_timestamp() " +
            "WHERE id = :id RETURNING *")
    FileVersion complete(@Bind("id") long id, @Bind("length") long length);

    @SqlQuery("SELECT * FROM depot_file WHERE id = :id")
    Optional<FileVersion> findById(@Bind("id") long id);

    @SqlUpdate("UPDATE depot_file SET metadata = CAST(:metadata AS jsonb) WHERE id = :id")
    int replaceMetadata(@Bind("id") long id, @Bind("metadata") @Json Map<String, Object> metadata);

    @SqlQuery("DELETE FROM depot_file WHERE id IN (<ids>) RETURNING *")
    List<FileVersion> deleteByIds(@BindList("ids") List<Long> ids);
}
