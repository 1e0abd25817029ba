package com.libragraph.depot.core.dao;

import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.customizer.BindList;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.util.List;
import java.util.Optional;

public interface ChunkDao {

    @SqlUpdate("INSERT INTO depot_chunk (file_id, n, data) VALUES (:fileId, :n, :data)")
    void insert(@Bind("fileId") long fileId, @Bind("n") int n, @Bind("data") byte[] data);

    @SqlQuery("SELECT data FROM depot_chunk WHERE file_id = :fileId AND n = :n")
    Optional<byte[]> find(@Bind("fileId") long fileId, @Bind("n") int n);

    @SqlQuery("SELECT EXISTS (SELECT 1 FROM depot_chunk WHERE file_id = :fileId)")
    boolean exists(@Bind("fileId") long fileId);

    @SqlUpdate("DELETE FROM depot_chunk WHERE file_id IN (<fileIds>)")
    int deleteByFileIds(@BindList("fileIds") List<Long> fileIds);
}
