package com.libragraph.depot.core.dao;

import com.libragraph.depot.core.model.FileMetadata;
import com.libragraph.depot.core.model.FileVersion;
import com.libragraph.depot.util.FileId;
import org.jdbi.v3.core.generic.GenericType;
import org.jdbi.v3.core.mapper.ColumnMapper;
import org.jdbi.v3.core.mapper.RowMapper;
import org.jdbi.v3.core.qualifier.QualifiedType;
import org.jdbi.v3.core.statement.StatementContext;
import org.jdbi.v3.json.Json;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.util.Map;

/**
 * Maps a {@code depot_file} row. The {@code jsonb} metadata column is decoded by
 * the Jackson plugin's {@code @Json} column mapper.
 */
public class FileVersionMapper implements RowMapper<FileVersion> {

    private static final QualifiedType<Map<String, Object>> METADATA_TYPE =
            QualifiedType.of(new GenericType<Map<String, Object>>() {}).with(Json.class);

    @Override
    public FileVersion map(ResultSet rs, StatementContext ctx) throws SQLException {
        ColumnMapper<Map<String, Object>> metadataMapper = ctx.findColumnMapperFor(METADATA_TYPE)
                .orElseThrow(() -> new IllegalStateException("No @Json column mapper registered"));
        return new FileVersion(
                FileId.of(rs.getLong("id")),
                rs.getString("filename"),
                rs.getString("container"),
                rs.getObject("upload_date", OffsetDateTime.class).toInstant(),
                rs.getLong("length"),
                rs.getString("content_type"),
                FileMetadata.of(metadataMapper.map(rs, "metadata", ctx)));
    }
}
