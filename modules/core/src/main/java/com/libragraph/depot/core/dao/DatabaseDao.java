package com.libragraph.depot.core.dao;

import org.jdbi.v3.sqlobject.statement.SqlQuery;

/** Connectivity and schema probes. */
public interface DatabaseDao {

    @SqlQuery("SELECT version()")
    String serverVersion();

    @SqlQuery("SELECT to_regclass('depot_file') IS NOT NULL AND to_regclass('depot_chunk') IS NOT NULL")
    boolean schemaPresent();
}
