package com.libragraph.depot.core.store;

import com.libragraph.depot.core.query.Filter;

/**
 * A read against the metadata collection.
 *
 * @param filter            records to match; null matches all
 * @param latestPerFilename keep only the newest record of each filename
 * @param limit             maximum rows returned, 0 for no limit
 */
public record MetadataQuery(Filter filter, boolean latestPerFilename, int limit) {

    public MetadataQuery {
        filter = filter != null ? filter : Filter.all();
        if (limit < 0) {
            throw new IllegalArgumentException("limit must be >= 0, got: " + limit);
        }
    }

    public static MetadataQuery of(Filter filter) {
        return new MetadataQuery(filter, false, 0);
    }

    public static MetadataQuery latestPerFilename(Filter filter) {
        return new MetadataQuery(filter, true, 0);
    }

    /** Only the newest matching record. */
    public static MetadataQuery first(Filter filter) {
        return new MetadataQuery(filter, false, 1);
    }
}
