package com.libragraph.depot.core.version;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Outcome of a cascading delete.
 *
 * @param versionsDeleted metadata records removed
 * @param filesDeleted    distinct filenames among them, or null when not requested
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DeleteResult(long versionsDeleted, Long filesDeleted) {

    public static DeleteResult versionsOnly(long versionsDeleted) {
        return new DeleteResult(versionsDeleted, null);
    }
}
