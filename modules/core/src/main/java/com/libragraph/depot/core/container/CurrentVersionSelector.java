package com.libragraph.depot.core.container;

import com.libragraph.depot.core.model.FileVersion;
import com.libragraph.depot.core.query.Filter;
import com.libragraph.depot.core.version.CountResult;
import com.libragraph.depot.core.version.VersionStore;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.util.List;

/**
 * Resolves the current version of each file in a container: among versions
 * matching {@code container == c AND filter}, the newest of each filename.
 *
 * <p>Derived on every call; nothing is cached.
 */
@ApplicationScoped
public class CurrentVersionSelector {

    @Inject
    VersionStore versions;

    public CurrentVersionSelector() {
    }

    /** For use outside CDI. */
    public CurrentVersionSelector(VersionStore versions) {
        this.versions = versions;
    }

    /** Current versions, newest first. */
    public Uni<List<FileVersion>> select(String container, Filter filter) {
        return versions.latestPerFilename(scope(container, filter));
    }

    /** Number of current versions; equals the distinct filenames among the matches. */
    public Uni<CountResult> count(String container, Filter filter) {
        return versions.countFiles(scope(container, filter));
    }

    private static Filter scope(String container, Filter filter) {
        return Filter.and(Filter.container(container), filter);
    }
}
