package com.libragraph.depot.core.container;

import com.libragraph.depot.core.model.FileVersion;
import com.libragraph.depot.core.query.Filter;
import com.libragraph.depot.core.version.CountResult;
import com.libragraph.depot.core.version.DeleteResult;
import com.libragraph.depot.core.version.VersionStore;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.List;

/**
 * Containers as derived groupings of version records. A container exists while
 * at least one version carries its name.
 */
@ApplicationScoped
public class ContainerIndex {

    private static final Logger log = Logger.getLogger(ContainerIndex.class);

    @Inject
    VersionStore versions;

    @Inject
    CurrentVersionSelector selector;

    public ContainerIndex() {
    }

    /** For use outside CDI. */
    public ContainerIndex(VersionStore versions, CurrentVersionSelector selector) {
        this.versions = versions;
        this.selector = selector;
    }

    /** Distinct container names, sorted. */
    public Uni<List<String>> listContainers() {
        return versions.containers();
    }

    /**
     * Moves every version of {@code oldName} to {@code newName}.
     *
     * @return the number of distinct files in {@code oldName} before the move
     */
    public Uni<CountResult> renameContainer(String oldName, String newName) {
        Filter scope = Filter.container(oldName);
        return versions.countFiles(scope)
                .flatMap(files -> versions.reassignContainer(scope, newName)
                        .invoke(moved -> log.infof("Renamed container '%s' -> '%s' (%d files, %d versions)",
                                oldName, newName, files.count(), moved))
                        .replaceWith(files));
    }

    /** Deletes every version in the container, with the distinct file count. */
    public Uni<DeleteResult> deleteContainer(String name) {
        return versions.deleteByFilter(Filter.container(name), true)
                .invoke(result -> log.infof("Deleted container '%s': %s", name, result));
    }

    public Uni<List<FileVersion>> listCurrentFiles(String container, Filter filter) {
        return selector.select(container, filter);
    }

    public Uni<CountResult> countCurrentFiles(String container, Filter filter) {
        return selector.count(container, filter);
    }
}
