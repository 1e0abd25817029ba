package com.libragraph.depot.core.bundle;

import com.libragraph.depot.core.container.CurrentVersionSelector;
import com.libragraph.depot.core.container.LineageService;
import com.libragraph.depot.core.model.FileVersion;
import com.libragraph.depot.core.query.Filter;
import com.libragraph.depot.util.EntryNames;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.util.List;

/**
 * Plans downloads. Each method resolves its selection first, so not-found and
 * empty selections fail before anything is written; the returned
 * {@link Download} does the streaming.
 *
 * <p>{@code alias} is an optional name template (see {@link EntryNameFormat#parse}).
 */
@ApplicationScoped
public class DownloadService {

    private static final String ZIP_SUFFIX = ".zip";

    @Inject
    CurrentVersionSelector selector;

    @Inject
    LineageService lineage;

    @Inject
    BundleStreamer streamer;

    public DownloadService() {
    }

    /** For use outside CDI. */
    public DownloadService(CurrentVersionSelector selector, LineageService lineage, BundleStreamer streamer) {
        this.selector = selector;
        this.lineage = lineage;
        this.streamer = streamer;
    }

    /** Current files of a container matching {@code filter}, as {@code <container>.zip}. */
    public Uni<Download> container(String container, Filter filter) {
        return selector.select(container, filter)
                .map(files -> bundle(nonEmpty(files, "No files in container: " + container),
                        container, EntryNameFormat.FILENAME));
    }

    /** The first current file of a container matching {@code filter}, as raw bytes. */
    public Uni<Download> firstMatch(String container, Filter filter, String alias, boolean inline) {
        return selector.select(container, filter)
                .map(files -> {
                    FileVersion first = nonEmpty(files, "No files in container: " + container).get(0);
                    return single(first, nameFormat(alias, EntryNameFormat.FILENAME), inline);
                });
    }

    /** Newest version of a file, as raw bytes. */
    public Uni<Download> file(String container, String filename, String alias, boolean inline) {
        return lineage.currentFile(container, filename)
                .map(current -> single(current, nameFormat(alias, EntryNameFormat.FILENAME), inline));
    }

    /** Versions of a file matching {@code filter}, as {@code <alias or filename>.zip}. */
    public Uni<Download> versions(String container, String filename, String alias, Filter filter) {
        return lineage.versions(container, filename, filter)
                .map(all -> {
                    EntryNameFormat entries = isBlank(alias)
                            ? EntryNameFormat.VERSIONED
                            : EntryNameFormat.versionedAlias(alias);
                    return bundle(nonEmpty(all, "No versions of file: " + container + "/" + filename),
                            isBlank(alias) ? filename : alias, entries);
                });
    }

    /** One version by id, as raw bytes. */
    public Uni<Download> version(String container, String filename, String versionId, String alias,
                                 boolean inline) {
        return lineage.version(container, filename, versionId)
                .map(v -> single(v, nameFormat(alias, EntryNameFormat.VERSIONED), inline));
    }

    private Download bundle(List<FileVersion> files, String baseName, EntryNameFormat entries) {
        String name = EntryNames.sanitize(baseName) + ZIP_SUFFIX;
        return new Download(name, Download.ZIP_CONTENT_TYPE, false, true,
                sink -> streamer.streamBundle(sink, files, entries));
    }

    private Download single(FileVersion version, EntryNameFormat nameFormat, boolean inline) {
        return new Download(nameFormat.format(version), version.contentType(), inline, false,
                sink -> streamer.streamFile(sink, version));
    }

    private static EntryNameFormat nameFormat(String alias, EntryNameFormat fallback) {
        return isBlank(alias) ? fallback : EntryNameFormat.alias(alias);
    }

    private static List<FileVersion> nonEmpty(List<FileVersion> files, String message) {
        if (files.isEmpty()) {
            throw new EmptyBundleException(message);
        }
        return files;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
