package com.libragraph.depot.core.bundle;

import com.libragraph.depot.core.model.FileVersion;
import com.libragraph.depot.core.version.VersionStore;
import com.libragraph.depot.util.EntryNames;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipArchiveOutputStream;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Streams stored content to a {@link BundleSink}, as a zip archive or as raw bytes.
 *
 * <p>Content is copied progressively with one open read handle at a time. If
 * anything fails after the sink is opened, the sink is aborted before any zip
 * central directory is written, so a partial archive never reads as complete.
 */
@ApplicationScoped
public class BundleStreamer {

    private static final Logger log = Logger.getLogger(BundleStreamer.class);

    @Inject
    VersionStore versions;

    public BundleStreamer() {
    }

    /** For use outside CDI. */
    public BundleStreamer(VersionStore versions) {
        this.versions = versions;
    }

    /**
     * Writes one zip entry per version, in order. Colliding entry names get a
     * {@code " (n)"} suffix before the extension.
     *
     * @throws EmptyBundleException if {@code bundle} is empty; the sink is not opened
     */
    public void streamBundle(BundleSink sink, List<FileVersion> bundle, EntryNameFormat nameFormat)
            throws IOException {
        if (bundle.isEmpty()) {
            throw new EmptyBundleException("No files to bundle");
        }
        AbortableOutputStream out = new AbortableOutputStream(sink.open());
        ZipArchiveOutputStream zip = new ZipArchiveOutputStream(out);
        zip.setEncoding("UTF-8");
        Set<String> used = new HashSet<>();
        String entryName = null;
        try {
            for (FileVersion version : bundle) {
                entryName = EntryNames.uniquify(nameFormat.format(version), used);
                ZipArchiveEntry entry = new ZipArchiveEntry(entryName);
                entry.setTime(version.uploadedAt().toEpochMilli());
                entry.setSize(version.length());
                zip.putArchiveEntry(entry);
                try (InputStream in = versions.openContent(version).await().indefinitely()) {
                    in.transferTo(zip);
                }
                zip.closeArchiveEntry();
            }
            zip.finish();
            zip.close();
            log.debugf("Streamed bundle of %d entries", bundle.size());
        } catch (IOException | RuntimeException e) {
            abort(sink, out, zip, e, entryName);
            throw e;
        }
    }

    /**
     * Writes one version's raw bytes. The content is opened before the sink, so a
     * missing version fails without touching the sink.
     */
    public void streamFile(BundleSink sink, FileVersion version) throws IOException {
        try (InputStream in = versions.openContent(version).await().indefinitely()) {
            OutputStream out = sink.open();
            try {
                in.transferTo(out);
                out.flush();
            } catch (IOException | RuntimeException e) {
                log.warnf("Aborted download of %s: %s", version.id(), e.getMessage());
                sink.abort(e);
                throw e;
            }
        }
    }

    private static void abort(BundleSink sink, AbortableOutputStream out, ZipArchiveOutputStream zip,
                              Exception cause, String entryName) {
        log.warnf("Aborted bundle at entry '%s': %s", entryName, cause.getMessage());
        out.abort();
        sink.abort(cause);
        try {
            zip.close();
        } catch (IOException e) {
            cause.addSuppressed(e);
        }
    }
}
