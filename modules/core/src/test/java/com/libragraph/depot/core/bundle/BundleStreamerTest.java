package com.libragraph.depot.core.bundle;

import com.libragraph.depot.core.model.FileVersion;
import com.libragraph.depot.core.store.ContentNotFoundException;
import com.libragraph.depot.core.store.ForwardingChunkStore;
import com.libragraph.depot.core.store.MemoryChunkStore;
import com.libragraph.depot.core.store.TickingClock;
import com.libragraph.depot.core.version.VersionStore;
import com.libragraph.depot.util.FileId;
import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;
import java.util.zip.ZipInputStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BundleStreamerTest {

    private MemoryChunkStore chunks;
    private TrackingStore store;
    private VersionStore versions;
    private BundleStreamer streamer;

    @BeforeEach
    void setUp() {
        chunks = new MemoryChunkStore(new TickingClock(), 4);
        store = new TrackingStore(chunks);
        versions = new VersionStore(store);
        streamer = new BundleStreamer(versions);
    }

    @Test
    void zipHasOneEntryPerVersionInOrder() throws IOException {
        FileVersion a = upload("a.txt", "alpha content");
        FileVersion b = upload("b.txt", "bravo");
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        OutputStreamBundleSink sink = new OutputStreamBundleSink(out);

        streamer.streamBundle(sink, List.of(b, a), EntryNameFormat.FILENAME);

        assertThat(sink.isOpened()).isTrue();
        assertThat(sink.isAborted()).isFalse();
        Map<String, String> entries = unzip(out.toByteArray());
        assertThat(entries.keySet()).containsExactly("b.txt", "a.txt");
        assertThat(entries).containsEntry("a.txt", "alpha content").containsEntry("b.txt", "bravo");
        assertThat(store.opened.get()).isEqualTo(2);
        assertThat(store.closed.get()).isEqualTo(2);
    }

    @Test
    void collidingNamesGetNumberedSuffix() throws IOException {
        FileVersion v1 = upload("report.pdf", "one");
        FileVersion v2 = upload("report.pdf", "two");
        FileVersion v3 = upload("report.pdf", "three");
        ByteArrayOutputStream out = new ByteArrayOutputStream();

        streamer.streamBundle(BundleSink.of(out), List.of(v3, v2, v1), EntryNameFormat.FILENAME);

        assertThat(unzip(out.toByteArray()))
                .containsExactly(
                        Map.entry("report.pdf", "three"),
                        Map.entry("report (1).pdf", "two"),
                        Map.entry("report (2).pdf", "one"));
    }

    @Test
    void emptyBundleNeverOpensSink() {
        OutputStreamBundleSink sink = new OutputStreamBundleSink(new ByteArrayOutputStream());

        assertThatThrownBy(() -> streamer.streamBundle(sink, List.of(), EntryNameFormat.FILENAME))
                .isInstanceOf(EmptyBundleException.class);
        assertThat(sink.isOpened()).isFalse();
    }

    @Test
    void failureMidStreamLeavesUnreadableArchive(@TempDir Path dir) throws IOException {
        FileVersion good = upload("good.txt", "complete content");
        FileVersion bad = upload("bad.txt", "this one breaks halfway");
        store.failReadsOf = bad.id();
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        OutputStreamBundleSink sink = new OutputStreamBundleSink(out);

        assertThatThrownBy(() -> streamer.streamBundle(sink, List.of(good, bad), EntryNameFormat.FILENAME))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("disk gone");

        assertThat(sink.isAborted()).isTrue();
        assertThat(store.closed.get()).isEqualTo(store.opened.get());
        Path zip = dir.resolve("partial.zip");
        Files.write(zip, out.toByteArray());
        assertThatThrownBy(() -> new ZipFile(zip.toFile()).close()).isInstanceOf(IOException.class);
    }

    @Test
    void missingContentAbortsBundle() throws IOException {
        FileVersion a = upload("a.txt", "alpha");
        FileVersion b = upload("b.txt", "bravo");
        chunks.deleteChunks(List.of(b.id())).await().indefinitely();
        OutputStreamBundleSink sink = new OutputStreamBundleSink(new ByteArrayOutputStream());

        assertThatThrownBy(() -> streamer.streamBundle(sink, List.of(a, b), EntryNameFormat.FILENAME))
                .isInstanceOf(ContentNotFoundException.class);
        assertThat(sink.isAborted()).isTrue();
    }

    @Test
    void failingSinkIsAborted() throws IOException {
        FileVersion a = upload("a.txt", "alpha");
        OutputStreamBundleSink sink = new OutputStreamBundleSink(new OutputStream() {
            @Override
            public void write(int b) throws IOException {
                throw new IOException("client went away");
            }
        });

        assertThatThrownBy(() -> streamer.streamBundle(sink, List.of(a), EntryNameFormat.FILENAME))
                .isInstanceOf(IOException.class);
        assertThat(sink.isAborted()).isTrue();
        assertThat(store.closed.get()).isEqualTo(store.opened.get());
    }

    @Test
    void streamFileWritesRawBytes() throws IOException {
        FileVersion a = upload("a.txt", "raw bytes, several chunks long");
        ByteArrayOutputStream out = new ByteArrayOutputStream();

        streamer.streamFile(BundleSink.of(out), a);

        assertThat(out.toString(StandardCharsets.UTF_8)).isEqualTo("raw bytes, several chunks long");
        assertThat(store.closed.get()).isEqualTo(1);
    }

    @Test
    void streamFileOfMissingContentLeavesSinkUnopened() throws IOException {
        FileVersion a = upload("a.txt", "alpha");
        chunks.deleteChunks(List.of(a.id())).await().indefinitely();
        OutputStreamBundleSink sink = new OutputStreamBundleSink(new ByteArrayOutputStream());

        assertThatThrownBy(() -> streamer.streamFile(sink, a)).isInstanceOf(ContentNotFoundException.class);
        assertThat(sink.isOpened()).isFalse();
    }

    private FileVersion upload(String filename, String content) {
        return versions.upload("docs", new ByteArrayInputStream(content.getBytes(StandardCharsets.UTF_8)),
                filename, "text/plain", Map.of()).await().indefinitely();
    }

    private static Map<String, String> unzip(byte[] bytes) throws IOException {
        Map<String, String> entries = new LinkedHashMap<>();
        try (ZipInputStream zin = new ZipInputStream(new ByteArrayInputStream(bytes), StandardCharsets.UTF_8)) {
            ZipEntry entry;
            while ((entry = zin.getNextEntry()) != null) {
                entries.put(entry.getName(), new String(zin.readAllBytes(), StandardCharsets.UTF_8));
            }
        }
        return entries;
    }

    /** Counts opened and closed read handles; optionally breaks reads of one file. */
    static class TrackingStore extends ForwardingChunkStore {

        final AtomicInteger opened = new AtomicInteger();
        final AtomicInteger closed = new AtomicInteger();
        volatile FileId failReadsOf;

        TrackingStore(MemoryChunkStore delegate) {
            super(delegate);
        }

        @Override
        public Uni<InputStream> openStream(FileId id) {
            return delegate.openStream(id).map(in -> {
                opened.incrementAndGet();
                return new FilterInputStream(id.equals(failReadsOf) ? new BreakingStream(in) : in) {
                    @Override
                    public void close() throws IOException {
                        closed.incrementAndGet();
                        super.close();
                    }
                };
            });
        }
    }

    /** Yields a few bytes, then fails. */
    static class BreakingStream extends FilterInputStream {

        private int remaining = 4;

        BreakingStream(InputStream in) {
            super(in);
        }

        @Override
        public int read() throws IOException {
            byte[] one = new byte[1];
            return read(one, 0, 1) < 0 ? -1 : one[0] & 0xff;
        }

        @Override
        public int read(byte[] b, int off, int len) throws IOException {
            if (remaining <= 0) {
                throw new IOException("disk gone");
            }
            int n = super.read(b, off, Math.min(len, remaining));
            remaining -= Math.max(n, 0);
            return n;
        }
    }
}
