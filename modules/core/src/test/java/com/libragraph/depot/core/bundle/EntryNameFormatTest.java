package com.libragraph.depot.core.bundle;

import com.libragraph.depot.core.model.FileMetadata;
import com.libragraph.depot.core.model.FileVersion;
import com.libragraph.depot.types.FileField;
import com.libragraph.depot.util.FileId;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EntryNameFormatTest {

    private static final FileVersion VERSION = new FileVersion(FileId.of(0x2a), "report.pdf", "docs",
            Instant.parse("2024-03-01T12:00:00Z"), 1234, "application/pdf", FileMetadata.empty());

    @Test
    void builtInFormats() {
        assertThat(EntryNameFormat.FILENAME.format(VERSION)).isEqualTo("report.pdf");
        assertThat(EntryNameFormat.VERSIONED.format(VERSION)).isEqualTo("000000000000002a_report.pdf");
    }

    @Test
    void parseMixesLiteralsAndFields() {
        EntryNameFormat format = EntryNameFormat.parse("{container}-{$length}-{filename}");

        assertThat(format.format(VERSION)).isEqualTo("docs-1234-report.pdf");
        assertThat(format.segments()).containsExactly(
                new EntryNameFormat.Field(FileField.CONTAINER),
                new EntryNameFormat.Literal("-"),
                new EntryNameFormat.Field(FileField.LENGTH),
                new EntryNameFormat.Literal("-"),
                new EntryNameFormat.Field(FileField.FILENAME));
    }

    @Test
    void storageAliasesAreAccepted() {
        assertThat(EntryNameFormat.parse("{metadata.container}/{uploadDate}").format(VERSION))
                .isEqualTo("docs_2024-03-01T12_00_00Z");
    }

    @Test
    void plainAliasIsLiteral() {
        assertThat(EntryNameFormat.alias("summary.pdf").format(VERSION)).isEqualTo("summary.pdf");
        assertThat(EntryNameFormat.versionedAlias("summary.pdf").format(VERSION))
                .isEqualTo("000000000000002a_summary.pdf");
    }

    @Test
    void toStringRoundTripsToEqualFormat() {
        EntryNameFormat format = EntryNameFormat.parse("v{id}.{filename}");

        assertThat(EntryNameFormat.parse(format.toString())).isEqualTo(format);
    }

    @Test
    void unsafeResultsAreSanitized() {
        FileVersion nasty = new FileVersion(FileId.of(1), "../../etc/passwd", "docs",
                Instant.EPOCH, 0, null, null);

        assertThat(EntryNameFormat.FILENAME.format(nasty)).isEqualTo(".._.._etc_passwd");
        assertThat(EntryNameFormat.parse("..").format(VERSION)).isEqualTo("_");
    }

    @Test
    void rejectsBadTemplates() {
        assertThatThrownBy(() -> EntryNameFormat.parse("{nope}"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("nope");
        assertThatThrownBy(() -> EntryNameFormat.parse("name{filename"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unclosed");
        assertThatThrownBy(() -> EntryNameFormat.parse("{metadata}"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
