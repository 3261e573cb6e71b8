package com.dmarcradar.ingestion.archive;

import com.dmarcradar.ingestion.InvalidReportInputException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.zip.GZIPOutputStream;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReportArchiveExtractorTest {

    private static final String XML = "<feedback><report_metadata><report_id>r1</report_id></report_metadata></feedback>";

    private final ReportArchiveExtractor extractor = new ReportArchiveExtractor();

    @Test
    void plainXml() {
        assertThat(extractor.extract(XML.getBytes(StandardCharsets.UTF_8), "xml")).isEqualTo(XML);
    }

    @Test
    @DisplayName("gzip signature wins over a .zip extension")
    void gzipNamedZip() throws IOException {
        assertThat(extractor.extract(gzip(XML), "zip")).isEqualTo(XML);
    }

    @Test
    @DisplayName("zip signature wins over a .gz extension")
    void zipNamedGz() throws IOException {
        assertThat(extractor.extract(zip(Map.of("report.xml", XML.getBytes(StandardCharsets.UTF_8))), ".gz"))
                .isEqualTo(XML);
    }

    @Test
    @DisplayName("xml entry is preferred, then a gzipped entry")
    void entrySelection() throws IOException {
        Map<String, byte[]> entries = new LinkedHashMap<>();
        entries.put("readme.txt", "hello".getBytes(StandardCharsets.UTF_8));
        entries.put("google.com!example.com!1709251200!1709337599.xml.gz", gzip(XML));
        assertThat(extractor.extract(zip(entries), "zip")).isEqualTo(XML);

        entries.put("inner/report.xml", "<feedback/>".getBytes(StandardCharsets.UTF_8));
        assertThat(extractor.extract(zip(entries), "zip")).isEqualTo("<feedback/>");
    }

    @Test
    void emptyZipRejected() throws IOException {
        assertThatThrownBy(() -> extractor.extract(zip(Map.of()), "zip"))
                .isInstanceOf(InvalidReportInputException.class);
    }

    @Test
    void unsupportedType() {
        assertThatThrownBy(() -> extractor.extract("%PDF-1.4".getBytes(StandardCharsets.UTF_8), "pdf"))
                .isInstanceOf(InvalidReportInputException.class)
                .hasMessage("Unsupported file type: pdf");
    }

    @Test
    void emptyBuffer() {
        assertThatThrownBy(() -> extractor.extract(new byte[0], "xml"))
                .isInstanceOf(InvalidReportInputException.class)
                .hasMessage("Invalid file buffer");
    }

    @Test
    void corruptGzip() {
        byte[] garbage = {(byte) 0x1f, (byte) 0x8b, 8, 0, 1, 2, 3, 4};
        assertThatThrownBy(() -> extractor.extract(garbage, "gz"))
                .isInstanceOf(InvalidReportInputException.class);
    }

    private static byte[] gzip(String text) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (GZIPOutputStream gz = new GZIPOutputStream(out)) {
            gz.write(text.getBytes(StandardCharsets.UTF_8));
        }
        return out.toByteArray();
    }

    private static byte[] zip(Map<String, byte[]> entries) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (ZipOutputStream zip = new ZipOutputStream(out)) {
            for (Map.Entry<String, byte[]> e : entries.entrySet()) {
                zip.putNextEntry(new ZipEntry(e.getKey()));
                zip.write(e.getValue());
                zip.closeEntry();
            }
        }
        return out.toByteArray();
    }
}
