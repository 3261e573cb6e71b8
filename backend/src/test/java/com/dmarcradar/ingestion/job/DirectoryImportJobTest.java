package com.dmarcradar.ingestion.job;

import com.dmarcradar.ingestion.IngestionResult;
import com.dmarcradar.ingestion.InvalidReportInputException;
import com.dmarcradar.ingestion.ReportIngestionService;
import com.dmarcradar.ingestion.config.IngestionProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DirectoryImportJobTest {

    private static final IngestionResult RESULT = new IngestionResult("id", "rid", "org", "example.com", 1, false, 1);

    @TempDir
    Path dir;

    @Mock
    ReportIngestionService reportIngestionService;

    IngestionProperties properties;
    DirectoryImportJob job;

    @BeforeEach
    void setUp() {
        properties = new IngestionProperties();
        properties.setImportDirectory(dir.toString());
        job = new DirectoryImportJob(reportIngestionService, properties);
    }

    @Test
    @DisplayName("unchanged files are imported once")
    void importsOnce() throws IOException {
        Files.writeString(dir.resolve("a.xml"), "<feedback/>");
        Files.writeString(dir.resolve("notes.txt"), "ignored");
        Files.writeString(dir.resolve(".hidden.xml"), "ignored");
        when(reportIngestionService.ingest(any(), eq("a.xml"))).thenReturn(RESULT);

        job.poll();
        job.poll();

        verify(reportIngestionService, times(1)).ingest(any(), eq("a.xml"));
        verify(reportIngestionService, never()).ingest(any(), eq("notes.txt"));
        verify(reportIngestionService, never()).ingest(any(), eq(".hidden.xml"));
    }

    @Test
    void deletesAfterImportWhenConfigured() throws IOException {
        properties.setDeleteAfterImport(true);
        Path file = dir.resolve("b.zip");
        Files.write(file, new byte[]{'P', 'K', 3, 4});
        when(reportIngestionService.ingest(any(), eq("b.zip"))).thenReturn(RESULT);

        assertThat(job.importFile(file)).isEqualTo(1);
        assertThat(file).doesNotExist();
    }

    @Test
    @DisplayName("rejected file is kept and not retried until it changes")
    void rejectedFileKept() throws IOException {
        properties.setDeleteAfterImport(true);
        Path file = dir.resolve("bad.gz");
        Files.write(file, new byte[]{1, 2, 3});
        when(reportIngestionService.ingest(any(), eq("bad.gz"))).thenThrow(new InvalidReportInputException("bad"));

        assertThat(job.importFile(file)).isZero();
        assertThat(job.importFile(file)).isZero();

        assertThat(file).exists();
        verify(reportIngestionService, times(1)).ingest(any(), eq("bad.gz"));
    }

    @Test
    void blankDirectoryIsIdle() {
        properties.setImportDirectory(" ");

        job.poll();

        verify(reportIngestionService, never()).ingest(any(), any());
    }

    @Test
    void reportFileNames() {
        assertThat(DirectoryImportJob.isReportFile(Path.of("x.XML"))).isTrue();
        assertThat(DirectoryImportJob.isReportFile(Path.of("x.xml.gz"))).isTrue();
        assertThat(DirectoryImportJob.isReportFile(Path.of("x.pdf"))).isFalse();
        assertThat(DirectoryImportJob.isReportFile(Path.of(".x.zip"))).isFalse();
    }
}
