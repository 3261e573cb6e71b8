package com.dmarcradar.ingestion.job;

import com.dmarcradar.ingestion.IngestionResult;
import com.dmarcradar.ingestion.InvalidReportInputException;
import com.dmarcradar.ingestion.ReportIngestionService;
import com.dmarcradar.ingestion.config.IngestionProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Polls the configured import directory and ingests new report files. Files are either deleted after import or
 * remembered by path, modification time and size so an unchanged file is not ingested twice.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DirectoryImportJob {

    private static final List<String> EXTENSIONS = List.of(".xml", ".gz", ".zip");

    private final ReportIngestionService reportIngestionService;
    private final IngestionProperties ingestionProperties;
    private final Map<Path, String> processed = new ConcurrentHashMap<>();

    @Scheduled(fixedDelayString = "${dmarcradar.ingestion.import-poll-interval-ms:60000}")
    public void poll() {
        String dir = ingestionProperties.getImportDirectory();
        if (dir == null || dir.isBlank()) {
            return;
        }
        Path root = Paths.get(dir);
        if (!Files.isDirectory(root)) {
            log.debug("Import directory {} does not exist", root);
            return;
        }
        List<Path> candidates;
        try (Stream<Path> files = Files.list(root)) {
            candidates = files.filter(Files::isRegularFile).filter(DirectoryImportJob::isReportFile).sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            log.warn("Cannot list import directory {}: {}", root, e.getMessage());
            return;
        }
        for (Path file : candidates) {
            importFile(file);
        }
    }

    /**
     * @return 1 when the file was ingested, 0 when it was skipped, unreadable or rejected
     */
    int importFile(Path file) {
        String fingerprint;
        byte[] content;
        try {
            fingerprint = Files.getLastModifiedTime(file).toMillis() + ":" + Files.size(file);
            if (fingerprint.equals(processed.get(file))) {
                return 0;
            }
            content = Files.readAllBytes(file);
        } catch (IOException e) {
            log.warn("Cannot read {}: {}", file, e.getMessage());
            return 0;
        }
        try {
            IngestionResult result = reportIngestionService.ingest(content, file.getFileName().toString());
            log.info("Imported {} as report {} ({} records)", file.getFileName(), result.reportId(), result.recordCount());
        } catch (InvalidReportInputException e) {
            log.warn("Skipping {}: {}", file.getFileName(), e.getMessage());
            processed.put(file, fingerprint);
            return 0;
        }
        if (ingestionProperties.isDeleteAfterImport()) {
            try {
                Files.deleteIfExists(file);
                return 1;
            } catch (IOException e) {
                log.warn("Could not delete {}: {}", file, e.getMessage());
            }
        }
        processed.put(file, fingerprint);
        return 1;
    }

    static boolean isReportFile(Path file) {
        String name = file.getFileName().toString();
        if (name.startsWith(".")) {
            return false;
        }
        String lower = name.toLowerCase(Locale.ROOT);
        return EXTENSIONS.stream().anyMatch(lower::endsWith);
    }
}
