package com.dmarcradar.api.controller;

import com.dmarcradar.ingestion.IngestionResult;
import com.dmarcradar.ingestion.InvalidReportInputException;
import com.dmarcradar.ingestion.ReportIngestionService;
import lombok.RequiredArgsConstructor;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.multipart.FilePart;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * POST /api/v1/reports/upload (multipart "file": .xml, .gz, .zip).
 */
@RestController
@RequestMapping("/api/v1/reports")
@RequiredArgsConstructor
public class ReportController {

    private final ReportIngestionService reportIngestionService;

    @PostMapping(value = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public Mono<ResponseEntity<IngestionResult>> upload(@RequestPart("file") FilePart file) {
        return DataBufferUtils.join(file.content())
                .map(ReportController::toBytes)
                .switchIfEmpty(Mono.error(new InvalidReportInputException("Invalid file buffer")))
                .publishOn(Schedulers.boundedElastic())
                .map(bytes -> ResponseEntity.ok(reportIngestionService.ingest(bytes, file.filename())));
    }

    private static byte[] toBytes(DataBuffer buffer) {
        try {
            byte[] bytes = new byte[buffer.readableByteCount()];
            buffer.read(bytes);
            return bytes;
        } finally {
            DataBufferUtils.release(buffer);
        }
    }
}
