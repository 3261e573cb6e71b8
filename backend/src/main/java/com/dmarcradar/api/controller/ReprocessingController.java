package com.dmarcradar.api.controller;

import com.dmarcradar.api.dto.ReprocessingJobResponse;
import com.dmarcradar.reprocessing.ReprocessingJobService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * POST /reprocessing/start, GET /reprocessing/jobs[/{id}], GET /reprocessing/current, POST /reprocessing/jobs/{id}/cancel.
 */
@RestController
@RequestMapping("/api/v1/reprocessing")
@RequiredArgsConstructor
public class ReprocessingController {

    private final ReprocessingJobService reprocessingJobService;

    @PostMapping("/start")
    public ResponseEntity<ReprocessingJobResponse> start() {
        return ResponseEntity.accepted().body(ReprocessingJobResponse.from(reprocessingJobService.startReprocessing()));
    }

    @GetMapping("/jobs")
    public List<ReprocessingJobResponse> jobs() {
        return reprocessingJobService.findAll().stream().map(ReprocessingJobResponse::from).toList();
    }

    @GetMapping("/jobs/{id}")
    public ReprocessingJobResponse job(@PathVariable String id) {
        return ReprocessingJobResponse.from(reprocessingJobService.findById(id));
    }

    @GetMapping("/current")
    public ResponseEntity<ReprocessingJobResponse> current() {
        return reprocessingJobService.getCurrentJob()
                .map(j -> ResponseEntity.ok(ReprocessingJobResponse.from(j)))
                .orElse(ResponseEntity.noContent().build());
    }

    @PostMapping("/jobs/{id}/cancel")
    public ReprocessingJobResponse cancel(@PathVariable String id) {
        return ReprocessingJobResponse.from(reprocessingJobService.cancel(id));
    }
}
