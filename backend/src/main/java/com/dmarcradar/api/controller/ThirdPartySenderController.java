package com.dmarcradar.api.controller;

import com.dmarcradar.api.dto.CreateThirdPartySenderRequest;
import com.dmarcradar.api.dto.ThirdPartySenderResponse;
import com.dmarcradar.api.dto.UpdateThirdPartySenderRequest;
import com.dmarcradar.classification.sender.ThirdPartySenderService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * CRUD for known third-party senders (/api/v1/third-party-senders).
 */
@RestController
@RequestMapping("/api/v1/third-party-senders")
@RequiredArgsConstructor
public class ThirdPartySenderController {

    private final ThirdPartySenderService thirdPartySenderService;

    @GetMapping
    public List<ThirdPartySenderResponse> findAll() {
        return thirdPartySenderService.findAll().stream().map(ThirdPartySenderResponse::from).toList();
    }

    @GetMapping("/{id}")
    public ThirdPartySenderResponse findById(@PathVariable String id) {
        return ThirdPartySenderResponse.from(thirdPartySenderService.findById(id));
    }

    @PostMapping
    public ResponseEntity<ThirdPartySenderResponse> create(@Valid @RequestBody CreateThirdPartySenderRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ThirdPartySenderResponse.from(thirdPartySenderService.create(request.toCommand())));
    }

    @PutMapping("/{id}")
    public ThirdPartySenderResponse update(@PathVariable String id, @Valid @RequestBody UpdateThirdPartySenderRequest request) {
        return ThirdPartySenderResponse.from(thirdPartySenderService.update(id, request.toCommand()));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable String id) {
        thirdPartySenderService.delete(id);
        return ResponseEntity.noContent().build();
    }
}
