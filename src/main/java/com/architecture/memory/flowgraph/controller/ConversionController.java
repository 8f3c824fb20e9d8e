package com.architecture.memory.flowgraph.controller;

import com.architecture.memory.flowgraph.dto.ConversionRequest;
import com.architecture.memory.flowgraph.dto.ConversionSummary;
import com.architecture.memory.flowgraph.service.conversion.ConversionService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/conversions")
@RequiredArgsConstructor
public class ConversionController {

    private final ConversionService conversionService;

    @PostMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<String> convert(@Valid @RequestBody ConversionRequest request) {
        String json = conversionService.convert(request.getSource(), request.getFileName());
        return ResponseEntity.ok()
                .contentType(MediaType.APPLICATION_JSON)
                .body(json);
    }

    @PostMapping("/summary")
    public ResponseEntity<ConversionSummary> summarize(@Valid @RequestBody ConversionRequest request) {
        ConversionSummary summary = conversionService.summarize(request.getSource(), request.getFileName());
        return ResponseEntity.ok(summary);
    }
}
