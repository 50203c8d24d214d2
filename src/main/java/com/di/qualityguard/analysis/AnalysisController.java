package com.di.qualityguard.analysis;

import com.di.qualityguard.report.Report;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * REST API: upload a dataset CSV (and optionally a baseline CSV) and get the quality report.
 * <ul>
 *   <li>{@code POST /api/analyze} multipart parts {@code dataset} and optional {@code baseline}</li>
 *   <li>{@code GET /api/health}</li>
 * </ul>
 */
@RestController
@RequiredArgsConstructor
public class AnalysisController {

    private final AnalysisService analysisService;

    @PostMapping(value = "/api/analyze",
            consumes = MediaType.MULTIPART_FORM_DATA_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Report> analyze(
            @RequestParam("dataset") MultipartFile dataset,
            @RequestParam(value = "baseline", required = false) MultipartFile baseline) throws IOException {
        byte[] baselineBytes = baseline != null && !baseline.isEmpty() ? baseline.getBytes() : null;
        return ResponseEntity.ok(analysisService.analyze(dataset.getBytes(), baselineBytes));
    }

    @GetMapping(value = "/api/health", produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, String> health() {
        return Map.of("status", "ok");
    }

    @GetMapping(value = {"/", "/api"}, produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, String> root() {
        Map<String, String> info = new LinkedHashMap<>();
        info.put("name", "QualityGuard");
        info.put("status", "ok");
        info.put("analyze", "/api/analyze");
        info.put("health", "/api/health");
        return info;
    }
}
