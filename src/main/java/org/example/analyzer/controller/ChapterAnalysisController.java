package org.example.analyzer.controller;

import org.example.analyzer.config.AnalysisPipelineProperties;
import org.example.analyzer.model.AnalysisRequest;
import org.example.analyzer.model.AnalysisStatusResponse;
import org.example.analyzer.model.ChapterAnalysisResult;
import org.example.analyzer.service.ChapterAnalysisService;
import org.example.analyzer.service.llm.InferenceGateway;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/analysis")
public class ChapterAnalysisController {

    private final ChapterAnalysisService chapterAnalysisService;
    private final InferenceGateway inferenceGateway;
    private final AnalysisPipelineProperties properties;

    public ChapterAnalysisController(
            ChapterAnalysisService chapterAnalysisService,
            InferenceGateway inferenceGateway,
            AnalysisPipelineProperties properties) {
        this.chapterAnalysisService = chapterAnalysisService;
        this.inferenceGateway = inferenceGateway;
        this.properties = properties;
    }

    @GetMapping("/status")
    public Map<String, Object> getStatus() {
        Map<String, Object> status = new HashMap<>();
        status.put("provider", inferenceGateway.getProviderName());
        status.put("available", inferenceGateway.isAvailable());
        status.put("heuristicFallbackEnabled", properties.isHeuristicFallbackEnabled());
        status.put("queueDepth", chapterAnalysisService.getQueueDepth());
        status.put("workers", chapterAnalysisService.getWorkers());
        status.put("waitingForEngine", inferenceGateway.getQueueLength());
        return status;
    }

    @PostMapping("/chapters/{chapterId}")
    public ResponseEntity<AnalysisStatusResponse> requestAnalysis(
            @PathVariable String chapterId,
            @RequestBody AnalysisRequest request) {
        if (request == null || request.text() == null) {
            return ResponseEntity.badRequest().build();
        }
        chapterAnalysisService.requestAnalysis(chapterId, request.text());
        return chapterAnalysisService.getStatus(chapterId)
                .map(status -> ResponseEntity.accepted().body(status))
                .orElse(ResponseEntity.accepted().build());
    }

    @GetMapping("/chapters/{chapterId}/status")
    public ResponseEntity<AnalysisStatusResponse> getChapterStatus(@PathVariable String chapterId) {
        return chapterAnalysisService.getStatus(chapterId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/chapters/{chapterId}")
    public ResponseEntity<ChapterAnalysisResult> getResult(@PathVariable String chapterId) {
        return chapterAnalysisService.getResult(chapterId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @PostMapping("/chapters/{chapterId}/cancel")
    public ResponseEntity<Map<String, Object>> cancel(@PathVariable String chapterId) {
        boolean cancelled = chapterAnalysisService.cancel(chapterId);
        if (!cancelled) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.accepted().body(Map.of("chapterId", chapterId, "cancelRequested", true));
    }
}
