package com.judgmentbell.analysis.controller;

import com.judgmentbell.analysis.model.ChshRequest;
import com.judgmentbell.analysis.model.CommutatorRequest;
import com.judgmentbell.analysis.model.CommutatorResponse;
import com.judgmentbell.analysis.model.CompareRequest;
import com.judgmentbell.analysis.model.InterferenceRequest;
import com.judgmentbell.analysis.model.InterferenceResponse;
import com.judgmentbell.analysis.service.AnalysisService;
import com.judgmentbell.common.report.ReportRenderer;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/analysis")
public class AnalysisController {

    private final AnalysisService analysisService;

    public AnalysisController(AnalysisService analysisService) {
        this.analysisService = analysisService;
    }

    /** Structured report, or its plain-text rendering with {@code ?format=text}. */
    @PostMapping("/chsh")
    public Mono<ResponseEntity<?>> chsh(@RequestBody ChshRequest request,
                                        @RequestParam(value = "format", defaultValue = "json") String format) {
        return analysisService.chsh(request)
            .map(report -> "text".equalsIgnoreCase(format)
                ? ResponseEntity.ok().contentType(MediaType.TEXT_PLAIN).body(ReportRenderer.render(report))
                : ResponseEntity.ok().contentType(MediaType.APPLICATION_JSON).body(report));
    }

    @PostMapping("/compare")
    public Mono<ResponseEntity<?>> compare(@RequestBody CompareRequest request,
                                           @RequestParam(value = "format", defaultValue = "json") String format) {
        return analysisService.compare(request.sources())
            .map(comparison -> "text".equalsIgnoreCase(format)
                ? ResponseEntity.ok().contentType(MediaType.TEXT_PLAIN).body(ReportRenderer.render(comparison))
                : ResponseEntity.ok().contentType(MediaType.APPLICATION_JSON).body(comparison));
    }

    @PostMapping("/commutator")
    public Mono<ResponseEntity<CommutatorResponse>> commutator(@RequestBody CommutatorRequest request) {
        return analysisService.commutator(request.observations()).map(ResponseEntity::ok);
    }

    @PostMapping("/interference")
    public Mono<ResponseEntity<InterferenceResponse>> interference(@RequestBody InterferenceRequest request) {
        return analysisService.interference(request.observations()).map(ResponseEntity::ok);
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }
}
