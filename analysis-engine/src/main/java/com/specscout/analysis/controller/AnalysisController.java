package com.specscout.analysis.controller;

import com.specscout.analysis.dto.BatchAnalysisResponse;
import com.specscout.analysis.service.AgentDispatchService;
import com.specscout.analysis.service.AnalysisService;
import com.specscout.common.exception.SafetyViolationException;
import com.specscout.common.exception.UnsafeConfigurationException;
import com.specscout.common.model.ProfileRecord;
import com.specscout.common.model.Recommendation;
import com.specscout.common.safety.AnalysisConfig;
import com.specscout.common.safety.SafetyPolicy;
import com.specscout.common.safety.SafetyStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/analyze")
public class AnalysisController {

    private static final Logger log = LoggerFactory.getLogger(AnalysisController.class);

    private final AnalysisService analysisService;
    private final AgentDispatchService dispatchService;
    private final AnalysisConfig analysisConfig;

    public AnalysisController(AnalysisService analysisService, AgentDispatchService dispatchService,
                              AnalysisConfig analysisConfig) {
        this.analysisService = analysisService;
        this.dispatchService = dispatchService;
        this.analysisConfig = analysisConfig;
    }

    /** {@code agents} narrows the configured agent set for this call only. */
    @PostMapping
    public Mono<ResponseEntity<Recommendation>> analyze(
            @RequestBody ProfileRecord profile,
            @RequestParam(value = "agents", required = false) List<String> agents,
            @RequestHeader(value = "X-Trace-Id", required = false) String traceId) {
        return analysisService.analyze(profile, configFor(agents), traceId)
            .map(ResponseEntity::ok);
    }

    /** {@code enforce} overrides the configured enforcement mode for this batch. */
    @PostMapping("/batch")
    public Mono<ResponseEntity<BatchAnalysisResponse>> analyzeBatch(
            @RequestBody List<ProfileRecord> profiles,
            @RequestParam(value = "agents", required = false) List<String> agents,
            @RequestParam(value = "enforce", required = false) Boolean enforce,
            @RequestHeader(value = "X-Trace-Id", required = false) String traceId) {
        AnalysisConfig config = configFor(agents);
        if (enforce != null) {
            config = config.withEnforcementMode(enforce);
        }
        return analysisService.analyzeBatch(profiles, config, traceId)
            .map(ResponseEntity::ok);
    }

    @GetMapping("/safety")
    public ResponseEntity<SafetyStatus> safety() {
        return ResponseEntity.ok(SafetyPolicy.status(analysisConfig));
    }

    @GetMapping("/agents")
    public ResponseEntity<List<String>> agents() {
        return ResponseEntity.ok(dispatchService.agentNames());
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }

    @ExceptionHandler(UnsafeConfigurationException.class)
    public ResponseEntity<Map<String, String>> unsafeConfiguration(UnsafeConfigurationException e) {
        log.warn("[AnalysisController] Rejected unsafe configuration: {}", e.getMessage());
        return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
    }

    @ExceptionHandler(SafetyViolationException.class)
    public ResponseEntity<Map<String, Object>> safetyViolation(SafetyViolationException e) {
        log.error("[AnalysisController] Spec files modified during analysis: {}", e.getModifiedFiles());
        return ResponseEntity.status(HttpStatus.CONFLICT)
            .body(Map.of("error", e.getMessage(), "modified_files", e.getModifiedFiles()));
    }

    private AnalysisConfig configFor(List<String> agents) {
        return agents == null || agents.isEmpty() ? analysisConfig : analysisConfig.withEnabledAgents(agents);
    }
}
