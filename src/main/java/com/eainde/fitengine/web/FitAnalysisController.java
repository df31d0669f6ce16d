package com.eainde.fitengine.web;

import com.eainde.fitengine.service.AnalysisOutcome;
import com.eainde.fitengine.service.FitAnalysisService;
import com.eainde.fitengine.session.AnalysisSessionManager;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequestMapping("/api/v1/fit-analysis")
public class FitAnalysisController {

    private final FitAnalysisService analysisService;
    private final AnalysisSessionManager sessionManager;

    public FitAnalysisController(FitAnalysisService analysisService, AnalysisSessionManager sessionManager) {
        this.analysisService = analysisService;
        this.sessionManager = sessionManager;
    }

    @PostMapping
    public AnalysisResponse analyze(@Valid @RequestBody AnalysisRequest request) {
        AnalysisOutcome outcome = analysisService.analyze(request.resume(), request.job());
        return AnalysisResponse.from(outcome);
    }

    /**
     * Cancels a running analysis and destroys its data immediately.
     */
    @DeleteMapping("/{sessionId}")
    public ResponseEntity<Void> cancel(@PathVariable String sessionId) {
        sessionManager.cancel(sessionId);
        return ResponseEntity.noContent().build();
    }
}
