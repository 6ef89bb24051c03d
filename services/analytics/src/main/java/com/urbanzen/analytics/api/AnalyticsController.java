package com.urbanzen.analytics.api;

import com.urbanzen.analytics.pipeline.PipelineStats;
import com.urbanzen.analytics.pipeline.StreamingCoordinator;
import com.urbanzen.analytics.scoring.AnomalyScorer;
import com.urbanzen.analytics.training.OfflineTrainingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Status and model management endpoints of the analytics service.
 *
 * Endpoints:
 * - GET  /api/v1/analytics/health - readiness of model and pipeline
 * - GET  /api/v1/analytics/model - active model artifact
 * - POST /api/v1/analytics/model/retrain - retrain from stored history
 * - GET  /api/v1/analytics/stats - pipeline counters
 */
@RestController
@RequestMapping(path = "/api/v1/analytics", produces = MediaType.APPLICATION_JSON_VALUE)
public class AnalyticsController {

    private static final Logger log = LoggerFactory.getLogger(AnalyticsController.class);

    private final AnomalyScorer scorer;
    private final StreamingCoordinator coordinator;
    private final OfflineTrainingService trainingService;

    public AnalyticsController(AnomalyScorer scorer,
                               StreamingCoordinator coordinator,
                               OfflineTrainingService trainingService) {
        this.scorer = scorer;
        this.coordinator = coordinator;
        this.trainingService = trainingService;
    }

    @GetMapping("/health")
    public Mono<ResponseEntity<HealthResponse>> health() {
        HealthResponse health = HealthResponse.of(scorer.isReady(), coordinator.isRunning());
        HttpStatus status = health.isUp() ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE;
        return Mono.just(ResponseEntity.status(status).body(health));
    }

    @GetMapping("/model")
    public Mono<ModelStatusResponse> model() {
        return Mono.just(scorer.activeArtifact()
                .map(ModelStatusResponse::of)
                .orElseGet(ModelStatusResponse::notReady));
    }

    /**
     * Retrains from the configured history source. Runs off the event loop.
     */
    @PostMapping("/model/retrain")
    public Mono<ResponseEntity<ModelStatusResponse>> retrain() {
        log.info("Retraining requested");
        return Mono.fromCallable(trainingService::retrainFromSource)
                .subscribeOn(Schedulers.boundedElastic())
                .map(artifact -> ResponseEntity.status(HttpStatus.CREATED).body(ModelStatusResponse.of(artifact)));
    }

    @GetMapping("/stats")
    public Mono<PipelineStats> stats() {
        return Mono.just(coordinator.stats());
    }
}
