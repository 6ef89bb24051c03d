package com.urbanzen.analytics.api;

import com.urbanzen.analytics.artifact.ModelArtifact;
import com.urbanzen.analytics.exception.ArtifactCorruptException;
import com.urbanzen.analytics.exception.InsufficientDataException;
import com.urbanzen.analytics.features.QualityBoundsTable;
import com.urbanzen.analytics.pipeline.PipelineStats;
import com.urbanzen.analytics.pipeline.StreamingCoordinator;
import com.urbanzen.analytics.scoring.AnomalyScorer;
import com.urbanzen.analytics.scoring.OutlierModel;
import com.urbanzen.analytics.scoring.StandardNormalizer;
import com.urbanzen.analytics.scoring.TrainingSummary;
import com.urbanzen.analytics.training.OfflineTrainingService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@WebFluxTest(AnalyticsController.class)
class AnalyticsControllerTest {

    @Autowired
    private WebTestClient webTestClient;

    @MockBean
    private AnomalyScorer scorer;

    @MockBean
    private StreamingCoordinator coordinator;

    @MockBean
    private OfflineTrainingService trainingService;

    @Test
    void healthShouldBeUpWhenModelAndPipelineAreReady() {
        when(scorer.isReady()).thenReturn(true);
        when(coordinator.isRunning()).thenReturn(true);

        webTestClient.get()
                .uri("/api/v1/analytics/health")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("UP")
                .jsonPath("$.modelReady").isEqualTo(true);
    }

    @Test
    void healthShouldBeUnavailableWithoutModel() {
        when(scorer.isReady()).thenReturn(false);
        when(coordinator.isRunning()).thenReturn(true);

        webTestClient.get()
                .uri("/api/v1/analytics/health")
                .exchange()
                .expectStatus().isEqualTo(503)
                .expectBody()
                .jsonPath("$.status").isEqualTo("DOWN")
                .jsonPath("$.modelReady").isEqualTo(false);
    }

    @Test
    void modelShouldDescribeActiveArtifact() {
        when(scorer.activeArtifact()).thenReturn(Optional.of(artifact()));

        webTestClient.get()
                .uri("/api/v1/analytics/model")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.ready").isEqualTo(true)
                .jsonPath("$.artifactId").isEqualTo("artifact-1")
                .jsonPath("$.featureCount").isEqualTo(2)
                .jsonPath("$.knownDeviceTypes[0]").isEqualTo("water_sensor")
                .jsonPath("$.training.sampleCount").isEqualTo(300)
                .jsonPath("$.training.anomalyRatio").isEqualTo(0.1);
    }

    @Test
    void modelShouldReportNotReady() {
        when(scorer.activeArtifact()).thenReturn(Optional.empty());

        webTestClient.get()
                .uri("/api/v1/analytics/model")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.ready").isEqualTo(false)
                .jsonPath("$.artifactId").doesNotExist()
                .jsonPath("$.training").doesNotExist();
    }

    @Test
    void retrainShouldReturnNewArtifact() {
        when(trainingService.retrainFromSource()).thenReturn(artifact());

        webTestClient.post()
                .uri("/api/v1/analytics/model/retrain")
                .exchange()
                .expectStatus().isCreated()
                .expectBody()
                .jsonPath("$.artifactId").isEqualTo("artifact-1");
    }

    @Test
    void retrainShouldRejectInsufficientData() {
        when(trainingService.retrainFromSource()).thenThrow(new InsufficientDataException(12, 100));

        webTestClient.post()
                .uri("/api/v1/analytics/model/retrain")
                .exchange()
                .expectStatus().isEqualTo(422)
                .expectBody()
                .jsonPath("$.error").isEqualTo("Insufficient Data")
                .jsonPath("$.path").isEqualTo("/api/v1/analytics/model/retrain")
                .jsonPath("$.details.available").isEqualTo(12)
                .jsonPath("$.details.required").isEqualTo(100);
    }

    @Test
    void retrainShouldReportCorruptArtifactLocation() {
        when(trainingService.retrainFromSource())
                .thenThrow(new ArtifactCorruptException("/models/detector.json", "unreadable document"));

        webTestClient.post()
                .uri("/api/v1/analytics/model/retrain")
                .exchange()
                .expectStatus().isEqualTo(500)
                .expectBody()
                .jsonPath("$.error").isEqualTo("Artifact Corrupt")
                .jsonPath("$.details.location").isEqualTo("/models/detector.json");
    }

    @Test
    void retrainShouldTrainOffTheCallingThread() {
        String caller = Thread.currentThread().getName();
        AtomicReference<String> trainedOn = new AtomicReference<>();
        when(trainingService.retrainFromSource()).thenAnswer(invocation -> {
            trainedOn.set(Thread.currentThread().getName());
            return artifact();
        });
        AnalyticsController controller = new AnalyticsController(scorer, coordinator, trainingService);

        StepVerifier.create(controller.retrain())
                .assertNext(response -> {
                    assertThat(response.getStatusCode().value()).isEqualTo(201);
                    assertThat(response.getBody().artifactId()).isEqualTo("artifact-1");
                })
                .verifyComplete();

        assertThat(trainedOn.get()).isNotEqualTo(caller).startsWith("boundedElastic");
    }

    @Test
    void retrainShouldPropagateInsufficientData() {
        when(trainingService.retrainFromSource()).thenThrow(new InsufficientDataException(3, 100));
        AnalyticsController controller = new AnalyticsController(scorer, coordinator, trainingService);

        StepVerifier.create(controller.retrain())
                .expectError(InsufficientDataException.class)
                .verify();
    }

    @Test
    void statsShouldExposeCounters() {
        when(coordinator.stats()).thenReturn(new PipelineStats(10, 1, 2, 3, 0, 4, 0, true));

        webTestClient.get()
                .uri("/api/v1/analytics/stats")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.received").isEqualTo(10)
                .jsonPath("$.anomalies").isEqualTo(3)
                .jsonPath("$.trackedDevices").isEqualTo(4);
    }

    private static ModelArtifact artifact() {
        OutlierModel model = new OutlierModel() {
            @Override
            public String type() {
                return "fixed";
            }

            @Override
            public int dimensions() {
                return 2;
            }

            @Override
            public double decisionFunction(double[] point) {
                return 0.0;
            }
        };
        return new ModelArtifact("artifact-1", Instant.parse("2024-01-15T00:00:00Z"), 0.1,
                List.of("flow_rate", "pressure"), List.of("water_sensor"), QualityBoundsTable.empty(),
                new StandardNormalizer(new double[] {0, 0}, new double[] {1, 1}), model,
                new TrainingSummary(300, 0.1, 0.42, 0.31));
    }
}
