package it.unimib.datai.clout.controlplane.api;

import it.unimib.datai.clout.common.CancellationSignal;
import it.unimib.datai.clout.common.CloutException;
import it.unimib.datai.clout.common.model.OverflowPolicy;
import it.unimib.datai.clout.common.model.QueueConfig;
import it.unimib.datai.clout.common.model.QueueMessage;
import it.unimib.datai.clout.common.model.QueueQuota;
import it.unimib.datai.clout.common.model.QueueStats;
import it.unimib.datai.clout.controlplane.queue.QueueSaturation;
import it.unimib.datai.clout.controlplane.queue.QueueSaturationEvaluator;
import it.unimib.datai.clout.controlplane.queue.QueueSaturationReport;
import it.unimib.datai.clout.controlplane.queue.QueueServer;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@WebFluxTest(controllers = QueueController.class)
@Import(GlobalExceptionHandler.class)
class QueueControllerTest {

    @Autowired
    private WebTestClient webClient;

    @MockitoBean
    private QueueServer queueServer;

    @MockitoBean
    private QueueSaturationEvaluator saturationEvaluator;

    @Test
    void enqueue_runsOffTheEventLoop() {
        AtomicReference<String> thread = new AtomicReference<>();
        when(queueServer.enqueue(eq("jobs"), any(byte[].class), any())).thenAnswer(inv -> {
            thread.set(Thread.currentThread().getName());
            return "m-1";
        });

        webClient.post()
                .uri("/api/queues/jobs/messages")
                .contentType(MediaType.APPLICATION_OCTET_STREAM)
                .bodyValue("payload".getBytes(StandardCharsets.UTF_8))
                .exchange()
                .expectStatus().isCreated()
                .expectBody()
                .jsonPath("$.messageId").isEqualTo("m-1");

        assertThat(thread.get()).startsWith("boundedElastic");
    }

    @Test
    void stats_listsQueues() {
        when(queueServer.stats()).thenReturn(List.of(new QueueStats("jobs", 2, 10)));

        webClient.get()
                .uri("/api/queues")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$[0].name").isEqualTo("jobs")
                .jsonPath("$[0].messageCount").isEqualTo(2)
                .jsonPath("$[0].totalBytes").isEqualTo(10);
    }

    @Test
    void saturation_returnsReport() {
        when(saturationEvaluator.evaluate()).thenReturn(new QueueSaturationReport(QueueSaturation.DEGRADED, 100,
                List.of(new QueueSaturationReport.Entry("jobs", 4, 85, 85.0, QueueSaturation.DEGRADED))));

        webClient.get()
                .uri("/api/queues/saturation")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("DEGRADED")
                .jsonPath("$.queues[0].saturationPercent").isEqualTo(85.0);
    }

    @Test
    void create_withQuota() {
        QueueConfig config = new QueueConfig(new QueueQuota(1024, 10), OverflowPolicy.DROP_OLDEST);
        when(queueServer.config("jobs")).thenReturn(Optional.of(config));

        webClient.put()
                .uri("/api/queues/jobs")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("maxBytes", 1024, "maxMessages", 10, "overflow", "DROP_OLDEST"))
                .exchange()
                .expectStatus().isCreated()
                .expectBody()
                .jsonPath("$.quota.maxBytes").isEqualTo(1024)
                .jsonPath("$.overflow").isEqualTo("DROP_OLDEST");

        verify(queueServer).createQueue("jobs", config);
    }

    @Test
    void create_withoutBody_usesDefaults() {
        when(queueServer.config("jobs")).thenReturn(Optional.of(
                new QueueConfig(QueueQuota.unlimited(), OverflowPolicy.REJECT)));

        webClient.put()
                .uri("/api/queues/jobs")
                .exchange()
                .expectStatus().isCreated();

        verify(queueServer).createQueue("jobs");
    }

    @Test
    void create_conflictingConfig_returns409() {
        org.mockito.Mockito.doThrow(CloutException.queueOperationFailed("jobs", "different configuration"))
                .when(queueServer).createQueue(eq("jobs"), any(QueueConfig.class));

        webClient.put()
                .uri("/api/queues/jobs")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("maxBytes", 10))
                .exchange()
                .expectStatus().isEqualTo(409)
                .expectBody()
                .jsonPath("$.error").isEqualTo("QUEUE_OPERATION_FAILED")
                .jsonPath("$.queue").isEqualTo("jobs");
    }

    @Test
    void enqueue_returns201WithMessageId() {
        when(queueServer.enqueue(eq("jobs"), any(byte[].class), any())).thenReturn("msg-1");

        webClient.post()
                .uri("/api/queues/jobs/messages")
                .contentType(MediaType.TEXT_PLAIN)
                .bodyValue("hello".getBytes(StandardCharsets.UTF_8))
                .exchange()
                .expectStatus().isCreated()
                .expectBody()
                .jsonPath("$.queue").isEqualTo("jobs")
                .jsonPath("$.messageId").isEqualTo("msg-1");
    }

    @Test
    void enqueue_overQuota_returns507() {
        when(queueServer.enqueue(eq("jobs"), any(byte[].class), any()))
                .thenThrow(CloutException.queueQuotaExceeded("jobs", 4, "Queue 'jobs' is full"));

        webClient.post()
                .uri("/api/queues/jobs/messages")
                .contentType(MediaType.APPLICATION_OCTET_STREAM)
                .bodyValue(new byte[]{1, 2, 3, 4, 5})
                .exchange()
                .expectStatus().isEqualTo(507)
                .expectBody()
                .jsonPath("$.error").isEqualTo("QUEUE_QUOTA_EXCEEDED")
                .jsonPath("$.maxBytes").isEqualTo(4);
    }

    @Test
    void dequeue_returnsMessage() throws Exception {
        byte[] payload = "hi".getBytes(StandardCharsets.UTF_8);
        when(queueServer.dequeue(eq("jobs"), eq(Duration.ofMillis(250)), any(CancellationSignal.class)))
                .thenReturn(Optional.of(new QueueMessage("msg-1", payload, "text/plain", 2,
                        Instant.parse("2026-01-01T00:00:00Z"))));

        webClient.post()
                .uri("/api/queues/jobs/messages:dequeue?timeoutMs=250")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.id").isEqualTo("msg-1")
                .jsonPath("$.payload").isEqualTo(Base64.getEncoder().encodeToString(payload));
    }

    @Test
    void dequeue_empty_returns204() throws Exception {
        when(queueServer.dequeue(eq("jobs"), any(Duration.class), any(CancellationSignal.class)))
                .thenReturn(Optional.empty());

        webClient.post()
                .uri("/api/queues/jobs/messages:dequeue")
                .exchange()
                .expectStatus().isNoContent();
    }

    @Test
    void dequeue_timeoutOutOfRange_returns400() {
        webClient.post()
                .uri("/api/queues/jobs/messages:dequeue?timeoutMs=-1")
                .exchange()
                .expectStatus().isBadRequest();
    }

    @Test
    void purge_andDelete() {
        when(queueServer.purge("jobs")).thenReturn(3);
        when(queueServer.deleteQueue("jobs")).thenReturn(true);
        when(queueServer.deleteQueue("ghost")).thenReturn(false);

        webClient.delete()
                .uri("/api/queues/jobs/messages")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.removed").isEqualTo(3);
        webClient.delete().uri("/api/queues/jobs").exchange().expectStatus().isNoContent();
        webClient.delete().uri("/api/queues/ghost").exchange().expectStatus().isNotFound();
    }
}
