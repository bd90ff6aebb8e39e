package it.unimib.datai.clout.controlplane.api;

import it.unimib.datai.clout.common.CancellationSignal;
import it.unimib.datai.clout.common.model.QueueConfig;
import it.unimib.datai.clout.common.model.QueueMessage;
import it.unimib.datai.clout.common.model.QueueQuota;
import it.unimib.datai.clout.common.model.QueueStats;
import it.unimib.datai.clout.controlplane.queue.QueueSaturationEvaluator;
import it.unimib.datai.clout.controlplane.queue.QueueSaturationReport;
import it.unimib.datai.clout.controlplane.queue.QueueServer;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/queues")
@Validated
public class QueueController {
    private final QueueServer queueServer;
    private final QueueSaturationEvaluator saturationEvaluator;

    public QueueController(QueueServer queueServer, QueueSaturationEvaluator saturationEvaluator) {
        this.queueServer = queueServer;
        this.saturationEvaluator = saturationEvaluator;
    }

    @GetMapping
    public List<QueueStats> stats() {
        return queueServer.stats();
    }

    @GetMapping("/saturation")
    public QueueSaturationReport saturation() {
        return saturationEvaluator.evaluate();
    }

    @PutMapping("/{name}")
    public Mono<ResponseEntity<QueueConfig>> create(@PathVariable String name,
                                                    @RequestBody(required = false) @Valid CreateQueueRequest request) {
        return Blocking.call(() -> {
            if (request == null) {
                queueServer.createQueue(name);
            } else {
                QueueQuota quota = new QueueQuota(
                        request.maxBytes() != null ? request.maxBytes() : Long.MAX_VALUE,
                        request.maxMessages() != null ? request.maxMessages() : Integer.MAX_VALUE);
                queueServer.createQueue(name, new QueueConfig(quota, request.overflow()));
            }
            return queueServer.config(name)
                    .map(config -> ResponseEntity.status(HttpStatus.CREATED).body(config))
                    .orElse(ResponseEntity.notFound().build());
        });
    }

    @DeleteMapping("/{name}")
    public Mono<ResponseEntity<Void>> delete(@PathVariable String name) {
        return Blocking.call(() -> queueServer.deleteQueue(name)
                ? ResponseEntity.noContent().<Void>build()
                : ResponseEntity.notFound().<Void>build());
    }

    @PostMapping("/{name}/messages")
    public Mono<ResponseEntity<EnqueueResponse>> enqueue(
            @PathVariable String name,
            @RequestBody(required = false) byte[] payload,
            @RequestHeader(value = HttpHeaders.CONTENT_TYPE, required = false) String contentType) {
        return Blocking.call(() -> queueServer.enqueue(name, payload == null ? new byte[0] : payload, contentType))
                .map(id -> ResponseEntity.status(HttpStatus.CREATED).body(new EnqueueResponse(name, id)));
    }

    @PostMapping("/{name}/messages:dequeue")
    public Mono<ResponseEntity<QueueMessage>> dequeue(
            @PathVariable String name,
            @RequestParam(defaultValue = "0") @Min(0) @Max(60_000) long timeoutMs) {
        CancellationSignal cancellation = new CancellationSignal();
        return Mono.fromCallable(() -> queueServer.dequeue(name, Duration.ofMillis(timeoutMs), cancellation))
                .subscribeOn(Schedulers.boundedElastic())
                .doOnCancel(cancellation::cancel)
                .map(message -> message
                        .map(ResponseEntity::ok)
                        .orElse(ResponseEntity.noContent().build()));
    }

    @DeleteMapping("/{name}/messages")
    public Mono<Map<String, Object>> purge(@PathVariable String name) {
        return Blocking.call(() -> Map.<String, Object>of("queue", name, "removed", queueServer.purge(name)));
    }
}
