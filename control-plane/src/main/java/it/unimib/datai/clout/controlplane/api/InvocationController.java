package it.unimib.datai.clout.controlplane.api;

import it.unimib.datai.clout.common.CancellationSignal;
import it.unimib.datai.clout.common.model.ExecutionOutcome;
import it.unimib.datai.clout.common.model.ExecutionRequest;
import it.unimib.datai.clout.controlplane.execution.FunctionExecutor;
import it.unimib.datai.clout.controlplane.registry.FunctionService;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;

/**
 * Runs a registered function once with the request body as input. A client that disconnects
 * cancels the execution.
 */
@RestController
@RequestMapping("/api/functions")
@Validated
public class InvocationController {
    private final FunctionService functionService;
    private final FunctionExecutor executor;

    public InvocationController(FunctionService functionService, FunctionExecutor executor) {
        this.functionService = functionService;
        this.executor = executor;
    }

    @PostMapping("/{id}:invoke")
    public Mono<ResponseEntity<InvocationResponse>> invoke(
            @PathVariable String id,
            @RequestBody(required = false) byte[] input,
            @RequestHeader(value = "X-Timeout-Ms", required = false) @Min(1) @Max(3_600_000) Long timeoutMs) {
        if (functionService.get(id).isEmpty()) {
            return Mono.just(ResponseEntity.notFound().build());
        }
        ExecutionRequest request = new ExecutionRequest(id, input,
                timeoutMs != null ? Duration.ofMillis(timeoutMs) : null);
        CancellationSignal cancellation = new CancellationSignal();
        return Mono.fromCallable(() -> executor.execute(request, cancellation))
                .subscribeOn(Schedulers.boundedElastic())
                .doOnCancel(cancellation::cancel)
                .map(result -> {
                    InvocationResponse body = InvocationResponse.from(result);
                    if (result.outcome() == ExecutionOutcome.FAILED) {
                        return ResponseEntity.status(GlobalExceptionHandler.statusFor(result.error())).body(body);
                    }
                    return ResponseEntity.ok(body);
                });
    }
}
