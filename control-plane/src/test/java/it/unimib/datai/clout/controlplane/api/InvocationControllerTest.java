package it.unimib.datai.clout.controlplane.api;

import it.unimib.datai.clout.common.CancellationSignal;
import it.unimib.datai.clout.common.CloutException;
import it.unimib.datai.clout.common.model.ExecutionRequest;
import it.unimib.datai.clout.common.model.ExecutionResult;
import it.unimib.datai.clout.common.model.FunctionRegistration;
import it.unimib.datai.clout.common.model.RuntimeKind;
import it.unimib.datai.clout.controlplane.execution.FunctionExecutor;
import it.unimib.datai.clout.controlplane.registry.FunctionService;
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
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@WebFluxTest(controllers = InvocationController.class)
@Import(GlobalExceptionHandler.class)
class InvocationControllerTest {

    @Autowired
    private WebTestClient webClient;

    @MockitoBean
    private FunctionService functionService;

    @MockitoBean
    private FunctionExecutor executor;

    private void registered(String id) {
        when(functionService.get(id)).thenReturn(Optional.of(new FunctionRegistration(id, "echo", RuntimeKind.SCRIPT,
                "sh", null, true, "code", null, Instant.now())));
    }

    @Test
    void invoke_success_returnsOutput() {
        registered("fn-1");
        when(executor.execute(any(ExecutionRequest.class), any(CancellationSignal.class)))
                .thenReturn(ExecutionResult.succeeded("fn-1", "HELLO", Duration.ofMillis(12)));

        webClient.post()
                .uri("/api/functions/fn-1:invoke")
                .header("X-Timeout-Ms", "2000")
                .contentType(MediaType.TEXT_PLAIN)
                .bodyValue("hello".getBytes(StandardCharsets.UTF_8))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.outcome").isEqualTo("SUCCEEDED")
                .jsonPath("$.output").isEqualTo("HELLO")
                .jsonPath("$.durationMs").isEqualTo(12);

        verify(executor).execute(argThat((ExecutionRequest r) ->
                        r.functionId().equals("fn-1")
                                && new String(r.input(), StandardCharsets.UTF_8).equals("hello")
                                && Duration.ofSeconds(2).equals(r.timeout())),
                any(CancellationSignal.class));
    }

    @Test
    void invoke_failure_mapsErrorKindToStatus() {
        registered("fn-1");
        when(executor.execute(any(ExecutionRequest.class), any(CancellationSignal.class)))
                .thenReturn(ExecutionResult.failed("fn-1",
                        CloutException.functionExecutionFailed("echo", "code", "timed out", null), Duration.ZERO));

        webClient.post()
                .uri("/api/functions/fn-1:invoke")
                .exchange()
                .expectStatus().isEqualTo(502)
                .expectBody()
                .jsonPath("$.outcome").isEqualTo("FAILED")
                .jsonPath("$.error").isEqualTo("FUNCTION_EXECUTION_FAILED")
                .jsonPath("$.message").isEqualTo("timed out");
    }

    @Test
    void invoke_unknownFunction_returns404() {
        when(functionService.get("missing")).thenReturn(Optional.empty());

        webClient.post()
                .uri("/api/functions/missing:invoke")
                .exchange()
                .expectStatus().isNotFound();

        verify(executor, never()).execute(any(ExecutionRequest.class), any(CancellationSignal.class));
    }
}
