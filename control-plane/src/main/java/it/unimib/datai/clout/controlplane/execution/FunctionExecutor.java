package it.unimib.datai.clout.controlplane.execution;

import io.micrometer.core.instrument.Gauge;
import it.unimib.datai.clout.common.CancellationSignal;
import it.unimib.datai.clout.common.CloutException;
import it.unimib.datai.clout.common.model.ExecutionOutcome;
import it.unimib.datai.clout.common.model.ExecutionRequest;
import it.unimib.datai.clout.common.model.ExecutionResult;
import it.unimib.datai.clout.common.model.FunctionRegistration;
import it.unimib.datai.clout.common.model.RuntimeKind;
import it.unimib.datai.clout.controlplane.blob.BlobStore;
import it.unimib.datai.clout.controlplane.blob.StoredBlob;
import it.unimib.datai.clout.controlplane.config.ExecutionProperties;
import it.unimib.datai.clout.controlplane.registry.FunctionRegistry;
import it.unimib.datai.clout.controlplane.service.Metrics;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs registered functions under the process-wide concurrency cap and a hard timeout.
 *
 * <p>Each execution gets its own workspace for the materialized code and process output.
 * On timeout or cancellation the invocation thread is interrupted and child processes are
 * destroyed. The slot and the workspace are released when the invocation actually ends, never
 * while its code may still be running.</p>
 */
@Service
public class FunctionExecutor {
    private static final Logger log = LoggerFactory.getLogger(FunctionExecutor.class);
    private static final Duration RELEASE_GRACE = Duration.ofSeconds(2);

    private final FunctionRegistry registry;
    private final BlobStore blobStore;
    private final Map<RuntimeKind, FunctionInvoker> invokers = new EnumMap<>(RuntimeKind.class);
    private final ExecutionProperties properties;
    private final Metrics metrics;
    private final ExecutionGate gate;
    private final ExecutorService invocationPool;

    public FunctionExecutor(FunctionRegistry registry,
                            BlobStore blobStore,
                            List<FunctionInvoker> invokers,
                            ExecutionProperties properties,
                            Metrics metrics) {
        this.registry = registry;
        this.blobStore = blobStore;
        invokers.forEach(invoker -> this.invokers.put(invoker.runtime(), invoker));
        this.properties = properties;
        this.metrics = metrics;
        this.gate = new ExecutionGate(properties.effectiveConcurrency());
        AtomicInteger threadIds = new AtomicInteger();
        this.invocationPool = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "clout-function-" + threadIds.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        Gauge.builder("function_executions_in_flight", gate, ExecutionGate::inFlight)
                .register(metrics.registry());
        log.info("Function executor ready (concurrency={}, timeout={})",
                gate.capacity(), properties.timeout());
    }

    public ExecutionResult execute(String functionId, byte[] input, CancellationSignal cancellation) {
        return execute(ExecutionRequest.of(functionId, input), cancellation);
    }

    public ExecutionResult execute(ExecutionRequest request, CancellationSignal cancellation) {
        CancellationSignal signal = cancellation == null ? CancellationSignal.none() : cancellation;
        long started = System.nanoTime();
        FunctionRegistration function = registry.get(request.functionId()).orElse(null);
        if (function == null) {
            return ExecutionResult.failed(request.functionId(),
                    CloutException.validation("functionId", "Function '" + request.functionId() + "' is not registered"),
                    elapsed(started));
        }
        if (!function.verified()) {
            return record(function, ExecutionResult.failed(function.id(),
                    CloutException.functionExecutionFailed(function.name(), function.sourceBlobId(),
                            "Function '" + function.name() + "' is not verified", null),
                    elapsed(started)));
        }
        FunctionInvoker invoker = invokers.get(function.runtime());
        if (invoker == null) {
            return record(function, ExecutionResult.failed(function.id(),
                    CloutException.functionExecutionFailed(function.name(), function.sourceBlobId(),
                            "No invoker for runtime " + function.runtime(), null),
                    elapsed(started)));
        }
        Duration timeout = request.timeout() != null ? request.timeout() : properties.timeout();

        ExecutionGate.Permit permit = acquireSlot(signal);
        if (permit == null) {
            return record(function, ExecutionResult.cancelled(function.id(), elapsed(started)));
        }

        FunctionWorkspace workspace = null;
        try {
            StoredBlob code = blobStore.get(function.sourceBlobId());
            workspace = FunctionWorkspace.open(properties.tempDirectoryPath(), function.name());
            Path codePath = workspace.write(code.content(), invoker.codeFileSuffix());
            return record(function, invoke(function, invoker, codePath, request.input(), workspace, permit,
                    timeout, signal, started));
        } catch (CloutException e) {
            release(workspace, permit);
            return record(function, ExecutionResult.failed(function.id(), e, elapsed(started)));
        } catch (IOException e) {
            release(workspace, permit);
            return record(function, ExecutionResult.failed(function.id(),
                    CloutException.functionExecutionFailed(function.name(), function.sourceBlobId(),
                            "Failed to prepare workspace for '" + function.name() + "'", e),
                    elapsed(started)));
        }
    }

    /**
     * Checks that the source blob exists and the entrypoint resolves for the runtime.
     */
    public Verification verify(String sourceBlobId, RuntimeKind runtime, String entrypoint, String declaringType) {
        FunctionInvoker invoker = invokers.get(runtime);
        if (invoker == null) {
            return Verification.failed("No invoker for runtime " + runtime);
        }
        StoredBlob code;
        try {
            code = blobStore.get(sourceBlobId);
        } catch (CloutException e) {
            return Verification.failed(e.getMessage());
        }
        try (FunctionWorkspace workspace = FunctionWorkspace.open(properties.tempDirectoryPath(), "verify")) {
            return invoker.verify(workspace.write(code.content(), invoker.codeFileSuffix()), entrypoint, declaringType);
        } catch (IOException e) {
            return Verification.failed("Failed to materialize code: " + e.getMessage());
        }
    }

    public int capacity() {
        return gate.capacity();
    }

    public int inFlight() {
        return gate.inFlight();
    }

    @PreDestroy
    public void shutdown() {
        invocationPool.shutdownNow();
    }

    /**
     * Runs the invocation on the pool. From submission on, the invocation task owns the slot and
     * the workspace and releases both when it ends, so a function that outlives its timeout keeps
     * counting against the cap and keeps its files.
     */
    private ExecutionResult invoke(FunctionRegistration function,
                                   FunctionInvoker invoker,
                                   Path codePath,
                                   byte[] input,
                                   FunctionWorkspace workspace,
                                   ExecutionGate.Permit permit,
                                   Duration timeout,
                                   CancellationSignal signal,
                                   long started) {
        AtomicBoolean claimed = new AtomicBoolean(false);
        CountDownLatch finished = new CountDownLatch(1);
        Future<String> future;
        try {
            future = invocationPool.submit(() -> {
                if (!claimed.compareAndSet(false, true)) {
                    throw new CancellationException("Abandoned before start");
                }
                try {
                    return invoker.invoke(function, codePath, input, workspace);
                } finally {
                    release(workspace, permit);
                    finished.countDown();
                }
            });
        } catch (RejectedExecutionException e) {
            release(workspace, permit);
            return ExecutionResult.failed(function.id(),
                    CloutException.functionExecutionFailed(function.name(), function.sourceBlobId(),
                            "Executor is shut down", e),
                    elapsed(started));
        }

        try (CancellationSignal.Registration ignored = signal.onCancel(() -> abandon(future, workspace))) {
            String output = future.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
            return ExecutionResult.succeeded(function.id(), output, elapsed(started));
        } catch (CancellationException e) {
            awaitRelease(function, workspace, permit, claimed, finished);
            return ExecutionResult.cancelled(function.id(), elapsed(started));
        } catch (TimeoutException e) {
            abandon(future, workspace);
            awaitRelease(function, workspace, permit, claimed, finished);
            metrics.timeout(function.name());
            return ExecutionResult.failed(function.id(),
                    CloutException.functionExecutionFailed(function.name(), function.sourceBlobId(),
                            "Function '" + function.name() + "' timed out after " + timeout.toMillis() + " ms", e),
                    elapsed(started));
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            return ExecutionResult.failed(function.id(),
                    CloutException.functionExecutionFailed(function.name(), function.sourceBlobId(),
                            "Function '" + function.name() + "' failed: " + cause.getMessage(), cause),
                    elapsed(started));
        } catch (InterruptedException e) {
            abandon(future, workspace);
            awaitRelease(function, workspace, permit, claimed, finished);
            Thread.currentThread().interrupt();
            return ExecutionResult.cancelled(function.id(), elapsed(started));
        }
    }

    private static void abandon(Future<String> future, FunctionWorkspace workspace) {
        future.cancel(true);
        workspace.destroyProcesses();
    }

    private ExecutionGate.Permit acquireSlot(CancellationSignal signal) {
        try {
            return gate.acquire(signal);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return null;
        }
    }

    /**
     * Waits briefly for an abandoned invocation to release its slot. A task that never started
     * is released here; one that ignores interruption keeps its slot until it returns.
     */
    private void awaitRelease(FunctionRegistration function,
                              FunctionWorkspace workspace,
                              ExecutionGate.Permit permit,
                              AtomicBoolean claimed,
                              CountDownLatch finished) {
        if (claimed.compareAndSet(false, true)) {
            release(workspace, permit);
            return;
        }
        try {
            if (!finished.await(RELEASE_GRACE.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Function {} ignored interruption; its slot stays taken until it returns",
                        function.name());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void release(FunctionWorkspace workspace, ExecutionGate.Permit permit) {
        if (workspace != null) {
            workspace.close();
        }
        permit.close();
    }

    private ExecutionResult record(FunctionRegistration function, ExecutionResult result) {
        metrics.execution(function.name(), result.outcome());
        metrics.latency(function.name()).record(result.duration());
        if (result.outcome() == ExecutionOutcome.FAILED) {
            log.error("Function {} ({}) failed: {}", function.name(), function.id(), result.error().getMessage());
        } else if (result.outcome() == ExecutionOutcome.CANCELLED) {
            log.info("Function {} ({}) cancelled after {} ms", function.name(), function.id(),
                    result.duration().toMillis());
        } else {
            log.debug("Function {} ({}) succeeded in {} ms", function.name(), function.id(),
                    result.duration().toMillis());
        }
        return result;
    }

    private static Duration elapsed(long startedNanos) {
        return Duration.ofNanos(System.nanoTime() - startedNanos);
    }
}
