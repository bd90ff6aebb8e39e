package it.unimib.datai.clout.controlplane.trigger;

import it.unimib.datai.clout.common.CloutException;
import it.unimib.datai.clout.common.Names;
import it.unimib.datai.clout.common.model.ExecutionOutcome;
import it.unimib.datai.clout.common.model.ExecutionResult;
import it.unimib.datai.clout.common.model.FunctionRegistration;
import it.unimib.datai.clout.common.model.QueueMessage;
import it.unimib.datai.clout.controlplane.config.TriggerProperties;
import it.unimib.datai.clout.controlplane.execution.FunctionExecutor;
import it.unimib.datai.clout.controlplane.queue.QueueServer;
import it.unimib.datai.clout.controlplane.registry.FunctionRegistrationListener;
import it.unimib.datai.clout.controlplane.registry.FunctionRegistry;
import it.unimib.datai.clout.controlplane.service.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runs one long-lived worker per queue-bound function. A worker dequeues with a bounded poll,
 * executes each message, and retries failed executions of the same message with exponential
 * backoff before moving on.
 *
 * <p>Activation, deactivation and shutdown are serialized by a single mutex, which keeps at
 * most one worker per function id.</p>
 */
@Component
public class QueueTriggerDispatcher implements SmartLifecycle, FunctionRegistrationListener {
    private static final Logger log = LoggerFactory.getLogger(QueueTriggerDispatcher.class);

    private final QueueServer queueServer;
    private final FunctionExecutor executor;
    private final FunctionRegistry registry;
    private final TriggerProperties properties;
    private final BackoffCalculator backoff;
    private final Metrics metrics;
    private final Map<String, QueueWorker> workers = new ConcurrentHashMap<>();
    private final ReentrantLock mutex = new ReentrantLock();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicInteger threadIds = new AtomicInteger();
    private final ExecutorService workerThreads = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "clout-queue-worker-" + threadIds.incrementAndGet());
        t.setDaemon(true);
        return t;
    });

    public QueueTriggerDispatcher(QueueServer queueServer,
                                  FunctionExecutor executor,
                                  FunctionRegistry registry,
                                  TriggerProperties properties,
                                  Metrics metrics) {
        this.queueServer = queueServer;
        this.executor = executor;
        this.registry = registry;
        this.properties = properties;
        this.metrics = metrics;
        this.backoff = new BackoffCalculator(properties.initialBackoff(), properties.maxBackoff(),
                properties.jitterFactor());
    }

    /**
     * Starts a worker feeding {@code queueName} into the function.
     *
     * @return {@code true} if a worker was started, {@code false} if one was already bound to the same queue
     * @throws CloutException QUEUE_OPERATION_FAILED if the function is bound to another queue
     */
    public boolean activate(String functionId, String queueName) {
        Names.requireQueueName(queueName);
        mutex.lock();
        try {
            QueueWorker existing = workers.get(functionId);
            if (existing != null && existing.state() != WorkerState.STOPPED) {
                if (existing.isStopRequested()) {
                    throw CloutException.queueOperationFailed(existing.queueName(),
                            "Worker of function '" + functionId + "' is still draining");
                }
                if (existing.queueName().equals(queueName)) {
                    return false;
                }
                throw CloutException.queueOperationFailed(queueName,
                        "Function '" + functionId + "' is already bound to queue '" + existing.queueName() + "'");
            }

            queueServer.createQueue(queueName);
            QueueWorker worker = new QueueWorker(functionId, queueName);
            workers.put(functionId, worker);
            try {
                workerThreads.execute(() -> runWorker(worker));
            } catch (RejectedExecutionException e) {
                workers.remove(functionId, worker);
                throw CloutException.queueOperationFailed(queueName, "Dispatcher is shut down", e);
            }
            log.info("Activated worker for function {} on queue {}", functionId, queueName);
            return true;
        } finally {
            mutex.unlock();
        }
    }

    /**
     * Stops the worker of a function, letting an in-flight execution finish within the drain timeout.
     *
     * @return {@code true} if no worker remains, {@code false} if it failed to drain in time
     */
    public boolean deactivate(String functionId) {
        mutex.lock();
        try {
            QueueWorker worker = workers.get(functionId);
            if (worker == null) {
                return true;
            }
            worker.requestStop();
            boolean stopped;
            try {
                stopped = worker.awaitStopped(properties.drainTimeout());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                stopped = false;
            }
            if (stopped) {
                workers.remove(functionId, worker);
                log.info("Deactivated worker for function {} on queue {}", functionId, worker.queueName());
            } else {
                log.warn("Worker for function {} did not drain within {}", functionId, properties.drainTimeout());
            }
            return stopped;
        } finally {
            mutex.unlock();
        }
    }

    /**
     * Stops every worker, waiting at most the drain timeout overall. Workers that do not stop
     * in time have their executions cancelled.
     *
     * @return ids of the functions whose workers failed to stop in time
     */
    public List<String> shutdown() {
        mutex.lock();
        try {
            List<QueueWorker> all = new ArrayList<>(workers.values());
            all.forEach(QueueWorker::requestStop);
            long deadline = System.nanoTime() + properties.drainTimeout().toNanos();
            List<String> failed = new ArrayList<>();
            for (QueueWorker worker : all) {
                boolean stopped;
                try {
                    stopped = worker.awaitStopped(Duration.ofNanos(Math.max(0, deadline - System.nanoTime())));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    stopped = false;
                }
                if (!stopped) {
                    failed.add(worker.functionId());
                    worker.kill();
                }
            }
            workers.clear();
            if (failed.isEmpty()) {
                log.info("All {} queue workers stopped", all.size());
            } else {
                log.warn("Queue workers failed to stop in time: {}", failed);
            }
            return failed;
        } finally {
            mutex.unlock();
        }
    }

    public Optional<WorkerState> state(String functionId) {
        return Optional.ofNullable(workers.get(functionId)).map(QueueWorker::state);
    }

    /**
     * Function id to queue name, for workers that are not stopped.
     */
    public Map<String, String> activeBindings() {
        Map<String, String> bindings = new TreeMap<>();
        workers.values().stream()
                .filter(worker -> worker.state() != WorkerState.STOPPED)
                .forEach(worker -> bindings.put(worker.functionId(), worker.queueName()));
        return bindings;
    }

    @Override
    public void onRegister(FunctionRegistration registration) {
        if (registration.queueName() != null) {
            activate(registration.id(), registration.queueName());
        }
    }

    @Override
    public void onTriggerChanged(FunctionRegistration registration) {
        String queueName = registration.queueName();
        QueueWorker current = workers.get(registration.id());
        if (current != null && (queueName == null || !current.queueName().equals(queueName))) {
            deactivate(registration.id());
        }
        if (queueName != null) {
            activate(registration.id(), queueName);
        }
    }

    @Override
    public void onRemove(String functionId) {
        deactivate(functionId);
    }

    @Override
    public void start() {
        if (running.compareAndSet(false, true)) {
            if (properties.restoreOnStartup()) {
                restore();
            }
            log.info("Queue trigger dispatcher started with {} workers", activeBindings().size());
        }
    }

    @Override
    public void stop() {
        if (running.compareAndSet(true, false)) {
            shutdown();
            workerThreads.shutdown();
            try {
                if (!workerThreads.awaitTermination(5, TimeUnit.SECONDS)) {
                    workerThreads.shutdownNow();
                }
            } catch (InterruptedException e) {
                workerThreads.shutdownNow();
                Thread.currentThread().interrupt();
            }
            log.info("Queue trigger dispatcher stopped");
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    private void restore() {
        for (FunctionRegistration registration : registry.list()) {
            if (registration.queueName() == null) {
                continue;
            }
            try {
                activate(registration.id(), registration.queueName());
            } catch (CloutException e) {
                log.warn("Could not restore queue binding of function {}: {}", registration.id(), e.getMessage());
            }
        }
    }

    private void runWorker(QueueWorker worker) {
        log.debug("Worker for function {} polling queue {}", worker.functionId(), worker.queueName());
        try {
            while (!worker.isStopRequested()) {
                worker.markIdle();
                Optional<QueueMessage> message;
                try {
                    message = queueServer.dequeue(worker.queueName(), properties.pollTimeout(), worker.stopSignal());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                } catch (RuntimeException e) {
                    log.error("Worker for function {} failed to dequeue from {}", worker.functionId(),
                            worker.queueName(), e);
                    if (pause(worker, properties.errorDelay())) {
                        break;
                    }
                    continue;
                }
                if (message.isEmpty()) {
                    continue;
                }
                worker.markRunning();
                process(worker, message.get());
            }
        } finally {
            worker.markStopped();
            log.debug("Worker for function {} stopped", worker.functionId());
        }
    }

    private void process(QueueWorker worker, QueueMessage message) {
        int maxAttempts = properties.maxAttempts();
        for (int attempt = 1; ; attempt++) {
            ExecutionResult result = executeOnce(worker, message);
            if (result.isSuccess()) {
                log.debug("Function {} processed message {} of queue {}", worker.functionId(), message.id(),
                        worker.queueName());
                return;
            }
            if (result.outcome() == ExecutionOutcome.CANCELLED) {
                log.info("Execution of message {} by function {} was cancelled", message.id(), worker.functionId());
                return;
            }
            if (attempt >= maxAttempts) {
                log.error("Giving up on message {} of queue {} after {} attempts", message.id(),
                        worker.queueName(), attempt);
                return;
            }
            if (worker.isStopRequested()) {
                log.warn("Not retrying message {} of queue {}: worker is stopping", message.id(), worker.queueName());
                return;
            }
            Duration delay = backoff.calculate(attempt);
            metrics.retry(worker.functionId());
            log.warn("Attempt {}/{} for message {} of queue {} failed, retrying in {} ms",
                    attempt, maxAttempts, message.id(), worker.queueName(), delay.toMillis());
            if (pause(worker, delay)) {
                return;
            }
        }
    }

    private ExecutionResult executeOnce(QueueWorker worker, QueueMessage message) {
        try {
            return executor.execute(worker.functionId(), message.payload(), worker.killSignal());
        } catch (RuntimeException e) {
            return ExecutionResult.failed(worker.functionId(),
                    CloutException.functionExecutionFailed(worker.functionId(), null,
                            "Unexpected failure executing message " + message.id(), e),
                    Duration.ZERO);
        }
    }

    /**
     * Waits for the delay; returns {@code true} if the worker should exit instead.
     */
    private static boolean pause(QueueWorker worker, Duration delay) {
        try {
            return worker.stopSignal().await(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return true;
        }
    }
}
