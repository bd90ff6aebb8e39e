package it.unimib.datai.clout.controlplane.schedule;

import it.unimib.datai.clout.common.CancellationSignal;
import it.unimib.datai.clout.common.CloutException;
import it.unimib.datai.clout.common.model.ExecutionResult;
import it.unimib.datai.clout.common.model.FunctionRegistration;
import it.unimib.datai.clout.controlplane.config.ScheduleProperties;
import it.unimib.datai.clout.controlplane.execution.FunctionExecutor;
import it.unimib.datai.clout.controlplane.registry.FunctionRegistrationListener;
import it.unimib.datai.clout.controlplane.registry.FunctionRegistry;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.support.CronTrigger;
import org.springframework.stereotype.Component;

import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * One cron timer per scheduled function. The next fire time is always computed from the
 * current time, so fires missed while the process was down are not replayed.
 *
 * <p>Timer threads only hand runs off to a separate pool, so long-running functions never hold
 * up the timers of others; the executor's concurrency cap is the only limit on how many run at
 * once. A fire is skipped while the previous run of the same function is still executing.</p>
 */
@Component
public class ScheduleEngine implements SmartLifecycle, FunctionRegistrationListener {
    private static final Logger log = LoggerFactory.getLogger(ScheduleEngine.class);
    private static final byte[] TIMER_INPUT = new byte[0];

    private final TaskScheduler taskScheduler;
    private final FunctionExecutor executor;
    private final FunctionRegistry registry;
    private final ScheduleProperties properties;
    private final ZoneId zone;
    private final Map<String, ScheduledFunction> schedules = new ConcurrentHashMap<>();
    private final Set<String> activeRuns = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicInteger threadIds = new AtomicInteger();
    private final ExecutorService runThreads = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "clout-timer-run-" + threadIds.incrementAndGet());
        t.setDaemon(true);
        return t;
    });
    private volatile CancellationSignal shutdownSignal = new CancellationSignal();

    public ScheduleEngine(@Qualifier("cloutTaskScheduler") TaskScheduler taskScheduler,
                          FunctionExecutor executor,
                          FunctionRegistry registry,
                          ScheduleProperties properties) {
        this.taskScheduler = taskScheduler;
        this.executor = executor;
        this.registry = registry;
        this.properties = properties;
        this.zone = properties.zoneId();
    }

    /**
     * Installs or replaces the timer of a function and returns the normalized expression.
     * An invalid expression leaves the existing timer untouched.
     */
    public String setSchedule(String functionId, String cronExpression) {
        String normalized = CronExpressions.normalize(cronExpression);
        schedules.compute(functionId, (id, existing) -> {
            if (existing != null) {
                existing.future().cancel(false);
            }
            ScheduledFuture<?> future = taskScheduler.schedule(() -> fire(id), new CronTrigger(normalized, zone));
            if (future == null) {
                log.warn("Cron expression '{}' of function {} never fires", normalized, id);
                return null;
            }
            return new ScheduledFunction(normalized, future);
        });
        log.info("Scheduled function {} with '{}'", functionId, normalized);
        return normalized;
    }

    public boolean clearSchedule(String functionId) {
        ScheduledFunction removed = schedules.remove(functionId);
        if (removed == null) {
            return false;
        }
        removed.future().cancel(false);
        log.info("Cleared schedule of function {}", functionId);
        return true;
    }

    public Optional<String> schedule(String functionId) {
        return Optional.ofNullable(schedules.get(functionId)).map(ScheduledFunction::cronExpression);
    }

    public Set<String> scheduledFunctionIds() {
        return new TreeSet<>(schedules.keySet());
    }

    public List<ZonedDateTime> nextFireTimes(String cronExpression, int count) {
        return CronExpressions.nextFireTimes(cronExpression, zone, count);
    }

    @Override
    public void onRegister(FunctionRegistration registration) {
        if (registration.cronExpression() != null) {
            setSchedule(registration.id(), registration.cronExpression());
        }
    }

    @Override
    public void onTriggerChanged(FunctionRegistration registration) {
        if (registration.cronExpression() != null) {
            setSchedule(registration.id(), registration.cronExpression());
        } else {
            clearSchedule(registration.id());
        }
    }

    @Override
    public void onRemove(String functionId) {
        clearSchedule(functionId);
    }

    @Override
    public void start() {
        if (running.compareAndSet(false, true)) {
            shutdownSignal = new CancellationSignal();
            if (properties.restoreOnStartup()) {
                restore();
            }
            log.info("Schedule engine started with {} timers", schedules.size());
        }
    }

    @Override
    public void stop() {
        if (running.compareAndSet(true, false)) {
            shutdownSignal.cancel();
            schedules.values().forEach(scheduled -> scheduled.future().cancel(false));
            schedules.clear();
            log.info("Schedule engine stopped");
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @PreDestroy
    public void shutdown() {
        runThreads.shutdownNow();
    }

    /**
     * Whether a timer-triggered run of the function is executing right now.
     */
    public boolean isRunActive(String functionId) {
        return activeRuns.contains(functionId);
    }

    void fire(String functionId) {
        if (!activeRuns.add(functionId)) {
            log.debug("Skipping timer of function {}: previous run still active", functionId);
            return;
        }
        try {
            runThreads.execute(() -> run(functionId));
        } catch (RejectedExecutionException e) {
            activeRuns.remove(functionId);
            log.warn("Timer of function {} fired after shutdown", functionId);
        }
    }

    private void run(String functionId) {
        try {
            log.debug("Timer fired for function {}", functionId);
            ExecutionResult result = executor.execute(functionId, TIMER_INPUT, shutdownSignal);
            if (!result.isSuccess()) {
                log.debug("Timer execution of {} ended with {}", functionId, result.outcome());
            }
        } catch (RuntimeException e) {
            log.error("Timer execution of function {} failed unexpectedly", functionId, e);
        } finally {
            activeRuns.remove(functionId);
        }
    }

    private void restore() {
        for (FunctionRegistration registration : registry.list()) {
            if (registration.cronExpression() == null) {
                continue;
            }
            try {
                setSchedule(registration.id(), registration.cronExpression());
            } catch (CloutException e) {
                log.warn("Ignoring invalid persisted schedule of function {}: {}", registration.id(), e.getMessage());
            }
        }
    }

    private record ScheduledFunction(String cronExpression, ScheduledFuture<?> future) {
    }
}
