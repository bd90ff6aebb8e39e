package it.unimib.datai.clout.controlplane.registry;

import it.unimib.datai.clout.common.CloutException;
import it.unimib.datai.clout.common.Names;
import it.unimib.datai.clout.common.model.FunctionRegistration;
import it.unimib.datai.clout.common.model.RuntimeKind;
import it.unimib.datai.clout.common.model.TriggerBinding;
import it.unimib.datai.clout.controlplane.blob.BlobInfo;
import it.unimib.datai.clout.controlplane.blob.BlobStore;
import it.unimib.datai.clout.controlplane.execution.FunctionExecutor;
import it.unimib.datai.clout.controlplane.execution.Verification;
import it.unimib.datai.clout.controlplane.schedule.CronExpressions;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Registration API. Every registration is persisted as a metadata-only blob whose id becomes
 * the function id; trigger changes rewrite that blob's metadata before listeners are notified.
 */
@Service
public class FunctionService {
    private static final Logger log = LoggerFactory.getLogger(FunctionService.class);

    static final String REGISTRATION_CONTENT_TYPE = "application/vnd.clout.function";

    private final FunctionRegistry registry;
    private final BlobStore blobStore;
    private final FunctionExecutor executor;
    private final List<FunctionRegistrationListener> listeners;
    private final ConcurrentHashMap<String, LockEntry> functionLocks = new ConcurrentHashMap<>();

    @Autowired
    public FunctionService(FunctionRegistry registry,
                           BlobStore blobStore,
                           FunctionExecutor executor,
                           @Autowired(required = false) List<FunctionRegistrationListener> listeners) {
        this.registry = registry;
        this.blobStore = blobStore;
        this.executor = executor;
        this.listeners = listeners == null ? List.of() : listeners;
    }

    /**
     * Loads persisted registrations into the registry.
     */
    @PostConstruct
    public void reload() {
        int loaded = 0;
        for (BlobInfo info : blobStore.list()) {
            Optional<FunctionRegistration> registration = FunctionMetadataCodec.fromBlob(info);
            if (registration.isPresent()) {
                registry.put(registration.get());
                loaded++;
            }
        }
        log.info("Loaded {} function registrations", loaded);
    }

    public Collection<FunctionRegistration> list() {
        return registry.list();
    }

    public Optional<FunctionRegistration> get(String id) {
        return registry.get(id);
    }

    public FunctionRegistration register(String blobId, String name, String runtime,
                                         String entrypoint, String declaringType) {
        return register(RegistrationRequest.of(blobId, name, runtime, entrypoint, declaringType));
    }

    public FunctionRegistration register(RegistrationRequest request) {
        Draft draft = prepare(request);
        if (!draft.verification().resolved()) {
            log.warn("Function {} registered without verification: {}", request.name(),
                    draft.verification().reason());
        }
        return persist(draft.registration());
    }

    /**
     * Registers one function per distinct entrypoint of a single source blob. Every entrypoint
     * must resolve; if any does not, nothing is registered.
     */
    public List<FunctionRegistration> registerMany(BatchRegistrationRequest request) {
        if (!Names.isValidIdentifier(request.blobId())) {
            throw CloutException.validation("blobId", "Source blob id is required");
        }
        Map<String, String> distinct = new LinkedHashMap<>();
        for (String entrypoint : request.entrypoints()) {
            if (!isBlank(entrypoint)) {
                distinct.putIfAbsent(entrypoint.trim().toLowerCase(Locale.ROOT), entrypoint.trim());
            }
        }
        if (distinct.isEmpty()) {
            throw CloutException.validation("entrypoints", "At least one entrypoint is required");
        }
        if (blobStore.info(request.blobId()).isEmpty()) {
            throw CloutException.blobNotFound(request.blobId());
        }
        String runtime = isBlank(request.runtime()) ? RuntimeKind.JVM.tag() : request.runtime();

        List<Draft> drafts = new ArrayList<>();
        Map<String, List<String>> errors = new LinkedHashMap<>();
        for (String entrypoint : distinct.values()) {
            Draft draft = prepare(new RegistrationRequest(request.blobId(), entrypoint, runtime, entrypoint,
                    request.declaringType(), request.cronExpression(), null));
            if (!draft.verification().resolved()) {
                addError(errors, "entrypoints", "Entrypoint '" + entrypoint + "' does not resolve: "
                        + draft.verification().reason());
            }
            drafts.add(draft);
        }
        if (!errors.isEmpty()) {
            throw CloutException.validation(errors);
        }

        List<FunctionRegistration> registered = new ArrayList<>(drafts.size());
        for (Draft draft : drafts) {
            registered.add(persist(draft.registration()));
        }
        log.info("Registered {} functions from blob {}", registered.size(), request.blobId());
        return registered;
    }

    /**
     * Sets the same timer on every function registered from {@code sourceId}.
     *
     * @return how many functions were scheduled
     */
    public int scheduleAll(String sourceId, String cronExpression) {
        requireSourceId(sourceId);
        CronExpressions.normalize(cronExpression);
        TriggerBinding timer = TriggerBinding.timer(cronExpression.trim());
        int count = 0;
        for (String id : functionIdsFromSource(sourceId)) {
            boolean updated = withFunctionLock(id, () -> {
                if (registry.get(id).isEmpty()) {
                    return false;
                }
                updateTrigger(id, timer);
                return true;
            });
            if (updated) {
                count++;
            }
        }
        log.info("Scheduled {} functions from source {} with '{}'", count, sourceId, timer.value());
        return count;
    }

    /**
     * Clears the timer of every function registered from {@code sourceId}.
     *
     * @return how many functions reference the source
     */
    public int unscheduleAll(String sourceId) {
        requireSourceId(sourceId);
        int count = 0;
        for (String id : functionIdsFromSource(sourceId)) {
            boolean present = withFunctionLock(id, () -> {
                Optional<FunctionRegistration> current = registry.get(id);
                if (current.isEmpty()) {
                    return false;
                }
                if (current.get().cronExpression() != null) {
                    updateTrigger(id, null);
                }
                return true;
            });
            if (present) {
                count++;
            }
        }
        log.info("Unscheduled {} functions from source {}", count, sourceId);
        return count;
    }

    private Draft prepare(RegistrationRequest request) {
        Map<String, List<String>> errors = new LinkedHashMap<>();
        if (!Names.isValidIdentifier(request.name())) {
            addError(errors, "name", "Function name is required (at most " + Names.MAX_LENGTH + " characters)");
        }
        if (!Names.isValidIdentifier(request.blobId())) {
            addError(errors, "blobId", "Source blob id is required");
        }
        Optional<RuntimeKind> runtime = RuntimeKind.fromTag(request.runtime());
        if (runtime.isEmpty()) {
            addError(errors, "runtime", "Unknown runtime '" + request.runtime() + "'; expected java, script or native");
        }
        if (runtime.orElse(null) != RuntimeKind.NATIVE && isBlank(request.entrypoint())) {
            addError(errors, "entrypoint", "Entrypoint is required");
        }
        TriggerBinding trigger = null;
        if (!isBlank(request.cronExpression()) && !isBlank(request.queueName())) {
            addError(errors, "trigger", "A function has either a timer or a queue trigger, not both");
        } else if (!isBlank(request.cronExpression())) {
            try {
                CronExpressions.normalize(request.cronExpression());
                trigger = TriggerBinding.timer(request.cronExpression().trim());
            } catch (CloutException e) {
                e.fieldErrors().forEach((field, messages) -> messages.forEach(m -> addError(errors, field, m)));
            }
        } else if (!isBlank(request.queueName())) {
            if (Names.isValidQueueName(request.queueName())) {
                trigger = TriggerBinding.queue(request.queueName());
            } else {
                addError(errors, "queueName", "Invalid queue name '" + request.queueName() + "'");
            }
        }
        if (!errors.isEmpty()) {
            throw CloutException.validation(errors);
        }

        RuntimeKind kind = runtime.get();
        String entrypoint = isBlank(request.entrypoint()) ? null : request.entrypoint().trim();
        String declaringType = isBlank(request.declaringType()) ? null : request.declaringType().trim();
        Verification verification = executor.verify(request.blobId(), kind, entrypoint, declaringType);
        if (verification.resolved() && verification.declaringType() != null) {
            declaringType = verification.declaringType();
        }
        return new Draft(new FunctionRegistration(null, request.name(), kind, entrypoint,
                declaringType, verification.resolved(), request.blobId(), trigger, null), verification);
    }

    private FunctionRegistration persist(FunctionRegistration draft) {
        BlobInfo info = blobStore.put(draft.name() + ".function", new byte[0], REGISTRATION_CONTENT_TYPE,
                FunctionMetadataCodec.toMetadata(draft));
        FunctionRegistration registered = new FunctionRegistration(info.id(), draft.name(), draft.runtime(),
                draft.entrypoint(), draft.declaringType(), draft.verified(), draft.sourceBlobId(),
                draft.trigger(), info.createdAt());

        return withFunctionLock(registered.id(), () -> {
            registry.put(registered);
            log.info("Registered function {} as {} (runtime={}, verified={})",
                    registered.name(), registered.id(), registered.runtime(), registered.verified());
            listeners.forEach(l -> l.onRegister(registered));
            return registered;
        });
    }

    /**
     * Binds a timer trigger, replacing any existing trigger. The expression is validated
     * before anything is stored.
     */
    public FunctionRegistration setSchedule(String id, String cronExpression) {
        CronExpressions.normalize(cronExpression);
        return withFunctionLock(id, () -> updateTrigger(id, TriggerBinding.timer(cronExpression.trim())));
    }

    public FunctionRegistration clearSchedule(String id) {
        return withFunctionLock(id, () -> {
            FunctionRegistration current = require(id);
            return current.cronExpression() == null ? current : updateTrigger(id, null);
        });
    }

    /**
     * Binds a queue trigger, replacing any existing trigger.
     */
    public FunctionRegistration bindQueue(String id, String queueName) {
        Names.requireQueueName(queueName);
        return withFunctionLock(id, () -> updateTrigger(id, TriggerBinding.queue(queueName)));
    }

    public FunctionRegistration unbindQueue(String id) {
        return withFunctionLock(id, () -> {
            FunctionRegistration current = require(id);
            return current.queueName() == null ? current : updateTrigger(id, null);
        });
    }

    public Optional<FunctionRegistration> remove(String id) {
        return withFunctionLock(id, () -> {
            FunctionRegistration removed = registry.remove(id);
            if (removed == null) {
                return Optional.empty();
            }
            listeners.forEach(l -> l.onRemove(id));
            blobStore.delete(id);
            log.info("Removed function {} ({})", removed.name(), id);
            return Optional.of(removed);
        });
    }

    private FunctionRegistration updateTrigger(String id, TriggerBinding trigger) {
        FunctionRegistration updated = require(id).withTrigger(trigger);
        blobStore.setMetadata(id, FunctionMetadataCodec.toMetadata(updated));
        registry.put(updated);
        listeners.forEach(l -> l.onTriggerChanged(updated));
        return updated;
    }

    private List<String> functionIdsFromSource(String sourceId) {
        return registry.list().stream()
                .filter(registration -> sourceId.equalsIgnoreCase(registration.sourceBlobId()))
                .map(FunctionRegistration::id)
                .toList();
    }

    private static void requireSourceId(String sourceId) {
        if (isBlank(sourceId)) {
            throw CloutException.validation("sourceId", "Source blob id is required");
        }
    }

    private FunctionRegistration require(String id) {
        return registry.get(id).orElseThrow(() -> CloutException.blobNotFound(id));
    }

    private static void addError(Map<String, List<String>> errors, String field, String message) {
        errors.computeIfAbsent(field, ignored -> new ArrayList<>()).add(message);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private <T> T withFunctionLock(String functionId, Supplier<T> action) {
        LockEntry lockEntry = acquireLockEntry(functionId);
        lockEntry.lock.lock();
        try {
            return action.get();
        } finally {
            lockEntry.lock.unlock();
            releaseLockEntry(functionId, lockEntry);
        }
    }

    private LockEntry acquireLockEntry(String functionId) {
        return functionLocks.compute(functionId, (ignored, existing) -> {
            LockEntry entry = existing == null ? new LockEntry() : existing;
            entry.users++;
            return entry;
        });
    }

    private void releaseLockEntry(String functionId, LockEntry lockEntry) {
        functionLocks.computeIfPresent(functionId, (ignored, existing) -> {
            if (existing != lockEntry) {
                return existing;
            }
            existing.users--;
            return existing.users == 0 ? null : existing;
        });
    }

    private record Draft(FunctionRegistration registration, Verification verification) {
    }

    private static final class LockEntry {
        private final ReentrantLock lock = new ReentrantLock();
        private int users;
    }
}
