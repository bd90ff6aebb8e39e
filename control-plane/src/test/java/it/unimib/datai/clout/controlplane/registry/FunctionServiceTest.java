package it.unimib.datai.clout.controlplane.registry;

import com.fasterxml.jackson.databind.json.JsonMapper;
import it.unimib.datai.clout.common.CloutException;
import it.unimib.datai.clout.common.ErrorKind;
import it.unimib.datai.clout.common.model.FunctionRegistration;
import it.unimib.datai.clout.common.model.RuntimeKind;
import it.unimib.datai.clout.common.model.TriggerType;
import it.unimib.datai.clout.controlplane.blob.BlobInfo;
import it.unimib.datai.clout.controlplane.blob.FileBlobStore;
import it.unimib.datai.clout.controlplane.config.BlobStorageProperties;
import it.unimib.datai.clout.controlplane.execution.FunctionExecutor;
import it.unimib.datai.clout.controlplane.execution.Verification;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class FunctionServiceTest {

    @TempDir
    Path tempDir;

    private FileBlobStore blobStore;
    private final FunctionExecutor executor = mock(FunctionExecutor.class);
    private final RecordingListener listener = new RecordingListener();
    private FunctionService service;
    private String codeBlobId;

    @BeforeEach
    void setUp() {
        blobStore = new FileBlobStore(BlobStorageProperties.at(tempDir), JsonMapper.builder().findAndAddModules().build());
        codeBlobId = blobStore.put("fn.jar", new byte[]{1, 2, 3}, null, List.of()).id();
        when(executor.verify(anyString(), any(RuntimeKind.class), any(), any()))
                .thenReturn(Verification.ok("com.example.Handler"));
        service = newService(new FunctionRegistry());
    }

    private FunctionService newService(FunctionRegistry registry) {
        FunctionService created = new FunctionService(registry, blobStore, executor, List.of(listener));
        created.reload();
        return created;
    }

    @Test
    void register_persistsRegistration_andNotifiesListeners() {
        FunctionRegistration registered = service.register(codeBlobId, "handler", "java", "handle", null);

        assertThat(registered.id()).isNotEqualTo(codeBlobId);
        assertThat(registered.runtime()).isEqualTo(RuntimeKind.JVM);
        assertThat(registered.verified()).isTrue();
        assertThat(registered.declaringType()).isEqualTo("com.example.Handler");
        assertThat(registered.sourceBlobId()).isEqualTo(codeBlobId);
        assertThat(service.get(registered.id())).contains(registered);
        assertThat(listener.events).containsExactly("register:" + registered.id());

        BlobInfo stored = blobStore.info(registered.id()).orElseThrow();
        assertThat(stored.contentType()).isEqualTo(FunctionService.REGISTRATION_CONTENT_TYPE);
        assertThat(stored.size()).isZero();
    }

    @Test
    void reload_rebuildsRegistryFromBlobs() {
        FunctionRegistration timed = service.register(new RegistrationRequest(codeBlobId, "timed", "script", "sh",
                null, "0 * * * *", null));
        FunctionRegistration queued = service.register(new RegistrationRequest(codeBlobId, "queued", "native", null,
                null, null, "jobs"));

        FunctionService restarted = newService(new FunctionRegistry());

        assertThat(restarted.list()).extracting(FunctionRegistration::name).containsExactly("queued", "timed");
        FunctionRegistration reloadedTimed = restarted.get(timed.id()).orElseThrow();
        assertThat(reloadedTimed.cronExpression()).isEqualTo("0 * * * *");
        assertThat(reloadedTimed.entrypoint()).isEqualTo("sh");
        assertThat(restarted.get(queued.id()).orElseThrow().queueName()).isEqualTo("jobs");
        assertThat(restarted.get(queued.id()).orElseThrow().entrypoint()).isNull();
    }

    @Test
    void register_aggregatesValidationErrors() {
        assertThatThrownBy(() -> service.register(new RegistrationRequest("", " ", "cobol", "", null,
                "0 * * * *", "jobs")))
                .isInstanceOfSatisfying(CloutException.class, e -> {
                    assertThat(e.kind()).isEqualTo(ErrorKind.VALIDATION_FAILED);
                    assertThat(e.fieldErrors()).containsKeys("name", "blobId", "runtime", "entrypoint", "trigger");
                });
        assertThat(service.list()).isEmpty();
        verify(executor, never()).verify(anyString(), any(RuntimeKind.class), any(), any());
    }

    @Test
    void register_rejectsInvalidCron() {
        assertThatThrownBy(() -> service.register(new RegistrationRequest(codeBlobId, "fn", "java", "handle", null,
                "every minute", null)))
                .isInstanceOfSatisfying(CloutException.class, e -> assertThat(e.fieldErrors()).containsKey("cron"));
    }

    @Test
    void register_keepsUnverifiedFunctions() {
        when(executor.verify(eq(codeBlobId), eq(RuntimeKind.SCRIPT), eq("python3"), isNull()))
                .thenReturn(Verification.failed("empty"));

        FunctionRegistration registered = service.register(codeBlobId, "draft", "script", "python3", null);

        assertThat(registered.verified()).isFalse();
        assertThat(registered.declaringType()).isNull();
    }

    @Test
    void triggerUpdates_arePersisted_andReplaceEachOther() {
        FunctionRegistration registered = service.register(codeBlobId, "fn", "java", "handle", null);

        FunctionRegistration timed = service.setSchedule(registered.id(), "0 0 * * *");
        assertThat(timed.trigger().type()).isEqualTo(TriggerType.TIMER);

        FunctionRegistration queued = service.bindQueue(registered.id(), "orders");
        assertThat(queued.cronExpression()).isNull();
        assertThat(queued.queueName()).isEqualTo("orders");
        assertThat(newService(new FunctionRegistry()).get(registered.id()).orElseThrow().queueName())
                .isEqualTo("orders");

        assertThat(service.clearSchedule(registered.id()).queueName()).isEqualTo("orders");
        assertThat(service.unbindQueue(registered.id()).trigger()).isNull();
        assertThat(listener.events).containsExactly(
                "register:" + registered.id(),
                "trigger:" + registered.id(),
                "trigger:" + registered.id(),
                "trigger:" + registered.id());
    }

    @Test
    void triggerUpdates_validateInputAndExistence() {
        FunctionRegistration registered = service.register(codeBlobId, "fn", "java", "handle", null);

        assertThatThrownBy(() -> service.setSchedule(registered.id(), "nope"))
                .isInstanceOfSatisfying(CloutException.class,
                        e -> assertThat(e.kind()).isEqualTo(ErrorKind.VALIDATION_FAILED));
        assertThatThrownBy(() -> service.bindQueue(registered.id(), "bad/name"))
                .isInstanceOfSatisfying(CloutException.class,
                        e -> assertThat(e.kind()).isEqualTo(ErrorKind.VALIDATION_FAILED));
        assertThatThrownBy(() -> service.setSchedule("ffffffffffffffffffffffffffffffff", "0 * * * *"))
                .isInstanceOfSatisfying(CloutException.class,
                        e -> assertThat(e.kind()).isEqualTo(ErrorKind.BLOB_NOT_FOUND));
        assertThat(service.get(registered.id()).orElseThrow().trigger()).isNull();
    }

    @Test
    void remove_deletesRegistrationBlob_butKeepsCode() {
        FunctionRegistration registered = service.register(codeBlobId, "fn", "java", "handle", null);

        assertThat(service.remove(registered.id())).contains(registered);
        assertThat(service.remove(registered.id())).isEmpty();

        assertThat(blobStore.info(registered.id())).isEmpty();
        assertThat(blobStore.info(codeBlobId)).isPresent();
        assertThat(listener.events).endsWith("remove:" + registered.id());
        assertThat(newService(new FunctionRegistry()).list()).isEmpty();
    }

    @Test
    void registerMany_registersEachDistinctEntrypoint_withSharedSchedule() {
        List<FunctionRegistration> registered = service.registerMany(new BatchRegistrationRequest(codeBlobId, null,
                List.of("handle", "report", "Handle", " "), null, "0 3 * * *"));

        assertThat(registered).extracting(FunctionRegistration::name).containsExactly("handle", "report");
        assertThat(registered).allSatisfy(registration -> {
            assertThat(registration.runtime()).isEqualTo(RuntimeKind.JVM);
            assertThat(registration.sourceBlobId()).isEqualTo(codeBlobId);
            assertThat(registration.cronExpression()).isEqualTo("0 3 * * *");
            assertThat(registration.entrypoint()).isEqualTo(registration.name());
        });
        assertThat(newService(new FunctionRegistry()).list()).hasSize(2);
        assertThat(listener.events).hasSize(2);
    }

    @Test
    void registerMany_unresolvedEntrypoint_registersNothing() {
        when(executor.verify(eq(codeBlobId), eq(RuntimeKind.JVM), eq("missing"), isNull()))
                .thenReturn(Verification.failed("no public method 'missing'"));

        assertThatThrownBy(() -> service.registerMany(new BatchRegistrationRequest(codeBlobId, "java",
                List.of("handle", "missing"), null, null)))
                .isInstanceOfSatisfying(CloutException.class, e -> {
                    assertThat(e.kind()).isEqualTo(ErrorKind.VALIDATION_FAILED);
                    assertThat(e.fieldErrors().get("entrypoints")).hasSize(1);
                    assertThat(e.fieldErrors().get("entrypoints").get(0)).contains("missing");
                });
        assertThat(service.list()).isEmpty();
        assertThat(listener.events).isEmpty();
    }

    @Test
    void registerMany_validatesInputBeforeTouchingStorage() {
        assertThatThrownBy(() -> service.registerMany(new BatchRegistrationRequest(codeBlobId, null,
                List.of(), null, null)))
                .isInstanceOfSatisfying(CloutException.class,
                        e -> assertThat(e.fieldErrors()).containsKey("entrypoints"));
        assertThatThrownBy(() -> service.registerMany(new BatchRegistrationRequest(codeBlobId, null,
                List.of("handle", "report"), null, "sometimes")))
                .isInstanceOfSatisfying(CloutException.class,
                        e -> assertThat(e.fieldErrors()).containsKey("cron"));
        assertThatThrownBy(() -> service.registerMany(new BatchRegistrationRequest(
                "ffffffffffffffffffffffffffffffff", null, List.of("handle"), null, null)))
                .isInstanceOfSatisfying(CloutException.class,
                        e -> assertThat(e.kind()).isEqualTo(ErrorKind.BLOB_NOT_FOUND));
        assertThat(service.list()).isEmpty();
    }

    @Test
    void scheduleAll_andUnscheduleAll_actOnFunctionsOfOneSource() {
        String otherBlobId = blobStore.put("other.jar", new byte[]{4}, null, List.of()).id();
        FunctionRegistration first = service.register(codeBlobId, "first", "java", "first", null);
        FunctionRegistration second = service.register(new RegistrationRequest(codeBlobId, "second", "java",
                "second", null, null, "jobs"));
        FunctionRegistration unrelated = service.register(otherBlobId, "unrelated", "java", "handle", null);

        assertThat(service.scheduleAll(codeBlobId, "*/5 * * * *")).isEqualTo(2);

        assertThat(service.get(first.id()).orElseThrow().cronExpression()).isEqualTo("*/5 * * * *");
        assertThat(service.get(second.id()).orElseThrow().cronExpression()).isEqualTo("*/5 * * * *");
        assertThat(service.get(second.id()).orElseThrow().queueName()).isNull();
        assertThat(service.get(unrelated.id()).orElseThrow().trigger()).isNull();
        assertThat(newService(new FunctionRegistry()).get(first.id()).orElseThrow().cronExpression())
                .isEqualTo("*/5 * * * *");

        assertThat(service.unscheduleAll(codeBlobId)).isEqualTo(2);
        assertThat(service.get(first.id()).orElseThrow().trigger()).isNull();
        assertThat(service.get(second.id()).orElseThrow().trigger()).isNull();
        assertThat(service.unscheduleAll("ffffffffffffffffffffffffffffffff")).isZero();
    }

    @Test
    void scheduleAll_invalidInput_changesNothing() {
        FunctionRegistration registered = service.register(codeBlobId, "fn", "java", "handle", null);

        assertThatThrownBy(() -> service.scheduleAll(codeBlobId, "bogus"))
                .isInstanceOfSatisfying(CloutException.class, e -> assertThat(e.fieldErrors()).containsKey("cron"));
        assertThatThrownBy(() -> service.scheduleAll(" ", "0 * * * *"))
                .isInstanceOfSatisfying(CloutException.class,
                        e -> assertThat(e.fieldErrors()).containsKey("sourceId"));
        assertThat(service.get(registered.id()).orElseThrow().trigger()).isNull();
    }

    private static final class RecordingListener implements FunctionRegistrationListener {
        private final List<String> events = new ArrayList<>();

        @Override
        public void onRegister(FunctionRegistration registration) {
            events.add("register:" + registration.id());
        }

        @Override
        public void onTriggerChanged(FunctionRegistration registration) {
            events.add("trigger:" + registration.id());
        }

        @Override
        public void onRemove(String functionId) {
            events.add("remove:" + functionId);
        }
    }
}
