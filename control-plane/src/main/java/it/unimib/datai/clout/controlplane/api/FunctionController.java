package it.unimib.datai.clout.controlplane.api;

import it.unimib.datai.clout.common.model.FunctionRegistration;
import it.unimib.datai.clout.controlplane.registry.BatchRegistrationRequest;
import it.unimib.datai.clout.controlplane.registry.FunctionService;
import it.unimib.datai.clout.controlplane.registry.RegistrationRequest;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Registration endpoints. Anything that touches blob storage or waits on trigger workers runs
 * on the bounded elastic scheduler, off the event loop.
 */
@RestController
@RequestMapping("/api/functions")
@Validated
public class FunctionController {
    private final FunctionService functionService;

    public FunctionController(FunctionService functionService) {
        this.functionService = functionService;
    }

    @GetMapping
    public Collection<FunctionRegistration> list() {
        return functionService.list();
    }

    @GetMapping("/{id}")
    public ResponseEntity<FunctionRegistration> get(@PathVariable String id) {
        return functionService.get(id)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @PostMapping
    public Mono<ResponseEntity<FunctionRegistration>> register(@RequestBody @Valid RegisterFunctionRequest request) {
        return Blocking.call(() -> functionService.register(new RegistrationRequest(
                request.blobId(),
                request.name(),
                request.runtime(),
                request.entrypoint(),
                request.declaringType(),
                request.cron(),
                request.queue())))
                .map(registered -> ResponseEntity.created(URI.create("/api/functions/" + registered.id()))
                        .body(registered));
    }

    @PostMapping("/register-many-from/{blobId}")
    public Mono<ResponseEntity<List<FunctionRegistration>>> registerMany(
            @PathVariable String blobId,
            @RequestBody @Valid RegisterManyRequest request) {
        return Blocking.call(() -> functionService.registerMany(new BatchRegistrationRequest(
                blobId,
                request.runtime(),
                request.entrypoints(),
                request.declaringType(),
                request.cron())))
                .map(registered -> ResponseEntity.status(HttpStatus.CREATED).body(registered));
    }

    @PostMapping("/schedule-all")
    public Mono<Map<String, Integer>> scheduleAll(@RequestBody @Valid SourceScheduleRequest request) {
        return Blocking.call(() -> Map.of("count", functionService.scheduleAll(request.sourceId(), request.cron())));
    }

    @PostMapping("/unschedule-all")
    public Mono<Map<String, Integer>> unscheduleAll(@RequestBody @Valid SourceScheduleRequest request) {
        return Blocking.call(() -> Map.of("count", functionService.unscheduleAll(request.sourceId())));
    }

    @DeleteMapping("/{id}")
    public Mono<ResponseEntity<Void>> remove(@PathVariable String id) {
        return Blocking.call(() -> functionService.remove(id)
                .map(removed -> ResponseEntity.noContent().<Void>build())
                .orElse(ResponseEntity.notFound().build()));
    }

    @PutMapping("/{id}/schedule")
    public Mono<FunctionRegistration> setSchedule(@PathVariable String id,
                                                  @RequestBody @Valid ScheduleRequest request) {
        return Blocking.call(() -> functionService.setSchedule(id, request.cron()));
    }

    @DeleteMapping("/{id}/schedule")
    public Mono<FunctionRegistration> clearSchedule(@PathVariable String id) {
        return Blocking.call(() -> functionService.clearSchedule(id));
    }

    @PutMapping("/{id}/queue")
    public Mono<FunctionRegistration> bindQueue(@PathVariable String id,
                                                @RequestBody @Valid QueueBindingRequest request) {
        return Blocking.call(() -> functionService.bindQueue(id, request.queue()));
    }

    @DeleteMapping("/{id}/queue")
    public Mono<FunctionRegistration> unbindQueue(@PathVariable String id) {
        return Blocking.call(() -> functionService.unbindQueue(id));
    }
}
