package it.unimib.datai.clout.controlplane.api;

import it.unimib.datai.clout.controlplane.schedule.CronExpressions;
import it.unimib.datai.clout.controlplane.schedule.ScheduleEngine;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.TreeMap;

@RestController
@RequestMapping("/api/schedules")
@Validated
public class ScheduleController {
    private final ScheduleEngine scheduleEngine;

    public ScheduleController(ScheduleEngine scheduleEngine) {
        this.scheduleEngine = scheduleEngine;
    }

    @GetMapping
    public Map<String, String> list() {
        Map<String, String> schedules = new TreeMap<>();
        for (String functionId : scheduleEngine.scheduledFunctionIds()) {
            scheduleEngine.schedule(functionId).ifPresent(cron -> schedules.put(functionId, cron));
        }
        return schedules;
    }

    @GetMapping("/next")
    public CronPreview next(@RequestParam @NotBlank(message = "cron is required") String cron,
                            @RequestParam(defaultValue = "5") @Min(1) @Max(100) int count) {
        String normalized = CronExpressions.normalize(cron);
        return new CronPreview(cron, normalized, scheduleEngine.nextFireTimes(cron, count));
    }
}
