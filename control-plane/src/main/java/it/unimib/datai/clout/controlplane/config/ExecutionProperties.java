package it.unimib.datai.clout.controlplane.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;
import java.time.Duration;

@ConfigurationProperties(prefix = "clout.execution")
@Validated
public record ExecutionProperties(
        Duration timeout,
        Boolean enableParallelExecution,
        @Min(1) @Max(100) Integer maxConcurrentExecutions,
        String tempDirectory
) {
    public static final Duration DEFAULT_TIMEOUT = Duration.ofMinutes(5);
    public static final int DEFAULT_MAX_CONCURRENT_EXECUTIONS = 5;

    public ExecutionProperties {
        if (timeout == null) {
            timeout = DEFAULT_TIMEOUT;
        }
        if (timeout.isZero() || timeout.isNegative() || timeout.compareTo(Duration.ofHours(1)) > 0) {
            throw new IllegalArgumentException("clout.execution.timeout must be positive and at most 1h");
        }
        if (enableParallelExecution == null) {
            enableParallelExecution = true;
        }
        if (maxConcurrentExecutions == null) {
            maxConcurrentExecutions = DEFAULT_MAX_CONCURRENT_EXECUTIONS;
        }
    }

    public static ExecutionProperties defaults() {
        return new ExecutionProperties(null, null, null, null);
    }

    /**
     * Number of executions allowed to run at once.
     */
    public int effectiveConcurrency() {
        return enableParallelExecution ? maxConcurrentExecutions : 1;
    }

    public Path tempDirectoryPath() {
        return tempDirectory == null || tempDirectory.isBlank()
                ? Path.of(System.getProperty("java.io.tmpdir"))
                : Path.of(tempDirectory);
    }
}
