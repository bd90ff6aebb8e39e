package it.unimib.datai.clout.controlplane.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import it.unimib.datai.clout.controlplane.blob.BlobStore;
import it.unimib.datai.clout.controlplane.blob.FileBlobStore;
import it.unimib.datai.clout.controlplane.execution.FunctionInvoker;
import it.unimib.datai.clout.controlplane.execution.JarFunctionInvoker;
import it.unimib.datai.clout.controlplane.execution.NativeFunctionInvoker;
import it.unimib.datai.clout.controlplane.execution.ScriptFunctionInvoker;
import it.unimib.datai.clout.controlplane.queue.DiskQueueServer;
import it.unimib.datai.clout.controlplane.queue.QueueServer;
import it.unimib.datai.clout.controlplane.service.Metrics;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Storage, runtime strategies and the timer thread pool.
 */
@Configuration
public class CoreConfiguration {

    @Bean
    public BlobStore blobStore(BlobStorageProperties properties, ObjectMapper objectMapper) {
        return new FileBlobStore(properties, objectMapper);
    }

    @Bean
    public QueueServer queueServer(QueueStorageProperties properties, ObjectMapper objectMapper, Metrics metrics) {
        return new DiskQueueServer(properties, objectMapper, metrics);
    }

    @Bean
    public FunctionInvoker jarFunctionInvoker() {
        return new JarFunctionInvoker();
    }

    @Bean
    public FunctionInvoker scriptFunctionInvoker() {
        return new ScriptFunctionInvoker();
    }

    @Bean
    public FunctionInvoker nativeFunctionInvoker() {
        return new NativeFunctionInvoker();
    }

    @Bean
    public ThreadPoolTaskScheduler cloutTaskScheduler(ScheduleProperties properties) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(properties.poolSize());
        scheduler.setThreadNamePrefix("clout-timer-");
        scheduler.setDaemon(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        return scheduler;
    }
}
