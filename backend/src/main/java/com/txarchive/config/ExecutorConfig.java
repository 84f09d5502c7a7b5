package com.txarchive.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.concurrent.Executor;

/**
 * Named executors. The storage writer is single-threaded so all archive writes are serialized; on shutdown
 * it finishes queued writes instead of interrupting them.
 */
@Configuration
public class ExecutorConfig {

    public static final String STORAGE_WRITER_EXECUTOR = "storage-writer";

    @Bean(name = STORAGE_WRITER_EXECUTOR)
    public Executor storageWriterExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(1);
        e.setMaxPoolSize(1);
        e.setThreadNamePrefix("storage-writer-");
        e.setWaitForTasksToCompleteOnShutdown(true);
        e.setAwaitTerminationSeconds(30);
        e.initialize();
        return e;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
