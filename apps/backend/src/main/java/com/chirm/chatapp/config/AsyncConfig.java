package com.chirm.chatapp.config;

import java.util.concurrent.Executor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class AsyncConfig {

    /**
     * 연결별 outbound writer 실행용.
     *
     * writer 는 연결이 살아 있는 동안 스레드를 점유하므로 큐를 두지 않는다 (queueCapacity = 0).
     * maxPoolSize 를 넘는 연결은 writer 시작이 거절되어 바로 정리된다.
     */
    @Bean(name = "connectionWriterExecutor", destroyMethod = "shutdown")
    public ThreadPoolTaskExecutor connectionWriterExecutor(
            @Value("${hub.writer.core-pool-size:64}") int corePoolSize,
            @Value("${hub.writer.max-pool-size:4096}") int maxPoolSize
    ) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setThreadNamePrefix("ws-writer-");
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(0);
        executor.setAllowCoreThreadTimeOut(true);
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }
}
