package com.goormthonuniv.factmerge.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class ExecutorConfig {

    public static final String SCORING_EXECUTOR = "scoringExecutor";
    public static final String CLUSTERING_EXECUTOR = "clusteringExecutor";

    /** 문서별 신뢰도 채점(네트워크 바운드) 팬아웃용 */
    @Bean(name = SCORING_EXECUTOR)
    public ThreadPoolTaskExecutor scoringExecutor(
            @Value("${factmerge.executor.scoring-pool-size:8}") int poolSize) {
        return bounded("scoring-", poolSize, 256);
    }

    /** 임베딩 + 클러스터링(CPU 바운드) 전용 */
    @Bean(name = CLUSTERING_EXECUTOR)
    public ThreadPoolTaskExecutor clusteringExecutor(
            @Value("${factmerge.executor.clustering-pool-size:2}") int poolSize) {
        return bounded("clustering-", poolSize, 64);
    }

    private static ThreadPoolTaskExecutor bounded(String prefix, int poolSize, int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setThreadNamePrefix(prefix);
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        return executor;
    }
}
