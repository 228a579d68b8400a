/*
 * Copyright 2024-2025 the original author or authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.familyleaf.prompting.start.config;

import com.familyleaf.prompting.extension.config.PromptingAutoConfiguration;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * 异步任务配置
 * <p>
 * 配置回复分析持久化与叶子批量增强两个线程池
 * </p>
 *
 * @author Family Leaf Team
 * @since 1.0.0
 */
@Configuration
@EnableAsync
public class AsyncConfig {

    @Value("${family.prompting.async.core-pool-size:2}")
    private int corePoolSize;

    @Value("${family.prompting.async.max-pool-size:10}")
    private int maxPoolSize;

    @Value("${family.prompting.async.queue-capacity:1000}")
    private int queueCapacity;

    @Value("${family.prompting.async.enhancement-pool-size:4}")
    private int enhancementPoolSize;

    /**
     * 回复分析持久化异步线程池
     */
    @Bean("analysisPersistenceExecutor")
    public Executor analysisPersistenceExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("analysis-persist-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();
        return executor;
    }

    /**
     * 叶子批量增强线程池
     */
    @Bean(PromptingAutoConfiguration.LEAF_ENHANCEMENT_EXECUTOR)
    public Executor leafEnhancementExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(enhancementPoolSize);
        executor.setMaxPoolSize(enhancementPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("leaf-enhance-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}
