package com.aiinpocket.ballcraft.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * 非同步任務配置。
 *
 * <p>自動合成迴圈在獨立的執行緒池中執行，每位玩家最多一個迴圈。
 * 迴圈之間的等待不佔用 CPU，但會佔住一條執行緒，因此最大執行緒數即為同時進行的自動合成上限。
 */
@Configuration
public class AsyncConfig {

    /**
     * 自動合成執行緒池。
     * 核心 2 線程 / 最大 8 線程，隊列容量 32。
     * 滿載時拒絕新迴圈（AbortPolicy），由呼叫端回報失敗，避免在請求執行緒上跑整個迴圈。
     */
    @Bean
    public TaskExecutor autoCraftExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(8);
        executor.setQueueCapacity(32);
        executor.setThreadNamePrefix("auto-craft-");
        executor.setRejectedExecutionHandler(new java.util.concurrent.ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }
}
