package com.rivalapex.adexport.server.service;

import com.rivalapex.adexport.server.dto.GlobalConfig;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import javax.annotation.PostConstruct;
import javax.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;

/**
 * 导出作业线程池，容量与队列长度来自 concurrency 配置。队列满时拒绝提交。
 */
@Slf4j
@Component
public class ExportWorkerPool {

    static final String THREAD_NAME_PREFIX = "adexport-worker-";

    private static final int AWAIT_TERMINATION_SECONDS = 30;

    private final GlobalConfigService globalConfigService;

    private ThreadPoolTaskExecutor executor;

    public ExportWorkerPool(GlobalConfigService globalConfigService) {
        this.globalConfigService = globalConfigService;
    }

    @PostConstruct
    public void init() {
        GlobalConfig.ConcurrencyConfig concurrency = globalConfigService.getGlobalConfig().getConcurrency();
        ThreadPoolTaskExecutor pool = new ThreadPoolTaskExecutor();
        pool.setCorePoolSize(concurrency.getMaxExportJobs());
        pool.setMaxPoolSize(concurrency.getMaxExportJobs());
        // 0 时 Spring 使用 SynchronousQueue，没有空闲线程即拒绝
        pool.setQueueCapacity(concurrency.getQueueCapacity());
        pool.setThreadNamePrefix(THREAD_NAME_PREFIX);
        pool.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        pool.setWaitForTasksToCompleteOnShutdown(true);
        pool.setAwaitTerminationSeconds(AWAIT_TERMINATION_SECONDS);
        pool.initialize();
        this.executor = pool;
        log.info("创建导出线程池: threads={}, queueCapacity={}",
            concurrency.getMaxExportJobs(), concurrency.getQueueCapacity());
    }

    /**
     * @throws RejectedExecutionException 队列已满或线程池已关闭
     */
    public void submit(Runnable task) {
        if (executor == null) {
            throw new RejectedExecutionException("export worker pool is not initialized");
        }
        executor.execute(task);
    }

    @PreDestroy
    public void shutdown() {
        if (executor != null) {
            log.info("关闭导出线程池，最多等待 {} 秒", AWAIT_TERMINATION_SECONDS);
            executor.shutdown();
        }
    }
}
