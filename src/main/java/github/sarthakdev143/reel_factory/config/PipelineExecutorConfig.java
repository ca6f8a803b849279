package github.sarthakdev143.reel_factory.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Bounded pool shared by media resolution, script generation and segment rendering. The size caps
 * concurrent ffmpeg encodes and concurrent calls to the speech provider.
 */
@Configuration
public class PipelineExecutorConfig {

    @Bean(name = "pipelineExecutor")
    public ThreadPoolTaskExecutor pipelineExecutor(ReelFactoryProperties properties) {
        ReelFactoryProperties.Pipeline pipeline = properties.pipeline();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(pipeline.concurrency());
        executor.setMaxPoolSize(pipeline.concurrency());
        executor.setQueueCapacity(pipeline.queueCapacity());
        executor.setThreadNamePrefix("reel-pipeline-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        return executor;
    }
}
