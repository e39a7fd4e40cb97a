package eu.virtualparadox.labelrecall.application.config;

import eu.virtualparadox.labelrecall.application.executor.QueryExecutor;
import eu.virtualparadox.labelrecall.application.executor.TrainingExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ExecutorConfig {

    @Bean
    public TrainingExecutor trainingExecutor(final ApplicationConfig config) {
        final int workers = Math.max(1, config.getTraining().getWorkers());
        final TrainingExecutor executor = new TrainingExecutor();
        executor.setCorePoolSize(workers);
        executor.setMaxPoolSize(workers);
        executor.setQueueCapacity(Integer.MAX_VALUE);
        executor.setThreadNamePrefix("train-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();
        return executor;
    }

    @Bean
    public QueryExecutor queryExecutor(final ApplicationConfig config) {
        final int threads = Math.max(1, config.getIndex().getQueryThreads());
        final QueryExecutor executor = new QueryExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(Integer.MAX_VALUE);
        executor.setThreadNamePrefix("query-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();
        return executor;
    }
}
