package eu.virtualparadox.labelrecall.application.executor;

import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Runs recall queries concurrently during evaluation and batch prediction.
 */
public class QueryExecutor extends ThreadPoolTaskExecutor {

}
