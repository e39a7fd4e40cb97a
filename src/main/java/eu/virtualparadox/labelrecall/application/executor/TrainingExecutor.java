package eu.virtualparadox.labelrecall.application.executor;

import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Runs the shards of data-parallel training steps.
 */
public class TrainingExecutor extends ThreadPoolTaskExecutor {

}
