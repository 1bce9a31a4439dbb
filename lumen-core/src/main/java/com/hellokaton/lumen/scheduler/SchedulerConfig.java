package com.hellokaton.lumen.scheduler;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.ZoneId;
import java.util.Map;

/**
 * Scheduler options resolved from the application configuration.
 * {@code tasks} maps a task name to the task it refers to.
 */
@Getter
@AllArgsConstructor
public class SchedulerConfig {

    private final Map<String, String> tasks;
    private final Map<String, Object> configurations;
    private final ZoneId timezone;

}
