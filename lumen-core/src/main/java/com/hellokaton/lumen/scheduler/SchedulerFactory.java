package com.hellokaton.lumen.scheduler;

import com.hellokaton.lumen.Lumen;

@FunctionalInterface
public interface SchedulerFactory {

    Scheduler create(Lumen app, SchedulerConfig config);

}
