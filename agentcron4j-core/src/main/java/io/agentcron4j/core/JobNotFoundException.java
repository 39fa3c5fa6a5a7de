package io.agentcron4j.core;

public class JobNotFoundException extends SchedulerException {

    public JobNotFoundException(String name) {
        super("Job not found: " + name);
    }
}
