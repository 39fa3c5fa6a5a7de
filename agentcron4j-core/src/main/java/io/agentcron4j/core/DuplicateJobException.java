package io.agentcron4j.core;

public class DuplicateJobException extends SchedulerException {

    public DuplicateJobException(String name) {
        super("Job already registered: " + name);
    }
}
