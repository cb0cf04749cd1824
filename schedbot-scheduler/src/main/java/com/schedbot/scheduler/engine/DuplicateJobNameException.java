package com.schedbot.scheduler.engine;

public class DuplicateJobNameException extends RuntimeException {

    private final String jobName;

    public DuplicateJobNameException(String jobName) {
        super("Job name \"" + jobName + "\" already exists");
        this.jobName = jobName;
    }

    public String getJobName() {
        return jobName;
    }
}
