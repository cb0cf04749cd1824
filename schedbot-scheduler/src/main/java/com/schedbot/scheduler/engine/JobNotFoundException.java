package com.schedbot.scheduler.engine;

public class JobNotFoundException extends RuntimeException {

    private final String jobName;

    public JobNotFoundException(String jobName) {
        super("Job \"" + jobName + "\" not found");
        this.jobName = jobName;
    }

    public String getJobName() {
        return jobName;
    }
}
