package com.punchwheel.exception;

/**
 * 调度边界捕获的任务执行异常
 */
public class JobExecutionException extends RuntimeException {

    private final String jobId;

    public JobExecutionException(String jobId, Throwable cause) {
        super("job '" + jobId + "' execution failed: " + cause.getMessage(), cause);
        this.jobId = jobId;
    }

    public String getJobId() {
        return jobId;
    }
}
