package com.starscape.offlineocr.common.exception;

public class JobCancelledException extends JobFailureException {
    
    public JobCancelledException(String jobId) {
        super("Job " + jobId + " was cancelled");
    }
    
    @Override
    public ErrorKind kind() {
        return ErrorKind.CANCELLED;
    }
}
