package com.starscape.offlineocr.common.exception;

/**
 * Failure that ends a job. Caught at the job boundary and recorded on the job,
 * never propagated to the worker thread.
 */
public abstract class JobFailureException extends RuntimeException {
    
    protected JobFailureException(String message) {
        super(message);
    }
    
    protected JobFailureException(String message, Throwable cause) {
        super(message, cause);
    }
    
    public abstract ErrorKind kind();
}
