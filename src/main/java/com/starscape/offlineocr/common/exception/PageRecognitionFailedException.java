package com.starscape.offlineocr.common.exception;

/**
 * Raised when not a single page of a document could be recognized.
 */
public class PageRecognitionFailedException extends JobFailureException {
    
    public PageRecognitionFailedException(String message) {
        super(message);
    }
    
    @Override
    public ErrorKind kind() {
        return ErrorKind.PAGE_RECOGNITION_FAILED;
    }
}
