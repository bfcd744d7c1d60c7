package com.starscape.offlineocr.common.exception;

public class UnsupportedFormatException extends JobFailureException {
    
    public UnsupportedFormatException(String message) {
        super(message);
    }
    
    public UnsupportedFormatException(String message, Throwable cause) {
        super(message, cause);
    }
    
    @Override
    public ErrorKind kind() {
        return ErrorKind.UNSUPPORTED_FORMAT;
    }
}
