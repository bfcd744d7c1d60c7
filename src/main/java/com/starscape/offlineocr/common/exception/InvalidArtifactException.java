package com.starscape.offlineocr.common.exception;

public class InvalidArtifactException extends BusinessException {
    
    public InvalidArtifactException(String message) {
        super(ErrorKind.INVALID_ARTIFACT.name(), message);
    }
    
    public InvalidArtifactException(String message, Throwable cause) {
        super(ErrorKind.INVALID_ARTIFACT.name(), message, cause);
    }
}
