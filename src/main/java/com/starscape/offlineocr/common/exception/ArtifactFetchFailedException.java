package com.starscape.offlineocr.common.exception;

public class ArtifactFetchFailedException extends JobFailureException {
    
    private final String code;
    
    public ArtifactFetchFailedException(String code, Throwable cause) {
        super("Language data for '" + code + "' is unavailable: " + describe(cause), cause);
        this.code = code;
    }
    
    public String getCode() {
        return code;
    }
    
    @Override
    public ErrorKind kind() {
        return ErrorKind.ARTIFACT_FETCH_FAILED;
    }
    
    private static String describe(Throwable cause) {
        if (cause == null) {
            return "unknown error";
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
