package com.starscape.offlineocr.common.exception;

public class InvalidInputException extends BusinessException {
    
    public InvalidInputException(String message) {
        super(ErrorKind.INVALID_INPUT.name(), message);
    }
}
