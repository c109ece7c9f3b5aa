package com.imagefan.app;

public class EnumerationException extends Exception {
    public EnumerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
