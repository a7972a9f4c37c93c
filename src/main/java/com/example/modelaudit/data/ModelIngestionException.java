package com.example.modelaudit.data;

public class ModelIngestionException extends RuntimeException {
    public ModelIngestionException(String message) {
        super(message);
    }

    public ModelIngestionException(String message, Throwable cause) {
        super(message, cause);
    }
}
