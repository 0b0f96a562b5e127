package com.example.messaging.chat.service;

public class UploadCancelledException extends RuntimeException {
    public UploadCancelledException(String fileName) {
        super("Upload of '" + fileName + "' was cancelled");
    }
}
