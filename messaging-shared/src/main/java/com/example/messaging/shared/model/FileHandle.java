package com.example.messaging.shared.model;

import lombok.Builder;
import lombok.ToString;
import lombok.Value;

import java.util.Locale;

@Value
@Builder
public class FileHandle {
    String fileName;
    String contentType;
    long sizeBytes;
    @ToString.Exclude
    byte[] content;

    public String extension() {
        if (fileName == null) {
            return "";
        }
        int dot = fileName.lastIndexOf('.');
        return dot < 0 ? "" : fileName.substring(dot).toLowerCase(Locale.ROOT);
    }
}
