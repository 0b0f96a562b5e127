package com.example.messaging.shared.model;

import lombok.Value;

/**
 * Location of a stored object. {@code path} is unique per upload attempt.
 */
@Value
public class StorageReference {
    String bucket;
    String path;
    String publicUrl;
}
