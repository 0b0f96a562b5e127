package com.example.messaging.chat.service;

import com.example.messaging.shared.config.AppProperties;
import com.example.messaging.shared.exception.AttachmentRejectedException;
import com.example.messaging.shared.exception.TransportException;
import com.example.messaging.shared.model.FileHandle;
import com.example.messaging.shared.model.StorageReference;
import io.github.resilience4j.bulkhead.Bulkhead;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;

import java.util.List;
import java.util.Locale;

/**
 * Uploads files to storage over a bounded set of channels. Each upload holds one bulkhead permit
 * from subscription until it completes, fails or is cancelled. Two uploads of the same content
 * produce two independent stored objects.
 */
@Component
@Slf4j
public class AttachmentUploader {

    private final BackendGateway backendGateway;
    private final Bulkhead uploadBulkhead;
    private final long maxSizeBytes;
    private final List<String> allowedContentTypes;
    private final List<String> blockedExtensions;

    public AttachmentUploader(BackendGateway backendGateway, Bulkhead attachmentUploadBulkhead, AppProperties appProperties) {
        this.backendGateway = backendGateway;
        this.uploadBulkhead = attachmentUploadBulkhead;
        AppProperties.Upload upload = appProperties.getUpload();
        this.maxSizeBytes = upload.getMaxSizeBytes();
        this.allowedContentTypes = upload.getAllowedContentTypes().stream().map(t -> t.toLowerCase(Locale.ROOT)).toList();
        this.blockedExtensions = upload.getBlockedExtensions().stream().map(e -> e.toLowerCase(Locale.ROOT)).toList();
    }

    /**
     * Starts an upload and returns at once. A file rejected locally, or one for which no channel
     * is free, yields a handle that has already failed.
     */
    public UploadHandle upload(String ownerId, FileHandle file) {
        UploadHandle handle = new UploadHandle(file.getFileName());
        try {
            validate(file);
        } catch (AttachmentRejectedException e) {
            log.warn("Rejected upload of '{}': {}", file.getFileName(), e.getMessage());
            handle.fail(e);
            return handle;
        }

        if (!uploadBulkhead.tryAcquirePermission()) {
            log.warn("No upload channel available for '{}' ({} in use)", file.getFileName(),
                    uploadBulkhead.getBulkheadConfig().getMaxConcurrentCalls());
            handle.fail(new TransportException("No upload channel available, try again later"));
            return handle;
        }

        log.debug("Uploading '{}' ({} bytes) for {}", file.getFileName(), file.getSizeBytes(), ownerId);
        Disposable transfer = backendGateway.storeFile(ownerId, file)
                .doFinally(signal -> {
                    uploadBulkhead.onComplete();
                    log.debug("Upload channel for '{}' released on {}", file.getFileName(), signal);
                })
                .subscribe(
                        reference -> onStored(handle, reference),
                        error -> {
                            if (handle.fail(error)) {
                                log.warn("Upload of '{}' failed: {}", file.getFileName(), error.getMessage());
                            }
                        });
        handle.attach(transfer);
        return handle;
    }

    void validate(FileHandle file) {
        if (file.getSizeBytes() > maxSizeBytes) {
            throw AttachmentRejectedException.tooLarge(file.getFileName(), file.getSizeBytes(), maxSizeBytes);
        }
        if (blockedExtensions.contains(file.extension())) {
            throw AttachmentRejectedException.unsupportedType(file.getFileName(), file.getContentType());
        }
        if (!isAllowedContentType(file.getContentType())) {
            throw AttachmentRejectedException.unsupportedType(file.getFileName(), file.getContentType());
        }
    }

    private boolean isAllowedContentType(String contentType) {
        if (contentType == null || contentType.isBlank()) {
            return false;
        }
        String normalized = contentType.toLowerCase(Locale.ROOT);
        int parameters = normalized.indexOf(';');
        if (parameters >= 0) {
            normalized = normalized.substring(0, parameters).trim();
        }
        for (String allowed : allowedContentTypes) {
            if (allowed.endsWith("/*")) {
                if (normalized.startsWith(allowed.substring(0, allowed.length() - 1))) {
                    return true;
                }
            } else if (allowed.equals(normalized)) {
                return true;
            }
        }
        return false;
    }

    private void onStored(UploadHandle handle, StorageReference reference) {
        if (handle.complete(reference)) {
            log.info("Stored '{}' at {}/{}", handle.getFileName(), reference.getBucket(), reference.getPath());
            return;
        }
        // Settled elsewhere (cancelled) while storage was finishing: drop the orphaned object
        log.info("Upload of '{}' completed after cancellation, deleting {}", handle.getFileName(), reference.getPath());
        backendGateway.deleteFile(reference).subscribe(
                unused -> { },
                error -> log.warn("Could not delete orphaned upload {}: {}", reference.getPath(), error.getMessage()));
    }
}
