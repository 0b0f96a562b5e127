package com.example.messaging.chat.service;

import com.example.messaging.shared.model.StorageReference;
import com.example.messaging.shared.util.Constants.UploadStatus;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.concurrent.atomic.AtomicReference;

/**
 * An upload in flight. Settles exactly once: to a storage reference, or to a failure.
 * Cancelling settles it as failed with {@link UploadCancelledException} and tears down the transfer.
 */
public class UploadHandle {

    private final String fileName;
    private final AtomicReference<UploadStatus> status = new AtomicReference<>(UploadStatus.UPLOADING);
    private final Sinks.One<StorageReference> result = Sinks.one();
    private final AtomicReference<Disposable> transfer = new AtomicReference<>();
    private volatile StorageReference reference;
    private volatile Throwable failure;

    UploadHandle(String fileName) {
        this.fileName = fileName;
    }

    public String getFileName() {
        return fileName;
    }

    public UploadStatus getStatus() {
        return status.get();
    }

    public StorageReference getReference() {
        return reference;
    }

    public Throwable getFailure() {
        return failure;
    }

    public boolean isCancelled() {
        return failure instanceof UploadCancelledException;
    }

    /**
     * Emits the storage reference, or the failure. Late subscribers see the settled outcome.
     */
    public Mono<StorageReference> result() {
        return result.asMono();
    }

    /**
     * @return false if the upload had already settled
     */
    public boolean cancel() {
        if (!fail(new UploadCancelledException(fileName))) {
            return false;
        }
        Disposable current = transfer.get();
        if (current != null) {
            current.dispose();
        }
        return true;
    }

    boolean complete(StorageReference storageReference) {
        if (!status.compareAndSet(UploadStatus.UPLOADING, UploadStatus.READY)) {
            return false;
        }
        reference = storageReference;
        result.tryEmitValue(storageReference);
        return true;
    }

    boolean fail(Throwable error) {
        if (!status.compareAndSet(UploadStatus.UPLOADING, UploadStatus.FAILED)) {
            return false;
        }
        failure = error;
        result.tryEmitError(error);
        return true;
    }

    void attach(Disposable disposable) {
        transfer.set(disposable);
        // Cancelled before the transfer was attached
        if (isCancelled()) {
            disposable.dispose();
        }
    }
}
