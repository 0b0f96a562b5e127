package com.example.messaging.chat.service;

import com.example.messaging.chat.support.ChatTestFixture;
import com.example.messaging.shared.exception.AttachmentRejectedException;
import com.example.messaging.shared.exception.ErrorCode;
import com.example.messaging.shared.exception.TransportException;
import com.example.messaging.shared.model.FileHandle;
import com.example.messaging.shared.util.Constants.UploadStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.nio.charset.StandardCharsets;

import static com.example.messaging.chat.support.ChatTestFixture.ME;
import static org.assertj.core.api.Assertions.assertThat;

class AttachmentUploaderTest {

    private ChatTestFixture fixture;
    private AttachmentUploader uploader;

    @BeforeEach
    void setUp() {
        fixture = new ChatTestFixture();
        uploader = fixture.uploader;
    }

    private static FileHandle file(String name, String contentType, int size) {
        return FileHandle.builder()
                .fileName(name)
                .contentType(contentType)
                .sizeBytes(size)
                .content(new byte[size])
                .build();
    }

    private int freeChannels() {
        return fixture.uploadBulkhead.getMetrics().getAvailableConcurrentCalls();
    }

    @Test
    void storesFileAndReleasesChannel() {
        byte[] content = "Dó Ré Mi".getBytes(StandardCharsets.UTF_8);
        UploadHandle handle = uploader.upload(ME, FileHandle.builder()
                .fileName("escala.txt")
                .contentType("text/plain; charset=utf-8")
                .sizeBytes(content.length)
                .content(content)
                .build());

        assertThat(handle.getStatus()).isEqualTo(UploadStatus.READY);
        assertThat(handle.getReference().getPublicUrl())
                .isEqualTo("http://localhost:8085/storage/chat-attachments/" + handle.getReference().getPath());
        assertThat(fixture.inMemoryBackend().isStored(handle.getReference().getPath())).isTrue();
        assertThat(freeChannels()).isEqualTo(2);
        StepVerifier.create(handle.result())
                .expectNext(handle.getReference())
                .verifyComplete();
    }

    @Test
    void oversizeFileIsRejectedWithoutTakingAChannel() {
        UploadHandle handle = uploader.upload(ME, file("ensaio.mp3", "audio/mpeg", 2048));

        assertThat(handle.getStatus()).isEqualTo(UploadStatus.FAILED);
        assertThat(freeChannels()).isEqualTo(2);
        StepVerifier.create(handle.result())
                .expectErrorSatisfies(e -> assertThat(((AttachmentRejectedException) e).getErrorCode())
                        .isEqualTo(ErrorCode.TOO_LARGE))
                .verify();
    }

    @Test
    void blockedExtensionWinsOverAllowedContentType() {
        UploadHandle handle = uploader.upload(ME, file("script.JS", "text/plain", 10));

        assertThat(handle.getFailure())
                .isInstanceOfSatisfying(AttachmentRejectedException.class,
                        e -> assertThat(e.getErrorCode()).isEqualTo(ErrorCode.UNSUPPORTED_TYPE));
    }

    @Test
    void contentTypeMustBeAllowed() {
        assertThat(uploader.upload(ME, file("foto.jpeg", "image/jpeg", 10)).getStatus())
                .isEqualTo(UploadStatus.READY);
        assertThat(uploader.upload(ME, file("aula.mp4", "video/mp4", 10)).getFailure())
                .isInstanceOf(AttachmentRejectedException.class);
        assertThat(uploader.upload(ME, file("sem-tipo", null, 10)).getFailure())
                .isInstanceOf(AttachmentRejectedException.class);
    }

    @Test
    void storageFailureFailsHandleAndReleasesChannel() {
        fixture.faults.setOffline(true);

        UploadHandle handle = uploader.upload(ME, file("foto.png", "image/png", 10));

        assertThat(handle.getStatus()).isEqualTo(UploadStatus.FAILED);
        assertThat(handle.getFailure()).isInstanceOf(TransportException.class);
        assertThat(freeChannels()).isEqualTo(2);
    }

    @Test
    void uploadsBeyondChannelLimitFailUntilOneIsCancelled() {
        fixture.faults.setUploadsStalled(true);

        UploadHandle first = uploader.upload(ME, file("a.png", "image/png", 10));
        UploadHandle second = uploader.upload(ME, file("b.png", "image/png", 10));
        UploadHandle third = uploader.upload(ME, file("c.png", "image/png", 10));

        assertThat(first.getStatus()).isEqualTo(UploadStatus.UPLOADING);
        assertThat(second.getStatus()).isEqualTo(UploadStatus.UPLOADING);
        assertThat(third.getFailure()).isInstanceOf(TransportException.class);
        assertThat(freeChannels()).isZero();

        assertThat(first.cancel()).isTrue();

        assertThat(first.isCancelled()).isTrue();
        assertThat(freeChannels()).isEqualTo(1);
        assertThat(uploader.upload(ME, file("c.png", "image/png", 10)).getStatus()).isEqualTo(UploadStatus.UPLOADING);
        StepVerifier.create(first.result())
                .expectError(UploadCancelledException.class)
                .verify();
    }

    @Test
    void settledUploadCannotBeCancelled() {
        UploadHandle handle = uploader.upload(ME, file("foto.png", "image/png", 10));

        assertThat(handle.cancel()).isFalse();
        assertThat(handle.getStatus()).isEqualTo(UploadStatus.READY);
    }

    @Test
    void identicalContentIsStoredTwice() {
        FileHandle same = file("lista.pdf", "application/pdf", 10);

        UploadHandle first = uploader.upload(ME, same);
        UploadHandle second = uploader.upload(ME, same);

        assertThat(first.getReference().getPath()).isNotEqualTo(second.getReference().getPath());
        assertThat(fixture.inMemoryBackend().isStored(first.getReference().getPath())).isTrue();
        assertThat(fixture.inMemoryBackend().isStored(second.getReference().getPath())).isTrue();
    }
}
