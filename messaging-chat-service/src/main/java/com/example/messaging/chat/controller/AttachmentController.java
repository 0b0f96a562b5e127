package com.example.messaging.chat.controller;

import com.example.messaging.chat.service.ConversationStore;
import com.example.messaging.shared.model.Attachment;
import com.example.messaging.shared.model.FileHandle;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.multipart.FilePart;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/chat")
@RequiredArgsConstructor
@Slf4j
public class AttachmentController {

    private final ConversationStore conversationStore;

    @PostMapping(value = "/conversations/{conversationId}/attachments", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public Mono<ResponseEntity<Attachment>> attachFile(
            @PathVariable String conversationId,
            @RequestPart("file") FilePart file) {
        MediaType contentType = file.headers().getContentType();
        return DataBufferUtils.join(file.content())
                .map(buffer -> {
                    byte[] bytes = new byte[buffer.readableByteCount()];
                    buffer.read(bytes);
                    DataBufferUtils.release(buffer);
                    return bytes;
                })
                .defaultIfEmpty(new byte[0])
                .map(bytes -> FileHandle.builder()
                        .fileName(file.filename())
                        .contentType(contentType == null ? null : contentType.toString())
                        .sizeBytes(bytes.length)
                        .content(bytes)
                        .build())
                .map(handle -> {
                    log.info("Attaching '{}' ({} bytes) to conversation {}", handle.getFileName(), handle.getSizeBytes(), conversationId);
                    Attachment attachment = conversationStore.attachFile(conversationId, handle);
                    return ResponseEntity.status(HttpStatus.ACCEPTED).body(attachment);
                });
    }

    @GetMapping("/attachments/{attachmentId}")
    public ResponseEntity<Attachment> getAttachment(@PathVariable String attachmentId) {
        return ResponseEntity.ok(conversationStore.getAttachment(attachmentId));
    }
}
