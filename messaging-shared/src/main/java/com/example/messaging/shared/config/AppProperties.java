package com.example.messaging.shared.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Data
@Validated
public class AppProperties {

    private final Session session = new Session();
    private final Backend backend = new Backend();
    private final Upload upload = new Upload();
    private final Poll poll = new Poll();
    private final Reconciliation reconciliation = new Reconciliation();
    private final View view = new View();
    private final Sse sse = new Sse();

    @Data
    public static class Session {
        @NotBlank
        private String participantId = "director-001";
    }

    @Data
    public static class Backend {
        @NotNull
        private Duration timeout = Duration.ofSeconds(10);
        @Positive
        private int ioThreads = 4;
        private Duration simulatedLatency = Duration.ZERO;
        private boolean seedDemoData = true;
        @NotNull
        private Duration resubscribeBackoff = Duration.ofSeconds(2);
    }

    @Data
    public static class Upload {
        @Positive
        private long maxSizeBytes = 10L * 1024 * 1024;
        @Positive
        private int maxConcurrent = 4;
        @NotBlank
        private String bucket = "chat-attachments";
        @NotBlank
        private String publicBaseUrl = "http://localhost:8085/storage";
        @NotEmpty
        private List<String> allowedContentTypes = new ArrayList<>(List.of(
                "image/*",
                "audio/*",
                "application/pdf",
                "application/msword",
                "application/vnd.openxmlformats-officedocument.wordprocessingml.document",
                "text/plain"));
        private List<String> blockedExtensions = new ArrayList<>(List.of(
                ".exe", ".bat", ".cmd", ".com", ".pif", ".scr", ".vbs",
                ".js", ".jar", ".php", ".asp", ".aspx", ".jsp"));
    }

    @Data
    public static class Poll {
        @Min(2)
        private int minOptions = 2;
        @Min(2)
        private int maxOptions = 10;
    }

    @Data
    public static class Reconciliation {
        @NotNull
        private Duration timestampBucket = Duration.ofSeconds(5);
        @NotNull
        private Duration pendingFingerprintTtl = Duration.ofMinutes(10);
        @Positive
        private long pendingFingerprintMaxSize = 10_000L;
        /** Per conversation: ids of discarded or replaced messages, and discarded poll ids. */
        @Positive
        private long retiredIdMaxSize = 10_000L;
    }

    @Data
    public static class View {
        @Positive
        private int mobileBreakpoint = 768;
    }

    @Data
    public static class Sse {
        @Positive
        private long heartbeatInterval = 30000L;
    }
}
