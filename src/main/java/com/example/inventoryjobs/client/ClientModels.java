package com.example.inventoryjobs.client;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Request/Response DTOs for external service clients
 */
public class ClientModels {
    private ClientModels() {
    }

    // === Mail API Models ===

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SendEmailRequest {
        private String from;
        private List<String> to;
        private String subject;
        private String html;
        private String text;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SendEmailResponse {
        private String id;
    }
}
