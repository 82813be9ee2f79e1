package com.example.shorturl.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

@Schema(description = "Short URL with its click statistics")
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class UrlResponse {
    @Schema(example = "aB3xY9")
    private String id;
    @JsonProperty("short_url")
    private String shortUrl;
    @JsonProperty("original_url")
    private String originalUrl;
    @Schema(description = "Public QR code endpoint for the short URL")
    @JsonProperty("qr_code_url")
    private String qrCodeUrl;
    private String description;
    @JsonProperty("expires_at")
    private Instant expiresAt;
    @JsonProperty("created_at")
    private Instant createdAt;
    @JsonProperty("updated_at")
    private Instant updatedAt;
    @JsonProperty("click_count")
    private long clickCount;
    @JsonProperty("is_active")
    private boolean active;
    @JsonProperty("last_accessed_at")
    private Instant lastAccessedAt;
}
