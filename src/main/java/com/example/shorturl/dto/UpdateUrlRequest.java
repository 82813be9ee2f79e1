package com.example.shorturl.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Partial update; a null field is left unchanged.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateUrlRequest {
    @JsonProperty("original_url")
    private String originalUrl;

    private String description;

    @JsonProperty("expires_at")
    private Instant expiresAt;

    @Schema(description = "false deactivates the link, true restores it")
    @JsonProperty("is_active")
    private Boolean active;
}
