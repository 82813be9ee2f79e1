package com.example.shorturl.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Schema(description = "Short URL to create")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateUrlRequest {
    @Schema(description = "http or https URL to redirect to", example = "https://example.com/some/long/path",
            requiredMode = Schema.RequiredMode.REQUIRED)
    @NotBlank
    @JsonProperty("original_url")
    private String originalUrl;

    @Schema(description = "3 to 50 letters, digits or hyphens", example = "my-link")
    @JsonProperty("custom_id")
    private String customId;

    @Schema(description = "Must lie in the future")
    @JsonProperty("expires_at")
    private Instant expiresAt;

    private String description;
}
