package com.example.shorturl.controller;

import com.example.shorturl.config.ApiKeyInterceptor;
import com.example.shorturl.config.OpenApiConfig;
import com.example.shorturl.config.ShortUrlProperties;
import com.example.shorturl.dto.CreateUrlRequest;
import com.example.shorturl.dto.UpdateUrlRequest;
import com.example.shorturl.dto.UrlListResponse;
import com.example.shorturl.dto.UrlResponse;
import com.example.shorturl.exception.ValidationException;
import com.example.shorturl.model.ClickContext;
import com.example.shorturl.model.SortField;
import com.example.shorturl.model.SortOrder;
import com.example.shorturl.model.UrlListOptions;
import com.example.shorturl.ratelimit.RateLimitInterceptor;
import com.example.shorturl.service.UrlService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.Map;

@Tag(name = "Short URLs", description = "Create, manage and resolve short links")
@RestController
@RequiredArgsConstructor
public class UrlController {

    private static final String REDIRECT_CACHE_CONTROL = "public, max-age=300";

    private final UrlService urlService;
    private final ShortUrlProperties properties;

    @Operation(summary = "Liveness check")
    @GetMapping("/health")
    public ResponseEntity<Map<String, String>> health() {
        return ResponseEntity.ok(Map.of("status", "ok"));
    }

    @Operation(summary = "Create a short URL", description = "Allocates a random id unless custom_id is given.",
            security = @SecurityRequirement(name = OpenApiConfig.API_KEY_SCHEME))
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Short URL created"),
            @ApiResponse(responseCode = "400", description = "Invalid URL, custom id, expiry or description"),
            @ApiResponse(responseCode = "401", description = "Missing or unknown API key"),
            @ApiResponse(responseCode = "409", description = "Custom id already taken")
    })
    @PostMapping("/api/v1/urls")
    public ResponseEntity<UrlResponse> create(
            @Parameter(hidden = true) @RequestAttribute(ApiKeyInterceptor.OWNER_KEY_ATTRIBUTE) String ownerKey,
            @Valid @RequestBody CreateUrlRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(urlService.create(request, ownerKey));
    }

    @Operation(summary = "Get statistics for an owned short URL",
            security = @SecurityRequirement(name = OpenApiConfig.API_KEY_SCHEME))
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Record with click statistics"),
            @ApiResponse(responseCode = "401", description = "Missing key or not the owner"),
            @ApiResponse(responseCode = "404", description = "Unknown short URL")
    })
    @GetMapping("/api/v1/urls/{id}")
    public ResponseEntity<UrlResponse> getStats(
            @Parameter(hidden = true) @RequestAttribute(ApiKeyInterceptor.OWNER_KEY_ATTRIBUTE) String ownerKey,
            @Parameter(description = "Short URL id", required = true) @PathVariable("id") String id) {
        return ResponseEntity.ok(urlService.getStats(id, ownerKey));
    }

    @Operation(summary = "List the caller's short URLs",
            security = @SecurityRequirement(name = OpenApiConfig.API_KEY_SCHEME))
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "One page of records"),
            @ApiResponse(responseCode = "400", description = "Invalid sort or order"),
            @ApiResponse(responseCode = "401", description = "Missing or unknown API key")
    })
    @GetMapping("/api/v1/urls")
    public ResponseEntity<UrlListResponse> list(
            @Parameter(hidden = true) @RequestAttribute(ApiKeyInterceptor.OWNER_KEY_ATTRIBUTE) String ownerKey,
            @Parameter(description = "Page number, from 1") @RequestParam(value = "page", required = false) Integer page,
            @Parameter(description = "Page size, at most 100") @RequestParam(value = "limit", required = false) Integer limit,
            @Parameter(description = "created_at, click_count or last_accessed_at")
            @RequestParam(value = "sort", required = false) String sort,
            @Parameter(description = "asc or desc") @RequestParam(value = "order", required = false) String order,
            @Parameter(description = "Filter on the active flag")
            @RequestParam(value = "is_active", required = false) Boolean active) {

        UrlListOptions options = UrlListOptions.of(page, limit, parseSort(sort), parseOrder(order), active);
        return ResponseEntity.ok(urlService.list(ownerKey, options));
    }

    @Operation(summary = "Update an owned short URL", description = "Fields left out of the body are unchanged.",
            security = @SecurityRequirement(name = OpenApiConfig.API_KEY_SCHEME))
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Updated record"),
            @ApiResponse(responseCode = "400", description = "Invalid URL or description"),
            @ApiResponse(responseCode = "401", description = "Missing key or not the owner"),
            @ApiResponse(responseCode = "404", description = "Unknown short URL")
    })
    @PutMapping("/api/v1/urls/{id}")
    public ResponseEntity<UrlResponse> update(
            @Parameter(hidden = true) @RequestAttribute(ApiKeyInterceptor.OWNER_KEY_ATTRIBUTE) String ownerKey,
            @Parameter(description = "Short URL id", required = true) @PathVariable("id") String id,
            @Valid @RequestBody UpdateUrlRequest request) {
        return ResponseEntity.ok(urlService.update(id, request, ownerKey));
    }

    @Operation(summary = "Deactivate an owned short URL",
            security = @SecurityRequirement(name = OpenApiConfig.API_KEY_SCHEME))
    @ApiResponses({
            @ApiResponse(responseCode = "204", description = "Deactivated"),
            @ApiResponse(responseCode = "401", description = "Missing key or not the owner"),
            @ApiResponse(responseCode = "404", description = "Unknown short URL")
    })
    @DeleteMapping("/api/v1/urls/{id}")
    public ResponseEntity<Void> delete(
            @Parameter(hidden = true) @RequestAttribute(ApiKeyInterceptor.OWNER_KEY_ATTRIBUTE) String ownerKey,
            @Parameter(description = "Short URL id", required = true) @PathVariable("id") String id) {
        urlService.delete(id, ownerKey);
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "Redirect to a QR code image for the short URL")
    @ApiResponses({
            @ApiResponse(responseCode = "301", description = "Redirect to the QR generator"),
            @ApiResponse(responseCode = "404", description = "Unknown or inactive short URL"),
            @ApiResponse(responseCode = "410", description = "Short URL expired")
    })
    @GetMapping("/api/v1/urls/{id}/qr")
    public ResponseEntity<Void> qrCode(
            @Parameter(description = "Short URL id", required = true) @PathVariable("id") String id,
            @Parameter(description = "Edge length in pixels, 50 to 1000")
            @RequestParam(value = "size", required = false) String size) {
        UrlResponse url = urlService.resolve(id);
        int pixels = qrSize(size);
        URI qrUri = UriComponentsBuilder.fromHttpUrl(properties.getQr().getGeneratorUrl())
                .queryParam("size", pixels + "x" + pixels)
                .queryParam("data", url.getShortUrl())
                .encode()
                .build()
                .toUri();
        return ResponseEntity.status(HttpStatus.MOVED_PERMANENTLY).location(qrUri).build();
    }

    @Operation(summary = "Redirect to the original URL")
    @ApiResponses({
            @ApiResponse(responseCode = "301", description = "Redirect to the original URL"),
            @ApiResponse(responseCode = "404", description = "Unknown or inactive short URL"),
            @ApiResponse(responseCode = "410", description = "Short URL expired")
    })
    @GetMapping("/{id}")
    public ResponseEntity<Void> redirect(
            @Parameter(description = "Short URL id", required = true) @PathVariable("id") String id,
            HttpServletRequest request) {
        ClickContext context = new ClickContext(
                RateLimitInterceptor.clientIp(request),
                request.getHeader(HttpHeaders.USER_AGENT),
                request.getHeader(HttpHeaders.REFERER));
        UrlResponse url = urlService.resolveForRedirect(id, context);
        return ResponseEntity.status(HttpStatus.MOVED_PERMANENTLY)
                .header(HttpHeaders.CACHE_CONTROL, REDIRECT_CACHE_CONTROL)
                .location(URI.create(url.getOriginalUrl()))
                .build();
    }

    int qrSize(String size) {
        ShortUrlProperties.Qr qr = properties.getQr();
        if (size == null) {
            return qr.getDefaultSize();
        }
        try {
            int parsed = Integer.parseInt(size.trim());
            return parsed < qr.getMinSize() || parsed > qr.getMaxSize() ? qr.getDefaultSize() : parsed;
        } catch (NumberFormatException e) {
            return qr.getDefaultSize();
        }
    }

    private static SortField parseSort(String sort) {
        if (sort == null || sort.isBlank()) {
            return null;
        }
        try {
            return SortField.fromApiName(sort.trim());
        } catch (IllegalArgumentException e) {
            throw new ValidationException("sort", "sort must be one of created_at, click_count, last_accessed_at");
        }
    }

    private static SortOrder parseOrder(String order) {
        if (order == null || order.isBlank()) {
            return null;
        }
        try {
            return SortOrder.fromApiName(order.trim());
        } catch (IllegalArgumentException e) {
            throw new ValidationException("order", "order must be asc or desc");
        }
    }
}
