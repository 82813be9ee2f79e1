package com.example.shorturl.dto;

import java.util.List;

public record UrlListResponse(List<UrlResponse> urls, PaginationMeta pagination) {
}
