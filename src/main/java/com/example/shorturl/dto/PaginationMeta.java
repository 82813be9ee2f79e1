package com.example.shorturl.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Paging state of a list response")
public record PaginationMeta(
        @JsonProperty("current_page") int currentPage,
        @JsonProperty("per_page") int perPage,
        @JsonProperty("total_pages") int totalPages,
        @JsonProperty("total_count") long totalCount,
        @JsonProperty("has_next") boolean hasNext,
        @JsonProperty("has_prev") boolean hasPrev
) {

    /** An empty result still reports one page. */
    public static PaginationMeta of(int page, int perPage, long totalCount) {
        int totalPages = (int) Math.max(1, (totalCount + perPage - 1) / perPage);
        return new PaginationMeta(page, perPage, totalPages, totalCount, page < totalPages, page > 1);
    }
}
