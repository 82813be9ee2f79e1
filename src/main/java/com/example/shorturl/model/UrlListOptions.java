package com.example.shorturl.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class UrlListOptions {

    public static final int DEFAULT_PAGE = 1;
    public static final int DEFAULT_LIMIT = 20;
    public static final int MAX_LIMIT = 100;

    int page;
    int limit;
    SortField sort;
    SortOrder order;
    Boolean active;

    public static UrlListOptions of(Integer page, Integer limit, SortField sort, SortOrder order, Boolean active) {
        int p = page == null || page < 1 ? DEFAULT_PAGE : page;
        int l = limit == null || limit < 1 ? DEFAULT_LIMIT : Math.min(limit, MAX_LIMIT);
        return UrlListOptions.builder()
                .page(p)
                .limit(l)
                .sort(sort == null ? SortField.CREATED_AT : sort)
                .order(order == null ? SortOrder.DESC : order)
                .active(active)
                .build();
    }

    public long offset() {
        return (long) (page - 1) * limit;
    }
}
