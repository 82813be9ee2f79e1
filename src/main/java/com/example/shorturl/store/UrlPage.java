package com.example.shorturl.store;

import com.example.shorturl.model.UrlRecord;

import java.util.List;

public record UrlPage(List<UrlRecord> records, long totalCount) {
}
