package com.nevis.hybrid.controller;

import com.nevis.hybrid.model.MetadataFilter;
import com.nevis.hybrid.model.MetadataValue;

import java.util.Map;

/**
 * JSON shape of a metadata filter: {@code {"equals": {"author.name": "Ann"}, "contains": {"tags": "ai"}}}.
 */
public record FilterRequest(
    Map<String, MetadataValue> equals,
    Map<String, MetadataValue> contains
) {
    public static MetadataFilter toFilter(FilterRequest request) {
        if (request == null) {
            return MetadataFilter.none();
        }
        MetadataFilter.Builder builder = MetadataFilter.builder();
        if (request.equals() != null) {
            request.equals().forEach(builder::equalTo);
        }
        if (request.contains() != null) {
            request.contains().forEach(builder::contains);
        }
        return builder.build();
    }
}
