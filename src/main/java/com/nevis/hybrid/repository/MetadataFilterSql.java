package com.nevis.hybrid.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nevis.hybrid.exception.FilterException;
import com.nevis.hybrid.model.MetadataFilter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders a {@link MetadataFilter} as a parameterized jsonb predicate. Paths and values are always bound
 * as parameters; only fixed operator fragments end up in the SQL text.
 */
record MetadataFilterSql(String clause, Map<String, Object> params) {

    static MetadataFilterSql of(MetadataFilter filter, String alias, ObjectMapper objectMapper) {
        if (filter == null || filter.isEmpty()) {
            return new MetadataFilterSql("TRUE", Map.of());
        }

        List<String> predicates = new ArrayList<>();
        Map<String, Object> params = new LinkedHashMap<>();
        int index = 0;

        for (MetadataFilter.Condition condition : filter.conditions()) {
            String pathParam = "filterPath" + index;
            String valueParam = "filterValue" + index;
            String operator = switch (condition.operator()) {
                case EQUALS -> "=";
                case CONTAINS -> "@>";
            };

            predicates.add("%s.metadata #> string_to_array(:%s, '.') %s CAST(:%s AS jsonb)"
                .formatted(alias, pathParam, operator, valueParam));
            params.put(pathParam, condition.path());
            params.put(valueParam, toJson(condition, objectMapper));
            index++;
        }

        return new MetadataFilterSql(String.join(" AND ", predicates), params);
    }

    private static String toJson(MetadataFilter.Condition condition, ObjectMapper objectMapper) {
        try {
            return objectMapper.writeValueAsString(condition.value());
        } catch (JsonProcessingException e) {
            throw new FilterException("Filter value for '" + condition.path() + "' is not serializable: " + e.getMessage());
        }
    }
}
