package com.libragraph.depot.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.libragraph.depot.core.query.Filter;
import com.libragraph.depot.core.query.InvalidFilterException;
import com.libragraph.depot.core.query.WhereParser;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.util.Map;

/**
 * Decodes JSON carried in query parameters and headers.
 */
@ApplicationScoped
public class RequestJson {

    private static final TypeReference<Map<String, Object>> DOCUMENT = new TypeReference<>() {};

    @Inject
    ObjectMapper mapper;

    public RequestJson() {
    }

    /** For use outside CDI. */
    public RequestJson(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /** A {@code where} parameter; absent means match-all. */
    public Filter where(String json) {
        if (json == null || json.isBlank()) {
            return Filter.all();
        }
        try {
            return WhereParser.parse(mapper.readValue(json, DOCUMENT));
        } catch (JsonProcessingException e) {
            throw new InvalidFilterException("Malformed where parameter: " + e.getOriginalMessage(), e);
        }
    }

    /** Custom metadata from the upload header or form field; absent means none. */
    public Map<String, Object> metadata(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return mapper.readValue(json, DOCUMENT);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed metadata: " + e.getOriginalMessage(), e);
        }
    }
}
