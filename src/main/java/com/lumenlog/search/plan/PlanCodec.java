package com.lumenlog.search.plan;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lumenlog.search.exception.PlanShapeViolationException;
import com.lumenlog.search.exception.SearchException;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Wire encoding of physical plans exchanged between coordinator and workers
 */
@Component
public class PlanCodec {

    private final ObjectMapper objectMapper = new ObjectMapper();

    public byte[] encode(PlanNode plan) {
        try {
            return objectMapper.writeValueAsBytes(plan);
        } catch (JsonProcessingException e) {
            throw new SearchException("Failed to encode plan: " + e.getMessage(), e);
        }
    }

    public PlanNode decode(byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            throw new PlanShapeViolationException("Empty physical plan");
        }
        try {
            return objectMapper.readValue(bytes, PlanNode.class);
        } catch (IOException e) {
            throw new PlanShapeViolationException("Failed to decode physical plan: " + e.getMessage(), e);
        }
    }
}
