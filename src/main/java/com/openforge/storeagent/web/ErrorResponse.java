package com.openforge.storeagent.web;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.time.Instant;
import java.util.Map;

@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
        String              code,
        String              message,
        Instant             timestamp,
        Map<String, Object> details
) {}
