package com.openforge.storeagent.routing.dto;

import java.util.Map;

public record StoreStatsResponse(
        long              totalExamples,
        long              learnedExamples,
        long              curatedExamples,
        Map<String, Long> examplesPerDomain
) {}
