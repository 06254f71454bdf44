package com.anamnesis.pipeline;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

import com.anamnesis.worker.WorkerKind;

/**
 * Time bounds for one ingestion. Every checkout and call is further capped by what is left of
 * {@code overall}.
 */
public record IngestionLimits(Duration overall, Duration call, Map<WorkerKind, Duration> checkout) {

    public IngestionLimits {
        if (overall == null || overall.isNegative() || overall.isZero()) {
            throw new IllegalArgumentException("overall ingestion timeout must be positive");
        }
        call = call == null ? overall : call;
        checkout = checkout == null || checkout.isEmpty()
                ? Map.of()
                : Map.copyOf(new EnumMap<>(checkout));
    }

    public Duration checkoutFor(WorkerKind kind) {
        return checkout.getOrDefault(kind, overall);
    }
}
