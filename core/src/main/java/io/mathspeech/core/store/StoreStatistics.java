package io.mathspeech.core.store;

import io.mathspeech.core.model.Domain;
import io.mathspeech.core.model.ExpressionContext;
import io.mathspeech.core.model.PriorityTier;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Pattern counts of one store snapshot.
 *
 * @param total     number of patterns
 * @param enabled   number of enabled patterns
 * @param byDomain  count per domain (domains without patterns omitted)
 * @param byTier    count per priority tier
 * @param byContext count per declared applicability context
 */
public record StoreStatistics(
        int total,
        int enabled,
        Map<Domain, Integer> byDomain,
        Map<PriorityTier, Integer> byTier,
        Map<ExpressionContext, Integer> byContext) {

    public StoreStatistics {
        byDomain = byDomain.isEmpty() ? Map.of() : Collections.unmodifiableMap(new EnumMap<>(byDomain));
        byTier = byTier.isEmpty() ? Map.of() : Collections.unmodifiableMap(new EnumMap<>(byTier));
        byContext = byContext.isEmpty() ? Map.of() : Collections.unmodifiableMap(new EnumMap<>(byContext));
    }
}
