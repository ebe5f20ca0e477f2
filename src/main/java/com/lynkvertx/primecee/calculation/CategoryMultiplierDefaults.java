package com.lynkvertx.primecee.calculation;

import com.lynkvertx.primecee.config.CeeCalculationConfig;
import com.lynkvertx.primecee.util.KeyNormalizer;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Category → default multiplier field mapping, and the rewrite of legacy
 * "quantity" multiplier keys onto it.
 */
@Component
@RequiredArgsConstructor
public class CategoryMultiplierDefaults {

    private final CeeCalculationConfig config;

    /**
     * Default dynamic param for the category ("isolation" → surface_isolee), or null.
     */
    public String defaultKey(String category) {
        String slug = KeyNormalizer.slug(category);
        if (slug.isEmpty()) {
            return null;
        }
        return config.getCategoryMultiplierKeys().get(slug);
    }

    public String defaultLabel(String category) {
        String slug = KeyNormalizer.slug(category);
        if (slug.isEmpty()) {
            return null;
        }
        return config.getCategoryMultiplierLabels().get(slug);
    }

    /**
     * Trim the configured key; legacy quantity keys become the category default
     * when there is one, else {@link MultiplierSentinels#LEGACY_QUANTITY_KEY}.
     *
     * @return the key to use, or null when nothing is configured
     */
    public String resolveKey(String rawKey, String category) {
        if (rawKey == null || rawKey.isBlank()) {
            return null;
        }
        if (MultiplierSentinels.isLegacyQuantityMultiplier(rawKey)) {
            String defaultKey = defaultKey(category);
            return defaultKey != null ? defaultKey : MultiplierSentinels.LEGACY_QUANTITY_KEY;
        }
        return rawKey.trim();
    }
}
