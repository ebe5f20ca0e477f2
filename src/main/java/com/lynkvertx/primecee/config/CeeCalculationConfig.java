package com.lynkvertx.primecee.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration properties for the Prime CEE valorisation engine.
 * Regulatory constants and category defaults are externalized here so that
 * catalog changes never require a code change.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "primecee.cee")
public class CeeCalculationConfig {

    /** Bonification applied when the organization has none (or a non-positive one) */
    private double defaultBonification = 2;

    /** kWh cumac → MWh cumac */
    private double mwhDivisor = 1000;

    /** Product codes starting with this prefix are helper products, never valorised */
    private String helperCodePrefix = "ECO";

    /**
     * Default multiplier field per CEE category (category slug → dynamic param name).
     * Used when a product still carries the legacy "quantity" multiplier.
     */
    private Map<String, String> categoryMultiplierKeys = defaultCategoryMultiplierKeys();

    /** Display labels for the default multiplier fields above */
    private Map<String, String> categoryMultiplierLabels = defaultCategoryMultiplierLabels();

    private Lighting lighting = new Lighting();

    @Data
    public static class Lighting {

        /** Category value (case-insensitive) that triggers the per-LED valorisation */
        private String category = "lighting";

        /**
         * Reference wattage of one LED for the lighting category.
         * No built-in default: it must be supplied by application.yml.
         */
        private Double defaultLedWatt;
    }

    private static Map<String, String> defaultCategoryMultiplierKeys() {
        Map<String, String> map = new LinkedHashMap<>();
        map.put("isolation", "surface_isolee");
        map.put("eclairage", "nombre_led");
        map.put("lighting", "nombre_led");
        return map;
    }

    private static Map<String, String> defaultCategoryMultiplierLabels() {
        Map<String, String> map = new LinkedHashMap<>();
        map.put("isolation", "Surface isolée");
        map.put("eclairage", "Nombre de LED");
        map.put("lighting", "Nombre de LED");
        return map;
    }
}
