package com.lynkvertx.primecee.calculation;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of the multiplier resolution of one product line
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MultiplierResolution {

    /** Positive multiplier, or null when it could not be determined */
    private Double value;

    /** Display label of the multiplier ("Surface isolée × 2", "Quantité"...) */
    private String label;

    /** The configured field has no usable value: a data-entry warning, not a failure */
    private boolean missingDynamicParams;

    private Source source;

    public enum Source {
        SCHEMA_FIELD,
        FORMULA,
        QUANTITY,
        NONE
    }

    public boolean isResolved() {
        return value != null && value > 0;
    }

    static MultiplierResolution none() {
        return MultiplierResolution.builder().source(Source.NONE).build();
    }
}
