package com.lynkvertx.primecee.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One field descriptor of a product's params schema
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ParamsSchemaField {

    /** Stable field name, also the key used in a line's dynamic params */
    private String name;

    /** Human-readable label (optional) */
    private String label;

    /** Display unit, e.g. "m²" (optional) */
    private String unit;
}
