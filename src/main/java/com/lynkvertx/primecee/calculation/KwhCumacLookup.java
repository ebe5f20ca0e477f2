package com.lynkvertx.primecee.calculation;

import com.lynkvertx.primecee.dto.KwhCumacEntryDTO;
import com.lynkvertx.primecee.util.KeyNormalizer;
import com.lynkvertx.primecee.util.NumericCoercion;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Finds the kWh cumac reference of a product for the project's building type.
 * Exact (normalized) match only: a typology with no row is reported missing.
 */
@Component
public class KwhCumacLookup {

    /**
     * @return the first positive kWh cumac whose building type matches, or null when missing
     */
    public Double find(List<KwhCumacEntryDTO> entries, String buildingType) {
        String wanted = KeyNormalizer.normalizeKey(buildingType);
        if (wanted.isEmpty() || entries == null) {
            return null;
        }
        for (KwhCumacEntryDTO entry : entries) {
            if (entry == null || !KeyNormalizer.normalizeKey(entry.getBuildingType()).equals(wanted)) {
                continue;
            }
            Double value = NumericCoercion.toPositiveNumber(entry.getKwhCumac());
            if (value != null) {
                return value;
            }
        }
        return null;
    }
}
