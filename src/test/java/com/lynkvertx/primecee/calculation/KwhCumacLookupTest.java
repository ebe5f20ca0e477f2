package com.lynkvertx.primecee.calculation;

import com.lynkvertx.primecee.dto.KwhCumacEntryDTO;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class KwhCumacLookupTest {

    private final KwhCumacLookup lookup = new KwhCumacLookup();

    private static KwhCumacEntryDTO entry(String buildingType, Double kwhCumac) {
        return KwhCumacEntryDTO.builder().buildingType(buildingType).kwhCumac(kwhCumac).build();
    }

    @Test
    void matchesBuildingTypeIgnoringCaseAndSurroundingSpaces() {
        List<KwhCumacEntryDTO> entries = Arrays.asList(
            entry("Appartement", 900d),
            entry("Maison individuelle", 1600d));

        assertThat(lookup.find(entries, "  maison INDIVIDUELLE ")).isEqualTo(1600d);
    }

    @Test
    void firstPositiveMatchingRowWins() {
        List<KwhCumacEntryDTO> entries = Arrays.asList(
            entry("Maison", 0d),
            entry("Maison", null),
            entry("Maison", 1200d),
            entry("Maison", 1500d));

        assertThat(lookup.find(entries, "Maison")).isEqualTo(1200d);
    }

    @Test
    void missingWhenNoExactMatchOrBlankBuildingType() {
        List<KwhCumacEntryDTO> entries = Arrays.asList(entry("Maison individuelle", 1600d));

        assertThat(lookup.find(entries, "Maison")).isNull();
        assertThat(lookup.find(entries, "  ")).isNull();
        assertThat(lookup.find(entries, null)).isNull();
        assertThat(lookup.find(null, "Maison individuelle")).isNull();
    }
}
