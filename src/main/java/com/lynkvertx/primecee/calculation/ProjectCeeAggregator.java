package com.lynkvertx.primecee.calculation;

import com.lynkvertx.primecee.dto.PrimeCeeResultDTO;
import com.lynkvertx.primecee.dto.ProjectCeeTotalsDTO;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Objects;

/**
 * Folds per-line valorisations into project totals. Null results are skipped.
 */
@Component
public class ProjectCeeAggregator {

    public ProjectCeeTotalsDTO computeProjectCeeTotals(List<PrimeCeeResultDTO> results) {
        ProjectCeeTotalsDTO totals = new ProjectCeeTotalsDTO(0, 0, 0);
        if (results == null) {
            return totals;
        }
        results.stream()
            .filter(Objects::nonNull)
            .forEach(result -> {
                totals.setTotalValorisationMwh(totals.getTotalValorisationMwh() + result.getValorisationTotalMwh());
                totals.setTotalValorisationEur(totals.getTotalValorisationEur() + result.getValorisationTotalEur());
                totals.setTotalPrime(totals.getTotalPrime() + result.getTotalPrime());
            });
        return totals;
    }
}
