package com.lynkvertx.primecee.controller;

import com.lynkvertx.primecee.dto.ApiResponse;
import com.lynkvertx.primecee.dto.ProjectValorisationResultDTO;
import com.lynkvertx.primecee.dto.ProjectValorisationSnapshotDTO;
import com.lynkvertx.primecee.service.ProjectValorisationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import javax.validation.Valid;

/**
 * Prime CEE Valorisation REST Controller
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Tag(name = "CEE Valorisation", description = "Prime CEE valorisation of project product lines")
public class ProjectValorisationController {

    private final ProjectValorisationService valorisationService;

    @GetMapping("/projects/{projectId}/cee-valorisation")
    @Operation(summary = "Valorise project", description = "Compute the Prime CEE of every line of a stored project and the project totals")
    public ResponseEntity<ApiResponse<ProjectValorisationResultDTO>> valoriseProject(@PathVariable Long projectId) {
        ProjectValorisationResultDTO result = valorisationService.calculateForProject(projectId);
        return ResponseEntity.ok(ApiResponse.success("CEE valorisation completed", result));
    }

    @PostMapping("/cee/valorisation")
    @Operation(summary = "Valorise snapshot", description = "Compute the Prime CEE of a project snapshot posted in the request body")
    public ResponseEntity<ApiResponse<ProjectValorisationResultDTO>> valoriseSnapshot(
            @Valid @RequestBody ProjectValorisationSnapshotDTO snapshot) {
        ProjectValorisationResultDTO result = valorisationService.evaluate(snapshot);
        return ResponseEntity.ok(ApiResponse.success("CEE valorisation completed", result));
    }
}
