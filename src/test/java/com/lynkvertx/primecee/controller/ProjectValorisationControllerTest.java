package com.lynkvertx.primecee.controller;

import com.lynkvertx.primecee.dto.ProjectCeeTotalsDTO;
import com.lynkvertx.primecee.dto.ProjectValorisationResultDTO;
import com.lynkvertx.primecee.service.ProjectValorisationService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import javax.persistence.EntityNotFoundException;
import java.util.ArrayList;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ProjectValorisationController.class)
class ProjectValorisationControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ProjectValorisationService valorisationService;

    private static ProjectValorisationResultDTO result() {
        return ProjectValorisationResultDTO.builder()
            .projectId(1L)
            .bonification(2)
            .entries(new ArrayList<>())
            .totals(new ProjectCeeTotalsDTO(20, 100, 100))
            .hasComputedTotals(true)
            .totalsDisplay("100,00 € (20 MWh)")
            .build();
    }

    @Test
    void valoriseStoredProject() throws Exception {
        when(valorisationService.calculateForProject(1L)).thenReturn(result());

        mockMvc.perform(get("/api/projects/1/cee-valorisation"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.code").value(200))
            .andExpect(jsonPath("$.data.totals.totalPrime").value(100.0))
            .andExpect(jsonPath("$.data.hasComputedTotals").value(true));
    }

    @Test
    void unknownProjectIsNotFound() throws Exception {
        when(valorisationService.calculateForProject(99L))
            .thenThrow(new EntityNotFoundException("Project not found with id: 99"));

        mockMvc.perform(get("/api/projects/99/cee-valorisation"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.code").value(404))
            .andExpect(jsonPath("$.message").value("Project not found with id: 99"));
    }

    @Test
    void valoriseSnapshot() throws Exception {
        when(valorisationService.evaluate(any())).thenReturn(result());

        String body = "{\"projectId\": 1, \"buildingType\": \"Maison individuelle\", \"delegatePriceEurPerMwh\": 5,"
            + " \"lines\": [{\"id\": 10, \"productId\": 3, \"quantity\": 1, \"dynamicParams\": {\"surface_isolee\": 40}}],"
            + " \"products\": [{\"id\": 3, \"code\": \"BAR-EN-101\", \"category\": \"isolation\"}]}";

        mockMvc.perform(post("/api/cee/valorisation").contentType(MediaType.APPLICATION_JSON).content(body))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.totalsDisplay").value("100,00 € (20 MWh)"));
    }

    @Test
    void invalidSnapshotIsRejected() throws Exception {
        String body = "{\"buildingType\": \"Maison\", \"lines\": [], \"products\": [{\"code\": \"BAR-EN-101\"}]}";

        mockMvc.perform(post("/api/cee/valorisation").contentType(MediaType.APPLICATION_JSON).content(body))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value(400))
            .andExpect(jsonPath("$.data['products[0].id']").value("Product id is required"));
        verifyNoInteractions(valorisationService);
    }

    @Test
    void malformedBodyIsRejected() throws Exception {
        mockMvc.perform(post("/api/cee/valorisation").contentType(MediaType.APPLICATION_JSON).content("{oops"))
            .andExpect(status().isBadRequest());
    }
}
