package com.nevis.vendors.controller;

import com.nevis.vendors.config.PipelineProperties;
import com.nevis.vendors.exception.PermanentServiceException;
import com.nevis.vendors.model.ServiceType;
import com.nevis.vendors.model.VendorMatch;
import com.nevis.vendors.model.VendorSearchResult;
import com.nevis.vendors.service.VendorSearchService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(controllers = VendorSearchController.class, properties = {
    "app.gemini.api-key=fake-key-value-for-testing",
    "app.places.api-key=fake-key-value-for-testing",
    "app.pipeline.top-k=7"
})
@EnableConfigurationProperties(PipelineProperties.class)
class VendorSearchControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private VendorSearchService vendorSearchService;

    @Test
    @DisplayName("Should return ranked vendors with 200 OK")
    void search_ShouldReturnMatches() throws Exception {
        when(vendorSearchService.search("superhero birthday", "decorations", 3, true))
            .thenReturn(new VendorSearchResult("superhero birthday", "superhero party decorations", List.of(
                new VendorMatch("p1", 0.91, 1, List.of("decorations"), Map.of("name", "Balloon Bar"))
            )));

        mockMvc.perform(get("/vendors/search")
                .param("q", "superhero birthday")
                .param("category", "decorations")
                .param("k", "3"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.search_query").value("superhero party decorations"))
            .andExpect(jsonPath("$.matches[0].id").value("p1"))
            .andExpect(jsonPath("$.matches[0].rank").value(1))
            .andExpect(jsonPath("$.matches[0].metadata.name").value("Balloon Bar"));
    }

    @Test
    @DisplayName("Should use the configured top-k when k is absent")
    void search_ShouldDefaultK() throws Exception {
        when(vendorSearchService.search(eq("gala"), isNull(), eq(7), eq(false)))
            .thenReturn(new VendorSearchResult("gala", "gala", List.of()));

        mockMvc.perform(get("/vendors/search").param("q", "gala").param("optimize", "false"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.matches").isEmpty());
    }

    @Test
    @DisplayName("Should return 400 when 'q' is missing")
    void search_ShouldReturn400_WhenQueryIsMissing() throws Exception {
        mockMvc.perform(get("/vendors/search"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message").value("Parameter 'q' is missing"));
    }

    @Test
    @DisplayName("Should return 400 when k is out of range")
    void search_ShouldReturn400_WhenKIsInvalid() throws Exception {
        mockMvc.perform(get("/vendors/search").param("q", "gala").param("k", "0"))
            .andExpect(status().isBadRequest());

        verifyNoInteractions(vendorSearchService);
    }

    @Test
    @DisplayName("Should return 502 when the embedding service fails")
    void search_ShouldReturn502_WhenUpstreamFails() throws Exception {
        when(vendorSearchService.search(anyString(), any(), anyInt(), anyBoolean()))
            .thenThrow(new PermanentServiceException(ServiceType.EMBEDDING, "invalid key"));

        mockMvc.perform(get("/vendors/search").param("q", "gala"))
            .andExpect(status().isBadGateway())
            .andExpect(jsonPath("$.message").value("Upstream service embedding is unavailable"));
    }
}
