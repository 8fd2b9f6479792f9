package com.example.backendtemplate.controller;

import com.example.backendtemplate.config.CorsProperties;
import com.example.backendtemplate.dto.CreateSampleRequest;
import com.example.backendtemplate.dto.SampleListResponse;
import com.example.backendtemplate.dto.SampleResponse;
import com.example.backendtemplate.dto.UpdateSampleRequest;
import com.example.backendtemplate.exception.SampleEntityNotFoundException;
import com.example.backendtemplate.service.SampleEntityService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(controllers = {SampleController.class, HelloWorldController.class, HealthController.class})
@Import(CorsProperties.class)
@DisplayName("SampleController Tests")
class SampleControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private SampleEntityService sampleEntityService;

    private static SampleResponse sample(UUID id) {
        return SampleResponse.builder()
                .id(id)
                .requiredUuid(UUID.randomUUID())
                .stringField("Hello")
                .requiredJsonb(Map.of("key", "value"))
                .bigInt(1L)
                .active(true)
                .build();
    }

    @Nested
    @DisplayName("Create API")
    class CreateApiTests {

        @Test
        @DisplayName("Should create a sample entity")
        void shouldCreate() throws Exception {
            // Given
            var id = UUID.randomUUID();
            var request = CreateSampleRequest.builder()
                    .requiredUuid(UUID.randomUUID())
                    .stringField("Hello")
                    .requiredJsonb(Map.of("key", "value"))
                    .build();
            when(sampleEntityService.create(any())).thenReturn(sample(id));

            // When / Then
            mockMvc.perform(post("/api/v1/samples")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(objectMapper.writeValueAsString(request)))
                    .andExpect(status().isCreated())
                    .andExpect(jsonPath("$.success").value(true))
                    .andExpect(jsonPath("$.data.id").value(id.toString()))
                    .andExpect(jsonPath("$.data.stringField").value("Hello"));
        }

        @Test
        @DisplayName("Should reject a request without required fields")
        void shouldRejectInvalidRequest() throws Exception {
            mockMvc.perform(post("/api/v1/samples")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"stringField\": \"\"}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.success").value(false))
                    .andExpect(jsonPath("$.message").value("Validation failed"))
                    .andExpect(jsonPath("$.errors", hasSize(3)));

            verifyNoInteractions(sampleEntityService);
        }

        @Test
        @DisplayName("Should reject malformed JSON")
        void shouldRejectMalformedJson() throws Exception {
            mockMvc.perform(post("/api/v1/samples")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{not json"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.message").value("Malformed request body"));
        }
    }

    @Nested
    @DisplayName("Retrieval API")
    class RetrievalApiTests {

        @Test
        @DisplayName("Should return 404 for a missing entity")
        void shouldReturnNotFound() throws Exception {
            // Given
            var id = UUID.randomUUID();
            when(sampleEntityService.getById(id)).thenThrow(new SampleEntityNotFoundException(id));

            // When / Then
            mockMvc.perform(get("/api/v1/samples/{id}", id))
                    .andExpect(status().isNotFound())
                    .andExpect(jsonPath("$.success").value(false))
                    .andExpect(jsonPath("$.message").value("Sample entity with ID " + id + " not found"));
        }

        @Test
        @DisplayName("Should return 400 for a malformed id")
        void shouldRejectMalformedId() throws Exception {
            mockMvc.perform(get("/api/v1/samples/{id}", "not-a-uuid"))
                    .andExpect(status().isBadRequest());
        }

        @Test
        @DisplayName("Should list with default paging")
        void shouldListWithDefaults() throws Exception {
            // Given
            var page = SampleListResponse.builder()
                    .items(List.of(sample(UUID.randomUUID())))
                    .total(1)
                    .skip(0)
                    .limit(100)
                    .build();
            when(sampleEntityService.list(0, 100, false)).thenReturn(page);

            // When / Then
            mockMvc.perform(get("/api/v1/samples"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.items", hasSize(1)))
                    .andExpect(jsonPath("$.data.total").value(1))
                    .andExpect(jsonPath("$.data.limit").value(100));
        }

        @Test
        @DisplayName("Should reject a limit above 1000")
        void shouldRejectLimitTooLarge() throws Exception {
            mockMvc.perform(get("/api/v1/samples").param("limit", "1001"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.message").value("Validation failed"));

            verifyNoInteractions(sampleEntityService);
        }

        @Test
        @DisplayName("Should reject a negative skip")
        void shouldRejectNegativeSkip() throws Exception {
            mockMvc.perform(get("/api/v1/samples").param("skip", "-1"))
                    .andExpect(status().isBadRequest());
        }

        @Test
        @DisplayName("Should search by string")
        void shouldSearch() throws Exception {
            // Given
            when(sampleEntityService.searchByStringField("hel", 0, 100)).thenReturn(List.of(sample(UUID.randomUUID())));

            // When / Then
            mockMvc.perform(get("/api/v1/samples/search/by-string").param("q", "hel"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data", hasSize(1)));
        }

        @Test
        @DisplayName("Should require a search term")
        void shouldRequireSearchTerm() throws Exception {
            mockMvc.perform(get("/api/v1/samples/search/by-string"))
                    .andExpect(status().isBadRequest());
        }
    }

    @Nested
    @DisplayName("Update and Delete API")
    class UpdateDeleteApiTests {

        @Test
        @DisplayName("Should patch an entity")
        void shouldPatch() throws Exception {
            // Given
            var id = UUID.randomUUID();
            var response = sample(id);
            response.setStringField("Updated");
            when(sampleEntityService.update(eq(id), any(UpdateSampleRequest.class))).thenReturn(response);

            // When / Then
            mockMvc.perform(patch("/api/v1/samples/{id}", id)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"stringField\": \"Updated\"}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.stringField").value("Updated"));
        }

        @Test
        @DisplayName("Should answer 400 for an update without fields")
        void shouldRejectEmptyUpdate() throws Exception {
            // Given
            var id = UUID.randomUUID();
            when(sampleEntityService.update(eq(id), any(UpdateSampleRequest.class)))
                    .thenThrow(new IllegalArgumentException("No fields provided for update"));

            // When / Then
            mockMvc.perform(put("/api/v1/samples/{id}", id)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.message").value("No fields provided for update"));
        }

        @Test
        @DisplayName("Should soft delete by default")
        void shouldSoftDelete() throws Exception {
            var id = UUID.randomUUID();

            mockMvc.perform(delete("/api/v1/samples/{id}", id))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.success").value(true))
                    .andExpect(jsonPath("$.data.id").value(id.toString()))
                    .andExpect(jsonPath("$.data.message").value("Sample entity soft deleted successfully"));

            verify(sampleEntityService).delete(id, false);
        }

        @Test
        @DisplayName("Should hard delete on request")
        void shouldHardDelete() throws Exception {
            var id = UUID.randomUUID();

            mockMvc.perform(delete("/api/v1/samples/{id}", id).param("hardDelete", "true"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.message").value("Sample entity permanently deleted successfully"));

            verify(sampleEntityService).delete(id, true);
        }
    }

    @Nested
    @DisplayName("Utility Endpoints")
    class UtilityEndpointTests {

        @Test
        @DisplayName("Should report healthy")
        void shouldReportHealthy() throws Exception {
            mockMvc.perform(get("/health"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.status").value("healthy"))
                    .andExpect(jsonPath("$.service").value("backend-template"));
        }

        @Test
        @DisplayName("Should greet")
        void shouldSayHello() throws Exception {
            mockMvc.perform(get("/api/v1/hello-world"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data").value("Hello World"));
        }

        @Test
        @DisplayName("Should echo request ids")
        void shouldEchoRequestId() throws Exception {
            mockMvc.perform(get("/health").header("X-Request-ID", "req-123"))
                    .andExpect(header().string("X-Request-ID", "req-123"))
                    .andExpect(header().exists("X-Correlation-ID"));
        }

        @Test
        @DisplayName("Should put the request id in error responses")
        void shouldIncludeRequestIdInErrors() throws Exception {
            var id = UUID.randomUUID();
            when(sampleEntityService.getById(id)).thenThrow(new SampleEntityNotFoundException(id));

            mockMvc.perform(get("/api/v1/samples/{id}", id).header("X-Request-ID", "req-456"))
                    .andExpect(status().isNotFound())
                    .andExpect(jsonPath("$.requestId").value("req-456"));
        }

        @Test
        @DisplayName("Should answer CORS preflight requests")
        void shouldAllowCorsPreflight() throws Exception {
            mockMvc.perform(options("/api/v1/samples")
                            .header("Origin", "http://localhost:3000")
                            .header("Access-Control-Request-Method", "PATCH"))
                    .andExpect(status().isOk())
                    .andExpect(header().string("Access-Control-Allow-Origin", "http://localhost:3000"))
                    .andExpect(header().string("Access-Control-Allow-Credentials", "true"));
        }
    }
}
