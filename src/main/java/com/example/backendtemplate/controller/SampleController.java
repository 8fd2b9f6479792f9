package com.example.backendtemplate.controller;

import com.example.backendtemplate.dto.*;
import com.example.backendtemplate.service.SampleEntityService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * REST API controller for sample entities.
 * <p>
 * Provides endpoints for:
 * - Creating and retrieving entities
 * - Paginated listing and searching
 * - Full and partial updates
 * - Soft and hard deletes
 */
@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/samples")
@Tag(name = "Samples", description = "CRUD operations for sample entities")
public class SampleController {

    private final SampleEntityService sampleEntityService;

    @PostMapping
    @Operation(summary = "Create a new sample entity", description = "Create a new sample entity with the provided data")
    public ResponseEntity<ApiResponse<SampleResponse>> create(@Valid @RequestBody CreateSampleRequest request) {
        log.info("API: Create sample entity with string field '{}'", request.getStringField());

        var response = sampleEntityService.create(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.success(response, "Sample entity created successfully"));
    }

    @GetMapping("/{entityId}")
    @Operation(summary = "Get sample entity by ID", description = "Retrieve an active sample entity by its UUID")
    public ResponseEntity<ApiResponse<SampleResponse>> get(@Parameter(description = "Entity UUID") @PathVariable UUID entityId) {
        return ResponseEntity.ok(ApiResponse.success(sampleEntityService.getById(entityId)));
    }

    @GetMapping
    @Operation(summary = "List sample entities", description = "Retrieve a paginated list of sample entities, newest first")
    public ResponseEntity<ApiResponse<SampleListResponse>> list(
            @Parameter(description = "Number of records to skip") @RequestParam(defaultValue = "0") @Min(0) long skip,
            @Parameter(description = "Maximum number of records to return")
            @RequestParam(defaultValue = "100") @Min(1) @Max(1000) int limit,
            @Parameter(description = "Include inactive and deleted entities")
            @RequestParam(defaultValue = "false") boolean includeInactive) {

        return ResponseEntity.ok(ApiResponse.success(sampleEntityService.list(skip, limit, includeInactive)));
    }

    @GetMapping("/search/by-string")
    @Operation(summary = "Search sample entities", description = "Case-insensitive search on the string field")
    public ResponseEntity<ApiResponse<List<SampleResponse>>> search(
            @Parameter(description = "Search term") @RequestParam @NotBlank String q,
            @Parameter(description = "Number of records to skip") @RequestParam(defaultValue = "0") @Min(0) long skip,
            @Parameter(description = "Maximum number of records to return")
            @RequestParam(defaultValue = "100") @Min(1) @Max(1000) int limit) {

        return ResponseEntity.ok(ApiResponse.success(sampleEntityService.searchByStringField(q, skip, limit)));
    }

    @PutMapping("/{entityId}")
    @Operation(summary = "Update sample entity", description = "Update an existing sample entity; only provided fields are changed")
    public ResponseEntity<ApiResponse<SampleResponse>> update(
            @Parameter(description = "Entity UUID") @PathVariable UUID entityId,
            @Valid @RequestBody UpdateSampleRequest request) {
        log.info("API: Update sample entity {}", entityId);

        var response = sampleEntityService.update(entityId, request);
        return ResponseEntity.ok(ApiResponse.success(response, "Sample entity updated successfully"));
    }

    @PatchMapping("/{entityId}")
    @Operation(summary = "Partially update sample entity", description = "Same as PUT: only provided fields are changed")
    public ResponseEntity<ApiResponse<SampleResponse>> patch(
            @Parameter(description = "Entity UUID") @PathVariable UUID entityId,
            @Valid @RequestBody UpdateSampleRequest request) {
        return update(entityId, request);
    }

    @DeleteMapping("/{entityId}")
    @Operation(summary = "Delete sample entity", description = "Soft delete by default; hardDelete=true removes the row")
    public ResponseEntity<ApiResponse<DeleteResponse>> delete(
            @Parameter(description = "Entity UUID") @PathVariable UUID entityId,
            @Parameter(description = "Permanently delete from database")
            @RequestParam(defaultValue = "false") boolean hardDelete) {
        log.info("API: Delete sample entity {} (hard={})", entityId, hardDelete);

        sampleEntityService.delete(entityId, hardDelete);

        var message = String.format("Sample entity %s successfully", hardDelete ? "permanently deleted" : "soft deleted");
        var response = DeleteResponse.builder().success(true).message(message).id(entityId).build();
        return ResponseEntity.ok(ApiResponse.success(response, message));
    }
}
