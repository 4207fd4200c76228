package com.cropchain.trackingservice.controller;

import com.cropchain.trackingservice.dto.request.CreateBatchRequest;
import com.cropchain.trackingservice.dto.request.UpdateBatchRequest;
import com.cropchain.trackingservice.dto.response.BatchListResponse;
import com.cropchain.trackingservice.dto.response.BatchResponse;
import com.cropchain.trackingservice.dto.response.RecallResponse;
import com.cropchain.trackingservice.dto.response.TimelineResponse;
import com.cropchain.trackingservice.model.CropBatch;
import com.cropchain.trackingservice.security.SecurityUtils;
import com.cropchain.trackingservice.service.BatchCreationService;
import com.cropchain.trackingservice.service.BatchQueryService;
import com.cropchain.trackingservice.service.BatchRecallService;
import com.cropchain.trackingservice.service.BatchUpdateService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/batches")
@RequiredArgsConstructor
@Tag(name = "Batch Tracking", description = "APIs for creating crop batches and recording their journey through the supply chain")
public class BatchController {

    private final BatchCreationService batchCreationService;
    private final BatchUpdateService batchUpdateService;
    private final BatchRecallService batchRecallService;
    private final BatchQueryService batchQueryService;

    @Operation(
            summary = "Create a new batch",
            description = "Registers a harvest owned by the authenticated caller and issues its CROP-<year>-<seq> identifier.",
            responses = {
                    @ApiResponse(responseCode = "201", description = "Batch created successfully",
                            content = @Content(mediaType = "application/json", schema = @Schema(implementation = BatchResponse.class))),
                    @ApiResponse(responseCode = "400", description = "Invalid request body"),
                    @ApiResponse(responseCode = "401", description = "Unauthorized"),
                    @ApiResponse(responseCode = "500", description = "No unique identifier could be allocated")
            }
    )
    @SecurityRequirement(name = "bearerAuth")
    @PostMapping
    public ResponseEntity<BatchResponse> createBatch(@Valid @RequestBody CreateBatchRequest request) {
        CropBatch batch = batchCreationService.createBatch(SecurityUtils.getCaller(), request);
        return ResponseEntity.status(HttpStatus.CREATED).body(BatchResponse.from(batch));
    }

    @Operation(summary = "List batches", description = "Lists batches newest first with summary statistics. Public.")
    @GetMapping
    public ResponseEntity<BatchListResponse> listBatches(
            @Parameter(description = "Only return batches owned by this farmer")
            @RequestParam(required = false) String farmerId) {
        return ResponseEntity.ok(batchQueryService.listBatches(farmerId));
    }

    @Operation(
            summary = "Get a batch by its identifier",
            description = "Used by the public tracking page and QR scans.",
            responses = {
                    @ApiResponse(responseCode = "200", description = "Batch found",
                            content = @Content(mediaType = "application/json", schema = @Schema(implementation = BatchResponse.class))),
                    @ApiResponse(responseCode = "404", description = "Batch not found")
            }
    )
    @GetMapping("/{batchId}")
    public ResponseEntity<BatchResponse> getBatch(@PathVariable String batchId) {
        return ResponseEntity.ok(BatchResponse.from(batchQueryService.getByIdentifier(batchId)));
    }

    @Operation(summary = "Get the supply-chain timeline of a batch")
    @GetMapping("/{batchId}/timeline")
    public ResponseEntity<TimelineResponse> getTimeline(@PathVariable String batchId) {
        return ResponseEntity.ok(TimelineResponse.of(batchId, batchQueryService.getTimeline(batchId)));
    }

    @Operation(
            summary = "Append a supply-chain update",
            description = "Records the next stage of a batch. Only the batch owner or an admin may update it.",
            responses = {
                    @ApiResponse(responseCode = "200", description = "Update recorded"),
                    @ApiResponse(responseCode = "400", description = "Invalid request body"),
                    @ApiResponse(responseCode = "403", description = "Forbidden - Caller does not own the batch"),
                    @ApiResponse(responseCode = "404", description = "Batch not found"),
                    @ApiResponse(responseCode = "409", description = "Batch has been recalled")
            }
    )
    @SecurityRequirement(name = "bearerAuth")
    @PutMapping("/{batchId}")
    public ResponseEntity<BatchResponse> updateBatch(
            @PathVariable String batchId,
            @Valid @RequestBody UpdateBatchRequest request) {
        CropBatch updated = batchUpdateService.updateBatch(SecurityUtils.getCaller(), batchId, request);
        return ResponseEntity.ok(BatchResponse.from(updated));
    }

    @Operation(
            summary = "Recall a batch",
            description = "Marks a batch as recalled. One-way. Requires the admin role.",
            responses = {
                    @ApiResponse(responseCode = "200", description = "Batch recalled"),
                    @ApiResponse(responseCode = "403", description = "Forbidden - User does not have required role"),
                    @ApiResponse(responseCode = "404", description = "Batch not found"),
                    @ApiResponse(responseCode = "409", description = "Batch was already recalled")
            }
    )
    @SecurityRequirement(name = "bearerAuth")
    @PostMapping("/{batchId}/recall")
    @PreAuthorize("hasAuthority('admin')")
    public ResponseEntity<RecallResponse> recallBatch(@PathVariable String batchId) {
        CropBatch recalled = batchRecallService.recall(batchId, SecurityUtils.getCaller());
        return ResponseEntity.ok(RecallResponse.from(recalled));
    }
}
