package com.cropchain.trackingservice.dto.response;

import com.cropchain.trackingservice.model.BatchUpdate;
import com.cropchain.trackingservice.model.CropBatch;
import com.cropchain.trackingservice.model.CropType;
import com.cropchain.trackingservice.model.Stage;
import com.cropchain.trackingservice.model.SyncStatus;
import com.cropchain.trackingservice.util.Timestamps;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Data;

import java.util.Collections;
import java.util.Date;
import java.util.List;
import java.util.stream.Collectors;

/**
 * The client view of a batch, including its full timeline.
 */
@Data
@Builder
public class BatchResponse {
    private String batchId;

    // --- Owner ---
    private String farmerId;
    private String farmerName;
    private String farmerAddress;

    // --- Produce ---
    private CropType cropType;
    private double quantity;
    private Date harvestDate;
    private String origin;
    private String certifications;
    private String description;

    // --- State ---
    private Stage currentStage;
    @JsonProperty("isRecalled")
    private boolean recalled;
    private String recalledBy;
    private Date recalledAt;

    private String qrCode;
    private String integrityHash;
    private SyncStatus syncStatus;

    private List<UpdateEntry> updates;
    private Date createdAt;
    private Date updatedAt;

    @Data
    @Builder
    public static class UpdateEntry {
        private String updateId;
        private Stage stage;
        private String actor;
        private String location;
        private Date timestamp;
        private String notes;

        public static UpdateEntry from(BatchUpdate update) {
            return UpdateEntry.builder()
                    .updateId(update.getUpdateId())
                    .stage(update.getStage())
                    .actor(update.getActor())
                    .location(update.getLocation())
                    .timestamp(Timestamps.toDate(update.getTimestamp()))
                    .notes(update.getNotes())
                    .build();
        }
    }

    public static BatchResponse from(CropBatch batch) {
        List<UpdateEntry> entries = batch.getUpdates() == null
                ? Collections.emptyList()
                : batch.getUpdates().stream().map(UpdateEntry::from).collect(Collectors.toList());

        return BatchResponse.builder()
                .batchId(batch.getBatchId())
                .farmerId(batch.getFarmerId())
                .farmerName(batch.getFarmerName())
                .farmerAddress(batch.getFarmerAddress())
                .cropType(batch.getCropType())
                .quantity(batch.getQuantity())
                .harvestDate(Timestamps.toDate(batch.getHarvestDate()))
                .origin(batch.getOrigin())
                .certifications(batch.getCertifications())
                .description(batch.getDescription())
                .currentStage(batch.getCurrentStage())
                .recalled(batch.isRecalled())
                .recalledBy(batch.getRecalledBy())
                .recalledAt(Timestamps.toDate(batch.getRecalledAt()))
                .qrCode(batch.getQrCode())
                .integrityHash(batch.getIntegrityHash())
                .syncStatus(batch.getSyncStatus())
                .updates(entries)
                .createdAt(Timestamps.toDate(batch.getCreatedAt()))
                .updatedAt(Timestamps.toDate(batch.getUpdatedAt()))
                .build();
    }
}
