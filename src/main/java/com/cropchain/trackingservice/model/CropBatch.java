package com.cropchain.trackingservice.model;

import com.google.cloud.Timestamp;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A tracked unit of harvested produce together with its full supply-chain history.
 * <p>
 * Stored in the {@code batches} collection with {@link #batchId} as the document id, so the
 * id is unique by construction. The timeline is embedded so a single read returns a batch and
 * its history consistently. Ownership is a plain {@link #farmerId} string.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class CropBatch {
    private String batchId;

    // --- Owner ---
    private String farmerId;
    private String farmerName;
    private String farmerAddress;

    // --- Produce ---
    private CropType cropType;
    private double quantity;
    private Timestamp harvestDate;
    private String origin;
    private String certifications;
    private String description;

    // --- Supply chain state ---
    private Stage currentStage;
    private boolean recalled;
    private String recalledBy;
    private Timestamp recalledAt;

    // --- Opaque artifacts supplied by collaborators ---
    private String qrCode;
    private String integrityHash;
    private SyncStatus syncStatus;

    @Builder.Default
    private List<BatchUpdate> updates = new ArrayList<>();

    private Timestamp createdAt;
    private Timestamp updatedAt;
}
