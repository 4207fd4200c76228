package com.cropchain.trackingservice.service;

import com.cropchain.trackingservice.dto.request.CreateBatchRequest;
import com.cropchain.trackingservice.dto.request.UpdateBatchRequest;
import com.cropchain.trackingservice.exception.InvalidRequestException;
import com.cropchain.trackingservice.model.CropType;
import com.cropchain.trackingservice.model.Stage;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Date;

/**
 * Re-checks the data model constraints inside the core, independently of the bean validation
 * applied at the HTTP boundary.
 */
@Component
@RequiredArgsConstructor
public class BatchPayloadValidator {

    static final double MAX_QUANTITY = 1_000_000d;
    static final int MAX_NOTES_LENGTH = 500;

    private final Clock clock;

    /**
     * @return the parsed crop type
     */
    public CropType validateNewBatch(CreateBatchRequest request) {
        CropType cropType = CropType.parse(request.getCropType())
                .orElseThrow(() -> new InvalidRequestException("cropType",
                        "Invalid crop type. Must be one of: " + CropType.allowedValues()));

        Double quantity = request.getQuantity();
        if (quantity == null || quantity.isNaN() || quantity <= 0) {
            throw new InvalidRequestException("quantity", "Quantity must be greater than 0.");
        }
        if (quantity > MAX_QUANTITY) {
            throw new InvalidRequestException("quantity", "Quantity cannot exceed 1,000,000.");
        }

        if (request.getHarvestDate() == null) {
            throw new InvalidRequestException("harvestDate", "Harvest date is required.");
        }
        if (isInFuture(request.getHarvestDate())) {
            throw new InvalidRequestException("harvestDate", "Harvest date cannot be in the future.");
        }

        requireText("origin", request.getOrigin(), 200);
        checkLength("farmerName", request.getFarmerName(), 100);
        checkLength("farmerAddress", request.getFarmerAddress(), 500);
        checkLength("certifications", request.getCertifications(), 500);
        checkLength("description", request.getDescription(), 1000);
        return cropType;
    }

    /**
     * @return the stage, normalized to its canonical form
     */
    public Stage validateUpdate(UpdateBatchRequest request) {
        Stage stage = Stage.parse(request.getStage())
                .orElseThrow(() -> new InvalidRequestException("stage",
                        "Stage must be one of: " + Stage.allowedValues()));

        requireText("actor", request.getActor(), 100);
        requireText("location", request.getLocation(), 200);
        checkLength("notes", request.getNotes(), MAX_NOTES_LENGTH);

        if (request.getTimestamp() != null && isInFuture(request.getTimestamp())) {
            throw new InvalidRequestException("timestamp", "Timestamp cannot be in the future.");
        }
        return stage;
    }

    private boolean isInFuture(Date date) {
        return date.toInstant().isAfter(clock.instant());
    }

    private static void requireText(String field, String value, int maxLength) {
        if (value == null || value.isBlank()) {
            throw new InvalidRequestException(field, field + " is required.");
        }
        checkLength(field, value, maxLength);
    }

    private static void checkLength(String field, String value, int maxLength) {
        if (value != null && value.length() > maxLength) {
            throw new InvalidRequestException(field, field + " cannot exceed " + maxLength + " characters.");
        }
    }
}
