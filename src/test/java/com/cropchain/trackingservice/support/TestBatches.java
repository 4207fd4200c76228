package com.cropchain.trackingservice.support;

import com.cropchain.trackingservice.config.BatchProperties;
import com.cropchain.trackingservice.dto.request.CreateBatchRequest;
import com.cropchain.trackingservice.dto.request.UpdateBatchRequest;
import com.cropchain.trackingservice.model.BatchUpdate;
import com.cropchain.trackingservice.model.CropBatch;
import com.cropchain.trackingservice.model.CropType;
import com.cropchain.trackingservice.model.Stage;
import com.cropchain.trackingservice.security.CallerIdentity;
import com.cropchain.trackingservice.util.Timestamps;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;

/**
 * Fixtures shared by the service tests.
 */
public final class TestBatches {

    public static final Instant NOW = Instant.parse("2024-06-15T10:00:00Z");
    public static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    private TestBatches() {
    }

    public static BatchProperties properties() {
        BatchProperties properties = new BatchProperties();
        properties.getBatch().setIdYear(2024);
        return properties;
    }

    public static CallerIdentity farmer(String farmerId) {
        return CallerIdentity.builder().userId("user-" + farmerId).farmerId(farmerId).role("farmer").build();
    }

    public static CallerIdentity admin() {
        return CallerIdentity.builder().userId("admin-1").role(CallerIdentity.ROLE_ADMIN).email("admin@cropchain.test").build();
    }

    public static CreateBatchRequest createRequest(double quantity) {
        CreateBatchRequest request = new CreateBatchRequest();
        request.setFarmerName("Ravi Kumar");
        request.setCropType("rice");
        request.setQuantity(quantity);
        request.setHarvestDate(Date.from(NOW.minusSeconds(86_400)));
        request.setOrigin("Punjab");
        return request;
    }

    public static UpdateBatchRequest updateRequest(String stage, String location) {
        UpdateBatchRequest request = new UpdateBatchRequest();
        request.setStage(stage);
        request.setActor("Logistics Co");
        request.setLocation(location);
        return request;
    }

    public static CropBatch batch(String batchId, String farmerId) {
        List<BatchUpdate> updates = new ArrayList<>();
        updates.add(BatchUpdate.builder()
                .updateId("initial")
                .stage(Stage.FARMER)
                .actor("Ravi Kumar")
                .location("Punjab")
                .timestamp(Timestamps.of(NOW.minusSeconds(86_400)))
                .build());
        return CropBatch.builder()
                .batchId(batchId)
                .farmerId(farmerId)
                .cropType(CropType.RICE)
                .quantity(100)
                .origin("Punjab")
                .currentStage(Stage.FARMER)
                .updates(updates)
                .createdAt(Timestamps.of(NOW))
                .updatedAt(Timestamps.of(NOW))
                .build();
    }
}
