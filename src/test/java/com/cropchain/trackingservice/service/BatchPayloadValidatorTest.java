package com.cropchain.trackingservice.service;

import com.cropchain.trackingservice.dto.request.CreateBatchRequest;
import com.cropchain.trackingservice.dto.request.UpdateBatchRequest;
import com.cropchain.trackingservice.exception.InvalidRequestException;
import com.cropchain.trackingservice.model.CropType;
import com.cropchain.trackingservice.model.Stage;
import com.cropchain.trackingservice.support.TestBatches;
import org.junit.jupiter.api.Test;

import java.util.Date;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BatchPayloadValidatorTest {

    private final BatchPayloadValidator validator = new BatchPayloadValidator(TestBatches.CLOCK);

    @Test
    void cropTypeIsMatchedCaseInsensitively() {
        CreateBatchRequest request = TestBatches.createRequest(10);
        request.setCropType("  Wheat ");

        assertThat(validator.validateNewBatch(request)).isEqualTo(CropType.WHEAT);
    }

    @Test
    void quantityBounds() {
        assertThat(validator.validateNewBatch(TestBatches.createRequest(1_000_000))).isEqualTo(CropType.RICE);

        assertThatThrownBy(() -> validator.validateNewBatch(TestBatches.createRequest(0)))
                .isInstanceOf(InvalidRequestException.class)
                .extracting("field").isEqualTo("quantity");
        assertThatThrownBy(() -> validator.validateNewBatch(TestBatches.createRequest(1_000_000.5)))
                .isInstanceOf(InvalidRequestException.class)
                .hasMessageContaining("1,000,000");
    }

    @Test
    void harvestDateMayNotBeInTheFuture() {
        CreateBatchRequest request = TestBatches.createRequest(10);
        request.setHarvestDate(Date.from(TestBatches.NOW.plusSeconds(60)));

        assertThatThrownBy(() -> validator.validateNewBatch(request))
                .isInstanceOf(InvalidRequestException.class)
                .extracting("field").isEqualTo("harvestDate");
    }

    @Test
    void originIsRequired() {
        CreateBatchRequest request = TestBatches.createRequest(10);
        request.setOrigin("   ");

        assertThatThrownBy(() -> validator.validateNewBatch(request))
                .isInstanceOf(InvalidRequestException.class)
                .extracting("field").isEqualTo("origin");
    }

    @Test
    void stageIsNormalized() {
        assertThat(validator.validateUpdate(TestBatches.updateRequest("TRANSPORT", "Warehouse A")))
                .isEqualTo(Stage.TRANSPORT);
        assertThat(validator.validateUpdate(TestBatches.updateRequest("Mandi", "Karnal")))
                .isEqualTo(Stage.MANDI);
    }

    @Test
    void unknownStageIsRejected() {
        assertThatThrownBy(() -> validator.validateUpdate(TestBatches.updateRequest("warehouse", "Karnal")))
                .isInstanceOf(InvalidRequestException.class)
                .hasMessageContaining("farmer, mandi, transport, retailer");
    }

    @Test
    void notesAreBounded() {
        UpdateBatchRequest request = TestBatches.updateRequest("retailer", "Delhi");
        request.setNotes("x".repeat(BatchPayloadValidator.MAX_NOTES_LENGTH + 1));

        assertThatThrownBy(() -> validator.validateUpdate(request))
                .isInstanceOf(InvalidRequestException.class)
                .extracting("field").isEqualTo("notes");
    }

    @Test
    void updateTimestampMayNotBeInTheFuture() {
        UpdateBatchRequest request = TestBatches.updateRequest("retailer", "Delhi");
        request.setTimestamp(Date.from(TestBatches.NOW.plusSeconds(3600)));

        assertThatThrownBy(() -> validator.validateUpdate(request))
                .isInstanceOf(InvalidRequestException.class)
                .extracting("field").isEqualTo("timestamp");
    }
}
