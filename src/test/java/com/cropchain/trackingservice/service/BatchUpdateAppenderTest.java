package com.cropchain.trackingservice.service;

import com.cropchain.trackingservice.dto.request.UpdateBatchRequest;
import com.cropchain.trackingservice.exception.BatchRecalledException;
import com.cropchain.trackingservice.exception.BatchUpdateException;
import com.cropchain.trackingservice.exception.InvalidRequestException;
import com.cropchain.trackingservice.model.BatchUpdate;
import com.cropchain.trackingservice.model.CropBatch;
import com.cropchain.trackingservice.model.Stage;
import com.cropchain.trackingservice.model.SyncStatus;
import com.cropchain.trackingservice.support.InMemoryFirestore;
import com.cropchain.trackingservice.support.TestBatches;
import com.cropchain.trackingservice.util.Timestamps;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Date;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BatchUpdateAppenderTest {

    private InMemoryFirestore store;
    private BatchUpdateAppender appender;
    private CropBatch batch;

    @BeforeEach
    void setUp() {
        store = new InMemoryFirestore();
        appender = new BatchUpdateAppender(store.firestore(), store.cropBatchRepository(),
                new BatchPayloadValidator(TestBatches.CLOCK), new Sha256IntegrityHasher(), TestBatches.CLOCK);
        batch = TestBatches.batch("CROP-2024-001", "F1");
        store.seed(batch);
    }

    @Test
    void appendsOneEntryAndAdvancesTheStage() {
        CropBatch updated = appender.appendUpdate(batch, TestBatches.updateRequest("Transport", "Warehouse A"));

        assertThat(updated.getUpdates()).hasSize(2);
        assertThat(updated.getCurrentStage()).isEqualTo(Stage.TRANSPORT);
        assertThat(updated.getUpdates().get(1).getLocation()).isEqualTo("Warehouse A");
        assertThat(updated.getSyncStatus()).isEqualTo(SyncStatus.PENDING);
        assertThat(updated.getIntegrityHash()).isNotEqualTo(batch.getIntegrityHash()).startsWith("0x");

        CropBatch stored = store.cropBatchRepository().findById("CROP-2024-001").orElseThrow();
        assertThat(stored.getUpdates()).hasSize(2);
        assertThat(stored.getCurrentStage()).isEqualTo(Stage.TRANSPORT);
    }

    @Test
    void leavesTheInputBatchUntouched() {
        appender.appendUpdate(batch, TestBatches.updateRequest("mandi", "Karnal"));

        assertThat(batch.getUpdates()).hasSize(1);
        assertThat(batch.getCurrentStage()).isEqualTo(Stage.FARMER);
    }

    @Test
    void anyStageMayFollowAnyOther() {
        CropBatch atRetailer = appender.appendUpdate(batch, TestBatches.updateRequest("retailer", "Delhi"));
        CropBatch backAtMandi = appender.appendUpdate(atRetailer, TestBatches.updateRequest("mandi", "Karnal"));

        assertThat(backAtMandi.getUpdates()).extracting(BatchUpdate::getStage)
                .containsExactly(Stage.FARMER, Stage.RETAILER, Stage.MANDI);
        assertThat(backAtMandi.getCurrentStage()).isEqualTo(Stage.MANDI);
    }

    @Test
    void timestampDefaultsToNowAndHonoursAnExplicitOne() {
        CropBatch first = appender.appendUpdate(batch, TestBatches.updateRequest("mandi", "Karnal"));
        assertThat(Timestamps.toInstant(first.getUpdates().get(1).getTimestamp())).isEqualTo(TestBatches.NOW);

        UpdateBatchRequest request = TestBatches.updateRequest("transport", "NH44");
        request.setTimestamp(Date.from(TestBatches.NOW.minusSeconds(3600)));
        CropBatch second = appender.appendUpdate(first, request);
        assertThat(Timestamps.toInstant(second.getUpdates().get(2).getTimestamp()))
                .isEqualTo(TestBatches.NOW.minusSeconds(3600));
    }

    @Test
    void invalidStageWritesNothing() {
        assertThatThrownBy(() -> appender.appendUpdate(batch, TestBatches.updateRequest("harbour", "Mumbai")))
                .isInstanceOf(InvalidRequestException.class);

        assertThat(store.cropBatchRepository().findById("CROP-2024-001").orElseThrow().getUpdates()).hasSize(1);
    }

    @Test
    void returnsTheStoredTimelineEvenFromAStaleSnapshot() {
        CropBatch staleA = batch.toBuilder().build();
        CropBatch staleB = batch.toBuilder().build();

        appender.appendUpdate(staleA, TestBatches.updateRequest("mandi", "Karnal"));
        CropBatch second = appender.appendUpdate(staleB, TestBatches.updateRequest("transport", "NH44"));

        CropBatch stored = store.cropBatchRepository().findById("CROP-2024-001").orElseThrow();
        assertThat(second.getUpdates()).hasSize(3);
        assertThat(second.getUpdates()).extracting(BatchUpdate::getUpdateId)
                .containsExactlyElementsOf(stored.getUpdates().stream().map(BatchUpdate::getUpdateId).collect(Collectors.toList()));
        assertThat(second.getCurrentStage()).isEqualTo(Stage.TRANSPORT);
    }

    @Test
    void batchRecalledSinceItWasReadIsNotUpdated() {
        store.seed(batch.toBuilder().recalled(true).build());

        assertThatThrownBy(() -> appender.appendUpdate(batch, TestBatches.updateRequest("retailer", "Delhi")))
                .isInstanceOf(BatchRecalledException.class);

        assertThat(store.cropBatchRepository().findById("CROP-2024-001").orElseThrow().getUpdates()).hasSize(1);
    }

    @Test
    void batchDeletedSinceItWasReadIsAnUpdateFailure() {
        CropBatch gone = TestBatches.batch("CROP-2024-777", "F1");

        assertThatThrownBy(() -> appender.appendUpdate(gone, TestBatches.updateRequest("mandi", "Karnal")))
                .isInstanceOf(BatchUpdateException.class)
                .hasMessageContaining("no longer exists");
    }

    @Test
    void storeFailureIsReportedAsUpdateFailure() {
        store.failNextAppend();

        assertThatThrownBy(() -> appender.appendUpdate(batch, TestBatches.updateRequest("mandi", "Karnal")))
                .isInstanceOf(BatchUpdateException.class)
                .hasMessageContaining("CROP-2024-001");
        assertThat(store.cropBatchRepository().findById("CROP-2024-001").orElseThrow().getUpdates()).hasSize(1);
    }
}
