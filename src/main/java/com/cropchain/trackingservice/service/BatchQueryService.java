package com.cropchain.trackingservice.service;

import com.cropchain.trackingservice.dto.response.BatchListResponse;
import com.cropchain.trackingservice.dto.response.BatchResponse;
import com.cropchain.trackingservice.dto.response.BatchStatistics;
import com.cropchain.trackingservice.exception.ResourceNotFoundException;
import com.cropchain.trackingservice.model.BatchUpdate;
import com.cropchain.trackingservice.model.CropBatch;
import com.cropchain.trackingservice.repository.CropBatchRepository;
import com.cropchain.trackingservice.util.Timestamps;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Read side of the batch store. Nothing here writes.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BatchQueryService {

    static final Duration RECENT_WINDOW = Duration.ofDays(30);

    private final CropBatchRepository cropBatchRepository;
    private final Clock clock;

    public CropBatch getByIdentifier(String batchId) {
        CropBatch batch = cropBatchRepository.findById(batchId)
                .orElseThrow(() -> ResourceNotFoundException.forBatch(batchId));
        if (batch.isRecalled()) {
            log.warn("Recalled batch {} viewed", batchId);
        }
        return batch;
    }

    /**
     * Lists batches newest first, optionally only those of one farmer. The statistics are
     * computed over the listed batches.
     */
    public BatchListResponse listBatches(String farmerId) {
        List<CropBatch> batches = StringUtils.hasText(farmerId)
                ? cropBatchRepository.findAllByFarmerId(farmerId)
                : listAll();

        return BatchListResponse.builder()
                .stats(computeStatistics(batches))
                .batches(batches.stream().map(BatchResponse::from).collect(Collectors.toList()))
                .build();
    }

    /** Every batch, newest first. */
    public List<CropBatch> listAll() {
        return cropBatchRepository.findAll();
    }

    /**
     * @return the timeline entries of the batch, in the order they were appended
     */
    public List<BatchUpdate> getTimeline(String batchId) {
        CropBatch batch = getByIdentifier(batchId);
        return batch.getUpdates() != null ? new ArrayList<>(batch.getUpdates()) : new ArrayList<>();
    }

    BatchStatistics computeStatistics(List<CropBatch> batches) {
        Instant recentSince = clock.instant().minus(RECENT_WINDOW);

        long farmers = batches.stream()
                .map(CropBatch::getFarmerId)
                .filter(Objects::nonNull)
                .distinct()
                .count();
        double totalQuantity = batches.stream().mapToDouble(CropBatch::getQuantity).sum();
        long recent = batches.stream()
                .filter(b -> b.getCreatedAt() != null)
                .filter(b -> !Timestamps.toInstant(b.getCreatedAt()).isBefore(recentSince))
                .count();
        long recalled = batches.stream().filter(CropBatch::isRecalled).count();

        return BatchStatistics.builder()
                .totalBatches(batches.size())
                .totalFarmers(farmers)
                .totalQuantity(totalQuantity)
                .recentBatches(recent)
                .recalledBatches(recalled)
                .build();
    }
}
