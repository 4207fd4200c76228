package com.cropchain.trackingservice.service;

import com.cropchain.trackingservice.config.BatchProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Encodes the public tracking page of the batch; the front end renders it as the QR image.
 */
@Component
@RequiredArgsConstructor
public class TrackingUrlQrCodeGenerator implements QrCodeGenerator {

    private final BatchProperties properties;

    @Override
    public String generate(String batchId) {
        String baseUrl = properties.getQr().getBaseUrl();
        return baseUrl.endsWith("/") ? baseUrl + batchId : baseUrl + "/" + batchId;
    }
}
