package com.cropchain.trackingservice.service;

/**
 * Supplies the code stored with a new batch for rendering as a QR image. The service stores
 * the value as-is.
 */
public interface QrCodeGenerator {

    String generate(String batchId);
}
