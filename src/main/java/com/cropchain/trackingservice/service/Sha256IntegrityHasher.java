package com.cropchain.trackingservice.service;

import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.HexFormat;

/**
 * {@code 0x}-prefixed hex SHA-256 of the mutated content and the mutation time, the format the
 * chain mirror expects for transaction hashes.
 */
@Component
public class Sha256IntegrityHasher implements IntegrityHasher {

    @Override
    public String hash(Object content, Instant at) {
        String input = content + "|" + at.toEpochMilli();
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] bytes = digest.digest(input.getBytes(StandardCharsets.UTF_8));
            return "0x" + HexFormat.of().formatHex(bytes);
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
