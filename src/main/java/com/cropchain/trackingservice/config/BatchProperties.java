package com.cropchain.trackingservice.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Settings bound from the {@code cropchain.*} keys of application.yml.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "cropchain")
public class BatchProperties {

    @Valid
    private Batch batch = new Batch();

    @Valid
    private Firebase firebase = new Firebase();

    @Valid
    private Qr qr = new Qr();

    @Data
    public static class Batch {
        /** Name of the counter document that feeds batch identifiers. */
        @NotBlank
        private String counterName = "batchId";

        /** Year printed in identifiers. Falls back to the current year when unset. */
        private Integer idYear;

        @Valid
        private Creation creation = new Creation();
    }

    @Data
    public static class Creation {
        // at least two retries after the first attempt
        @Min(3)
        private int maxAttempts = 3;

        @NotNull
        private Duration timeout = Duration.ofSeconds(5);

        /**
         * Attempts Firestore makes per creation transaction when commits contend on the counter
         * document. Exhausting them fails the creation with ABORTED, which is not retried.
         */
        @Min(1)
        private int transactionAttempts = 10;
    }

    @Data
    public static class Firebase {
        private String projectId;

        /** Service-account JSON. Application default credentials are used when empty. */
        private String credentialsPath;
    }

    @Data
    public static class Qr {
        @NotBlank
        private String baseUrl = "http://localhost:3000/track";
    }
}
