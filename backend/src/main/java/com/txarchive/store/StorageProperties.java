package com.txarchive.store;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Archive storage: backend choice, location, write retries and periodic maintenance.
 */
@ConfigurationProperties(prefix = "txarchive.storage")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class StorageProperties {

    public enum Backend {
        FILE,
        MONGO
    }

    @NotNull
    private Backend backend = Backend.FILE;

    /** Root directory of the file backend. */
    @NotBlank
    private String path = "./tx_archive_data";

    @Min(1)
    private long sweepIntervalMs = 3_600_000L;

    @Min(1)
    private long statsIntervalMs = 30_000L;

    /** Attempts per record for recoverable write failures. */
    @Min(1)
    private int writeMaxAttempts = 5;

    @Min(1)
    private long writeBaseDelayMs = 200L;

    @Min(1)
    private long writeMaxDelayMs = 10_000L;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double writeJitterFactor = 0.2;

    @Valid
    private Mongo mongo = new Mongo();

    @Getter
    @Setter
    @NoArgsConstructor
    public static class Mongo {

        @NotBlank
        private String uri = "mongodb://localhost:27017";

        @NotBlank
        private String database = "txarchive";
    }
}
