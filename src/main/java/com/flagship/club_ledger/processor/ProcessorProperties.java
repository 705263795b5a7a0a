package com.flagship.club_ledger.processor;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Credentials for the payment processor.
 */
@ConfigurationProperties(prefix = "processor")
@Getter
@Setter
public class ProcessorProperties {

    private String apiKey;

    private String webhookSecret;

    /** Allowed clock skew when checking webhook signature timestamps, seconds. */
    private long signatureToleranceSeconds = 300;
}
