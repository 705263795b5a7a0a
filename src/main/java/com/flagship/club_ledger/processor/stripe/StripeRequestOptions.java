package com.flagship.club_ledger.processor.stripe;

import com.flagship.club_ledger.processor.ProcessorProperties;
import com.stripe.net.RequestOptions;
import org.springframework.util.StringUtils;

/**
 * Builds per-call options so every request carries the platform key and, where
 * needed, acts on behalf of a connected receiving account.
 */
final class StripeRequestOptions {

    private StripeRequestOptions() {
    }

    static RequestOptions forAccount(ProcessorProperties properties, String receivingAccountRef) {
        RequestOptions.RequestOptionsBuilder builder = RequestOptions.builder()
                .setApiKey(properties.getApiKey());
        if (StringUtils.hasText(receivingAccountRef)) {
            builder.setStripeAccount(receivingAccountRef);
        }
        return builder.build();
    }
}
