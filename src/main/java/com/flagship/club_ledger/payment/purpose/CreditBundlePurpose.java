package com.flagship.club_ledger.payment.purpose;

/**
 * Messaging credits bought from the platform.
 */
public record CreditBundlePurpose(String bundleId, String bundleName, int credits) implements PaymentPurpose {

    public static final String TYPE = "sms_bundle";

    @Override
    public String typeCode() {
        return TYPE;
    }

    @Override
    public boolean isPlatformOnly() {
        return true;
    }
}
