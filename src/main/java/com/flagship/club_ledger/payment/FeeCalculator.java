package com.flagship.club_ledger.payment;

import com.flagship.club_ledger.config.LedgerProperties;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Platform fee arithmetic in minor units. Half-up rounding, so 1.5% of 50
 * cents is 1 cent.
 */
@Component
public class FeeCalculator {

    private final LedgerProperties.Fees fees;

    public FeeCalculator(LedgerProperties properties) {
        this.fees = properties.getFees();
    }

    public long platformFee(long amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("Amount must not be negative: " + amount);
        }
        return BigDecimal.valueOf(amount)
                .multiply(fees.getPlatformRate())
                .setScale(0, RoundingMode.HALF_UP)
                .longValueExact();
    }

    /**
     * Whether a checkout of this size may carry the recurring account fee.
     */
    public boolean qualifiesForAccountFee(long amount) {
        return amount >= fees.getAccountFeeMinimumPayment();
    }

    public long accountFee() {
        return fees.getAccountFee();
    }

    /**
     * Application fee routed to the platform for one checkout.
     */
    public long applicationFee(long amount, boolean includeAccountFee) {
        long fee = platformFee(amount);
        return includeAccountFee ? fee + fees.getAccountFee() : fee;
    }
}
