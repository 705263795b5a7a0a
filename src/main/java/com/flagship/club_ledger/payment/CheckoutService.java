package com.flagship.club_ledger.payment;

import com.flagship.club_ledger.feelock.AccountFeeLockService;
import com.flagship.club_ledger.feelock.FeeLockClaim;
import com.flagship.club_ledger.payment.dto.CheckoutRequest;
import com.flagship.club_ledger.payment.dto.CheckoutResponse;
import com.flagship.club_ledger.payment.purpose.PaymentPurpose;
import com.flagship.club_ledger.processor.CheckoutSessionHandle;
import com.flagship.club_ledger.processor.CheckoutSessionRequest;
import com.flagship.club_ledger.processor.PaymentProcessorClient;
import com.flagship.club_ledger.transaction.FinancialTransaction;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.HashMap;
import java.util.Map;

/**
 * Opens hosted checkouts and stamps them with the metadata the ledger reads
 * back when the processor notifies.
 *
 * The first qualifying checkout of a billing period for a receiving account
 * also carries the monthly account fee, decided by the account fee lock.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CheckoutService {

    private final PaymentProcessorClient processorClient;
    private final AccountFeeLockService feeLockService;
    private final FeeCalculator feeCalculator;
    private final PaymentMetadataDecoder metadataDecoder;

    public CheckoutResponse createCheckout(CheckoutRequest request) {
        PaymentPurpose purpose = request.getPurpose().toPurpose();
        String currency = FinancialTransaction.canonicalCurrency(request.getCurrency());
        long amount = request.getAmount();

        Map<String, String> metadata = new HashMap<>(metadataDecoder.encodePurpose(purpose));
        putIfPresent(metadata, MetadataKeys.PAYER_ID, request.getPayerRef());
        putIfPresent(metadata, MetadataKeys.PAYER_NAME, request.getPayerName());
        putIfPresent(metadata, MetadataKeys.PAYER_EMAIL, request.getPayerEmail());
        putIfPresent(metadata, MetadataKeys.REFERENCE_ID, request.getReferenceId());
        putIfPresent(metadata, MetadataKeys.EVENT_NAME, request.getItemName());

        String receivingAccount = null;
        long applicationFee = 0;
        boolean accountFeeCharged = false;
        if (!purpose.isPlatformOnly()) {
            if (!StringUtils.hasText(request.getReceivingAccountRef())) {
                throw new IllegalArgumentException("Receiving account is required for " + purpose.typeCode() + " checkouts");
            }
            if (!StringUtils.hasText(request.getOrganizerRef())) {
                throw new IllegalArgumentException("Organizer is required for " + purpose.typeCode() + " checkouts");
            }
            receivingAccount = request.getReceivingAccountRef();
            metadata.put(MetadataKeys.ORGANIZER_ID, request.getOrganizerRef());

            if (feeCalculator.qualifiesForAccountFee(amount)) {
                FeeLockClaim claim = claimAccountFee(receivingAccount);
                if (claim.shouldCharge()) {
                    accountFeeCharged = true;
                    metadata.put(MetadataKeys.ACCOUNT_FEE_LOCK_ID, claim.lockId());
                }
            }
            applicationFee = feeCalculator.applicationFee(amount, accountFeeCharged);
        }

        CheckoutSessionHandle session = processorClient.createCheckoutSession(new CheckoutSessionRequest(
                receivingAccount,
                request.getItemName(),
                request.getItemDescription(),
                amount,
                currency,
                applicationFee,
                request.getPayerEmail(),
                request.getSuccessUrl(),
                request.getCancelUrl(),
                metadata));

        log.info("Checkout {} created: purpose={}, account={}, amount={} {}, applicationFee={}, accountFee={}",
                session.sessionId(), purpose.typeCode(), receivingAccount, amount, currency,
                applicationFee, accountFeeCharged);

        return CheckoutResponse.builder()
                .sessionId(session.sessionId())
                .url(session.url())
                .amount(amount)
                .applicationFee(applicationFee)
                .accountFeeCharged(accountFeeCharged)
                .build();
    }

    // A lock failure must not block the payer; the fee is skipped for this checkout
    private FeeLockClaim claimAccountFee(String receivingAccount) {
        try {
            return feeLockService.tryClaimCurrentPeriod(receivingAccount);
        } catch (DataAccessException e) {
            log.error("Account fee lock unavailable for {}, continuing without account fee: {}",
                    receivingAccount, e.getMessage(), e);
            return FeeLockClaim.notCharged(feeLockService.currentPeriodKey());
        }
    }

    private static void putIfPresent(Map<String, String> values, String key, String value) {
        if (StringUtils.hasText(value)) {
            values.put(key, value);
        }
    }
}
