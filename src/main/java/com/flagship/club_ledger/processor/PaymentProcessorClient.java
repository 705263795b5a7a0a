package com.flagship.club_ledger.processor;

import java.time.Instant;
import java.util.List;

/**
 * Outbound calls to the payment processor.
 *
 * Every call is synchronous and blocking. Implementations do not retry; a
 * failure surfaces as {@link ProcessorException} and fails the calling
 * operation.
 */
public interface PaymentProcessorClient {

    /**
     * Retrieves the settled fee and net breakdown for a charge.
     *
     * @throws ProcessorException if the call fails or the settlement record is not available yet
     */
    SettlementDetails fetchSettlement(String chargeId, String receivingAccountRef);

    PaymentIntentSnapshot fetchPaymentIntent(String paymentIntentId, String receivingAccountRef);

    List<RefundSnapshot> listRefunds(String chargeId, String receivingAccountRef);

    IssuedRefund issueRefund(RefundInstruction instruction);

    CheckoutSessionHandle createCheckoutSession(CheckoutSessionRequest request);

    /**
     * Retrieves one charge with its metadata, for rebuilding a missing ledger row.
     */
    ProcessorCharge fetchCharge(String chargeId, String receivingAccountRef);

    /**
     * All charges created on the account in {@code [from, to]}, following pagination.
     */
    List<ProcessorCharge> listCharges(String receivingAccountRef, Instant from, Instant to);

    /**
     * All balance movements created on the account in {@code [from, to]}, following pagination.
     */
    List<BalanceEntry> listBalanceEntries(String receivingAccountRef, Instant from, Instant to);
}
