package com.flagship.club_ledger.processor.stripe;

import com.flagship.club_ledger.processor.BalanceEntry;
import com.flagship.club_ledger.processor.CheckoutSessionHandle;
import com.flagship.club_ledger.processor.CheckoutSessionRequest;
import com.flagship.club_ledger.processor.IssuedRefund;
import com.flagship.club_ledger.processor.PaymentIntentSnapshot;
import com.flagship.club_ledger.processor.PaymentProcessorClient;
import com.flagship.club_ledger.processor.ProcessorCharge;
import com.flagship.club_ledger.processor.ProcessorException;
import com.flagship.club_ledger.processor.ProcessorProperties;
import com.flagship.club_ledger.processor.RefundInstruction;
import com.flagship.club_ledger.processor.RefundSnapshot;
import com.flagship.club_ledger.processor.SettlementDetails;
import com.stripe.exception.StripeException;
import com.stripe.model.BalanceTransaction;
import com.stripe.model.BalanceTransactionCollection;
import com.stripe.model.Charge;
import com.stripe.model.ChargeCollection;
import com.stripe.model.PaymentIntent;
import com.stripe.model.Refund;
import com.stripe.model.RefundCollection;
import com.stripe.model.checkout.Session;
import com.stripe.net.RequestOptions;
import com.stripe.param.BalanceTransactionListParams;
import com.stripe.param.ChargeListParams;
import com.stripe.param.ChargeRetrieveParams;
import com.stripe.param.PaymentIntentRetrieveParams;
import com.stripe.param.RefundCreateParams;
import com.stripe.param.RefundListParams;
import com.stripe.param.checkout.SessionCreateParams;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Stripe Connect implementation of {@link PaymentProcessorClient}.
 *
 * All calls use direct charges on the connected account, so each request is
 * issued with the {@code Stripe-Account} header set to the receiving account.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StripeProcessorClient implements PaymentProcessorClient {

    private static final long PAGE_SIZE = 100L;

    private final ProcessorProperties properties;

    @Override
    public SettlementDetails fetchSettlement(String chargeId, String receivingAccountRef) {
        ChargeRetrieveParams params = ChargeRetrieveParams.builder()
                .addExpand("balance_transaction")
                .build();
        try {
            Charge charge = Charge.retrieve(chargeId, params,
                    StripeRequestOptions.forAccount(properties, receivingAccountRef));
            BalanceTransaction balance = charge.getBalanceTransactionObject();
            if (balance == null) {
                throw new ProcessorException("No balance transaction yet for charge " + chargeId);
            }
            long applicationFee = charge.getApplicationFeeAmount() != null ? charge.getApplicationFeeAmount() : 0L;
            log.debug("Settlement for charge {}: gross={}, fee={}, net={}, applicationFee={}",
                    chargeId, balance.getAmount(), balance.getFee(), balance.getNet(), applicationFee);
            return new SettlementDetails(balance.getId(), balance.getAmount(), balance.getFee(),
                    balance.getNet(), applicationFee);
        } catch (StripeException e) {
            throw new ProcessorException("Failed to retrieve settlement for charge " + chargeId, e);
        }
    }

    @Override
    public PaymentIntentSnapshot fetchPaymentIntent(String paymentIntentId, String receivingAccountRef) {
        try {
            PaymentIntent intent = PaymentIntent.retrieve(paymentIntentId,
                    PaymentIntentRetrieveParams.builder().build(),
                    StripeRequestOptions.forAccount(properties, receivingAccountRef));
            return new PaymentIntentSnapshot(intent.getId(),
                    intent.getAmount() != null ? intent.getAmount() : 0L,
                    intent.getCurrency(),
                    intent.getMetadata());
        } catch (StripeException e) {
            throw new ProcessorException("Failed to retrieve payment intent " + paymentIntentId, e);
        }
    }

    @Override
    public List<RefundSnapshot> listRefunds(String chargeId, String receivingAccountRef) {
        RefundListParams params = RefundListParams.builder()
                .setCharge(chargeId)
                .setLimit(100L)
                .build();
        try {
            RefundCollection refunds = Refund.list(params,
                    StripeRequestOptions.forAccount(properties, receivingAccountRef));
            return refunds.getData().stream()
                    .map(StripeEventTranslator::toRefundSnapshot)
                    .toList();
        } catch (StripeException e) {
            throw new ProcessorException("Failed to list refunds for charge " + chargeId, e);
        }
    }

    @Override
    public IssuedRefund issueRefund(RefundInstruction instruction) {
        RefundCreateParams.Builder params = RefundCreateParams.builder()
                .setCharge(instruction.chargeId())
                .setAmount(instruction.amount());
        RefundCreateParams.Reason reason = toReason(instruction.reason());
        if (reason != null) {
            params.setReason(reason);
        }
        try {
            Refund refund = Refund.create(params.build(),
                    StripeRequestOptions.forAccount(properties, instruction.receivingAccountRef()));
            log.info("Issued refund {} for charge {}: amount={}, status={}",
                    refund.getId(), instruction.chargeId(), refund.getAmount(), refund.getStatus());
            return new IssuedRefund(refund.getId(), refund.getAmount(), refund.getStatus());
        } catch (StripeException e) {
            throw new ProcessorException("Failed to issue refund for charge " + instruction.chargeId(), e);
        }
    }

    @Override
    public CheckoutSessionHandle createCheckoutSession(CheckoutSessionRequest request) {
        SessionCreateParams.LineItem.PriceData.ProductData.Builder product =
                SessionCreateParams.LineItem.PriceData.ProductData.builder()
                        .setName(request.itemName());
        if (request.itemDescription() != null && !request.itemDescription().isBlank()) {
            product.setDescription(request.itemDescription());
        }

        SessionCreateParams.Builder params = SessionCreateParams.builder()
                .setMode(SessionCreateParams.Mode.PAYMENT)
                .setSuccessUrl(request.successUrl())
                .setCancelUrl(request.cancelUrl())
                .addLineItem(SessionCreateParams.LineItem.builder()
                        .setQuantity(1L)
                        .setPriceData(SessionCreateParams.LineItem.PriceData.builder()
                                .setCurrency(request.currency().toLowerCase(Locale.ROOT))
                                .setUnitAmount(request.amount())
                                .setProductData(product.build())
                                .build())
                        .build())
                .putAllMetadata(request.metadata());
        SessionCreateParams.PaymentIntentData.Builder paymentIntent =
                SessionCreateParams.PaymentIntentData.builder().putAllMetadata(request.metadata());
        // Application fees only apply to charges on a receiving account
        if (StringUtils.hasText(request.receivingAccountRef()) && request.applicationFee() > 0) {
            paymentIntent.setApplicationFeeAmount(request.applicationFee());
        }
        params.setPaymentIntentData(paymentIntent.build());
        if (request.customerEmail() != null && !request.customerEmail().isBlank()) {
            params.setCustomerEmail(request.customerEmail());
        }

        try {
            Session session = Session.create(params.build(),
                    StripeRequestOptions.forAccount(properties, request.receivingAccountRef()));
            return new CheckoutSessionHandle(session.getId(), session.getUrl());
        } catch (StripeException e) {
            throw new ProcessorException("Failed to create checkout session for account "
                    + request.receivingAccountRef(), e);
        }
    }

    @Override
    public ProcessorCharge fetchCharge(String chargeId, String receivingAccountRef) {
        try {
            Charge charge = Charge.retrieve(chargeId, ChargeRetrieveParams.builder().build(),
                    StripeRequestOptions.forAccount(properties, receivingAccountRef));
            return toProcessorCharge(charge);
        } catch (StripeException e) {
            throw new ProcessorException("Failed to retrieve charge " + chargeId, e);
        }
    }

    @Override
    public List<ProcessorCharge> listCharges(String receivingAccountRef, Instant from, Instant to) {
        RequestOptions options = StripeRequestOptions.forAccount(properties, receivingAccountRef);
        ChargeListParams.Created created = ChargeListParams.Created.builder()
                .setGte(from.getEpochSecond())
                .setLte(to.getEpochSecond())
                .build();
        List<ProcessorCharge> charges = new ArrayList<>();
        String startingAfter = null;
        try {
            while (true) {
                ChargeListParams.Builder params = ChargeListParams.builder()
                        .setCreated(created)
                        .setLimit(PAGE_SIZE);
                if (startingAfter != null) {
                    params.setStartingAfter(startingAfter);
                }
                ChargeCollection page = Charge.list(params.build(), options);
                page.getData().forEach(charge -> charges.add(toProcessorCharge(charge)));
                if (!Boolean.TRUE.equals(page.getHasMore()) || page.getData().isEmpty()) {
                    break;
                }
                startingAfter = page.getData().get(page.getData().size() - 1).getId();
            }
        } catch (StripeException e) {
            throw new ProcessorException("Failed to list charges for account " + receivingAccountRef, e);
        }
        log.debug("Listed {} charges for account {} between {} and {}", charges.size(), receivingAccountRef, from, to);
        return charges;
    }

    @Override
    public List<BalanceEntry> listBalanceEntries(String receivingAccountRef, Instant from, Instant to) {
        RequestOptions options = StripeRequestOptions.forAccount(properties, receivingAccountRef);
        BalanceTransactionListParams.Created created = BalanceTransactionListParams.Created.builder()
                .setGte(from.getEpochSecond())
                .setLte(to.getEpochSecond())
                .build();
        List<BalanceEntry> entries = new ArrayList<>();
        String startingAfter = null;
        try {
            while (true) {
                BalanceTransactionListParams.Builder params = BalanceTransactionListParams.builder()
                        .setCreated(created)
                        .setLimit(PAGE_SIZE);
                if (startingAfter != null) {
                    params.setStartingAfter(startingAfter);
                }
                BalanceTransactionCollection page = BalanceTransaction.list(params.build(), options);
                for (BalanceTransaction balance : page.getData()) {
                    entries.add(new BalanceEntry(balance.getId(), balance.getType(),
                            orZero(balance.getAmount()), orZero(balance.getFee()), orZero(balance.getNet()),
                            balance.getSource(), toInstant(balance.getCreated())));
                }
                if (!Boolean.TRUE.equals(page.getHasMore()) || page.getData().isEmpty()) {
                    break;
                }
                startingAfter = page.getData().get(page.getData().size() - 1).getId();
            }
        } catch (StripeException e) {
            throw new ProcessorException("Failed to list balance transactions for account " + receivingAccountRef, e);
        }
        log.debug("Listed {} balance entries for account {} between {} and {}", entries.size(), receivingAccountRef, from, to);
        return entries;
    }

    private static ProcessorCharge toProcessorCharge(Charge charge) {
        return new ProcessorCharge(StripeEventTranslator.toChargeSnapshot(charge), charge.getStatus(),
                Boolean.TRUE.equals(charge.getLivemode()), toInstant(charge.getCreated()));
    }

    private static long orZero(Long value) {
        return value != null ? value : 0L;
    }

    private static Instant toInstant(Long epochSeconds) {
        return epochSeconds != null ? Instant.ofEpochSecond(epochSeconds) : null;
    }

    private static RefundCreateParams.Reason toReason(String reason) {
        if (reason == null) {
            return null;
        }
        return switch (reason) {
            case "duplicate" -> RefundCreateParams.Reason.DUPLICATE;
            case "fraudulent" -> RefundCreateParams.Reason.FRAUDULENT;
            case "requested_by_customer" -> RefundCreateParams.Reason.REQUESTED_BY_CUSTOMER;
            default -> null;
        };
    }
}
