package com.flagship.club_ledger.refund;

import com.flagship.club_ledger.LedgerIntegrationTestSupport;
import com.flagship.club_ledger.payment.TwoPhaseRecorder;
import com.flagship.club_ledger.processor.ChargeSnapshot;
import com.flagship.club_ledger.processor.CheckoutSessionSnapshot;
import com.flagship.club_ledger.processor.IssuedRefund;
import com.flagship.club_ledger.processor.ProcessorEvent;
import com.flagship.club_ledger.processor.ProcessorException;
import com.flagship.club_ledger.processor.RefundInstruction;
import com.flagship.club_ledger.transaction.FinancialTransaction;
import com.flagship.club_ledger.transaction.TransactionLedgerStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Map;
import java.util.UUID;

import static com.flagship.club_ledger.LedgerFixtures.charge;
import static com.flagship.club_ledger.LedgerFixtures.event;
import static com.flagship.club_ledger.LedgerFixtures.meetupMetadata;
import static com.flagship.club_ledger.LedgerFixtures.paidCheckout;
import static com.flagship.club_ledger.LedgerFixtures.standardSettlement;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

class RefundControllerTest extends LedgerIntegrationTestSupport {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private TwoPhaseRecorder recorder;

    @Autowired
    private TransactionLedgerStore ledgerStore;

    private String account;
    private String paymentIntentId;
    private FinancialTransaction payment;

    @BeforeEach
    void setUp() {
        account = uniqueId("acct");
        paymentIntentId = uniqueId("pi");
        String chargeId = uniqueId("ch");

        Map<String, String> metadata = meetupMetadata(uniqueId("club"), "meetup-3");
        ProcessorEvent checkout = event(ProcessorEvent.CHECKOUT_COMPLETED, account,
                paidCheckout(paymentIntentId, 5000, metadata));
        recorder.onInitiationNotified((CheckoutSessionSnapshot) checkout.payload(), checkout);
        when(processorClient.fetchSettlement(chargeId, account)).thenReturn(standardSettlement());
        ProcessorEvent settled = event(ProcessorEvent.CHARGE_SUCCEEDED, account,
                charge(chargeId, paymentIntentId, 5000, metadata));
        recorder.onSettlementNotified((ChargeSnapshot) settled.payload(), settled);
        payment = ledgerStore.findPaymentByPaymentIntent(paymentIntentId).orElseThrow();
    }

    @Test
    @DisplayName("POST refund returns 201 with a PROCESSING refund row")
    void testCreateRefund() throws Exception {
        printTestHeader("Create Refund");

        String refundId = uniqueId("re");
        when(processorClient.issueRefund(any(RefundInstruction.class)))
                .thenReturn(new IssuedRefund(refundId, 1000, "pending"));

        mockMvc.perform(post("/api/transactions/{id}/refunds", payment.getId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"amount\":1000,\"reason\":\"Rained out\",\"initiated_by\":\"admin_7\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.refund_id").value(refundId))
                .andExpect(jsonPath("$.payment_transaction_id").value(payment.getId().toString()))
                .andExpect(jsonPath("$.amount").value(1000))
                .andExpect(jsonPath("$.status").value("PROCESSING"));

        mockMvc.perform(get("/api/transactions").param("paymentIntentId", paymentIntentId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[0].kind").value("PAYMENT"))
                .andExpect(jsonPath("$[0].status").value("COMPLETED"))
                .andExpect(jsonPath("$[1].kind").value("REFUND"))
                .andExpect(jsonPath("$[1].amount").value(-1000));
        printSuccess("Refund requested");
    }

    @Test
    @DisplayName("Refund errors map to 400, 422 and 502")
    void testRefundErrors() throws Exception {
        printTestHeader("Refund Errors");

        // Missing initiator fails validation
        mockMvc.perform(post("/api/transactions/{id}/refunds", payment.getId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"amount\":1000}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details.initiatedBy").exists());

        mockMvc.perform(post("/api/transactions/{id}/refunds", payment.getId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"amount\":9000,\"initiated_by\":\"admin_7\"}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error").value("Invalid Refund"));
        verify(processorClient, never()).issueRefund(any(RefundInstruction.class));

        when(processorClient.issueRefund(any(RefundInstruction.class)))
                .thenThrow(new ProcessorException("Charge has already been refunded"));
        mockMvc.perform(post("/api/transactions/{id}/refunds", payment.getId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"initiated_by\":\"admin_7\"}"))
                .andExpect(status().isBadGateway());
        printSuccess("Errors mapped");
    }

    @Test
    @DisplayName("Unknown transaction returns 404")
    void testTransactionNotFound() throws Exception {
        mockMvc.perform(get("/api/transactions/{id}", UUID.randomUUID()))
                .andExpect(status().isNotFound());
        mockMvc.perform(get("/api/transactions/{id}", payment.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.netAmount").value(4890));
    }
}
