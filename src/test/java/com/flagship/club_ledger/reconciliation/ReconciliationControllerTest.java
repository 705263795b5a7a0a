package com.flagship.club_ledger.reconciliation;

import com.flagship.club_ledger.LedgerIntegrationTestSupport;
import com.flagship.club_ledger.processor.BalanceEntry;
import com.flagship.club_ledger.processor.ProcessorCharge;
import com.flagship.club_ledger.processor.ProcessorException;
import com.flagship.club_ledger.processor.SettlementDetails;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

import static com.flagship.club_ledger.LedgerFixtures.charge;
import static com.flagship.club_ledger.LedgerFixtures.meetupMetadata;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

class ReconciliationControllerTest extends LedgerIntegrationTestSupport {

    @Autowired
    private MockMvc mockMvc;

    private String account;
    private String from;
    private String to;

    @BeforeEach
    void setUp() {
        account = uniqueId("acct");
        Instant now = Instant.now().truncatedTo(ChronoUnit.SECONDS);
        from = now.minus(1, ChronoUnit.DAYS).toString();
        to = now.plus(1, ChronoUnit.HOURS).toString();
    }

    @Test
    @DisplayName("GET charges returns the report for the window")
    void testChargeReport() throws Exception {
        printTestHeader("Charge Report");

        String chargeId = uniqueId("ch");
        when(processorClient.listCharges(eq(account), any(Instant.class), any(Instant.class))).thenReturn(List.of(
                new ProcessorCharge(charge(chargeId, uniqueId("pi"), 2500, meetupMetadata("club_x", "m")),
                        ProcessorCharge.SUCCEEDED, false, Instant.now())));

        mockMvc.perform(get("/api/admin/reconciliation/charges")
                        .param("account", account).param("from", from).param("to", to))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.mode").value("CHARGES"))
                .andExpect(jsonPath("$.receivingAccountRef").value(account))
                .andExpect(jsonPath("$.summary.missingInLedger").value(1))
                .andExpect(jsonPath("$.summary.processorTotal").value(2500))
                .andExpect(jsonPath("$.discrepancies[0].type").value("MISSING_IN_LEDGER"))
                .andExpect(jsonPath("$.discrepancies[0].processorRef").value(chargeId))
                .andExpect(jsonPath("$.discrepancies[0].canAutoFix").value(true));
        printSuccess("Report returned");
    }

    @Test
    @DisplayName("GET settlements reports ignored balance types")
    void testSettlementReport() throws Exception {
        printTestHeader("Settlement Report");

        when(processorClient.listBalanceEntries(eq(account), any(Instant.class), any(Instant.class))).thenReturn(List.of(
                new BalanceEntry(uniqueId("txn"), "payout", -5000, 0, -5000,
                        null, Instant.now())));

        mockMvc.perform(get("/api/admin/reconciliation/settlements")
                        .param("account", account).param("from", from).param("to", to))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.mode").value("SETTLEMENTS"))
                .andExpect(jsonPath("$.summary.compared").value(0))
                .andExpect(jsonPath("$.summary.ignoredTypes.payout").value(1))
                .andExpect(jsonPath("$.summary.matchRate").value(100.0));
    }

    @Test
    @DisplayName("Bad windows and missing parameters return 400")
    void testBadRequests() throws Exception {
        printTestHeader("Reconciliation Bad Requests");

        mockMvc.perform(get("/api/admin/reconciliation/charges")
                        .param("account", account).param("from", to).param("to", from))
                .andExpect(status().isBadRequest());
        mockMvc.perform(get("/api/admin/reconciliation/charges")
                        .param("account", account).param("from", "2020-01-01T00:00:00Z").param("to", to))
                .andExpect(status().isBadRequest());
        mockMvc.perform(get("/api/admin/reconciliation/charges").param("account", account))
                .andExpect(status().isBadRequest());
        mockMvc.perform(get("/api/admin/reconciliation/charges")
                        .param("account", account).param("from", "yesterday").param("to", to))
                .andExpect(status().isBadRequest());
        printSuccess("Rejected");
    }

    @Test
    @DisplayName("POST missing-payments returns 201, then 409 for the same charge")
    void testAddMissingPayment() throws Exception {
        printTestHeader("Add Missing Payment Endpoint");

        String chargeId = uniqueId("ch");
        when(processorClient.fetchCharge(chargeId, account)).thenReturn(new ProcessorCharge(
                charge(chargeId, uniqueId("pi"), 5000, meetupMetadata(uniqueId("club"), "meetup-9")),
                ProcessorCharge.SUCCEEDED, false, Instant.now()));
        when(processorClient.fetchSettlement(chargeId, account))
                .thenReturn(new SettlementDetails(uniqueId("txn"), 5000, 110, 4890, 75));
        String body = String.format(
                "{\"receiving_account_ref\":\"%s\",\"charge_id\":\"%s\",\"requested_by\":\"admin_7\"}", account, chargeId);

        mockMvc.perform(post("/api/admin/reconciliation/missing-payments")
                        .contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.chargeId").value(chargeId))
                .andExpect(jsonPath("$.status").value("COMPLETED"))
                .andExpect(jsonPath("$.netAmount").value(4890));

        mockMvc.perform(post("/api/admin/reconciliation/missing-payments")
                        .contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isConflict());
        printSuccess("Charge added once");
    }

    @Test
    @DisplayName("POST missing-payments validates the body and maps processor errors to 502")
    void testAddMissingPaymentErrors() throws Exception {
        printTestHeader("Add Missing Payment Errors");

        mockMvc.perform(post("/api/admin/reconciliation/missing-payments")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"charge_id\":\"ch_1\",\"requested_by\":\"admin_7\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details.receivingAccountRef").exists());

        String chargeId = uniqueId("ch");
        when(processorClient.fetchCharge(chargeId, account)).thenThrow(new ProcessorException("No such charge"));
        mockMvc.perform(post("/api/admin/reconciliation/missing-payments")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(String.format(
                                "{\"receiving_account_ref\":\"%s\",\"charge_id\":\"%s\",\"requested_by\":\"admin_7\"}",
                                account, chargeId)))
                .andExpect(status().isBadGateway());
        printSuccess("Errors mapped");
    }
}
