package com.flagship.club_ledger.payment;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.club_ledger.payment.purpose.CourtBookingPurpose;
import com.flagship.club_ledger.payment.purpose.CourtSlot;
import com.flagship.club_ledger.payment.purpose.CreditBundlePurpose;
import com.flagship.club_ledger.payment.purpose.LeaguePurpose;
import com.flagship.club_ledger.payment.purpose.MeetupPurpose;
import com.flagship.club_ledger.payment.purpose.PaymentPurpose;
import com.flagship.club_ledger.payment.purpose.TournamentPurpose;
import com.flagship.club_ledger.payment.purpose.UnknownPurpose;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns the processor's flat string metadata into {@link PaymentMetadata}.
 *
 * Malformed JSON in a list-valued entry is logged and read as empty; it never
 * fails the notification, since the money has already moved.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PaymentMetadataDecoder {

    private static final TypeReference<List<CourtSlot>> SLOT_LIST = new TypeReference<>() { };
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() { };
    private static final TypeReference<Map<String, Object>> OBJECT_MAP = new TypeReference<>() { };

    private final ObjectMapper objectMapper;

    public PaymentMetadata decode(Map<String, String> metadata) {
        Map<String, String> values = metadata == null ? Map.of() : metadata;
        String referenceId = firstPresent(values,
                MetadataKeys.REFERENCE_ID, MetadataKeys.MEETUP_ID, MetadataKeys.TOURNAMENT_ID, MetadataKeys.LEAGUE_ID);
        return new PaymentMetadata(
                blankToNull(values.get(MetadataKeys.ORGANIZER_ID)),
                blankToNull(values.get(MetadataKeys.PAYER_ID)),
                blankToNull(values.get(MetadataKeys.PAYER_NAME)),
                blankToNull(values.get(MetadataKeys.PAYER_EMAIL)),
                referenceId,
                blankToNull(values.get(MetadataKeys.EVENT_NAME)),
                blankToNull(values.get(MetadataKeys.ACCOUNT_FEE_LOCK_ID)),
                decodePurpose(values));
    }

    PaymentPurpose decodePurpose(Map<String, String> values) {
        String type = blankToNull(values.get(MetadataKeys.TYPE));
        if (type == null) {
            return new UnknownPurpose(null);
        }
        return switch (type) {
            case MeetupPurpose.TYPE -> new MeetupPurpose(values.get(MetadataKeys.MEETUP_ID));
            case CourtBookingPurpose.TYPE -> new CourtBookingPurpose(decodeSlots(values));
            case TournamentPurpose.TYPE -> new TournamentPurpose(
                    values.get(MetadataKeys.TOURNAMENT_ID),
                    values.get(MetadataKeys.REGISTRATION_ID),
                    readJson(values, MetadataKeys.DIVISION_IDS, STRING_LIST, List.of()),
                    readJson(values, MetadataKeys.PARTNER_DETAILS, OBJECT_MAP, Map.of()));
            case LeaguePurpose.TYPE -> new LeaguePurpose(values.get(MetadataKeys.LEAGUE_ID));
            case CreditBundlePurpose.TYPE -> new CreditBundlePurpose(
                    values.get(MetadataKeys.BUNDLE_ID),
                    values.get(MetadataKeys.BUNDLE_NAME),
                    parseCredits(values.get(MetadataKeys.CREDITS)));
            default -> new UnknownPurpose(type);
        };
    }

    /**
     * Writes the purpose-specific entries back into metadata form.
     */
    public Map<String, String> encodePurpose(PaymentPurpose purpose) {
        Map<String, String> values = new HashMap<>();
        values.put(MetadataKeys.TYPE, purpose.typeCode());
        if (purpose instanceof MeetupPurpose meetup) {
            putIfPresent(values, MetadataKeys.MEETUP_ID, meetup.meetupId());
        } else if (purpose instanceof CourtBookingPurpose booking) {
            values.put(MetadataKeys.SLOTS, writeJson(booking.slots()));
        } else if (purpose instanceof TournamentPurpose tournament) {
            putIfPresent(values, MetadataKeys.TOURNAMENT_ID, tournament.tournamentId());
            putIfPresent(values, MetadataKeys.REGISTRATION_ID, tournament.registrationId());
            values.put(MetadataKeys.DIVISION_IDS, writeJson(tournament.divisionIds()));
            if (!tournament.partnerDetails().isEmpty()) {
                values.put(MetadataKeys.PARTNER_DETAILS, writeJson(tournament.partnerDetails()));
            }
        } else if (purpose instanceof LeaguePurpose league) {
            putIfPresent(values, MetadataKeys.LEAGUE_ID, league.leagueId());
        } else if (purpose instanceof CreditBundlePurpose bundle) {
            putIfPresent(values, MetadataKeys.BUNDLE_ID, bundle.bundleId());
            putIfPresent(values, MetadataKeys.BUNDLE_NAME, bundle.bundleName());
            values.put(MetadataKeys.CREDITS, String.valueOf(bundle.credits()));
        }
        return values;
    }

    private List<CourtSlot> decodeSlots(Map<String, String> values) {
        if (values.containsKey(MetadataKeys.SLOTS)) {
            return readJson(values, MetadataKeys.SLOTS, SLOT_LIST, List.of());
        }
        // Single-slot bookings carry the slot as flat entries
        String courtId = blankToNull(values.get(MetadataKeys.COURT_ID));
        String date = blankToNull(values.get(MetadataKeys.DATE));
        String startTime = blankToNull(values.get(MetadataKeys.START_TIME));
        if (courtId != null && date != null && startTime != null) {
            return List.of(new CourtSlot(courtId, date, startTime, values.getOrDefault(MetadataKeys.END_TIME, "")));
        }
        return List.of();
    }

    private <T> T readJson(Map<String, String> values, String key, TypeReference<T> type, T fallback) {
        String raw = blankToNull(values.get(key));
        if (raw == null) {
            return fallback;
        }
        try {
            T parsed = objectMapper.readValue(raw, type);
            return parsed != null ? parsed : fallback;
        } catch (JsonProcessingException e) {
            log.warn("Malformed JSON in metadata entry '{}', treating as empty: {}", key, e.getOriginalMessage());
            return fallback;
        }
    }

    private String writeJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot encode metadata value", e);
        }
    }

    private static int parseCredits(String raw) {
        if (raw == null || raw.isBlank()) {
            return 0;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("Non-numeric credits value '{}' in metadata", raw);
            return 0;
        }
    }

    private static String firstPresent(Map<String, String> values, String... keys) {
        for (String key : keys) {
            String value = blankToNull(values.get(key));
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private static void putIfPresent(Map<String, String> values, String key, String value) {
        if (value != null && !value.isBlank()) {
            values.put(key, value);
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
