package com.flagship.club_ledger.payment;

/**
 * Keys of the processor metadata written at checkout and read back on
 * notifications. Values are strings; list-valued entries are JSON.
 */
public final class MetadataKeys {

    public static final String TYPE = "type";
    public static final String ORGANIZER_ID = "organizerId";
    public static final String PAYER_ID = "payerId";
    public static final String PAYER_NAME = "payerName";
    public static final String PAYER_EMAIL = "payerEmail";
    public static final String REFERENCE_ID = "referenceId";
    public static final String EVENT_NAME = "eventName";
    public static final String ACCOUNT_FEE_LOCK_ID = "accountFeeLockId";

    public static final String MEETUP_ID = "meetupId";
    public static final String SLOTS = "slots";
    public static final String COURT_ID = "courtId";
    public static final String DATE = "date";
    public static final String START_TIME = "startTime";
    public static final String END_TIME = "endTime";
    public static final String TOURNAMENT_ID = "tournamentId";
    public static final String REGISTRATION_ID = "registrationId";
    public static final String DIVISION_IDS = "divisionIds";
    public static final String PARTNER_DETAILS = "partnerDetails";
    public static final String LEAGUE_ID = "leagueId";
    public static final String BUNDLE_ID = "bundleId";
    public static final String BUNDLE_NAME = "bundleName";
    public static final String CREDITS = "credits";

    private MetadataKeys() {
    }
}
