package com.airledger.core.ledger;

public final class LedgerEventTypes {
    public static final String COMPLIANCE_EVENT = "COMPLIANCE_EVENT";
    public static final String OFFICER_ACTION = "OFFICER_ACTION";

    private LedgerEventTypes() {
    }
}
