package com.trading.assetgraph.api;

/** Closed set of regulatory event types. */
public enum RegulatoryActivity {
    EARNINGS_REPORT("earnings_report"),
    SEC_FILING("sec_filing"),
    DIVIDEND_ANNOUNCEMENT("dividend_announcement"),
    MERGER("merger");

    private final String value;

    RegulatoryActivity(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static RegulatoryActivity fromValue(String value) {
        for (RegulatoryActivity a : values()) {
            if (a.value.equals(value) || a.name().equals(value))
                return a;
        }
        throw new IllegalArgumentException("Unknown regulatory activity: " + value);
    }
}
