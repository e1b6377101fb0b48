package com.trading.assetgraph.model;

/** Type tags written by the built-in inference rules. */
public final class RelationshipTypes {
    public static final String SAME_SECTOR = "same_sector";
    public static final String CORPORATE_LINK = "corporate_link";
    public static final String EVENT_IMPACT = "event_impact";

    public static final double SAME_SECTOR_STRENGTH = 0.7;
    public static final double CORPORATE_LINK_STRENGTH = 0.9;

    private RelationshipTypes() {
    }
}
