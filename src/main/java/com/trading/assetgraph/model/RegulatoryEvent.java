package com.trading.assetgraph.model;

import com.trading.assetgraph.api.ModelValidationException;
import com.trading.assetgraph.api.RegulatoryActivity;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A dated occurrence on one asset. Each related asset id may receive an
 * {@code event_impact} relationship from {@link #getAssetId()} with strength
 * {@code |impactScore|}.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class RegulatoryEvent {
    private final String id;
    private final String assetId;
    private final RegulatoryActivity eventType;
    private final String date;
    private final String description;
    private final double impactScore;
    private final List<String> relatedAssets;

    public RegulatoryEvent(String id, String assetId, RegulatoryActivity eventType, String date,
            String description, double impactScore, List<String> relatedAssets) {
        this.id = Asset.requireNonBlank(id, "id");
        this.assetId = Asset.requireNonBlank(assetId, "asset_id");
        if (eventType == null)
            throw new ModelValidationException("event_type is required for event " + id);
        this.eventType = eventType;
        this.date = requireIsoDate(date);
        this.description = description == null ? "" : description;
        if (!Double.isFinite(impactScore) || impactScore < -1.0 || impactScore > 1.0)
            throw new ModelValidationException(
                    "impact_score must be between -1.0 and 1.0 for event " + id + ", got " + impactScore);
        this.impactScore = impactScore;

        List<String> related = new ArrayList<>();
        if (relatedAssets != null) {
            for (String rid : relatedAssets) {
                related.add(Asset.requireNonBlank(rid, "related_assets entry"));
            }
        }
        this.relatedAssets = List.copyOf(related);
    }

    private static String requireIsoDate(String date) {
        if (date == null || date.isBlank())
            throw new ModelValidationException("date must be an ISO-8601 string");
        try {
            if (date.indexOf('T') < 0) {
                LocalDate.parse(date);
            } else if (date.endsWith("Z") || date.matches(".*[+-]\\d{2}:\\d{2}$")) {
                OffsetDateTime.parse(date);
            } else {
                LocalDateTime.parse(date);
            }
        } catch (DateTimeParseException e) {
            throw new ModelValidationException("date must be ISO-8601, got '" + date + "'", e);
        }
        return date;
    }
}
