package com.trading.assetgraph.viz;

import java.util.Locale;
import java.util.Map;

/** Colours, line styles and labels used when drawing the network. */
public final class VisualizationPalette {
    public static final String NODE_COLOR = "#4ECDC4";
    public static final String DEFAULT_COLOR = "#888888";
    public static final String BASE_TITLE = "Financial Asset Network";

    public static final int BIDIRECTIONAL_WIDTH = 4;
    public static final int DIRECTED_WIDTH = 2;
    public static final String SOLID = "solid";
    public static final String DASH = "dash";

    public static final Map<String, String> REL_TYPE_COLORS = Map.of(
            "same_sector", "#FF6B6B",
            "market_cap_similar", "#4ECDC4",
            "correlation", "#45B7D1",
            "corporate_bond_to_equity", "#96CEB4",
            "commodity_currency", "#FFEAA7",
            "income_comparison", "#DDA0DD",
            "regulatory_impact", "#FFA07A");

    private VisualizationPalette() {
    }

    public static String colorFor(String relationshipType) {
        return REL_TYPE_COLORS.getOrDefault(relationshipType, DEFAULT_COLOR);
    }

    public static String arrow(boolean bidirectional) {
        return bidirectional ? "↔" : "→";
    }

    /** {@code "same_sector"} becomes {@code "Same Sector (↔)"}. */
    public static String traceName(String relationshipType, boolean bidirectional) {
        return titleCase(relationshipType.replace('_', ' ')) + " (" + arrow(bidirectional) + ")";
    }

    public static String edgeHover(String source, String target, String type, boolean bidirectional,
            double strength) {
        return source + " " + arrow(bidirectional) + " " + target + "<br>Type: " + type + "<br>Strength: "
                + String.format(Locale.ROOT, "%.2f", strength);
    }

    public static String directionHover(String source, String target, String type) {
        return "Direction: " + source + " → " + target + "<br>Type: " + type;
    }

    public static String nodeHover(String assetId) {
        return "Asset: " + assetId;
    }

    public static String title(int assets, int relationships) {
        return BASE_TITLE + " - " + assets + " Assets, " + relationships + " Relationships";
    }

    // Capitalizes the first letter of every alphabetic run and lowercases the rest.
    static String titleCase(String s) {
        StringBuilder sb = new StringBuilder(s.length());
        boolean prevLetter = false;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            boolean letter = Character.isLetter(c);
            if (letter)
                sb.append(prevLetter ? Character.toLowerCase(c) : Character.toUpperCase(c));
            else
                sb.append(c);
            prevLetter = letter;
        }
        return sb.toString();
    }
}
