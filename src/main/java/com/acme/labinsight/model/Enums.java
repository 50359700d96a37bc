package com.acme.labinsight.model;

import java.util.Locale;
import java.util.Set;

public final class Enums {
    private Enums() {}

    public enum Status {
        NORMAL, BORDERLINE, ABNORMAL;
        public String label() { return name().toLowerCase(Locale.ROOT); }
    }

    public enum Urgency {
        ROUTINE, SOON, URGENT;
        public String label() { return name().toLowerCase(Locale.ROOT); }
    }

    /** Ordered by severity; {@link #rank()} is the fusion rank. */
    public enum RiskLevel {
        LOW, MODERATE, HIGH;

        public int rank() { return ordinal(); }
        public String label() { return name().toLowerCase(Locale.ROOT); }

        public static RiskLevel fromRank(int rank) {
            if (rank >= 2) return HIGH;
            if (rank >= 1) return MODERATE;
            return LOW;
        }

        /** Anything other than "high" or "moderate" counts as low. */
        public static RiskLevel fromLabel(String label) {
            if (label == null) return LOW;
            String l = label.trim().toLowerCase(Locale.ROOT);
            if (l.equals("high")) return HIGH;
            if (l.equals("moderate")) return MODERATE;
            return LOW;
        }
    }

    public enum PanelType {
        CBC("CBC", Set.of("cbc")),
        LIPID("Lipid Profile", Set.of("lipid", "lipid profile")),
        URINALYSIS("Urinalysis", Set.of("urinalysis")),
        GENERIC("Generic", Set.of());

        private final String displayName;
        private final Set<String> tags;

        PanelType(String displayName, Set<String> tags) {
            this.displayName = displayName;
            this.tags = tags;
        }

        public String displayName() { return displayName; }

        public static PanelType fromTag(String tag) {
            if (tag == null) return GENERIC;
            String t = tag.trim().toLowerCase(Locale.ROOT);
            for (PanelType p : values()) {
                if (p.tags.contains(t)) return p;
            }
            return GENERIC;
        }
    }
}
