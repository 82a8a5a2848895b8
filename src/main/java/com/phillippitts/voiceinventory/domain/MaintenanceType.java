package com.phillippitts.voiceinventory.domain;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Maintenance intervention types with the spoken synonyms the model and operators use for them.
 */
public enum MaintenanceType {
    SCHEDULED("Scheduled", MetaCategory.ORDINARY,
            List.of("scheduled", "routine", "periodic", "planned", "preventive")),
    INSPECTION("Inspection", MetaCategory.ORDINARY,
            List.of("inspection", "check", "verification", "safety check")),
    REPAIR("Repair", MetaCategory.EXTRAORDINARY,
            List.of("repair", "fix", "fixed", "repaired", "corrective")),
    REPLACEMENT("Replacement", MetaCategory.EXTRAORDINARY,
            List.of("replacement", "replace", "replaced", "swap", "substitution")),
    INSTALLATION("Installation", MetaCategory.LIFECYCLE,
            List.of("installation", "install", "installed", "setup")),
    TESTING("Testing", MetaCategory.LIFECYCLE,
            List.of("testing", "test", "acceptance test", "commissioning")),
    DECOMMISSION("Decommission", MetaCategory.LIFECYCLE,
            List.of("decommission", "decommissioned", "disposal", "retired", "scrapped")),
    EXTRAORDINARY("Extraordinary", MetaCategory.EXTRAORDINARY,
            List.of("extraordinary", "emergency", "urgent", "unplanned"));

    public enum MetaCategory {
        ORDINARY,
        EXTRAORDINARY,
        LIFECYCLE
    }

    private final String displayName;
    private final MetaCategory metaCategory;
    private final List<String> synonyms;

    MaintenanceType(String displayName, MetaCategory metaCategory, List<String> synonyms) {
        this.displayName = displayName;
        this.metaCategory = metaCategory;
        this.synonyms = synonyms;
    }

    public String getDisplayName() {
        return displayName;
    }

    public MetaCategory getMetaCategory() {
        return metaCategory;
    }

    public List<String> getSynonyms() {
        return synonyms;
    }

    /**
     * Parses a constant name, display name or synonym (case-insensitive).
     *
     * @return the matching type, or empty if nothing matches
     */
    public static Optional<MaintenanceType> parse(String spoken) {
        if (spoken == null || spoken.isBlank()) {
            return Optional.empty();
        }
        String normalized = spoken.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(t -> t.name().equalsIgnoreCase(normalized)
                        || t.displayName.equalsIgnoreCase(normalized)
                        || t.synonyms.contains(normalized))
                .findFirst();
    }
}
