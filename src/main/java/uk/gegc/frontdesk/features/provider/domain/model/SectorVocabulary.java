package uk.gegc.frontdesk.features.provider.domain.model;

import java.util.List;

/**
 * Suggested sector names for clients. Never enforced: a provider may use any non-blank sector.
 */
public final class SectorVocabulary {

    public static final List<String> RECOMMENDED = List.of(
            "medical",
            "dental",
            "real_estate",
            "transportation",
            "laboratory",
            "hospitality",
            "automotive",
            "beauty",
            "legal",
            "education",
            "veterinary",
            "fitness",
            "photography",
            "consulting",
            "maintenance",
            "food_service",
            "entertainment",
            "other"
    );

    private SectorVocabulary() {
        throw new AssertionError("Utility class - do not instantiate");
    }
}
