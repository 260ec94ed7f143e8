package edu.brandeis.cosi103a.arena.rating;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Result of one human comparison between competitor A and competitor B.
 *
 * @param competitorA the A side; scores are expressed from its perspective
 * @param competitorB the B side
 * @param judgements  one judgement for each of the four categories
 */
public record ComparisonOutcome(
    String competitorA,
    String competitorB,
    ImmutableMap<Category, Judgement> judgements
) {
    public ComparisonOutcome {
        Objects.requireNonNull(competitorA, "competitorA");
        Objects.requireNonNull(competitorB, "competitorB");
        Objects.requireNonNull(judgements, "judgements");
        for (Category category : Category.values()) {
            if (!judgements.containsKey(category)) {
                throw new IllegalArgumentException("Missing judgement for " + category.fieldName());
            }
        }
    }

    /**
     * Builds an outcome from the four category judgements.
     */
    public static ComparisonOutcome of(String competitorA, String competitorB,
                                       Judgement technicalQuality, Judgement constructiveness,
                                       Judgement clarity, Judgement overallQuality) {
        Map<Category, Judgement> judgements = new EnumMap<>(Category.class);
        judgements.put(Category.TECHNICAL_QUALITY, Objects.requireNonNull(technicalQuality, "technicalQuality"));
        judgements.put(Category.CONSTRUCTIVENESS, Objects.requireNonNull(constructiveness, "constructiveness"));
        judgements.put(Category.CLARITY, Objects.requireNonNull(clarity, "clarity"));
        judgements.put(Category.OVERALL_QUALITY, Objects.requireNonNull(overallQuality, "overallQuality"));
        return new ComparisonOutcome(competitorA, competitorB, Maps.immutableEnumMap(judgements));
    }

    /**
     * Same judgement in every category.
     */
    public static ComparisonOutcome uniform(String competitorA, String competitorB, Judgement judgement) {
        return of(competitorA, competitorB, judgement, judgement, judgement, judgement);
    }

    public Judgement judgement(Category category) {
        return judgements.get(category);
    }
}
