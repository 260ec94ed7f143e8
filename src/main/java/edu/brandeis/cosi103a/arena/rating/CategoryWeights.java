package edu.brandeis.cosi103a.arena.rating;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Weight of each category in the combined comparison score.
 * Every weight lies in the open interval (0, 1) and the four weights sum to 1.
 */
public record CategoryWeights(
    @JsonProperty("technical_quality") double technicalQuality,
    @JsonProperty("constructiveness") double constructiveness,
    @JsonProperty("clarity") double clarity,
    @JsonProperty("overall_quality") double overallQuality
) {
    static final double SUM_TOLERANCE = 1e-6;

    /**
     * Default weights; overall quality counts twice as much as each other category.
     */
    public static final CategoryWeights DEFAULTS = new CategoryWeights(0.2, 0.2, 0.2, 0.4);

    public CategoryWeights {
        checkRange("technical_quality", technicalQuality);
        checkRange("constructiveness", constructiveness);
        checkRange("clarity", clarity);
        checkRange("overall_quality", overallQuality);
        double total = technicalQuality + constructiveness + clarity + overallQuality;
        if (Math.abs(total - 1.0) > SUM_TOLERANCE) {
            throw new InvalidWeightsException("The sum of all weights must be 1, but it is " + total);
        }
    }

    public double weight(Category category) {
        return switch (category) {
            case TECHNICAL_QUALITY -> technicalQuality;
            case CONSTRUCTIVENESS -> constructiveness;
            case CLARITY -> clarity;
            case OVERALL_QUALITY -> overallQuality;
        };
    }

    public double sum() {
        return technicalQuality + constructiveness + clarity + overallQuality;
    }

    private static void checkRange(String name, double weight) {
        if (!(weight > 0.0 && weight < 1.0)) {
            throw new InvalidWeightsException("Weight " + name + " must be in (0, 1), got " + weight);
        }
    }
}
