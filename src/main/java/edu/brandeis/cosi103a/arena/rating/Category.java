package edu.brandeis.cosi103a.arena.rating;

/**
 * The four independent categories a human judges in every comparison.
 */
public enum Category {
    TECHNICAL_QUALITY("technical_quality"),
    CONSTRUCTIVENESS("constructiveness"),
    CLARITY("clarity"),
    OVERALL_QUALITY("overall_quality");

    private final String fieldName;

    Category(String fieldName) {
        this.fieldName = fieldName;
    }

    /**
     * Name of the field carrying this category in vote log records.
     */
    public String fieldName() {
        return fieldName;
    }
}
