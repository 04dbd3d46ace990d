package com.williamcallahan.hidden_gem.types;

/**
 * Category of a stored game image
 * - Exactly one image of a media record is presented as {@link #COVER}
 */
public enum ImageCategory {
    COVER("cover"),
    SCREENSHOT("screenshot");

    private final String label;

    ImageCategory(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
