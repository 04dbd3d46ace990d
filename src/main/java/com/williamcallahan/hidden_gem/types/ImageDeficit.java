package com.williamcallahan.hidden_gem.types;

/**
 * Images still missing for a game during a resolution
 */
public record ImageDeficit(int coversNeeded, int screenshotsNeeded) {

    public ImageDeficit {
        if (coversNeeded < 0 || screenshotsNeeded < 0) {
            throw new IllegalArgumentException("Deficit counts must not be negative");
        }
    }

    public int total() {
        return coversNeeded + screenshotsNeeded;
    }

    public boolean isZero() {
        return total() == 0;
    }

    public boolean needsCover() {
        return coversNeeded > 0;
    }

    public ImageDeficit minus(ImageCategory category) {
        if (category == ImageCategory.COVER) {
            return new ImageDeficit(Math.max(0, coversNeeded - 1), screenshotsNeeded);
        }
        return new ImageDeficit(coversNeeded, Math.max(0, screenshotsNeeded - 1));
    }
}
