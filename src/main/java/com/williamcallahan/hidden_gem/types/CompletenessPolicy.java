package com.williamcallahan.hidden_gem.types;

/**
 * What a cached game needs before the resolution engine stops calling providers
 *
 * @param coverCount desired covers, always 1
 * @param screenshotCount desired screenshots
 * @param requireDescription whether a missing description alone makes the cache incomplete
 */
public record CompletenessPolicy(int coverCount, int screenshotCount, boolean requireDescription) {

    public static final int DEFAULT_SCREENSHOT_COUNT = 4;

    public CompletenessPolicy {
        if (coverCount != 1) {
            throw new IllegalArgumentException("Cover count must be 1, was " + coverCount);
        }
        if (screenshotCount < 0) {
            throw new IllegalArgumentException("Screenshot count must not be negative, was " + screenshotCount);
        }
    }

    public static CompletenessPolicy defaults() {
        return new CompletenessPolicy(1, DEFAULT_SCREENSHOT_COUNT, false);
    }

    /**
     * Policy for a caller that wants {@code maxImages} images in total: one cover plus screenshots
     */
    public static CompletenessPolicy forMaxImages(int maxImages, boolean requireDescription) {
        if (maxImages < 1) {
            throw new IllegalArgumentException("maxImages must be at least 1, was " + maxImages);
        }
        return new CompletenessPolicy(1, maxImages - 1, requireDescription);
    }

    public int totalImages() {
        return coverCount + screenshotCount;
    }

    /**
     * Whether satisfying this policy also asks for everything {@code other} asks for
     */
    public boolean covers(CompletenessPolicy other) {
        return screenshotCount >= other.screenshotCount()
            && (requireDescription || !other.requireDescription());
    }

    public CompletenessPolicy withRequireDescription(boolean required) {
        return new CompletenessPolicy(coverCount, screenshotCount, required);
    }
}
