package com.williamcallahan.hidden_gem.types;

/**
 * Result of inspecting the stored assets of a game against a completeness policy
 */
public record CacheStatus(GameKey key,
                          int covers,
                          int screenshots,
                          boolean hasDescription,
                          boolean satisfiesPolicy) {

    public static CacheStatus evaluate(GameKey key, int covers, int screenshots, boolean hasDescription,
                                       CompletenessPolicy policy) {
        boolean satisfied = covers >= policy.coverCount()
            && screenshots >= policy.screenshotCount()
            && (!policy.requireDescription() || hasDescription);
        return new CacheStatus(key, covers, screenshots, hasDescription, satisfied);
    }

    public ImageDeficit deficit(CompletenessPolicy policy) {
        return new ImageDeficit(
            Math.max(0, policy.coverCount() - covers),
            Math.max(0, policy.screenshotCount() - screenshots));
    }

    public int totalImages() {
        return covers + screenshots;
    }
}
