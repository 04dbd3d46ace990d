package com.williamcallahan.hidden_gem.service;

/**
 * Counts of one catalog prefetch run
 *
 * @param inspected games whose cache was inspected
 * @param resolved games sent through a resolution
 * @param alreadyComplete games whose cache already met the policy
 * @param failed resolutions that ended with a store error
 */
public record PrefetchSummary(int inspected, int resolved, int alreadyComplete, int failed) {
}
