package com.williamcallahan.hidden_gem.types;

/**
 * Image a provider offers for download, already named and categorized
 *
 * @param url absolute source URL
 * @param filename filename to store the image under
 * @param category category implied by the filename prefix
 */
public record ImageCandidate(String url, String filename, ImageCategory category) {
}
