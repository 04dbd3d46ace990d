package com.williamcallahan.hidden_gem.types;

/**
 * Image payload returned by a provider before categorization and persistence
 *
 * @param filename provider-assigned filename, categorizable by its prefix
 * @param bytes image content
 * @param sourceProvider provider that returned the image
 * @param sourceUrl URL the bytes were downloaded from
 */
public record RawImage(String filename, byte[] bytes, ProviderId sourceProvider, String sourceUrl) {

    public RawImage withFilename(String newFilename) {
        return new RawImage(newFilename, bytes, sourceProvider, sourceUrl);
    }
}
