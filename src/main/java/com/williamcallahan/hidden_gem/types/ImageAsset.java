package com.williamcallahan.hidden_gem.types;

import java.nio.file.Path;
import java.time.Instant;

/**
 * A stored image of a game
 *
 * @param filename opaque filename inside the game directory
 * @param category cover or screenshot
 * @param sourceProvider provider display name, "admin" for uploads, "local" for unlogged files
 * @param storedPath absolute path of the file
 * @param webPath path under which the file is served
 * @param addedAt when the file was recorded, null for unlogged files
 */
public record ImageAsset(String filename,
                         ImageCategory category,
                         String sourceProvider,
                         Path storedPath,
                         String webPath,
                         Instant addedAt) {

    public static final String SOURCE_ADMIN = "admin";
    public static final String SOURCE_LOCAL = "local";

    public boolean isCover() {
        return category == ImageCategory.COVER;
    }

    public ImageAsset withCategory(ImageCategory newCategory) {
        if (newCategory == category) {
            return this;
        }
        return new ImageAsset(filename, newCategory, sourceProvider, storedPath, webPath, addedAt);
    }
}
