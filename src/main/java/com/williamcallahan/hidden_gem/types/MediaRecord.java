package com.williamcallahan.hidden_gem.types;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Resolved media of one game as returned to callers
 * - {@code images} holds the cover (if any) at index 0
 * - {@code imageCount} always equals {@code images.size()}
 */
public record MediaRecord(GameKey key,
                          List<ImageAsset> images,
                          String description,
                          DescriptionSource descriptionSource,
                          Set<String> tags,
                          Instant lastResolvedAt) {

    public MediaRecord {
        images = images == null ? List.of() : List.copyOf(images);
        tags = tags == null ? Set.of() : Set.copyOf(tags);
    }

    public int imageCount() {
        return images.size();
    }

    public Optional<ImageAsset> cover() {
        return images.isEmpty() ? Optional.empty() : Optional.of(images.get(0)).filter(ImageAsset::isCover);
    }

    public boolean hasDescription() {
        return description != null && !description.isBlank();
    }

    public boolean isAdminDescription() {
        return hasDescription() && descriptionSource == DescriptionSource.ADMIN;
    }

    /**
     * Copy limited to the first {@code maxImages} images
     */
    public MediaRecord limitImages(int maxImages) {
        if (images.size() <= maxImages) {
            return this;
        }
        return new MediaRecord(key, images.subList(0, maxImages), description, descriptionSource, tags, lastResolvedAt);
    }
}
