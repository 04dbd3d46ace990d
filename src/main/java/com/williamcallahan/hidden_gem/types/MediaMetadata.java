/**
 * Sidecar metadata stored next to a game's images
 *
 * Features:
 * - Explicit admin image order, description with its source, tags
 * - Timestamp and policy of the last completed resolution attempt
 * - Append-only log of stored assets recording insertion order and provenance
 * - Immutable; every change produces a new instance
 */
package com.williamcallahan.hidden_gem.types;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record MediaMetadata(String title,
                            String platform,
                            List<String> order,
                            String description,
                            DescriptionSource descriptionSource,
                            Set<String> tags,
                            Instant lastResolvedAt,
                            CompletenessPolicy lastResolvedPolicy,
                            List<AssetEntry> assets) {

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record AssetEntry(String filename, String sourceProvider, Instant addedAt) { }

    public MediaMetadata {
        order = order == null ? null : List.copyOf(order);
        tags = tags == null ? null : Set.copyOf(new LinkedHashSet<>(tags));
        assets = assets == null ? List.of() : List.copyOf(assets);
    }

    public static MediaMetadata empty(GameKey key) {
        return new MediaMetadata(key.title(), key.platform(), null, null, null, null, null, null, List.of());
    }

    @JsonIgnore
    public boolean hasExplicitOrder() {
        return order != null && !order.isEmpty();
    }

    @JsonIgnore
    public boolean hasDescription() {
        return description != null && !description.isBlank();
    }

    @JsonIgnore
    public boolean isAdminDescription() {
        return hasDescription() && descriptionSource == DescriptionSource.ADMIN;
    }

    public Optional<AssetEntry> findAsset(String filename) {
        return assets.stream().filter(a -> a.filename().equals(filename)).findFirst();
    }

    /**
     * Position of a file in the asset log, or -1 when the file was never logged
     */
    public int logIndexOf(String filename) {
        for (int i = 0; i < assets.size(); i++) {
            if (assets.get(i).filename().equals(filename)) {
                return i;
            }
        }
        return -1;
    }

    public MediaMetadata withKey(GameKey key) {
        String newPlatform = key.platform() != null ? key.platform() : platform;
        return new MediaMetadata(key.title(), newPlatform, order, description, descriptionSource, tags, lastResolvedAt, lastResolvedPolicy, assets);
    }

    public MediaMetadata withOrder(List<String> newOrder) {
        return new MediaMetadata(title, platform, newOrder, description, descriptionSource, tags, lastResolvedAt, lastResolvedPolicy, assets);
    }

    public MediaMetadata withDescription(String newDescription, DescriptionSource source) {
        return new MediaMetadata(title, platform, order, newDescription, newDescription == null ? null : source, tags, lastResolvedAt, lastResolvedPolicy, assets);
    }

    public MediaMetadata withTags(Set<String> newTags) {
        return new MediaMetadata(title, platform, order, description, descriptionSource, newTags, lastResolvedAt, lastResolvedPolicy, assets);
    }

    public MediaMetadata withLastResolved(Instant resolvedAt, CompletenessPolicy policy) {
        return new MediaMetadata(title, platform, order, description, descriptionSource, tags, resolvedAt, policy, assets);
    }

    /**
     * Whether the last provider walk asked for at least what {@code policy} wants
     * - Sidecars written before the policy was recorded never match
     */
    public boolean wasResolvedFor(CompletenessPolicy policy) {
        return lastResolvedAt != null && lastResolvedPolicy != null && lastResolvedPolicy.covers(policy);
    }

    /**
     * Records a stored file; a file already in the log keeps its position and gets the new provenance
     */
    public MediaMetadata withAsset(String filename, String sourceProvider, Instant addedAt) {
        List<AssetEntry> updated = new ArrayList<>(assets);
        AssetEntry entry = new AssetEntry(filename, sourceProvider, addedAt);
        int index = logIndexOf(filename);
        if (index >= 0) {
            updated.set(index, entry);
        } else {
            updated.add(entry);
        }
        return new MediaMetadata(title, platform, order, description, descriptionSource, tags, lastResolvedAt, lastResolvedPolicy, updated);
    }

    /**
     * Forgets a deleted file in both the asset log and the explicit order
     */
    public MediaMetadata withoutAsset(String filename) {
        List<AssetEntry> updated = new ArrayList<>(assets);
        updated.removeIf(a -> a.filename().equals(filename));
        List<String> newOrder = order;
        if (order != null && order.contains(filename)) {
            newOrder = new ArrayList<>(order);
            newOrder.remove(filename);
        }
        return new MediaMetadata(title, platform, newOrder, description, descriptionSource, tags, lastResolvedAt, lastResolvedPolicy, updated);
    }
}
