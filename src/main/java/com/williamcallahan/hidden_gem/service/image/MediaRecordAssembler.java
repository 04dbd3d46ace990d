/**
 * Builds the caller-facing MediaRecord from stored assets and sidecar metadata
 *
 * Ordering rules:
 * - An explicit admin order wins outright; its first image is presented as the cover
 * - Otherwise the earliest stored cover goes first, then the remaining images in insertion order,
 *   then files the store never logged (dropped in by hand) alphabetically
 * - Only one image is ever presented as a cover; extra covers are shown as screenshots
 * - A game without any cover-like file presents its first image as the cover, without renaming it
 */
package com.williamcallahan.hidden_gem.service.image;

import com.williamcallahan.hidden_gem.types.GameKey;
import com.williamcallahan.hidden_gem.types.ImageAsset;
import com.williamcallahan.hidden_gem.types.ImageCategory;
import com.williamcallahan.hidden_gem.types.MediaMetadata;
import com.williamcallahan.hidden_gem.types.MediaRecord;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

@Component
public class MediaRecordAssembler {

    public MediaRecord assemble(GameKey key, List<ImageAsset> assets, MediaMetadata metadata) {
        List<ImageAsset> ordered = metadata.hasExplicitOrder()
            ? new ArrayList<>(assets)
            : coverFirst(assets, metadata);

        List<ImageAsset> images = new ArrayList<>(ordered.size());
        for (int i = 0; i < ordered.size(); i++) {
            images.add(ordered.get(i).withCategory(i == 0 ? ImageCategory.COVER : ImageCategory.SCREENSHOT));
        }
        return new MediaRecord(key, images, metadata.description(), metadata.descriptionSource(),
            metadata.tags(), metadata.lastResolvedAt());
    }

    private List<ImageAsset> coverFirst(List<ImageAsset> assets, MediaMetadata metadata) {
        Comparator<ImageAsset> insertionOrder = Comparator
            .comparingInt((ImageAsset a) -> {
                int index = metadata.logIndexOf(a.filename());
                return index < 0 ? Integer.MAX_VALUE : index;
            })
            .thenComparing(ImageAsset::filename);

        List<ImageAsset> sorted = new ArrayList<>(assets);
        sorted.sort(insertionOrder);

        sorted.stream()
            .filter(ImageAsset::isCover)
            .findFirst()
            .ifPresent(cover -> {
                sorted.remove(cover);
                sorted.add(0, cover);
            });
        return sorted;
    }
}
