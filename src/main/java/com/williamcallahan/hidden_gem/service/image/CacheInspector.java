/**
 * Counts what is already stored for a game and checks it against a completeness policy
 *
 * Features:
 * - Reads the game directory and sidecar only; never touches the network
 * - Counts at most one cover, matching the record where extra cover-named files show as screenshots
 * - An admin's explicit order makes its first image the cover even without a cover-like filename
 */
package com.williamcallahan.hidden_gem.service.image;

import com.williamcallahan.hidden_gem.repository.MediaStore;
import com.williamcallahan.hidden_gem.types.CacheStatus;
import com.williamcallahan.hidden_gem.types.CompletenessPolicy;
import com.williamcallahan.hidden_gem.types.GameKey;
import com.williamcallahan.hidden_gem.types.ImageAsset;
import com.williamcallahan.hidden_gem.types.MediaMetadata;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class CacheInspector {

    private final MediaStore mediaStore;

    public CacheInspector(MediaStore mediaStore) {
        this.mediaStore = mediaStore;
    }

    public CacheStatus inspect(GameKey key, CompletenessPolicy policy) {
        return inspect(key, mediaStore.listAssets(key), mediaStore.readMetadata(key), policy);
    }

    /**
     * Evaluates an already loaded listing, used when the caller needs the assets anyway
     */
    public CacheStatus inspect(GameKey key, List<ImageAsset> assets, MediaMetadata metadata, CompletenessPolicy policy) {
        boolean hasCoverFile = assets.stream().anyMatch(ImageAsset::isCover);
        int covers = hasCoverFile || (!assets.isEmpty() && metadata.hasExplicitOrder()) ? 1 : 0;
        int screenshots = assets.size() - covers;
        return CacheStatus.evaluate(key, covers, screenshots, metadata.hasDescription(), policy);
    }
}
