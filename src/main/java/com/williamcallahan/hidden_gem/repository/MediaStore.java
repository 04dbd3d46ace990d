/**
 * Repository interface for stored game media
 *
 * Features:
 * - Narrow contract over images and their sidecar metadata
 * - Lets the filesystem layout be swapped for another blob or key-value store
 * - All failures surface as MediaStoreException
 */
package com.williamcallahan.hidden_gem.repository;

import com.williamcallahan.hidden_gem.types.CompletenessPolicy;
import com.williamcallahan.hidden_gem.types.GameKey;
import com.williamcallahan.hidden_gem.types.ImageAsset;
import com.williamcallahan.hidden_gem.types.MediaMetadata;

import java.time.Instant;
import java.util.List;
import java.util.Set;

public interface MediaStore {

    /**
     * Lists a game's images ordered by the explicit order if one is set, else alphabetically
     *
     * @param key game to list
     * @return assets with their filename-derived category; empty when the game has no directory
     */
    List<ImageAsset> listAssets(GameKey key);

    /**
     * Reads the sidecar metadata, or an empty record when none exists
     */
    MediaMetadata readMetadata(GameKey key);

    boolean hasAsset(GameKey key, String filename);

    /**
     * Stores an admin-supplied image, atomically replacing a file of the same name
     */
    default ImageAsset saveAsset(GameKey key, String filename, byte[] bytes) {
        return saveAsset(key, filename, bytes, ImageAsset.SOURCE_ADMIN);
    }

    /**
     * Stores an image atomically (temp file then rename) and records its provenance
     */
    ImageAsset saveAsset(GameKey key, String filename, byte[] bytes, String sourceProvider);

    /**
     * Removes an image; does not trigger any re-fetch
     *
     * @return true if a file was deleted
     */
    boolean deleteAsset(GameKey key, String filename);

    /**
     * Persists an explicit image order overriding every derived ordering for this game
     */
    void setOrder(GameKey key, List<String> filenames);

    /**
     * Sets an admin description, which the engine never overwrites
     */
    void setDescription(GameKey key, String description);

    /**
     * Stores a provider description only when the game has none yet
     *
     * @return true if the description was stored
     */
    boolean setProviderDescriptionIfAbsent(GameKey key, String description);

    void deleteDescription(GameKey key);

    void setTags(GameKey key, Set<String> tags);

    void deleteTags(GameKey key);

    /**
     * Records a finished provider walk and the policy it tried to satisfy
     */
    void markResolved(GameKey key, Instant resolvedAt, CompletenessPolicy policy);

    /**
     * Games that have a directory under the media root
     */
    List<GameKey> listStoredKeys();
}
