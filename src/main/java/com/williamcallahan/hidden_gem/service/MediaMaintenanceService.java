package com.williamcallahan.hidden_gem.service;

import com.williamcallahan.hidden_gem.repository.MediaStore;
import com.williamcallahan.hidden_gem.types.DescriptionSource;
import com.williamcallahan.hidden_gem.types.GameKey;
import com.williamcallahan.hidden_gem.types.MediaMetadata;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Housekeeping over the stored media
 * - Clears provider descriptions too short to be useful so the next resolution fetches them again
 * - Admin descriptions are never touched
 */
@Slf4j
@Service
public class MediaMaintenanceService {

    static final int MIN_DESCRIPTION_LENGTH = 100;

    private final MediaStore mediaStore;

    public MediaMaintenanceService(MediaStore mediaStore) {
        this.mediaStore = mediaStore;
    }

    /**
     * @return number of descriptions removed
     */
    public int clearShortProviderDescriptions() {
        int removed = 0;
        int kept = 0;
        for (GameKey key : mediaStore.listStoredKeys()) {
            MediaMetadata metadata = mediaStore.readMetadata(key);
            if (!metadata.hasDescription()) {
                continue;
            }
            if (metadata.descriptionSource() == DescriptionSource.PROVIDER
                    && metadata.description().length() < MIN_DESCRIPTION_LENGTH) {
                mediaStore.deleteDescription(key);
                removed++;
                log.info("Removed short provider description of {} ({} chars)", key, metadata.description().length());
            } else {
                kept++;
            }
        }
        log.info("Cleared {} short provider description(s), kept {}", removed, kept);
        return removed;
    }
}
