/**
 * Classifies stored game images as cover or screenshot from their filenames
 *
 * Features:
 * - Fixed ordered rule set: cover tokens first, explicit screenshot token next
 * - Unmatched filenames default to screenshot
 * - Pure and deterministic so write-time labels agree with later cache inspection
 */
package com.williamcallahan.hidden_gem.service.image;

import com.williamcallahan.hidden_gem.types.ImageCategory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

@Component
public class ImageCategorizer {

    private record Rule(String prefix, ImageCategory category) { }

    // Order matters: the first matching prefix wins
    private static final List<Rule> RULES = List.of(
        new Rule("cover_", ImageCategory.COVER),
        new Rule("boxart_", ImageCategory.COVER),
        new Rule("background_", ImageCategory.COVER),
        new Rule("poster_", ImageCategory.COVER),
        new Rule("artwork_", ImageCategory.COVER),
        new Rule("screenshot_", ImageCategory.SCREENSHOT)
    );

    /**
     * Prefix used when a screenshot is promoted to be a game's cover
     */
    public static final String PROMOTED_COVER_PREFIX = "cover_";

    public ImageCategory categorize(String filename) {
        if (filename == null || filename.isBlank()) {
            return ImageCategory.SCREENSHOT;
        }
        String name = filename.toLowerCase(Locale.ROOT);
        for (Rule rule : RULES) {
            if (name.startsWith(rule.prefix())) {
                return rule.category();
            }
        }
        return ImageCategory.SCREENSHOT;
    }

    public boolean isCover(String filename) {
        return categorize(filename) == ImageCategory.COVER;
    }

    /**
     * Filename under which a screenshot is stored when promoted to cover, so re-inspection labels it
     * a cover as well
     */
    public String promotedCoverFilename(String filename) {
        if (isCover(filename)) {
            return filename;
        }
        return PROMOTED_COVER_PREFIX + filename;
    }
}
