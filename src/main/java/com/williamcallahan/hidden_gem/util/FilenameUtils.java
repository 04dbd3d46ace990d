/**
 * Helpers for game media filenames
 *
 * - Provider filenames are a category prefix plus the first 8 hex chars of the URL's MD5
 * - Only a fixed set of image extensions is recognized in game directories
 */
package com.williamcallahan.hidden_gem.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Set;

public final class FilenameUtils {

    public static final Set<String> IMAGE_EXTENSIONS = Set.of(".jpg", ".jpeg", ".png", ".gif", ".webp");

    private FilenameUtils() {
        // Prevent instantiation
    }

    /**
     * Builds a provider filename like {@code screenshot_1a2b3c4d.jpg}
     *
     * @param prefix category prefix including its trailing underscore
     * @param url source URL of the image
     * @return deterministic filename for the URL
     */
    public static String providerFilename(String prefix, String url) {
        return prefix + shortHash(url) + extensionOf(url);
    }

    public static String shortHash(String value) {
        try {
            MessageDigest md = MessageDigest.getInstance("MD5");
            byte[] hash = md.digest(value.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash).substring(0, 8);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 algorithm not available", e);
        }
    }

    /**
     * Image extension of a URL or filename, {@code .jpg} when none is recognized
     */
    public static String extensionOf(String urlOrName) {
        if (urlOrName == null) {
            return ".jpg";
        }
        String path = urlOrName;
        int query = path.indexOf('?');
        if (query >= 0) {
            path = path.substring(0, query);
        }
        int dot = path.lastIndexOf('.');
        if (dot >= 0 && dot > path.lastIndexOf('/')) {
            String ext = path.substring(dot).toLowerCase(Locale.ROOT);
            if (IMAGE_EXTENSIONS.contains(ext)) {
                return ext;
            }
        }
        return ".jpg";
    }

    public static boolean isImageFile(String filename) {
        if (filename == null || filename.startsWith(".")) {
            return false;
        }
        int dot = filename.lastIndexOf('.');
        return dot > 0 && IMAGE_EXTENSIONS.contains(filename.substring(dot).toLowerCase(Locale.ROOT));
    }

    /**
     * Rejects names that could escape the game directory or collide with store internals
     *
     * @throws IllegalArgumentException for blank names, path separators, ".." or a leading dot
     */
    public static String requireSafeFilename(String filename) {
        if (filename == null || filename.isBlank()) {
            throw new IllegalArgumentException("Filename must not be blank");
        }
        if (filename.contains("/") || filename.contains("\\") || filename.contains("..")
                || filename.startsWith(".") || filename.indexOf('\0') >= 0) {
            throw new IllegalArgumentException("Unsafe filename: " + filename);
        }
        return filename;
    }
}
