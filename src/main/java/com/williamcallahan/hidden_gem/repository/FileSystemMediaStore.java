/**
 * Filesystem-backed store for game images and their sidecar metadata
 *
 * Features:
 * - One directory per game under the configured media root
 * - Image writes go to a temp file first and are renamed into place
 * - Sidecar {@code .media.json} holds order, description, tags and the asset log
 * - Per-directory locks serialize sidecar read-modify-write cycles
 * - Unreadable sidecars surface as MediaStoreException instead of being silently reset
 */
package com.williamcallahan.hidden_gem.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.williamcallahan.hidden_gem.config.AppConfigurationProperties;
import com.williamcallahan.hidden_gem.exception.MediaStoreException;
import com.williamcallahan.hidden_gem.service.image.ImageCategorizer;
import com.williamcallahan.hidden_gem.types.CompletenessPolicy;
import com.williamcallahan.hidden_gem.types.DescriptionSource;
import com.williamcallahan.hidden_gem.types.GameKey;
import com.williamcallahan.hidden_gem.types.ImageAsset;
import com.williamcallahan.hidden_gem.types.MediaMetadata;
import com.williamcallahan.hidden_gem.util.FilenameUtils;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

@Repository
public class FileSystemMediaStore implements MediaStore {

    private static final Logger logger = LoggerFactory.getLogger(FileSystemMediaStore.class);

    public static final String SIDECAR_FILENAME = ".media.json";

    private final Path root;
    private final String publicUrlPrefix;
    private final ImageCategorizer categorizer;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Map<String, ReentrantLock> directoryLocks = new ConcurrentHashMap<>();

    public FileSystemMediaStore(AppConfigurationProperties properties,
                                ImageCategorizer categorizer,
                                ObjectMapper objectMapper,
                                Clock clock) {
        this.root = Paths.get(properties.getMedia().getRoot()).toAbsolutePath().normalize();
        String prefix = properties.getMedia().getPublicUrlPrefix();
        this.publicUrlPrefix = prefix.endsWith("/") ? prefix.substring(0, prefix.length() - 1) : prefix;
        this.categorizer = categorizer;
        this.objectMapper = objectMapper.copy()
            .findAndRegisterModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);
        this.clock = clock;
    }

    /**
     * Creates the media root if it does not exist yet
     */
    @PostConstruct
    public void init() {
        try {
            Files.createDirectories(root);
            logger.info("Media store initialized at {}", root);
        } catch (IOException e) {
            throw new MediaStoreException("Could not create media root " + root, e);
        }
    }

    public Path getRoot() {
        return root;
    }

    @Override
    public List<ImageAsset> listAssets(GameKey key) {
        Path dir = gameDirectory(key);
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        MediaMetadata metadata = readMetadata(key);
        List<String> filenames = listImageFilenames(dir);

        List<String> ordered = new ArrayList<>(filenames.size());
        if (metadata.hasExplicitOrder()) {
            for (String name : metadata.order()) {
                if (filenames.contains(name) && !ordered.contains(name)) {
                    ordered.add(name);
                }
            }
        }
        for (String name : filenames) {
            if (!ordered.contains(name)) {
                ordered.add(name);
            }
        }

        List<ImageAsset> assets = new ArrayList<>(ordered.size());
        for (String name : ordered) {
            assets.add(toAsset(key, dir, name, metadata));
        }
        return assets;
    }

    @Override
    public MediaMetadata readMetadata(GameKey key) {
        Path sidecar = gameDirectory(key).resolve(SIDECAR_FILENAME);
        if (!Files.exists(sidecar)) {
            return MediaMetadata.empty(key);
        }
        try {
            return objectMapper.readValue(sidecar.toFile(), MediaMetadata.class);
        } catch (IOException e) {
            throw new MediaStoreException("Unreadable metadata for " + key + " at " + sidecar, e);
        }
    }

    @Override
    public boolean hasAsset(GameKey key, String filename) {
        return Files.isRegularFile(gameDirectory(key).resolve(FilenameUtils.requireSafeFilename(filename)));
    }

    @Override
    public ImageAsset saveAsset(GameKey key, String filename, byte[] bytes, String sourceProvider) {
        FilenameUtils.requireSafeFilename(filename);
        if (!FilenameUtils.isImageFile(filename)) {
            throw new IllegalArgumentException("Not an image filename: " + filename);
        }
        if (bytes == null || bytes.length == 0) {
            throw new IllegalArgumentException("Image content for " + filename + " is empty");
        }
        Path dir = gameDirectory(key);
        Instant now = clock.instant();
        MediaMetadata updated = withDirectoryLock(key, () -> {
            writeAtomically(dir, filename, bytes);
            return updateMetadataLocked(key, m -> m.withAsset(filename, sourceProvider, now));
        });
        logger.debug("Stored {} for {} from {} ({} bytes)", filename, key, sourceProvider, bytes.length);
        return toAsset(key, dir, filename, updated);
    }

    @Override
    public boolean deleteAsset(GameKey key, String filename) {
        FilenameUtils.requireSafeFilename(filename);
        Path file = gameDirectory(key).resolve(filename);
        return withDirectoryLock(key, () -> {
            boolean deleted;
            try {
                deleted = Files.deleteIfExists(file);
            } catch (IOException e) {
                throw new MediaStoreException("Could not delete " + file, e);
            }
            if (deleted) {
                updateMetadataLocked(key, m -> m.withoutAsset(filename));
                logger.info("Deleted {} for {}", filename, key);
            }
            return deleted;
        });
    }

    @Override
    public void setOrder(GameKey key, List<String> filenames) {
        List<String> order = new ArrayList<>(new LinkedHashSet<>(filenames));
        order.forEach(FilenameUtils::requireSafeFilename);
        updateMetadata(key, m -> m.withOrder(order.isEmpty() ? null : order));
    }

    @Override
    public void setDescription(GameKey key, String description) {
        if (description == null || description.isBlank()) {
            throw new IllegalArgumentException("Description must not be blank; use deleteDescription to remove it");
        }
        updateMetadata(key, m -> m.withDescription(description.strip(), DescriptionSource.ADMIN));
    }

    @Override
    public boolean setProviderDescriptionIfAbsent(GameKey key, String description) {
        if (description == null || description.isBlank()) {
            return false;
        }
        return withDirectoryLock(key, () -> {
            MediaMetadata current = readMetadata(key);
            if (current.hasDescription()) {
                return false;
            }
            writeMetadataLocked(key, current.withKey(key).withDescription(description.strip(), DescriptionSource.PROVIDER));
            return true;
        });
    }

    @Override
    public void deleteDescription(GameKey key) {
        updateMetadata(key, m -> m.withDescription(null, null));
    }

    @Override
    public void setTags(GameKey key, Set<String> tags) {
        Set<String> cleaned = new LinkedHashSet<>();
        for (String tag : tags) {
            if (tag != null && !tag.isBlank()) {
                cleaned.add(tag.strip());
            }
        }
        updateMetadata(key, m -> m.withTags(cleaned.isEmpty() ? null : cleaned));
    }

    @Override
    public void deleteTags(GameKey key) {
        updateMetadata(key, m -> m.withTags(null));
    }

    @Override
    public void markResolved(GameKey key, Instant resolvedAt, CompletenessPolicy policy) {
        updateMetadata(key, m -> m.withLastResolved(resolvedAt, policy));
    }

    @Override
    public List<GameKey> listStoredKeys() {
        if (!Files.isDirectory(root)) {
            return List.of();
        }
        List<GameKey> keys = new ArrayList<>();
        try (DirectoryStream<Path> dirs = Files.newDirectoryStream(root, Files::isDirectory)) {
            for (Path dir : dirs) {
                keys.add(keyForDirectory(dir));
            }
        } catch (IOException e) {
            throw new MediaStoreException("Could not list media root " + root, e);
        }
        keys.sort(Comparator.comparing(GameKey::title));
        return keys;
    }

    Path gameDirectory(GameKey key) {
        return root.resolve(key.directoryName());
    }

    private GameKey keyForDirectory(Path dir) {
        Path sidecar = dir.resolve(SIDECAR_FILENAME);
        if (Files.exists(sidecar)) {
            try {
                MediaMetadata metadata = objectMapper.readValue(sidecar.toFile(), MediaMetadata.class);
                if (metadata.title() != null && !metadata.title().isBlank()) {
                    return GameKey.of(metadata.title(), metadata.platform());
                }
            } catch (IOException e) {
                logger.warn("Unreadable metadata in {}, falling back to directory name: {}", dir, e.getMessage());
            }
        }
        return GameKey.of(dir.getFileName().toString().replace('_', ' '));
    }

    private List<String> listImageFilenames(Path dir) {
        List<String> names = new ArrayList<>();
        try (DirectoryStream<Path> files = Files.newDirectoryStream(dir)) {
            for (Path file : files) {
                String name = file.getFileName().toString();
                if (Files.isRegularFile(file) && FilenameUtils.isImageFile(name)) {
                    names.add(name);
                }
            }
        } catch (IOException e) {
            throw new MediaStoreException("Could not list images in " + dir, e);
        }
        names.sort(Comparator.naturalOrder());
        return names;
    }

    private ImageAsset toAsset(GameKey key, Path dir, String filename, MediaMetadata metadata) {
        MediaMetadata.AssetEntry entry = metadata.findAsset(filename).orElse(null);
        String source = entry != null && entry.sourceProvider() != null ? entry.sourceProvider() : ImageAsset.SOURCE_LOCAL;
        Instant addedAt = entry != null ? entry.addedAt() : null;
        String webPath = publicUrlPrefix + "/" + key.directoryName() + "/" + filename;
        return new ImageAsset(filename, categorizer.categorize(filename), source, dir.resolve(filename), webPath, addedAt);
    }

    private void updateMetadata(GameKey key, UnaryOperator<MediaMetadata> change) {
        withDirectoryLock(key, () -> updateMetadataLocked(key, change));
    }

    private MediaMetadata updateMetadataLocked(GameKey key, UnaryOperator<MediaMetadata> change) {
        MediaMetadata updated = change.apply(readMetadata(key).withKey(key));
        writeMetadataLocked(key, updated);
        return updated;
    }

    private void writeMetadataLocked(GameKey key, MediaMetadata metadata) {
        try {
            writeAtomically(gameDirectory(key), SIDECAR_FILENAME, objectMapper.writeValueAsBytes(metadata));
        } catch (IOException e) {
            throw new MediaStoreException("Could not serialize metadata for " + key, e);
        }
    }

    private void writeAtomically(Path dir, String filename, byte[] bytes) {
        Path target = dir.resolve(filename);
        Path temp = dir.resolve("." + filename + "." + UUID.randomUUID() + ".tmp");
        try {
            Files.createDirectories(dir);
            Files.write(temp, bytes);
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            try {
                Files.deleteIfExists(temp);
            } catch (IOException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw new MediaStoreException("Could not write " + target, e);
        }
    }

    private <T> T withDirectoryLock(GameKey key, Supplier<T> action) {
        ReentrantLock lock = directoryLocks.computeIfAbsent(key.directoryName(), k -> new ReentrantLock());
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}
