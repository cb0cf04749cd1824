package com.schedbot.media;

import com.schedbot.common.infra.ContentHash;
import com.schedbot.media.MediaConstants.MediaKind;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Turns media references into local files.
 * <p>
 * URL and inline references are content-addressed: the SHA-256 of the
 * reference names the file under {@code downloads/}, so the same reference
 * always maps to the same file. Cached files are never refreshed; only
 * {@link #invalidate(String)} and {@link #pruneOlderThan(Duration)} drop them.
 */
@Slf4j
public class MediaResolver {

    static final List<String> MANAGED_FOLDERS = List.of(
            MediaConstants.DOWNLOADS_DIR, MediaKind.IMAGE.folder(), MediaKind.VIDEO.folder(),
            MediaKind.AUDIO.folder(), MediaKind.DOCUMENT.folder(),
            MediaConstants.API_RESPONSES_DIR, MediaConstants.DEFAULTS_DIR);

    private static final int BUFFER_SIZE = 8192;
    private static final int LOCK_STRIPES = 64;

    private final Path mediaDir;
    private final Path downloadsDir;
    private final OkHttpClient httpClient;
    private final long maxBytes;
    private final PlaceholderAssets placeholders;

    /** hash -> cached file */
    private final Map<String, Path> index = new ConcurrentHashMap<>();
    /** Striped per-key locks; the set stays fixed however many URLs pass through. */
    private final Object[] keyLocks = new Object[LOCK_STRIPES];

    public MediaResolver(Path mediaDir, Duration downloadTimeout, long maxBytes) {
        this(mediaDir, new OkHttpClient.Builder()
                .connectTimeout(10, TimeUnit.SECONDS)
                .callTimeout(downloadTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .build(), maxBytes);
    }

    /** Package-private for testing with a custom client. */
    MediaResolver(Path mediaDir, OkHttpClient httpClient, long maxBytes) {
        this.mediaDir = mediaDir;
        this.downloadsDir = mediaDir.resolve(MediaConstants.DOWNLOADS_DIR);
        this.httpClient = httpClient;
        this.maxBytes = maxBytes;
        this.placeholders = new PlaceholderAssets(mediaDir.resolve(MediaConstants.DEFAULTS_DIR));
        for (int i = 0; i < LOCK_STRIPES; i++) {
            keyLocks[i] = new Object();
        }
        ensureDirectories();
        rebuildIndex();
    }

    public Path getMediaDir() {
        return mediaDir;
    }

    public Path getApiResponsesDir() {
        return mediaDir.resolve(MediaConstants.API_RESPONSES_DIR);
    }

    /**
     * Create the managed folders under the media root.
     */
    public final void ensureDirectories() {
        for (String folder : MANAGED_FOLDERS) {
            try {
                Files.createDirectories(mediaDir.resolve(folder));
            } catch (IOException e) {
                log.warn("Cannot create media folder {}: {}", mediaDir.resolve(folder), e.getMessage());
            }
        }
    }

    private void rebuildIndex() {
        if (!Files.isDirectory(downloadsDir)) {
            return;
        }
        try (DirectoryStream<Path> files = Files.newDirectoryStream(downloadsDir)) {
            for (Path file : files) {
                String name = file.getFileName().toString();
                int dot = name.indexOf('.');
                if (dot == 64 && Files.isRegularFile(file)) {
                    index.put(name.substring(0, dot), file);
                }
            }
        } catch (IOException e) {
            log.warn("Cannot scan {}: {}", downloadsDir, e.getMessage());
        }
        log.debug("Media index holds {} cached files", index.size());
    }

    public Path resolve(String ref) {
        return resolve(ref, MediaKind.UNKNOWN);
    }

    /**
     * Resolve a reference to a local file.
     *
     * @param kindHint which media slot the reference came from; picks the
     *                 sub-folder relative local paths are looked up in
     * @throws MediaUnavailableException for unusable inline or local references.
     *                                   URL references never throw; a failed
     *                                   download yields the notification placeholder.
     */
    public Path resolve(String ref, MediaKind kindHint) {
        MediaReference parsed = MediaReference.parse(ref);
        switch (parsed.type()) {
            case DEFAULT_ASSET:
                return placeholders.get(parsed.value());
            case URL:
                try {
                    return fetchUrl(parsed.value());
                } catch (MediaUnavailableException e) {
                    log.warn("Media download failed for {}, using placeholder: {}",
                            parsed.abbreviate(), e.getMessage());
                    return placeholders.get(MediaConstants.NOTIFICATION_ASSET);
                }
            case INLINE:
                return storeInline(parsed);
            case LOCAL_PATH:
            default:
                return resolveLocal(parsed.value(), kindHint == null ? MediaKind.UNKNOWN : kindHint);
        }
    }

    /**
     * Download a URL into the cache without falling back to a placeholder.
     *
     * @return true if the file is cached afterwards
     */
    public boolean prefetch(String url) {
        try {
            fetchUrl(MediaReference.parse(url).value());
            return true;
        } catch (MediaUnavailableException e) {
            log.warn("Prefetch of {} failed: {}", url, e.getMessage());
            return false;
        }
    }

    /**
     * Drop the cached file of a URL or inline reference.
     *
     * @return true if something was removed
     */
    public boolean invalidate(String ref) {
        String key = ContentHash.sha256Hex(ref.trim());
        synchronized (lockFor(key)) {
            Path cached = index.remove(key);
            if (cached == null) {
                return false;
            }
            try {
                Files.deleteIfExists(cached);
            } catch (IOException e) {
                log.warn("Cannot delete {}: {}", cached, e.getMessage());
            }
            return true;
        }
    }

    /**
     * Delete downloaded files last modified before {@code maxAge} ago.
     *
     * @return number of files removed
     */
    public int pruneOlderThan(Duration maxAge) {
        Instant cutoff = Instant.now().minus(maxAge);
        int removed = 0;
        for (Map.Entry<String, Path> entry : Map.copyOf(index).entrySet()) {
            synchronized (lockFor(entry.getKey())) {
                Path file = entry.getValue();
                try {
                    if (!Files.exists(file) || Files.getLastModifiedTime(file).toInstant().isBefore(cutoff)) {
                        Files.deleteIfExists(file);
                        index.remove(entry.getKey());
                        removed++;
                    }
                } catch (IOException e) {
                    log.warn("Cannot prune {}: {}", file, e.getMessage());
                }
            }
        }
        if (removed > 0) {
            log.info("Pruned {} cached media files older than {}", removed, maxAge);
        }
        return removed;
    }

    int indexSize() {
        return index.size();
    }

    // =========================================================================
    // URL downloads
    // =========================================================================

    private Path fetchUrl(String url) {
        HttpUrl httpUrl = HttpUrl.parse(url);
        if (httpUrl == null) {
            throw new MediaUnavailableException(url, "malformed URL");
        }
        String key = ContentHash.sha256Hex(url);
        synchronized (lockFor(key)) {
            Path cached = cachedFile(key);
            if (cached != null) {
                log.debug("Media cache hit for {}", url);
                return cached;
            }
            Path downloaded = download(url, httpUrl, key);
            index.put(key, downloaded);
            return downloaded;
        }
    }

    private Path download(String url, HttpUrl httpUrl, String key) {
        Request request = new Request.Builder().url(httpUrl).get().build();
        Path tmp = null;
        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw new MediaUnavailableException(url, "HTTP " + response.code());
            }
            ResponseBody body = response.body();
            if (body == null) {
                throw new MediaUnavailableException(url, "empty response body");
            }
            if (body.contentLength() > maxBytes) {
                throw new MediaUnavailableException(url, "file too large: " + body.contentLength());
            }
            String ext = MediaConstants.extensionOf(httpUrl.encodedPath());
            if (!MediaConstants.isRecognizedExtension(ext)) {
                ext = MediaConstants.extensionFromMime(response.header("Content-Type"));
            }
            if (!MediaConstants.isRecognizedExtension(ext)) {
                throw new MediaUnavailableException(url, "unrecognized media type");
            }
            tmp = Files.createTempFile(downloadsDir, key, ".part");
            long size;
            try (InputStream in = body.byteStream(); OutputStream out = Files.newOutputStream(tmp)) {
                size = copyBounded(in, out, url);
            }
            if (size == 0) {
                throw new MediaUnavailableException(url, "downloaded file is empty");
            }
            Path target = downloadsDir.resolve(key + "." + ext);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            log.info("Downloaded {} ({} bytes) to {}", url, size, target.getFileName());
            return target;
        } catch (IOException e) {
            throw new MediaUnavailableException(url, "download failed: " + e.getMessage(), e);
        } finally {
            deleteQuietly(tmp);
        }
    }

    private long copyBounded(InputStream in, OutputStream out, String url) throws IOException {
        byte[] buffer = new byte[BUFFER_SIZE];
        long total = 0;
        int read;
        while ((read = in.read(buffer)) != -1) {
            total += read;
            if (total > maxBytes) {
                throw new MediaUnavailableException(url, "file exceeds " + maxBytes + " bytes");
            }
            out.write(buffer, 0, read);
        }
        return total;
    }

    // =========================================================================
    // Inline payloads
    // =========================================================================

    private Path storeInline(MediaReference ref) {
        String key = ContentHash.sha256Hex(ref.value());
        synchronized (lockFor(key)) {
            Path cached = cachedFile(key);
            if (cached != null) {
                return cached;
            }
            MediaReference.InlinePayload payload = ref.decodeInline();
            if (payload.bytes().length == 0) {
                throw new MediaUnavailableException(ref.abbreviate(), "inline payload is empty");
            }
            if (payload.bytes().length > maxBytes) {
                throw new MediaUnavailableException(ref.abbreviate(), "inline payload too large");
            }
            String ext = MediaConstants.extensionFromMime(payload.mimeType());
            if (!MediaConstants.isRecognizedExtension(ext)) {
                throw new MediaUnavailableException(ref.abbreviate(),
                        "unsupported inline type " + payload.mimeType());
            }
            Path target = downloadsDir.resolve(key + "." + ext);
            Path tmp = null;
            try {
                tmp = Files.createTempFile(downloadsDir, key, ".part");
                Files.write(tmp, payload.bytes());
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            } catch (IOException e) {
                throw new MediaUnavailableException(ref.abbreviate(), "cannot store inline payload", e);
            } finally {
                deleteQuietly(tmp);
            }
            index.put(key, target);
            log.debug("Stored inline {} payload as {}", payload.mimeType(), target.getFileName());
            return target;
        }
    }

    // =========================================================================
    // Local paths
    // =========================================================================

    private Path resolveLocal(String value, MediaKind kindHint) {
        Path raw;
        try {
            raw = Path.of(value);
        } catch (java.nio.file.InvalidPathException e) {
            throw new MediaUnavailableException(value, "invalid path", e);
        }
        if (raw.isAbsolute()) {
            return requireUsable(raw, value);
        }
        if (kindHint.folder() != null) {
            Path underKind = mediaDir.resolve(kindHint.folder()).resolve(raw).normalize();
            if (Files.isRegularFile(underKind)) {
                return requireUsable(underKind, value);
            }
        }
        return requireUsable(mediaDir.resolve(raw).normalize(), value);
    }

    private static Path requireUsable(Path path, String ref) {
        try {
            if (!Files.isRegularFile(path)) {
                throw new MediaUnavailableException(ref, "file not found: " + path);
            }
            if (Files.size(path) == 0) {
                throw new MediaUnavailableException(ref, "file is empty: " + path);
            }
        } catch (IOException e) {
            throw new MediaUnavailableException(ref, "cannot read " + path, e);
        }
        return path;
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    Object lockFor(String key) {
        return keyLocks[Math.floorMod(key.hashCode(), LOCK_STRIPES)];
    }

    private Path cachedFile(String key) {
        Path cached = index.get(key);
        if (cached == null) {
            return null;
        }
        if (Files.exists(cached)) {
            return cached;
        }
        // removed out from under us; treat as a miss
        index.remove(key);
        return null;
    }

    private static void deleteQuietly(Path path) {
        if (path == null) {
            return;
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.debug("Cannot delete temp file {}: {}", path, e.getMessage());
        }
    }
}
