package com.schedbot.media;

import lombok.extern.slf4j.Slf4j;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Locale;

/**
 * Bundled placeholder images under {@code <media>/defaults}. Each asset is a
 * small PNG generated on first use.
 */
@Slf4j
public class PlaceholderAssets {

    static final int SIZE = 64;

    private final Path defaultsDir;

    public PlaceholderAssets(Path defaultsDir) {
        this.defaultsDir = defaultsDir;
    }

    /**
     * Path of the named placeholder, generating the file when absent.
     */
    public synchronized Path get(String name) {
        String safe = sanitize(name);
        Path target = defaultsDir.resolve(safe + ".png");
        try {
            if (Files.isRegularFile(target) && Files.size(target) > 0) {
                return target;
            }
            Files.createDirectories(defaultsDir);
            Path tmp = Files.createTempFile(defaultsDir, safe, ".tmp");
            try {
                if (!ImageIO.write(render(safe), "png", tmp.toFile())) {
                    throw new IOException("no PNG writer available");
                }
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            } finally {
                Files.deleteIfExists(tmp);
            }
            log.info("Generated placeholder asset {}", target);
            return target;
        } catch (IOException e) {
            throw new MediaUnavailableException(MediaReference.DEFAULT_ASSET_PREFIX + name,
                    "cannot create placeholder " + safe + ": " + e.getMessage(), e);
        }
    }

    static String sanitize(String name) {
        String cleaned = name == null ? "" : name.trim().toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9_-]", "");
        return cleaned.isEmpty() ? MediaConstants.NOTIFICATION_ASSET : cleaned;
    }

    private static BufferedImage render(String name) {
        // hue derived from the name so different placeholders are told apart
        float hue = (name.hashCode() & 0xff) / 255f;
        BufferedImage img = new BufferedImage(SIZE, SIZE, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = img.createGraphics();
        try {
            g.setColor(Color.getHSBColor(hue, 0.45f, 0.95f));
            g.fillRect(0, 0, SIZE, SIZE);
            g.setColor(Color.getHSBColor(hue, 0.7f, 0.55f));
            g.drawRect(0, 0, SIZE - 1, SIZE - 1);
            g.fillOval(SIZE / 4, SIZE / 4, SIZE / 2, SIZE / 2);
        } finally {
            g.dispose();
        }
        return img;
    }
}
