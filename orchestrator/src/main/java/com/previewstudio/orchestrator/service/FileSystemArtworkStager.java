package com.previewstudio.orchestrator.service;

import com.previewstudio.orchestrator.config.PreviewProperties;
import com.previewstudio.orchestrator.model.ArtworkSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Copies base artwork from local directories into the job's input folder.
 *
 * Lookup order per target: configured asset directories (ASSET_DIRECTORY),
 * the original-posters folder (ORIGINAL_POSTER), then exported current
 * posters (PLEX_CURRENT, which may already carry overlays). In each
 * directory {id}.jpg, {id}.jpeg and {id}.png are tried; PNGs are
 * re-encoded so the staged file is always a JPEG named {id}.jpg.
 */
@Component
public class FileSystemArtworkStager implements ArtworkStager {

    private static final Logger log = LoggerFactory.getLogger(FileSystemArtworkStager.class);

    private static final List<String> EXTENSIONS = List.of("jpg", "jpeg", "png");

    private final PreviewProperties.Artwork artwork;

    public FileSystemArtworkStager(PreviewProperties properties) {
        this.artwork = properties.getArtwork();
    }

    @Override
    public List<StagedArtwork> stage(String jobId, List<ResolvedTarget> targets, Path inputDir) {
        List<StagedArtwork> staged = new ArrayList<>();
        for (ResolvedTarget target : targets) {
            staged.add(stageOne(target, inputDir));
        }
        return staged;
    }

    private StagedArtwork stageOne(ResolvedTarget target, Path inputDir) {
        List<String> warnings = new ArrayList<>();
        for (SourceDir dir : sourceDirs()) {
            Optional<Path> found = find(dir.path(), target.id());
            if (found.isEmpty()) continue;
            try {
                copyAsJpeg(found.get(), inputDir.resolve(target.id() + ".jpg"));
                if (dir.source() == ArtworkSource.PLEX_CURRENT) {
                    warnings.add("Using current artwork for " + target.id() + " (may contain existing overlays)");
                }
                return new StagedArtwork(target.id(), dir.source(), warnings);
            } catch (IOException e) {
                log.warn("Could not stage {} for target {}: {}", found.get(), target.id(), e.getMessage());
                warnings.add("Could not read artwork " + found.get().getFileName() + ": " + e.getMessage());
            }
        }
        warnings.add("No artwork found for " + target.id());
        return new StagedArtwork(target.id(), null, warnings);
    }

    private List<SourceDir> sourceDirs() {
        List<SourceDir> dirs = new ArrayList<>();
        for (String dir : artwork.getAssetDirectories()) {
            dirs.add(new SourceDir(Path.of(dir), ArtworkSource.ASSET_DIRECTORY));
        }
        if (isSet(artwork.getOriginalPostersPath())) {
            dirs.add(new SourceDir(Path.of(artwork.getOriginalPostersPath()), ArtworkSource.ORIGINAL_POSTER));
        }
        if (isSet(artwork.getCurrentPostersPath())) {
            dirs.add(new SourceDir(Path.of(artwork.getCurrentPostersPath()), ArtworkSource.PLEX_CURRENT));
        }
        return dirs;
    }

    private static Optional<Path> find(Path dir, String targetId) {
        for (String ext : EXTENSIONS) {
            Path candidate = dir.resolve(targetId + "." + ext);
            if (Files.isRegularFile(candidate)) return Optional.of(candidate);
        }
        return Optional.empty();
    }

    private static void copyAsJpeg(Path source, Path target) throws IOException {
        Files.createDirectories(target.getParent());
        if (!source.getFileName().toString().endsWith(".png")) {
            Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING);
            return;
        }
        BufferedImage png = ImageIO.read(source.toFile());
        if (png == null) throw new IOException("unsupported image format");

        // JPEG has no alpha channel.
        BufferedImage rgb = new BufferedImage(png.getWidth(), png.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g = rgb.createGraphics();
        try {
            g.drawImage(png, 0, 0, Color.WHITE, null);
        } finally {
            g.dispose();
        }
        if (!ImageIO.write(rgb, "jpg", target.toFile())) {
            throw new IOException("no JPEG writer available");
        }
    }

    private static boolean isSet(String value) {
        return value != null && !value.isBlank();
    }

    private record SourceDir(Path path, ArtworkSource source) {}
}
