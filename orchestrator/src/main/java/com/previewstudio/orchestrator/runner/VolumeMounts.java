package com.previewstudio.orchestrator.runner;

import com.previewstudio.orchestrator.config.PreviewProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the bind mounts for a renderer container.
 *
 * The Docker daemon resolves bind sources on its own host, so every source
 * here is a host path, never the path this process sees.
 *
 * <pre>
 *   {jobsHost}/{jobId}  → /jobs               rw
 *   {fontsHost}         → /fonts              ro
 *   {userAssets}        → /user_assets        ro  (optional)
 *   {userConfig}        → /user_config        ro  (optional)
 *   {cacheHost}         → /kometa_cache       rw  (optional)
 *   {cacheHost}         → /jobs/config/cache  rw  (optional)
 * </pre>
 */
@Component
public class VolumeMounts {

    private final PreviewProperties properties;

    public VolumeMounts(PreviewProperties properties) {
        this.properties = properties;
    }

    public List<String> binds(String jobId) {
        List<String> binds = new ArrayList<>();
        binds.add(join(properties.getJobs().getHostPath(), jobId) + ":/jobs:rw");
        binds.add(stripTrailingSlash(properties.getFonts().getHostPath()) + ":/fonts:ro");

        String assets = properties.getUser().getAssetsPath();
        if (isSet(assets)) binds.add(stripTrailingSlash(assets) + ":/user_assets:ro");

        String userConfig = properties.getUser().getConfigPath();
        if (isSet(userConfig)) binds.add(stripTrailingSlash(userConfig) + ":/user_config:ro");

        // Mounted twice: /kometa_cache signals that a cache exists, the
        // second mount is where the renderer actually writes it.
        String cache = properties.getCache().getHostPath();
        if (isSet(cache)) {
            binds.add(stripTrailingSlash(cache) + ":/kometa_cache:rw");
            binds.add(stripTrailingSlash(cache) + ":/jobs/config/cache:rw");
        }
        return binds;
    }

    private static String join(String base, String child) {
        return stripTrailingSlash(base) + "/" + child;
    }

    private static String stripTrailingSlash(String path) {
        String p = path;
        while (p.length() > 1 && p.endsWith("/")) p = p.substring(0, p.length() - 1);
        return p;
    }

    private static boolean isSet(String value) {
        return value != null && !value.isBlank();
    }
}
