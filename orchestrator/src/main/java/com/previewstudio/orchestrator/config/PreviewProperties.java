package com.previewstudio.orchestrator.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Paths, renderer and streaming settings ({@code preview.*}).
 *
 * Every directory that is bind-mounted into the renderer container has two
 * forms: the path this process reads and writes, and the path the Docker
 * daemon sees on the host. They only differ when the orchestrator itself
 * runs in a container; an unset host path falls back to the local path.
 */
@ConfigurationProperties(prefix = "preview")
public class PreviewProperties {

    private final Jobs      jobs      = new Jobs();
    private final Fonts     fonts     = new Fonts();
    private final Cache     cache     = new Cache();
    private final User      user      = new User();
    private final Artwork   artwork   = new Artwork();
    private final Renderer  renderer  = new Renderer();
    private final Docker    docker    = new Docker();
    private final Sse       sse       = new Sse();
    private final Retention retention = new Retention();

    public Jobs      getJobs()      { return jobs; }
    public Fonts     getFonts()     { return fonts; }
    public Cache     getCache()     { return cache; }
    public User      getUser()      { return user; }
    public Artwork   getArtwork()   { return artwork; }
    public Renderer  getRenderer()  { return renderer; }
    public Docker    getDocker()    { return docker; }
    public Sse       getSse()       { return sse; }
    public Retention getRetention() { return retention; }

    public static class Jobs {
        private String path = "./jobs";
        private String hostPath;

        public String getPath()                 { return path; }
        public void   setPath(String path)      { this.path = path; }
        public String getHostPath()             { return hostPath != null && !hostPath.isBlank() ? hostPath : path; }
        public void   setHostPath(String path)  { this.hostPath = path; }
    }

    public static class Fonts {
        private String path = "./fonts";
        private String hostPath;

        public String getPath()                 { return path; }
        public void   setPath(String path)      { this.path = path; }
        public String getHostPath()             { return hostPath != null && !hostPath.isBlank() ? hostPath : path; }
        public void   setHostPath(String path)  { this.hostPath = path; }
    }

    /** Persistent renderer API cache. Not mounted when unset. */
    public static class Cache {
        private String hostPath;

        public String getHostPath()             { return hostPath; }
        public void   setHostPath(String path)  { this.hostPath = path; }
    }

    /** Optional user directories, already expressed as host paths. */
    public static class User {
        private String assetsPath;
        private String configPath;

        public String getAssetsPath()              { return assetsPath; }
        public void   setAssetsPath(String path)   { this.assetsPath = path; }
        public String getConfigPath()              { return configPath; }
        public void   setConfigPath(String path)   { this.configPath = path; }
    }

    /**
     * Local directories searched for base artwork, in priority order:
     * asset directories, then original posters, then exported current posters.
     */
    public static class Artwork {
        private List<String> assetDirectories = new ArrayList<>();
        private String       originalPostersPath;
        private String       currentPostersPath;

        public List<String> getAssetDirectories()                { return assetDirectories; }
        public void         setAssetDirectories(List<String> d)  { this.assetDirectories = d; }
        public String       getOriginalPostersPath()             { return originalPostersPath; }
        public void         setOriginalPostersPath(String path)  { this.originalPostersPath = path; }
        public String       getCurrentPostersPath()              { return currentPostersPath; }
        public void         setCurrentPostersPath(String path)   { this.currentPostersPath = path; }
    }

    public static class Renderer {
        private String   image       = "kometa-preview-renderer:latest";
        private Duration stopTimeout = Duration.ofSeconds(5);
        private Duration waitTimeout = Duration.ofHours(2);
        private boolean  prePull     = true;

        public String   getImage()                   { return image; }
        public void     setImage(String image)       { this.image = image; }
        public Duration getStopTimeout()             { return stopTimeout; }
        public void     setStopTimeout(Duration d)   { this.stopTimeout = d; }
        public Duration getWaitTimeout()             { return waitTimeout; }
        public void     setWaitTimeout(Duration d)   { this.waitTimeout = d; }
        public boolean  isPrePull()                  { return prePull; }
        public void     setPrePull(boolean prePull)  { this.prePull = prePull; }
    }

    /** Docker Engine API endpoint (TCP, e.g. a docker-socket-proxy sidecar). */
    public static class Docker {
        private String   baseUrl        = "http://localhost:2375";
        private String   apiVersion     = "v1.43";
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration requestTimeout = Duration.ofSeconds(60);
        private Duration pullTimeout    = Duration.ofMinutes(5);

        public String   getBaseUrl()                  { return baseUrl; }
        public void     setBaseUrl(String baseUrl)    { this.baseUrl = baseUrl; }
        public String   getApiVersion()               { return apiVersion; }
        public void     setApiVersion(String v)       { this.apiVersion = v; }
        public Duration getConnectTimeout()           { return connectTimeout; }
        public void     setConnectTimeout(Duration d) { this.connectTimeout = d; }
        public Duration getRequestTimeout()           { return requestTimeout; }
        public void     setRequestTimeout(Duration d) { this.requestTimeout = d; }
        public Duration getPullTimeout()              { return pullTimeout; }
        public void     setPullTimeout(Duration d)    { this.pullTimeout = d; }
    }

    public static class Sse {
        private Duration heartbeatInterval = Duration.ofSeconds(30);
        private Duration closeDelay        = Duration.ofMillis(100);

        public Duration getHeartbeatInterval()           { return heartbeatInterval; }
        public void     setHeartbeatInterval(Duration d) { this.heartbeatInterval = d; }
        public Duration getCloseDelay()                  { return closeDelay; }
        public void     setCloseDelay(Duration d)        { this.closeDelay = d; }
    }

    /** Eviction of finished job records and their working directories. */
    public static class Retention {
        private Duration maxAge   = Duration.ofDays(7);
        private int      keepLast = 200;

        public Duration getMaxAge()              { return maxAge; }
        public void     setMaxAge(Duration d)    { this.maxAge = d; }
        public int      getKeepLast()            { return keepLast; }
        public void     setKeepLast(int n)       { this.keepLast = n; }
    }
}
