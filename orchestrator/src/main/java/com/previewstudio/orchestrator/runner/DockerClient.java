package com.previewstudio.orchestrator.runner;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.previewstudio.orchestrator.config.PreviewProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.InputStream;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.stream.Stream;

/**
 * HTTP client for the Docker Engine API.
 *
 * Covers the container lifecycle the renderer needs (create, attach, start,
 * wait, logs, stop, pause, remove) plus image inspect/pull. Uses
 * java.net.http.HttpClient against a TCP endpoint, e.g. a docker-socket-proxy
 * sidecar, so every request is explicit.
 *
 * All calls block; ContainerRunner invokes them from the queue worker thread.
 */
@Component
public class DockerClient {

    private static final Logger log = LoggerFactory.getLogger(DockerClient.class);

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       baseUrl;
    private final Duration     requestTimeout;
    private final Duration     pullTimeout;

    public DockerClient(PreviewProperties properties, ObjectMapper objectMapper) {
        PreviewProperties.Docker docker = properties.getDocker();
        this.baseUrl        = trimSlash(docker.getBaseUrl()) + "/" + docker.getApiVersion();
        this.requestTimeout = docker.getRequestTimeout();
        this.pullTimeout    = docker.getPullTimeout();
        this.json           = objectMapper;
        this.http           = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)   // attach streams are raw HTTP/1.1 bodies
                .connectTimeout(docker.getConnectTimeout())
                .build();
    }

    // ------------------------------------------------------------------
    // Daemon / images
    // ------------------------------------------------------------------

    /** True when the daemon answers GET /_ping. */
    public boolean ping() {
        HttpResponse<String> resp = send(get("/_ping", requestTimeout), "ping");
        return resp.statusCode() == 200;
    }

    /** GET /images/{ref}/json; 404 means the image is not present locally. */
    public boolean imageExists(String imageRef) {
        HttpResponse<String> resp = send(get("/images/" + imageRef + "/json", requestTimeout),
                "inspect image " + imageRef);
        if (resp.statusCode() == 404) return false;
        expectSuccess(resp, "inspect image " + imageRef);
        return true;
    }

    /**
     * Pull an image, forwarding each progress status line to {@code progress}.
     *
     * The daemon reports pull failures inside the 200 response stream, as a
     * JSON line with an "error" field; those are raised as DockerException.
     */
    public void pullImage(String imageRef, Consumer<String> progress) {
        String[] parts = splitReference(imageRef);
        String path = "/images/create?fromImage=" + encode(parts[0]) + "&tag=" + encode(parts[1]);
        log.info("Pulling image {}", imageRef);

        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .timeout(pullTimeout)
                .POST(HttpRequest.BodyPublishers.noBody())
                .build();
        HttpResponse<Stream<String>> resp = send(req, HttpResponse.BodyHandlers.ofLines(), "pull " + imageRef);

        try (Stream<String> lines = resp.body()) {
            if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
                throw new DockerException("pull " + imageRef + " failed, HTTP " + resp.statusCode()
                        + ": " + String.join("\n", lines.toList()), resp.statusCode());
            }
            Iterator<String> it = lines.iterator();
            while (it.hasNext()) {
                String line = it.next();
                if (line.isBlank()) continue;
                JsonNode node = readTree(line, "pull " + imageRef);
                if (node.hasNonNull("error")) {
                    throw new DockerException("pull " + imageRef + " failed: " + node.get("error").asText());
                }
                String status = node.path("status").asText("");
                String id     = node.path("id").asText("");
                if (!status.isEmpty()) progress.accept(id.isEmpty() ? status : id + ": " + status);
            }
        }
    }

    // ------------------------------------------------------------------
    // Containers
    // ------------------------------------------------------------------

    /**
     * Create a non-TTY container on the bridge network.
     *
     * @return the container id
     */
    public String createContainer(String image, List<String> cmd, List<String> env, List<String> binds) {
        Map<String, Object> hostConfig = new LinkedHashMap<>();
        hostConfig.put("Binds",       binds);
        hostConfig.put("AutoRemove",  false);
        hostConfig.put("NetworkMode", "bridge");

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("Image",        image);
        body.put("Cmd",          cmd);
        body.put("Env",          env);
        body.put("WorkingDir",   "/");
        body.put("Tty",          false);
        body.put("AttachStdout", true);
        body.put("AttachStderr", true);
        body.put("HostConfig",   hostConfig);

        String respBody = post("/containers/create", toJson(body), "create container from " + image, requestTimeout);
        String id = readTree(respBody, "create container").path("Id").asText("");
        if (id.isEmpty()) throw new DockerException("create container returned no Id: " + respBody);
        log.info("Created container {} from {}", shortId(id), image);
        return id;
    }

    /**
     * Attach to stdout/stderr. Must be called before {@link #start} so no
     * early output is lost. The returned stream is multiplexed and ends when
     * the container exits; the caller closes it.
     */
    public InputStream attach(String containerId) {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/containers/" + containerId + "/attach?stream=1&stdout=1&stderr=1"))
                .timeout(requestTimeout)
                .POST(HttpRequest.BodyPublishers.noBody())
                .build();
        HttpResponse<InputStream> resp = send(req, HttpResponse.BodyHandlers.ofInputStream(), "attach " + shortId(containerId));
        if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
            closeQuietly(resp.body(), containerId);
            throw new DockerException("attach " + shortId(containerId) + " failed, HTTP " + resp.statusCode(),
                    resp.statusCode());
        }
        return resp.body();
    }

    public void start(String containerId) {
        // 304: already started
        HttpResponse<String> resp = send(postRequest("/containers/" + containerId + "/start", "", requestTimeout),
                "start " + shortId(containerId));
        if (resp.statusCode() != 304) expectSuccess(resp, "start " + shortId(containerId));
    }

    /** Block until the container exits; returns its exit status. */
    public int waitFor(String containerId, Duration timeout) {
        String respBody = post("/containers/" + containerId + "/wait", "", "wait " + shortId(containerId), timeout);
        JsonNode node = readTree(respBody, "wait");
        if (node.hasNonNull("Error") && node.get("Error").hasNonNull("Message")) {
            throw new DockerException("wait " + shortId(containerId) + " failed: "
                    + node.get("Error").get("Message").asText());
        }
        return node.path("StatusCode").asInt(-1);
    }

    /** Full stdout/stderr of a stopped container, demultiplexed. */
    public String logs(String containerId) {
        HttpRequest req = get("/containers/" + containerId + "/logs?stdout=1&stderr=1&follow=0", requestTimeout);
        HttpResponse<byte[]> resp = send(req, HttpResponse.BodyHandlers.ofByteArray(), "logs " + shortId(containerId));
        if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
            throw new DockerException("logs " + shortId(containerId) + " failed, HTTP " + resp.statusCode(),
                    resp.statusCode());
        }
        return DockerStreamDecoder.decodeAll(resp.body());
    }

    /** SIGTERM, then SIGKILL after {@code graceSeconds}. 304 (already stopped) is fine. */
    public void stop(String containerId, long graceSeconds) {
        Duration timeout = requestTimeout.plusSeconds(graceSeconds);
        HttpResponse<String> resp = send(postRequest("/containers/" + containerId + "/stop?t=" + graceSeconds, "", timeout),
                "stop " + shortId(containerId));
        if (resp.statusCode() != 304) expectSuccess(resp, "stop " + shortId(containerId));
    }

    /** Remove a container. A container that is already gone is not an error. */
    public void remove(String containerId, boolean force) {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/containers/" + containerId + "?force=" + force))
                .timeout(requestTimeout)
                .DELETE()
                .build();
        HttpResponse<String> resp = send(req, "remove " + shortId(containerId));
        if (resp.statusCode() == 404) {
            log.debug("Container {} already removed", shortId(containerId));
            return;
        }
        expectSuccess(resp, "remove " + shortId(containerId));
    }

    public void pause(String containerId) {
        post("/containers/" + containerId + "/pause", "", "pause " + shortId(containerId), requestTimeout);
    }

    public void unpause(String containerId) {
        post("/containers/" + containerId + "/unpause", "", "unpause " + shortId(containerId), requestTimeout);
    }

    /** State.Running from GET /containers/{id}/json. */
    public boolean isRunning(String containerId) {
        HttpResponse<String> resp = send(get("/containers/" + containerId + "/json", requestTimeout),
                "inspect " + shortId(containerId));
        expectSuccess(resp, "inspect " + shortId(containerId));
        return readTree(resp.body(), "inspect").path("State").path("Running").asBoolean(false);
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private HttpRequest get(String path, Duration timeout) {
        return HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .timeout(timeout)
                .header("Accept", "application/json")
                .GET()
                .build();
    }

    private HttpRequest postRequest(String path, String jsonBody, Duration timeout) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .timeout(timeout)
                .header("Accept", "application/json");
        if (jsonBody.isEmpty()) {
            builder.POST(HttpRequest.BodyPublishers.noBody());
        } else {
            builder.header("Content-Type", "application/json")
                   .POST(HttpRequest.BodyPublishers.ofString(jsonBody));
        }
        return builder.build();
    }

    /** POST and require a 2xx; returns the response body. */
    private String post(String path, String jsonBody, String opName, Duration timeout) {
        HttpResponse<String> resp = send(postRequest(path, jsonBody, timeout), opName);
        expectSuccess(resp, opName);
        return resp.body();
    }

    private HttpResponse<String> send(HttpRequest req, String opName) {
        return send(req, HttpResponse.BodyHandlers.ofString(), opName);
    }

    private <T> HttpResponse<T> send(HttpRequest req, HttpResponse.BodyHandler<T> handler, String opName) {
        try {
            return http.send(req, handler);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DockerException(opName + " interrupted", e);
        } catch (Exception e) {
            throw new DockerException(opName + " failed", e);
        }
    }

    private static void expectSuccess(HttpResponse<String> resp, String opName) {
        if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
            throw new DockerException(opName + " failed, HTTP " + resp.statusCode() + ": " + resp.body(),
                    resp.statusCode());
        }
    }

    private JsonNode readTree(String body, String opName) {
        try {
            return json.readTree(body == null || body.isBlank() ? "{}" : body);
        } catch (JsonProcessingException e) {
            throw new DockerException("Failed to parse " + opName + " response", e);
        }
    }

    private String toJson(Object obj) {
        try {
            return json.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new DockerException("JSON serialization failed", e);
        }
    }

    private static void closeQuietly(InputStream in, String containerId) {
        try {
            in.close();
        } catch (Exception e) {
            log.debug("Closing attach stream of {} failed: {}", shortId(containerId), e.getMessage());
        }
    }

    /** "repo/name:tag" → [repo/name, tag]; a missing tag means "latest". */
    static String[] splitReference(String imageRef) {
        int slash = imageRef.lastIndexOf('/');
        int colon = imageRef.lastIndexOf(':');
        if (colon > slash) {
            return new String[] { imageRef.substring(0, colon), imageRef.substring(colon + 1) };
        }
        return new String[] { imageRef, "latest" };
    }

    static String shortId(String containerId) {
        return containerId.length() > 12 ? containerId.substring(0, 12) : containerId;
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private static String trimSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
