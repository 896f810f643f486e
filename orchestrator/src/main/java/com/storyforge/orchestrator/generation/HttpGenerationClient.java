package com.storyforge.orchestrator.generation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.storyforge.orchestrator.error.JobExecutionException;
import com.storyforge.orchestrator.error.JobExecutionException.Category;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Consumer;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * HTTP client for the generation gateway.
 *
 * Uses java.net.http.HttpClient directly. Text tasks are streamed as
 * newline-delimited JSON ({@code {"content": "..."}} per line) so tokens
 * can be forwarded to subscribers as they arrive.
 *
 * Error mapping:
 *   request timeout  -> TIMEOUT
 *   I/O failure      -> NETWORK
 *   HTTP 429 / 5xx   -> NETWORK (transient)
 *   other HTTP 4xx   -> VALIDATION (retrying will not help)
 */
@Component
public class HttpGenerationClient implements GenerationClient {

    private static final Logger log = LoggerFactory.getLogger(HttpGenerationClient.class);

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       baseUrl;
    private final Duration     textTimeout;
    private final Duration     mediaTimeout;

    public HttpGenerationClient(
            @Value("${storyforge.generation.base-url}") String baseUrl,
            @Value("${storyforge.generation.text-timeout:PT5M}") Duration textTimeout,
            @Value("${storyforge.generation.media-timeout:PT10M}") Duration mediaTimeout,
            ObjectMapper objectMapper) {
        this.baseUrl      = baseUrl;
        this.textTimeout  = textTimeout;
        this.mediaTimeout = mediaTimeout;
        this.json         = objectMapper;
        this.http         = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    // ------------------------------------------------------------------
    // Text
    // ------------------------------------------------------------------

    @Override
    public String completeText(String task, String prompt, Consumer<String> onChunk) {
        log.info("Text task '{}' ({} chars of input)", task, prompt.length());
        HttpRequest req = jsonPost("/v1/text/stream",
                toJson(Map.of("task", task, "prompt", prompt)), textTimeout);
        try {
            HttpResponse<Stream<String>> resp = http.send(req, HttpResponse.BodyHandlers.ofLines());
            StringBuilder full = new StringBuilder();
            try (Stream<String> lines = resp.body()) {
                if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
                    throw httpFailure("text task " + task, resp.statusCode(), lines.collect(Collectors.joining("\n")));
                }
                Iterator<String> it = lines.iterator();
                while (it.hasNext()) {
                    String line = it.next();
                    if (line.isBlank()) continue;
                    String chunk = json.readTree(line).path("content").asText("");
                    if (chunk.isEmpty()) continue;
                    full.append(chunk);
                    onChunk.accept(chunk);
                }
            }
            return full.toString();
        } catch (JobExecutionException e) {
            throw e;
        } catch (JsonProcessingException e) {
            throw new JobExecutionException(Category.INTERNAL, "Malformed stream chunk from text task " + task, e);
        } catch (HttpTimeoutException e) {
            throw new JobExecutionException(Category.TIMEOUT, "Text task " + task + " timed out", e);
        } catch (IOException e) {
            throw new JobExecutionException(Category.NETWORK, "Text task " + task + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new JobExecutionException(Category.INTERNAL, "Interrupted during text task " + task, e);
        }
    }

    // ------------------------------------------------------------------
    // Media
    // ------------------------------------------------------------------

    @Override
    public String generateImage(String prompt, Map<String, Object> options) {
        Map<String, Object> body = new LinkedHashMap<>(options == null ? Map.of() : options);
        body.put("prompt", prompt);
        return urlFrom(post("/v1/images", toJson(body), "generateImage"), "generateImage");
    }

    @Override
    public String generateVideo(String imageUrl, String prompt, Map<String, Object> options) {
        Map<String, Object> body = new LinkedHashMap<>(options == null ? Map.of() : options);
        body.put("image_url", imageUrl);
        body.put("prompt",    prompt);
        return urlFrom(post("/v1/videos", toJson(body), "generateVideo"), "generateVideo");
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private String post(String path, String jsonBody, String opName) {
        try {
            HttpResponse<String> resp = http.send(jsonPost(path, jsonBody, mediaTimeout),
                    HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
                throw httpFailure(opName, resp.statusCode(), resp.body());
            }
            return resp.body();
        } catch (JobExecutionException e) {
            throw e;
        } catch (HttpTimeoutException e) {
            throw new JobExecutionException(Category.TIMEOUT, opName + " timed out", e);
        } catch (IOException e) {
            throw new JobExecutionException(Category.NETWORK, opName + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new JobExecutionException(Category.INTERNAL, "Interrupted during " + opName, e);
        }
    }

    private HttpRequest jsonPost(String path, String jsonBody, Duration timeout) {
        return HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .header("Accept",       "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(jsonBody))
                .build();
    }

    private String urlFrom(String respBody, String opName) {
        try {
            JsonNode url = json.readTree(respBody).path("url");
            if (url.isMissingNode() || url.asText().isBlank()) {
                throw new JobExecutionException(Category.INTERNAL, opName + " response has no url");
            }
            return url.asText();
        } catch (JsonProcessingException e) {
            throw new JobExecutionException(Category.INTERNAL, "Failed to parse " + opName + " response", e);
        }
    }

    private static JobExecutionException httpFailure(String opName, int status, String body) {
        Category category = (status == 429 || status >= 500) ? Category.NETWORK : Category.VALIDATION;
        return new JobExecutionException(category, opName + " failed: HTTP " + status + ": " + body);
    }

    private String toJson(Object obj) {
        try {
            return json.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new JobExecutionException(Category.INTERNAL, "JSON serialization failed", e);
        }
    }
}
