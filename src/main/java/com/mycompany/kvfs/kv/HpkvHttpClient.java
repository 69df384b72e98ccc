package com.mycompany.kvfs.kv;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.mycompany.kvfs.exception.KvfsException;
import io.vertx.core.Context;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.http.HttpClient;
import io.vertx.core.http.HttpClientOptions;
import io.vertx.core.http.HttpMethod;
import io.vertx.core.http.RequestOptions;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.io.IOException;
import java.io.UnsupportedEncodingException;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Client for the HPKV REST API.
 *
 * <pre>
 * GET    /record?key=k                      -> {"key":k,"value":"..."}
 * POST   /record {"key":k,"value":"..."}    upsert
 * DELETE /record?key=k
 * GET    /list?prefix=p[&amp;delimiter=d][&amp;marker=m] -> {"items":[{"key":...}],"nextMarker":...}
 * </pre>
 *
 * Values travel as JSON strings; bytes are mapped to text with the configured charset.
 * ISO-8859-1 maps every byte to one char and back, UTF-8 only round-trips valid text.
 * Calls block the caller, never invoke them from an event loop thread. Every request chain runs on
 * the single context the client was created with.
 */
@Slf4j
public class HpkvHttpClient implements KvClient {
    public static final String API_KEY_HEADER = "x-api-key";
    public static final String RECORD_PATH = "/record";
    public static final String LIST_PATH = "/list";

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private final Vertx vertx;
    private final boolean ownsVertx;
    private final Context context;
    private final HttpClient httpClient;
    private final URI baseUri;
    private final String apiKey;
    private final Charset valueCharset;
    private final long timeoutMs;
    private final int maxValueSize;

    public HpkvHttpClient(Vertx vertx, String apiUrl, String apiKey, Charset valueCharset,
                          long timeoutMs, int maxValueSize) {
        this(vertx, false, apiUrl, apiKey, valueCharset, timeoutMs, maxValueSize);
    }

    /**
     * Creates a client running on its own Vert.x instance, closed together with the client.
     */
    public static HpkvHttpClient create(String apiUrl, String apiKey, Charset valueCharset,
                                        long timeoutMs, int maxValueSize) {
        return new HpkvHttpClient(Vertx.vertx(), true, apiUrl, apiKey, valueCharset, timeoutMs, maxValueSize);
    }

    private HpkvHttpClient(Vertx vertx, boolean ownsVertx, String apiUrl, String apiKey, Charset valueCharset,
                           long timeoutMs, int maxValueSize) {
        if (StringUtils.isBlank(apiKey)) {
            if (ownsVertx) {
                vertx.close();
            }
            throw KvfsException.unauthorized("HPKV API key is missing");
        }
        if (StringUtils.isBlank(apiUrl)) {
            if (ownsVertx) {
                vertx.close();
            }
            throw new IllegalArgumentException("HPKV API URL is missing");
        }
        this.vertx = vertx;
        this.context = vertx.getOrCreateContext();
        this.ownsVertx = ownsVertx;
        this.baseUri = URI.create(apiUrl);
        this.apiKey = apiKey;
        this.valueCharset = valueCharset;
        this.timeoutMs = timeoutMs;
        this.maxValueSize = maxValueSize;
        this.httpClient = vertx.createHttpClient(new HttpClientOptions()
                .setKeepAlive(true)
                .setConnectTimeout((int) Math.min(timeoutMs, Integer.MAX_VALUE)));
    }

    @Override
    public Optional<byte[]> get(String key) {
        HttpResult result = call(HttpMethod.GET, RECORD_PATH, params("key", key), null);
        if (result.statusCode == 404) {
            return Optional.empty();
        }
        ensureSuccess(result, "get " + key);
        JsonNode body = parse(result, "get " + key);
        JsonNode value = body.get("value");
        if (value == null || value.isNull()) {
            throw KvfsException.storeError("Record " + key + " returned without a value", null);
        }
        return Optional.of(value.asText().getBytes(valueCharset));
    }

    @Override
    public void put(String key, byte[] value) {
        if (value.length > maxValueSize) {
            throw KvfsException.storeError("Value of " + key + " is " + value.length
                    + " bytes, store limit is " + maxValueSize, null);
        }
        ObjectNode body = objectMapper.createObjectNode();
        body.put("key", key);
        body.put("value", new String(value, valueCharset));
        HttpResult result = call(HttpMethod.POST, RECORD_PATH, Collections.emptyMap(), body);
        ensureSuccess(result, "put " + key);
    }

    @Override
    public void delete(String key) {
        HttpResult result = call(HttpMethod.DELETE, RECORD_PATH, params("key", key), null);
        // already gone
        if (result.statusCode == 404) {
            return;
        }
        ensureSuccess(result, "delete " + key);
    }

    @Override
    public ListPage list(String prefix, String delimiter, String marker) {
        Map<String, String> params = params("prefix", prefix);
        if (StringUtils.isNotEmpty(delimiter)) {
            params.put("delimiter", delimiter);
        }
        if (StringUtils.isNotEmpty(marker)) {
            params.put("marker", marker);
        }
        HttpResult result = call(HttpMethod.GET, LIST_PATH, params, null);
        ensureSuccess(result, "list " + prefix);
        JsonNode body = parse(result, "list " + prefix);
        JsonNode items = body.get("items");
        if (items == null || !items.isArray()) {
            throw KvfsException.storeError("Invalid response from HPKV list API for prefix " + prefix, null);
        }
        List<String> keys = new ArrayList<>(items.size());
        for (JsonNode item : items) {
            keys.add(item.path("key").asText());
        }
        JsonNode next = body.get("nextMarker");
        String nextMarker = next == null || next.isNull() || next.asText().isEmpty() ? null : next.asText();
        return ListPage.of(keys, nextMarker);
    }

    @Override
    public int maxValueSize() {
        return maxValueSize;
    }

    @Override
    public void close() {
        httpClient.close();
        if (ownsVertx) {
            vertx.close();
        }
    }

    private HttpResult call(HttpMethod method, String path, Map<String, String> params, JsonNode body) {
        String query = params.entrySet().stream()
                .map(e -> e.getKey() + "=" + urlEncode(e.getValue()))
                .collect(Collectors.joining("&"));
        // resolves against the host like the browser URL API does, any base path is dropped
        URI uri = baseUri.resolve(query.isEmpty() ? path : path + "?" + query);

        RequestOptions options = new RequestOptions()
                .setMethod(method)
                .setAbsoluteURI(uri.toString())
                .setTimeout(timeoutMs)
                .putHeader(API_KEY_HEADER, apiKey)
                .putHeader("Content-Type", "application/json");

        Promise<HttpResult> promise = Promise.promise();
        context.runOnContext(v -> httpClient.request(options)
                .compose(request -> body == null
                        ? request.send()
                        : request.send(Buffer.buffer(body.toString(), StandardCharsets.UTF_8.name())))
                .compose(response -> response.body()
                        .map(buffer -> new HttpResult(response.statusCode(), buffer)))
                .onComplete(promise));
        try {
            return promise.future().toCompletionStage().toCompletableFuture().get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw KvfsException.storeError("Interrupted calling HPKV " + method + " " + path, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("Network error calling HPKV {} {}: {}", method, path, cause.getMessage());
            throw KvfsException.storeError("Network error: " + cause.getMessage(), cause);
        } catch (TimeoutException e) {
            throw KvfsException.storeError("HPKV " + method + " " + path + " timed out after " + timeoutMs + "ms", e);
        }
    }

    private static void ensureSuccess(HttpResult result, String operation) {
        int status = result.statusCode;
        if (status >= 200 && status < 300) {
            return;
        }
        String errorBody = StringUtils.abbreviate(result.body.toString(StandardCharsets.UTF_8), 200);
        log.error("HPKV API Error ({}) on {}: {}", status, operation, errorBody);
        if (status == 401 || status == 403) {
            throw KvfsException.unauthorized("HPKV API Error (" + status + "): " + errorBody);
        }
        throw KvfsException.storeError("HPKV API Error (" + status + ") on " + operation + ": " + errorBody, null);
    }

    private static JsonNode parse(HttpResult result, String operation) {
        try {
            return objectMapper.readTree(result.body.getBytes());
        } catch (IOException e) {
            throw KvfsException.storeError("Unreadable HPKV response on " + operation, e);
        }
    }

    private static String urlEncode(String value) {
        try {
            return URLEncoder.encode(value, StandardCharsets.UTF_8.name());
        } catch (UnsupportedEncodingException e) {
            throw new IllegalStateException("UTF-8 is not supported", e);
        }
    }

    private static Map<String, String> params(String name, String value) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put(name, value);
        return params;
    }

    private static final class HttpResult {
        final int statusCode;
        final Buffer body;

        HttpResult(int statusCode, Buffer body) {
            this.statusCode = statusCode;
            this.body = body;
        }
    }
}
