package com.mycompany.kvfs.netserver;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.mycompany.kvfs.KvFileSystem;
import com.mycompany.kvfs.exception.KvfsException;
import io.vertx.core.AbstractVerticle;
import io.vertx.core.Promise;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.http.HttpHeaders;
import io.vertx.core.http.HttpMethod;
import io.vertx.core.http.HttpServer;
import io.vertx.core.http.HttpServerOptions;
import io.vertx.core.http.HttpServerRequest;
import io.vertx.core.http.HttpServerResponse;
import org.apache.commons.codec.binary.Base64;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.Callable;
import java.util.function.BiConsumer;

/**
 * HTTP front of a {@link KvFileSystem}:
 *
 * <pre>
 * GET    /api/metadata?path=               metadata record
 * GET    /api/list?path=                   [{"name","isDir"}]
 * GET    /api/read?path=&amp;offset=&amp;size=     raw bytes
 * POST   /api/write?path=&amp;offset=          body: base64 data
 * POST   /api/mkdir?path=
 * DELETE /api/delete?path=
 * </pre>
 *
 * Store calls run on worker threads, the event loop only parses and answers.
 */
public class KvfsHttpServer extends AbstractVerticle {
    private static final Logger log = LoggerFactory.getLogger(KvfsHttpServer.class);

    private static final ObjectMapper objectMapper = new ObjectMapper();
    private static final String APPLICATION_JSON = "application/json";
    private static final String APPLICATION_OCTET_STREAM = "application/octet-stream";

    private final KvFileSystem fileSystem;
    private final String host;
    private final int port;
    private HttpServer httpServer;

    public KvfsHttpServer(KvFileSystem fileSystem, String host, int port) {
        this.fileSystem = fileSystem;
        this.host = host;
        this.port = port;
    }

    @Override
    public void start(Promise<Void> startPromise) {
        HttpServerOptions options = new HttpServerOptions()
                .setHost(host)
                .setPort(port)
                .setTcpKeepAlive(true);

        httpServer = vertx.createHttpServer(options);
        httpServer.requestHandler(this::handleRequest);
        httpServer.listen(result -> {
            if (result.succeeded()) {
                log.info("KVFS HTTP server is hosted on {}:{}", host, result.result().actualPort());
                startPromise.complete();
            } else {
                log.error("Launch KVFS HTTP server on {}:{} failed", host, port, result.cause());
                startPromise.fail(result.cause());
            }
        });
    }

    @Override
    public void stop(Promise<Void> stopPromise) {
        if (httpServer == null) {
            stopPromise.complete();
            return;
        }
        httpServer.close(stopPromise);
    }

    public int actualPort() {
        return httpServer == null ? -1 : httpServer.actualPort();
    }

    private void handleRequest(HttpServerRequest request) {
        HttpMethod method = request.method();
        String route = request.path();
        log.debug("{} {}", method, request.uri());
        try {
            if (HttpMethod.GET.equals(method) && "/api/metadata".equals(route)) {
                String path = requirePath(request);
                blocking(request, () -> fileSystem.stat(path), (response, metadata) -> sendJson(response, 200, metadata));
            } else if (HttpMethod.GET.equals(method) && "/api/list".equals(route)) {
                String path = requirePath(request);
                blocking(request, () -> fileSystem.list(path), (response, entries) -> sendJson(response, 200, entries));
            } else if (HttpMethod.GET.equals(method) && "/api/read".equals(route)) {
                handleRead(request);
            } else if (HttpMethod.POST.equals(method) && "/api/write".equals(route)) {
                handleWrite(request);
            } else if (HttpMethod.POST.equals(method) && "/api/mkdir".equals(route)) {
                String path = requirePath(request);
                blocking(request, () -> fileSystem.mkdir(path), (response, created) -> {
                    ObjectNode body = objectMapper.createObjectNode().put("success", true);
                    if (created) {
                        sendJson(response, 201, body);
                    } else {
                        sendJson(response, 200, body.put("message", "Directory already exists"));
                    }
                });
            } else if (HttpMethod.DELETE.equals(method) && "/api/delete".equals(route)) {
                String path = requirePath(request);
                blocking(request, () -> {
                    fileSystem.delete(path);
                    return Boolean.TRUE;
                }, (response, ignored) -> sendJson(response, 200, objectMapper.createObjectNode().put("success", true)));
            } else {
                sendError(request.response(), 404, "Not found: " + method + " " + route);
            }
        } catch (KvfsException e) {
            sendFailure(request, e);
        }
    }

    private void handleRead(HttpServerRequest request) {
        String path = request.getParam("path");
        String offsetParam = request.getParam("offset");
        String sizeParam = request.getParam("size");
        if (StringUtils.isEmpty(path) || offsetParam == null || sizeParam == null) {
            throw KvfsException.invalidArgument("Path, offset, and size parameters are required");
        }
        long offset = parseLong(offsetParam, "Invalid offset or size");
        long size = parseLong(sizeParam, "Invalid offset or size");

        blocking(request, () -> fileSystem.openReadStream(vertx, path, offset, size), (response, stream) -> {
            response.setStatusCode(200)
                    .putHeader(HttpHeaders.CONTENT_TYPE, APPLICATION_OCTET_STREAM)
                    .putHeader(HttpHeaders.CONTENT_LENGTH, String.valueOf(stream.getLength()));
            stream.pipeTo(response).onFailure(e -> log.error("Streaming {} failed", path, e));
        });
    }

    private void handleWrite(HttpServerRequest request) {
        String path = request.getParam("path");
        String offsetParam = request.getParam("offset");
        if (StringUtils.isEmpty(path) || offsetParam == null) {
            throw KvfsException.invalidArgument("Path and offset parameters are required");
        }
        long offset = parseLong(offsetParam, "Invalid offset");

        request.bodyHandler(body -> {
            String encoded = body.toString(StandardCharsets.US_ASCII).trim();
            if (encoded.isEmpty()) {
                sendFailure(request, KvfsException.invalidArgument("Request body with base64 data is required"));
                return;
            }
            if (!Base64.isBase64(encoded)) {
                sendFailure(request, KvfsException.invalidArgument("Invalid base64 data in request body"));
                return;
            }
            byte[] data = Base64.decodeBase64(encoded);
            blocking(request, () -> fileSystem.write(path, offset, data),
                    (response, written) -> sendJson(response, 200, objectMapper.createObjectNode().put("bytesWritten", written)));
        });
    }

    private <T> void blocking(HttpServerRequest request, Callable<T> work, BiConsumer<HttpServerResponse, T> onSuccess) {
        vertx.<T>executeBlocking(promise -> {
            try {
                promise.complete(work.call());
            } catch (Exception e) {
                promise.fail(e);
            }
        }, false, res -> {
            if (res.succeeded()) {
                onSuccess.accept(request.response(), res.result());
            } else {
                sendFailure(request, res.cause());
            }
        });
    }

    private static String requirePath(HttpServerRequest request) {
        String path = request.getParam("path");
        if (StringUtils.isEmpty(path)) {
            throw KvfsException.invalidArgument("Path parameter is required");
        }
        return path;
    }

    private static long parseLong(String value, String message) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw KvfsException.invalidArgument(message + ": " + value);
        }
    }

    private static void sendFailure(HttpServerRequest request, Throwable cause) {
        if (cause instanceof KvfsException) {
            KvfsException e = (KvfsException) cause;
            int status = e.getErrorCode().getHttpStatus();
            if (status >= 500) {
                log.error("{} {} failed: {}", request.method(), request.uri(), e.getMessage(), e);
            } else {
                log.info("{} {} rejected: {} {}", request.method(), request.uri(), e.getErrorCode(), e.getMessage());
            }
            sendError(request.response(), status, e.getMessage());
            return;
        }
        log.error("{} {} failed", request.method(), request.uri(), cause);
        sendError(request.response(), 500, "Internal server error: " + cause.getMessage());
    }

    private static void sendError(HttpServerResponse response, int status, String message) {
        sendJson(response, status, objectMapper.createObjectNode().put("error", message));
    }

    private static void sendJson(HttpServerResponse response, int status, Object body) {
        String json;
        try {
            json = objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            log.error("Failed to encode response", e);
            status = 500;
            json = "{\"error\":\"Internal server error: response encoding failed\"}";
        }
        response.setStatusCode(status)
                .putHeader(HttpHeaders.CONTENT_TYPE, APPLICATION_JSON)
                .end(Buffer.buffer(json, StandardCharsets.UTF_8.name()));
    }
}
