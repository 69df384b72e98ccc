package com.mycompany.kvfs;

import com.mycompany.kvfs.POJO.KvfsConfig;
import com.mycompany.kvfs.kv.KvClient;
import com.mycompany.kvfs.kv.KvClientFactory;
import com.mycompany.kvfs.netserver.KvfsHttpServer;
import io.vertx.core.Vertx;
import io.vertx.core.VertxOptions;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class App {
    public static void main(String[] args) {
        KvfsConfig config = KvfsConfig.load();
        KvClient kvClient = KvClientFactory.create(config);
        KvFileSystem fileSystem = new KvFileSystem(kvClient, config);

        Vertx vertx = Vertx.vertx(new VertxOptions());
        vertx.deployVerticle(new KvfsHttpServer(fileSystem, config.getHttpHost(), config.getHttpPort()))
                .onSuccess(id -> Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                    log.info("Shutting down KVFS");
                    vertx.close();
                    fileSystem.close();
                }, "kvfs-shutdown")))
                .onFailure(e -> {
                    log.error("Failed to start KVFS", e);
                    vertx.close();
                    fileSystem.close();
                });
    }
}
