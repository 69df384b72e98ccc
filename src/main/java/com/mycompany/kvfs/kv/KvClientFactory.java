package com.mycompany.kvfs.kv;

import com.mycompany.kvfs.POJO.KvfsConfig;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Paths;

@Slf4j
public class KvClientFactory {

    private KvClientFactory() {
    }

    public static KvClient create(KvfsConfig config) {
        log.info("Creating {} store, {}", config.getBackend(), config);
        switch (config.getBackend()) {
            case ROCKSDB:
                return RocksKvClient.open(Paths.get(config.getRocksDbPath()), config.getListPageSize(),
                        config.getMaxValueSize());
            case HPKV:
                return HpkvHttpClient.create(config.getHpkvUrl(), config.getHpkvApiKey(), config.getHpkvCharset(),
                        config.getHpkvTimeoutMs(), config.getMaxValueSize());
            case MEMORY:
            default:
                return new InMemoryKvClient(config.getListPageSize(), config.getMaxValueSize());
        }
    }
}
