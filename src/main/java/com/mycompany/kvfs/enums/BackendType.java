package com.mycompany.kvfs.enums;

public enum BackendType {
    MEMORY,
    ROCKSDB,
    HPKV
}
