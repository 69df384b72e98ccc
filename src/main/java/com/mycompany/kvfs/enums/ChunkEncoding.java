package com.mycompany.kvfs.enums;

import org.apache.commons.codec.binary.Base64;

/**
 * How chunk bytes are turned into store values. One encoding is fixed per store; mixing them
 * on the same key space corrupts non-text content.
 */
public enum ChunkEncoding {
    /** value bytes are the chunk bytes, the store must be binary safe */
    RAW {
        @Override
        public byte[] encode(byte[] chunk) {
            return chunk;
        }

        @Override
        public byte[] decode(byte[] value) {
            return value;
        }

        @Override
        public int encodedLength(int chunkLength) {
            return chunkLength;
        }
    },
    /** unchunked standard base64, for stores that only keep printable text */
    BASE64 {
        @Override
        public byte[] encode(byte[] chunk) {
            return Base64.encodeBase64(chunk, false);
        }

        @Override
        public byte[] decode(byte[] value) {
            return Base64.decodeBase64(value);
        }

        @Override
        public int encodedLength(int chunkLength) {
            return 4 * ((chunkLength + 2) / 3);
        }
    };

    public abstract byte[] encode(byte[] chunk);

    public abstract byte[] decode(byte[] value);

    public abstract int encodedLength(int chunkLength);
}
