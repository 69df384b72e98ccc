package com.mycompany.kvfs.POJO;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import static com.mycompany.kvfs.constant.GlobalConstant.DEFAULT_DIR_MODE;
import static com.mycompany.kvfs.constant.GlobalConstant.DEFAULT_FILE_MODE;
import static com.mycompany.kvfs.constant.GlobalConstant.MAX_CHUNK_SIZE;

/**
 * Side-band record of a file or directory, stored as JSON under the path's metadata key.
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"mode", "uid", "gid", "size", "atime", "mtime", "ctime", "num_chunks"})
public class Metadata {
    @JsonProperty("mode")
    int mode;
    @JsonProperty("uid")
    int uid;
    @JsonProperty("gid")
    int gid;
    @JsonProperty("size")
    long size;
    @JsonProperty("atime")
    long atime;
    @JsonProperty("mtime")
    long mtime;
    @JsonProperty("ctime")
    long ctime;
    // optional on the wire, older records do not carry it
    @JsonProperty("num_chunks")
    Long numChunks;

    public static enum Mode {
        S_IFMT(0170000), // file type mask
        S_IFSOCK(0140000),
        S_IFLNK(0120000),
        S_IFREG(0100000),
        S_IFBLK(0060000),
        S_IFDIR(0040000),
        S_IFCHR(0020000),
        S_IFIFO(0010000);

        private final int code;

        Mode(int code) {
            this.code = code;
        }

        public int getCode() {
            return code;
        }
    }

    @JsonIgnore
    public boolean isDirectory() {
        return (mode & Mode.S_IFMT.getCode()) == Mode.S_IFDIR.getCode();
    }

    @JsonIgnore
    public boolean isRegularFile() {
        return (mode & Mode.S_IFMT.getCode()) == Mode.S_IFREG.getCode();
    }

    public static long chunkCountFor(long size) {
        if (size <= 0) {
            return 0;
        }
        return (size + MAX_CHUNK_SIZE - 1) / MAX_CHUNK_SIZE;
    }

    public static Metadata newFile(Owner owner, long now) {
        return Metadata.builder()
                .mode(DEFAULT_FILE_MODE)
                .uid(owner.getUid())
                .gid(owner.getGid())
                .size(0)
                .atime(now)
                .mtime(now)
                .ctime(now)
                .numChunks(0L)
                .build();
    }

    // directories are written without num_chunks, like every other client of the store does
    public static Metadata newDirectory(Owner owner, long now) {
        return Metadata.builder()
                .mode(DEFAULT_DIR_MODE)
                .uid(owner.getUid())
                .gid(owner.getGid())
                .size(0)
                .atime(now)
                .mtime(now)
                .ctime(now)
                .build();
    }
}
