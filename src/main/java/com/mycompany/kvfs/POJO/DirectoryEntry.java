package com.mycompany.kvfs.POJO;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class DirectoryEntry {
    @JsonProperty("name")
    private String name;

    @JsonProperty("isDir")
    private boolean dir;

    public static DirectoryEntry file(String name) {
        return new DirectoryEntry(name, false);
    }

    public static DirectoryEntry directory(String name) {
        return new DirectoryEntry(name, true);
    }
}
