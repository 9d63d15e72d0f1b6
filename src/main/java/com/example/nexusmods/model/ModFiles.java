package com.example.nexusmods.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;
import java.util.function.BiPredicate;

/**
 * Response of {@code GET games/{domain}/mods/{id}/files.json}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ModFiles(
        @JsonProperty("files") List<ModFile> files,
        @JsonProperty("file_updates") List<FileUpdate> fileUpdates) {

    public ModFiles {
        files = files == null ? List.of() : List.copyOf(files);
        fileUpdates = fileUpdates == null ? List.of() : List.copyOf(fileUpdates);
    }

    /**
     * Keep the first file of every group of equivalent files, in listing order.
     * Useful when a mod ships the same file in several variants.
     */
    public List<ModFile> dedup(BiPredicate<ModFile, ModFile> equivalent) {
        List<ModFile> representatives = new ArrayList<>();
        for (ModFile file : files) {
            boolean seen = representatives.stream().anyMatch(kept -> equivalent.test(kept, file));
            if (!seen) {
                representatives.add(file);
            }
        }
        return List.copyOf(representatives);
    }

    public List<ModFile> ofCategory(FileCategory category) {
        return files.stream()
                .filter(file -> file.category() == category)
                .toList();
    }
}
