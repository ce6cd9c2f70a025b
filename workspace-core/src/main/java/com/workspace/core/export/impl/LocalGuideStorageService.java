package com.workspace.core.export.impl;

import com.workspace.core.config.WorkspaceProperties;
import com.workspace.core.export.GuideStorageService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Stores guides as plain files. No locking: two requests with the same slug
 * overwrite each other, last write wins.
 */
@Service
@Slf4j
public class LocalGuideStorageService implements GuideStorageService {

    private final WorkspaceProperties properties;

    public LocalGuideStorageService(WorkspaceProperties properties) {
        this.properties = properties;
    }

    @Override
    public Path writeText(String fileName, String content) throws IOException {
        Path filePath = resolve(fileName);
        Files.writeString(filePath, content != null ? content : "", StandardCharsets.UTF_8);
        log.info("Saved guide file {} (size: {} bytes)", filePath, Files.size(filePath));
        return filePath;
    }

    @Override
    public Path resolve(String fileName) throws IOException {
        Path storagePath = Paths.get(properties.getGuides().getDirectory());
        if (!Files.exists(storagePath)) {
            Files.createDirectories(storagePath);
        }
        return storagePath.resolve(fileName);
    }

    @Override
    public String publicUrl(String fileName) {
        String prefix = properties.getGuides().getUrlPrefix();
        if (prefix.endsWith("/")) {
            prefix = prefix.substring(0, prefix.length() - 1);
        }
        return prefix + "/" + fileName;
    }
}
