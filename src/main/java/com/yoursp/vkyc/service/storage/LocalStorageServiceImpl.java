package com.yoursp.vkyc.service.storage;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Local filesystem implementation of {@link StorageService}. Point
 * {@code storage.local-root} at a mounted volume in deployed environments.
 */
@Slf4j
@Service
public class LocalStorageServiceImpl implements StorageService {

    private final Path storageRoot;

    @Autowired
    public LocalStorageServiceImpl(@Value("${storage.local-root:/tmp/vkyc-storage}") String storageRoot) {
        this(Paths.get(storageRoot));
    }

    public LocalStorageServiceImpl(Path storageRoot) {
        this.storageRoot = storageRoot.toAbsolutePath().normalize();
        try {
            Files.createDirectories(this.storageRoot);
            log.info("LocalStorageService initialized at {}", this.storageRoot);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create local storage directory: " + this.storageRoot, e);
        }
    }

    @Override
    public String upload(byte[] data, String key, String contentType) {
        Path filePath = resolve(key);
        try {
            Files.createDirectories(filePath.getParent());
            Files.write(filePath, data);
            log.debug("Uploaded {} ({} bytes, type={})", key, data.length, contentType);
            return key;
        } catch (IOException e) {
            throw new StorageException("Failed to upload file: " + key, e);
        }
    }

    @Override
    public byte[] download(String key) {
        Path filePath = resolve(key);
        if (!Files.exists(filePath)) {
            throw new StorageException("File not found: " + key);
        }
        try {
            return Files.readAllBytes(filePath);
        } catch (IOException e) {
            throw new StorageException("Failed to download file: " + key, e);
        }
    }

    @Override
    public void delete(String key) {
        try {
            boolean deleted = Files.deleteIfExists(resolve(key));
            log.debug("Deleted {} (existed={})", key, deleted);
        } catch (IOException e) {
            throw new StorageException("Failed to delete file: " + key, e);
        }
    }

    private Path resolve(String key) {
        // Prevent path-traversal attacks
        Path resolved = storageRoot.resolve(key).normalize();
        if (!resolved.startsWith(storageRoot)) {
            throw new SecurityException("Path traversal attempt detected: " + key);
        }
        return resolved;
    }
}
