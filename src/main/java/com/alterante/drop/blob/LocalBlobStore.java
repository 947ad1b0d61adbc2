package com.alterante.drop.blob;

import com.alterante.drop.error.UpstreamException;
import com.alterante.drop.util.Hashing;
import com.alterante.drop.util.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Content-addressed blob store on the local filesystem. Blobs are named by the
 * SHA-256 of their bytes and served by the API under {@code /blobs/{hash}}.
 * Uploading identical bytes twice yields the same reference.
 */
public class LocalBlobStore implements BlobStore {

    private static final Logger log = LoggerFactory.getLogger(LocalBlobStore.class);
    private static final Pattern HASH = Pattern.compile("[0-9a-f]{64}");

    private final Path root;
    private final String baseUrl;

    /**
     * @param baseUrl public base URL of the API serving {@code /blobs}, without trailing slash
     */
    public LocalBlobStore(Path root, String baseUrl) {
        this.root = root;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    @Override
    public BlobReference upload(String fileName, Path content, Map<String, String> metadata) throws UpstreamException {
        try {
            Files.createDirectories(root);
            String hash = Hashing.hex(Hashing.sha256(content));
            Path target = root.resolve(hash);
            if (!Files.exists(target)) {
                Path tmp = Files.createTempFile(root, hash, ".part");
                try {
                    Files.copy(content, tmp, StandardCopyOption.REPLACE_EXISTING);
                    moveIntoPlace(tmp, target);
                } finally {
                    Files.deleteIfExists(tmp);
                }
            }
            Map<String, String> meta = new LinkedHashMap<>(metadata);
            meta.put("name", fileName);
            Files.write(root.resolve(hash + ".json"), Json.toBytes(meta));
            log.info("Stored blob {} ({}, {} bytes)", hash, fileName, Files.size(target));
            return new BlobReference(hash, baseUrl + "/blobs/" + hash);
        } catch (IOException e) {
            throw new UpstreamException("Local blob upload failed: " + e.getMessage(), e);
        }
    }

    /**
     * Path of a stored blob, or empty if {@code hash} is malformed or unknown.
     */
    public Optional<Path> locate(String hash) {
        if (hash == null || !HASH.matcher(hash).matches()) {
            return Optional.empty();
        }
        Path path = root.resolve(hash);
        return Files.isRegularFile(path) ? Optional.of(path) : Optional.empty();
    }

    public Path root() {
        return root;
    }

    private static void moveIntoPlace(Path tmp, Path target) throws IOException {
        try {
            Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        } catch (FileAlreadyExistsException e) {
            log.debug("Blob {} stored concurrently", target.getFileName());
        }
    }
}
