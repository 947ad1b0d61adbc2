package com.alterante.drop.blob;

import com.alterante.drop.error.UpstreamException;

import java.nio.file.Path;
import java.util.Map;

/**
 * Adapter over an external content-addressed store. Implementations hold no
 * per-upload state; a call either returns a reference to durably stored bytes
 * or throws.
 */
public interface BlobStore {

    /**
     * Upload {@code content} and block until the store confirms it.
     *
     * @param metadata descriptive key/values stored alongside the blob
     * @throws UpstreamException if the store fails or does not answer in time
     */
    BlobReference upload(String fileName, Path content, Map<String, String> metadata) throws UpstreamException;
}
