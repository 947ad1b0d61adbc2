package com.alterante.drop.blob;

/**
 * Stable reference to uploaded bytes.
 *
 * @param hash content address (SHA-256 hex locally, CID on IPFS)
 * @param url  where the bytes can be fetched
 */
public record BlobReference(String hash, String url) {
}
