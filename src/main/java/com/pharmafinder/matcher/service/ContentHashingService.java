package com.pharmafinder.matcher.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * SHA-256 fingerprints of reference-data payloads, used to skip reloads when the source
 * has not changed.
 */
@Service
public class ContentHashingService {

    private static final Logger logger = LoggerFactory.getLogger(ContentHashingService.class);
    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private final MessageDigest digest;

    public ContentHashingService() {
        try {
            this.digest = MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            logger.error("SHA-256 MessageDigest not available", e);
            throw new IllegalStateException("Failed to initialize reference data hashing", e);
        }
    }

    /**
     * @return lowercase hex SHA-256 of {@code content}, or {@code null} for {@code null} input
     */
    public synchronized String hash(byte[] content) {
        if (content == null) {
            return null;
        }
        return toHex(digest.digest(content));
    }

    private static String toHex(byte[] bytes) {
        char[] out = new char[bytes.length * 2];
        for (int i = 0; i < bytes.length; i++) {
            int v = bytes[i] & 0xff;
            out[i * 2] = HEX[v >>> 4];
            out[i * 2 + 1] = HEX[v & 0x0f];
        }
        return new String(out);
    }
}
