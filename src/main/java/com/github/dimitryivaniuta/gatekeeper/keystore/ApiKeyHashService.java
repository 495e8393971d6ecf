package com.github.dimitryivaniuta.gatekeeper.keystore;

import com.github.dimitryivaniuta.gatekeeper.config.GatekeeperProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

@Service
public class ApiKeyHashService {

    private static final String ALGORITHM = "SHA-256";

    private final String pepper;

    @Autowired
    public ApiKeyHashService(GatekeeperProperties properties) {
        this(properties.getKeyStore().getHashPepper());
    }

    public ApiKeyHashService(String pepper) {
        this.pepper = pepper == null ? "" : pepper;
    }

    /**
     * Lowercase hex SHA-256 of the raw key. With a pepper configured the input is
     * {@code raw + ":" + pepper}; without one it is the raw key alone.
     */
    public String hash(String rawApiKey) {
        if (rawApiKey == null || rawApiKey.isBlank()) {
            throw new IllegalArgumentException("rawApiKey must not be blank");
        }
        String input = pepper.isEmpty() ? rawApiKey : rawApiKey + ":" + pepper;
        try {
            MessageDigest md = MessageDigest.getInstance(ALGORITHM);
            return toHex(md.digest(input.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("Unable to hash API key", e);
        }
    }

    private static String toHex(byte[] b) {
        StringBuilder sb = new StringBuilder(b.length * 2);
        for (byte x : b) sb.append(String.format("%02x", x));
        return sb.toString();
    }
}
