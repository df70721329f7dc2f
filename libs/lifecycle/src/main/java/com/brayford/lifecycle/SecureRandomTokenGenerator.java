package com.brayford.lifecycle;

import java.security.SecureRandom;
import java.util.Base64;

/**
 * 256-bit tokens from {@link SecureRandom}, URL-safe Base64 without padding.
 */
public final class SecureRandomTokenGenerator implements TokenGenerator {

    private static final int TOKEN_BYTES = 32;

    private final SecureRandom random;

    public SecureRandomTokenGenerator() {
        this(new SecureRandom());
    }

    public SecureRandomTokenGenerator(SecureRandom random) {
        this.random = random;
    }

    @Override
    public String newToken() {
        byte[] bytes = new byte[TOKEN_BYTES];
        random.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }
}
