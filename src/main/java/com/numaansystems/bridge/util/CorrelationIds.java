package com.numaansystems.bridge.util;

import com.numaansystems.bridge.service.InvalidCorrelationIdException;

import java.security.SecureRandom;
import java.util.Base64;
import java.util.regex.Pattern;

/**
 * Generation and validation of correlation ids.
 *
 * <p>A correlation id is the only capability needed to claim a pending login,
 * so generated ids carry 256 bits from {@link SecureRandom}. Validation only
 * checks the shape: URL-safe characters legal in an OAuth {@code state}.</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
public final class CorrelationIds {

    private static final Pattern SHAPE = Pattern.compile("^[A-Za-z0-9_-]{1,128}$");
    private static final int ENTROPY_BYTES = 32;
    private static final SecureRandom RANDOM = new SecureRandom();
    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();

    private CorrelationIds() {
    }

    /**
     * @return a new unguessable, URL-safe correlation id (43 characters)
     */
    public static String generate() {
        byte[] bytes = new byte[ENTROPY_BYTES];
        RANDOM.nextBytes(bytes);
        return ENCODER.encodeToString(bytes);
    }

    public static boolean isValid(String id) {
        return id != null && SHAPE.matcher(id).matches();
    }

    /**
     * Validates the shape of a correlation id received from a request.
     * 
     * @param id the id to check
     * @return the same id
     * @throws InvalidCorrelationIdException if the id is missing or malformed
     */
    public static String requireValid(String id) {
        if (!isValid(id)) {
            throw new InvalidCorrelationIdException(id);
        }
        return id;
    }
}
