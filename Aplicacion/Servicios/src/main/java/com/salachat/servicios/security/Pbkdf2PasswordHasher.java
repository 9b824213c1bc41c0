package com.salachat.servicios.security;

import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.PBEKeySpec;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Hash PBKDF2-HMAC-SHA256 con formato {@code pbkdf2_sha256$<iteraciones>$<sal>$<hash>},
 * sal y hash en base64 url-safe sin relleno.
 */
public class Pbkdf2PasswordHasher implements PasswordHasher {

    private static final Logger LOGGER = Logger.getLogger(Pbkdf2PasswordHasher.class.getName());

    public static final String ALGORITHM_TAG = "pbkdf2_sha256";
    public static final int DEFAULT_ITERATIONS = 200_000;
    private static final int SALT_BYTES = 16;
    private static final int KEY_BITS = 256;

    private final int iterations;
    private final SecureRandom random = new SecureRandom();

    public Pbkdf2PasswordHasher() {
        this(DEFAULT_ITERATIONS);
    }

    public Pbkdf2PasswordHasher(int iterations) {
        if (iterations <= 0) {
            throw new IllegalArgumentException("iterations debe ser positivo");
        }
        this.iterations = iterations;
    }

    @Override
    public String hash(String rawPassword) {
        if (rawPassword == null || rawPassword.isEmpty()) {
            throw new IllegalArgumentException("Password must be non-empty string");
        }
        byte[] salt = new byte[SALT_BYTES];
        random.nextBytes(salt);
        byte[] derived = derive(rawPassword, salt, iterations);
        Base64.Encoder encoder = Base64.getUrlEncoder().withoutPadding();
        return ALGORITHM_TAG + "$" + iterations + "$" + encoder.encodeToString(salt) + "$" + encoder.encodeToString(derived);
    }

    @Override
    public boolean matches(String rawPassword, String hashedPassword) {
        if (rawPassword == null || rawPassword.isEmpty() || hashedPassword == null) {
            return false;
        }
        String[] parts = hashedPassword.split("\\$", 4);
        if (parts.length != 4 || !ALGORITHM_TAG.equals(parts[0])) {
            return false;
        }
        try {
            int storedIterations = Integer.parseInt(parts[1]);
            Base64.Decoder decoder = Base64.getUrlDecoder();
            byte[] salt = decoder.decode(parts[2]);
            byte[] expected = decoder.decode(parts[3]);
            byte[] actual = derive(rawPassword, salt, storedIterations, expected.length * 8);
            return MessageDigest.isEqual(expected, actual);
        } catch (IllegalArgumentException e) {
            LOGGER.log(Level.FINE, "Hash almacenado con formato invalido", e);
            return false;
        }
    }

    private static byte[] derive(String password, byte[] salt, int iterations) {
        return derive(password, salt, iterations, KEY_BITS);
    }

    private static byte[] derive(String password, byte[] salt, int iterations, int keyBits) {
        if (iterations <= 0 || keyBits <= 0) {
            throw new IllegalArgumentException("Parametros PBKDF2 invalidos");
        }
        PBEKeySpec spec = new PBEKeySpec(password.toCharArray(), salt, iterations, keyBits);
        try {
            SecretKeyFactory factory = SecretKeyFactory.getInstance("PBKDF2WithHmacSHA256");
            return factory.generateSecret(spec).getEncoded();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("PBKDF2WithHmacSHA256 no disponible", e);
        } finally {
            spec.clearPassword();
        }
    }
}
