package com.delivery.console.common.signing;

import com.delivery.console.common.param.ParamValue;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Computes the {@code secret_key} field: lowercase hex MD5 of the canonical string followed by the
 * method key. The server recomputes the same digest, so the algorithm is fixed.
 */
public class SignatureComputer {
    private static final String ALGORITHM = "MD5";

    private final Canonicalizer canonicalizer;

    public SignatureComputer(Canonicalizer canonicalizer) {
        this.canonicalizer = canonicalizer;
    }

    public String sign(ParamValue data, String secret) {
        return md5Hex(signingInput(data, secret));
    }

    public String signingInput(ParamValue data, String secret) {
        return canonicalizer.canonicalize(data) + (secret == null ? "" : secret);
    }

    private String md5Hex(String value) {
        try {
            MessageDigest md = MessageDigest.getInstance(ALGORITHM);
            byte[] raw = md.digest(value.getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder(raw.length * 2);
            for (byte b : raw) {
                sb.append(String.format("%02x", b));
            }
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 digest is not available", e);
        }
    }
}
