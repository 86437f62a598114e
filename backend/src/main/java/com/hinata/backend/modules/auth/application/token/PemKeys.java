package com.hinata.backend.modules.auth.application.token;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.spec.PKCS8EncodedKeySpec;
import java.security.spec.X509EncodedKeySpec;
import java.util.Base64;
import java.util.Locale;

/**
 * Reads Ed25519 keys from PEM text: PKCS#8 for the private key, X.509 SubjectPublicKeyInfo for the public key.
 */
public final class PemKeys {

    private static final String KEY_ALGORITHM = "Ed25519";

    private PemKeys() {
    }

    public static PrivateKey readPrivateKey(String pem) {
        byte[] der = decode(pem, "PRIVATE KEY");
        try {
            return KeyFactory.getInstance(KEY_ALGORITHM).generatePrivate(new PKCS8EncodedKeySpec(der));
        } catch (GeneralSecurityException ex) {
            throw new IllegalStateException("Invalid Ed25519 private key", ex);
        }
    }

    public static PublicKey readPublicKey(String pem) {
        byte[] der = decode(pem, "PUBLIC KEY");
        try {
            return KeyFactory.getInstance(KEY_ALGORITHM).generatePublic(new X509EncodedKeySpec(der));
        } catch (GeneralSecurityException ex) {
            throw new IllegalStateException("Invalid Ed25519 public key", ex);
        }
    }

    public static String toPem(String label, byte[] der) {
        String body = Base64.getMimeEncoder(64, "\n".getBytes(StandardCharsets.US_ASCII)).encodeToString(der);
        return "-----BEGIN " + label + "-----\n" + body + "\n-----END " + label + "-----\n";
    }

    private static byte[] decode(String pem, String label) {
        if (pem == null || pem.isBlank()) {
            throw new IllegalStateException("Missing PEM " + label.toLowerCase(Locale.ROOT) + " for hinata.auth.mode=eddsa");
        }
        String body = pem
                .replace("-----BEGIN " + label + "-----", "")
                .replace("-----END " + label + "-----", "")
                .replaceAll("\\s", "");
        try {
            return Base64.getDecoder().decode(body);
        } catch (IllegalArgumentException ex) {
            throw new IllegalStateException("PEM " + label.toLowerCase(Locale.ROOT) + " is not valid Base64", ex);
        }
    }
}
