package io.chainnode.core.protocol;

import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.MessageDigest;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.Signature;
import java.security.spec.X509EncodedKeySpec;

public final class SignatureUtil {
    private static final String ALGORITHM = "SHA256withECDSA";

    private SignatureUtil() {}

    public static byte[] sign(byte[] data, PrivateKey priv) {
        try {
            Signature sig = Signature.getInstance(ALGORITHM);
            sig.initSign(priv);
            sig.update(data);
            return sig.sign();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Signing failed", e);
        }
    }

    public static boolean verify(byte[] data, byte[] signature, PublicKey pub) {
        if (pub == null || signature == null || signature.length == 0) {
            return false;
        }
        try {
            Signature sig = Signature.getInstance(ALGORITHM);
            sig.initVerify(pub);
            sig.update(data);
            return sig.verify(signature);
        } catch (GeneralSecurityException | RuntimeException e) {
            // malformed DER signatures surface as SignatureException
            return false;
        }
    }

    /** Decode an X.509 SubjectPublicKeyInfo EC key as carried inside transactions. */
    public static PublicKey decodePublicKey(byte[] encoded) {
        try {
            return KeyFactory.getInstance("EC").generatePublic(new X509EncodedKeySpec(encoded));
        } catch (GeneralSecurityException e) {
            throw new MalformedEncodingException("Invalid EC public key", e);
        }
    }

    public static String deriveAddress(PublicKey pub) {
        try {
            MessageDigest sha = MessageDigest.getInstance("SHA-256");
            byte[] hash = sha.digest(pub.getEncoded());
            // hex string, first 40 chars
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < 20; i++) {
                sb.append(String.format("%02x", hash[i]));
            }
            return sb.toString();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Address derivation failed", e);
        }
    }
}
