package com.dbbaskette.envsync.service.crypto;

import org.bouncycastle.crypto.agreement.X25519Agreement;
import org.bouncycastle.crypto.digests.Blake2bDigest;
import org.bouncycastle.crypto.engines.Salsa20Engine;
import org.bouncycastle.crypto.engines.XSalsa20Engine;
import org.bouncycastle.crypto.macs.Poly1305;
import org.bouncycastle.crypto.params.KeyParameter;
import org.bouncycastle.crypto.params.ParametersWithIV;
import org.bouncycastle.crypto.params.X25519PrivateKeyParameters;
import org.bouncycastle.crypto.params.X25519PublicKeyParameters;
import org.bouncycastle.util.Arrays;
import org.bouncycastle.util.Pack;

import java.security.SecureRandom;

/**
 * Anonymous sealed-box encryption ({@code crypto_box_seal}) as GitHub expects for secret values.
 *
 * <p>Output layout: ephemeral public key (32) | Poly1305 tag (16) | XSalsa20 ciphertext.
 * The nonce is BLAKE2b-192 over the ephemeral and recipient public keys. Only the recipient's
 * private key can open the box; the ephemeral private key is discarded after sealing.
 */
public final class SealedBox {

    public static final int PUBLIC_KEY_BYTES = 32;
    public static final int MAC_BYTES = 16;
    public static final int NONCE_BYTES = 24;
    public static final int OVERHEAD = PUBLIC_KEY_BYTES + MAC_BYTES;

    private static final int[] SIGMA = {0x61707865, 0x3320646e, 0x79622d32, 0x6b206574};

    private static final SecureRandom RANDOM = new SecureRandom();

    private SealedBox() {}

    public static byte[] seal(byte[] message, byte[] recipientPublicKey) {
        if (recipientPublicKey == null || recipientPublicKey.length != PUBLIC_KEY_BYTES) {
            throw new IllegalArgumentException("Recipient public key must be " + PUBLIC_KEY_BYTES + " bytes");
        }
        X25519PrivateKeyParameters ephemeral = new X25519PrivateKeyParameters(RANDOM);
        byte[] ephemeralPublic = ephemeral.generatePublicKey().getEncoded();

        byte[] nonce = nonce(ephemeralPublic, recipientPublicKey);
        byte[] key = beforeNm(ephemeral, new X25519PublicKeyParameters(recipientPublicKey, 0));

        byte[] out = new byte[OVERHEAD + message.length];
        System.arraycopy(ephemeralPublic, 0, out, 0, PUBLIC_KEY_BYTES);
        secretbox(message, nonce, key, out, PUBLIC_KEY_BYTES);
        Arrays.fill(key, (byte) 0);
        return out;
    }

    /**
     * Opens a sealed box. Only needed by whoever holds the private key; this service never does.
     *
     * @return the plaintext, or null when the tag does not verify
     */
    public static byte[] open(byte[] sealed, byte[] recipientPublicKey, byte[] recipientPrivateKey) {
        if (sealed.length < OVERHEAD) return null;
        byte[] ephemeralPublic = Arrays.copyOfRange(sealed, 0, PUBLIC_KEY_BYTES);
        byte[] nonce = nonce(ephemeralPublic, recipientPublicKey);
        byte[] key = beforeNm(new X25519PrivateKeyParameters(recipientPrivateKey, 0),
                new X25519PublicKeyParameters(ephemeralPublic, 0));

        XSalsa20Engine cipher = new XSalsa20Engine();
        cipher.init(false, new ParametersWithIV(new KeyParameter(key), nonce));
        byte[] polyKey = new byte[32];
        cipher.processBytes(new byte[32], 0, 32, polyKey, 0);

        int cipherLength = sealed.length - OVERHEAD;
        byte[] expectedMac = mac(polyKey, sealed, OVERHEAD, cipherLength);
        byte[] mac = Arrays.copyOfRange(sealed, PUBLIC_KEY_BYTES, OVERHEAD);
        if (!Arrays.constantTimeAreEqual(expectedMac, mac)) {
            return null;
        }
        byte[] plain = new byte[cipherLength];
        cipher.processBytes(sealed, OVERHEAD, cipherLength, plain, 0);
        return plain;
    }

    private static void secretbox(byte[] message, byte[] nonce, byte[] key, byte[] out, int offset) {
        XSalsa20Engine cipher = new XSalsa20Engine();
        cipher.init(true, new ParametersWithIV(new KeyParameter(key), nonce));
        // first 32 keystream bytes key the authenticator
        byte[] polyKey = new byte[32];
        cipher.processBytes(new byte[32], 0, 32, polyKey, 0);

        int cipherOffset = offset + MAC_BYTES;
        cipher.processBytes(message, 0, message.length, out, cipherOffset);
        byte[] tag = mac(polyKey, out, cipherOffset, message.length);
        System.arraycopy(tag, 0, out, offset, MAC_BYTES);
        Arrays.fill(polyKey, (byte) 0);
    }

    private static byte[] mac(byte[] polyKey, byte[] data, int offset, int length) {
        Poly1305 poly = new Poly1305();
        poly.init(new KeyParameter(polyKey));
        poly.update(data, offset, length);
        byte[] tag = new byte[MAC_BYTES];
        poly.doFinal(tag, 0);
        return tag;
    }

    private static byte[] nonce(byte[] ephemeralPublic, byte[] recipientPublic) {
        Blake2bDigest blake = new Blake2bDigest(null, NONCE_BYTES, null, null);
        blake.update(ephemeralPublic, 0, ephemeralPublic.length);
        blake.update(recipientPublic, 0, recipientPublic.length);
        byte[] nonce = new byte[NONCE_BYTES];
        blake.doFinal(nonce, 0);
        return nonce;
    }

    /** X25519 shared point run through HSalsa20 with a zero input, as {@code crypto_box_beforenm}. */
    private static byte[] beforeNm(X25519PrivateKeyParameters privateKey, X25519PublicKeyParameters publicKey) {
        X25519Agreement agreement = new X25519Agreement();
        agreement.init(privateKey);
        byte[] shared = new byte[agreement.getAgreementSize()];
        agreement.calculateAgreement(publicKey, shared, 0);
        byte[] key = hsalsa20(shared, new byte[16]);
        Arrays.fill(shared, (byte) 0);
        return key;
    }

    static byte[] hsalsa20(byte[] key, byte[] input) {
        int[] state = new int[16];
        state[0] = SIGMA[0];
        state[5] = SIGMA[1];
        state[10] = SIGMA[2];
        state[15] = SIGMA[3];
        for (int i = 0; i < 4; i++) {
            state[1 + i] = Pack.littleEndianToInt(key, i * 4);
            state[6 + i] = Pack.littleEndianToInt(input, i * 4);
            state[11 + i] = Pack.littleEndianToInt(key, 16 + i * 4);
        }

        int[] x = new int[16];
        Salsa20Engine.salsaCore(20, state, x);
        // salsaCore adds the input back in; HSalsa20 wants the bare permutation
        int[] words = {
                x[0] - state[0], x[5] - state[5], x[10] - state[10], x[15] - state[15],
                x[6] - state[6], x[7] - state[7], x[8] - state[8], x[9] - state[9]
        };
        byte[] out = new byte[32];
        for (int i = 0; i < words.length; i++) {
            Pack.intToLittleEndian(words[i], out, i * 4);
        }
        return out;
    }
}
