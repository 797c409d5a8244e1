package oscar.provisioning.service.webhook;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;
import javax.crypto.Cipher;
import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.PBEKeySpec;
import javax.crypto.spec.SecretKeySpec;

/**
 * Encrypts MinIO admin API request bodies with the caller's secret key.
 *
 * <p>Layout: {@code salt(32) | algorithm id(1) | nonce(8) | fragments}. The key is derived with
 * PBKDF2-HMAC-SHA256 (8192 rounds); the body is split into 16 KiB fragments, each sealed with
 * AES-256-GCM under {@code nonce || little-endian sequence number}. The additional data of every
 * fragment is a flag byte (0x80 on the final fragment) followed by the tag of an empty message
 * sealed with sequence number 0.</p>
 */
public class AdminPayloadCipher {

    static final int SALT_LENGTH = 32;
    static final int NONCE_LENGTH = 8;
    static final byte PBKDF2_AES_GCM = 0x02;
    static final int FRAGMENT_SIZE = 16 * 1024;
    static final int PBKDF2_ROUNDS = 8192;
    private static final int KEY_BITS = 256;
    private static final int TAG_BITS = 128;
    private static final byte FINAL_FLAG = (byte) 0x80;

    private final SecureRandom random;

    public AdminPayloadCipher(SecureRandom random) {
        this.random = random;
    }

    public byte[] encrypt(String password, byte[] plaintext) throws GeneralSecurityException {
        byte[] salt = new byte[SALT_LENGTH];
        byte[] nonce = new byte[NONCE_LENGTH];
        random.nextBytes(salt);
        random.nextBytes(nonce);
        SecretKeySpec key = deriveKey(password, salt);

        ByteArrayOutputStream out = new ByteArrayOutputStream(
            SALT_LENGTH + 1 + NONCE_LENGTH + plaintext.length + (plaintext.length / FRAGMENT_SIZE + 1) * 16);
        out.writeBytes(salt);
        out.write(PBKDF2_AES_GCM);
        out.writeBytes(nonce);

        byte[] associatedData = new byte[1 + TAG_BITS / 8];
        byte[] headerTag = seal(key, nonce, 0, new byte[0], null);
        System.arraycopy(headerTag, 0, associatedData, 1, headerTag.length);

        int sequence = 1;
        int offset = 0;
        while (plaintext.length - offset > FRAGMENT_SIZE) {
            out.writeBytes(seal(key, nonce, sequence++, Arrays.copyOfRange(plaintext, offset, offset + FRAGMENT_SIZE),
                associatedData));
            offset += FRAGMENT_SIZE;
        }
        associatedData[0] = FINAL_FLAG;
        out.writeBytes(seal(key, nonce, sequence, Arrays.copyOfRange(plaintext, offset, plaintext.length),
            associatedData));
        return out.toByteArray();
    }

    static SecretKeySpec deriveKey(String password, byte[] salt) throws GeneralSecurityException {
        SecretKeyFactory factory = SecretKeyFactory.getInstance("PBKDF2WithHmacSHA256");
        byte[] key = factory.generateSecret(new PBEKeySpec(password.toCharArray(), salt, PBKDF2_ROUNDS, KEY_BITS))
            .getEncoded();
        return new SecretKeySpec(key, "AES");
    }

    static byte[] fragmentNonce(byte[] nonce, int sequence) {
        return ByteBuffer.allocate(NONCE_LENGTH + 4)
            .order(ByteOrder.LITTLE_ENDIAN)
            .put(nonce)
            .putInt(sequence)
            .array();
    }

    private static byte[] seal(SecretKeySpec key, byte[] nonce, int sequence, byte[] plaintext,
                               byte[] associatedData) throws GeneralSecurityException {
        Cipher cipher = Cipher.getInstance("AES/GCM/NoPadding");
        cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(TAG_BITS, fragmentNonce(nonce, sequence)));
        if (associatedData != null) {
            cipher.updateAAD(associatedData);
        }
        return cipher.doFinal(plaintext);
    }
}
