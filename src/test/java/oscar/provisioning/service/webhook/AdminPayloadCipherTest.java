package oscar.provisioning.service.webhook;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.Arrays;
import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class AdminPayloadCipherTest {

    private static final int TAG_LENGTH = 16;
    private static final int HEADER_LENGTH = AdminPayloadCipher.SALT_LENGTH + 1 + AdminPayloadCipher.NONCE_LENGTH;

    private final AdminPayloadCipher cipher = new AdminPayloadCipher(new SecureRandom());

    @Test
    @DisplayName("Should write salt, algorithm id and nonce before the sealed fragment")
    void shouldWriteHeader() throws Exception {
        byte[] plaintext = "notify_webhook:plants endpoint=http://oscar/job/plants auth_token=abc"
            .getBytes(StandardCharsets.UTF_8);

        byte[] sealed = cipher.encrypt("secret-key", plaintext);

        assertThat(sealed).hasSize(HEADER_LENGTH + plaintext.length + TAG_LENGTH);
        assertThat(sealed[AdminPayloadCipher.SALT_LENGTH]).isEqualTo(AdminPayloadCipher.PBKDF2_AES_GCM);
        assertThat(decrypt("secret-key", sealed)).isEqualTo(plaintext);
    }

    @Test
    @DisplayName("Should split large payloads into 16 KiB fragments")
    void shouldFragmentLargePayloads() throws Exception {
        byte[] plaintext = new byte[2 * AdminPayloadCipher.FRAGMENT_SIZE + 1000];
        new SecureRandom().nextBytes(plaintext);

        byte[] sealed = cipher.encrypt("secret-key", plaintext);

        assertThat(sealed).hasSize(HEADER_LENGTH + plaintext.length + 3 * TAG_LENGTH);
        assertThat(decrypt("secret-key", sealed)).isEqualTo(plaintext);
    }

    @Test
    @DisplayName("Should use a fresh salt and nonce for every payload")
    void shouldRandomizeHeader() throws Exception {
        byte[] first = cipher.encrypt("secret-key", new byte[10]);
        byte[] second = cipher.encrypt("secret-key", new byte[10]);

        assertThat(Arrays.copyOf(first, HEADER_LENGTH)).isNotEqualTo(Arrays.copyOf(second, HEADER_LENGTH));
    }

    @Test
    @DisplayName("Should not decrypt with another password")
    void shouldBindToPassword() throws Exception {
        byte[] sealed = cipher.encrypt("secret-key", new byte[10]);

        assertThatThrownBy(() -> decrypt("other-key", sealed))
            .isInstanceOf(AEADBadTagException.class);
    }

    @Test
    @DisplayName("Should append the sequence number little-endian after the nonce")
    void shouldBuildFragmentNonce() {
        byte[] nonce = {1, 2, 3, 4, 5, 6, 7, 8};

        assertThat(AdminPayloadCipher.fragmentNonce(nonce, 258))
            .containsExactly(1, 2, 3, 4, 5, 6, 7, 8, 2, 1, 0, 0);
    }

    /** Independent reader of the sealed layout, written against the JDK cipher directly. */
    static byte[] decrypt(String password, byte[] sealed) throws Exception {
        byte[] salt = Arrays.copyOfRange(sealed, 0, AdminPayloadCipher.SALT_LENGTH);
        byte[] nonce = Arrays.copyOfRange(sealed, AdminPayloadCipher.SALT_LENGTH + 1, HEADER_LENGTH);
        SecretKeySpec key = AdminPayloadCipher.deriveKey(password, salt);

        byte[] associatedData = new byte[1 + TAG_LENGTH];
        System.arraycopy(open(key, nonce, 0, new byte[0], null, true), 0, associatedData, 1, TAG_LENGTH);

        ByteArrayOutputStream plaintext = new ByteArrayOutputStream();
        int fragment = AdminPayloadCipher.FRAGMENT_SIZE + TAG_LENGTH;
        int offset = HEADER_LENGTH;
        int sequence = 1;
        while (offset < sealed.length) {
            int end = Math.min(offset + fragment, sealed.length);
            associatedData[0] = end == sealed.length ? (byte) 0x80 : 0;
            plaintext.writeBytes(open(key, nonce, sequence++, Arrays.copyOfRange(sealed, offset, end),
                associatedData, false));
            offset = end;
        }
        return plaintext.toByteArray();
    }

    private static byte[] open(SecretKeySpec key, byte[] nonce, int sequence, byte[] input, byte[] aad,
                               boolean seal) throws Exception {
        Cipher aes = Cipher.getInstance("AES/GCM/NoPadding");
        aes.init(seal ? Cipher.ENCRYPT_MODE : Cipher.DECRYPT_MODE, key,
            new GCMParameterSpec(TAG_LENGTH * 8, AdminPayloadCipher.fragmentNonce(nonce, sequence)));
        if (aad != null) {
            aes.updateAAD(aad);
        }
        return aes.doFinal(input);
    }
}
