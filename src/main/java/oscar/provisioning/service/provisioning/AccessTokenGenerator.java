package oscar.provisioning.service.provisioning;

import java.security.SecureRandom;
import java.util.HexFormat;
import org.springframework.stereotype.Component;

/**
 * Generates service access tokens: 32 bytes from a CSPRNG, hex encoded so they are safe in URLs
 * and webhook configuration strings.
 */
@Component
public class AccessTokenGenerator {

    private static final int TOKEN_BYTES = 32;

    private final SecureRandom random;

    public AccessTokenGenerator(SecureRandom random) {
        this.random = random;
    }

    public String generate() {
        byte[] bytes = new byte[TOKEN_BYTES];
        random.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }
}
