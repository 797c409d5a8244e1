package oscar.provisioning.util;

/**
 * Extraction of bearer tokens from {@code Authorization} header values.
 */
public final class BearerTokens {

    public static final String PREFIX = "Bearer ";

    private BearerTokens() {
    }

    public static boolean isBearer(String authorizationHeader) {
        return authorizationHeader != null && authorizationHeader.startsWith(PREFIX);
    }

    /**
     * @return the raw token, or null when the header does not carry a bearer token
     */
    public static String extract(String authorizationHeader) {
        if (!isBearer(authorizationHeader)) {
            return null;
        }
        String token = authorizationHeader.substring(PREFIX.length()).trim();
        return token.isEmpty() ? null : token;
    }
}
