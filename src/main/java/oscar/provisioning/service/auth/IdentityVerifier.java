package oscar.provisioning.service.auth;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import oscar.provisioning.config.OscarProperties;
import oscar.provisioning.exception.IdentityResolutionException;
import org.springframework.stereotype.Service;

/**
 * Verifies bearer tokens issued by the configured identity provider and resolves the
 * caller's subject and groups. Verification is local (cached key set); resolution is a
 * network round-trip to the userinfo endpoint.
 */
@Service
@Slf4j
public class IdentityVerifier {

    static final String ENTITLEMENT_CLAIM = "eduperson_entitlement";
    private static final int GROUP_FIELD_INDEX = 4;

    private final OidcProviderClient providerClient;
    private final String groupUrnPrefix;

    public IdentityVerifier(OidcProviderClient providerClient, OscarProperties properties) {
        this.providerClient = providerClient;
        this.groupUrnPrefix = properties.getOidc().getGroupUrnPrefix().toLowerCase(Locale.ROOT);
    }

    /**
     * @return true if the token is signed by the provider, unexpired and issued by it; false otherwise
     */
    public boolean verify(String rawToken) {
        if (rawToken == null || rawToken.isBlank()) {
            return false;
        }
        try {
            providerClient.verify(rawToken);
            return true;
        } catch (RuntimeException e) {
            log.debug("Token verification failed: {}", e.getMessage());
            return false;
        }
    }

    /**
     * Resolves the subject and groups of the token's owner.
     *
     * @throws IdentityResolutionException if the userinfo round-trip fails
     */
    public UserIdentity resolveIdentity(String rawToken) throws IdentityResolutionException {
        Map<String, Object> claims;
        try {
            claims = providerClient.fetchUserInfo(rawToken);
        } catch (RuntimeException e) {
            throw new IdentityResolutionException("Unable to obtain user info from the identity provider: "
                + e.getMessage(), e);
        }
        Object subject = claims.get("sub");
        Object entitlements = claims.get(ENTITLEMENT_CLAIM);
        List<String> groups = entitlements instanceof Collection<?> values
            ? extractGroups(values, groupUrnPrefix)
            : List.of();
        return new UserIdentity(subject != null ? subject.toString() : null, groups);
    }

    /**
     * Maps entitlement URNs ({@code urn:mace:egi.eu:group:<group>:...}) to short group names.
     * Entries without the prefix or with fewer than five colon-separated fields are dropped.
     */
    static List<String> extractGroups(Collection<?> entitlements, String urnPrefix) {
        List<String> groups = new ArrayList<>();
        for (Object value : entitlements) {
            if (value == null) {
                continue;
            }
            String urn = value.toString().trim().toLowerCase(Locale.ROOT);
            if (!urn.startsWith(urnPrefix)) {
                continue;
            }
            String[] fields = urn.split(":", -1);
            if (fields.length > GROUP_FIELD_INDEX) {
                groups.add(fields[GROUP_FIELD_INDEX]);
            }
        }
        return groups;
    }
}
