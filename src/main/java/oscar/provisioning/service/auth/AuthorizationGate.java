package oscar.provisioning.service.auth;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import oscar.provisioning.config.OscarProperties;
import oscar.provisioning.exception.IdentityResolutionException;
import oscar.provisioning.util.LogSanitizer;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Decides whether a bearer token grants access to the API and whether its owner belongs to a
 * virtual organization.
 */
@Service
@Slf4j
public class AuthorizationGate {

    private final IdentityVerifier verifier;
    private final String adminSubject;
    private final List<String> adminGroups;
    private final TokenCache tokenCache;

    @Autowired
    public AuthorizationGate(IdentityVerifier verifier, OscarProperties properties) {
        this(verifier, properties, Clock.systemUTC());
    }

    AuthorizationGate(IdentityVerifier verifier, OscarProperties properties, Clock clock) {
        this.verifier = verifier;
        this.adminSubject = properties.getOidc().getSubject();
        this.adminGroups = List.copyOf(properties.getOidc().getGroups());
        this.tokenCache = new TokenCache(verifier::verify, properties.getOidc().getSweepMinInterval(), clock);
    }

    /**
     * Checks if a token is authorised to access the API: valid, and either owned by the admin
     * subject or by a member of one of the admin groups. Fails closed on any resolution error.
     */
    public boolean isAuthorized(String rawToken) {
        if (!verifier.verify(rawToken)) {
            return false;
        }

        Optional<UserIdentity> cached = tokenCache.get(rawToken);
        UserIdentity identity;
        if (cached.isPresent()) {
            identity = cached.get();
        } else {
            try {
                identity = verifier.resolveIdentity(rawToken);
            } catch (IdentityResolutionException e) {
                log.warn("Denying access, identity could not be resolved: {}", e.getMessage());
                return false;
            }
            tokenCache.put(rawToken, identity);
        }

        if (adminSubject != null && adminSubject.equals(identity.subject())) {
            return true;
        }
        boolean granted = identity.groups().stream().anyMatch(adminGroups::contains);
        if (!granted) {
            log.info("Subject {} is not in any authorised group", LogSanitizer.maskIdentifier(identity.subject()));
        }
        return granted;
    }

    /**
     * Resolves a fresh identity (never cached) and checks membership of {@code vo}.
     *
     * @throws IdentityResolutionException if the identity provider cannot be queried
     */
    public boolean userHasVO(String rawToken, String vo) throws IdentityResolutionException {
        return verifier.resolveIdentity(rawToken).isMemberOf(vo);
    }

    TokenCache tokenCache() {
        return tokenCache;
    }
}
