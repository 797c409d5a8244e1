package oscar.provisioning.service.auth;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwsHeader;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.LocatorAdapter;
import io.jsonwebtoken.security.Jwk;
import io.jsonwebtoken.security.JwkSet;
import io.jsonwebtoken.security.Jwks;
import java.security.Key;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import oscar.provisioning.config.OscarProperties;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * Thin client over an OpenID Connect provider: discovery, key set and userinfo.
 */
@Component
@Slf4j
public class OidcProviderClient {

    private static final String DISCOVERY_PATH = "/.well-known/openid-configuration";
    private static final ParameterizedTypeReference<Map<String, Object>> JSON_OBJECT =
        new ParameterizedTypeReference<>() { };

    private final RestTemplate restTemplate;
    private final String issuer;

    private volatile Map<String, Object> metadata;
    private volatile JwkSet keySet;

    public OidcProviderClient(@Qualifier("oidcRestTemplate") RestTemplate restTemplate, OscarProperties properties) {
        this.restTemplate = restTemplate;
        this.issuer = trimTrailingSlash(properties.getOidc().getIssuer());
    }

    /**
     * Verifies signature, expiry and issuer of {@code rawToken}.
     * The audience is not checked: tokens are issued to arbitrary clients of the same provider.
     *
     * @throws JwtException when the token is malformed, expired or not signed by the provider
     * @throws RestClientException when discovery or the key set download fails
     */
    public Claims verify(String rawToken) {
        return Jwts.parser()
            .keyLocator(new KeySetLocator())
            .requireIssuer(String.valueOf(metadata().getOrDefault("issuer", issuer)))
            .build()
            .parseSignedClaims(rawToken)
            .getPayload();
    }

    /**
     * Fetches the userinfo claims for the bearer token.
     *
     * @throws RestClientException if the provider rejects the token or is unreachable
     */
    public Map<String, Object> fetchUserInfo(String rawToken) {
        Object endpoint = metadata().get("userinfo_endpoint");
        if (endpoint == null) {
            throw new RestClientException("Identity provider " + issuer + " does not publish a userinfo endpoint");
        }
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(rawToken);
        ResponseEntity<Map<String, Object>> response = restTemplate.exchange(
            endpoint.toString(), HttpMethod.GET, new HttpEntity<>(headers), JSON_OBJECT);
        if (response.getBody() == null) {
            throw new RestClientException("Empty userinfo response from " + issuer);
        }
        return response.getBody();
    }

    private Map<String, Object> metadata() {
        Map<String, Object> current = metadata;
        if (current == null) {
            ResponseEntity<Map<String, Object>> response = restTemplate.exchange(
                issuer + DISCOVERY_PATH, HttpMethod.GET, HttpEntity.EMPTY, JSON_OBJECT);
            current = response.getBody();
            if (current == null) {
                throw new RestClientException("Empty discovery document from " + issuer);
            }
            metadata = current;
            log.info("Loaded OpenID configuration from {}", issuer);
        }
        return current;
    }

    private JwkSet keySet(boolean forceRefresh) {
        JwkSet current = keySet;
        if (current == null || forceRefresh) {
            Object jwksUri = metadata().get("jwks_uri");
            if (jwksUri == null) {
                throw new RestClientException("Identity provider " + issuer + " does not publish a jwks_uri");
            }
            String json = restTemplate.getForObject(jwksUri.toString(), String.class);
            if (json == null) {
                throw new RestClientException("Empty key set from " + jwksUri);
            }
            current = Jwks.setParser().build().parse(json);
            keySet = current;
            log.info("Identity provider key set refreshed ({} keys)", current.getKeys().size());
        }
        return current;
    }

    private static String trimTrailingSlash(String value) {
        if (value == null) {
            return "";
        }
        return value.endsWith("/") ? value.substring(0, value.length() - 1) : value;
    }

    /** Resolves the verification key by {@code kid}, refreshing the key set once on a miss (key rotation). */
    private final class KeySetLocator extends LocatorAdapter<Key> {

        @Override
        protected Key locate(JwsHeader header) {
            String kid = header.getKeyId();
            Key key = find(keySet(false), kid);
            if (key == null) {
                key = find(keySet(true), kid);
            }
            if (key == null) {
                throw new JwtException("No key with id " + kid + " published by " + issuer);
            }
            return key;
        }

        private Key find(JwkSet set, String kid) {
            for (Jwk<?> jwk : set.getKeys()) {
                if (kid == null || kid.equals(jwk.getId())) {
                    return jwk.toKey();
                }
            }
            return null;
        }
    }
}
