package oscar.provisioning.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.List;
import oscar.provisioning.service.auth.AuthorizationGate;
import oscar.provisioning.util.BearerTokens;
import org.springframework.http.HttpHeaders;
import org.springframework.lang.NonNull;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Authenticates API calls that carry an OIDC bearer token.
 * Requests without one fall through to basic authentication.
 */
public class OidcAuthenticationFilter extends OncePerRequestFilter {

    static final String PROTECTED_PREFIX = "/system/";

    private final AuthorizationGate authorizationGate;

    public OidcAuthenticationFilter(AuthorizationGate authorizationGate) {
        this.authorizationGate = authorizationGate;
    }

    @Override
    protected boolean shouldNotFilter(@NonNull HttpServletRequest request) {
        String path = request.getRequestURI();
        return path == null || !path.startsWith(PROTECTED_PREFIX);
    }

    @Override
    protected void doFilterInternal(
        @NonNull HttpServletRequest request,
        @NonNull HttpServletResponse response,
        @NonNull FilterChain filterChain
    ) throws ServletException, IOException {
        String header = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (!BearerTokens.isBearer(header)) {
            filterChain.doFilter(request, response);
            return;
        }

        String rawToken = BearerTokens.extract(header);
        if (rawToken == null || !authorizationGate.isAuthorized(rawToken)) {
            response.sendError(HttpServletResponse.SC_UNAUTHORIZED, "Unauthorized");
            return;
        }

        Authentication auth = new UsernamePasswordAuthenticationToken(
            "oidc",
            null,
            List.of(new SimpleGrantedAuthority("ROLE_USER"))
        );
        SecurityContextHolder.getContext().setAuthentication(auth);

        filterChain.doFilter(request, response);
    }
}
