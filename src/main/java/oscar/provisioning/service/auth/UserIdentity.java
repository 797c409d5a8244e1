package oscar.provisioning.service.auth;

import java.util.List;

/**
 * Essential fields resolved from the identity provider's userinfo endpoint.
 */
public record UserIdentity(String subject, List<String> groups) {

    public UserIdentity {
        groups = groups == null ? List.of() : List.copyOf(groups);
    }

    public boolean isMemberOf(String group) {
        return group != null && groups.contains(group);
    }
}
