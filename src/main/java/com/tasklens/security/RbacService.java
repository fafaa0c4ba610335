package com.tasklens.security;

import com.tasklens.user.User;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class RbacService {

    public static final String SCOPE_USER = "tasklens.user";
    public static final String SCOPE_ADMIN = "tasklens.admin";

    /**
     * Scopes granted to a user's access tokens. Superusers also get the admin scope.
     */
    public List<String> scopesFor(User user) {
        return user.isSuperuser() ? List.of(SCOPE_USER, SCOPE_ADMIN) : List.of(SCOPE_USER);
    }

    public boolean isAdmin(Authentication auth) {
        return hasScope(auth, "SCOPE_" + SCOPE_ADMIN);
    }

    private boolean hasScope(Authentication auth, String scope) {
        if (auth == null) return false;
        return auth.getAuthorities().stream()
                .map(GrantedAuthority::getAuthority)
                .anyMatch(a -> a.equals(scope));
    }
}
