package com.cropchain.trackingservice.security;

import org.springframework.security.authentication.AuthenticationCredentialsNotFoundException;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.oauth2.jwt.Jwt;

/**
 * Static access to the authenticated caller of the current request.
 */
public final class SecurityUtils {

    private SecurityUtils() {
    }

    public static CallerIdentity getCaller() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication == null || !(authentication.getPrincipal() instanceof Jwt)) {
            throw new AuthenticationCredentialsNotFoundException("No authenticated caller in the security context.");
        }
        return fromJwt((Jwt) authentication.getPrincipal());
    }

    /**
     * Maps the token claims issued by the auth service. The user id is carried in the
     * {@code id} claim; {@code sub} is the fallback.
     */
    static CallerIdentity fromJwt(Jwt jwt) {
        String userId = jwt.getClaimAsString("id");
        if (userId == null) {
            userId = jwt.getSubject();
        }
        return CallerIdentity.builder()
                .userId(userId)
                .farmerId(jwt.getClaimAsString("farmerId"))
                .role(jwt.getClaimAsString("role"))
                .email(jwt.getClaimAsString("email"))
                .build();
    }
}
