package com.company.alerting.security;

import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.stereotype.Component;

/**
 * Identity of the authenticated caller, for audit logging.
 */
@Component
public class CallerContext {

    public String getCurrentCallerId() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();

        if (authentication != null && authentication.getPrincipal() instanceof Jwt jwt) {
            String clientId = jwt.getClaimAsString("azp");
            return clientId != null ? clientId : jwt.getClaimAsString("sub");
        }

        return "anonymous";
    }
}
