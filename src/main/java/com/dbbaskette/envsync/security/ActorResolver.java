package com.dbbaskette.envsync.security;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.security.authentication.AnonymousAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

import java.util.regex.Pattern;

/**
 * Works out who is acting for audit purposes.
 */
public final class ActorResolver {

    public static final String ACTOR_HEADER = "X-Actor-Id";
    public static final String ANONYMOUS = "anonymous";

    private static final Pattern SAFE_ACTOR = Pattern.compile("^[A-Za-z0-9@._:-]{1,100}$");

    private ActorResolver() {}

    public static String resolve(HttpServletRequest request) {
        String header = request.getHeader(ACTOR_HEADER);
        if (header != null && SAFE_ACTOR.matcher(header.trim()).matches()) {
            return header.trim();
        }
        Authentication auth = SecurityContextHolder.getContext().getAuthentication();
        if (auth != null && auth.isAuthenticated() && !(auth instanceof AnonymousAuthenticationToken)) {
            return auth.getName();
        }
        return ANONYMOUS;
    }
}
