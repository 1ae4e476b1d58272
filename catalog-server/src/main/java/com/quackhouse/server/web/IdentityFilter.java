package com.quackhouse.server.web;

import com.quackhouse.auth.Principal;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Derives the request {@link Principal} from the identity headers set by the
 * upstream gateway and exposes it as a request attribute.
 *
 * <p>A request without a usable {@code X-User-Id} is anonymous.
 */
@Component
public final class IdentityFilter extends OncePerRequestFilter {

    public static final String USER_HEADER = "X-User-Id";
    public static final String ROLE_HEADER = "X-User-Role";
    public static final String PRINCIPAL_ATTRIBUTE = "quackhouse.principal";

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        Principal principal = Principal.fromHeaders(request.getHeader(USER_HEADER), request.getHeader(ROLE_HEADER));
        request.setAttribute(PRINCIPAL_ATTRIBUTE, principal);
        filterChain.doFilter(request, response);
    }
}
