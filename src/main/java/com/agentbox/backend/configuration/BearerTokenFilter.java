package com.agentbox.backend.configuration;

import com.agentbox.backend.service.AuthenticationService;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Resolves {@code Authorization: Bearer ...} into a {@link CallerIdentity}. An unusable
 * token leaves the request anonymous, so protected routes answer 401 from the entry point.
 */
@Slf4j
@RequiredArgsConstructor
public class BearerTokenFilter extends OncePerRequestFilter {
    private static final String PREFIX = "Bearer ";

    private final AuthenticationService authenticationService;

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        String header = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (header != null && header.startsWith(PREFIX)) {
            Optional<CallerIdentity> caller = authenticationService.resolve(header.substring(PREFIX.length()).trim());
            if (caller.isPresent()) {
                List<SimpleGrantedAuthority> authorities = caller.get().isAdmin()
                        ? List.of(new SimpleGrantedAuthority("ROLE_user"), new SimpleGrantedAuthority("ROLE_admin"))
                        : List.of(new SimpleGrantedAuthority("ROLE_user"));
                var authentication = new UsernamePasswordAuthenticationToken(caller.get(), null, authorities);
                authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
                SecurityContextHolder.getContext().setAuthentication(authentication);
            } else {
                log.debug("Rejected bearer token on {} {}", request.getMethod(), request.getRequestURI());
                SecurityContextHolder.clearContext();
            }
        }
        chain.doFilter(request, response);
    }
}
