package com.tgnote.backend.filter;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tgnote.backend.exception.GlobalExceptionHandler.ErrorBody;
import com.tgnote.backend.utils.TelegramInitDataVerifier;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Requires valid Telegram init data on requests that change notes. Reads go through untouched.
 */
@Slf4j
public class TelegramAuthFilter extends OncePerRequestFilter {

    public static final String INIT_DATA_HEADER = "X-Telegram-Init-Data";

    private static final Set<String> MUTATING = Set.of(
            HttpMethod.POST.name(), HttpMethod.PUT.name(), HttpMethod.PATCH.name(), HttpMethod.DELETE.name());

    private final TelegramInitDataVerifier verifier;
    private final ObjectMapper objectMapper;

    public TelegramAuthFilter(TelegramInitDataVerifier verifier, ObjectMapper objectMapper) {
        this.verifier = verifier;
        this.objectMapper = objectMapper;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getRequestURI().substring(request.getContextPath().length());
        return !MUTATING.contains(request.getMethod()) || !path.startsWith("/notes");
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        Optional<Long> userId = verifier.verify(request.getHeader(INIT_DATA_HEADER));
        if (userId.isEmpty()) {
            log.warn("Rejected {} {}: missing or invalid Telegram init data", request.getMethod(), request.getRequestURI());
            response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
            response.setContentType(MediaType.APPLICATION_JSON_VALUE);
            objectMapper.writeValue(response.getOutputStream(),
                    new ErrorBody("unauthorized", "Missing or invalid Telegram init data"));
            return;
        }

        var auth = new UsernamePasswordAuthenticationToken(String.valueOf(userId.get()), null, List.of());
        SecurityContextHolder.getContext().setAuthentication(auth);
        filterChain.doFilter(request, response);
    }
}
