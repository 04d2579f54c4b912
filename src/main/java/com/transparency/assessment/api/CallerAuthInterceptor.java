package com.transparency.assessment.api;

import com.transparency.assessment.config.AssessmentProperties;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Set;
import java.util.stream.Collectors;

@Component
public class CallerAuthInterceptor implements HandlerInterceptor {
    private static final Logger log = LoggerFactory.getLogger(CallerAuthInterceptor.class);
    private static final String BEARER = "Bearer ";

    private final Set<String> acceptedTokens;

    public CallerAuthInterceptor(AssessmentProperties properties) {
        this.acceptedTokens = properties.auth().tokens().stream()
                .map(String::trim)
                .filter(t -> !t.isEmpty())
                .collect(Collectors.toUnmodifiableSet());
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) throws IOException {
        String header = request.getHeader(HttpHeaders.AUTHORIZATION);
        String token = header != null && header.regionMatches(true, 0, BEARER, 0, BEARER.length())
                ? header.substring(BEARER.length()).trim()
                : "";
        if (!token.isEmpty() && (acceptedTokens.isEmpty() || acceptedTokens.contains(token))) {
            return true;
        }

        log.warn("Rejected unauthenticated {} {}", request.getMethod(), request.getRequestURI());
        response.setStatus(HttpStatus.UNAUTHORIZED.value());
        response.setHeader(HttpHeaders.WWW_AUTHENTICATE, "Bearer");
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        response.getWriter().write("{\"error\":\"UNAUTHORIZED\",\"message\":\"Invalid authentication credentials\"}");
        return false;
    }
}
