package org.caureq.fabricops.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.caureq.fabricops.config.FabricProps;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/** Mutating routes (configure, rollback) need X-API-KEY. Reads stay open. */
@Component
@Slf4j
public class ApiKeyFilter extends OncePerRequestFilter {
    private final FabricProps props;

    public ApiKeyFilter(FabricProps props) {
        this.props = props;
        if (props.apiKey() == null || props.apiKey().isBlank()) {
            log.warn("[Security] fabric.api-key is empty, configure/rollback are NOT protected");
        }
    }

    static boolean needsKey(String method, String path) {
        if (!"POST".equalsIgnoreCase(method)) return false;
        return path.startsWith("/api/v1/port/configure") || path.startsWith("/api/v1/rollback/");
    }

    @Override
    protected void doFilterInternal(HttpServletRequest req, HttpServletResponse res, FilterChain chain)
            throws ServletException, IOException {

        var expected = props.apiKey();
        if (expected != null && !expected.isBlank() && needsKey(req.getMethod(), req.getRequestURI())) {
            String key = req.getHeader("X-API-KEY");
            if (key == null || !key.equals(expected)) {
                res.setStatus(HttpStatus.UNAUTHORIZED.value());
                res.setContentType("application/json");
                res.getWriter().write("{\"code\":\"AUTH_REQUIRED\",\"message\":\"Missing or invalid X-API-KEY\"}");
                return;
            }
        }

        chain.doFilter(req, res);
    }
}
