package com.chicu.croprecommender.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

@Slf4j
@Component
@Order(1)
public class AccessLogFilter extends OncePerRequestFilter {

    @Override
    protected void doFilterInternal(HttpServletRequest req, HttpServletResponse res, FilterChain chain)
            throws IOException, ServletException {
        long t0 = System.nanoTime();
        try {
            chain.doFilter(req, res);
        } finally {
            long dtMs = (System.nanoTime() - t0) / 1_000_000;
            int status = res.getStatus();
            if (status >= 500) {
                log.warn("HTTP <<< {} {} -> {} ({} ms)", req.getMethod(), req.getRequestURI(), status, dtMs);
            } else {
                log.info("HTTP <<< {} {} -> {} ({} ms)", req.getMethod(), req.getRequestURI(), status, dtMs);
            }
        }
    }

    /** Пробы actuator не засоряют лог. */
    @Override
    protected boolean shouldNotFilter(HttpServletRequest req) {
        String uri = req.getRequestURI();
        return uri != null && uri.startsWith("/actuator");
    }
}
