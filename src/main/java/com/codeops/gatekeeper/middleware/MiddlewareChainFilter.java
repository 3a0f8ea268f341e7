package com.codeops.gatekeeper.middleware;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Servlet filter that runs a {@link MiddlewarePipeline} and then hands the request
 * to the rest of the servlet filter chain.
 */
@RequiredArgsConstructor
public class MiddlewareChainFilter extends OncePerRequestFilter {

    private final MiddlewarePipeline pipeline;

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        pipeline.run(request, response, filterChain::doFilter);
    }
}
