package com.codeops.gatekeeper.middleware;

import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import java.io.IOException;
import java.util.List;

/**
 * An ordered, immutable list of middleware. Each request runs the middleware in list order
 * and then the terminal stage, unless one of them short-circuits.
 */
public final class MiddlewarePipeline {

    private final List<Middleware> middlewares;

    public MiddlewarePipeline(List<Middleware> middlewares) {
        this.middlewares = List.copyOf(middlewares);
    }

    public List<Middleware> getMiddlewares() {
        return middlewares;
    }

    /**
     * Runs the pipeline for one request.
     *
     * @param request  the request
     * @param response the response
     * @param terminal the stage that runs after the last middleware
     */
    public void run(HttpServletRequest request, HttpServletResponse response, MiddlewareChain terminal)
            throws IOException, ServletException {
        invoke(0, request, response, terminal);
    }

    private void invoke(int index, HttpServletRequest request, HttpServletResponse response, MiddlewareChain terminal)
            throws IOException, ServletException {
        if (index == middlewares.size()) {
            terminal.proceed(request, response);
            return;
        }
        middlewares.get(index).handle(request, response,
                (nextRequest, nextResponse) -> invoke(index + 1, nextRequest, nextResponse, terminal));
    }
}
