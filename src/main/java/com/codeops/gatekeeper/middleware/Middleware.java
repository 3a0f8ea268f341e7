package com.codeops.gatekeeper.middleware;

import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import java.io.IOException;

/**
 * One stage of request handling. A middleware either continues with {@code next}
 * or writes a terminal response and returns without calling it.
 */
@FunctionalInterface
public interface Middleware {

    void handle(HttpServletRequest request, HttpServletResponse response, MiddlewareChain next)
            throws IOException, ServletException;
}
