package com.codeops.gatekeeper.middleware;

import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import java.io.IOException;

/**
 * The remainder of the pipeline after the current middleware.
 */
@FunctionalInterface
public interface MiddlewareChain {

    void proceed(HttpServletRequest request, HttpServletResponse response) throws IOException, ServletException;
}
