package com.codeops.gatekeeper.handler;

import com.codeops.gatekeeper.config.AppConstants;
import com.codeops.gatekeeper.dto.response.HealthResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.function.ServerRequest;
import org.springframework.web.servlet.function.ServerResponse;

import java.time.Clock;

/**
 * Public liveness endpoint.
 */
@Component
@RequiredArgsConstructor
public class HealthHandler {

    private final Clock clock;

    public ServerResponse health(ServerRequest request) {
        return ServerResponse.ok().body(new HealthResponse("UP", AppConstants.SERVICE_NAME, clock.instant()));
    }
}
