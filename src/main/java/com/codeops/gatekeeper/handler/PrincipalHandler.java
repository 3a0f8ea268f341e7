package com.codeops.gatekeeper.handler;

import com.codeops.gatekeeper.dto.response.PrincipalResponse;
import com.codeops.gatekeeper.security.AuthenticationContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.function.ServerRequest;
import org.springframework.web.servlet.function.ServerResponse;

import java.util.List;

/**
 * Returns the principal the current request was authenticated as.
 */
@Component
@Slf4j
public class PrincipalHandler {

    /**
     * @param request the request
     * @param context the authentication context of this request
     * @return the subject and its authorities, sorted
     */
    public ServerResponse currentPrincipal(ServerRequest request, AuthenticationContext context) {
        log.debug("Resolving principal {}", context.principal());
        return ServerResponse.ok().body(new PrincipalResponse(context.principal(), List.copyOf(context.authorityNames())));
    }
}
