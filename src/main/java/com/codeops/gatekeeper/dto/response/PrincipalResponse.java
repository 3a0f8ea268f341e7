package com.codeops.gatekeeper.dto.response;

import java.util.List;

public record PrincipalResponse(
        String subject,
        List<String> authorities
) {}
