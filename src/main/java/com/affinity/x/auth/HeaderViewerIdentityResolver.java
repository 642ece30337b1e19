package com.affinity.x.auth;

import com.affinity.x.exceptions.UnauthorizedException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Reads the viewer id an upstream gateway placed on the request after authenticating it.
 */
@Slf4j
@Component
public class HeaderViewerIdentityResolver implements ViewerIdentityResolver {
    private final String headerName;

    public HeaderViewerIdentityResolver(@Value("${matching.auth.viewer-header:X-Viewer-Id}") String headerName) {
        this.headerName = headerName;
    }

    @Override
    public UUID resolve(HttpServletRequest request) {
        String raw = request.getHeader(headerName);
        if (StringUtils.isBlank(raw)) {
            throw new UnauthorizedException("Missing viewer identity");
        }
        try {
            return UUID.fromString(raw.trim());
        } catch (IllegalArgumentException e) {
            log.warn("Rejected malformed {} header", headerName);
            throw new UnauthorizedException("Invalid viewer identity");
        }
    }
}
