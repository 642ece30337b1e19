package com.affinity.x.auth;

import jakarta.servlet.http.HttpServletRequest;

import java.util.UUID;

/**
 * Supplies the authenticated viewer for a request. Token verification happens upstream;
 * the resolved id is trusted as given.
 */
public interface ViewerIdentityResolver {

    /**
     * @throws com.affinity.x.exceptions.UnauthorizedException when no usable identity is present
     */
    UUID resolve(HttpServletRequest request);
}
