package com.last9.mcpserver.session;

import com.last9.shared.telemetry.exception.DecodeException;

/**
 * Reads the claims of a backend issued JWT.
 */
public interface JwtClaimsDecoder {

    /**
     * @throws DecodeException if the token is not a well formed JWT
     */
    JwtClaims decode(String token);
}
