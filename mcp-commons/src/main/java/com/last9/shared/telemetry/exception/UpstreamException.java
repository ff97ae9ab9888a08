package com.last9.shared.telemetry.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Backend call failed, either with a non-2xx status or at the transport level.
 * The message names the endpoint, the status and a truncated response body.
 */
public class UpstreamException extends TelemetryException {

    public static final int MAX_BODY_LENGTH = 512;

    private final String endpoint;
    private final int status;
    private final String body;

    public UpstreamException(String endpoint, int status, String body) {
        super(ErrorKind.UPSTREAM, describe(endpoint, status, body), context(endpoint, status), null);
        this.endpoint = endpoint;
        this.status = status;
        this.body = truncate(body);
    }

    /** Transport failure; no HTTP status was received. */
    public UpstreamException(String endpoint, Throwable cause) {
        super(ErrorKind.UPSTREAM, String.format("request to %s failed: %s", endpoint, cause.getMessage()),
                context(endpoint, 0), cause);
        this.endpoint = endpoint;
        this.status = 0;
        this.body = null;
    }

    public String getEndpoint() {
        return endpoint;
    }

    /** HTTP status, or 0 for transport failures. */
    public int getStatus() {
        return status;
    }

    public String getBody() {
        return body;
    }

    static String truncate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() <= MAX_BODY_LENGTH ? body : body.substring(0, MAX_BODY_LENGTH) + "...";
    }

    private static String describe(String endpoint, int status, String body) {
        return String.format("request to %s failed with status %d: %s", endpoint, status, truncate(body));
    }

    private static Map<String, Object> context(String endpoint, int status) {
        Map<String, Object> ctx = new LinkedHashMap<>();
        ctx.put("endpoint", endpoint);
        ctx.put("status", status);
        return ctx;
    }
}
