package com.last9.mcpserver.session;

import com.last9.mcpserver.config.properties.Last9Properties;
import com.last9.shared.telemetry.exception.DecodeException;
import com.last9.shared.telemetry.exception.ValidationException;
import lombok.extern.log4j.Log4j2;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Credentials and tenant settings shared by every tool invocation.
 *
 * <p>The current state is an immutable {@link SessionSnapshot} in a volatile field. Readers take
 * the fast path while the token is fresh. Once it is not, callers serialize on a lock, the first
 * one performs the exchange and the rest re-check and return the snapshot it published, so at
 * most one exchange is in flight.
 *
 * <p>The datasource is resolved after the first successful exchange and carried over by later
 * refreshes until {@link #resolveTenant(boolean)} forces it again.
 */
@Component
@Log4j2
public class SessionContext {

    private final TokenExchangeClient tokenExchangeClient;
    private final DatasourceResolver datasourceResolver;
    private final JwtClaimsDecoder claimsDecoder;
    private final Clock clock;
    private final String refreshToken;
    private final double refreshBufferFraction;
    private final String apiHost;
    private final String datasourceName;

    private final ReentrantLock refreshLock = new ReentrantLock();
    private volatile SessionSnapshot snapshot;

    @Autowired
    public SessionContext(TokenExchangeClient tokenExchangeClient, DatasourceResolver datasourceResolver,
                          JwtClaimsDecoder claimsDecoder, Clock clock, Last9Properties properties) {
        this(tokenExchangeClient, datasourceResolver, claimsDecoder, clock,
                properties.getAuth().getRefreshToken(), properties.getAuth().getRefreshBufferFraction(),
                properties.getApi().getHost(), properties.getApi().getDatasourceName());
    }

    SessionContext(TokenExchangeClient tokenExchangeClient, DatasourceResolver datasourceResolver,
                   JwtClaimsDecoder claimsDecoder, Clock clock, String refreshToken,
                   double refreshBufferFraction, String apiHost, String datasourceName) {
        this.tokenExchangeClient = tokenExchangeClient;
        this.datasourceResolver = datasourceResolver;
        this.claimsDecoder = claimsDecoder;
        this.clock = clock;
        this.refreshToken = refreshToken;
        this.refreshBufferFraction = refreshBufferFraction;
        this.apiHost = apiHost;
        this.datasourceName = datasourceName;
    }

    /**
     * Get a valid access token, refreshing it first if it is inside the refresh buffer
     */
    public String getAccessToken() {
        return snapshot().accessToken();
    }

    /**
     * Get a consistent view of token, tenant and datasource, refreshing if needed
     */
    public SessionSnapshot snapshot() {
        SessionSnapshot current = this.snapshot;
        if (isFresh(current)) {
            return current;
        }
        refreshLock.lock();
        try {
            current = this.snapshot;
            if (isFresh(current)) {
                return current;
            }
            SessionSnapshot refreshed = refresh(current);
            this.snapshot = refreshed;
            return refreshed;
        } finally {
            refreshLock.unlock();
        }
    }

    /**
     * Resolve the tenant datasource. Without {@code force} this only runs when no datasource has
     * been resolved yet.
     */
    public SessionSnapshot resolveTenant(boolean force) {
        SessionSnapshot current = snapshot();
        if (!force && current.datasource() != null) {
            return current;
        }
        refreshLock.lock();
        try {
            current = this.snapshot;
            Datasource ds = datasourceResolver.resolve(current.apiBaseUrl(), current.accessToken(), datasourceName);
            SessionSnapshot updated = current.withDatasource(ds);
            this.snapshot = updated;
            return updated;
        } finally {
            refreshLock.unlock();
        }
    }

    private boolean isFresh(SessionSnapshot s) {
        return s != null && clock.instant().isBefore(s.refreshAt());
    }

    private SessionSnapshot refresh(SessionSnapshot previous) {
        if (!StringUtils.hasText(refreshToken)) {
            throw new ValidationException("refresh token is not configured (last9.auth.refresh-token)");
        }
        String oauthUrl = claimsDecoder.decode(refreshToken).actionUrl();
        if (oauthUrl == null) {
            throw new DecodeException("no audience found in refresh token claims");
        }

        Instant obtainedAt = clock.instant();
        String accessToken = tokenExchangeClient.exchange(oauthUrl, refreshToken);
        JwtClaims claims = claimsDecoder.decode(accessToken);
        if (!StringUtils.hasText(claims.organizationSlug())) {
            throw new DecodeException("organization slug not found in token");
        }
        if (claims.expiresAt() == null) {
            throw new DecodeException("no expiration time found in token");
        }
        String actionUrl = claims.actionUrl();
        if (actionUrl == null) {
            throw new DecodeException("no audience found in token claims");
        }

        Duration lifetime = Duration.between(obtainedAt, claims.expiresAt());
        if (lifetime.isNegative()) {
            lifetime = Duration.ZERO;
        }
        Instant refreshAt = claims.expiresAt().minusMillis((long) (lifetime.toMillis() * refreshBufferFraction));
        String apiBaseUrl = String.format("https://%s/api/v4/organizations/%s", apiHost, claims.organizationSlug());

        Datasource ds;
        if (previous != null && previous.datasource() != null && apiBaseUrl.equals(previous.apiBaseUrl())) {
            ds = previous.datasource();
        } else {
            ds = datasourceResolver.resolve(apiBaseUrl, accessToken, datasourceName);
        }

        log.info("Access token refreshed for org {}, expires at {}, next refresh at {}",
                claims.organizationSlug(), claims.expiresAt(), refreshAt);
        return new SessionSnapshot(accessToken, claims.expiresAt(), refreshAt,
                claims.organizationSlug(), actionUrl, apiBaseUrl, ds);
    }
}
