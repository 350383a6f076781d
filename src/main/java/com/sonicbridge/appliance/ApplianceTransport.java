package com.sonicbridge.appliance;

import reactor.core.publisher.Mono;

/**
 * Issues HTTP requests to the firewall appliance.
 *
 * Implementations return every HTTP status as an {@link ApplianceResponse}; the Mono
 * only errors for transport-level failures (connection refused, DNS, TLS, open circuit),
 * which are reported as {@link ApplianceUnavailableException}.
 */
public interface ApplianceTransport {

    /**
     * Send a request to the appliance
     *
     * @param request the fully prepared request, credentials included
     * @return Mono of the response
     */
    Mono<ApplianceResponse> exchange(ApplianceRequest request);
}
