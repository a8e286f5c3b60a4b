package com.codeheadsystems.gplot.dropwizard.auth;

/**
 * Bearer credentials extracted from a request, together with what the authenticator needs to
 * check device binding and to audit the attempt.
 *
 * @param token         raw JWT
 * @param fingerprint   device fingerprint derived from the request
 * @param clientAddress remote address of the caller
 * @param endpoint      request path, for audit records
 */
public record GplotCredentials(String token, String fingerprint, String clientAddress, String endpoint) {
}
