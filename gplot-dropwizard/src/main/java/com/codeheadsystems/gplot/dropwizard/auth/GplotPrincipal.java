package com.codeheadsystems.gplot.dropwizard.auth;

import java.security.Principal;

/**
 * Principal representing an authenticated caller. The name is the token's group, which is
 * what the image resources scope storage to.
 *
 * @param group   group claim from the JWT
 * @param tokenId JWT ID, used for revocation
 */
public record GplotPrincipal(String group, String tokenId) implements Principal {

  @Override
  public String getName() {
    return group;
  }
}
