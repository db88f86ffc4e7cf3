package io.github.wphillipmoore.nd.api.gui.auth;

import java.util.Map;
import java.util.Objects;

/**
 * Controller address and login credentials.
 *
 * <p>If both {@code ip4} and {@code ip6} are set, {@code ip4} is used. Empty strings mean "not
 * set". Instances are immutable; use the {@code with*} methods to override individual values, for
 * example after {@link #fromEnvironment(Map)}.
 *
 * @param ip4 IPv4 address (or host name) of the controller
 * @param ip6 IPv6 address of the controller
 * @param username login user name
 * @param password login password
 * @param domain authentication domain
 */
public record ControllerCredentials(
    String ip4, String ip6, String username, String password, String domain) {

  public static final String ENV_IP4 = "ND_IP4";
  public static final String ENV_IP6 = "ND_IP6";
  public static final String ENV_USERNAME = "ND_USERNAME";
  public static final String ENV_PASSWORD = "ND_PASSWORD";
  public static final String ENV_DOMAIN = "ND_DOMAIN";

  /** Default login user name. */
  public static final String DEFAULT_USERNAME = "admin";

  /** Default authentication domain. */
  public static final String DEFAULT_DOMAIN = "local";

  /** Validates that all fields are non-null. */
  public ControllerCredentials {
    Objects.requireNonNull(ip4, "ip4");
    Objects.requireNonNull(ip6, "ip6");
    Objects.requireNonNull(username, "username");
    Objects.requireNonNull(password, "password");
    Objects.requireNonNull(domain, "domain");
  }

  /**
   * Reads credentials from {@code ND_IP4}, {@code ND_IP6}, {@code ND_USERNAME}, {@code
   * ND_PASSWORD} and {@code ND_DOMAIN}. User name defaults to {@code admin} and domain to {@code
   * local}.
   *
   * @param environment the environment, typically {@link System#getenv()}
   * @return the credentials
   */
  public static ControllerCredentials fromEnvironment(Map<String, String> environment) {
    return new ControllerCredentials(
        environment.getOrDefault(ENV_IP4, ""),
        environment.getOrDefault(ENV_IP6, ""),
        environment.getOrDefault(ENV_USERNAME, DEFAULT_USERNAME),
        environment.getOrDefault(ENV_PASSWORD, ""),
        environment.getOrDefault(ENV_DOMAIN, DEFAULT_DOMAIN));
  }

  /** Returns the controller address to use: {@code ip4} if set, else {@code ip6}, else empty. */
  public String host() {
    if (!ip4.isBlank()) {
      return ip4.strip();
    }
    return ip6.strip();
  }

  /**
   * Returns the host in URL authority form. IPv6 literals are wrapped in brackets.
   *
   * @return the authority, or an empty string if no host is set
   */
  public String urlHost() {
    String host = host();
    if (host.indexOf(':') >= 0 && !host.startsWith("[")) {
      return "[" + host + "]";
    }
    return host;
  }

  public ControllerCredentials withIp4(String value) {
    return new ControllerCredentials(value, ip6, username, password, domain);
  }

  public ControllerCredentials withIp6(String value) {
    return new ControllerCredentials(ip4, value, username, password, domain);
  }

  public ControllerCredentials withUsername(String value) {
    return new ControllerCredentials(ip4, ip6, value, password, domain);
  }

  public ControllerCredentials withPassword(String value) {
    return new ControllerCredentials(ip4, ip6, username, value, domain);
  }

  public ControllerCredentials withDomain(String value) {
    return new ControllerCredentials(ip4, ip6, username, password, value);
  }

  /** Masks the password so credentials can be logged. */
  @Override
  public String toString() {
    return "ControllerCredentials[ip4="
        + ip4
        + ", ip6="
        + ip6
        + ", username="
        + username
        + ", password=********, domain="
        + domain
        + "]";
  }
}
