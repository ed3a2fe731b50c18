package ca.gc.cra.relay.validation;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Validation of broker endpoint lists such as {@code kafka-1:9092,kafka-2:9092}.
 */
public final class Net {
  private static final int MAX_HOSTNAME_LENGTH = 253;
  private static final Pattern HOSTNAME_PATTERN =
      Pattern.compile("^[A-Za-z0-9](?:[A-Za-z0-9-]{0,61}[A-Za-z0-9])?(?:\\.[A-Za-z0-9](?:[A-Za-z0-9-]{0,61}[A-Za-z0-9])?)*$");
  private static final Pattern IPV6_PATTERN = Pattern.compile("^[0-9A-Fa-f:.]+$");

  private Net() {
    // Utility
  }

  /**
   * Validates a comma-separated list of {@code host:port} endpoints.
   *
   * @param value endpoint list
   * @return normalized list joined with commas and no whitespace
   * @throws IllegalArgumentException if any endpoint is malformed
   */
  public static String validateBootstrap(String value) {
    String sanitized = Strings.requireNonBlank("kafkaBootstrap", value);
    List<String> endpoints = new ArrayList<>();
    for (String token : sanitized.split(",")) {
      if (token.isBlank()) {
        throw new IllegalArgumentException("kafkaBootstrap contains an empty endpoint");
      }
      endpoints.add(validateHostPort(token));
    }
    return String.join(",", endpoints);
  }

  /** Validates a single {@code host:port} string supporting hostnames, IPv4, and bracketed IPv6. */
  public static String validateHostPort(String value) {
    String sanitized = Strings.requireNonBlank("host:port", value);
    String host;
    String portPart;
    if (sanitized.startsWith("[")) {
      int idx = sanitized.indexOf(']');
      if (idx < 0 || idx + 2 > sanitized.length() || sanitized.charAt(idx + 1) != ':') {
        throw new IllegalArgumentException("host:port must use [IPv6]:PORT format (was " + sanitized + ")");
      }
      host = sanitized.substring(1, idx);
      portPart = sanitized.substring(idx + 2);
      if (host.isEmpty() || !IPV6_PATTERN.matcher(host).matches()) {
        throw new IllegalArgumentException("Invalid IPv6 literal: " + host);
      }
      host = '[' + host + ']';
    } else {
      int lastColon = sanitized.lastIndexOf(':');
      if (lastColon <= 0 || lastColon == sanitized.length() - 1) {
        throw new IllegalArgumentException("host:port must use HOST:PORT format (was " + sanitized + ")");
      }
      host = sanitized.substring(0, lastColon);
      portPart = sanitized.substring(lastColon + 1);
      if (host.length() > MAX_HOSTNAME_LENGTH || !HOSTNAME_PATTERN.matcher(host).matches()) {
        throw new IllegalArgumentException("Invalid host: " + host);
      }
    }
    int port;
    try {
      port = Integer.parseInt(portPart);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("port must be numeric (was " + portPart + ")", ex);
    }
    Numbers.requireRange("port", port, 1, 65535);
    return host + ':' + port;
  }
}
