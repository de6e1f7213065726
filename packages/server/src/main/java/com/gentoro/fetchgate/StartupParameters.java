package com.gentoro.fetchgate;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Command line parameters in the {@code --name value} or {@code --name=value} form. A bare {@code
 * --flag} is recorded as {@code "true"}.
 */
public final class StartupParameters {
  static final String DEFAULT_CONFIG = "classpath:application.yaml";

  private final Map<String, String> values = new HashMap<>();

  public StartupParameters(String[] args) {
    if (args == null) return;
    for (int i = 0; i < args.length; i++) {
      String arg = args[i];
      if (arg == null || !arg.startsWith("--") || arg.length() == 2) {
        throw new IllegalArgumentException("Unrecognized argument: " + arg);
      }
      String body = arg.substring(2);
      int eq = body.indexOf('=');
      if (eq > 0) {
        values.put(body.substring(0, eq), body.substring(eq + 1));
      } else if (i + 1 < args.length && !args[i + 1].startsWith("--")) {
        values.put(body, args[++i]);
      } else {
        values.put(body, "true");
      }
    }
  }

  public String getParameter(String name, String defaultValue) {
    return values.getOrDefault(name, defaultValue);
  }

  public <T> T getParameter(String name, Class<T> type) {
    String raw = values.get(name);
    if (raw == null) return null;
    if (type == String.class) return type.cast(raw);
    if (type == Integer.class) return type.cast(Integer.valueOf(raw));
    if (type == Boolean.class) return type.cast(Boolean.valueOf(raw));
    throw new IllegalArgumentException("Unsupported parameter type: " + type.getName());
  }

  /** Location of the YAML configuration: a file path or a {@code classpath:} resource. */
  public String configFile() {
    return Objects.requireNonNullElse(values.get("config"), DEFAULT_CONFIG);
  }
}
