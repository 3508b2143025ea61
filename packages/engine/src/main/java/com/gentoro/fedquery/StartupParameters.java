package com.gentoro.fedquery;

import com.gentoro.fedquery.exception.ConfigurationException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Command-line arguments in {@code --name value} or {@code --name=value} form. A flag without a
 * value is recorded as {@code "true"}.
 */
public class StartupParameters {
  private final Map<String, String> parameters = new LinkedHashMap<>();

  public StartupParameters(String[] args) {
    if (args == null) {
      return;
    }
    for (int i = 0; i < args.length; i++) {
      String arg = args[i];
      if (!arg.startsWith("--") || arg.length() == 2) {
        throw new ConfigurationException("Unexpected argument: " + arg);
      }
      String name = arg.substring(2);
      String value;
      int eq = name.indexOf('=');
      if (eq >= 0) {
        value = name.substring(eq + 1);
        name = name.substring(0, eq);
      } else if (i + 1 < args.length && !args[i + 1].startsWith("--")) {
        value = args[++i];
      } else {
        value = "true";
      }
      parameters.put(name, value);
    }
  }

  public boolean hasParameter(String name) {
    return parameters.containsKey(name);
  }

  /** Typed lookup; supports String, Integer, Long and Boolean. Returns null when absent. */
  public <T> T getParameter(String name, Class<T> type) {
    String raw = parameters.get(name);
    if (raw == null) {
      return null;
    }
    try {
      if (type == String.class) {
        return type.cast(raw);
      } else if (type == Integer.class) {
        return type.cast(Integer.valueOf(raw));
      } else if (type == Long.class) {
        return type.cast(Long.valueOf(raw));
      } else if (type == Boolean.class) {
        return type.cast(Boolean.valueOf(raw));
      }
    } catch (NumberFormatException e) {
      throw new ConfigurationException(
          "Parameter --" + name + " expects a " + type.getSimpleName() + ", got '" + raw + "'", e);
    }
    throw new IllegalArgumentException("Unsupported parameter type " + type.getName());
  }

  public String configFile() {
    return getParameter("config", String.class);
  }

  public String planFile() {
    return getParameter("plan", String.class);
  }

  public Map<String, String> asMap() {
    return Collections.unmodifiableMap(parameters);
  }
}
