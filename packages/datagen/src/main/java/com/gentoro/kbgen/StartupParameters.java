package com.gentoro.kbgen;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Command line flags, given as {@code --name value} pairs:
 *
 * <ul>
 *   <li>{@code --mode generate|render|help} (default {@code generate})
 *   <li>{@code --config-file} configuration location (default {@code classpath:application.yaml})
 *   <li>{@code --scenario} run only the named scenario
 *   <li>{@code --graph-file} graph JSON used by {@code render} mode
 *   <li>{@code --output-dir} overrides {@code output.base-dir}
 * </ul>
 */
public class StartupParameters {
  public static final Set<String> MODES = Set.of("generate", "render", "help");

  final Map<String, Object> parameters = new HashMap<>();

  {
    parameters.put("config-file", ConfigurationProvider.DEFAULT_LOCATION);
    parameters.put("mode", "generate");
  }

  public StartupParameters(String[] arguments) {
    this.parameters.putAll(parseArguments(arguments));
    this.validate();
  }

  private Map<String, Object> parseArguments(String[] arguments) {
    Map<String, Object> result = new HashMap<>();
    for (int p = 0; p < arguments.length; p++) {
      if (!arguments[p].startsWith("--")) {
        continue;
      }
      String paramName = arguments[p].substring(2);
      String paramValue = null;
      if (p < arguments.length - 1 && !arguments[p + 1].startsWith("--")) {
        paramValue = arguments[p + 1];
        p++;
      }
      result.put(paramName, paramValue);
    }
    return result;
  }

  private void validate() {
    Object mode = parameters.get("mode");
    if (mode == null || !MODES.contains(mode.toString())) {
      throw new IllegalArgumentException(
          "Invalid mode: " + mode + " (expected one of " + MODES + ")");
    }
    if (parameters.get("config-file") == null
        || parameters.get("config-file").toString().isBlank()) {
      throw new IllegalArgumentException("Missing config file location");
    }
    if ("render".equals(mode) && getOptionalParameter("graph-file", String.class).isEmpty()) {
      throw new IllegalArgumentException("Mode render requires --graph-file");
    }
  }

  public String mode() {
    return getParameter("mode", String.class);
  }

  public String configFile() {
    return getOptionalParameter("config-file", String.class)
        .orElse(ConfigurationProvider.DEFAULT_LOCATION);
  }

  public <T> T getParameter(String name, Class<T> type) {
    return type.cast(parameters.get(name));
  }

  public <T> Optional<T> getOptionalParameter(String name, Class<T> type) {
    return Optional.ofNullable(type.cast(parameters.get(name)));
  }

  public boolean isParameterPresent(String name) {
    return parameters.containsKey(name);
  }
}
