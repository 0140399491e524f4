package com.gentoro.onesync;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Command-line options of the form {@code --name value}. Known options are {@code --config-file}
 * and {@code --mode}; an option directly followed by another option has no value. A bare
 * {@code --help} selects help mode.
 */
public class StartupParameters {
  public static final String MODE_SYNC = "sync";
  public static final String MODE_WATCH = "watch";
  public static final String MODE_REPORT = "report";
  public static final String MODE_HELP = "help";

  static final String CONFIG_FILE = "config-file";
  static final String MODE = "mode";

  private static final List<String> MODES = List.of(MODE_SYNC, MODE_WATCH, MODE_REPORT, MODE_HELP);

  private final Map<String, String> parameters = new HashMap<>();

  public StartupParameters(String[] arguments) {
    parameters.put(CONFIG_FILE, ConfigurationProvider.DEFAULT_LOCATION);
    parameters.put(MODE, MODE_SYNC);

    int p = 0;
    while (p < arguments.length) {
      String argument = arguments[p++];
      if (!argument.startsWith("--")) continue;

      String name = argument.substring(2);
      String value = p < arguments.length && !arguments[p].startsWith("--") ? arguments[p++] : null;
      if (MODE_HELP.equals(name) && value == null) {
        parameters.put(MODE, MODE_HELP);
      } else {
        parameters.put(name, value);
      }
    }

    String mode = parameters.get(MODE);
    if (mode == null || !MODES.contains(mode)) {
      throw new IllegalArgumentException("Invalid mode: " + mode);
    }
    String configFile = parameters.get(CONFIG_FILE);
    if (configFile == null || configFile.isBlank()) {
      throw new IllegalArgumentException("Missing config file location");
    }
  }

  /** Configuration location: {@code classpath:application.yaml}, a file URI or a path. */
  public String configFile() {
    return parameters.get(CONFIG_FILE);
  }

  public String mode() {
    return parameters.get(MODE);
  }

  public String getParameter(String name) {
    return parameters.get(name);
  }

  public Optional<String> getOptionalParameter(String name) {
    return Optional.ofNullable(parameters.get(name));
  }

  public boolean isParameterPresent(String name) {
    return parameters.containsKey(name);
  }
}
