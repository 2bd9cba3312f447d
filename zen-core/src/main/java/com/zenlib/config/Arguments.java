package com.zenlib.config;

import com.google.common.collect.HashMultiset;
import com.google.common.collect.Multiset;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;
import java.util.regex.Pattern;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Key/value settings read from command-line arguments, JVM properties, environmental variables or a properties file.
 * <p>
 * Lookups are case and separator insensitive, so {@code "SIMPLIFY_STACK_SIZE"} matches {@code "simplify.stack-size"}
 * and {@code "simplify_stack_size"}.
 * <p>
 * A renamed setting can be read with {@code "new_name|old_name"}, which falls back to the old name and warns that it
 * is deprecated.
 */
public class Arguments {

  private static final Logger LOGGER = LoggerFactory.getLogger(Arguments.class);

  private final UnaryOperator<String> provider;
  private final Supplier<? extends Collection<String>> keys;
  private boolean silent = false;

  private Arguments(UnaryOperator<String> provider, Supplier<? extends Collection<String>> keys) {
    this.provider = provider;
    this.keys = keys;
  }

  /**
   * Returns arguments from JVM system properties prefixed with {@code zen.}
   * <p>
   * For example to set {@code simplify.large-stack=true}: {@code java -Dzen.simplify.large.stack=true ...}
   */
  public static Arguments fromJvmProperties() {
    return fromJvmProperties(
      System::getProperty,
      () -> System.getProperties().stringPropertyNames()
    );
  }

  static Arguments fromJvmProperties(UnaryOperator<String> getter, Supplier<? extends Collection<String>> keys) {
    return fromPrefixed(getter, keys, "zen", ".", false);
  }

  /**
   * Returns arguments parsed from environmental variables prefixed with {@code ZEN_}
   * <p>
   * For example to set {@code simplify.large-stack=true}: {@code ZEN_SIMPLIFY_LARGE_STACK=true java ...}
   */
  public static Arguments fromEnvironment() {
    return fromEnvironment(
      System::getenv,
      () -> System.getenv().keySet()
    );
  }

  static Arguments fromEnvironment(UnaryOperator<String> getter, Supplier<Set<String>> keys) {
    return fromPrefixed(getter, keys, "ZEN", "_", true);
  }

  /** Returns arguments parsed from a {@link Properties} object, matching keys like {@link #of(Map)} does. */
  public static Arguments from(Properties properties) {
    Map<String, String> map = new LinkedHashMap<>();
    for (String key : properties.stringPropertyNames()) {
      map.put(key, properties.getProperty(key));
    }
    return of(map);
  }

  /**
   * Returns arguments parsed from command-line arguments: {@code key=value}, {@code --key value} or {@code --key} for
   * {@code key=true}.
   */
  public static Arguments fromArgs(String... args) {
    Map<String, String> parsed = new HashMap<>();
    for (int i = 0; i < args.length; i++) {
      String arg = args[i].strip();
      String[] kv = arg.split("=", 2);
      String key = kv[0].replaceAll("^[\\s-]+", "");
      if (kv.length == 2) {
        parsed.put(key, kv[1]);
      } else if (arg.startsWith("-") && i < args.length - 1 && !args[i + 1].strip().startsWith("-")) {
        parsed.put(key, args[++i].strip());
      } else {
        parsed.put(key, "true");
      }
    }
    return of(parsed);
  }

  /**
   * Returns arguments provided from a properties file.
   *
   * @throws IllegalArgumentException if the file can not be read
   */
  public static Arguments fromConfigFile(Path path) {
    Properties properties = new Properties();
    try (var reader = Files.newBufferedReader(path)) {
      properties.load(reader);
      return from(properties);
    } catch (IOException e) {
      throw new IllegalArgumentException("Unable to load config file: " + path, e);
    }
  }

  /**
   * Returns arguments parsed from command-line arguments, then JVM properties, then environmental variables, then a
   * properties file named by the {@code config} argument when one is set.
   */
  public static Arguments fromArgsOrConfigFile(String... args) {
    Arguments fromArgsOrEnv = fromArgs(args)
      .orElse(fromJvmProperties())
      .orElse(fromEnvironment());
    String configFile = fromArgsOrEnv.getArg("config");
    if (configFile != null) {
      return fromArgsOrEnv.orElse(fromConfigFile(Path.of(configFile)));
    } else {
      return fromArgsOrEnv;
    }
  }

  private static String normalize(String key, String separator, boolean upperCase) {
    String result = key.replaceAll("[._-]", separator);
    return upperCase ? result.toUpperCase(Locale.ROOT) : result.toLowerCase(Locale.ROOT);
  }

  private static String normalize(String key) {
    return normalize(key, "_", false);
  }

  public static Arguments of(Map<String, String> map) {
    Map<String, String> updated = new LinkedHashMap<>();
    for (var entry : map.entrySet()) {
      updated.put(normalize(entry.getKey()), entry.getValue());
    }
    return new Arguments(updated::get, updated::keySet);
  }

  /** Shorthand for {@link #of(Map)} which constructs the map from a list of key/value pairs. */
  public static Arguments of(Object... args) {
    Map<String, String> map = new TreeMap<>();
    for (int i = 0; i < args.length; i += 2) {
      map.put(args[i].toString(), args[i + 1].toString());
    }
    return of(map);
  }

  private static Arguments fromPrefixed(UnaryOperator<String> provider, Supplier<? extends Collection<String>> keys,
    String prefix, String separator, boolean upperCase) {
    var prefixRegex = Pattern.compile("^" + Pattern.quote(normalize(prefix + separator, separator, upperCase)),
      Pattern.CASE_INSENSITIVE);
    Supplier<List<String>> unprefixed = () -> keys.get().stream()
      .filter(key -> prefixRegex.matcher(key).find())
      .map(key -> normalize(prefixRegex.matcher(key).replaceFirst("")))
      .toList();
    return new Arguments(key -> provider.apply(normalize(prefix + separator + key, separator, upperCase)), unprefixed);
  }

  private String get(String key) {
    String[] options = key.split("\\|");
    String value = null;
    for (int i = 0; i < options.length; i++) {
      String option = options[i].strip();
      value = provider.apply(normalize(option));
      if (value != null) {
        if (i != 0) {
          LOGGER.warn("Argument '{}' is deprecated", option);
        }
        break;
      }
    }
    return value;
  }

  /**
   * Chain two argument providers so that {@code other} is used as a fallback to {@code this}.
   *
   * @param other another arguments provider
   * @return arguments instance that checks {@code this} first and if a match is not found then {@code other}
   */
  public Arguments orElse(Arguments other) {
    var result = new Arguments(
      key -> {
        String ourResult = get(key);
        return ourResult != null ? ourResult : other.get(key);
      },
      () -> Stream.concat(
        other.keys.get().stream(),
        keys.get().stream()
      ).distinct().toList()
    );
    if (silent) {
      result.silence();
    }
    return result;
  }

  /** Returns a new arguments instance where the value for {@code key} defaults to {@code value}. */
  public Arguments withDefault(Object key, Object value) {
    return orElse(Arguments.of(key.toString().replaceFirst("^-*", ""), value));
  }

  String getArg(String key) {
    String value = get(key);
    return value == null ? null : value.trim();
  }

  String getArg(String key, String defaultValue) {
    String value = getArg(key);
    return value == null ? defaultValue : value;
  }

  protected void logArgValue(String key, String description, Object result) {
    if (!silent && LOGGER.isDebugEnabled()) {
      LOGGER.debug("argument: {}={} ({})", key.replaceFirst("\\|.*$", ""), result, description);
    }
  }

  /** Stop logging argument values when they are read and return this instance. */
  public Arguments silence() {
    this.silent = true;
    return this;
  }

  public String getString(String key, String description, String defaultValue) {
    String value = getArg(key, defaultValue);
    logArgValue(key, description, value);
    return value;
  }

  /** Returns a boolean parsed from {@code key} argument where {@code "true"} is true and anything else is false. */
  public boolean getBoolean(String key, String description, boolean defaultValue) {
    boolean value = "true".equalsIgnoreCase(getArg(key, Boolean.toString(defaultValue)));
    logArgValue(key, description, value);
    return value;
  }

  /**
   * Returns an argument as integer.
   *
   * @throws NumberFormatException if the argument cannot be parsed as an integer
   */
  public int getInteger(String key, String description, int defaultValue) {
    String value = getArg(key, Integer.toString(defaultValue));
    int parsed = Integer.parseInt(value);
    logArgValue(key, description, parsed);
    return parsed;
  }

  /**
   * Returns an argument as long.
   *
   * @throws NumberFormatException if the argument cannot be parsed as a long
   */
  public long getLong(String key, String description, long defaultValue) {
    String value = getArg(key, Long.toString(defaultValue));
    long parsed = Long.parseLong(value);
    logArgValue(key, description, parsed);
    return parsed;
  }

  /**
   * Returns a number of bytes written like a JVM memory setting: {@code 1048576}, {@code 512k}, {@code 256m} or
   * {@code 1g}.
   *
   * @throws IllegalArgumentException if the argument cannot be parsed as a size
   */
  public long getByteSize(String key, String description, String defaultValue) {
    String value = getArg(key, defaultValue);
    long parsed = parseByteSize(value);
    logArgValue(key, description, parsed);
    return parsed;
  }

  static long parseByteSize(String value) {
    try {
      value = value.strip();
      char lastChar = value.charAt(value.length() - 1);
      if (Character.isDigit(lastChar)) {
        return Long.parseLong(value);
      }
      long base = Long.parseLong(value.substring(0, value.length() - 1));
      return switch (Character.toLowerCase(lastChar)) {
        case 'k' -> base * 1024L;
        case 'm' -> base * 1024L * 1024L;
        case 'g' -> base * 1024L * 1024L * 1024L;
        default -> throw new NumberFormatException();
      };
    } catch (NumberFormatException | StringIndexOutOfBoundsException e) {
      throw new IllegalArgumentException("Unable to parse size: " + value, e);
    }
  }

  /** Returns a map from all the arguments provided to their values. */
  public Map<String, String> toMap() {
    Map<String, String> result = new HashMap<>();
    for (var key : keys.get()) {
      result.put(normalize(key), get(key));
    }
    return result;
  }

  /** Returns a copy of this {@code Arguments} instance that logs each extracted argument value exactly once. */
  public Arguments withExactlyOnceLogging() {
    Multiset<String> logged = HashMultiset.create();
    return new Arguments(this.provider, this.keys) {
      @Override
      protected void logArgValue(String key, String description, Object result) {
        if (logged.add(key, 1) == 0) {
          super.logArgValue(key, description, result);
        }
      }
    };
  }
}
