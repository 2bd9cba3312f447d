package com.zenlib.util;

import java.text.NumberFormat;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.apache.commons.text.StringEscapeUtils;

/**
 * Utilities for formatting values as strings.
 */
public class Format {

  public static final Locale DEFAULT_LOCALE = Locale.getDefault(Locale.Category.FORMAT);

  private static final ConcurrentMap<Locale, Format> instances = new ConcurrentHashMap<>();
  private static final NavigableMap<Long, String> STORAGE_SUFFIXES = new TreeMap<>(Map.ofEntries(
    Map.entry(1_024L, "k"),
    Map.entry(1_024L * 1_024, "M"),
    Map.entry(1_024L * 1_024 * 1_024, "G"),
    Map.entry(1_024L * 1_024 * 1_024 * 1_024, "T")
  ));
  private static final NavigableMap<Long, String> NUMERIC_SUFFIXES = new TreeMap<>(Map.ofEntries(
    Map.entry(1_000L, "k"),
    Map.entry(1_000_000L, "M"),
    Map.entry(1_000_000_000L, "B"),
    Map.entry(1_000_000_000_000L, "T")
  ));

  // NumberFormat instances are not thread safe
  @SuppressWarnings("java:S5164")
  private final ThreadLocal<NumberFormat> nf;

  private Format(Locale locale) {
    nf = ThreadLocal.withInitial(() -> {
      var f = NumberFormat.getNumberInstance(locale);
      f.setMaximumFractionDigits(1);
      return f;
    });
  }

  public static Format forLocale(Locale locale) {
    return instances.computeIfAbsent(locale, Format::new);
  }

  public static Format defaultInstance() {
    return forLocale(DEFAULT_LOCALE);
  }

  /** Returns Java code that can re-create {@code string}: {@code null} if null, or {@code "contents"} if not. */
  public static String quote(Object string) {
    if (string == null) {
      return "null";
    }
    return '"' + StringEscapeUtils.escapeJava(string.toString()) + '"';
  }

  /** Returns a number of bytes formatted like "123" "1.2k" "256M", using binary multiples. */
  public String storage(Number num) {
    return format(num, STORAGE_SUFFIXES);
  }

  /** Returns a number formatted like "123" "1.2k" "2.5B", etc. */
  public String numeric(Number num) {
    return format(num, NUMERIC_SUFFIXES);
  }

  private String format(Number num, NavigableMap<Long, String> suffixes) {
    long value = num.longValue();
    if (value < 0) {
      return "-";
    }
    Map.Entry<Long, String> e = suffixes.floorEntry(value);
    if (e == null) {
      return Long.toString(value);
    }
    double scaled = value * 1d / e.getKey();
    return (scaled < 10 ? decimal(scaled) : Long.toString(Math.round(scaled))) + e.getValue();
  }

  /** Returns a number formatted with 1 decimal point. */
  public String decimal(double value) {
    return nf.get().format(value);
  }

  /** Returns a duration formatted like "1h2m", "2m3s" or "0.4s". */
  public String duration(Duration duration) {
    double seconds = duration.toNanos() * 1d / Duration.ofSeconds(1).toNanos();
    if (seconds < 1) {
      return decimal(seconds) + "s";
    }
    return Duration.ofSeconds(Math.round(seconds)).toString().replace("PT", "").toLowerCase(Locale.ROOT);
  }
}
