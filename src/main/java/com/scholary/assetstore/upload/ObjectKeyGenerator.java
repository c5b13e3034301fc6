package com.scholary.assetstore.upload;

import java.time.Clock;
import java.util.Locale;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * Generates object keys of the form {@code {prefix}/{epochMillis}-{uuid}.{extension}}.
 *
 * <p>The random UUID makes collisions negligible without any coordination between instances; the
 * timestamp keeps keys roughly ordered by upload time.
 */
public class ObjectKeyGenerator {

  private static final Pattern EXTENSION = Pattern.compile("[a-z0-9]{1,10}");

  private final String prefix;
  private final Clock clock;
  private final Supplier<UUID> idSupplier;

  public ObjectKeyGenerator(String prefix) {
    this(prefix, Clock.systemUTC(), UUID::randomUUID);
  }

  public ObjectKeyGenerator(String prefix, Clock clock, Supplier<UUID> idSupplier) {
    this.prefix = stripSlashes(prefix);
    this.clock = clock;
    this.idSupplier = idSupplier;
  }

  public String generate(String originalName) {
    String base = prefix + "/" + clock.millis() + "-" + idSupplier.get();
    String extension = extensionOf(originalName);
    return extension.isEmpty() ? base : base + "." + extension;
  }

  /**
   * Lower-cased text after the last dot of the filename, or empty if there is none or it is not a
   * plain alphanumeric extension.
   */
  static String extensionOf(String originalName) {
    if (originalName == null) {
      return "";
    }
    int lastDot = originalName.lastIndexOf('.');
    if (lastDot < 0 || lastDot == originalName.length() - 1) {
      return "";
    }
    String extension = originalName.substring(lastDot + 1).toLowerCase(Locale.ROOT);
    return EXTENSION.matcher(extension).matches() ? extension : "";
  }

  private static String stripSlashes(String value) {
    String result = value;
    while (result.startsWith("/")) {
      result = result.substring(1);
    }
    while (result.endsWith("/")) {
      result = result.substring(0, result.length() - 1);
    }
    return result;
  }
}
