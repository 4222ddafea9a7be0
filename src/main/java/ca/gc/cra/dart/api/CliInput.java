package ca.gc.cra.dart.api;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Command-line arguments split into normalized flags and the remaining {@code key=value} or positional tokens.
 *
 * <p>Aliases collapse onto one canonical flag: {@code -h} and {@code help} become {@code --help}, {@code -v} and
 * {@code --debug} become {@code --verbose}, {@code -n} becomes {@code --dry-run}.</p>
 */
public final class CliInput {
  private static final Map<String, String> ALIASES = Map.of(
      "-h", "--help",
      "help", "--help",
      "--help", "--help",
      "-v", "--verbose",
      "--debug", "--verbose",
      "--verbose", "--verbose",
      "-n", "--dry-run");

  private final String[] remaining;
  private final Set<String> flags;

  private CliInput(String[] remaining, Set<String> flags) {
    this.remaining = remaining;
    this.flags = flags;
  }

  /**
   * Parses raw arguments.
   *
   * @param args raw CLI arguments; {@code null} or blank entries are ignored
   * @return parsed arguments
   */
  public static CliInput parse(String[] args) {
    if (args == null || args.length == 0) {
      return new CliInput(new String[0], Set.of());
    }
    List<String> rest = new ArrayList<>();
    Set<String> flags = new LinkedHashSet<>();
    for (String raw : args) {
      if (raw == null || raw.isBlank()) {
        continue;
      }
      String arg = raw.trim();
      String lower = arg.toLowerCase(Locale.ROOT);
      String canonical = ALIASES.get(lower);
      if (canonical != null) {
        flags.add(canonical);
      } else if (arg.startsWith("-") && !arg.contains("=")) {
        flags.add(lower);
      } else {
        rest.add(arg);
      }
    }
    return new CliInput(rest.toArray(String[]::new), Set.copyOf(flags));
  }

  /**
   * Returns a copy of the non-flag arguments in command-line order.
   *
   * @return key/value and positional arguments
   */
  public String[] keyValueArgs() {
    return Arrays.copyOf(remaining, remaining.length);
  }

  /**
   * Whether help was requested.
   *
   * @return {@code true} for {@code --help} or an alias
   */
  public boolean help() {
    return flags.contains("--help");
  }

  /**
   * Whether DEBUG logging was requested.
   *
   * @return {@code true} for {@code --verbose} or an alias
   */
  public boolean verbose() {
    return flags.contains("--verbose");
  }

  /**
   * Checks whether a flag such as {@code --dry-run} was given.
   *
   * @param flag flag to query (case-insensitive)
   * @return {@code true} if present
   */
  public boolean hasFlag(String flag) {
    if (flag == null || flag.isBlank()) {
      return false;
    }
    return flags.contains(flag.trim().toLowerCase(Locale.ROOT));
  }

  /**
   * Returns flags not present in {@code supported}, in command-line order.
   *
   * @param supported canonical flags the command understands
   * @return unsupported flags; empty when all are known
   */
  public List<String> unsupportedFlags(Set<String> supported) {
    List<String> unknown = new ArrayList<>();
    for (String flag : flags) {
      if (!supported.contains(flag)) {
        unknown.add(flag);
      }
    }
    return unknown;
  }
}
