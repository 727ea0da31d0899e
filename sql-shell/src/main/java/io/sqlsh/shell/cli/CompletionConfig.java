package io.sqlsh.shell.cli;

import io.sqlsh.shell.core.completion.Catalog;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Properties;

/**
 * Completion settings. Loads from {@code ~/.sqlsh/completion.properties} by default.
 *
 * @param smartCompletion classify the cursor position instead of matching the whole vocabulary
 * @param keywords extra keywords added to every session's catalog
 * @param specialCommands meta-commands offered at the start of a line
 */
public record CompletionConfig(
    boolean smartCompletion, List<String> keywords, List<String> specialCommands) {

  public CompletionConfig {
    keywords = keywords == null ? List.of() : List.copyOf(keywords);
    specialCommands = specialCommands == null ? List.of() : List.copyOf(specialCommands);
  }

  /** Smart completion on, no extra vocabulary. */
  public static CompletionConfig defaults() {
    return new CompletionConfig(true, List.of(), List.of());
  }

  /**
   * Loads configuration from the default location.
   *
   * @return loaded configuration, or defaults if the file doesn't exist
   * @throws IOException if the file exists but cannot be read
   */
  public static CompletionConfig load() throws IOException {
    return load(getConfigPath());
  }

  /**
   * Loads configuration from {@code configPath}.
   *
   * @return loaded configuration, or defaults if the file doesn't exist
   * @throws IOException if the file exists but cannot be read
   */
  public static CompletionConfig load(Path configPath) throws IOException {
    if (!Files.exists(configPath)) {
      return defaults();
    }
    Properties props = new Properties();
    try (var reader = Files.newBufferedReader(configPath)) {
      props.load(reader);
    }
    return fromProperties(props);
  }

  /** Gets the default configuration file path. */
  public static Path getConfigPath() {
    String home = System.getProperty("user.home");
    return Path.of(home, ".sqlsh", "completion.properties");
  }

  /**
   * Creates configuration from properties. Lists are comma separated.
   *
   * @param props properties with keys {@code smartCompletion}, {@code keywords}, {@code
   *     specialCommands}
   */
  public static CompletionConfig fromProperties(Properties props) {
    boolean smart = Boolean.parseBoolean(props.getProperty("smartCompletion", "true"));
    List<String> keywords = parseList(props.getProperty("keywords", ""));
    List<String> specials = parseList(props.getProperty("specialCommands", ""));
    return new CompletionConfig(smart, keywords, specials);
  }

  /** Adds the configured keywords and special commands to {@code catalog}. */
  public void applyTo(Catalog catalog) {
    catalog.extendKeywords(keywords);
    catalog.extendSpecialCommands(specialCommands);
  }

  private static List<String> parseList(String value) {
    return Arrays.stream(value.split(","))
        .map(String::trim)
        .filter(s -> !s.isEmpty())
        .toList();
  }
}
