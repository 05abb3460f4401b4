package io.sketchlab.tools;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls the first IPv4-looking token out of each line of a log file.
 *
 * <p>Octets are not range checked, {@code 999.1.1.1} matches too.
 */
public final class LogAddressExtractor
{
  private static final Logger LOG = LoggerFactory.getLogger(LogAddressExtractor.class);

  private static final Pattern ADDRESS_PATTERN = Pattern.compile("(?:\\d{1,3}\\.){3}\\d{1,3}");

  private LogAddressExtractor()
  {
  }

  public static Optional<String> extract(String line)
  {
    Matcher matcher = ADDRESS_PATTERN.matcher(line);
    return matcher.find() ? Optional.of(matcher.group()) : Optional.empty();
  }

  /**
   * @return addresses in file order, duplicates kept
   */
  public static List<String> load(Path logFile) throws IOException
  {
    List<String> addresses = new ArrayList<>();
    long lines = 0;
    try (BufferedReader reader = Files.newBufferedReader(logFile, StandardCharsets.UTF_8)) {
      String line;
      while ((line = reader.readLine()) != null) {
        lines++;
        extract(line).ifPresent(addresses::add);
      }
    }
    LOG.info("Read {} lines from {}, {} without an address", lines, logFile, lines - addresses.size());
    return addresses;
  }
}
