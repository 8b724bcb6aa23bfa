package datadog.sql.cli;

import static java.nio.charset.StandardCharsets.UTF_8;

import datadog.sql.SqlSanitizer;
import de.thetaphi.forbiddenapis.SuppressForbidden;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Prints the sanitized SQL of the files given as arguments. */
public final class SqlSanitizerCli {
  private static final Logger log = LoggerFactory.getLogger(SqlSanitizerCli.class);

  static final int SUCCESS = 0;
  static final int READ_FAILURE = 1;
  static final int USAGE_FAILURE = 2;

  static final String USAGE = "Usage: sql-sanitizer <file>...";

  private SqlSanitizerCli() {}

  @SuppressForbidden
  public static void main(String[] args) {
    System.exit(run(args, System.out, System.err));
  }

  /**
   * Sanitizes each file and prints the result.
   *
   * @param args The paths of the files holding SQL.
   * @param out The stream to print the sanitized SQL to.
   * @param err The stream to print the usage to.
   * @return The exit status.
   */
  static int run(String[] args, PrintStream out, PrintStream err) {
    if (args == null || args.length == 0) {
      err.println(USAGE);
      return USAGE_FAILURE;
    }
    int status = SUCCESS;
    for (String arg : args) {
      Path path = Paths.get(arg);
      String sql;
      try {
        sql = new String(Files.readAllBytes(path), UTF_8);
      } catch (IOException e) {
        log.error("Failed to read SQL from {}", path, e);
        status = READ_FAILURE;
        continue;
      }
      log.debug("Sanitizing {} ({} characters)", path, sql.length());
      out.println(SqlSanitizer.sanitizeText(sql));
    }
    return status;
  }
}
