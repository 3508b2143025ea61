package com.gentoro.fedquery;

import com.gentoro.fedquery.engine.PlanResult;
import com.gentoro.fedquery.exception.ConfigurationException;
import com.gentoro.fedquery.logging.LoggingService;
import com.gentoro.fedquery.utility.JacksonUtility;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;

/** Runs a single plan file and prints its result as JSON. */
public class FedQueryApp {
  private static final Logger log = LoggingService.getLogger(FedQueryApp.class);

  static final int EXIT_OK = 0;
  static final int EXIT_STARTUP_ERROR = 1;
  static final int EXIT_PLAN_FAILED = 2;

  public static void main(String[] args) {
    System.exit(run(args));
  }

  static int run(String[] args) {
    try (FedQuery app = new FedQuery(args)) {
      String planFile = app.startupParameters().planFile();
      if (planFile == null || planFile.isBlank()) {
        throw new ConfigurationException("Usage: FedQueryApp --plan <file> [--config <file>]");
      }
      String planJson = readPlan(Path.of(planFile));
      app.initialize();

      PlanResult result = app.executor().execute(planJson);
      System.out.println(
          JacksonUtility.getJsonMapper()
              .writerWithDefaultPrettyPrinter()
              .writeValueAsString(result.toJson()));
      return result.isSuccess() ? EXIT_OK : EXIT_PLAN_FAILED;
    } catch (Exception e) {
      log.error("Application failed to start", e);
      return EXIT_STARTUP_ERROR;
    }
  }

  private static String readPlan(Path path) {
    try {
      return Files.readString(path, StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new ConfigurationException("Could not read plan file " + path.toAbsolutePath(), e);
    }
  }
}
