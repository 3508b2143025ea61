package com.gentoro.fedquery;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FedQueryAppTest {

  @TempDir Path tempDir;

  @Test
  @DisplayName("a missing --plan is a startup error")
  void missingPlan() {
    assertEquals(FedQueryApp.EXIT_STARTUP_ERROR, FedQueryApp.run(new String[0]));
    assertEquals(
        FedQueryApp.EXIT_STARTUP_ERROR,
        FedQueryApp.run(new String[] {"--plan", tempDir.resolve("absent.json").toString()}));
  }

  @Test
  @DisplayName("a plan that cannot run exits with the plan failure code")
  void failedPlan() throws IOException {
    Path config = tempDir.resolve("fedquery.yaml");
    Files.writeString(config, FedQueryTest.CONFIG);
    Path plan = tempDir.resolve("plan.json");
    Files.writeString(plan, FedQueryTest.PLAN);

    int exit =
        FedQueryApp.run(new String[] {"--config", config.toString(), "--plan", plan.toString()});

    assertEquals(FedQueryApp.EXIT_PLAN_FAILED, exit);
  }
}
