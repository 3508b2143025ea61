package com.gentoro.fedquery;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.gentoro.fedquery.exception.ConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class StartupParametersTest {

  @Test
  @DisplayName("both --name value and --name=value forms are accepted")
  void forms() {
    StartupParameters params =
        new StartupParameters(
            new String[] {"--plan", "plan.json", "--config=app.yaml", "--verbose", "--runs", "3"});

    assertEquals("plan.json", params.planFile());
    assertEquals("app.yaml", params.configFile());
    assertEquals(Boolean.TRUE, params.getParameter("verbose", Boolean.class));
    assertEquals(3, params.getParameter("runs", Integer.class));
    assertEquals(3L, params.getParameter("runs", Long.class));
    assertTrue(params.hasParameter("verbose"));
    assertFalse(params.hasParameter("missing"));
    assertNull(params.getParameter("missing", String.class));
  }

  @Test
  @DisplayName("no arguments means no parameters")
  void empty() {
    assertTrue(new StartupParameters(null).asMap().isEmpty());
    assertNull(new StartupParameters(new String[0]).planFile());
  }

  @Test
  @DisplayName("positional arguments and bad numbers are rejected")
  void invalid() {
    assertThrows(
        ConfigurationException.class, () -> new StartupParameters(new String[] {"plan.json"}));
    assertThrows(ConfigurationException.class, () -> new StartupParameters(new String[] {"--"}));
    StartupParameters params = new StartupParameters(new String[] {"--runs", "many"});
    assertThrows(ConfigurationException.class, () -> params.getParameter("runs", Integer.class));
    assertThrows(IllegalArgumentException.class, () -> params.getParameter("runs", Double.class));
  }
}
