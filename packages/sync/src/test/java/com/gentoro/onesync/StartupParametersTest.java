package com.gentoro.onesync;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class StartupParametersTest {

  @Test
  void defaults() {
    StartupParameters params = new StartupParameters(new String[0]);

    assertEquals("classpath:application.yaml", params.configFile());
    assertEquals(StartupParameters.MODE_SYNC, params.mode());
  }

  @Test
  void parsesOptionsWithValues() {
    StartupParameters params =
        new StartupParameters(
            new String[] {"--config-file", "/etc/onesync.yaml", "--mode", "watch", "--verbose"});

    assertEquals("/etc/onesync.yaml", params.configFile());
    assertEquals(StartupParameters.MODE_WATCH, params.mode());
    assertTrue(params.isParameterPresent("verbose"));
    assertTrue(params.getOptionalParameter("verbose").isEmpty());
  }

  @Test
  void optionIsNotConsumedAsPreviousValue() {
    StartupParameters params = new StartupParameters(new String[] {"--dry", "--mode", "report"});

    assertEquals(StartupParameters.MODE_REPORT, params.mode());
    assertNull(params.getParameter("dry"));
  }

  @Test
  void bareHelpSelectsHelpMode() {
    assertEquals(
        StartupParameters.MODE_HELP, new StartupParameters(new String[] {"--help"}).mode());
  }

  @Test
  void rejectsUnknownMode() {
    IllegalArgumentException e =
        assertThrows(
            IllegalArgumentException.class,
            () -> new StartupParameters(new String[] {"--mode", "serve"}));
    assertEquals("Invalid mode: serve", e.getMessage());
  }

  @Test
  void rejectsConfigFileWithoutValue() {
    assertThrows(
        IllegalArgumentException.class,
        () -> new StartupParameters(new String[] {"--config-file", "--mode", "sync"}));
  }
}
