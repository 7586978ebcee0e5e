package com.gentoro.kbgen;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class StartupParametersTest {

  @Test
  void defaultsToGenerateWithBundledConfig() {
    StartupParameters params = new StartupParameters(new String[0]);
    assertEquals("generate", params.mode());
    assertEquals(ConfigurationProvider.DEFAULT_LOCATION, params.configFile());
    assertFalse(params.isParameterPresent("scenario"));
  }

  @Test
  void parsesNameValuePairsAndBareFlags() {
    StartupParameters params =
        new StartupParameters(
            new String[] {
              "--mode", "render", "--graph-file", "g.json", "--verbose", "--scenario", "pangorio"
            });
    assertEquals("render", params.mode());
    assertEquals("g.json", params.getParameter("graph-file", String.class));
    assertEquals("pangorio", params.getOptionalParameter("scenario", String.class).orElseThrow());
    assertTrue(params.isParameterPresent("verbose"));
    assertTrue(params.getOptionalParameter("verbose", String.class).isEmpty());
  }

  @Test
  void rejectsInvalidCombinations() {
    assertThrows(
        IllegalArgumentException.class, () -> new StartupParameters(new String[] {"--mode", "x"}));
    assertThrows(
        IllegalArgumentException.class,
        () -> new StartupParameters(new String[] {"--mode", "render"}));
    assertThrows(
        IllegalArgumentException.class,
        () -> new StartupParameters(new String[] {"--config-file", "--mode", "help"}));
  }
}
