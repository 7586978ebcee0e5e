package com.gentoro.kbgen.pipeline;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.kbgen.exception.ConfigException;
import com.gentoro.kbgen.exception.NotFoundException;
import com.gentoro.kbgen.exception.ValidationException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import org.apache.commons.configuration2.BaseConfiguration;
import org.apache.commons.configuration2.YAMLConfiguration;
import org.junit.jupiter.api.Test;

class ScenarioCatalogTest {

  private static YAMLConfiguration yaml(String text) throws Exception {
    YAMLConfiguration cfg = new YAMLConfiguration();
    cfg.read(new StringReader(text));
    return cfg;
  }

  @Test
  void readsScenariosWithDefaults() throws Exception {
    ScenarioCatalog catalog =
        ScenarioCatalog.fromConfiguration(
            yaml(
                """
                render:
                  radius: 3
                scenarios:
                  - name: pangorio
                    world-description: "  A family restaurant in Hoboken  "
                    num-people: 6
                    num-entities: 4
                    num-focal-nodes: 2
                    questions-per-hop: { hop-0: 4, hop-2: 1 }
                    updates-per-hop: { hop-0: 2, hop-1: 1 }
                    clarifications-per-kind: 2
                    radius: 1
                    seed: 7
                  - name: village
                    world-description: A village in Rajasthan
                """));

    assertEquals(List.of("pangorio", "village"), catalog.names());
    ScenarioConfig pangorio = catalog.get("pangorio");
    assertEquals(
        new ScenarioConfig(
            "pangorio",
            "A family restaurant in Hoboken",
            6,
            4,
            2,
            Map.of(0, 4, 2, 1),
            Map.of(0, 2, 1, 1),
            2,
            1,
            7L),
        pangorio);

    ScenarioConfig village = catalog.get("village");
    assertEquals(5, village.numPeople());
    assertEquals(5, village.numEntities());
    assertEquals(3, village.numFocalNodes());
    assertEquals(Map.of(), village.questionsPerHop());
    assertEquals(Map.of(0, 3, 1, 2, 2, 1), village.updatesPerHop());
    assertEquals(1, village.clarificationsPerKind());
    assertEquals(3, village.radius());
    assertEquals(42L, village.seed());
  }

  @Test
  void missingScenariosGiveAnEmptyCatalog() throws Exception {
    ScenarioCatalog catalog = ScenarioCatalog.fromConfiguration(yaml("render:\n  radius: 2\n"));
    assertTrue(catalog.isEmpty());
    assertThrows(NotFoundException.class, () -> catalog.get("pangorio"));
  }

  @Test
  void rejectsInvalidDefinitions() {
    assertThrows(
        ConfigException.class,
        () -> ScenarioCatalog.fromConfiguration(yaml("scenarios:\n  - name: a\n")));
    assertThrows(
        ConfigException.class,
        () ->
            ScenarioCatalog.fromConfiguration(
                yaml(
                    """
                    scenarios:
                      - name: a
                        world-description: w
                        questions-per-hop: { three: 3 }
                    """)));
    assertThrows(
        ConfigException.class,
        () ->
            ScenarioCatalog.fromConfiguration(
                yaml(
                    """
                    scenarios:
                      - name: a
                        world-description: w
                        num-people: lots
                    """)));
    assertThrows(
        ValidationException.class,
        () ->
            ScenarioCatalog.fromConfiguration(
                yaml(
                    """
                    scenarios:
                      - name: a
                        world-description: w
                        num-people: 0
                    """)));
    assertThrows(
        ValidationException.class,
        () ->
            ScenarioCatalog.fromConfiguration(
                yaml(
                    """
                    scenarios:
                      - name: a
                        world-description: w
                        updates-per-hop: { hop-1: -2 }
                    """)));
  }

  @Test
  void duplicateNamesAreRejected() {
    ScenarioConfig a = new ScenarioConfig("a", "w", 1, 0, 1, Map.of(), Map.of(), 0, 2, 1L);
    assertThrows(ConfigException.class, () -> new ScenarioCatalog(List.of(a, a)));
  }

  @Test
  void flatConfigurationIsRejected() {
    assertThrows(
        ConfigException.class, () -> ScenarioCatalog.fromConfiguration(new BaseConfiguration()));
  }

  @Test
  void bundledConfigurationDeclaresFiveScenarios() throws Exception {
    YAMLConfiguration cfg = new YAMLConfiguration();
    try (InputStream in = getClass().getClassLoader().getResourceAsStream("application.yaml")) {
      cfg.read(new InputStreamReader(in, StandardCharsets.UTF_8));
    }
    ScenarioCatalog catalog = ScenarioCatalog.fromConfiguration(cfg);
    assertEquals(
        List.of(
            "pangorio", "st-marys-emergency", "sakura-robotics", "rajasthan-village", "ai-startup"),
        catalog.names());
  }
}
