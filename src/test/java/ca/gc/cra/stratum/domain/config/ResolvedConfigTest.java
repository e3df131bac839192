package ca.gc.cra.stratum.domain.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.stratum.domain.option.CommandRole;
import ca.gc.cra.stratum.domain.option.OptionDefinition;
import ca.gc.cra.stratum.domain.option.OptionSection;
import ca.gc.cra.stratum.domain.option.OptionSource;
import ca.gc.cra.stratum.domain.option.OptionType;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ResolvedConfigTest {

  private static OptionDefinition repoPath() {
    return new OptionDefinition(
        0, "repo-path", OptionType.PATH, OptionSection.GLOBAL, "repo", false, false, false, List.of(), Map.of());
  }

  private static ResolvedConfig config() {
    Map<String, ResolvedOption> options = new LinkedHashMap<>();
    options.put("repo-path", new ResolvedOption(repoPath(), true, List.of(
        new ResolvedValue("/one", OptionSource.PARAM, false, false),
        new ResolvedValue("/three", OptionSource.CONFIG, false, false))));
    return new ResolvedConfig(
        "backup", CommandRole.LOCAL, false, List.of(), Map.of("repo", List.of(0, 2)), options);
  }

  @Test
  void exposesValuesByDenseIndex() {
    ResolvedConfig config = config();

    assertEquals(2, config.groupIndexTotal("repo"));
    assertEquals(3, config.groupIndexKey("repo", 1));
    assertEquals("/three", config.string("repo-path", 1).orElseThrow());
    assertEquals(OptionSource.CONFIG, config.source("repo-path", 1).orElseThrow());
    assertFalse(config.resolved("repo-path", 2).present());
  }

  @Test
  void unknownOptionsAreAbsent() {
    ResolvedConfig config = config();

    assertFalse(config.valid("bogus"));
    assertTrue(config.value("bogus").isEmpty());
    assertFalse(config.test("bogus"));
    assertEquals(List.of(), config.list("bogus"));
    assertEquals(0, config.groupIndexTotal("pg"));
  }

  @Test
  void listAndHashValuesAreReturnedAsStrings() {
    OptionDefinition include = new OptionDefinition(
        0, "db-include", OptionType.LIST, OptionSection.GLOBAL, null, false, false, false, List.of(), Map.of());
    OptionDefinition recovery = new OptionDefinition(
        1, "recovery-option", OptionType.HASH, OptionSection.GLOBAL, null, false, false, false, List.of(), Map.of());
    Map<String, String> pairs = new LinkedHashMap<>();
    pairs.put("standby_mode", "on");
    pairs.put("primary_conninfo", "host=db");
    Map<String, ResolvedOption> options = new LinkedHashMap<>();
    options.put("db-include", new ResolvedOption(include, true, List.of(
        new ResolvedValue(List.of("app", "audit"), OptionSource.CONFIG, false, false))));
    options.put("recovery-option", new ResolvedOption(recovery, true, List.of(
        new ResolvedValue(pairs, OptionSource.CONFIG, false, false))));
    ResolvedConfig config = new ResolvedConfig("restore", null, false, List.of(), Map.of(), options);

    assertEquals(List.of("app", "audit"), config.list("db-include"));
    assertEquals(pairs, config.map("recovery-option"));
    assertEquals(List.of("standby_mode", "primary_conninfo"), List.copyOf(config.map("recovery-option").keySet()));
    assertThrows(UnsupportedOperationException.class, () -> config.map("recovery-option").clear());
    assertEquals(Map.of(), config.map("bogus"));
  }

  @Test
  void snapshotIsImmutable() {
    List<String> parameters = new ArrayList<>(List.of("a"));
    ResolvedConfig config = new ResolvedConfig("info", null, false, parameters, null, null);
    parameters.add("b");

    assertEquals(List.of("a"), config.parameters());
    assertEquals(CommandRole.DEFAULT, config.role());
    assertThrows(UnsupportedOperationException.class, () -> config.parameters().add("c"));
    assertThrows(UnsupportedOperationException.class, () -> config.options().clear());
  }
}
