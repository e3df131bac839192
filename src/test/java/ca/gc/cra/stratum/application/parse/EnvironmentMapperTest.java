package ca.gc.cra.stratum.application.parse;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.stratum.domain.config.ResolvedConfig;
import ca.gc.cra.stratum.domain.option.OptionSource;
import ca.gc.cra.stratum.testutil.TestSchemas;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class EnvironmentMapperTest {
  private static final List<String> BACKUP = List.of("backup", "--stanza=main", "--pg-path=/pg");

  @TempDir Path tempDir;

  private final List<String> warnings = new ArrayList<>();
  private ConfigParser parser;

  @BeforeEach
  void setUp() {
    parser = TestSchemas.parser(tempDir, warnings);
  }

  private ResolvedConfig backup(Map<String, String> env) {
    return parser.parse(BACKUP, env);
  }

  @Test
  void mapsPrefixedVariablesToOptions() {
    ResolvedConfig config = backup(Map.of(
        "STRATUM_PROCESS_MAX", "6",
        "STRATUM_REPO2_PATH", "/repo2",
        "PATH", "/usr/bin"));

    assertEquals(6L, config.number("process-max").orElseThrow());
    assertEquals(OptionSource.CONFIG, config.source("process-max").orElseThrow());
    assertEquals(1, config.groupIndexTotal("repo"));
    assertEquals(2, config.groupIndexKey("repo", 0));
    assertEquals("/repo2", config.string("repo-path", 0).orElseThrow());
    assertTrue(warnings.isEmpty());
  }

  @Test
  void commandLineWinsOverEnvironment() {
    ResolvedConfig config = parser.parse(
        List.of("backup", "--stanza=main", "--pg-path=/pg", "--process-max=3"),
        Map.of("STRATUM_PROCESS_MAX", "6"));

    assertEquals(3L, config.number("process-max").orElseThrow());
    assertEquals(OptionSource.PARAM, config.source("process-max").orElseThrow());
  }

  @Test
  void booleansUseYesNo() {
    assertFalse(backup(Map.of("STRATUM_ONLINE", "n")).test("online"));
    assertTrue(backup(Map.of("STRATUM_ONLINE", "y")).test("online"));

    OptionException ex = assertThrows(OptionException.class, () -> backup(Map.of("STRATUM_ONLINE", "true")));
    assertEquals(ErrorKind.OPTION_INVALID_VALUE, ex.kind());
    assertEquals("environment boolean option 'online' must be 'y' or 'n'", ex.getMessage());
  }

  @Test
  void listAndHashValuesSplitOnColon() {
    ResolvedConfig config = backup(Map.of(
        "STRATUM_DB_INCLUDE", "db1:db2",
        "STRATUM_RECOVERY_OPTION", "a=1:b=2"));

    assertEquals(List.of("db1", "db2"), config.list("db-include"));
    assertEquals(Map.of("a", "1", "b", "2"), config.map("recovery-option"));
  }

  @Test
  void unknownNegateAndResetVariablesWarn() {
    backup(Map.of(
        "STRATUM_BOGUS", "1",
        "STRATUM_NO_ONLINE", "y",
        "STRATUM_RESET_PROCESS_MAX", "y"));

    assertEquals(List.of(
        "environment contains invalid option 'bogus'",
        "environment contains invalid negate option 'no-online'",
        "environment contains invalid reset option 'reset-process-max'"), warnings);
  }

  @Test
  void optionInvalidForCommandIsSkippedSilently() {
    ResolvedConfig config = backup(Map.of("STRATUM_SPOOL_PATH", "/spool"));

    assertTrue(config.value("spool-path").isEmpty());
    assertTrue(warnings.isEmpty());
  }

  @Test
  void emptyValueIsError() {
    OptionException ex = assertThrows(OptionException.class, () -> backup(Map.of("STRATUM_COMPRESS_TYPE", "")));
    assertEquals("environment variable 'compress-type' must have a value", ex.getMessage());
  }

  @Test
  void secureOptionMayComeFromEnvironment() {
    ResolvedConfig config = backup(Map.of(
        "STRATUM_REPO1_TYPE", "s3",
        "STRATUM_REPO1_S3_KEY", "secret"));

    assertEquals("secret", config.string("repo-s3-key").orElseThrow());
    assertEquals(OptionSource.CONFIG, config.source("repo-s3-key").orElseThrow());
  }
}
