package ca.gc.cra.stratum.application.parse;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.stratum.domain.config.ResolvedConfig;
import ca.gc.cra.stratum.domain.option.CommandRole;
import ca.gc.cra.stratum.domain.option.OptionSource;
import ca.gc.cra.stratum.testutil.TestSchemas;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigParserTest {
  @TempDir Path tempDir;

  private final List<String> warnings = new ArrayList<>();
  private ConfigParser parser;

  @BeforeEach
  void setUp() {
    parser = TestSchemas.parser(tempDir, warnings);
  }

  private ResolvedConfig parse(String... args) {
    return parser.parse(List.of(args), Map.of());
  }

  private OptionException failure(String... args) {
    return assertThrows(OptionException.class, () -> parse(args));
  }

  @Test
  void resolvesCommandOptionsAndDefaults() {
    ResolvedConfig config = parse("backup", "--stanza=main", "--pg-path=/pg/data/", "--process-max", "4");

    assertEquals("backup", config.command());
    assertEquals(CommandRole.DEFAULT, config.role());
    assertFalse(config.help());
    assertEquals("main", config.string("stanza").orElseThrow());
    assertEquals("/pg/data", config.string("pg-path").orElseThrow());
    assertEquals(4L, config.number("process-max").orElseThrow());
    assertEquals(OptionSource.PARAM, config.source("process-max").orElseThrow());
    assertEquals(1830.0, config.decimal("protocol-timeout").orElseThrow());
    assertEquals(OptionSource.DEFAULT, config.source("protocol-timeout").orElseThrow());
    assertTrue(config.test("online"));
    assertTrue(warnings.isEmpty());
  }

  @Test
  void optionsInvalidForCommandAreMarkedInvalid() {
    ResolvedConfig config = parse("backup", "--stanza=main", "--pg-path=/pg");

    assertFalse(config.valid("spool-path"));
    assertTrue(config.value("spool-path").isEmpty());
    assertTrue(config.valid("compress-type"));
  }

  @Test
  void roleSuffixSelectsRole() {
    ResolvedConfig config = parse("backup:remote", "--stanza=main", "--pg-path=/pg");

    assertEquals("backup", config.command());
    assertEquals(CommandRole.REMOTE, config.role());
  }

  @Test
  void unsupportedOrUnknownRoleIsInvalid() {
    OptionException unsupported = failure("backup:async");
    assertEquals(ErrorKind.COMMAND_INVALID, unsupported.kind());
    assertEquals("invalid command 'backup:async'", unsupported.getMessage());

    OptionException unknown = failure("backup:sideways");
    assertEquals(ErrorKind.COMMAND_INVALID, unknown.kind());
    assertEquals("invalid command role 'sideways'", unknown.getMessage());
  }

  @Test
  void unknownCommandIsInvalid() {
    OptionException ex = failure("bogus");
    assertEquals(ErrorKind.COMMAND_INVALID, ex.kind());
    assertEquals("invalid command 'bogus'", ex.getMessage());
  }

  @Test
  void optionsWithoutCommandRequireCommand() {
    OptionException ex = failure("--stanza=main");
    assertEquals(ErrorKind.COMMAND_REQUIRED, ex.kind());
    assertEquals("no command found", ex.getMessage());
  }

  @Test
  void noArgumentsRequestsHelp() {
    ResolvedConfig config = parse();

    assertEquals("help", config.command());
    assertTrue(config.help());
    assertTrue(config.options().isEmpty());
  }

  @Test
  void helpForCommandSkipsRequiredChecks() {
    ResolvedConfig config = parse("help", "backup");

    assertEquals("backup", config.command());
    assertTrue(config.help());
    assertTrue(config.value("pg-path").isEmpty());
  }

  @Test
  void versionSkipsResolution() {
    ResolvedConfig config = parse("version");

    assertEquals("version", config.command());
    assertTrue(config.options().isEmpty());
  }

  @Test
  void parametersOnlyForCommandsThatAllowThem() {
    ResolvedConfig config = parse("archive-push", "--stanza=main", "000000010000000100000001");
    assertEquals(List.of("000000010000000100000001"), config.parameters());

    OptionException ex = failure("backup", "--stanza=main", "--pg-path=/pg", "extra");
    assertEquals(ErrorKind.PARAM_INVALID, ex.kind());
    assertEquals("command does not allow parameters", ex.getMessage());
  }

  @Test
  void secureOptionIsRejectedOnCommandLine() {
    OptionException ex = failure("backup", "--repo2-s3-key=secret");

    assertEquals(ErrorKind.OPTION_INVALID, ex.kind());
    assertTrue(ex.getMessage().startsWith("option 'repo2-s3-key' is not allowed on the command-line\n"));
    assertTrue(ex.getMessage().contains("HINT: this option could expose secrets in the process list."));
  }

  @Test
  void commandLineOptionInvalidForCommandIsHardError() {
    OptionException ex = failure("backup", "--stanza=main", "--pg-path=/pg", "--spool-path=/spool");

    assertEquals(ErrorKind.OPTION_INVALID, ex.kind());
    assertEquals("option 'spool-path' not valid for command 'backup'", ex.getMessage());
  }

  @Test
  void internalRolesDoNotReportWarnings() throws IOException {
    Files.writeString(tempDir.resolve("stratum.conf"), "[global]\nbogus-option=1\n");

    parse("backup:local", "--stanza=main", "--pg-path=/pg");
    parser.parse(List.of("backup:remote", "--stanza=main", "--pg-path=/pg"), Map.of("STRATUM_BOGUS", "1"));
    assertTrue(warnings.isEmpty());

    parse("backup", "--stanza=main", "--pg-path=/pg");
    assertEquals(List.of("configuration file contains invalid option 'bogus-option'"), warnings);
  }

  @Test
  void parserIsReusableAcrossCalls() {
    ResolvedConfig first = parse("backup", "--stanza=a", "--pg-path=/pg", "--process-max=2");
    ResolvedConfig second = parse("backup", "--stanza=b", "--pg-path=/pg");

    assertEquals(2L, first.number("process-max").orElseThrow());
    assertEquals(1L, second.number("process-max").orElseThrow());
    assertEquals("b", second.string("stanza").orElseThrow());
  }
}
