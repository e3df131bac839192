package ca.gc.cra.stratum.application.parse;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.stratum.domain.config.ResolvedConfig;
import ca.gc.cra.stratum.domain.config.ResolvedValue;
import ca.gc.cra.stratum.domain.option.OptionSource;
import ca.gc.cra.stratum.testutil.TestSchemas;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class OptionValueResolverTest {
  @TempDir Path tempDir;

  private ResolvedConfig parse(String... args) {
    return TestSchemas.parser(tempDir, new ArrayList<>()).parse(List.of(args), Map.of());
  }

  private ResolvedConfig backup(String... extra) {
    List<String> args = new ArrayList<>(List.of("backup", "--stanza=main", "--pg-path=/pg"));
    args.addAll(List.of(extra));
    return parse(args.toArray(String[]::new));
  }

  private OptionException backupFailure(String... extra) {
    return assertThrows(OptionException.class, () -> backup(extra));
  }

  @Test
  void sizeValuesUseBinaryUnits() {
    assertEquals(10L * 1024 * 1024, backup("--buffer-size=10m").number("buffer-size").orElseThrow());
    assertEquals(1024L * 1024, backup().number("buffer-size").orElseThrow());

    OptionException bad = backupFailure("--buffer-size=10x");
    assertEquals(ErrorKind.OPTION_INVALID_VALUE, bad.kind());
    assertEquals("'10x' is not valid for 'buffer-size' option", bad.getMessage());

    OptionException small = backupFailure("--buffer-size=1kb");
    assertEquals("'1kb' is out of range for 'buffer-size' option", small.getMessage());
  }

  @Test
  void integerAndFloatRanges() {
    assertEquals("'0' is out of range for 'process-max' option", backupFailure("--process-max=0").getMessage());
    assertEquals("'four' is not valid for 'process-max' option", backupFailure("--process-max=four").getMessage());
    assertEquals(0.5, backup("--protocol-timeout=.5").decimal("protocol-timeout").orElseThrow());
    assertEquals("'0.01' is out of range for 'protocol-timeout' option",
        backupFailure("--protocol-timeout=0.01").getMessage());
  }

  @Test
  void pathValuesAreValidated() {
    assertEquals("/repo", backup("--repo1-path=/repo/").string("repo-path").orElseThrow());
    assertTrue(backupFailure("--repo1-path=repo").getMessage().contains("must begin with /"));
    assertTrue(backupFailure("--repo1-path=/a//b").getMessage().contains("cannot contain //"));
  }

  @Test
  void allowListIsEnforced() {
    OptionException ex = backupFailure("--compress-type=bz2");

    assertEquals(ErrorKind.OPTION_INVALID_VALUE, ex.kind());
    assertEquals("'bz2' is not allowed for 'compress-type' option", ex.getMessage());
  }

  @Test
  void hashAndListValues() {
    ResolvedConfig config = backup(
        "--recovery-option=primary_conninfo=host=db", "--recovery-option=target=now",
        "--db-include=db1", "--db-include=db2");

    assertEquals(Map.of("primary_conninfo", "host=db", "target", "now"), config.map("recovery-option"));
    assertEquals(List.of("db1", "db2"), config.list("db-include"));

    OptionException ex = backupFailure("--recovery-option=novalue");
    assertEquals("key/value 'novalue' not valid for 'recovery-option' option", ex.getMessage());
  }

  @Test
  void requiredOptionWithStanzaHint() {
    OptionException ex = assertThrows(OptionException.class, () -> parse("backup", "--stanza=main"));

    assertEquals(ErrorKind.OPTION_REQUIRED, ex.kind());
    assertEquals("backup command requires option: pg-path\nHINT: does this stanza exist?", ex.getMessage());
  }

  @Test
  void commandLineDependencyViolationIsError() {
    OptionException ex = backupFailure("--repo1-s3-bucket=bucket");

    assertEquals(ErrorKind.OPTION_INVALID, ex.kind());
    assertEquals("option 'repo1-s3-bucket' not valid without option 'repo1-type' = 's3'", ex.getMessage());
  }

  @Test
  void booleanDependencyRequiringFalseNamesNegatedSpelling() {
    OptionException ex = backupFailure("--backup-standby");

    assertEquals("option 'backup-standby' not valid without option 'no-online'", ex.getMessage());
    assertTrue(backup("--no-online", "--backup-standby").test("backup-standby"));
  }

  @Test
  void fileDependencyViolationIsSilentlyAbsent() throws IOException {
    Files.writeString(tempDir.resolve("stratum.conf"), "[global]\nrepo1-s3-bucket=bucket\n");

    ResolvedConfig config = backup();

    assertTrue(config.value("repo-s3-bucket").isEmpty());
    assertEquals("posix", config.string("repo-type").orElseThrow());
  }

  @Test
  void satisfiedDependencyResolvesAtSameGroupIndex() {
    ResolvedConfig config = backup("--repo2-type=s3", "--repo2-s3-bucket=bucket", "--repo1-path=/one");

    assertEquals("bucket", config.string("repo-s3-bucket", 1).orElseThrow());
    assertTrue(config.value("repo-s3-bucket", 0).isEmpty());
  }

  @Test
  void unsatisfiedDefaultDependencyLeavesOptionAbsent() {
    ResolvedConfig config = parse("archive-push", "--stanza=main");

    assertFalse(config.test("archive-async"));
    assertTrue(config.value("spool-path").isEmpty());

    ResolvedConfig async = parse("archive-push", "--stanza=main", "--archive-async");
    assertEquals("/var/spool/stratum", async.string("spool-path").orElseThrow());
  }

  @Test
  void resetClearsValueWithoutDefault() {
    ResolvedValue value = backup("--reset-process-max").resolved("process-max");

    assertFalse(value.present());
    assertTrue(value.reset());
    assertEquals(OptionSource.PARAM, value.source());
  }

  @Test
  void negatedBooleanResolvesFalse() {
    ResolvedValue value = backup("--no-online").resolved("online");

    assertEquals(Boolean.FALSE, value.value());
    assertTrue(value.negate());
  }
}
