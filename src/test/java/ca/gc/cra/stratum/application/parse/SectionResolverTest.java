package ca.gc.cra.stratum.application.parse;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.stratum.domain.config.ResolvedConfig;
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

class SectionResolverTest {
  @TempDir Path tempDir;

  private final List<String> warnings = new ArrayList<>();

  private ResolvedConfig run(String ini, Map<String, String> env, String... args) throws IOException {
    Files.writeString(tempDir.resolve("stratum.conf"), ini);
    return TestSchemas.parser(tempDir, warnings).parse(List.of(args), env);
  }

  private ResolvedConfig backup(String ini) throws IOException {
    return run(ini, Map.of(), "backup", "--stanza=stanza1", "--pg-path=/pg");
  }

  @Test
  void mostSpecificSectionWins() throws IOException {
    ResolvedConfig config = backup("""
        [global]
        process-max=1
        compress-type=none
        buffer-size=32k
        protocol-timeout=60

        [global:backup]
        process-max=2
        compress-type=lz4
        buffer-size=64k

        [stanza1]
        process-max=3
        compress-type=gz

        [stanza1:backup]
        process-max=4
        """);

    assertEquals(4L, config.number("process-max").orElseThrow());
    assertEquals("gz", config.string("compress-type").orElseThrow());
    assertEquals(64L * 1024, config.number("buffer-size").orElseThrow());
    assertEquals(60.0, config.decimal("protocol-timeout").orElseThrow());
    assertTrue(warnings.isEmpty());
  }

  @Test
  void otherStanzasAreIgnored() throws IOException {
    ResolvedConfig config = backup("[other]\nprocess-max=8\n");

    assertEquals(OptionSource.DEFAULT, config.source("process-max").orElseThrow());
  }

  @Test
  void commandLineAndEnvironmentBeatFiles() throws IOException {
    ResolvedConfig config = run(
        "[stanza1:backup]\nprocess-max=4\ncompress-type=none\n",
        Map.of("STRATUM_COMPRESS_TYPE", "lz4"),
        "backup", "--stanza=stanza1", "--pg-path=/pg", "--process-max=2");

    assertEquals(2L, config.number("process-max").orElseThrow());
    assertEquals("lz4", config.string("compress-type").orElseThrow());
  }

  @Test
  void stanzaOnlyOptionInGlobalSectionWarns() throws IOException {
    ResolvedConfig config = backup("[global]\npg-path=/global/pg\n");

    assertEquals("/pg", config.string("pg-path").orElseThrow());
    assertEquals(
        List.of("configuration file contains stanza-only option 'pg-path' in global section '[global]'"),
        warnings);
  }

  @Test
  void stanzaOnlyOptionInStanzaSectionApplies() throws IOException {
    ResolvedConfig config = run("[stanza1]\npg-path=/stanza/pg\n", Map.of(), "backup", "--stanza=stanza1");

    assertEquals("/stanza/pg", config.string("pg-path").orElseThrow());
  }

  @Test
  void ignoredKeysWarn() throws IOException {
    backup("""
        [global]
        bogus=1
        no-online=y
        reset-process-max=y
        stanza=other
        """);

    assertEquals(List.of(
        "configuration file contains invalid option 'bogus'",
        "configuration file contains negate option 'no-online'",
        "configuration file contains reset option 'reset-process-max'",
        "configuration file contains command-line only option 'stanza'"), warnings);
  }

  @Test
  void optionInvalidForCommandWarnsOnlyInCommandSections() throws IOException {
    backup("[global]\nspool-path=/spool\n[global:backup]\narchive-async=y\n");

    assertEquals(
        List.of("configuration file contains option 'archive-async' invalid for section '[global:backup]'"),
        warnings);
  }

  @Test
  void duplicateSpellingsInOneSectionAreRejected() {
    OptionException ex = assertThrows(OptionException.class,
        () -> backup("[global]\nrepo1-path=/a\nrepo-path=/b\n"));

    assertEquals(ErrorKind.OPTION_INVALID, ex.kind());
    assertEquals(
        "configuration file contains duplicate options ('repo-path', 'repo1-path') in section '[global]'",
        ex.getMessage());
    assertFalse(ex.commandLine());
  }

  @Test
  void sameOptionInDifferentSectionsIsNotDuplicate() throws IOException {
    ResolvedConfig config = backup("[global]\nrepo-path=/a\n[stanza1]\nrepo1-path=/b\n");

    assertEquals("/b", config.string("repo-path").orElseThrow());
  }

  @Test
  void booleansUseYesNo() throws IOException {
    assertFalse(backup("[global]\nonline=n\n").test("online"));

    OptionException ex = assertThrows(OptionException.class, () -> backup("[global]\nonline=true\n"));
    assertEquals("boolean option 'online' must be 'y' or 'n'", ex.getMessage());
  }

  @Test
  void emptyValueIsError() {
    OptionException ex = assertThrows(OptionException.class, () -> backup("[global]\ncompress-type=\n"));

    assertEquals(ErrorKind.OPTION_INVALID_VALUE, ex.kind());
    assertEquals("section '[global]', key 'compress-type' must have a value", ex.getMessage());
  }

  @Test
  void repeatedKeyFormsListForMultiOptions() throws IOException {
    ResolvedConfig config = backup("[global]\ndb-include=a\ndb-include=b\n");
    assertEquals(List.of("a", "b"), config.list("db-include"));

    OptionException ex = assertThrows(OptionException.class,
        () -> backup("[global]\nprocess-max=1\nprocess-max=2\n"));
    assertEquals("option 'process-max' cannot be set multiple times", ex.getMessage());
  }
}
