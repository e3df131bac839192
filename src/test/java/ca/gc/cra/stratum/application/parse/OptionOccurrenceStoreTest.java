package ca.gc.cra.stratum.application.parse;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.stratum.application.port.OptionSchema;
import ca.gc.cra.stratum.domain.option.OptionSource;
import ca.gc.cra.stratum.testutil.TestSchemas;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;

class OptionOccurrenceStoreTest {
  private final OptionSchema schema = TestSchemas.standard(Path.of("/etc/stratum"));
  private final LongOptionTable table = new LongOptionTable(schema);
  private final OptionOccurrenceStore store = new OptionOccurrenceStore(schema);

  private void record(String spelling, String value) {
    store.recordCommandLine(table.find(spelling).orElseThrow(), value);
  }

  private String failure(String first, String firstValue, String second, String secondValue) {
    record(first, firstValue);
    return assertThrows(OptionException.class, () -> record(second, secondValue)).getMessage();
  }

  @Test
  void firstOccurrenceIsFoundFromParam() {
    record("stanza", "main");
    int id = schema.option("stanza").orElseThrow().id();

    assertTrue(store.found(id, 0));
    OptionOccurrence occurrence = store.find(id, 0).orElseThrow();
    assertEquals(OptionSource.PARAM, occurrence.source());
    assertEquals(List.of("main"), occurrence.values());
    assertTrue(store.setOnCommandLine(id));
    assertEquals("main", store.firstValue(id).orElseThrow());
  }

  @Test
  void negatedTwiceIsRejected() {
    assertEquals("option 'online' is negated multiple times",
        failure("no-online", null, "no-online", null));
  }

  @Test
  void resetTwiceIsRejected() {
    assertEquals("option 'process-max' is reset multiple times",
        failure("reset-process-max", null, "reset-process-max", null));
  }

  @Test
  void negateAndResetAreExclusive() {
    assertEquals("option 'online' cannot be negated and reset",
        failure("no-online", null, "reset-online", null));
  }

  @Test
  void setAndNegateAreExclusive() {
    assertEquals("option 'online' cannot be set and negated", failure("online", null, "no-online", null));
  }

  @Test
  void setAndResetAreExclusive() {
    assertEquals("option 'repo2-path' cannot be set and reset",
        failure("repo2-path", "/a", "reset-repo2-path", null));
  }

  @Test
  void singleValuedOptionCannotRepeat() {
    assertEquals("option 'process-max' cannot be set multiple times",
        failure("process-max", "1", "process-max", "2"));
  }

  @Test
  void multiValuedOptionAccumulates() {
    record("db-include", "a");
    record("db-include", "b");

    int id = schema.option("db-include").orElseThrow().id();
    assertEquals(List.of("a", "b"), store.find(id, 0).orElseThrow().values());
  }

  @Test
  void configTierNeverOverwritesFound() {
    record("process-max", "4");
    int id = schema.option("process-max").orElseThrow().id();

    assertFalse(store.claimConfig(id, 0, false, List.of("8")));
    assertEquals(List.of("4"), store.find(id, 0).orElseThrow().values());
    assertTrue(store.claimConfig(id, 1, false, List.of("8")));
  }

  @Test
  void foundIndexesAreSorted() {
    record("repo4-path", "/d");
    record("repo1-path", "/a");

    int id = schema.option("repo-path").orElseThrow().id();
    assertEquals(List.of(0, 3), List.copyOf(store.foundIndexes(id).keySet()));
  }
}
