package org.marcdb.ingest_service.resolution;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;
import org.marcdb.ingest_service.loading.AssemblyReference;
import org.marcdb.ingest_service.model.Assembly;

class AssemblyIndexTest {

  static Assembly assembly(long id, String sampleId, String runNumber) {
    return new Assembly(id, sampleId, null, null, runNumber, null, null, null, null, null);
  }

  private final Assembly s1Run1 = assembly(1, "s1", "1");
  private final Assembly s1Run2 = assembly(2, "s1", "2");
  private final Assembly s2 = assembly(3, "s2", null);
  private final AssemblyIndex index = new AssemblyIndex(List.of(s1Run2, s2, s1Run1));

  @Test
  void testExplicitIdWins() {
    AssemblyMatch match = index.match(new AssemblyReference(2L, "s2", "1"));

    assertTrue(match.isUnique());
    assertEquals(s1Run2, match.assembly());
  }

  @Test
  void testUnknownExplicitIdMatchesNothing() {
    assertEquals(MatchStatus.NONE, index.match(new AssemblyReference(99L, "s1", null)).status());
  }

  @Test
  void testSingleAssemblyForSampleIsUnique() {
    AssemblyMatch match = index.match(new AssemblyReference(null, "s2", null));

    assertEquals(s2, match.assembly());
  }

  @Test
  void testNamedRunMustMatchEvenForSingleAssembly() {
    AssemblyIndex single = new AssemblyIndex(List.of(s1Run1));

    assertEquals(s1Run1, single.match(new AssemblyReference(null, "s1", "1")).assembly());
    assertEquals(MatchStatus.NONE, single.match(new AssemblyReference(null, "s1", "4")).status());
    assertEquals(MatchStatus.NONE, index.match(new AssemblyReference(null, "s2", "4")).status());
  }

  @Test
  void testSeveralAssembliesWithoutRunAreAmbiguous() {
    AssemblyMatch match = index.match(new AssemblyReference(null, "s1", null));

    assertEquals(MatchStatus.AMBIGUOUS, match.status());
    assertNull(match.assembly());
    assertEquals(List.of(s1Run1, s1Run2), match.candidates());
  }

  @Test
  void testRunNumberDisambiguates() {
    assertEquals(s1Run2, index.match(new AssemblyReference(null, "s1", "2")).assembly());
    assertEquals(MatchStatus.NONE, index.match(new AssemblyReference(null, "s1", "3")).status());
  }

  @Test
  void testUnknownSampleMatchesNothing() {
    assertEquals(MatchStatus.NONE, index.match(new AssemblyReference(null, "s9", null)).status());
  }

  @Test
  void testDuplicateIdsAreIndexedOnce() {
    AssemblyIndex withRepeats = new AssemblyIndex(List.of(s2, s2));

    assertEquals(1, withRepeats.size());
    assertTrue(withRepeats.match(new AssemblyReference(null, "s2", null)).isUnique());
  }

  @Test
  void testUnflushedAssemblyIsRejected() {
    Assembly unflushed = s2.withId(null);

    assertThrows(IllegalArgumentException.class, () -> new AssemblyIndex(List.of(unflushed)));
  }
}
