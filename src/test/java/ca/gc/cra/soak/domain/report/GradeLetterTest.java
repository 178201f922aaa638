package ca.gc.cra.soak.domain.report;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class GradeLetterTest {

  @Test
  void scoresMapToFirstReachedCutoff() {
    assertEquals(GradeLetter.A, GradeLetter.fromScore(100d));
    assertEquals(GradeLetter.A, GradeLetter.fromScore(90d));
    assertEquals(GradeLetter.B, GradeLetter.fromScore(89.9d));
    assertEquals(GradeLetter.C, GradeLetter.fromScore(70d));
    assertEquals(GradeLetter.D, GradeLetter.fromScore(60d));
    assertEquals(GradeLetter.F, GradeLetter.fromScore(59.9d));
    assertEquals(GradeLetter.F, GradeLetter.fromScore(0d));
  }

  @Test
  void lettersCarryDescriptions() {
    assertEquals("Failing - critical issues prevent extended session use", GradeLetter.F.description());
    assertEquals(80d, GradeLetter.B.minimumScore());
  }
}
