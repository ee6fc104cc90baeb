package autopilot.quality;

import autopilot.model.ContentType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AssessmentParserTest {
  private static final List<CriterionSpec> SPECS = List.of(
      new CriterionSpec("originality", 1.0, "fresh"),
      new CriterionSpec("story structure", 1.2, "shape"));

  @Test
  void readsScoreLinesFromEvaluationBlock() {
    String reply = "Some preamble originality: 10\n"
        + "<evaluation>\n"
        + "originality: 85 - a fresh inversion of the heist\n"
        + "Story Structure: 72 - the middle sags\n"
        + "</evaluation>";

    List<QualityCriterion> criteria = AssessmentParser.parse(reply, SPECS);

    assertEquals(85, criteria.get(0).score());
    assertEquals("a fresh inversion of the heist", criteria.get(0).details());
    assertEquals(72, criteria.get(1).score());
    assertEquals(1.2, criteria.get(1).weight());
  }

  @Test
  void acceptsScoresOutOfHundredAndBullets() {
    String reply = "- originality: 64/100 - decent\n* story_structure: 58";

    List<QualityCriterion> criteria = AssessmentParser.parse(reply, SPECS);

    assertEquals(64, criteria.get(0).score());
    assertEquals(58, criteria.get(1).score());
  }

  @Test
  void fallsBackToLooseSearch() {
    String reply = "I would rate the originality at 77 overall, and story structure around 66.";

    List<QualityCriterion> criteria = AssessmentParser.parse(reply, SPECS);

    assertEquals(77, criteria.get(0).score());
    assertEquals(66, criteria.get(1).score());
  }

  @Test
  void missingCriterionGetsDefaultScore() {
    List<QualityCriterion> criteria = AssessmentParser.parse("originality: 90", SPECS);

    assertEquals(90, criteria.get(0).score());
    assertEquals(AssessmentParser.DEFAULT_SCORE, criteria.get(1).score());
    assertTrue(criteria.get(1).details().contains("default"));
  }

  @Test
  void scoresAreClamped() {
    List<QualityCriterion> criteria = AssessmentParser.parse("originality: 150\nstory structure: 0", SPECS);

    assertEquals(100, criteria.get(0).score());
    assertEquals(0, criteria.get(1).score());
  }

  @Test
  void nullReplyUsesDefaultsForEveryCriterion() {
    List<QualityCriterion> criteria = AssessmentParser.parse(null, QualityCriteria.forType(ContentType.PLOT));

    assertEquals(QualityCriteria.forType(ContentType.PLOT).size(), criteria.size());
    assertTrue(criteria.stream().allMatch(c -> c.score() == AssessmentParser.DEFAULT_SCORE));
  }
}
