package autopilot.quality;

import autopilot.model.ContentType;

import java.util.List;
import java.util.Objects;

/**
 * Fixed, ordered criteria per content type.
 */
public final class QualityCriteria {

  private static final List<CriterionSpec> PLOT = List.of(
      new CriterionSpec("originality", 1.0, "Freshness of the premise and its twists"),
      new CriterionSpec("story structure", 1.2, "Clear setup, escalation and resolution"),
      new CriterionSpec("emotional arc", 0.8, "Emotional movement the reader goes through"),
      new CriterionSpec("logic", 1.0, "Internal consistency of cause and effect"),
      new CriterionSpec("reader appeal", 1.1, "How strongly it pulls the reader in"),
      new CriterionSpec("marketability", 0.7, "Fit with what readers look for"));

  private static final List<CriterionSpec> CHARACTER = List.of(
      new CriterionSpec("distinct personality", 1.2, "A personality that is clear and recognizable"),
      new CriterionSpec("backstory consistency", 1.0, "Backstory that agrees with behaviour"),
      new CriterionSpec("natural dialogue", 1.1, "A voice that sounds like a real person"),
      new CriterionSpec("growth potential", 0.9, "Room to change over a story"),
      new CriterionSpec("reader empathy", 1.0, "How easily readers relate"),
      new CriterionSpec("uniqueness", 0.8, "Distance from stock characters"));

  private static final List<CriterionSpec> WORLD_SETTING = List.of(
      new CriterionSpec("internal consistency", 1.3, "Rules of the world that do not contradict"),
      new CriterionSpec("level of detail", 1.0, "Concrete, specific texture"),
      new CriterionSpec("originality", 1.1, "Distance from familiar settings"),
      new CriterionSpec("story potential", 1.2, "Conflicts and stories the setting invites"),
      new CriterionSpec("accessibility", 0.9, "How quickly a reader can grasp it"),
      new CriterionSpec("plausibility", 0.7, "Believability within its own premise"));

  private static final List<CriterionSpec> INSPIRATION = List.of(
      new CriterionSpec("serendipity", 1.4, "Surprise of the combination"),
      new CriterionSpec("creative usefulness", 1.2, "How directly it can seed new work"),
      new CriterionSpec("uniqueness", 1.0, "Distance from common ideas"),
      new CriterionSpec("memorability", 0.8, "How well it sticks"),
      new CriterionSpec("combination quality", 1.1, "How well the sources fit together"));

  public static List<CriterionSpec> forType(ContentType type) {
    Objects.requireNonNull(type, "type");
    return switch (type) {
      case PLOT -> PLOT;
      case CHARACTER -> CHARACTER;
      case WORLD_SETTING -> WORLD_SETTING;
      case INSPIRATION -> INSPIRATION;
    };
  }

  private QualityCriteria() {}
}
