package autopilot.quality;

import java.util.Objects;

/**
 * A named, weighted assessment criterion.
 */
public record CriterionSpec(String name, double weight, String description) {
  public CriterionSpec {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(description, "description");
    if (!(weight > 0)) {
      throw new IllegalArgumentException("weight must be > 0");
    }
  }
}
