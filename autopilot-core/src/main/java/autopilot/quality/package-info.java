/**
 * Weighted multi-criterion scoring of generated content.
 *
 * <p>{@link autopilot.quality.QualityGate} asks the assessor for one score per criterion
 * of the content type, combines them by weight and maps the result to a
 * {@link autopilot.quality.Recommendation}. Assessor failures never propagate; they yield
 * a degraded REVIEW assessment.
 */
package autopilot.quality;
