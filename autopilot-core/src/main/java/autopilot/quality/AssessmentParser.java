package autopilot.quality;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts per-criterion scores from an assessor reply.
 *
 * <p>The assessor is asked to answer inside an {@code <evaluation>} block with one
 * {@code name: score - reason} line per criterion. Parsing is lenient:
 * <ol>
 *   <li>lines of the evaluation block (or the whole reply if there is none) are matched
 *       by criterion name;</li>
 *   <li>a criterion missing from those lines is searched anywhere in the reply as
 *       {@code name ... NN};</li>
 *   <li>a criterion still not found gets {@link #DEFAULT_SCORE}.</li>
 * </ol>
 * Scores are clamped to 0-100.
 */
final class AssessmentParser {
  static final int DEFAULT_SCORE = 50;

  private static final Pattern EVALUATION_BLOCK =
      Pattern.compile("<evaluation>(.*?)</evaluation>", Pattern.DOTALL | Pattern.CASE_INSENSITIVE);
  private static final Pattern SCORE_LINE =
      Pattern.compile("^\\s*[-*]?\\s*([^:：]+?)\\s*[:：]\\s*(\\d{1,3})(?:\\s*(?:/\\s*100)?\\s*[-:]\\s*(.*))?\\s*$");

  static List<QualityCriterion> parse(String reply, List<CriterionSpec> specs) {
    String text = reply == null ? "" : reply;
    Map<String, Scored> lines = scoreLines(evaluationBlock(text));

    List<QualityCriterion> criteria = new ArrayList<>(specs.size());
    for (CriterionSpec spec : specs) {
      Scored scored = lines.get(normalize(spec.name()));
      if (scored == null) {
        scored = searchAnywhere(text, spec.name());
      }
      if (scored == null) {
        criteria.add(new QualityCriterion(spec.name(), DEFAULT_SCORE, spec.weight(),
            "not found in assessment; default score used"));
      } else {
        criteria.add(new QualityCriterion(spec.name(), clamp(scored.score), spec.weight(), scored.reason));
      }
    }
    return criteria;
  }

  private static String evaluationBlock(String text) {
    Matcher m = EVALUATION_BLOCK.matcher(text);
    return m.find() ? m.group(1) : text;
  }

  private static Map<String, Scored> scoreLines(String block) {
    Map<String, Scored> scores = new HashMap<>();
    for (String line : block.split("\\R")) {
      Matcher m = SCORE_LINE.matcher(line);
      if (m.matches()) {
        String reason = m.group(3) == null ? "" : m.group(3).trim();
        scores.putIfAbsent(normalize(m.group(1)), new Scored(Integer.parseInt(m.group(2)), reason));
      }
    }
    return scores;
  }

  private static Scored searchAnywhere(String text, String name) {
    Pattern p = Pattern.compile(Pattern.quote(name) + "\\D{0,20}?(\\d{1,3})", Pattern.CASE_INSENSITIVE);
    Matcher m = p.matcher(text);
    return m.find() ? new Scored(Integer.parseInt(m.group(1)), "") : null;
  }

  private static String normalize(String name) {
    return name.trim().toLowerCase(Locale.ROOT).replaceAll("[\\s_]+", " ");
  }

  private static int clamp(int score) {
    return Math.max(0, Math.min(100, score));
  }

  private record Scored(int score, String reason) {}

  private AssessmentParser() {}
}
