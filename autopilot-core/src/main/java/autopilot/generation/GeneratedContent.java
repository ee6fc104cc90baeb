package autopilot.generation;

import autopilot.model.ContentType;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Content produced by one operation, one record per {@link ContentType}.
 *
 * <p>Serialized only at the persistence edge, through {@link #attributes()}.
 */
public sealed interface GeneratedContent
    permits GeneratedContent.PlotIdea, GeneratedContent.CharacterProfile,
    GeneratedContent.WorldSetting, GeneratedContent.Inspiration {

  ContentType type();

  String title();

  String body();

  /**
   * Type-specific fields as a flat map.
   */
  Map<String, String> attributes();

  record PlotIdea(String theme, String body) implements GeneratedContent {
    public PlotIdea {
      Objects.requireNonNull(theme, "theme");
      Objects.requireNonNull(body, "body");
    }

    @Override
    public ContentType type() {
      return ContentType.PLOT;
    }

    @Override
    public String title() {
      return "Plot: " + theme;
    }

    @Override
    public Map<String, String> attributes() {
      return Map.of("theme", theme);
    }
  }

  record CharacterProfile(String trait, String body) implements GeneratedContent {
    public CharacterProfile {
      Objects.requireNonNull(trait, "trait");
      Objects.requireNonNull(body, "body");
    }

    @Override
    public ContentType type() {
      return ContentType.CHARACTER;
    }

    @Override
    public String title() {
      return "Character: " + trait;
    }

    @Override
    public Map<String, String> attributes() {
      return Map.of("trait", trait);
    }
  }

  record WorldSetting(String concept, String body) implements GeneratedContent {
    public WorldSetting {
      Objects.requireNonNull(concept, "concept");
      Objects.requireNonNull(body, "body");
    }

    @Override
    public ContentType type() {
      return ContentType.WORLD_SETTING;
    }

    @Override
    public String title() {
      return "World setting: " + concept;
    }

    @Override
    public Map<String, String> attributes() {
      return Map.of("concept", concept);
    }
  }

  record Inspiration(List<String> sources, String body) implements GeneratedContent {
    public Inspiration {
      sources = List.copyOf(Objects.requireNonNull(sources, "sources"));
      Objects.requireNonNull(body, "body");
    }

    @Override
    public ContentType type() {
      return ContentType.INSPIRATION;
    }

    @Override
    public String title() {
      return "Inspiration: " + String.join(" x ", sources);
    }

    @Override
    public Map<String, String> attributes() {
      return Map.of("sources", String.join(",", sources));
    }
  }
}
