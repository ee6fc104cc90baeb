package autopilot.spi;

import autopilot.model.ContentType;
import autopilot.model.SavedContent;

import java.sql.Connection;
import java.util.List;

/**
 * Persistence for content that passed the quality gate.
 */
public interface ContentStore extends EntityStore<SavedContent> {

  /**
   * Returns up to {@code limit} saved items of the given type, newest first.
   */
  List<SavedContent> findByType(Connection conn, ContentType type, int limit);
}
