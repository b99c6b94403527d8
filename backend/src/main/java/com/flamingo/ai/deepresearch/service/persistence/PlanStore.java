package com.flamingo.ai.deepresearch.service.persistence;

import com.flamingo.ai.deepresearch.service.research.ResearchSession;
import java.util.Optional;
import java.util.UUID;

/** Key-value persistence of session snapshots. */
public interface PlanStore {

  /**
   * Loads the last saved snapshot.
   *
   * @param sessionId the session id
   * @return the session, or empty if none was saved
   */
  Optional<ResearchSession> load(UUID sessionId);

  /**
   * Saves the session, replacing any earlier snapshot.
   *
   * @param session the session
   * @throws PlanStoreException if the snapshot could not be written
   */
  void save(ResearchSession session);
}
