package com.flamingo.ai.deepresearch.service.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.deepresearch.domain.entity.ResearchSnapshot;
import com.flamingo.ai.deepresearch.domain.repository.ResearchSnapshotRepository;
import com.flamingo.ai.deepresearch.service.research.ResearchSession;
import java.util.Optional;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Stores whole session snapshots as JSON in the relational database. */
@Service
@Slf4j
public class JpaPlanStore implements PlanStore {

  private final ResearchSnapshotRepository repository;
  private final ObjectMapper objectMapper;

  public JpaPlanStore(ResearchSnapshotRepository repository, ObjectMapper objectMapper) {
    this.repository = repository;
    this.objectMapper =
        objectMapper.copy().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
  }

  @Override
  @Transactional(readOnly = true)
  public Optional<ResearchSession> load(UUID sessionId) {
    return repository.findById(sessionId).map(this::toSession);
  }

  @Override
  @Transactional
  public void save(ResearchSession session) {
    String payload;
    try {
      payload = objectMapper.writeValueAsString(session);
    } catch (JsonProcessingException e) {
      throw new PlanStoreException("Could not serialize session " + session.getId(), e);
    }
    ResearchSnapshot snapshot =
        repository
            .findById(session.getId())
            .orElseGet(
                () ->
                    ResearchSnapshot.builder()
                        .id(session.getId())
                        .question(truncate(session.getQuestion()))
                        .build());
    snapshot.setState(session.getState());
    snapshot.setPayload(payload);
    repository.save(snapshot);
    log.debug("Saved snapshot of session {} in state {}", session.getId(), session.getState());
  }

  private ResearchSession toSession(ResearchSnapshot snapshot) {
    try {
      return objectMapper.readValue(snapshot.getPayload(), ResearchSession.class);
    } catch (JsonProcessingException e) {
      throw new PlanStoreException("Corrupt snapshot for session " + snapshot.getId(), e);
    }
  }

  private static String truncate(String question) {
    return question.length() <= 2000 ? question : question.substring(0, 2000);
  }
}
