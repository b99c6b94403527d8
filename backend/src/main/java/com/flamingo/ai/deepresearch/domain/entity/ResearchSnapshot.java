package com.flamingo.ai.deepresearch.domain.entity;

import com.flamingo.ai.deepresearch.service.research.ResearchState;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Lob;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** Last persisted state of a research session, stored as a JSON document. */
@Entity
@Table(name = "research_snapshots")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ResearchSnapshot {

  /** The session id; assigned by the engine, not generated. */
  @Id private UUID id;

  @Column(nullable = false, length = 2000)
  private String question;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  private ResearchState state;

  @Lob
  @Column(nullable = false)
  private String payload;

  @Column(nullable = false, updatable = false)
  private LocalDateTime createdAt;

  @Column(nullable = false)
  private LocalDateTime updatedAt;

  @PrePersist
  protected void onCreate() {
    LocalDateTime now = LocalDateTime.now();
    createdAt = now;
    updatedAt = now;
  }

  @PreUpdate
  protected void onUpdate() {
    updatedAt = LocalDateTime.now();
  }
}
