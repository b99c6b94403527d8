package com.flamingo.ai.deepresearch.api.dto.request;

import com.flamingo.ai.deepresearch.index.PrunePolicy;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for pruning evidence. Chunks matching either the subgoal or one of the ids are
 * pruned; a null policy uses the configured one.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PruneRequest {

  private String subgoalId;

  private List<String> chunkIds;

  private PrunePolicy policy;

  public boolean hasSelector() {
    return (subgoalId != null && !subgoalId.isBlank()) || (chunkIds != null && !chunkIds.isEmpty());
  }
}
