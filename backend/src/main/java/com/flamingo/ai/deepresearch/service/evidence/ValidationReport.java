package com.flamingo.ai.deepresearch.service.evidence;

import java.util.List;

/** Units that passed validation plus human-readable notes about the rejected ones. */
public record ValidationReport(List<EvidenceUnit> accepted, List<String> notes) {

  public ValidationReport {
    accepted = List.copyOf(accepted);
    notes = List.copyOf(notes);
  }
}
