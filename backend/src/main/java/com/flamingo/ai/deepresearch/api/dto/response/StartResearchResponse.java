package com.flamingo.ai.deepresearch.api.dto.response;

import com.flamingo.ai.deepresearch.service.research.ResearchState;
import java.util.UUID;

/** Response DTO for a started session. */
public record StartResearchResponse(UUID sessionId, ResearchState state) {}
