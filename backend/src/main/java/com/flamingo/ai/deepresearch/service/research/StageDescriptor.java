package com.flamingo.ai.deepresearch.service.research;

import java.util.List;

/**
 * Static description of one stage of the state machine.
 *
 * @param stage the state
 * @param description what the stage does
 * @param reads session fields the stage reads
 * @param writes session fields the stage writes
 * @param next states the stage can move to
 */
public record StageDescriptor(
    ResearchState stage,
    String description,
    List<String> reads,
    List<String> writes,
    List<ResearchState> next) {}
