package com.flamingo.ai.deepresearch.service.research;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.deepresearch.config.ResearchConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ResearchOptions Tests")
class ResearchOptionsTest {

  @Test
  @DisplayName("Should apply only non-null overrides")
  void shouldApplyOverrides() {
    ResearchOptions defaults = ResearchOptions.from(new ResearchConfig());

    ResearchOptions options = defaults.withOverrides(1, null, false);

    assertThat(options.maxResearchLoops()).isEqualTo(1);
    assertThat(options.initialQueryCount()).isEqualTo(defaults.initialQueryCount());
    assertThat(options.requirePlanningConfirmation()).isFalse();
    assertThat(options.tokenBudget()).isEqualTo(defaults.tokenBudget());
  }

  @Test
  @DisplayName("Should reject a zero loop ceiling")
  void shouldRejectZeroLoops() {
    assertThatThrownBy(() -> new ResearchOptions(0, 3, true, 1000))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
