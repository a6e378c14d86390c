package com.flamingo.ai.docindex.service.rag.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.docindex.config.RagConfig;
import com.flamingo.ai.docindex.exception.InvalidChunkingConfigException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("ChunkingConfig Tests")
class ChunkingConfigTest {

  @Nested
  @DisplayName("validate")
  class Validate {

    @Test
    @DisplayName("should accept the defaults")
    void shouldAcceptDefaults() {
      ChunkingConfig config = ChunkingConfig.defaults();

      assertThat(config.validate()).isSameAs(config);
    }

    @Test
    @DisplayName("should reject a minimum above the maximum")
    void shouldRejectInvertedBounds() {
      ChunkingConfig config =
          ChunkingConfig.builder().minChunkSize(600).maxChunkSize(500).build();

      assertThatThrownBy(config::validate)
          .isInstanceOf(InvalidChunkingConfigException.class)
          .extracting(e -> ((InvalidChunkingConfigException) e).getField())
          .isEqualTo("minChunkSize");
    }

    @Test
    @DisplayName("should reject a target outside the bounds")
    void shouldRejectTargetOutsideBounds() {
      ChunkingConfig config = ChunkingConfig.builder().targetChunkSize(900).build();

      assertThatThrownBy(config::validate)
          .isInstanceOf(InvalidChunkingConfigException.class)
          .hasMessageContaining("[200, 500]");
    }

    @Test
    @DisplayName("should reject a non-positive minimum")
    void shouldRejectZeroMinimum() {
      ChunkingConfig config = ChunkingConfig.builder().minChunkSize(0).build();

      assertThatThrownBy(config::validate).isInstanceOf(InvalidChunkingConfigException.class);
    }

    @Test
    @DisplayName("should reject overlap above half a chunk")
    void shouldRejectExcessiveOverlap() {
      ChunkingConfig config = ChunkingConfig.builder().overlapPercentage(51).build();

      assertThatThrownBy(config::validate)
          .isInstanceOf(InvalidChunkingConfigException.class)
          .extracting(e -> ((InvalidChunkingConfigException) e).getField())
          .isEqualTo("overlapPercentage");
    }
  }

  @Nested
  @DisplayName("adaptTo")
  class AdaptTo {

    @Test
    @DisplayName("should scale every bound to a tiny document")
    void shouldScaleToTinyDocument() {
      ChunkingConfig adapted = ChunkingConfig.defaults().adaptTo(150);

      assertThat(adapted.getMinChunkSize()).isEqualTo(15);
      assertThat(adapted.getTargetChunkSize()).isEqualTo(75);
      assertThat(adapted.getMaxChunkSize()).isEqualTo(250);
      assertThat(adapted.validate()).isSameAs(adapted);
    }

    @Test
    @DisplayName("should shrink the bounds for a small document")
    void shouldShrinkForSmallDocument() {
      ChunkingConfig adapted = ChunkingConfig.defaults().adaptTo(1000);

      assertThat(adapted.getMinChunkSize()).isEqualTo(100);
      assertThat(adapted.getTargetChunkSize()).isEqualTo(300);
      assertThat(adapted.getMaxChunkSize()).isEqualTo(375);
    }

    @Test
    @DisplayName("should keep the config for a large document")
    void shouldKeepConfigForLargeDocument() {
      ChunkingConfig config = ChunkingConfig.defaults();

      assertThat(config.adaptTo(5000)).isSameAs(config);
    }

    @Test
    @DisplayName("should leave the config alone when adaptive sizing is off")
    void shouldNotAdaptWhenDisabled() {
      ChunkingConfig config = ChunkingConfig.builder().adaptiveSizing(false).build();

      assertThat(config.adaptTo(10)).isSameAs(config);
      assertThat(config.getMinChunkSize()).isEqualTo(200);
    }
  }

  @Test
  @DisplayName("should copy every setting from the configured properties")
  void shouldCopyProperties() {
    RagConfig.Chunking properties = new RagConfig.Chunking();
    properties.setMinChunkSize(50);
    properties.setTargetChunkSize(120);
    properties.setMaxChunkSize(150);
    properties.setRespectSectionBoundaries(false);

    ChunkingConfig config = ChunkingConfig.fromProperties(properties);

    assertThat(config.getMinChunkSize()).isEqualTo(50);
    assertThat(config.getTargetChunkSize()).isEqualTo(120);
    assertThat(config.getMaxChunkSize()).isEqualTo(150);
    assertThat(config.isRespectSectionBoundaries()).isFalse();
    assertThat(config.isIncludeHeadingContext()).isTrue();
  }
}
