package com.flamingo.ai.docindex.service.rag.model;

import com.flamingo.ai.docindex.config.RagConfig;
import com.flamingo.ai.docindex.exception.InvalidChunkingConfigException;
import lombok.Builder;
import lombok.Value;

/**
 * Immutable configuration of one chunking run. Sizes are in tokens.
 *
 * <p>Adaptive variants are derived with {@link #adaptTo(int)}; the original is never changed.
 */
@Value
@Builder(toBuilder = true)
public class ChunkingConfig {

  static final int MAX_OVERLAP_PERCENTAGE = 50;

  @Builder.Default int minChunkSize = 200;
  @Builder.Default int maxChunkSize = 500;
  @Builder.Default int targetChunkSize = 400;
  @Builder.Default int overlapPercentage = 10;
  @Builder.Default boolean preferSemanticBoundaries = true;
  @Builder.Default boolean respectSectionBoundaries = true;
  @Builder.Default boolean includeHeadingContext = true;
  @Builder.Default boolean adaptiveSizing = true;

  public static ChunkingConfig defaults() {
    return ChunkingConfig.builder().build();
  }

  public static ChunkingConfig fromProperties(RagConfig.Chunking properties) {
    return ChunkingConfig.builder()
        .minChunkSize(properties.getMinChunkSize())
        .maxChunkSize(properties.getMaxChunkSize())
        .targetChunkSize(properties.getTargetChunkSize())
        .overlapPercentage(properties.getOverlapPercentage())
        .preferSemanticBoundaries(properties.isPreferSemanticBoundaries())
        .respectSectionBoundaries(properties.isRespectSectionBoundaries())
        .includeHeadingContext(properties.isIncludeHeadingContext())
        .adaptiveSizing(properties.isAdaptiveSizing())
        .build();
  }

  /**
   * Rejects inverted or out-of-range bounds.
   *
   * @return this config
   * @throws InvalidChunkingConfigException naming the first offending field
   */
  public ChunkingConfig validate() {
    if (minChunkSize < 1) {
      throw new InvalidChunkingConfigException(
          "minChunkSize", "must be at least 1 but was " + minChunkSize);
    }
    if (minChunkSize > maxChunkSize) {
      throw new InvalidChunkingConfigException(
          "minChunkSize",
          "must not exceed maxChunkSize (" + minChunkSize + " > " + maxChunkSize + ")");
    }
    if (targetChunkSize < minChunkSize || targetChunkSize > maxChunkSize) {
      throw new InvalidChunkingConfigException(
          "targetChunkSize",
          "must lie within [" + minChunkSize + ", " + maxChunkSize + "] but was "
              + targetChunkSize);
    }
    if (overlapPercentage < 0 || overlapPercentage > MAX_OVERLAP_PERCENTAGE) {
      throw new InvalidChunkingConfigException(
          "overlapPercentage",
          "must lie within [0, " + MAX_OVERLAP_PERCENTAGE + "] but was " + overlapPercentage);
    }
    return this;
  }

  /**
   * Derives the size profile for a document of the given length. Bounds only ever shrink.
   *
   * <ul>
   *   <li>Tiny documents (under twice the minimum) scale every bound to the document itself.
   *   <li>Small documents (under four targets) halve the minimum and take three quarters of the
   *       target and maximum.
   *   <li>Anything larger uses this config unchanged.
   * </ul>
   *
   * @param totalTokens token count of the whole document
   * @return the config to chunk with; {@code this} when adaptive sizing is off
   */
  public ChunkingConfig adaptTo(int totalTokens) {
    if (!adaptiveSizing || totalTokens <= 0) {
      return this;
    }
    if (totalTokens < 2 * minChunkSize) {
      int min = Math.max(1, Math.min(minChunkSize, totalTokens / 10));
      int target = Math.max(min, Math.min(targetChunkSize, totalTokens / 2));
      int max = Math.max(target, maxChunkSize / 2);
      return resized(min, target, max);
    }
    if (totalTokens < 4 * targetChunkSize) {
      int min = Math.max(1, minChunkSize / 2);
      int target = Math.max(min, targetChunkSize * 3 / 4);
      int max = Math.max(target, maxChunkSize * 3 / 4);
      return resized(min, target, max);
    }
    return this;
  }

  private ChunkingConfig resized(int min, int target, int max) {
    return toBuilder().minChunkSize(min).targetChunkSize(target).maxChunkSize(max).build();
  }
}
