package com.flamingo.ai.docindex.service.rag.embedding;

import com.flamingo.ai.docindex.config.RagConfig;
import com.flamingo.ai.docindex.service.rag.semantic.VectorMath;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Deterministic feature-hashing embeddings.
 *
 * <p>Each lowercase word, and each adjacent word pair at half weight, is hashed with murmur3 into
 * one of {@code dimensions} buckets. Bucket weights are square-root damped and the vector is
 * L2-normalized. All weights are non-negative, so cosine similarity between two outputs is always
 * in [0,1]. Texts without words map to the zero vector.
 *
 * <p>Used for the "local" provider and as the substitute whenever the remote model fails.
 */
@Component
public class HashingEmbeddingGenerator {

  private static final HashFunction HASH = Hashing.murmur3_32_fixed();
  private static final float BIGRAM_WEIGHT = 0.5f;

  private final int dimensions;

  @Autowired
  public HashingEmbeddingGenerator(RagConfig ragConfig) {
    this(ragConfig.getEmbedding().getDimensions());
  }

  @VisibleForTesting
  public HashingEmbeddingGenerator(int dimensions) {
    if (dimensions <= 0) {
      throw new IllegalArgumentException("dimensions must be positive: " + dimensions);
    }
    this.dimensions = dimensions;
  }

  public int getDimensions() {
    return dimensions;
  }

  public float[] generate(String text) {
    float[] vector = new float[dimensions];
    if (text == null || text.isBlank()) {
      return vector;
    }
    List<String> words = words(text);
    for (int i = 0; i < words.size(); i++) {
      vector[bucket(words.get(i))] += 1.0f;
      if (i > 0) {
        vector[bucket(words.get(i - 1) + " " + words.get(i))] += BIGRAM_WEIGHT;
      }
    }
    for (int i = 0; i < vector.length; i++) {
      vector[i] = (float) Math.sqrt(vector[i]);
    }
    return VectorMath.normalize(vector);
  }

  public List<float[]> generateAll(List<String> texts) {
    List<float[]> vectors = new ArrayList<>(texts.size());
    for (String text : texts) {
      vectors.add(generate(text));
    }
    return vectors;
  }

  private int bucket(String feature) {
    return Math.floorMod(HASH.hashString(feature, StandardCharsets.UTF_8).asInt(), dimensions);
  }

  private static List<String> words(String text) {
    List<String> words = new ArrayList<>();
    for (String word : text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+")) {
      if (!word.isEmpty()) {
        words.add(word);
      }
    }
    return words;
  }
}
