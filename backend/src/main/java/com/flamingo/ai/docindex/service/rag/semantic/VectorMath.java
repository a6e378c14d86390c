package com.flamingo.ai.docindex.service.rag.semantic;

import java.util.List;

/** Small vector helpers shared by boundary detection, chunk scoring and the in-memory store. */
public final class VectorMath {

  private VectorMath() {}

  /**
   * Cosine similarity clamped to [0,1]. Zero-norm or mismatched vectors score 0.
   *
   * @param a first vector
   * @param b second vector
   * @return the similarity
   */
  public static double cosine(float[] a, float[] b) {
    if (a == null || b == null || a.length == 0 || a.length != b.length) {
      return 0.0;
    }
    double dot = 0.0;
    double normA = 0.0;
    double normB = 0.0;
    for (int i = 0; i < a.length; i++) {
      dot += (double) a[i] * b[i];
      normA += (double) a[i] * a[i];
      normB += (double) b[i] * b[i];
    }
    if (normA == 0.0 || normB == 0.0) {
      return 0.0;
    }
    return clamp(dot / (Math.sqrt(normA) * Math.sqrt(normB)));
  }

  /** Mean pairwise cosine over all vectors; 1.0 when fewer than two. */
  public static double meanPairwise(List<float[]> vectors) {
    if (vectors.size() < 2) {
      return 1.0;
    }
    double sum = 0.0;
    int pairs = 0;
    for (int i = 0; i < vectors.size(); i++) {
      for (int j = i + 1; j < vectors.size(); j++) {
        sum += cosine(vectors.get(i), vectors.get(j));
        pairs++;
      }
    }
    return clamp(sum / pairs);
  }

  /** L2-normalized element-wise mean; {@code null} for an empty list. */
  public static float[] normalizedMean(List<float[]> vectors) {
    if (vectors.isEmpty()) {
      return null;
    }
    float[] mean = new float[vectors.get(0).length];
    for (float[] vector : vectors) {
      for (int i = 0; i < mean.length && i < vector.length; i++) {
        mean[i] += vector[i] / vectors.size();
      }
    }
    return normalize(mean);
  }

  /** Returns a unit-length copy; a zero vector is returned unchanged. */
  public static float[] normalize(float[] vector) {
    double norm = 0.0;
    for (float v : vector) {
      norm += (double) v * v;
    }
    if (norm == 0.0) {
      return vector.clone();
    }
    double length = Math.sqrt(norm);
    float[] result = new float[vector.length];
    for (int i = 0; i < vector.length; i++) {
      result[i] = (float) (vector[i] / length);
    }
    return result;
  }

  public static double clamp(double value) {
    if (Double.isNaN(value)) {
      return 0.0;
    }
    return Math.max(0.0, Math.min(1.0, value));
  }
}
