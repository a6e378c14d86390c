package com.flamingo.ai.docindex.service.rag.semantic;

import com.flamingo.ai.docindex.config.RagConfig;
import com.flamingo.ai.docindex.domain.enums.BoundaryType;
import com.flamingo.ai.docindex.service.rag.chunking.TokenCounter;
import com.flamingo.ai.docindex.service.rag.embedding.EmbeddingBatch;
import com.flamingo.ai.docindex.service.rag.embedding.TextEmbedder;
import com.flamingo.ai.docindex.service.rag.model.HierarchyNode;
import com.flamingo.ai.docindex.service.rag.model.SemanticAnalysisResult;
import com.flamingo.ai.docindex.service.rag.model.SemanticBoundary;
import com.flamingo.ai.docindex.service.rag.model.SemanticSegment;
import io.micrometer.core.annotation.Timed;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Finds topic changes in a node sequence independently of its formatting.
 *
 * <p>Each non-empty node becomes one text unit, prefixed with its heading path. Units are embedded
 * in one ordered batch and compared pairwise with their right-hand neighbour. A boundary's
 * strength is how far its similarity falls below the average of the surrounding pairs, where the
 * window covers {@code windowSize} pairs on each side and excludes the pair itself. With no
 * neighbouring pairs the configured similarity threshold stands in for the local average.
 *
 * <p>Segments are cut at strong boundaries and at moderate boundaries that also shift topic.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SemanticBoundaryDetector {

  private final TextEmbedder textEmbedder;
  private final KeywordExtractor keywordExtractor;
  private final TokenCounter tokenCounter;
  private final RagConfig ragConfig;

  /**
   * Analyses the boundaries between adjacent nodes.
   *
   * @param nodes nodes in document order
   * @return boundaries, segments and coherence for the non-empty nodes
   */
  @Timed(value = "semantic.analyze", description = "Time to analyse semantic boundaries")
  public SemanticAnalysisResult analyzeSemanticBoundaries(List<HierarchyNode> nodes) {
    List<HierarchyNode> units =
        nodes.stream().filter(n -> n.getContent() != null && !n.getContent().isBlank()).toList();
    if (units.isEmpty()) {
      return SemanticAnalysisResult.empty();
    }

    RagConfig.Semantic settings = ragConfig.getSemantic();
    List<String> texts = units.stream().map(this::unitText).toList();
    EmbeddingBatch batch = textEmbedder.embedPassages(texts);
    List<float[]> embeddings = batch.vectors();

    List<List<String>> keywords = new ArrayList<>(units.size());
    Map<String, float[]> nodeEmbeddings = new HashMap<>();
    Map<String, List<String>> nodeKeywords = new HashMap<>();
    for (int i = 0; i < units.size(); i++) {
      List<String> unitKeywords =
          keywordExtractor.extract(units.get(i).getContent(), settings.getKeywordCount());
      keywords.add(unitKeywords);
      nodeEmbeddings.put(units.get(i).getId(), embeddings.get(i));
      nodeKeywords.put(units.get(i).getId(), unitKeywords);
    }

    double[] similarities = new double[units.size() - 1];
    for (int i = 0; i < similarities.length; i++) {
      similarities[i] = VectorMath.cosine(embeddings.get(i), embeddings.get(i + 1));
    }

    List<SemanticBoundary> boundaries = new ArrayList<>(similarities.length);
    for (int i = 0; i < similarities.length; i++) {
      boundaries.add(buildBoundary(units, similarities, keywords, i, settings));
    }

    List<SemanticSegment> segments = buildSegments(units, embeddings, boundaries, settings);
    List<Integer> splitPoints = recommendSplitPoints(units, boundaries, settings);
    double overallCoherence = mean(similarities);

    log.debug(
        "Analysed {} units: {} boundaries, {} segments, coherence {}",
        units.size(),
        boundaries.size(),
        segments.size(),
        String.format("%.3f", overallCoherence));

    return SemanticAnalysisResult.builder()
        .segments(List.copyOf(segments))
        .boundaries(List.copyOf(boundaries))
        .overallCoherence(overallCoherence)
        .recommendedSplitPoints(List.copyOf(splitPoints))
        .nodeEmbeddings(Map.copyOf(nodeEmbeddings))
        .nodeKeywords(Map.copyOf(nodeKeywords))
        .degraded(batch.degraded())
        .build();
  }

  /**
   * Similarity of two free texts, in [0,1].
   *
   * @param first first text
   * @param second second text
   * @return cosine similarity of their embeddings
   */
  public double analyzeSimilarity(String first, String second) {
    EmbeddingBatch batch = textEmbedder.embedPassages(List.of(first, second));
    return VectorMath.cosine(batch.vectors().get(0), batch.vectors().get(1));
  }

  private SemanticBoundary buildBoundary(
      List<HierarchyNode> units,
      double[] similarities,
      List<List<String>> keywords,
      int index,
      RagConfig.Semantic settings) {
    double similarity = similarities[index];
    double threshold = settings.getSimilarityThreshold();
    double reference = localAverage(similarities, index, settings.getWindowSize(), threshold);

    double drop = Math.max(0.0, reference - similarity);
    double strength = reference > 0.0 ? VectorMath.clamp(drop / reference) : 0.0;

    BoundaryType type;
    if (similarity < 0.5 * threshold) {
      type = BoundaryType.STRONG;
    } else if (similarity < threshold) {
      type = BoundaryType.MODERATE;
    } else {
      type = BoundaryType.WEAK;
    }

    double overlap = keywordExtractor.overlap(keywords.get(index), keywords.get(index + 1));
    boolean topicShift = overlap < settings.getTopicOverlapThreshold();

    return SemanticBoundary.builder()
        .position(units.get(index + 1).getPosition())
        .previousPosition(units.get(index).getPosition())
        .similarity(similarity)
        .boundaryStrength(strength)
        .similarityDrop(drop)
        .topicShiftDetected(topicShift)
        .boundaryType(type)
        .build();
  }

  /** Average of the neighbouring pair similarities, excluding the pair under evaluation. */
  private double localAverage(double[] similarities, int index, int window, double fallback) {
    double sum = 0.0;
    int count = 0;
    int from = Math.max(0, index - window);
    int to = Math.min(similarities.length - 1, index + window);
    for (int j = from; j <= to; j++) {
      if (j != index) {
        sum += similarities[j];
        count++;
      }
    }
    return count == 0 ? fallback : sum / count;
  }

  private List<SemanticSegment> buildSegments(
      List<HierarchyNode> units,
      List<float[]> embeddings,
      List<SemanticBoundary> boundaries,
      RagConfig.Semantic settings) {
    List<int[]> ranges = new ArrayList<>();
    int start = 0;
    for (int i = 0; i < boundaries.size(); i++) {
      if (boundaries.get(i).isSegmentCut()) {
        ranges.add(new int[] {start, i});
        start = i + 1;
      }
    }
    ranges.add(new int[] {start, units.size() - 1});

    List<float[]> averages = new ArrayList<>(ranges.size());
    for (int[] range : ranges) {
      averages.add(VectorMath.normalizedMean(embeddings.subList(range[0], range[1] + 1)));
    }

    List<SemanticSegment> segments = new ArrayList<>(ranges.size());
    for (int s = 0; s < ranges.size(); s++) {
      int[] range = ranges.get(s);
      List<HierarchyNode> members = units.subList(range[0], range[1] + 1);
      String content =
          String.join("\n\n", members.stream().map(HierarchyNode::getContent).toList());
      segments.add(
          SemanticSegment.builder()
              .startPosition(members.get(0).getPosition())
              .endPosition(members.get(members.size() - 1).getPosition())
              .content(content)
              .coherenceScore(
                  VectorMath.meanPairwise(embeddings.subList(range[0], range[1] + 1)))
              .topicKeywords(keywordExtractor.extract(content, settings.getKeywordCount()))
              .averageEmbedding(averages.get(s))
              .similarityToPrevious(
                  s > 0 ? VectorMath.cosine(averages.get(s - 1), averages.get(s)) : null)
              .similarityToNext(
                  s < ranges.size() - 1
                      ? VectorMath.cosine(averages.get(s), averages.get(s + 1))
                      : null)
              .build());
    }
    return segments;
  }

  /**
   * Positions where a new chunk should start: segment cuts preceded by at least {@code
   * minSegmentTokens} tokens since the previous split point.
   */
  private List<Integer> recommendSplitPoints(
      List<HierarchyNode> units, List<SemanticBoundary> boundaries, RagConfig.Semantic settings) {
    List<Integer> splitPoints = new ArrayList<>();
    int accumulated = 0;
    for (int i = 0; i < boundaries.size(); i++) {
      accumulated += tokenCounter.count(units.get(i).getContent());
      SemanticBoundary boundary = boundaries.get(i);
      if (boundary.isSegmentCut() && accumulated >= settings.getMinSegmentTokens()) {
        splitPoints.add(boundary.getPosition());
        accumulated = 0;
      }
    }
    return splitPoints;
  }

  private String unitText(HierarchyNode node) {
    if (node.getPath().isEmpty()) {
      return node.getContent();
    }
    return String.join(" > ", node.getPath()) + "\n" + node.getContent();
  }

  private static double mean(double[] values) {
    if (values.length == 0) {
      return 1.0;
    }
    double sum = 0.0;
    for (double value : values) {
      sum += value;
    }
    return VectorMath.clamp(sum / values.length);
  }
}
