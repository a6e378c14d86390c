package com.flamingo.ai.docindex.service.rag.semantic;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.flamingo.ai.docindex.config.RagConfig;
import com.flamingo.ai.docindex.domain.enums.BoundaryType;
import com.flamingo.ai.docindex.domain.enums.NodeType;
import com.flamingo.ai.docindex.service.rag.chunking.TokenCounter;
import com.flamingo.ai.docindex.service.rag.embedding.EmbeddingBatch;
import com.flamingo.ai.docindex.service.rag.embedding.TextEmbedder;
import com.flamingo.ai.docindex.service.rag.model.HierarchyNode;
import com.flamingo.ai.docindex.service.rag.model.SemanticAnalysisResult;
import com.flamingo.ai.docindex.service.rag.model.SemanticBoundary;
import com.flamingo.ai.docindex.service.rag.model.SemanticSegment;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("SemanticBoundaryDetector Tests")
class SemanticBoundaryDetectorTest {

  private static final float[] TOPIC_A = {1f, 0f};
  private static final float[] TOPIC_B = {0f, 1f};

  @Mock private TextEmbedder textEmbedder;

  private RagConfig ragConfig;
  private SemanticBoundaryDetector detector;

  @BeforeEach
  void setUp() {
    ragConfig = new RagConfig();
    detector =
        new SemanticBoundaryDetector(
            textEmbedder, new KeywordExtractor(), new TokenCounter(), ragConfig);
  }

  private static List<HierarchyNode> paragraphs(String... contents) {
    List<HierarchyNode> nodes = new ArrayList<>();
    for (int i = 0; i < contents.length; i++) {
      nodes.add(
          HierarchyNode.builder()
              .id("node_" + i)
              .type(NodeType.PARAGRAPH)
              .content(contents[i])
              .position(i)
              .build());
    }
    return nodes;
  }

  private void embedAs(float[]... vectors) {
    when(textEmbedder.embedPassages(anyList()))
        .thenReturn(new EmbeddingBatch(List.of(vectors), 0));
  }

  @Test
  @DisplayName("should place a strong boundary where the topic changes")
  void shouldPlaceStrongBoundaryAtTopicChange() {
    embedAs(TOPIC_A, TOPIC_A, TOPIC_B, TOPIC_B);

    SemanticAnalysisResult result =
        detector.analyzeSemanticBoundaries(
            paragraphs(
                "Apples grow in orchards.",
                "Orchards need pruning.",
                "Compilers parse source code.",
                "Parsers build syntax trees."));

    List<SemanticBoundary> boundaries = result.getBoundaries();
    assertThat(boundaries).hasSize(3);

    SemanticBoundary change = boundaries.get(1);
    assertThat(change.getPosition()).isEqualTo(2);
    assertThat(change.getPreviousPosition()).isEqualTo(1);
    assertThat(change.getSimilarity()).isCloseTo(0.0, within(1e-6));
    assertThat(change.getBoundaryType()).isEqualTo(BoundaryType.STRONG);
    assertThat(change.getBoundaryStrength()).isCloseTo(1.0, within(1e-6));

    SemanticBoundary steady = boundaries.get(0);
    assertThat(steady.getBoundaryType()).isEqualTo(BoundaryType.WEAK);
    assertThat(steady.getBoundaryStrength()).isZero();
  }

  @Test
  @DisplayName("should cut segments at strong boundaries")
  void shouldCutSegmentsAtStrongBoundaries() {
    embedAs(TOPIC_A, TOPIC_A, TOPIC_B, TOPIC_B);

    SemanticAnalysisResult result =
        detector.analyzeSemanticBoundaries(paragraphs("one", "two", "three", "four"));

    List<SemanticSegment> segments = result.getSegments();
    assertThat(segments).hasSize(2);
    assertThat(segments.get(0).getStartPosition()).isZero();
    assertThat(segments.get(0).getEndPosition()).isEqualTo(1);
    assertThat(segments.get(0).getCoherenceScore()).isCloseTo(1.0, within(1e-6));
    assertThat(segments.get(0).getSimilarityToPrevious()).isNull();
    assertThat(segments.get(1).getSimilarityToPrevious()).isCloseTo(0.0, within(1e-6));
    assertThat(segments.get(1).getSimilarityToNext()).isNull();
    assertThat(segments.get(1).getContent()).isEqualTo("three\n\nfour");
  }

  @Test
  @DisplayName("should report the mean adjacent similarity as overall coherence")
  void shouldReportMeanAdjacentSimilarity() {
    embedAs(TOPIC_A, TOPIC_A, TOPIC_B, TOPIC_B);

    SemanticAnalysisResult result =
        detector.analyzeSemanticBoundaries(paragraphs("one", "two", "three", "four"));

    assertThat(result.getOverallCoherence()).isCloseTo(2.0 / 3.0, within(1e-6));
    assertThat(result.getBoundaries())
        .allSatisfy(b -> assertThat(b.getSimilarity()).isBetween(0.0, 1.0));
  }

  @Test
  @DisplayName("should recommend a split point once enough tokens precede it")
  void shouldRecommendSplitPoints() {
    ragConfig.getSemantic().setMinSegmentTokens(1);
    embedAs(TOPIC_A, TOPIC_A, TOPIC_B, TOPIC_B);

    SemanticAnalysisResult result =
        detector.analyzeSemanticBoundaries(paragraphs("one", "two", "three", "four"));

    assertThat(result.getRecommendedSplitPoints()).containsExactly(2);
  }

  @Test
  @DisplayName("should not recommend split points for short segments")
  void shouldNotRecommendSplitPointsForShortSegments() {
    embedAs(TOPIC_A, TOPIC_A, TOPIC_B, TOPIC_B);

    SemanticAnalysisResult result =
        detector.analyzeSemanticBoundaries(paragraphs("one", "two", "three", "four"));

    assertThat(result.getRecommendedSplitPoints()).isEmpty();
  }

  @Test
  @DisplayName("should use the similarity threshold as reference when there are no neighbours")
  void shouldFallBackToThresholdWithoutNeighbours() {
    float[] halfway = {0.5f, (float) Math.sqrt(0.75)};
    embedAs(TOPIC_A, halfway);

    SemanticAnalysisResult result =
        detector.analyzeSemanticBoundaries(paragraphs("first", "second"));

    SemanticBoundary boundary = result.getBoundaries().get(0);
    assertThat(boundary.getSimilarity()).isCloseTo(0.5, within(1e-4));
    assertThat(boundary.getBoundaryType()).isEqualTo(BoundaryType.MODERATE);
    assertThat(boundary.getBoundaryStrength()).isCloseTo(0.2 / 0.7, within(1e-3));
    assertThat(boundary.getSimilarityDrop()).isCloseTo(0.2, within(1e-4));
  }

  @Test
  @DisplayName("should leave the evaluated pair out of its local average")
  void shouldExcludeEvaluatedPairFromLocalAverage() {
    float[] halfway = {0.5f, (float) Math.sqrt(0.75)};
    embedAs(TOPIC_A, TOPIC_A, halfway, halfway);

    SemanticAnalysisResult result =
        detector.analyzeSemanticBoundaries(paragraphs("one", "two", "three", "four"));

    // neighbours are 1.0 on both sides, so the reference is 1.0 rather than 2.5 / 3
    SemanticBoundary middle = result.getBoundaries().get(1);
    assertThat(middle.getSimilarity()).isCloseTo(0.5, within(1e-4));
    assertThat(middle.getSimilarityDrop()).isCloseTo(0.5, within(1e-4));
    assertThat(middle.getBoundaryStrength()).isCloseTo(0.5, within(1e-4));
  }

  @Test
  @DisplayName("should count every long word when judging a topic shift")
  void shouldCountCommonWordsForTopicShift() {
    embedAs(TOPIC_A, TOPIC_A, TOPIC_A);

    SemanticAnalysisResult result =
        detector.analyzeSemanticBoundaries(
            paragraphs(
                "Which records keep their dates",
                "Which tools keep their logs",
                "Compilers parse source code"));

    // {which, keep, their} of seven distinct words is above the overlap threshold
    assertThat(result.getBoundaries().get(0).isTopicShiftDetected()).isFalse();
    assertThat(result.getBoundaries().get(1).isTopicShiftDetected()).isTrue();
  }

  @Test
  @DisplayName("should compare two texts by the cosine of their embeddings")
  void shouldAnalyzeSimilarityOfTwoTexts() {
    float[] halfway = {0.5f, (float) Math.sqrt(0.75)};
    embedAs(TOPIC_A, halfway);

    assertThat(detector.analyzeSimilarity("apples", "orchards")).isCloseTo(0.5, within(1e-4));
  }

  @Test
  @DisplayName("should treat a single node as fully coherent")
  void shouldTreatSingleNodeAsCoherent() {
    embedAs(TOPIC_A);

    SemanticAnalysisResult result = detector.analyzeSemanticBoundaries(paragraphs("alone"));

    assertThat(result.getBoundaries()).isEmpty();
    assertThat(result.getSegments()).hasSize(1);
    assertThat(result.getOverallCoherence()).isEqualTo(1.0);
    assertThat(result.getNodeEmbeddings()).containsKey("node_0");
  }

  @Test
  @DisplayName("should skip blank nodes without calling the embedder")
  void shouldSkipBlankNodes() {
    SemanticAnalysisResult result = detector.analyzeSemanticBoundaries(paragraphs("  ", ""));

    assertThat(result.getSegments()).isEmpty();
    assertThat(result.getOverallCoherence()).isEqualTo(1.0);
    verifyNoInteractions(textEmbedder);
  }

  @Test
  @DisplayName("should prefix each unit with its heading path before embedding")
  @SuppressWarnings("unchecked")
  void shouldPrefixUnitsWithHeadingPath() {
    embedAs(TOPIC_A);
    HierarchyNode node =
        HierarchyNode.builder()
            .id("node_1")
            .type(NodeType.PARAGRAPH)
            .content("Body text.")
            .path(List.of("Guide", "Setup"))
            .position(1)
            .build();

    detector.analyzeSemanticBoundaries(List.of(node));

    ArgumentCaptor<List<String>> texts = ArgumentCaptor.forClass(List.class);
    verify(textEmbedder).embedPassages(texts.capture());
    assertThat(texts.getValue()).containsExactly("Guide > Setup\nBody text.");
  }

  @Test
  @DisplayName("should mark the analysis degraded when fallback vectors were used")
  void shouldPropagateDegradedEmbeddings() {
    when(textEmbedder.embedPassages(anyList()))
        .thenReturn(new EmbeddingBatch(List.of(TOPIC_A, TOPIC_B), 1));

    SemanticAnalysisResult result =
        detector.analyzeSemanticBoundaries(paragraphs("first", "second"));

    assertThat(result.isDegraded()).isTrue();
  }
}
