package com.flamingo.ai.docindex.service.rag.chunking;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.docindex.config.RagConfig;
import com.flamingo.ai.docindex.domain.enums.ChunkType;
import com.flamingo.ai.docindex.domain.enums.ChunkingMethod;
import com.flamingo.ai.docindex.exception.DocumentProcessingException;
import com.flamingo.ai.docindex.exception.InvalidChunkingConfigException;
import com.flamingo.ai.docindex.service.rag.embedding.EmbeddingService;
import com.flamingo.ai.docindex.service.rag.embedding.HashingEmbeddingGenerator;
import com.flamingo.ai.docindex.service.rag.model.ChunkSource;
import com.flamingo.ai.docindex.service.rag.model.ChunkingConfig;
import com.flamingo.ai.docindex.service.rag.model.ChunkingResult;
import com.flamingo.ai.docindex.service.rag.model.DocumentChunk;
import com.flamingo.ai.docindex.service.rag.parsing.DocumentStructureParser;
import com.flamingo.ai.docindex.service.rag.semantic.KeywordExtractor;
import com.flamingo.ai.docindex.service.rag.semantic.SemanticBoundaryDetector;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("SemanticChunker Tests")
class SemanticChunkerTest {

  private static final ChunkSource SOURCE = new ChunkSource("file-1", "guide.md");

  private SemanticChunker chunker;
  private TokenCounter tokenCounter;
  private SimpleMeterRegistry meterRegistry;

  @BeforeEach
  void setUp() {
    RagConfig ragConfig = new RagConfig();
    tokenCounter = new TokenCounter();
    meterRegistry = new SimpleMeterRegistry();
    KeywordExtractor keywordExtractor = new KeywordExtractor();
    EmbeddingService embedder =
        new EmbeddingService(
            Optional.empty(),
            new HashingEmbeddingGenerator(384),
            ragConfig,
            Runnable::run,
            meterRegistry);
    chunker =
        new SemanticChunker(
            new DocumentStructureParser(),
            new SemanticBoundaryDetector(embedder, keywordExtractor, tokenCounter, ragConfig),
            tokenCounter,
            keywordExtractor,
            new ChunkOverlapInjector(tokenCounter),
            new ChunkRelationshipLinker(),
            new ChunkQualityCalculator(),
            ragConfig,
            meterRegistry);
  }

  private static String threeSections() {
    return "# Alpha\n"
        + "Alpha covers the onboarding process for new staff members. "
        + "Every new hire receives a laptop and a badge on the first day. "
        + "The manager schedules an introduction meeting within the first week.\n\n"
        + "# Beta\n"
        + "Beta describes the expense policy for business travel. "
        + "Receipts must be submitted within thirty days of the trip. "
        + "Meals are reimbursed up to a fixed daily allowance.\n\n"
        + "# Gamma\n"
        + "Gamma explains how security incidents are reported. "
        + "Staff contact the security desk by phone or by email. "
        + "Every incident is logged and reviewed by the response team.";
  }

  private static String longSection() {
    String body =
        IntStream.range(0, 60)
            .mapToObj(i -> "Sentence number " + i + " explains another detail of the archive.")
            .collect(Collectors.joining(" "));
    return "# Archive Rules\n" + body;
  }

  @Nested
  @DisplayName("Structure")
  class Structure {

    @Test
    @DisplayName("should keep top-level sections in separate chunks")
    void shouldKeepSectionsApart() {
      ChunkingResult result =
          chunker.chunkDocument(
              "# A\npara1.\n\n# B\npara2.", "doc-1", SOURCE, ChunkingConfig.defaults());

      assertThat(result.getChunks()).hasSize(2);
      assertThat(result.getChunks().get(0).getContent()).contains("para1.").doesNotContain("B");
      assertThat(result.getChunks().get(1).getContent()).contains("para2.").doesNotContain("A");
      assertThat(result.getChunks().get(0).getHeadingPath()).containsExactly("A");
      assertThat(result.getChunks().get(1).getHeadingPath()).containsExactly("B");
    }

    @Test
    @DisplayName("should attach a heading to the first content below it")
    void shouldAttachHeadingToContent() {
      ChunkingResult result =
          chunker.chunkDocument(
              "# A\npara1.\n\n# B\npara2.", "doc-1", SOURCE, ChunkingConfig.defaults());

      DocumentChunk first = result.getChunks().get(0);
      assertThat(first.getContent()).isEqualTo("A\n\npara1.");
      assertThat(first.getChunkType()).isEqualTo(ChunkType.HEADING);
      assertThat(first.getHierarchyLevel()).isEqualTo(1);
    }

    @Test
    @DisplayName("should keep consecutive list items together as one list chunk")
    void shouldKeepListTogether() {
      String text =
          "- First item about apples\n"
              + "- Second item about pears\n"
              + "- Third item about plums\n"
              + "- Fourth item about cherries\n"
              + "- Fifth item about grapes";
      ChunkingConfig config = ChunkingConfig.builder().minChunkSize(50).build();

      ChunkingResult result = chunker.chunkDocument(text, "doc-list", SOURCE, config);

      assertThat(result.getChunks()).hasSize(1);
      DocumentChunk list = result.getChunks().get(0);
      assertThat(list.getChunkType()).isEqualTo(ChunkType.LIST);
      assertThat(list.getContent().split("•", -1)).hasSize(6);
      assertThat(list.getContent()).startsWith("• First item").contains("• Fifth item");
    }

    @Test
    @DisplayName("should assign sequential ids, positions and provenance")
    void shouldAssignIdsAndProvenance() {
      ChunkingResult result =
          chunker.chunkDocument(threeSections(), "doc-7", SOURCE, ChunkingConfig.defaults());

      List<DocumentChunk> chunks = result.getChunks();
      for (int i = 0; i < chunks.size(); i++) {
        DocumentChunk chunk = chunks.get(i);
        assertThat(chunk.getId()).isEqualTo("doc-7_chunk_" + i);
        assertThat(chunk.getPosition()).isEqualTo(i);
        assertThat(chunk.getDocumentId()).isEqualTo("doc-7");
        assertThat(chunk.getMetadata().getSourceFileName()).isEqualTo("guide.md");
        assertThat(chunk.getMetadata().getChunkingMethod()).isEqualTo(ChunkingMethod.HYBRID);
        assertThat(chunk.getHierarchyLevel()).isEqualTo(chunk.getHeadingPath().size());
        assertThat(chunk.getTopicKeywords()).isNotEmpty();
      }
    }

    @Test
    @DisplayName("should link previous, next and sibling chunks")
    void shouldLinkChunks() {
      ChunkingResult result =
          chunker.chunkDocument(threeSections(), "doc-7", SOURCE, ChunkingConfig.defaults());

      List<DocumentChunk> chunks = result.getChunks();
      assertThat(chunks).hasSize(3);
      assertThat(chunks.get(0).getPreviousChunkId()).isNull();
      assertThat(chunks.get(0).getNextChunkId()).isEqualTo("doc-7_chunk_1");
      assertThat(chunks.get(2).getNextChunkId()).isNull();
      assertThat(chunks.get(1).getSiblingChunkIds())
          .containsExactly("doc-7_chunk_0", "doc-7_chunk_2");
    }
  }

  @Nested
  @DisplayName("Sizing and overlap")
  class SizingAndOverlap {

    @Test
    @DisplayName("should never exceed the effective maximum size")
    void shouldRespectMaximumSize() {
      ChunkingConfig config =
          ChunkingConfig.builder()
              .minChunkSize(20)
              .targetChunkSize(60)
              .maxChunkSize(80)
              .overlapPercentage(0)
              .adaptiveSizing(false)
              .build();

      ChunkingResult result = chunker.chunkDocument(longSection(), "doc-long", SOURCE, config);

      assertThat(result.getChunks()).hasSizeGreaterThan(5);
      assertThat(result.getChunks())
          .allSatisfy(
              chunk -> {
                assertThat(chunk.getTokens()).isLessThanOrEqualTo(80);
                assertThat(chunk.getTokens()).isEqualTo(tokenCounter.count(chunk.getContent()));
                assertThat(chunk.getHeadingPath()).containsExactly("Archive Rules");
              });
      assertThat(result.getEffectiveConfig()).isEqualTo(config);
    }

    @Test
    @DisplayName("should shrink the size bounds for a short document")
    void shouldAdaptBoundsForShortDocument() {
      ChunkingResult result =
          chunker.chunkDocument(threeSections(), "doc-7", SOURCE, ChunkingConfig.defaults());

      assertThat(result.getEffectiveConfig().getMaxChunkSize()).isLessThan(500);
      assertThat(result.getChunks())
          .allSatisfy(
              chunk ->
                  assertThat(chunk.getTokens())
                      .isLessThanOrEqualTo(result.getEffectiveConfig().getMaxChunkSize()));
    }

    @Test
    @DisplayName("should flag overlap on both chunks of every overlapping pair")
    void shouldFlagOverlapSymmetrically() {
      ChunkingConfig config = ChunkingConfig.builder().overlapPercentage(20).build();

      ChunkingResult result = chunker.chunkDocument(threeSections(), "doc-7", SOURCE, config);

      List<DocumentChunk> chunks = result.getChunks();
      assertThat(chunks.get(0).isOverlapPrevious()).isFalse();
      assertThat(chunks.get(chunks.size() - 1).isOverlapNext()).isFalse();
      for (int i = 0; i < chunks.size() - 1; i++) {
        DocumentChunk current = chunks.get(i);
        assertThat(current.isOverlapNext()).isEqualTo(chunks.get(i + 1).isOverlapPrevious());
        assertThat(current.isOverlapNext()).isTrue();
        assertThat(squash(current.getContent())).endsWith(squash(current.getOverlapText()));
      }
      assertThat(result.getOverlapEfficiency()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should not add overlap when the percentage is zero")
    void shouldSkipOverlapWhenDisabled() {
      ChunkingConfig config = ChunkingConfig.builder().overlapPercentage(0).build();

      ChunkingResult result = chunker.chunkDocument(threeSections(), "doc-7", SOURCE, config);

      assertThat(result.getChunks())
          .allSatisfy(
              chunk -> {
                assertThat(chunk.isOverlapNext()).isFalse();
                assertThat(chunk.getOverlapText()).isNull();
              });
      assertThat(result.getOverlapEfficiency()).isZero();
    }

    private String squash(String text) {
      return text.replaceAll("\\s+", " ").strip();
    }
  }

  @Nested
  @DisplayName("Results and errors")
  class ResultsAndErrors {

    @Test
    @DisplayName("should produce the same contents and token counts on every run")
    void shouldBeIdempotent() {
      ChunkingResult first =
          chunker.chunkDocument(longSection(), "doc-a", SOURCE, ChunkingConfig.defaults());
      ChunkingResult second =
          chunker.chunkDocument(longSection(), "doc-b", SOURCE, ChunkingConfig.defaults());

      assertThat(second.getChunks())
          .extracting(DocumentChunk::getContent)
          .isEqualTo(first.getChunks().stream().map(DocumentChunk::getContent).toList());
      assertThat(second.getChunks())
          .extracting(DocumentChunk::getTokens)
          .isEqualTo(first.getChunks().stream().map(DocumentChunk::getTokens).toList());
    }

    @Test
    @DisplayName("should report metrics within the unit interval")
    void shouldReportMetrics() {
      ChunkingResult result =
          chunker.chunkDocument(threeSections(), "doc-7", SOURCE, ChunkingConfig.defaults());

      int totalTokens = result.getChunks().stream().mapToInt(DocumentChunk::getTokens).sum();
      assertThat(result.getTotalChunks()).isEqualTo(result.getChunks().size());
      assertThat(result.getTotalTokens()).isEqualTo(totalTokens);
      assertThat(result.getAverageChunkSize())
          .isEqualTo((double) totalTokens / result.getTotalChunks());
      assertThat(result.getSemanticCoherence()).isBetween(0.0, 1.0);
      assertThat(result.getHierarchyPreservation()).isZero();
      assertThat(result.isDegraded()).isFalse();
      assertThat(meterRegistry.counter("chunking.documents").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should return an empty result for empty or blank text")
    void shouldReturnEmptyResultForEmptyText() {
      ChunkingResult empty = chunker.chunkDocument("", "doc-0", SOURCE, ChunkingConfig.defaults());
      ChunkingResult blank =
          chunker.chunkDocument("  \n\n ", "doc-0", SOURCE, ChunkingConfig.defaults());

      assertThat(empty.getChunks()).isEmpty();
      assertThat(empty.getTotalChunks()).isZero();
      assertThat(empty.getTotalTokens()).isZero();
      assertThat(blank.getChunks()).isEmpty();
    }

    @Test
    @DisplayName("should reject an invalid config before doing any work")
    void shouldRejectInvalidConfig() {
      ChunkingConfig config =
          ChunkingConfig.builder().minChunkSize(300).maxChunkSize(100).targetChunkSize(200).build();

      assertThatThrownBy(() -> chunker.chunkDocument("# A\ntext", "doc-1", SOURCE, config))
          .isInstanceOf(InvalidChunkingConfigException.class);
    }

    @Test
    @DisplayName("should reject missing text")
    void shouldRejectMissingText() {
      assertThatThrownBy(
              () -> chunker.chunkDocument(null, "doc-1", SOURCE, ChunkingConfig.defaults()))
          .isInstanceOf(DocumentProcessingException.class)
          .hasMessageContaining("missing");
    }

    @Test
    @DisplayName("should mark chunks structural when semantic boundaries are not preferred")
    void shouldMarkStructuralChunking() {
      ChunkingConfig config = ChunkingConfig.builder().preferSemanticBoundaries(false).build();

      ChunkingResult result = chunker.chunkDocument(threeSections(), "doc-7", null, config);

      assertThat(result.getChunks())
          .allSatisfy(
              chunk ->
                  assertThat(chunk.getMetadata().getChunkingMethod())
                      .isEqualTo(ChunkingMethod.STRUCTURAL));
    }
  }
}
