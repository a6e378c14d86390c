package com.flamingo.ai.docindex.service.rag.chunking;

import com.flamingo.ai.docindex.config.RagConfig;
import com.flamingo.ai.docindex.domain.enums.ChunkingMethod;
import com.flamingo.ai.docindex.exception.DocumentProcessingException;
import com.flamingo.ai.docindex.service.rag.model.ChunkProvenance;
import com.flamingo.ai.docindex.service.rag.model.ChunkSource;
import com.flamingo.ai.docindex.service.rag.model.ChunkingConfig;
import com.flamingo.ai.docindex.service.rag.model.ChunkingResult;
import com.flamingo.ai.docindex.service.rag.model.DocumentChunk;
import com.flamingo.ai.docindex.service.rag.model.DocumentStructure;
import com.flamingo.ai.docindex.service.rag.model.SemanticAnalysisResult;
import com.flamingo.ai.docindex.service.rag.parsing.DocumentStructureParser;
import com.flamingo.ai.docindex.service.rag.semantic.KeywordExtractor;
import com.flamingo.ai.docindex.service.rag.semantic.SemanticBoundaryDetector;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Hierarchical semantic chunker.
 *
 * <p>Pipeline: parse the text into a heading tree, analyse semantic boundaries between its nodes,
 * adapt the size bounds to the document length, assemble chunks bottom-up along the tree, then add
 * overlap, relationship links and quality metrics. Every step returns new values; nothing produced
 * by an earlier step is modified.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SemanticChunker implements DocumentChunker {

  private static final int CHUNK_KEYWORDS = 5;

  private final DocumentStructureParser structureParser;
  private final SemanticBoundaryDetector boundaryDetector;
  private final TokenCounter tokenCounter;
  private final KeywordExtractor keywordExtractor;
  private final ChunkOverlapInjector overlapInjector;
  private final ChunkRelationshipLinker relationshipLinker;
  private final ChunkQualityCalculator qualityCalculator;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  @Override
  @Timed(value = "chunking.document", description = "Time to chunk one document")
  public ChunkingResult chunkDocument(
      String text, String documentId, ChunkSource source, ChunkingConfig config) {
    config.validate();
    if (text == null) {
      throw new DocumentProcessingException(documentId, "Document text is missing");
    }

    DocumentStructure structure = structureParser.parse(text);
    if (structure.isEmpty()) {
      log.debug("Document {} has no content, returning no chunks", documentId);
      return ChunkingResult.empty(config);
    }

    SemanticAnalysisResult analysis =
        boundaryDetector.analyzeSemanticBoundaries(structure.getNodes());
    int documentTokens =
        structure.getNodes().stream().mapToInt(n -> tokenCounter.count(n.getContent())).sum();
    ChunkingConfig effective = config.adaptTo(documentTokens);

    List<DraftChunk> drafts =
        new TreeChunkAssembler(
                structure,
                analysis,
                effective,
                ragConfig.getSemantic().getStrongBoundaryStrength(),
                tokenCounter)
            .assemble(HierarchyTree.build(structure));

    List<DocumentChunk> chunks = toChunks(drafts, documentId, source, effective);
    chunks = overlapInjector.apply(chunks, effective.getOverlapPercentage());
    chunks = relationshipLinker.link(chunks);

    int totalTokens = chunks.stream().mapToInt(DocumentChunk::getTokens).sum();
    ChunkingResult result =
        ChunkingResult.builder()
            .chunks(chunks)
            .totalChunks(chunks.size())
            .totalTokens(totalTokens)
            .averageChunkSize(chunks.isEmpty() ? 0.0 : (double) totalTokens / chunks.size())
            .overlapEfficiency(qualityCalculator.overlapEfficiency(chunks))
            .semanticCoherence(qualityCalculator.semanticCoherence(chunks))
            .hierarchyPreservation(qualityCalculator.hierarchyPreservation(chunks))
            .effectiveConfig(effective)
            .degraded(analysis.isDegraded())
            .build();

    meterRegistry.counter("chunking.documents").increment();
    meterRegistry.counter("chunking.chunks").increment(chunks.size());
    log.info(
        "Chunked document {}: {} nodes into {} chunks ({} tokens, coherence {}){}",
        documentId,
        structure.size(),
        chunks.size(),
        totalTokens,
        String.format("%.2f", result.getSemanticCoherence()),
        result.isDegraded() ? " using fallback embeddings" : "");
    return result;
  }

  private List<DocumentChunk> toChunks(
      List<DraftChunk> drafts, String documentId, ChunkSource source, ChunkingConfig config) {
    ChunkSource origin = source == null ? ChunkSource.unknown() : source;
    ChunkProvenance provenance =
        ChunkProvenance.builder()
            .sourceFileId(origin.fileId())
            .sourceFileName(origin.fileName())
            .chunkingMethod(
                config.isPreferSemanticBoundaries()
                    ? ChunkingMethod.HYBRID
                    : ChunkingMethod.STRUCTURAL)
            .createdAt(Instant.now())
            .build();

    List<DocumentChunk> chunks = new ArrayList<>(drafts.size());
    for (int i = 0; i < drafts.size(); i++) {
      DraftChunk draft = drafts.get(i);
      chunks.add(
          DocumentChunk.builder()
              .id(documentId + "_chunk_" + i)
              .documentId(documentId)
              .content(draft.content())
              .tokens(draft.tokens())
              .position(i)
              .headingPath(draft.headingPath())
              .hierarchyLevel(draft.level())
              .chunkType(draft.type())
              .semanticDensity(draft.density())
              .topicKeywords(keywordExtractor.extract(draft.content(), CHUNK_KEYWORDS))
              .metadata(provenance)
              .build());
    }
    return chunks;
  }
}
