package com.flamingo.ai.docindex.api.rest;

import com.flamingo.ai.docindex.api.dto.request.ChunkSearchRequest;
import com.flamingo.ai.docindex.config.RagConfig;
import com.flamingo.ai.docindex.service.rag.model.DocumentChunk;
import com.flamingo.ai.docindex.service.retrieval.BrowseOptions;
import com.flamingo.ai.docindex.service.retrieval.ChunkRetriever;
import com.flamingo.ai.docindex.service.retrieval.RelatedChunksOptions;
import com.flamingo.ai.docindex.service.retrieval.RetrievalOptions;
import com.flamingo.ai.docindex.service.retrieval.RetrievalResult;
import com.flamingo.ai.docindex.service.retrieval.RetrievedChunk;
import com.flamingo.ai.docindex.service.retrieval.TableOfContents;
import jakarta.validation.Valid;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for searching and browsing the chunks of a project. */
@RestController
@RequestMapping("/api/projects/{projectId}")
@RequiredArgsConstructor
public class RetrievalController {

  private final ChunkRetriever chunkRetriever;
  private final RagConfig ragConfig;

  /** Searches chunks with the requested strategy. */
  @PostMapping("/search")
  public ResponseEntity<RetrievalResult> search(
      @PathVariable String projectId, @Valid @RequestBody ChunkSearchRequest request) {
    RetrievalOptions options =
        request.toOptions(RetrievalOptions.defaults(ragConfig.getRetrieval()));
    return ResponseEntity.ok(
        chunkRetriever.retrieveChunks(
            projectId, request.getQuery(), request.strategyOrDefault(), options));
  }

  /** Returns the heading tree of the project or of one document. */
  @GetMapping("/hierarchy")
  public ResponseEntity<TableOfContents> getHierarchy(
      @PathVariable String projectId,
      @RequestParam(required = false) String documentId,
      @RequestParam(required = false) Integer maxDepth,
      @RequestParam(defaultValue = "false") boolean includeContent) {
    BrowseOptions options =
        BrowseOptions.builder()
            .documentId(documentId)
            .maxDepth(maxDepth)
            .includeContent(includeContent)
            .build();
    return ResponseEntity.ok(chunkRetriever.browseByStructure(projectId, options));
  }

  /** Gets a chunk by ID. */
  @GetMapping("/chunks/{chunkId}")
  public ResponseEntity<DocumentChunk> getChunk(
      @PathVariable String projectId, @PathVariable String chunkId) {
    return ResponseEntity.ok(chunkRetriever.getChunk(projectId, chunkId));
  }

  /** Returns chunks related to a chunk by structure or meaning. */
  @GetMapping("/chunks/{chunkId}/related")
  public ResponseEntity<List<RetrievedChunk>> getRelatedChunks(
      @PathVariable String projectId,
      @PathVariable String chunkId,
      @RequestParam(required = false) Boolean includeSiblings,
      @RequestParam(required = false) Boolean includeParentChildren,
      @RequestParam(required = false) Boolean includeSemantic,
      @RequestParam(required = false) Double similarityThreshold,
      @RequestParam(required = false) Integer maxResults) {
    RelatedChunksOptions defaults = RelatedChunksOptions.defaults(ragConfig.getRetrieval());
    RelatedChunksOptions options =
        defaults.toBuilder()
            .includeSiblings(orDefault(includeSiblings, defaults.isIncludeSiblings()))
            .includeParentChildren(
                orDefault(includeParentChildren, defaults.isIncludeParentChildren()))
            .includeSemantic(orDefault(includeSemantic, defaults.isIncludeSemantic()))
            .similarityThreshold(
                similarityThreshold == null
                    ? defaults.getSimilarityThreshold()
                    : similarityThreshold)
            .maxResults(maxResults == null ? defaults.getMaxResults() : maxResults)
            .build();
    return ResponseEntity.ok(chunkRetriever.getRelatedChunks(projectId, chunkId, options));
  }

  private static boolean orDefault(Boolean value, boolean fallback) {
    return value == null ? fallback : value;
  }
}
