package com.flamingo.ai.docindex.api.rest;

import com.flamingo.ai.docindex.api.dto.request.ChunkPreviewRequest;
import com.flamingo.ai.docindex.api.dto.request.ChunkingConfigRequest;
import com.flamingo.ai.docindex.api.dto.request.IndexDocumentRequest;
import com.flamingo.ai.docindex.api.dto.response.ChunkingResponse;
import com.flamingo.ai.docindex.api.dto.response.IndexingResponse;
import com.flamingo.ai.docindex.config.RagConfig;
import com.flamingo.ai.docindex.service.document.DocumentIndexingService;
import com.flamingo.ai.docindex.service.document.IndexingReport;
import com.flamingo.ai.docindex.service.rag.chunking.DocumentChunker;
import com.flamingo.ai.docindex.service.rag.model.ChunkSource;
import com.flamingo.ai.docindex.service.rag.model.ChunkingConfig;
import com.flamingo.ai.docindex.service.rag.model.ChunkingResult;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for chunking and indexing documents. */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class ChunkingController {

  private static final String PREVIEW_DOCUMENT_ID = "preview";

  private final DocumentChunker documentChunker;
  private final DocumentIndexingService indexingService;
  private final RagConfig ragConfig;

  /** Chunks text and returns the chunks without storing them. */
  @PostMapping("/chunking/preview")
  public ResponseEntity<ChunkingResponse> previewChunks(
      @Valid @RequestBody ChunkPreviewRequest request) {
    String documentId =
        request.getDocumentId() == null ? PREVIEW_DOCUMENT_ID : request.getDocumentId();
    ChunkingResult result =
        documentChunker.chunkDocument(
            request.getText(), documentId, ChunkSource.unknown(), config(request.getConfig()));
    return ResponseEntity.ok(ChunkingResponse.fromResult(result));
  }

  /** Chunks, embeds and stores a document, replacing its previous chunks. */
  @PostMapping("/projects/{projectId}/documents/{documentId}/chunks")
  public ResponseEntity<IndexingResponse> indexDocument(
      @PathVariable String projectId,
      @PathVariable String documentId,
      @Valid @RequestBody IndexDocumentRequest request) {
    IndexingReport report =
        indexingService.indexDocument(
            projectId,
            documentId,
            request.getText(),
            new ChunkSource(request.getSourceFileId(), request.getSourceFileName()),
            config(request.getConfig()));
    return ResponseEntity.status(HttpStatus.CREATED).body(IndexingResponse.fromReport(report));
  }

  /** Removes all chunks of a document. */
  @DeleteMapping("/projects/{projectId}/documents/{documentId}/chunks")
  public ResponseEntity<Void> deleteDocumentChunks(
      @PathVariable String projectId, @PathVariable String documentId) {
    indexingService.deleteDocument(projectId, documentId);
    return ResponseEntity.noContent().build();
  }

  private ChunkingConfig config(ChunkingConfigRequest overrides) {
    ChunkingConfig defaults = ChunkingConfig.fromProperties(ragConfig.getChunking());
    return overrides == null ? defaults : overrides.toConfig(defaults);
  }
}
