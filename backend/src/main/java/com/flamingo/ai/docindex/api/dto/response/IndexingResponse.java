package com.flamingo.ai.docindex.api.dto.response;

import com.flamingo.ai.docindex.service.document.IndexingReport;
import com.flamingo.ai.docindex.service.rag.model.ChunkingResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for an indexed document. Chunk bodies are not echoed back. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IndexingResponse {

  private String projectId;
  private String documentId;
  private Integer totalChunks;
  private Integer totalTokens;
  private Double averageChunkSize;
  private Double semanticCoherence;
  private Double hierarchyPreservation;
  private Long replacedChunks;
  private Boolean degraded;
  private String message;

  /** Creates an IndexingResponse from an indexing report. */
  public static IndexingResponse fromReport(IndexingReport report) {
    ChunkingResult chunking = report.getChunking();
    return IndexingResponse.builder()
        .projectId(report.getProjectId())
        .documentId(report.getDocumentId())
        .totalChunks(chunking.getTotalChunks())
        .totalTokens(chunking.getTotalTokens())
        .averageChunkSize(chunking.getAverageChunkSize())
        .semanticCoherence(chunking.getSemanticCoherence())
        .hierarchyPreservation(chunking.getHierarchyPreservation())
        .replacedChunks(report.getReplacedChunks())
        .degraded(report.isDegraded())
        .message(report.getMessage())
        .build();
  }
}
