package com.flamingo.ai.docindex.api.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for indexing the extracted text of a document. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IndexDocumentRequest {

  @NotNull(message = "Text is required")
  @Size(max = 2_000_000, message = "Text must not exceed 2000000 characters")
  private String text;

  private String sourceFileId;

  @Size(max = 255, message = "File name must not exceed 255 characters")
  private String sourceFileName;

  @Valid private ChunkingConfigRequest config;
}
