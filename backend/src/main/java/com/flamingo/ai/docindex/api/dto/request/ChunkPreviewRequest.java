package com.flamingo.ai.docindex.api.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for chunking text without storing it. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChunkPreviewRequest {

  @NotNull(message = "Text is required")
  @Size(max = 2_000_000, message = "Text must not exceed 2000000 characters")
  private String text;

  /** Used as the chunk id prefix; defaults to "preview". */
  private String documentId;

  @Valid private ChunkingConfigRequest config;
}
