package com.flamingo.ai.docindex.store;

import com.flamingo.ai.docindex.service.rag.model.DocumentChunk;

/**
 * A stored chunk with its similarity to a query vector.
 *
 * @param chunk the chunk
 * @param similarity cosine similarity in [0,1]
 */
public record ScoredChunk(DocumentChunk chunk, double similarity) {}
