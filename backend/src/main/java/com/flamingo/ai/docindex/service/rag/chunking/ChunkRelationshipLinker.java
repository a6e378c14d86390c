package com.flamingo.ai.docindex.service.rag.chunking;

import com.flamingo.ai.docindex.service.rag.model.DocumentChunk;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Links chunks of one document to their neighbours in reading order and in the heading tree.
 *
 * <p>Siblings share the hierarchy level and the parent part of the heading path. Children sit one
 * level deeper and their heading path starts with the parent's full path.
 */
@Component
public class ChunkRelationshipLinker {

  public List<DocumentChunk> link(List<DocumentChunk> chunks) {
    List<DocumentChunk> linked = new ArrayList<>(chunks.size());
    for (int i = 0; i < chunks.size(); i++) {
      DocumentChunk chunk = chunks.get(i);
      linked.add(
          chunk.toBuilder()
              .previousChunkId(i > 0 ? chunks.get(i - 1).getId() : null)
              .nextChunkId(i < chunks.size() - 1 ? chunks.get(i + 1).getId() : null)
              .siblingChunkIds(siblings(chunk, chunks))
              .childChunkIds(children(chunk, chunks))
              .build());
    }
    return List.copyOf(linked);
  }

  private List<String> siblings(DocumentChunk chunk, List<DocumentChunk> all) {
    List<String> parentPath = parentPath(chunk.getHeadingPath());
    return all.stream()
        .filter(other -> other != chunk)
        .filter(other -> other.getHierarchyLevel() == chunk.getHierarchyLevel())
        .filter(other -> parentPath(other.getHeadingPath()).equals(parentPath))
        .map(DocumentChunk::getId)
        .toList();
  }

  private List<String> children(DocumentChunk chunk, List<DocumentChunk> all) {
    List<String> path = chunk.getHeadingPath();
    return all.stream()
        .filter(other -> other.getHierarchyLevel() == chunk.getHierarchyLevel() + 1)
        .filter(other -> startsWith(other.getHeadingPath(), path))
        .map(DocumentChunk::getId)
        .toList();
  }

  private static boolean startsWith(List<String> path, List<String> prefix) {
    return path.size() >= prefix.size() && path.subList(0, prefix.size()).equals(prefix);
  }

  private static List<String> parentPath(List<String> path) {
    return path.isEmpty() ? path : path.subList(0, path.size() - 1);
  }
}
