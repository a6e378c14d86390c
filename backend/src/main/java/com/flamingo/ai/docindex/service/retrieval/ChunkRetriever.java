package com.flamingo.ai.docindex.service.retrieval;

import com.flamingo.ai.docindex.config.RagConfig;
import com.flamingo.ai.docindex.domain.enums.ChunkRelation;
import com.flamingo.ai.docindex.domain.enums.ChunkType;
import com.flamingo.ai.docindex.domain.enums.RetrievalStrategy;
import com.flamingo.ai.docindex.exception.ChunkNotFoundException;
import com.flamingo.ai.docindex.exception.MalformedChunkDataException;
import com.flamingo.ai.docindex.exception.SearchException;
import com.flamingo.ai.docindex.service.rag.embedding.TextEmbedder;
import com.flamingo.ai.docindex.service.rag.model.DocumentChunk;
import com.flamingo.ai.docindex.service.retrieval.HierarchicalQueryParser.HierarchyHints;
import com.flamingo.ai.docindex.store.ChunkFilter;
import com.flamingo.ai.docindex.store.ChunkVectorStore;
import com.flamingo.ai.docindex.store.ScoredChunk;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Query strategies over the stored chunks of a project.
 *
 * <ul>
 *   <li>{@code SEMANTIC}: vector search, hits below the similarity threshold dropped.
 *   <li>{@code HIERARCHICAL}: level and heading cues read from the query, ordered by level then
 *       position.
 *   <li>{@code HYBRID}: semantic and hierarchical hits merged and reranked with structural bonuses.
 *   <li>{@code CONTEXTUAL}: semantic hits with their neighbouring chunks attached.
 *   <li>{@code KEYWORD}: literal term matching, exact phrase matches first.
 * </ul>
 *
 * <p>When the store fails or returns undecodable records a strategy returns an empty result
 * instead of a partial one.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ChunkRetriever {

  private static final double HYBRID_SIMILARITY_WEIGHT = 0.7;
  private static final double TOP_LEVEL_BONUS = 0.3;
  private static final double HEADING_BONUS = 0.2;
  private static final int MIN_TERM_LENGTH = 3;

  private final ChunkVectorStore chunkStore;
  private final TextEmbedder textEmbedder;
  private final HierarchicalQueryParser queryParser;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  /**
   * Retrieves chunks for a query.
   *
   * @param projectId project to search
   * @param query free-text query
   * @param strategy retrieval strategy
   * @param options result count, thresholds and filters
   * @return the hits, empty when the store could not answer
   */
  @Timed(value = "retrieval.query", description = "Time to retrieve chunks")
  public RetrievalResult retrieveChunks(
      String projectId, String query, RetrievalStrategy strategy, RetrievalOptions options) {
    long start = System.currentTimeMillis();
    meterRegistry.counter("retrieval.requests", "strategy", strategy.name()).increment();
    try {
      Hits hits =
          switch (strategy) {
            case SEMANTIC -> semantic(projectId, query, options);
            case HIERARCHICAL -> hierarchical(projectId, query, options);
            case HYBRID -> hybrid(projectId, query, options);
            case CONTEXTUAL -> withContext(projectId, semantic(projectId, query, options), options);
            case KEYWORD -> keyword(projectId, query, options);
          };
      if (options.isIncludeContext() && strategy != RetrievalStrategy.CONTEXTUAL) {
        hits = withContext(projectId, hits, options);
      }
      long elapsed = System.currentTimeMillis() - start;
      log.debug(
          "{} retrieval in project {} returned {} of {} hits in {}ms",
          strategy,
          projectId,
          hits.chunks().size(),
          hits.totalFound(),
          elapsed);
      return RetrievalResult.builder()
          .chunks(hits.chunks())
          .totalFound(hits.totalFound())
          .strategy(strategy)
          .processingTimeMs(elapsed)
          .aggregatedMetadata(AggregatedMetadata.of(hits.chunks()))
          .build();
    } catch (MalformedChunkDataException e) {
      log.warn(
          "Discarding {} results, store returned malformed data: {}", strategy, e.getMessage());
      meterRegistry.counter("retrieval.empty", "reason", "malformed").increment();
      return RetrievalResult.empty(strategy, System.currentTimeMillis() - start);
    } catch (SearchException e) {
      log.warn("Discarding {} results, store unavailable: {}", strategy, e.getMessage());
      meterRegistry.counter("retrieval.empty", "reason", "unavailable").increment();
      return RetrievalResult.empty(strategy, System.currentTimeMillis() - start);
    }
  }

  // ---- strategies ----

  private Hits semantic(String projectId, String query, RetrievalOptions options) {
    float[] vector = textEmbedder.embedQuery(query);
    List<RetrievedChunk> hits = new ArrayList<>();
    for (ScoredChunk scored :
        chunkStore.query(vector, options.getMaxResults(), baseFilter(projectId, options))) {
      if (scored.similarity() >= options.getSimilarityThreshold()) {
        hits.add(
            RetrievedChunk.builder()
                .chunk(scored.chunk())
                .similarity(scored.similarity())
                .score(scored.similarity())
                .build());
      }
    }
    return new Hits(hits, hits.size());
  }

  private Hits hierarchical(String projectId, String query, RetrievalOptions options) {
    HierarchyHints hints = queryParser.parse(query);
    if (hints.isEmpty()) {
      log.debug("No structural cues in query '{}'", query);
      return new Hits(List.of(), 0);
    }
    List<DocumentChunk> matches = new ArrayList<>();
    if (hints.heading() != null) {
      ChunkFilter byHeading =
          baseFilter(projectId, options).toBuilder().headingPathContains(hints.heading()).build();
      for (DocumentChunk chunk : scan(byHeading)) {
        if (queryParser.matchesHeading(chunk.getHeadingPath(), hints.heading())) {
          matches.add(chunk);
        }
      }
    }
    if (hints.level() != null) {
      ChunkFilter byLevel =
          baseFilter(projectId, options).toBuilder().hierarchyLevel(hints.level()).build();
      matches.addAll(scan(byLevel));
    }

    Map<String, DocumentChunk> byId = new LinkedHashMap<>();
    matches.forEach(chunk -> byId.putIfAbsent(chunk.getId(), chunk));
    List<DocumentChunk> unique = new ArrayList<>(byId.values());
    unique.sort(
        Comparator.comparingInt(DocumentChunk::getHierarchyLevel)
            .thenComparingInt(DocumentChunk::getPosition)
            .thenComparing(DocumentChunk::getDocumentId));
    List<RetrievedChunk> hits =
        unique.stream()
            .limit(options.getMaxResults())
            .map(chunk -> RetrievedChunk.builder().chunk(chunk).score(0.0).build())
            .toList();
    return new Hits(hits, unique.size());
  }

  private Hits hybrid(String projectId, String query, RetrievalOptions options) {
    int requested = options.getMaxResults();
    double share = ragConfig.getRetrieval().getSemanticShare();
    int semanticCount = (int) Math.ceil(requested * share);
    int hierarchicalCount = (int) Math.ceil(requested * (1.0 - share));

    List<RetrievedChunk> combined = new ArrayList<>();
    combined.addAll(
        semantic(projectId, query, options.toBuilder().maxResults(semanticCount).build()).chunks());
    combined.addAll(
        hierarchical(projectId, query, options.toBuilder().maxResults(hierarchicalCount).build())
            .chunks());

    List<RetrievedChunk> reranked =
        dedupe(combined).stream()
            .map(hit -> hit.toBuilder().score(hybridScore(hit)).build())
            .sorted(Comparator.comparingDouble(RetrievedChunk::getScore).reversed())
            .toList();
    return new Hits(reranked.stream().limit(requested).toList(), reranked.size());
  }

  private static double hybridScore(RetrievedChunk hit) {
    double similarity = hit.getSimilarity() == null ? 0.0 : hit.getSimilarity();
    DocumentChunk chunk = hit.getChunk();
    return HYBRID_SIMILARITY_WEIGHT * similarity
        + (chunk.getHierarchyLevel() == 1 ? TOP_LEVEL_BONUS : 0.0)
        + (chunk.getChunkType() == ChunkType.HEADING ? HEADING_BONUS : 0.0);
  }

  private Hits withContext(String projectId, Hits hits, RetrievalOptions options) {
    int window = options.getContextWindow();
    List<RetrievedChunk> expanded = new ArrayList<>(hits.chunks().size());
    for (RetrievedChunk hit : hits.chunks()) {
      DocumentChunk chunk = hit.getChunk();
      ChunkFilter neighbours =
          ChunkFilter.builder()
              .projectId(projectId)
              .documentId(chunk.getDocumentId())
              .minPosition(chunk.getPosition() - window)
              .maxPosition(chunk.getPosition() + window)
              .build();
      List<DocumentChunk> context =
          chunkStore.getByFilter(neighbours, 2 * window + 1).stream()
              .filter(other -> !other.getId().equals(chunk.getId()))
              .toList();
      expanded.add(hit.toBuilder().context(context).build());
    }
    return new Hits(expanded, hits.totalFound());
  }

  private Hits keyword(String projectId, String query, RetrievalOptions options) {
    List<String> terms = queryTerms(query);
    if (terms.isEmpty()) {
      return new Hits(List.of(), 0);
    }
    String phrase = query.strip().toLowerCase(Locale.ROOT);
    ChunkFilter filter = baseFilter(projectId, options).toBuilder().anyTerms(terms).build();

    List<KeywordMatch> matches = new ArrayList<>();
    for (DocumentChunk chunk : scan(filter)) {
      String content = chunk.getContent().toLowerCase(Locale.ROOT);
      int matched = 0;
      for (String term : terms) {
        if (content.contains(term) || chunk.getTopicKeywords().contains(term)) {
          matched++;
        }
      }
      if (matched > 0) {
        matches.add(new KeywordMatch(chunk, content.contains(phrase), matched));
      }
    }

    matches.sort(
        Comparator.comparing(KeywordMatch::phrase)
            .reversed()
            .thenComparing(Comparator.comparingInt(KeywordMatch::matchedTerms).reversed())
            .thenComparing(m -> m.chunk().getDocumentId())
            .thenComparingInt(m -> m.chunk().getPosition()));

    List<RetrievedChunk> hits =
        matches.stream()
            .limit(options.getMaxResults())
            .map(
                m ->
                    RetrievedChunk.builder()
                        .chunk(m.chunk())
                        .score(m.phrase() ? 1.0 : (double) m.matchedTerms() / terms.size())
                        .build())
            .toList();
    return new Hits(hits, matches.size());
  }

  /** Every chunk matching the filter in document order, read page by page. */
  private List<DocumentChunk> scan(ChunkFilter filter) {
    int pageSize = Math.max(1, ragConfig.getRetrieval().getScanPageSize());
    List<DocumentChunk> chunks = new ArrayList<>();
    ChunkFilter page = filter;
    while (true) {
      List<DocumentChunk> batch = chunkStore.getByFilter(page, pageSize);
      chunks.addAll(batch);
      if (batch.size() < pageSize) {
        return chunks;
      }
      page = filter.after(batch.get(batch.size() - 1));
    }
  }

  /** Lowercase query words longer than two characters, punctuation removed, in query order. */
  static List<String> queryTerms(String query) {
    if (query == null) {
      return List.of();
    }
    List<String> terms = new ArrayList<>();
    for (String word : query.toLowerCase(Locale.ROOT).replaceAll("[^\\w\\s]", "").split("\\s+")) {
      if (word.length() >= MIN_TERM_LENGTH && !terms.contains(word)) {
        terms.add(word);
      }
    }
    return terms;
  }

  // ---- structure browsing ----

  /**
   * Rebuilds a table of contents from the stored heading chunks.
   *
   * <p>Each heading chunk nests under the closest earlier heading of the same document whose path
   * is a proper prefix of its own. Repeated heading paths within a document are listed once.
   */
  @Timed(value = "retrieval.browse", description = "Time to build a table of contents")
  public TableOfContents browseByStructure(String projectId, BrowseOptions options) {
    ChunkFilter filter =
        ChunkFilter.builder().projectId(projectId).documentId(options.getDocumentId()).build();
    List<DocumentChunk> chunks = scan(filter);

    List<TocNode> roots = new ArrayList<>();
    Map<String, List<TocNode>> byDocument = new HashMap<>();
    Map<String, TocNode> byPath = new HashMap<>();
    int total = 0;
    for (DocumentChunk chunk : chunks) {
      if (chunk.getChunkType() != ChunkType.HEADING || chunk.getHeadingPath().isEmpty()) {
        continue;
      }
      if (options.getMaxDepth() != null && chunk.getHierarchyLevel() > options.getMaxDepth()) {
        continue;
      }
      String key = chunk.getDocumentId() + "\u0000" + chunk.headingPathText();
      if (byPath.containsKey(key)) {
        continue;
      }
      TocNode node = new TocNode(chunk);
      byPath.put(key, node);
      total++;
      List<TocNode> documentNodes =
          byDocument.computeIfAbsent(chunk.getDocumentId(), d -> new ArrayList<>());
      TocNode parent = closestAncestor(documentNodes, chunk.getHeadingPath());
      if (parent == null) {
        roots.add(node);
      } else {
        parent.children.add(node);
      }
      documentNodes.add(node);
    }

    if (options.isIncludeContent()) {
      for (DocumentChunk chunk : chunks) {
        if (chunk.getChunkType() == ChunkType.HEADING) {
          continue;
        }
        TocNode owner =
            closestAncestor(
                byDocument.getOrDefault(chunk.getDocumentId(), List.of()), chunk.getHeadingPath());
        if (owner != null) {
          owner.contentChunkIds.add(chunk.getId());
        }
      }
    }

    return TableOfContents.builder()
        .entries(roots.stream().map(TocNode::toEntry).toList())
        .totalHeadings(total)
        .build();
  }

  /** Node with the longest heading path that prefixes {@code path}; the latest wins ties. */
  private static TocNode closestAncestor(List<TocNode> candidates, List<String> path) {
    TocNode best = null;
    for (TocNode candidate : candidates) {
      List<String> candidatePath = candidate.chunk.getHeadingPath();
      boolean prefix =
          candidatePath.size() <= path.size()
              && path.subList(0, candidatePath.size()).equals(candidatePath);
      if (prefix && (best == null || candidatePath.size() >= best.chunk.getHeadingPath().size())) {
        best = candidate;
      }
    }
    return best;
  }

  /**
   * Looks up one stored chunk.
   *
   * @throws ChunkNotFoundException if the project has no chunk with that id
   */
  public DocumentChunk getChunk(String projectId, String chunkId) {
    return chunkStore
        .getById(projectId, chunkId)
        .orElseThrow(() -> new ChunkNotFoundException(projectId, chunkId));
  }

  // ---- related chunks ----

  /**
   * Chunks related to one chunk: siblings, parent and children in its document, then semantically
   * similar chunks anywhere in the project. The source chunk is never part of the result.
   *
   * @throws ChunkNotFoundException if the project has no chunk with that id
   */
  @Timed(value = "retrieval.related", description = "Time to find related chunks")
  public List<RetrievedChunk> getRelatedChunks(
      String projectId, String chunkId, RelatedChunksOptions options) {
    DocumentChunk source = getChunk(projectId, chunkId);

    List<RetrievedChunk> related = new ArrayList<>();
    if (options.isIncludeSiblings()) {
      for (String id : source.getSiblingChunkIds()) {
        chunkStore
            .getById(projectId, id)
            .ifPresent(c -> related.add(relatedHit(c, ChunkRelation.SIBLING)));
      }
    }
    if (options.isIncludeParentChildren()) {
      findParent(projectId, source)
          .ifPresent(parent -> related.add(relatedHit(parent, ChunkRelation.PARENT)));
      for (String id : source.getChildChunkIds()) {
        chunkStore
            .getById(projectId, id)
            .ifPresent(c -> related.add(relatedHit(c, ChunkRelation.CHILD)));
      }
    }
    if (options.isIncludeSemantic()) {
      float[] vector = textEmbedder.embedPassages(List.of(source.getContent())).vectors().get(0);
      List<ScoredChunk> similar =
          chunkStore.query(vector, options.getMaxResults() + 1, ChunkFilter.forProject(projectId));
      for (ScoredChunk scored : similar) {
        if (scored.similarity() >= options.getSimilarityThreshold()) {
          related.add(
              RetrievedChunk.builder()
                  .chunk(scored.chunk())
                  .similarity(scored.similarity())
                  .score(scored.similarity())
                  .relation(ChunkRelation.SEMANTIC)
                  .build());
        }
      }
    }

    return dedupe(related).stream()
        .filter(hit -> !hit.getId().equals(chunkId))
        .limit(options.getMaxResults())
        .toList();
  }

  /**
   * Preceding chunk one level up whose heading path is the parent part of the source's. The
   * section's heading chunk wins over its content chunks; otherwise the nearest one is taken.
   */
  private Optional<DocumentChunk> findParent(String projectId, DocumentChunk source) {
    if (source.getHierarchyLevel() == 0) {
      return Optional.empty();
    }
    List<String> parentPath = source.getHeadingPath().subList(0, source.getHierarchyLevel() - 1);
    ChunkFilter filter =
        ChunkFilter.builder()
            .projectId(projectId)
            .documentId(source.getDocumentId())
            .hierarchyLevel(source.getHierarchyLevel() - 1)
            .maxPosition(source.getPosition())
            .build();
    List<DocumentChunk> candidates =
        scan(filter).stream()
            .filter(candidate -> candidate.getHeadingPath().equals(parentPath))
            .toList();
    return candidates.stream()
        .filter(candidate -> candidate.getChunkType() == ChunkType.HEADING)
        .reduce((first, second) -> second)
        .or(() -> candidates.stream().reduce((first, second) -> second));
  }

  private static RetrievedChunk relatedHit(DocumentChunk chunk, ChunkRelation relation) {
    return RetrievedChunk.builder().chunk(chunk).score(0.0).relation(relation).build();
  }

  // ---- shared helpers ----

  private static ChunkFilter baseFilter(String projectId, RetrievalOptions options) {
    return ChunkFilter.builder()
        .projectId(projectId)
        .documentId(options.getDocumentId())
        .chunkType(options.getChunkType())
        .hierarchyLevel(options.getHierarchyLevel())
        .headingPathContains(options.getHeadingPath())
        .build();
  }

  /** Keeps the first hit per chunk id. */
  private static List<RetrievedChunk> dedupe(List<RetrievedChunk> hits) {
    Map<String, RetrievedChunk> unique = new LinkedHashMap<>();
    for (RetrievedChunk hit : hits) {
      unique.putIfAbsent(hit.getId(), hit);
    }
    return new ArrayList<>(unique.values());
  }

  private record Hits(List<RetrievedChunk> chunks, int totalFound) {}

  private record KeywordMatch(DocumentChunk chunk, boolean phrase, int matchedTerms) {}

  /** Mutable table-of-contents node used while the tree is built. */
  private static final class TocNode {
    private final DocumentChunk chunk;
    private final List<TocNode> children = new ArrayList<>();
    private final List<String> contentChunkIds = new ArrayList<>();

    private TocNode(DocumentChunk chunk) {
      this.chunk = chunk;
    }

    private StructureEntry toEntry() {
      List<String> path = chunk.getHeadingPath();
      return StructureEntry.builder()
          .chunkId(chunk.getId())
          .documentId(chunk.getDocumentId())
          .title(path.get(path.size() - 1))
          .headingPath(path)
          .level(chunk.getHierarchyLevel())
          .position(chunk.getPosition())
          .contentChunkIds(List.copyOf(contentChunkIds))
          .children(children.stream().map(TocNode::toEntry).toList())
          .build();
    }
  }
}
