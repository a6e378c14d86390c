package com.flamingo.ai.docindex.domain.enums;

/** Structural classification of a parsed document line or block. */
public enum NodeType {
  /** Markdown or numbered heading. */
  HEADING,

  /** Running prose. Also the fallback for anything unrecognised. */
  PARAGRAPH,

  /** Bulleted or numbered list item(s). */
  LIST,

  /** Pipe-delimited table row(s). */
  TABLE,

  /** Fenced, indented or inline-backtick code. */
  CODE,

  /** Plain text that carries no markup of its own. */
  TEXT
}
