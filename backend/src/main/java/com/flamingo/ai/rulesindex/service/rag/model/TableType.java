package com.flamingo.ai.rulesindex.service.rag.model;

/** Kind of table recognized in rulebook text. */
public enum TableType {
  ROLL_TABLE("roll table"),
  STATS_TABLE("stats table"),
  EQUIPMENT("equipment"),
  GENERIC("generic");

  private final String keyword;

  TableType(String keyword) {
    this.keyword = keyword;
  }

  /** Keyword stamped on every table of this kind. */
  public String keyword() {
    return keyword;
  }
}
