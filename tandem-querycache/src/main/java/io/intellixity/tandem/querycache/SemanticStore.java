package io.intellixity.tandem.querycache;

/** Embedding/vector store that indexes cached responses for semantic search. */
@FunctionalInterface
public interface SemanticStore {
  void store(String text);

  static SemanticStore none() {
    return text -> { };
  }
}
