package com.flamingo.ai.rulesindex.service.rag.annotation;

import com.flamingo.ai.rulesindex.config.IndexingConfig;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Tags a text span with the domain terms it mentions.
 *
 * <p>Matching is a case-insensitive substring test against the configured vocabulary: no
 * tokenization, no stemming. A term is reported once however often it occurs, and terms come back
 * in vocabulary order so identical input always yields an identical list.
 */
@Service
public class KeywordExtractor {

  private final List<String> vocabulary;

  @Autowired
  public KeywordExtractor(IndexingConfig indexingConfig) {
    this(indexingConfig.getKeywords().getVocabulary());
  }

  KeywordExtractor(List<String> vocabulary) {
    Set<String> terms = new LinkedHashSet<>();
    for (String term : vocabulary) {
      if (term != null && !term.isBlank()) {
        terms.add(term.trim().toLowerCase(Locale.ROOT));
      }
    }
    this.vocabulary = List.copyOf(terms);
  }

  /**
   * Returns the vocabulary terms contained in {@code text}.
   *
   * @param text text to scan; {@code null} is treated as empty
   * @return matched terms without duplicates, in vocabulary order
   */
  public List<String> extractKeywords(String text) {
    if (text == null || text.isEmpty()) {
      return List.of();
    }
    String lowerText = text.toLowerCase(Locale.ROOT);
    List<String> keywords = new ArrayList<>();
    for (String term : vocabulary) {
      if (lowerText.contains(term)) {
        keywords.add(term);
      }
    }
    return keywords;
  }

  public List<String> getVocabulary() {
    return vocabulary;
  }
}
