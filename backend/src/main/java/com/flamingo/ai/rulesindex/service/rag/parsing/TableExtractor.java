package com.flamingo.ai.rulesindex.service.rag.parsing;

import com.flamingo.ai.rulesindex.service.rag.model.PageText;
import com.flamingo.ai.rulesindex.service.rag.model.RulesTable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Finds roll, stats, equipment and column-aligned tables in page text.
 *
 * <p>Pages are scanned line by line. Each unclaimed line is offered to the {@link TableDetector}s
 * in order; the first detector whose trigger fires and which finds enough rows claims the lines it
 * covers. Detection works on uncleaned text since column gaps are significant.
 */
@Service
@Slf4j
public class TableExtractor {

  /** Terms stamped as keywords when they occur in a table's raw text. */
  static final List<String> TABLE_TERMS =
      List.of(
          "injury", "exploration", "advancement", "skill", "loot",
          "encounter", "event", "critical", "fumble", "misfire",
          "weapon", "armour", "armor", "equipment", "spell");

  private static final int MIN_TITLE_WORD_LENGTH = 4;
  private static final Pattern LINE_BREAK = Pattern.compile("\\r?\\n");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private final List<TableDetector> detectors;

  public TableExtractor(List<TableDetector> detectors) {
    this.detectors = List.copyOf(detectors);
  }

  /**
   * Detects tables on every non-blank page.
   *
   * @param sourceId id stamped on every table
   * @param pages pages in ascending page order
   * @return tables in page then line order
   */
  public List<RulesTable> extract(String sourceId, List<PageText> pages) {
    List<RulesTable> tables = new ArrayList<>();
    for (PageText page : pages) {
      if (!page.isBlank()) {
        tables.addAll(extract(sourceId, null, page));
      }
    }
    return tables;
  }

  /**
   * Detects tables in one block of text.
   *
   * @param sourceId id stamped on every table
   * @param sectionId section the text belongs to, or {@code null}
   * @param page the text and the page number stamped on every table
   */
  public List<RulesTable> extract(String sourceId, String sectionId, PageText page) {
    List<String> lines = Arrays.asList(LINE_BREAK.split(page.text(), -1));
    Set<Integer> claimed = new HashSet<>();
    List<RulesTable> tables = new ArrayList<>();

    for (int i = 0; i < lines.size(); i++) {
      if (claimed.contains(i)) {
        continue;
      }
      String line = lines.get(i).trim();
      if (line.isEmpty()) {
        continue;
      }

      Optional<TableCandidate> found = Optional.empty();
      for (TableDetector detector : detectors) {
        if (detector.triggers(line)) {
          found = detector.detect(lines, i);
          if (found.isPresent()) {
            break;
          }
        }
      }

      if (found.isPresent()) {
        TableCandidate candidate = found.get();
        for (int j = candidate.startLine(); j <= candidate.endLine(); j++) {
          claimed.add(j);
        }
        tables.add(toTable(sourceId, sectionId, page.pageNumber(), candidate));
      }
    }

    if (!tables.isEmpty()) {
      log.debug("Found {} tables on page {} of {}", tables.size(), page.pageNumber(), sourceId);
    }
    return tables;
  }

  private static RulesTable toTable(
      String sourceId, String sectionId, int pageNumber, TableCandidate candidate) {
    return new RulesTable(
        sourceId,
        sectionId,
        candidate.titleGuess(),
        candidate.headerContext(),
        pageNumber,
        candidate.rawText(),
        candidate.rows(),
        candidate.type(),
        candidate.confidence(),
        keywords(candidate));
  }

  private static List<String> keywords(TableCandidate candidate) {
    Set<String> keywords = new LinkedHashSet<>();
    keywords.add(candidate.type().keyword());
    if (candidate.titleGuess() != null) {
      for (String word : WHITESPACE.split(candidate.titleGuess().toLowerCase(Locale.ROOT))) {
        if (word.length() >= MIN_TITLE_WORD_LENGTH) {
          keywords.add(word);
        }
      }
    }
    String raw = candidate.rawText().toLowerCase(Locale.ROOT);
    for (String term : TABLE_TERMS) {
      if (raw.contains(term)) {
        keywords.add(term);
      }
    }
    return List.copyOf(keywords);
  }
}
