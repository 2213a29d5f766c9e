package com.flamingo.ai.rulesindex.service.rag.cleaning;

import com.flamingo.ai.rulesindex.config.IndexingConfig;
import com.flamingo.ai.rulesindex.service.rag.model.PageText;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Removes text-extraction artifacts from page text before section detection.
 *
 * <p>Per page: line endings are normalized, page-number lines and copyright lines are dropped,
 * space runs collapse to one space, control characters are stripped and runs of blank lines are
 * reduced to a single blank line, so paragraph breaks survive. Tabs are left alone since they mark
 * table layout.
 *
 * <p>Across pages: a line appearing near the top or bottom of most pages is taken to be a running
 * header or footer and removed everywhere.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PageTextCleaner {

  private static final Pattern LINE_BREAK = Pattern.compile("\\r\\n?");
  private static final Pattern BARE_PAGE_NUMBER = Pattern.compile("(?m)^[ \\t]*\\d+[ \\t]*$");
  private static final Pattern PAGE_LABEL =
      Pattern.compile("(?im)^[ \\t]*page[ \\t]+\\d+[ \\t]*$");
  private static final Pattern DASHED_PAGE_NUMBER =
      Pattern.compile("(?m)^[ \\t]*-[ \\t]*\\d+[ \\t]*-[ \\t]*$");
  private static final Pattern COPYRIGHT_LINE = Pattern.compile("(?m)^.*©.*$");
  private static final Pattern RIGHTS_RESERVED_LINE =
      Pattern.compile("(?im)^.*all rights reserved.*$");
  private static final Pattern SPACE_RUN = Pattern.compile(" {2,}");
  private static final Pattern LEADING_SPACES = Pattern.compile("(?m)^ +");
  private static final Pattern TRAILING_SPACES = Pattern.compile("(?m) +$");
  private static final Pattern CONTROL_CHARS =
      Pattern.compile("[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]");
  private static final Pattern EXCESS_BLANK_LINES = Pattern.compile("\\n{3,}");

  /** Lines at least this long are never treated as running headers or footers. */
  private static final int MAX_REPEATED_LINE_LENGTH = 100;

  private final IndexingConfig indexingConfig;

  /**
   * Cleans every page of a source. Page numbers and page count are preserved; a page may come back
   * with empty text.
   *
   * @param pages pages in ascending page order
   * @return cleaned pages, or {@code pages} itself when cleaning is disabled
   */
  public List<PageText> clean(List<PageText> pages) {
    IndexingConfig.Cleaning cleaning = indexingConfig.getCleaning();
    if (!cleaning.isEnabled() || pages.isEmpty()) {
      return pages;
    }

    List<String> texts = new ArrayList<>(pages.size());
    for (PageText page : pages) {
      texts.add(cleanText(page.text()));
    }
    texts = removeRepeatedHeadersFooters(texts, cleaning);

    List<PageText> cleaned = new ArrayList<>(pages.size());
    for (int i = 0; i < pages.size(); i++) {
      cleaned.add(new PageText(texts.get(i), pages.get(i).pageNumber()));
    }
    return cleaned;
  }

  /** Strips extraction artifacts from a single page. */
  public String cleanText(String text) {
    if (text == null || text.isEmpty()) {
      return "";
    }
    String cleaned = LINE_BREAK.matcher(text).replaceAll("\n");
    cleaned = BARE_PAGE_NUMBER.matcher(cleaned).replaceAll("");
    cleaned = PAGE_LABEL.matcher(cleaned).replaceAll("");
    cleaned = DASHED_PAGE_NUMBER.matcher(cleaned).replaceAll("");
    cleaned = COPYRIGHT_LINE.matcher(cleaned).replaceAll("");
    cleaned = RIGHTS_RESERVED_LINE.matcher(cleaned).replaceAll("");
    cleaned = SPACE_RUN.matcher(cleaned).replaceAll(" ");
    cleaned = LEADING_SPACES.matcher(cleaned).replaceAll("");
    cleaned = TRAILING_SPACES.matcher(cleaned).replaceAll("");
    cleaned = CONTROL_CHARS.matcher(cleaned).replaceAll("");
    cleaned = EXCESS_BLANK_LINES.matcher(cleaned).replaceAll("\n\n");
    return cleaned.trim();
  }

  /**
   * Removes lines that recur near the edges of most pages.
   *
   * @param pages page texts in page order
   * @param cleaning thresholds
   * @return page texts without the repeated lines
   */
  List<String> removeRepeatedHeadersFooters(List<String> pages, IndexingConfig.Cleaning cleaning) {
    if (pages.size() < cleaning.getMinPagesForRepeatDetection()) {
      return pages;
    }

    Map<String, Integer> lineFrequency = new HashMap<>();
    for (String page : pages) {
      for (String line : edgeLines(page, cleaning.getEdgeLines())) {
        lineFrequency.merge(line, 1, Integer::sum);
      }
    }

    double threshold = pages.size() * cleaning.getRepeatedLineThreshold();
    Set<String> repeated = new HashSet<>();
    lineFrequency.forEach(
        (line, count) -> {
          if (count >= threshold && line.length() < MAX_REPEATED_LINE_LENGTH) {
            repeated.add(line);
          }
        });
    if (repeated.isEmpty()) {
      return pages;
    }
    log.debug(
        "Removing {} repeated header/footer lines across {} pages", repeated.size(), pages.size());

    List<String> result = new ArrayList<>(pages.size());
    for (String page : pages) {
      result.add(
          Arrays.stream(page.split("\n", -1))
              .filter(line -> !repeated.contains(normalize(line)))
              .collect(Collectors.joining("\n"))
              .trim());
    }
    return result;
  }

  private static Set<String> edgeLines(String page, int edgeLineCount) {
    String[] lines = page.split("\n", -1);
    Set<String> unique = new LinkedHashSet<>();
    int head = Math.min(edgeLineCount, lines.length);
    for (int i = 0; i < head; i++) {
      addIfPresent(unique, lines[i]);
    }
    for (int i = Math.max(0, lines.length - edgeLineCount); i < lines.length; i++) {
      addIfPresent(unique, lines[i]);
    }
    return unique;
  }

  private static void addIfPresent(Set<String> lines, String line) {
    String normalized = normalize(line);
    if (!normalized.isEmpty()) {
      lines.add(normalized);
    }
  }

  private static String normalize(String line) {
    return line.trim().toLowerCase(Locale.ROOT);
  }
}
