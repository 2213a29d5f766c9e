package com.flamingo.ai.rulesindex.service.rag.parsing;

import com.flamingo.ai.rulesindex.config.IndexingConfig;
import com.flamingo.ai.rulesindex.service.rag.model.PageText;
import com.flamingo.ai.rulesindex.service.rag.model.RulesSection;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Recovers a flat outline from rulebook page text, which carries no explicit markup.
 *
 * <p>All non-blank pages are flattened into one line sequence. Each line whose trimmed length lies
 * within the configured bounds is offered to the {@link HeaderHeuristic}s in order; the first match
 * makes it a header. A section's body is every line after its header up to, but excluding, the next
 * header (or the end of the document), joined across page boundaries and trimmed.
 *
 * <p>A header with nothing beneath it still yields a section, with {@code null} text, so it can
 * serve as a structural marker. A document without any detected header yields no sections and is
 * chunked page by page downstream.
 */
@Service
@Slf4j
public class SectionExtractor {

  private final List<HeaderHeuristic> heuristics;
  private final int minHeaderLength;
  private final int maxHeaderLength;

  public SectionExtractor(List<HeaderHeuristic> heuristics, IndexingConfig indexingConfig) {
    this.heuristics = List.copyOf(heuristics);
    this.minHeaderLength = indexingConfig.getSections().getMinHeaderLength();
    this.maxHeaderLength = indexingConfig.getSections().getMaxHeaderLength();
  }

  /**
   * Extracts sections from a source's pages.
   *
   * @param sourceId id stamped on every section and used to derive section ids
   * @param pages pages in ascending page order; blank pages are ignored
   * @return sections in detection order; empty if no header was found
   */
  public List<RulesSection> extract(String sourceId, List<PageText> pages) {
    List<PageLine> lines = flatten(pages);
    List<DetectedHeader> headers = detectHeaders(lines);

    List<RulesSection> sections = new ArrayList<>(headers.size());
    for (int i = 0; i < headers.size(); i++) {
      DetectedHeader header = headers.get(i);
      int bodyEnd = i + 1 < headers.size() ? headers.get(i + 1).lineIndex() : lines.size();

      String body = joinLines(lines, header.lineIndex() + 1, bodyEnd).trim();
      sections.add(
          new RulesSection(
              RulesSection.idFor(sourceId, i),
              sourceId,
              header.title(),
              header.level(),
              List.of(header.title()),
              lines.get(header.lineIndex()).pageNumber(),
              lines.get(bodyEnd - 1).pageNumber(),
              body.isEmpty() ? null : body,
              List.of()));
    }

    log.debug(
        "Detected {} sections in source {} ({} lines over {} pages)",
        sections.size(),
        sourceId,
        lines.size(),
        pages.size());
    return sections;
  }

  private List<PageLine> flatten(List<PageText> pages) {
    List<PageLine> lines = new ArrayList<>();
    for (PageText page : pages) {
      if (page.isBlank()) {
        continue;
      }
      String[] pageLines = page.text().split("\\r?\\n", -1);
      for (String line : pageLines) {
        lines.add(new PageLine(line, page.pageNumber()));
      }
    }
    return lines;
  }

  private List<DetectedHeader> detectHeaders(List<PageLine> lines) {
    List<DetectedHeader> headers = new ArrayList<>();
    for (int i = 0; i < lines.size(); i++) {
      String trimmed = lines.get(i).text().trim();
      if (trimmed.length() < minHeaderLength || trimmed.length() > maxHeaderLength) {
        continue;
      }
      String nextLine = i + 1 < lines.size() ? lines.get(i + 1).text().trim() : null;
      HeaderCandidate candidate = new HeaderCandidate(trimmed, nextLine);

      for (HeaderHeuristic heuristic : heuristics) {
        OptionalInt level = heuristic.classify(candidate);
        if (level.isPresent()) {
          log.trace("Line {} '{}' matched {}", i, trimmed, heuristic.getName());
          headers.add(new DetectedHeader(i, trimmed, level.getAsInt()));
          break;
        }
      }
    }
    return headers;
  }

  private static String joinLines(List<PageLine> lines, int fromInclusive, int toExclusive) {
    StringBuilder sb = new StringBuilder();
    for (int i = fromInclusive; i < toExclusive; i++) {
      sb.append(lines.get(i).text()).append('\n');
    }
    return sb.toString();
  }

  private record PageLine(String text, int pageNumber) {}

  private record DetectedHeader(int lineIndex, String title, int level) {}
}
