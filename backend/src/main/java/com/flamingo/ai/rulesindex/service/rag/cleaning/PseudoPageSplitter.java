package com.flamingo.ai.rulesindex.service.rag.cleaning;

import com.flamingo.ai.rulesindex.config.IndexingConfig;
import com.flamingo.ai.rulesindex.service.rag.model.PageText;
import com.flamingo.ai.rulesindex.service.rag.model.SourceDocument;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * Turns unpaginated text, such as a pasted rules summary, into pseudo pages so it can go through
 * the page-based pipeline.
 *
 * <p>Paragraphs are packed greedily; a page is closed when the next paragraph would push it past
 * the configured size. A single paragraph longer than that becomes a page of its own.
 */
@Service
@RequiredArgsConstructor
public class PseudoPageSplitter {

  private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\\n\\n+");
  private static final String PARAGRAPH_SEPARATOR = "\n\n";

  private final IndexingConfig indexingConfig;

  /**
   * Splits text into pages numbered from 1.
   *
   * @param text unpaginated text; {@code null} or blank yields no pages
   */
  public List<PageText> split(String text) {
    List<PageText> pages = new ArrayList<>();
    if (text == null || text.isBlank()) {
      return pages;
    }
    int pageSize = indexingConfig.getCleaning().getPseudoPageSize();

    StringBuilder current = new StringBuilder();
    for (String paragraph : PARAGRAPH_BREAK.split(text)) {
      if (current.length() > 0
          && current.length() + paragraph.length() + PARAGRAPH_SEPARATOR.length() > pageSize) {
        addPage(pages, current);
        current.setLength(0);
        current.append(paragraph);
      } else {
        if (current.length() > 0) {
          current.append(PARAGRAPH_SEPARATOR);
        }
        current.append(paragraph);
      }
    }
    addPage(pages, current);
    return pages;
  }

  /** Wraps {@link #split} output as a source ready for {@code BatchIndexingService}. */
  public SourceDocument toSourceDocument(String sourceId, String text) {
    return new SourceDocument(sourceId, split(text));
  }

  private static void addPage(List<PageText> pages, StringBuilder content) {
    String pageText = content.toString().trim();
    if (!pageText.isEmpty()) {
      pages.add(new PageText(pageText, pages.size() + 1));
    }
  }
}
