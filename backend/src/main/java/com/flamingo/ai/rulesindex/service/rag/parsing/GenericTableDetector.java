package com.flamingo.ai.rulesindex.service.rag.parsing;

import com.flamingo.ai.rulesindex.service.rag.model.Confidence;
import com.flamingo.ai.rulesindex.service.rag.model.TableType;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Last resort for column-aligned text: the first tab or wide-gap line is the header row.
 *
 * <p>Gets no title and low confidence.
 */
@Component
@Order(4)
public class GenericTableDetector implements TableDetector {

  private static final int MIN_COLUMNS = 2;
  private static final int MIN_ROWS = 2;
  private static final int SCAN_WINDOW = 30;

  private static final Pattern WIDE_GAP = Pattern.compile("\\s{3,}");
  private static final Pattern TABS = Pattern.compile("\\t+");

  @Override
  public boolean triggers(String line) {
    return line.indexOf('\t') >= 0 || WIDE_GAP.matcher(line).find();
  }

  @Override
  public Optional<TableCandidate> detect(List<String> lines, int startIndex) {
    String headerLine = lines.get(startIndex).trim();
    Pattern separator = headerLine.indexOf('\t') >= 0 ? TABS : WIDE_GAP;
    List<String> headers = columns(headerLine, separator);
    if (headers.size() < MIN_COLUMNS) {
      return Optional.empty();
    }

    List<Map<String, String>> rows = new ArrayList<>();
    int last = Math.min(lines.size(), startIndex + SCAN_WINDOW);
    for (int i = startIndex + 1; i < last; i++) {
      String line = lines.get(i).trim();
      if (line.isEmpty()) {
        if (rows.size() >= MIN_ROWS) {
          break;
        }
        continue;
      }
      List<String> values = columns(line, separator);
      if (values.size() >= headers.size() - 1) {
        Map<String, String> row = new LinkedHashMap<>();
        for (int h = 0; h < headers.size(); h++) {
          row.put(headers.get(h), h < values.size() ? values.get(h) : "");
        }
        rows.add(row);
      } else if (rows.size() >= MIN_ROWS) {
        break;
      }
    }

    if (rows.size() < MIN_ROWS) {
      return Optional.empty();
    }

    return Optional.of(
        new TableCandidate(
            startIndex,
            startIndex + rows.size() + 1,
            TableDetector.joinLines(lines, startIndex, startIndex + rows.size() + 1),
            null,
            TableDetector.joinLines(lines, startIndex - 2, startIndex),
            TableType.GENERIC,
            Confidence.LOW,
            rows));
  }

  private static List<String> columns(String line, Pattern separator) {
    return Arrays.stream(separator.split(line))
        .map(String::trim)
        .filter(s -> !s.isEmpty())
        .toList();
  }
}
