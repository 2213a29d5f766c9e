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
 * Recognizes profile lines such as {@code M  WS  BS  S  T  W  I  A  Ld} followed by value rows.
 *
 * <p>Columns are separated by two or more spaces or a tab. A value row may be one column short.
 */
@Component
@Order(2)
public class StatsTableDetector implements TableDetector {

  private static final int MIN_HEADERS = 3;
  private static final int MAX_ROWS = 20;
  private static final int TITLE_LOOKBACK = 3;
  private static final int MAX_TITLE_LENGTH = 60;

  private static final Pattern STAT_TRIGGER =
      Pattern.compile("\\b(M|WS|BS|S|T|W|I|A|Ld)\\b", Pattern.CASE_INSENSITIVE);
  private static final Pattern STAT_HEADER =
      Pattern.compile(
          "\\b(M|WS|BS|S|T|W|I|A|Ld|Sv|Mv|Rng|Acc|Str|AP|Dmg)\\b", Pattern.CASE_INSENSITIVE);
  private static final Pattern COLUMN_GAP = Pattern.compile("\\s{2,}|\\t");

  @Override
  public boolean triggers(String line) {
    return STAT_TRIGGER.matcher(line).find();
  }

  @Override
  public Optional<TableCandidate> detect(List<String> lines, int startIndex) {
    List<String> headers = columns(lines.get(startIndex).trim());
    if (headers.size() < MIN_HEADERS) {
      return Optional.empty();
    }

    String titleGuess = null;
    for (int i = startIndex - 1; i >= Math.max(0, startIndex - TITLE_LOOKBACK); i--) {
      String line = lines.get(i).trim();
      if (!line.isEmpty()
          && !STAT_HEADER.matcher(line).find()
          && line.length() < MAX_TITLE_LENGTH) {
        titleGuess = line;
        break;
      }
    }

    List<Map<String, String>> rows = new ArrayList<>();
    int last = Math.min(lines.size(), startIndex + 1 + MAX_ROWS);
    for (int i = startIndex + 1; i < last; i++) {
      String line = lines.get(i).trim();
      if (line.isEmpty()) {
        if (!rows.isEmpty()) {
          break;
        }
        continue;
      }
      List<String> values = columns(line);
      if (values.size() >= headers.size() - 1) {
        Map<String, String> row = new LinkedHashMap<>();
        for (int h = 0; h < headers.size(); h++) {
          row.put(headers.get(h), h < values.size() ? values.get(h) : "");
        }
        rows.add(row);
      } else if (!rows.isEmpty()) {
        break;
      }
    }

    if (rows.isEmpty()) {
      return Optional.empty();
    }

    return Optional.of(
        new TableCandidate(
            startIndex,
            startIndex + rows.size() + 1,
            TableDetector.joinLines(lines, startIndex - 2, startIndex + rows.size() + 2),
            titleGuess != null ? titleGuess : "Stats Table",
            TableDetector.joinLines(lines, startIndex - 2, startIndex),
            TableType.STATS_TABLE,
            Confidence.HIGH,
            rows));
  }

  private static List<String> columns(String line) {
    return Arrays.stream(COLUMN_GAP.split(line))
        .map(String::trim)
        .filter(s -> !s.isEmpty())
        .toList();
  }
}
