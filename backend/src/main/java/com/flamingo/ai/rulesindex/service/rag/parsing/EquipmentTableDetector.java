package com.flamingo.ai.rulesindex.service.rag.parsing;

import com.flamingo.ai.rulesindex.service.rag.model.Confidence;
import com.flamingo.ai.rulesindex.service.rag.model.TableType;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Recognizes price lists: {@code Sword  10 gc  +1 to hit} or {@code Helmet - 10 gc}.
 *
 * <p>Rows become {@code Name} / {@code Cost} / {@code Effect}. Lines without a price inside the
 * scanned window are skipped rather than ending the table.
 */
@Component
@Order(3)
public class EquipmentTableDetector implements TableDetector {

  private static final int MIN_ROWS = 3;
  private static final int SCAN_WINDOW = 30;
  private static final int TITLE_LOOKBACK = 3;

  private static final Pattern PRICE_TRIGGER =
      Pattern.compile("\\d+\\s*(gc|gold|pts?|points?)", Pattern.CASE_INSENSITIVE);
  private static final Pattern PRICED_ROW =
      Pattern.compile(
          "^(.+?)\\s+(\\d+)\\s*(gc|gold|pts?|points?)(\\s+.+)?$", Pattern.CASE_INSENSITIVE);
  private static final Pattern DASHED_PRICE_ROW =
      Pattern.compile("^(.+?)\\s*[-–]\\s*(\\d+)\\s*(gc|gold|pts?)$", Pattern.CASE_INSENSITIVE);
  private static final Pattern TITLE_HINT =
      Pattern.compile("equipment|weapon|armour|armor|item|gear", Pattern.CASE_INSENSITIVE);

  @Override
  public boolean triggers(String line) {
    return PRICE_TRIGGER.matcher(line).find();
  }

  @Override
  public Optional<TableCandidate> detect(List<String> lines, int startIndex) {
    String titleGuess = null;
    for (int i = startIndex - 1; i >= Math.max(0, startIndex - TITLE_LOOKBACK); i--) {
      String line = lines.get(i).trim();
      if (TITLE_HINT.matcher(line).find()) {
        titleGuess = line;
        break;
      }
    }

    int tableStart = -1;
    List<Map<String, String>> rows = new ArrayList<>();
    int last = Math.min(lines.size(), startIndex + SCAN_WINDOW);
    for (int i = startIndex; i < last; i++) {
      String line = lines.get(i).trim();
      if (line.isEmpty()) {
        if (rows.size() >= MIN_ROWS) {
          break;
        }
        continue;
      }
      Map<String, String> row = parseRow(line);
      if (row != null) {
        if (tableStart == -1) {
          tableStart = i;
        }
        rows.add(row);
      }
    }

    if (rows.size() < MIN_ROWS) {
      return Optional.empty();
    }

    return Optional.of(
        new TableCandidate(
            tableStart,
            tableStart + rows.size(),
            TableDetector.joinLines(lines, tableStart - 2, tableStart + rows.size() + 1),
            titleGuess != null ? titleGuess : "Equipment",
            TableDetector.joinLines(lines, tableStart - 2, tableStart),
            TableType.EQUIPMENT,
            Confidence.MEDIUM,
            rows));
  }

  private static Map<String, String> parseRow(String line) {
    Matcher priced = PRICED_ROW.matcher(line);
    if (priced.matches()) {
      String effect = priced.group(4);
      return row(
          priced.group(1),
          priced.group(2) + " " + priced.group(3),
          effect != null ? effect.trim() : "");
    }
    Matcher dashed = DASHED_PRICE_ROW.matcher(line);
    if (dashed.matches()) {
      return row(dashed.group(1), dashed.group(2) + " " + dashed.group(3), "");
    }
    return null;
  }

  private static Map<String, String> row(String name, String cost, String effect) {
    Map<String, String> row = new LinkedHashMap<>();
    row.put("Name", name.trim());
    row.put("Cost", cost);
    row.put("Effect", effect);
    return row;
  }
}
