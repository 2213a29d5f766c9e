package com.flamingo.ai.rulesindex.service.rag.parsing;

import com.flamingo.ai.rulesindex.service.rag.model.Confidence;
import com.flamingo.ai.rulesindex.service.rag.model.TableType;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Recognizes dice result tables such as
 *
 * <pre>
 * SERIOUS INJURIES
 * 1-2: Dead
 * 3: Captured
 * 4-6: Full recovery
 * </pre>
 *
 * <p>Rows are {@code Roll} / {@code Result} pairs. An unnumbered line inside the table continues
 * the previous result. A D6 range or a two-digit D66 roll makes the table high confidence.
 */
@Component
@Order(1)
public class RollTableDetector implements TableDetector {

  static final String ROLL = "Roll";
  static final String RESULT = "Result";

  private static final int MIN_ROWS = 3;
  private static final int TITLE_LOOKBACK = 5;
  private static final int MAX_TITLE_LENGTH = 60;

  private static final Pattern RANGE_TRIGGER = Pattern.compile("^\\d+\\s*[-–:]\\s*\\d*");
  private static final Pattern DIE_FACE_TRIGGER =
      Pattern.compile("^[1-6]\\s*[-–]?\\s*[1-6]?\\s*[:\\s]");

  private static final Pattern RANGE_ROW =
      Pattern.compile("^(\\d+)\\s*[-–]\\s*(\\d+)[:\\s]+(.+)$");
  private static final Pattern SINGLE_ROW = Pattern.compile("^(\\d+)[:\\s]+(.+)$");
  private static final Pattern D66_ROW = Pattern.compile("^(\\d{2})\\s*[-–]?\\s*(.+)$");
  private static final Pattern TWO_DIGITS = Pattern.compile("\\d{2}");
  private static final Pattern LEADING_DIGIT = Pattern.compile("^\\d");

  @Override
  public boolean triggers(String line) {
    return RANGE_TRIGGER.matcher(line).find() || DIE_FACE_TRIGGER.matcher(line).find();
  }

  @Override
  public Optional<TableCandidate> detect(List<String> lines, int startIndex) {
    String titleGuess = findTitle(lines, startIndex);

    int tableStart = -1;
    List<Map<String, String>> rows = new ArrayList<>();
    for (int i = startIndex; i < lines.size(); i++) {
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
      } else if (tableStart != -1) {
        if (!LEADING_DIGIT.matcher(line).find() && !rows.isEmpty()) {
          Map<String, String> last = rows.get(rows.size() - 1);
          last.put(RESULT, last.get(RESULT) + " " + line);
        } else if (rows.size() >= MIN_ROWS) {
          break;
        }
      }
    }

    if (rows.size() < MIN_ROWS) {
      return Optional.empty();
    }

    boolean hasD6 = rows.size() == 6 || rows.stream().anyMatch(r -> r.get(ROLL).contains("-"));
    boolean hasD66 = rows.stream().anyMatch(r -> TWO_DIGITS.matcher(r.get(ROLL)).matches());
    String defaultTitle = hasD66 ? "D66 Table" : "D6 Table";

    return Optional.of(
        new TableCandidate(
            tableStart,
            tableStart + rows.size(),
            TableDetector.joinLines(lines, tableStart - 2, tableStart + rows.size() + 1),
            titleGuess != null ? titleGuess : defaultTitle,
            TableDetector.joinLines(lines, tableStart - 3, tableStart),
            TableType.ROLL_TABLE,
            hasD6 || hasD66 ? Confidence.HIGH : Confidence.MEDIUM,
            rows.stream().map(Collections::unmodifiableMap).toList()));
  }

  private static String findTitle(List<String> lines, int startIndex) {
    for (int i = startIndex - 1; i >= Math.max(0, startIndex - TITLE_LOOKBACK); i--) {
      String line = lines.get(i).trim();
      if (!line.isEmpty()
          && !LEADING_DIGIT.matcher(line).find()
          && line.length() < MAX_TITLE_LENGTH) {
        return line;
      }
    }
    return null;
  }

  private static Map<String, String> parseRow(String line) {
    Matcher range = RANGE_ROW.matcher(line);
    if (range.matches()) {
      return row(range.group(1) + "-" + range.group(2), range.group(3));
    }
    Matcher single = SINGLE_ROW.matcher(line);
    if (single.matches()) {
      return row(single.group(1), single.group(2));
    }
    Matcher d66 = D66_ROW.matcher(line);
    if (d66.matches()) {
      return row(d66.group(1), d66.group(2));
    }
    return null;
  }

  private static Map<String, String> row(String roll, String result) {
    Map<String, String> row = new LinkedHashMap<>();
    row.put(ROLL, roll);
    row.put(RESULT, result.trim());
    return row;
  }
}
