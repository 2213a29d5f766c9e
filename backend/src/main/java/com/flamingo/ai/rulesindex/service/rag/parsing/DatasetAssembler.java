package com.flamingo.ai.rulesindex.service.rag.parsing;

import com.flamingo.ai.rulesindex.service.rag.model.Confidence;
import com.flamingo.ai.rulesindex.service.rag.model.DatasetRow;
import com.flamingo.ai.rulesindex.service.rag.model.DatasetType;
import com.flamingo.ai.rulesindex.service.rag.model.RulesDataset;
import com.flamingo.ai.rulesindex.service.rag.model.RulesTable;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.springframework.stereotype.Service;

/**
 * Pools the rows of related tables into source-wide datasets: equipment, skills and injuries.
 *
 * <p>A table joins a dataset when its keywords carry the dataset's keyword. Equipment and injury
 * datasets ignore low-confidence tables. A dataset with no rows is not produced.
 */
@Service
public class DatasetAssembler {

  private record DatasetRule(
      String name,
      DatasetType type,
      String keyword,
      boolean acceptsLowConfidence,
      List<String> fixedFields,
      Confidence confidence) {}

  private static final List<DatasetRule> RULES =
      List.of(
          new DatasetRule(
              "Equipment", DatasetType.EQUIPMENT, "equipment", false, null, Confidence.HIGH),
          new DatasetRule("Skills", DatasetType.SKILLS, "skill", true, null, Confidence.MEDIUM),
          new DatasetRule(
              "Injuries",
              DatasetType.INJURIES,
              "injury",
              false,
              List.of(RollTableDetector.ROLL, RollTableDetector.RESULT),
              Confidence.HIGH));

  public List<RulesDataset> assemble(String sourceId, List<RulesTable> tables) {
    List<RulesDataset> datasets = new ArrayList<>();
    for (DatasetRule rule : RULES) {
      List<DatasetRow> rows = new ArrayList<>();
      Set<String> fields = new LinkedHashSet<>();
      for (RulesTable table : tables) {
        if (!table.keywords().contains(rule.keyword())) {
          continue;
        }
        if (table.confidence() == Confidence.LOW && !rule.acceptsLowConfidence()) {
          continue;
        }
        for (Map<String, String> row : table.parsedRows()) {
          rows.add(new DatasetRow(row, table.pageNumber()));
          fields.addAll(row.keySet());
        }
      }
      if (!rows.isEmpty()) {
        datasets.add(
            new RulesDataset(
                sourceId,
                rule.name(),
                rule.type(),
                rule.fixedFields() != null ? rule.fixedFields() : List.copyOf(fields),
                rule.confidence(),
                rows));
      }
    }
    return datasets;
  }
}
