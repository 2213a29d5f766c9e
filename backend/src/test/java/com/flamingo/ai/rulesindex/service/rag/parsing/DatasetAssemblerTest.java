package com.flamingo.ai.rulesindex.service.rag.parsing;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.rulesindex.service.rag.model.Confidence;
import com.flamingo.ai.rulesindex.service.rag.model.DatasetRow;
import com.flamingo.ai.rulesindex.service.rag.model.DatasetType;
import com.flamingo.ai.rulesindex.service.rag.model.RulesDataset;
import com.flamingo.ai.rulesindex.service.rag.model.RulesTable;
import com.flamingo.ai.rulesindex.service.rag.model.TableType;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("DatasetAssembler Tests")
class DatasetAssemblerTest {

  private final DatasetAssembler assembler = new DatasetAssembler();

  @Test
  @DisplayName("should pool equipment rows across tables with the union of their columns")
  void shouldPoolEquipmentRows() {
    RulesTable weapons =
        table(
            2,
            TableType.EQUIPMENT,
            Confidence.MEDIUM,
            List.of("equipment", "weapon"),
            List.of(Map.of("Name", "Sword", "Cost", "10 gc")));
    RulesTable armour =
        table(
            5,
            TableType.GENERIC,
            Confidence.MEDIUM,
            List.of("generic", "equipment"),
            List.of(Map.of("Name", "Helmet", "Save", "6+")));

    List<RulesDataset> datasets = assembler.assemble("rules", List.of(weapons, armour));

    assertThat(datasets).hasSize(1);
    RulesDataset equipment = datasets.get(0);
    assertThat(equipment.name()).isEqualTo("Equipment");
    assertThat(equipment.type()).isEqualTo(DatasetType.EQUIPMENT);
    assertThat(equipment.sourceId()).isEqualTo("rules");
    assertThat(equipment.confidence()).isEqualTo(Confidence.HIGH);
    assertThat(equipment.fields()).containsExactlyInAnyOrder("Name", "Cost", "Save");
    assertThat(equipment.rows()).extracting(DatasetRow::pageNumber).containsExactly(2, 5);
  }

  @Test
  @DisplayName("should leave low-confidence tables out of equipment and injuries but not skills")
  void shouldFilterLowConfidenceTables() {
    List<Map<String, String>> rows = List.of(Map.of("Roll", "1", "Result", "Dead"));
    RulesTable lowEquipment =
        table(1, TableType.GENERIC, Confidence.LOW, List.of("generic", "equipment"), rows);
    RulesTable lowInjury =
        table(1, TableType.GENERIC, Confidence.LOW, List.of("generic", "injury"), rows);
    RulesTable lowSkill =
        table(1, TableType.GENERIC, Confidence.LOW, List.of("generic", "skill"), rows);

    List<RulesDataset> datasets =
        assembler.assemble("rules", List.of(lowEquipment, lowInjury, lowSkill));

    assertThat(datasets).extracting(RulesDataset::type).containsExactly(DatasetType.SKILLS);
    assertThat(datasets.get(0).confidence()).isEqualTo(Confidence.MEDIUM);
  }

  @Test
  @DisplayName("should give injury datasets the roll and result fields")
  void shouldUseRollAndResultFieldsForInjuries() {
    RulesTable injuries =
        table(
            3,
            TableType.ROLL_TABLE,
            Confidence.HIGH,
            List.of("roll table", "serious", "injury"),
            List.of(Map.of("Roll", "11-15", "Result", "Dead")));

    List<RulesDataset> datasets = assembler.assemble("rules", List.of(injuries));

    assertThat(datasets).hasSize(1);
    assertThat(datasets.get(0).name()).isEqualTo("Injuries");
    assertThat(datasets.get(0).fields()).containsExactly("Roll", "Result");
    assertThat(datasets.get(0).rows().get(0).data()).containsEntry("Result", "Dead");
  }

  @Test
  @DisplayName("should produce no datasets when no table matches")
  void shouldProduceNothingWithoutMatches() {
    RulesTable stats =
        table(
            1,
            TableType.STATS_TABLE,
            Confidence.HIGH,
            List.of("stats table"),
            List.of(Map.of("M", "4")));

    assertThat(assembler.assemble("rules", List.of(stats))).isEmpty();
    assertThat(assembler.assemble("rules", List.of())).isEmpty();
  }

  private static RulesTable table(
      int page,
      TableType type,
      Confidence confidence,
      List<String> keywords,
      List<Map<String, String>> rows) {
    return new RulesTable(
        "rules", null, null, "", page, "", rows, type, confidence, keywords);
  }
}
