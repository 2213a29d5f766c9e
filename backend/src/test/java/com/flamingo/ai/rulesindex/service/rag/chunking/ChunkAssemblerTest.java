package com.flamingo.ai.rulesindex.service.rag.chunking;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.rulesindex.config.IndexingConfig;
import com.flamingo.ai.rulesindex.service.rag.annotation.KeywordExtractor;
import com.flamingo.ai.rulesindex.service.rag.annotation.ScoreHintAnalyzer;
import com.flamingo.ai.rulesindex.service.rag.model.PageText;
import com.flamingo.ai.rulesindex.service.rag.model.RulesChunk;
import com.flamingo.ai.rulesindex.service.rag.model.RulesSection;
import com.flamingo.ai.rulesindex.service.rag.model.ScoreHints;
import com.flamingo.ai.rulesindex.service.rag.model.TextSpan;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

@DisplayName("ChunkAssembler Tests")
class ChunkAssemblerTest {

  private ChunkAssembler assembler;

  @BeforeEach
  void setUp() {
    IndexingConfig config = new IndexingConfig();
    config.getChunking().setTargetSize(1000);
    config.getChunking().setMinSize(500);
    config.getChunking().setMaxSize(1500);
    config.getChunking().setOverlapSize(150);
    TextSegmenter segmenter =
        new TextSegmenter(
            new KeywordExtractor(config), new ScoreHintAnalyzer(), new BreakPointFinder(), config);
    assembler = new ChunkAssembler(segmenter);
  }

  @Test
  @DisplayName("should chunk page by page when no sections were found")
  void shouldChunkPagesWhenNoSections() {
    List<PageText> pages =
        List.of(
            new PageText("Combat Rules. Roll 1d6 to hit.", 1),
            new PageText("  ", 2),
            new PageText("Morale is tested on 2D6.", 3));

    List<RulesChunk> chunks = assembler.assemble("rules", pages, List.of());

    assertThat(chunks).hasSize(2);
    assertThat(chunks).extracting(RulesChunk::pageStart).containsExactly(1, 3);
    assertThat(chunks).extracting(RulesChunk::orderIndex).containsExactly(0, 1);
    assertThat(chunks)
        .allSatisfy(
            chunk -> {
              assertThat(chunk.sectionId()).isNull();
              assertThat(chunk.sectionPath()).isEmpty();
              assertThat(chunk.pageEnd()).isEqualTo(chunk.pageStart());
            });
    assertThat(chunks.get(0).scoreHints().hasDiceNotation()).isTrue();
    assertThat(chunks.get(0).keywords()).contains("roll", "combat");
  }

  @Test
  @DisplayName("should chunk section bodies and skip sections without text")
  void shouldChunkSectionBodies() {
    List<RulesSection> sections =
        List.of(
            section(0, "COMBAT", 2, "Roll to hit."),
            section(1, "ARMOUR", 3, null),
            section(2, "SHOOTING", 4, "Ranged attacks use ballistic skill."));

    List<RulesChunk> chunks = assembler.assemble("rules", List.of(), sections);

    assertThat(chunks).hasSize(2);
    assertThat(chunks).extracting(RulesChunk::sectionId).containsExactly("rules#0", "rules#2");
    assertThat(chunks).extracting(RulesChunk::pageStart).containsExactly(2, 4);
    assertThat(chunks.get(1).sectionPath()).containsExactly("SHOOTING");
    assertThat(chunks).extracting(RulesChunk::orderIndex).containsExactly(0, 1);
  }

  @Test
  @DisplayName("should number chunks without gaps across multi-chunk sections")
  void shouldNumberChunksWithoutGaps() {
    List<RulesSection> sections =
        List.of(
            section(0, "COMBAT", 1, TextSegmenterTest.words(3500)),
            section(1, "SHOOTING", 2, "Short body."),
            section(2, "MORALE", 3, TextSegmenterTest.words(2500)));

    List<RulesChunk> chunks = assembler.assemble("rules", List.of(), sections);

    assertThat(chunks).hasSizeGreaterThan(3);
    for (int i = 0; i < chunks.size(); i++) {
      assertThat(chunks.get(i).orderIndex()).isEqualTo(i);
    }
    assertThat(chunks)
        .extracting(RulesChunk::sectionId)
        .containsSubsequence("rules#0", "rules#1", "rules#2");
  }

  @Test
  @DisplayName("should produce no chunks when every section is empty")
  void shouldProduceNoChunksWhenAllSectionsEmpty() {
    List<PageText> pages = List.of(new PageText("ARMOUR\nWEAPONS", 1));
    List<RulesSection> sections =
        List.of(section(0, "ARMOUR", 1, null), section(1, "WEAPONS", 1, "  "));

    List<RulesChunk> chunks = assembler.assemble("rules", pages, sections);

    assertThat(chunks).isEmpty();
  }

  @Test
  @DisplayName("should pass the running chunk count as start index of each span")
  void shouldPassRunningCountAsStartIndex() {
    TextSegmenter segmenter = mock(TextSegmenter.class);
    when(segmenter.segment(any(TextSpan.class), eq(0)))
        .thenReturn(List.of(chunk(0), chunk(1), chunk(2)));
    when(segmenter.segment(any(TextSpan.class), eq(3))).thenReturn(List.of(chunk(3)));
    ChunkAssembler mocked = new ChunkAssembler(segmenter);
    List<PageText> pages = List.of(new PageText("Page one.", 1), new PageText("Page two.", 2));

    List<RulesChunk> chunks = mocked.assemble("rules", pages, List.of());

    assertThat(chunks).extracting(RulesChunk::orderIndex).containsExactly(0, 1, 2, 3);
    InOrder order = inOrder(segmenter);
    order.verify(segmenter).segment(TextSpan.ofPage("rules", pages.get(0)), 0);
    order.verify(segmenter).segment(TextSpan.ofPage("rules", pages.get(1)), 3);
    verify(segmenter, never()).segment(any(TextSpan.class), eq(1));
  }

  private static RulesSection section(int ordinal, String title, int page, String text) {
    return new RulesSection(
        RulesSection.idFor("rules", ordinal),
        "rules",
        title,
        1,
        List.of(title),
        page,
        page,
        text,
        List.of());
  }

  private static RulesChunk chunk(int orderIndex) {
    return new RulesChunk(
        "rules", null, "text", 1, 1, List.of(), orderIndex, List.of(), ScoreHints.none());
  }
}
