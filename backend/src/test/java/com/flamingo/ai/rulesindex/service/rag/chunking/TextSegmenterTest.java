package com.flamingo.ai.rulesindex.service.rag.chunking;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.rulesindex.config.IndexingConfig;
import com.flamingo.ai.rulesindex.service.rag.annotation.KeywordExtractor;
import com.flamingo.ai.rulesindex.service.rag.annotation.ScoreHintAnalyzer;
import com.flamingo.ai.rulesindex.service.rag.model.RulesChunk;
import com.flamingo.ai.rulesindex.service.rag.model.TextSpan;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("TextSegmenter Tests")
class TextSegmenterTest {

  private static final int TARGET = 1000;
  private static final int MIN = 500;
  private static final int MAX = 1500;
  private static final int OVERLAP = 150;
  private static final int WINDOW = 50;

  private static final String[] WORDS = {
    "the", "warband", "marches", "through", "ruined", "streets", "of", "a", "burning", "city"
  };

  private TextSegmenter segmenter;

  @BeforeEach
  void setUp() {
    segmenter = segmenter(TARGET, MIN, MAX, OVERLAP, WINDOW);
  }

  @Test
  @DisplayName("should emit short span as a single trimmed chunk")
  void shouldEmitShortSpanWhole() {
    TextSpan span =
        new TextSpan("rules-1", "  Combat Rules.  \n", 4, List.of("COMBAT"), "rules-1#0");

    List<RulesChunk> chunks = segmenter.segment(span, 3);

    assertThat(chunks).hasSize(1);
    RulesChunk chunk = chunks.get(0);
    assertThat(chunk.text()).isEqualTo("Combat Rules.");
    assertThat(chunk.sourceId()).isEqualTo("rules-1");
    assertThat(chunk.sectionId()).isEqualTo("rules-1#0");
    assertThat(chunk.sectionPath()).containsExactly("COMBAT");
    assertThat(chunk.pageStart()).isEqualTo(4);
    assertThat(chunk.pageEnd()).isEqualTo(4);
    assertThat(chunk.orderIndex()).isEqualTo(3);
  }

  @Test
  @DisplayName("should emit nothing for blank span")
  void shouldEmitNothingForBlankSpan() {
    assertThat(segmenter.segment(new TextSpan("s", " \n\t ", 1, null, null), 0)).isEmpty();
    assertThat(segmenter.segment(new TextSpan("s", null, 1, null, null), 0)).isEmpty();
  }

  @Test
  @DisplayName("should split long paragraph-free text at word boundaries within max size")
  void shouldSplitAtWordBoundaries() {
    String text = words(5000);

    List<RulesChunk> chunks = segmenter.segment(new TextSpan("s", text, 2, null, null), 0);

    assertThat(chunks).hasSizeGreaterThan(1);
    assertThat(chunks)
        .allSatisfy(chunk -> assertThat(chunk.text().length()).isLessThanOrEqualTo(MAX));
    assertThat(chunks.get(0).text()).startsWith(text.substring(0, 50));
    assertThat(chunks.get(chunks.size() - 1).text()).endsWith(text.substring(text.length() - 50));
    for (RulesChunk chunk : chunks) {
      assertThat(text).contains(chunk.text());
      // chunks end on a whole word
      String[] tokens = chunk.text().split(" ");
      assertThat(WORDS).contains(tokens[tokens.length - 1]);
    }
  }

  @Test
  @DisplayName("should repeat the overlap tail of each chunk at the start of the next")
  void shouldOverlapConsecutiveChunks() {
    List<RulesChunk> chunks = segmenter.segment(new TextSpan("s", words(5000), 1, null, null), 0);

    for (int i = 1; i < chunks.size(); i++) {
      String previous = chunks.get(i - 1).text();
      String shared = previous.substring(previous.length() - OVERLAP).trim();
      assertThat(shared.length()).isGreaterThanOrEqualTo(OVERLAP - 1);
      assertThat(chunks.get(i).text()).startsWith(shared);
    }
  }

  @Test
  @DisplayName("should prefer paragraph breaks over word boundaries")
  void shouldPreferParagraphBreaks() {
    StringBuilder text = new StringBuilder();
    for (int i = 0; i < 12; i++) {
      if (i > 0) {
        text.append("\n\n");
      }
      text.append(("Rule " + i + " applies to every model in the warband. ").repeat(7).trim());
    }

    List<RulesChunk> chunks =
        segmenter.segment(new TextSpan("s", text.toString(), 1, null, null), 0);

    assertThat(chunks).hasSizeGreaterThan(1);
    assertThat(chunks).allSatisfy(chunk -> assertThat(chunk.text()).endsWith("."));
    assertThat(chunks)
        .allSatisfy(chunk -> assertThat(chunk.text().length()).isLessThanOrEqualTo(MAX));
    for (int i = 1; i < chunks.size(); i++) {
      String previous = chunks.get(i - 1).text();
      assertThat(chunks.get(i).text()).contains(previous.substring(previous.length() - 100));
    }
  }

  @Test
  @DisplayName("should number chunks consecutively from the start index")
  void shouldNumberChunksConsecutively() {
    List<RulesChunk> chunks = segmenter.segment(new TextSpan("s", words(4000), 1, null, null), 7);

    for (int i = 0; i < chunks.size(); i++) {
      assertThat(chunks.get(i).orderIndex()).isEqualTo(7 + i);
    }
  }

  @Test
  @DisplayName("should keep an indivisible token as one oversized chunk")
  void shouldKeepIndivisibleTokenWhole() {
    String token = "x".repeat(5000);

    List<RulesChunk> chunks = segmenter.segment(new TextSpan("s", token, 1, null, null), 0);

    assertThat(chunks).hasSize(1);
    assertThat(chunks.get(0).text()).hasSize(5000);
  }

  @Test
  @DisplayName("should give a run longer than max size a chunk of its own")
  void shouldIsolateOversizedRun() {
    String run = "y".repeat(3000);
    String text = words(1700) + " " + run + " " + words(1000);

    List<RulesChunk> chunks = segmenter.segment(new TextSpan("s", text, 1, null, null), 0);

    assertThat(chunks).anySatisfy(chunk -> assertThat(chunk.text()).isEqualTo(run));
    assertThat(chunks)
        .allSatisfy(
            chunk -> {
              if (chunk.text().length() > MAX) {
                assertThat(chunk.text()).isEqualTo(run);
              }
            });
    assertThat(chunks.get(chunks.size() - 1).text()).endsWith(text.substring(text.length() - 30));
    for (int i = 0; i < chunks.size(); i++) {
      assertThat(chunks.get(i).orderIndex()).isEqualTo(i);
    }
  }

  @Test
  @DisplayName("should start the oversized run chunk right after the preceding text")
  void shouldSplitTextBeforeOversizedRun() {
    String run = "y".repeat(3000);
    String text = words(1200) + " " + run + " " + words(1200);

    List<RulesChunk> chunks = segmenter.segment(new TextSpan("s", text, 1, null, null), 0);

    int runIndex = -1;
    for (int i = 0; i < chunks.size(); i++) {
      if (chunks.get(i).text().equals(run)) {
        runIndex = i;
      }
    }
    assertThat(runIndex).isPositive();
    assertThat(chunks.get(runIndex - 1).text()).doesNotContain("yy");
    assertThat(text).startsWith(chunks.get(0).text());
  }

  @Test
  @DisplayName("should extend chunk over a short run that straddles the target")
  void shouldExtendChunkOverShortRun() {
    String run = "z".repeat(200);
    String text = "abcd ".repeat(188) + run + " " + words(2000);

    List<RulesChunk> chunks = segmenter.segment(new TextSpan("s", text, 1, null, null), 0);

    assertThat(chunks.get(0).text()).endsWith(run);
    assertThat(chunks.get(0).text().length()).isLessThanOrEqualTo(MAX);
  }

  @Test
  @DisplayName("should advance past a break point that falls inside the overlap")
  void shouldAdvanceWhenOverlapWouldNotMoveForward() {
    TextSegmenter tight = segmenter(100, 60, 300, 55, 50);
    String text = "a".repeat(50) + " " + "b".repeat(300);

    List<RulesChunk> chunks = tight.segment(new TextSpan("s", text, 1, null, null), 0);

    assertThat(chunks)
        .extracting(RulesChunk::text)
        .containsExactly("a".repeat(50), "b".repeat(300));
    assertThat(chunks).extracting(RulesChunk::orderIndex).containsExactly(0, 1);
  }

  @Test
  @DisplayName("should annotate each chunk with keywords and score hints")
  void shouldAnnotateChunks() {
    List<RulesChunk> chunks =
        segmenter.segment(new TextSpan("s", "Roll 2D6 on the injury table.", 1, null, null), 0);

    RulesChunk chunk = chunks.get(0);
    assertThat(chunk.keywords()).containsExactly("injury", "d6", "roll", "table");
    assertThat(chunk.scoreHints().hasDiceNotation()).isTrue();
    assertThat(chunk.scoreHints().hasListPattern()).isNull();
  }

  @Test
  @DisplayName("should produce identical chunks on repeated runs")
  void shouldBeDeterministic() {
    TextSpan span = new TextSpan("s", words(4500), 3, List.of("A"), "s#0");

    assertThat(segmenter.segment(span, 0)).isEqualTo(segmenter.segment(span, 0));
  }

  static TextSegmenter segmenter(int target, int min, int max, int overlap, int window) {
    IndexingConfig config = new IndexingConfig();
    IndexingConfig.Chunking chunking = config.getChunking();
    chunking.setTargetSize(target);
    chunking.setMinSize(min);
    chunking.setMaxSize(max);
    chunking.setOverlapSize(overlap);
    chunking.setWordBoundaryWindow(window);
    return new TextSegmenter(
        new KeywordExtractor(config), new ScoreHintAnalyzer(), new BreakPointFinder(), config);
  }

  static String words(int length) {
    StringBuilder text = new StringBuilder();
    int i = 0;
    while (text.length() < length) {
      text.append(WORDS[i++ % WORDS.length]).append(' ');
    }
    return text.toString().trim();
  }
}
