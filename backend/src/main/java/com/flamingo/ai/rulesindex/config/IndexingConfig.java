package com.flamingo.ai.rulesindex.config;

import com.flamingo.ai.rulesindex.service.rag.model.ChunkSizes;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the rulebook indexing pipeline. */
@Configuration
@ConfigurationProperties(prefix = "indexing")
@Getter
@Setter
public class IndexingConfig {

  private Chunking chunking = new Chunking();
  private Sections sections = new Sections();
  private Keywords keywords = new Keywords();
  private Cleaning cleaning = new Cleaning();
  private Tables tables = new Tables();
  private Batch batch = new Batch();

  /** Size bounds for chunk segmentation, all in characters. */
  @Getter
  @Setter
  public static class Chunking {
    private int targetSize = 1800;
    private int minSize = 500;
    private int maxSize = 2500;
    private int overlapSize = 200;

    /** Distance either side of the target size searched for whitespace when no paragraph fits. */
    private int wordBoundaryWindow = 50;

    /**
     * Validated snapshot of the size bounds.
     *
     * @throws IllegalArgumentException if the bounds are inconsistent
     */
    public ChunkSizes toChunkSizes() {
      return new ChunkSizes(targetSize, minSize, maxSize, overlapSize, wordBoundaryWindow);
    }
  }

  @Getter
  @Setter
  public static class Sections {
    /** Trimmed header candidates shorter than this are ignored. */
    private int minHeaderLength = 3;

    /** Trimmed header candidates longer than this are ignored. */
    private int maxHeaderLength = 80;
  }

  @Getter
  @Setter
  public static class Keywords {
    /**
     * Domain terms matched case-insensitively against chunk text. List order is the order in which
     * matches are reported.
     */
    private List<String> vocabulary = new ArrayList<>(DEFAULT_VOCABULARY);
  }

  /** Page text pre-pass that strips extraction artifacts before section detection. */
  @Getter
  @Setter
  public static class Cleaning {
    private boolean enabled = true;

    /** Share of pages a line must appear on (near the page edges) to count as header/footer. */
    private double repeatedLineThreshold = 0.6;

    /** Number of lines at the top and at the bottom of each page inspected for repeats. */
    private int edgeLines = 5;

    /** Repeated header/footer detection is skipped for documents with fewer pages. */
    private int minPagesForRepeatDetection = 3;

    /** Character budget of one pseudo page when splitting unpaginated text. */
    private int pseudoPageSize = 8000;
  }

  @Getter
  @Setter
  public static class Tables {
    private boolean enabled = true;
  }

  @Getter
  @Setter
  public static class Batch {
    private int corePoolSize = 2;
    private int maxPoolSize = 4;
    private int queueCapacity = 100;
  }

  /** Damage, combat, advancement and dice terminology found in skirmish wargame rulebooks. */
  public static final List<String> DEFAULT_VOCABULARY =
      List.of(
          "injury", "wound", "damage", "attack", "defense", "armour", "armor",
          "skill", "ability", "trait", "equipment", "weapon", "item",
          "exploration", "loot", "treasure", "encounter", "event",
          "advancement", "experience", "level", "upgrade",
          "warband", "unit", "model", "hero", "henchman",
          "deployment", "scenario", "mission", "objective",
          "movement", "shooting", "combat", "melee", "ranged",
          "morale", "rout", "flee", "recovery",
          "d6", "d66", "d3", "d10", "d20", "dice", "roll",
          "table", "chart", "list");
}
