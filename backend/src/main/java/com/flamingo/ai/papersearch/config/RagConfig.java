package com.flamingo.ai.papersearch.config;

import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the extraction, chunking, embedding and retrieval pipeline. */
@Configuration
@ConfigurationProperties(prefix = "rag")
@Getter
@Setter
public class RagConfig {

  private Chunking chunking = new Chunking();
  private Layout layout = new Layout();
  private Extraction extraction = new Extraction();
  private Figures figures = new Figures();
  private Embedding embedding = new Embedding();
  private Retrieval retrieval = new Retrieval();
  private VectorStore vectorStore = new VectorStore();
  private Upload upload = new Upload();

  @Getter
  @Setter
  public static class Chunking {
    /** Maximum chunk length in characters. */
    private int size = 500;

    private int overlap = 50;

    /** Minimum length of every chunk except the last one of a section. */
    private int minSize = 100;
  }

  /** Thresholds for the per-page column gutter detection. */
  @Getter
  @Setter
  public static class Layout {
    private int minGlyphs = 50;
    private double gapDensityRatio = 0.08;
    private float minGapWidth = 6f;
    private double minColumnShare = 0.2;
    private double searchStart = 0.25;
    private double searchEnd = 0.75;
  }

  @Getter
  @Setter
  public static class Extraction {
    /** Wall-clock budget for the structural extraction of one document. */
    private Duration timeout = Duration.ofSeconds(60);

    private int maxPages = 500;

    /** Maximum vertical distance in points between a caption line and its table or figure. */
    private float captionMaxDistance = 40f;

    /**
     * Fraction of page 1, from the top, searched for the title block. The default searches the
     * whole page; lower it for layouts with large banners or figures below the title.
     */
    private double titleRegionRatio = 1.0;

    private int maxKeywords = 10;
  }

  /** Configuration for figure images written outside the core. */
  @Getter
  @Setter
  public static class Figures {
    /** Root directory for stored figure images. */
    private String basePath = "data/figures";

    private boolean enabled = true;

    /** Images whose encoded size exceeds this are recorded without a stored file. */
    private long maxFileSizeBytes = 10 * 1024 * 1024L; // 10 MB
  }

  @Getter
  @Setter
  public static class Embedding {
    /** Embedding provider: "local" (all-MiniLM-L6-v2, in process) or "openai". */
    private String provider = "local";

    private int dimensions = 384;
    private int batchSize = 32;
    private int maxCharsPerText = 5000;
  }

  @Getter
  @Setter
  public static class Retrieval {
    private int defaultMaxResults = 10;
    private int maxResults = 50;
  }

  @Getter
  @Setter
  public static class VectorStore {
    /** Chunk store backend: "memory" or "elasticsearch". */
    private String type = "memory";
  }

  @Getter
  @Setter
  public static class Upload {
    private long maxFileSizeBytes = 10 * 1024 * 1024L; // 10 MB
  }
}
