package com.flamingo.ai.foliospec.config;

import com.flamingo.ai.foliospec.service.spec.BuildPolicy;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the document conversion pipeline. */
@Configuration
@ConfigurationProperties(prefix = "conversion")
@Getter
@Setter
public class ConversionConfig {

  private Pdf pdf = new Pdf();
  private Docx docx = new Docx();
  private Builder builder = new Builder();
  private Fallback fallback = new Fallback();
  private Html html = new Html();
  private TipTap tiptap = new TipTap();
  private Storage storage = new Storage();

  /** Font heuristics used to classify PDF lines. */
  @Getter
  @Setter
  public static class Pdf {
    /** Lines whose largest span reaches this size become level-1 headings. */
    private float h1FontSize = 18f;

    /** Lines whose largest span reaches this size (or that contain bold text) become level 2. */
    private float h2FontSize = 16f;
  }

  @Getter
  @Setter
  public static class Docx {
    /** Numbering ids at or above this value are treated as ordered lists. */
    private int orderedNumIdThreshold = 10;

    private double boldHeadingMinFontSize = 14.0;
    private int boldHeadingMaxWords = 15;
    private int boldHeadingShortWords = 8;
    private int boldHeadingLevel = 3;
  }

  @Getter
  @Setter
  public static class Builder {
    private BuildPolicy policy = BuildPolicy.PER_BLOCK;

    /** Only used by {@link BuildPolicy#SENTENCE_ACCUMULATION}. */
    private int accumulationMaxChars = 500;
  }

  @Getter
  @Setter
  public static class Fallback {
    /** Page count assumed when a job does not carry one. */
    private int defaultPageCount = 10;

    /** {@link String#format} pattern receiving the page count. */
    private String message =
        "Dit document bevat %d pagina's maar de tekst kon niet worden geëxtraheerd.";
  }

  @Getter
  @Setter
  public static class Html {
    private String lang = "nl";
    private String title = "Geconverteerd Document";
  }

  @Getter
  @Setter
  public static class TipTap {
    private String contentType = "application/vnd.nldoc.tiptap+json";
  }

  /** Blob store location and credentials (MinIO or any S3-compatible endpoint). */
  @Getter
  @Setter
  public static class Storage {
    private String endpoint = "http://minio:9000";
    private String region = "us-east-1";
    private String accessKey = "minio";
    private String secretKey = "minio123";
    private String specBucket = "files";
    private String outputBucket = "output";
    private boolean createBuckets = true;
  }
}
