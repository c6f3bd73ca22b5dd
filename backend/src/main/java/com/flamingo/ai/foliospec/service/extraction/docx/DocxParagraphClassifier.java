package com.flamingo.ai.foliospec.service.extraction.docx;

import com.flamingo.ai.foliospec.config.ConversionConfig;
import java.math.BigInteger;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Heading and list heuristics for DOCX paragraphs, independent of the POI object model so they can
 * be tested and tuned on their own.
 */
public class DocxParagraphClassifier {

  private static final Set<String> HEADING_STYLE_MARKERS = Set.of("heading", "title", "kop");
  private static final Set<Character> BULLET_GLYPHS = Set.of('•', '●', '○', '▪', '-', '*');
  private static final Pattern ORDERED_PREFIX = Pattern.compile("^\\d+[.):]");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private final ConversionConfig.Docx thresholds;

  public DocxParagraphClassifier(ConversionConfig.Docx thresholds) {
    this.thresholds = thresholds;
  }

  /**
   * Heading level of a paragraph style: the first digit of the style name, 1 when there is none.
   *
   * @param styleName style name, may be null
   * @return level, or empty when the style is not a heading style
   */
  public Optional<Integer> headingLevel(String styleName) {
    String name = normalize(styleName);
    if (HEADING_STYLE_MARKERS.stream().noneMatch(name::contains)) {
      return Optional.empty();
    }
    for (char c : name.toCharArray()) {
      if (Character.isDigit(c)) {
        return Optional.of(Character.digit(c, 10));
      }
    }
    return Optional.of(1);
  }

  /**
   * Detects list membership. Numbering properties win over the style name, which wins over the
   * text prefix.
   *
   * @param numId numbering id from the paragraph properties, null when absent
   * @param styleName style name, may be null
   * @param text trimmed paragraph text
   * @return list type, or empty for a regular paragraph
   */
  public Optional<ListType> listType(BigInteger numId, String styleName, String text) {
    String name = normalize(styleName);
    if (numId != null) {
      boolean ordered =
          numId.compareTo(BigInteger.valueOf(thresholds.getOrderedNumIdThreshold())) >= 0
              || name.contains("number");
      return Optional.of(ordered ? ListType.ORDERED : ListType.BULLET);
    }
    if (name.contains("list")) {
      boolean ordered = name.contains("number") || name.contains("ordered");
      return Optional.of(ordered ? ListType.ORDERED : ListType.BULLET);
    }
    return listTypeFromText(text);
  }

  /**
   * Detects list markers typed as text: bullet glyphs, or digits followed by {@code .}, {@code )}
   * or {@code :}.
   */
  public Optional<ListType> listTypeFromText(String text) {
    if (text == null || text.isEmpty()) {
      return Optional.empty();
    }
    if (BULLET_GLYPHS.contains(text.charAt(0))) {
      return Optional.of(ListType.BULLET);
    }
    if (ORDERED_PREFIX.matcher(text).find()) {
      return Optional.of(ListType.ORDERED);
    }
    return Optional.empty();
  }

  /**
   * Whether an unstyled paragraph reads as a short bold label and should become a heading.
   *
   * @param firstRunBold whether the paragraph's first run is bold
   * @param firstRunFontSize font size of the first run in points, null when inherited
   * @param text trimmed paragraph text
   */
  public boolean isBoldHeading(boolean firstRunBold, Double firstRunFontSize, String text) {
    if (!firstRunBold) {
      return false;
    }
    int words = wordCount(text);
    if (words >= thresholds.getBoldHeadingMaxWords()) {
      return false;
    }
    boolean large =
        firstRunFontSize != null && firstRunFontSize >= thresholds.getBoldHeadingMinFontSize();
    return large || words < thresholds.getBoldHeadingShortWords();
  }

  public int boldHeadingLevel() {
    return thresholds.getBoldHeadingLevel();
  }

  static int wordCount(String text) {
    String trimmed = text == null ? "" : text.strip();
    return trimmed.isEmpty() ? 0 : WHITESPACE.split(trimmed).length;
  }

  private static String normalize(String styleName) {
    return styleName == null ? "" : styleName.toLowerCase(Locale.ROOT);
  }
}
