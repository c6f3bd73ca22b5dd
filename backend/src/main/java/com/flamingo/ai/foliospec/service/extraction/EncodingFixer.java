package com.flamingo.ai.foliospec.service.extraction;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Repairs text that was decoded with the wrong charset somewhere upstream, typically UTF-8 read
 * as Windows-1252 ({@code â€™}) or as code page 437 ({@code ΓÇô}), and strips zero-width
 * characters and byte order marks.
 *
 * <p>Replacements are applied until nothing changes, so {@code fix(fix(s)).equals(fix(s))}.
 */
public final class EncodingFixer {

  private static final Map<String, String> REPLACEMENTS = new LinkedHashMap<>();

  static {
    REPLACEMENTS.put("\u200b", "");
    REPLACEMENTS.put("\ufeff", "");
    // Windows-1252 readings of UTF-8; longer sequences first so "â€" does not shadow them
    REPLACEMENTS.put("â€”", "—");
    REPLACEMENTS.put("â€“", "–");
    REPLACEMENTS.put("â€™", "'");
    REPLACEMENTS.put("â€œ", "\"");
    REPLACEMENTS.put("â€¦", "…");
    REPLACEMENTS.put("â€", "\"");
    REPLACEMENTS.put("Ã©", "é");
    REPLACEMENTS.put("Ã¨", "è");
    REPLACEMENTS.put("Ã«", "ë");
    REPLACEMENTS.put("Ã¯", "ï");
    REPLACEMENTS.put("Ã¶", "ö");
    REPLACEMENTS.put("Ã¼", "ü");
    REPLACEMENTS.put("Ã\u00a0", "à");
    // Code page 437 readings
    REPLACEMENTS.put("ΓÇô", "–");
    REPLACEMENTS.put("ΓÇö", "—");
    REPLACEMENTS.put("ΓÇï", "");
    REPLACEMENTS.put("ΓÇ£", "\"");
    REPLACEMENTS.put("ΓÇª", "…");
  }

  private EncodingFixer() {}

  /**
   * Returns {@code text} with known mis-decoded sequences replaced.
   *
   * @param text input, may be null
   * @return repaired text, or {@code null} when the input is null
   */
  public static String fix(String text) {
    if (text == null || text.isEmpty()) {
      return text;
    }
    String current = text;
    String previous;
    do {
      previous = current;
      for (Map.Entry<String, String> entry : REPLACEMENTS.entrySet()) {
        current = current.replace(entry.getKey(), entry.getValue());
      }
    } while (!current.equals(previous));
    return current;
  }
}
