package com.flamingo.ai.foliospec.service.render;

import com.flamingo.ai.foliospec.config.ConversionConfig;
import com.flamingo.ai.foliospec.domain.model.Mark;
import com.flamingo.ai.foliospec.domain.spec.SpecNode;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Renders a canonical tree as a standalone, accessible HTML5 page.
 *
 * <p>Block elements end with a newline; inline text is escaped and wrapped in {@code <strong>},
 * {@code <em>} and {@code <u>} (innermost first) for the marks it carries. Node types outside the
 * vocabulary render their children, or nothing.
 */
@Component
@RequiredArgsConstructor
public class HtmlRenderer {

  static final String STYLESHEET =
      """
              body { font-family: -apple-system, BlinkMacSystemFont, 'Segoe UI', Roboto, Oxygen, \
      Ubuntu, sans-serif; line-height: 1.6; max-width: 800px; margin: 0 auto; padding: 2rem; \
      color: #333; }
              h1, h2, h3, h4, h5, h6 { margin-top: 1.5em; margin-bottom: 0.5em; color: #1a1a1a; }
              h1 { font-size: 2rem; border-bottom: 2px solid #eee; padding-bottom: 0.3em; }
              h2 { font-size: 1.5rem; border-bottom: 1px solid #eee; padding-bottom: 0.2em; }
              h3 { font-size: 1.25rem; }
              p { margin: 1em 0; }
              ul, ol { margin: 1em 0; padding-left: 2em; }
              li { margin: 0.3em 0; }
              table { border-collapse: collapse; width: 100%; margin: 1em 0; }
              th, td { border: 1px solid #ddd; padding: 0.75em; text-align: left; }
              th { background-color: #f5f5f5; font-weight: bold; }
              tr:nth-child(even) { background-color: #fafafa; }
              strong { font-weight: bold; }
              em { font-style: italic; }
              u { text-decoration: underline; }
      """;

  private final ConversionConfig conversionConfig;

  /** Full HTML document with the rendered tree as body. */
  public String render(SpecNode root) {
    ConversionConfig.Html html = conversionConfig.getHtml();
    return "<!DOCTYPE html>\n"
        + "<html lang=\""
        + escape(html.getLang())
        + "\">\n"
        + "<head>\n"
        + "    <meta charset=\"UTF-8\">\n"
        + "    <meta name=\"viewport\" content=\"width=device-width, initial-scale=1.0\">\n"
        + "    <title>"
        + escape(html.getTitle())
        + "</title>\n"
        + "    <style>\n"
        + STYLESHEET
        + "    </style>\n"
        + "</head>\n"
        + "<body>\n"
        + renderBody(root)
        + "\n</body>\n"
        + "</html>";
  }

  /** Body markup only, without the page shell. */
  public String renderBody(SpecNode node) {
    return switch (node.type()) {
      case TEXT -> renderText(node);
      case HEADING -> {
        int level = node.level() == null ? 20 : node.level();
        int h = Math.min(6, Math.max(1, level / 10));
        yield "<h" + h + ">" + renderChildren(node.children()) + "</h" + h + ">\n";
      }
      case PARAGRAPH -> "<p>" + renderChildren(node.children()) + "</p>\n";
      case BULLET_LIST -> "<ul>\n" + renderChildren(node.children()) + "</ul>\n";
      case ORDERED_LIST -> "<ol>\n" + renderChildren(node.children()) + "</ol>\n";
      case LIST_ITEM -> "<li>" + renderChildren(node.children()) + "</li>\n";
      case TABLE -> "<table>\n" + renderChildren(node.children()) + "</table>\n";
      case TABLE_HEADER_ROW -> renderRow(node, "th");
      case TABLE_ROW -> renderRow(node, "td");
      case TABLE_CELL, DOCUMENT -> renderChildren(node.children());
      case UNKNOWN -> renderChildren(node.children());
    };
  }

  private String renderRow(SpecNode row, String cellTag) {
    StringBuilder sb = new StringBuilder("<tr>");
    for (SpecNode cell : row.children()) {
      sb.append('<')
          .append(cellTag)
          .append('>')
          .append(renderChildren(cell.children()))
          .append("</")
          .append(cellTag)
          .append('>');
    }
    return sb.append("</tr>\n").toString();
  }

  private String renderChildren(List<SpecNode> children) {
    StringBuilder sb = new StringBuilder();
    for (SpecNode child : children) {
      sb.append(renderBody(child));
    }
    return sb.toString();
  }

  private static String renderText(SpecNode node) {
    Set<Mark> marks = EnumSet.noneOf(Mark.class);
    for (String tag : node.marks()) {
      Mark.fromTag(tag).ifPresent(marks::add);
    }
    String result = escape(node.text());
    if (marks.contains(Mark.BOLD)) {
      result = "<strong>" + result + "</strong>";
    }
    if (marks.contains(Mark.ITALIC)) {
      result = "<em>" + result + "</em>";
    }
    if (marks.contains(Mark.UNDERLINE)) {
      result = "<u>" + result + "</u>";
    }
    return result;
  }

  static String escape(String text) {
    if (text == null || text.isEmpty()) {
      return "";
    }
    return text.replace("&", "&amp;")
        .replace("<", "&lt;")
        .replace(">", "&gt;")
        .replace("\"", "&quot;")
        .replace("'", "&#x27;");
  }
}
