package com.flamingo.ai.foliospec.service.render;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.foliospec.domain.model.Mark;
import com.flamingo.ai.foliospec.domain.spec.NodeType;
import com.flamingo.ai.foliospec.domain.spec.SpecNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Renders a canonical tree as a TipTap/ProseMirror document.
 *
 * <p>Only the direct children of a Document root become top-level content; any other root yields
 * an empty {@code doc}. Nodes TipTap has no counterpart for are dropped.
 */
@Component
@RequiredArgsConstructor
public class TipTapRenderer {

  private final ObjectMapper objectMapper;

  /** A TipTap node. Unset fields are left out of the JSON. */
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public record TipTapNode(
      String type,
      Map<String, Object> attrs,
      List<TipTapNode> content,
      String text,
      List<TipTapMark> marks) {

    static TipTapNode block(String type, List<TipTapNode> content) {
      return new TipTapNode(type, null, content, null, null);
    }

    static TipTapNode text(String text, List<TipTapMark> marks) {
      return new TipTapNode("text", null, null, text, marks.isEmpty() ? null : marks);
    }

    static TipTapNode emptyParagraph() {
      return block("paragraph", List.of(text("", List.of())));
    }
  }

  /** A TipTap inline mark such as {@code {"type": "bold"}}. */
  public record TipTapMark(String type) {}

  public TipTapNode render(SpecNode root) {
    List<TipTapNode> content = new ArrayList<>();
    if (root != null && root.is(NodeType.DOCUMENT)) {
      for (SpecNode child : root.children()) {
        renderBlock(child).ifPresent(content::add);
      }
    }
    return TipTapNode.block("doc", content);
  }

  public byte[] renderJson(SpecNode root) {
    try {
      return objectMapper.writeValueAsBytes(render(root));
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to serialize TipTap document", e);
    }
  }

  private Optional<TipTapNode> renderBlock(SpecNode node) {
    return switch (node.type()) {
      case HEADING -> {
        int level = node.level() == null ? 2 : Math.max(1, Math.min(6, node.level() / 10));
        yield Optional.of(
            new TipTapNode("heading", Map.of("level", level), inline(node), null, null));
      }
      case PARAGRAPH -> Optional.of(TipTapNode.block("paragraph", inline(node)));
      case BULLET_LIST -> Optional.of(TipTapNode.block("bulletList", blocks(node.children())));
      case ORDERED_LIST -> Optional.of(TipTapNode.block("orderedList", blocks(node.children())));
      case LIST_ITEM -> Optional.of(TipTapNode.block("listItem", blocks(node.children())));
      case TABLE -> Optional.of(TipTapNode.block("table", rows(node)));
      case DOCUMENT, TEXT, TABLE_HEADER_ROW, TABLE_ROW, TABLE_CELL, UNKNOWN -> Optional.empty();
    };
  }

  private List<TipTapNode> blocks(List<SpecNode> children) {
    List<TipTapNode> out = new ArrayList<>();
    for (SpecNode child : children) {
      renderBlock(child).ifPresent(out::add);
    }
    return out;
  }

  private List<TipTapNode> inline(SpecNode node) {
    List<TipTapNode> out = new ArrayList<>();
    for (SpecNode child : node.children()) {
      if (child.is(NodeType.TEXT)) {
        out.add(TipTapNode.text(child.text() == null ? "" : child.text(), marks(child)));
      }
    }
    return out.isEmpty() ? List.of(TipTapNode.text("", List.of())) : out;
  }

  private List<TipTapNode> rows(SpecNode table) {
    List<TipTapNode> rows = new ArrayList<>();
    for (SpecNode row : table.children()) {
      String cellType;
      if (row.is(NodeType.TABLE_HEADER_ROW)) {
        cellType = "tableHeader";
      } else if (row.is(NodeType.TABLE_ROW)) {
        cellType = "tableCell";
      } else {
        continue;
      }
      List<TipTapNode> cells = new ArrayList<>();
      for (SpecNode cell : row.children()) {
        List<TipTapNode> content = blocks(cell.children());
        cells.add(
            TipTapNode.block(
                cellType, content.isEmpty() ? List.of(TipTapNode.emptyParagraph()) : content));
      }
      rows.add(TipTapNode.block("tableRow", cells));
    }
    return rows;
  }

  private static List<TipTapMark> marks(SpecNode text) {
    List<TipTapMark> marks = new ArrayList<>();
    for (String tag : text.marks()) {
      Mark.fromTag(tag).ifPresent(m -> marks.add(new TipTapMark(m.tag())));
    }
    return marks;
  }
}
