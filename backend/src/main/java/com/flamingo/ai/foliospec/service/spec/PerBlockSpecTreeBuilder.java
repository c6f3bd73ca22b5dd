package com.flamingo.ai.foliospec.service.spec;

import com.flamingo.ai.foliospec.config.ConversionConfig;
import com.flamingo.ai.foliospec.domain.model.Block;
import com.flamingo.ai.foliospec.domain.model.BlockKind;
import com.flamingo.ai.foliospec.domain.model.ListItem;
import com.flamingo.ai.foliospec.domain.spec.NodeType;
import com.flamingo.ai.foliospec.domain.spec.SpecNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Default builder: every block becomes one top-level node.
 *
 * <ul>
 *   <li>heading → Heading with one Text per run
 *   <li>paragraph → Paragraph, skipped when its text is blank
 *   <li>bullet/ordered list → BulletList/OrderedList of ListItem → Paragraph; ordered items carry
 *       a 1-based {@code order}
 *   <li>table → Table whose first row is a TableHeaderRow; each cell wraps a Paragraph
 * </ul>
 *
 * Empty lists and tables are skipped.
 */
public class PerBlockSpecTreeBuilder extends AbstractSpecTreeBuilder {

  public PerBlockSpecTreeBuilder(ConversionConfig conversionConfig, NodeIdGenerator ids) {
    super(conversionConfig, ids);
  }

  @Override
  public BuiltTree buildTree(List<Block> blocks, int pageCount) {
    List<SpecNode> children = new ArrayList<>();
    for (Block block : blocks) {
      toNode(block).ifPresent(children::add);
    }
    return document(children, pageCount);
  }

  @Override
  public BuildPolicy policy() {
    return BuildPolicy.PER_BLOCK;
  }

  private Optional<SpecNode> toNode(Block block) {
    return switch (block.kind()) {
      case HEADING -> Optional.of(
          heading(block.level(), textNodes(block.runs(), block.text().strip())));
      case PARAGRAPH -> block.text().isBlank()
          ? Optional.empty()
          : Optional.of(paragraph(textNodes(block.runs(), block.text().strip())));
      case BULLET_LIST, ORDERED_LIST -> list(block);
      case TABLE -> table(block.rows());
    };
  }

  private Optional<SpecNode> list(Block block) {
    if (block.items().isEmpty()) {
      return Optional.empty();
    }
    boolean ordered = block.kind() == BlockKind.ORDERED_LIST;
    List<SpecNode> items = new ArrayList<>();
    int order = 1;
    for (ListItem item : block.items()) {
      SpecNode content = paragraph(textNodes(item.runs(), item.text()));
      items.add(SpecNode.listItem(ids.get(), ordered ? order++ : null, List.of(content)));
    }
    NodeType type = ordered ? NodeType.ORDERED_LIST : NodeType.BULLET_LIST;
    return Optional.of(SpecNode.container(ids.get(), type, items));
  }

  private Optional<SpecNode> table(List<List<String>> rows) {
    if (rows.isEmpty()) {
      return Optional.empty();
    }
    List<SpecNode> rowNodes = new ArrayList<>();
    for (int r = 0; r < rows.size(); r++) {
      List<SpecNode> cells = new ArrayList<>();
      for (String cellText : rows.get(r)) {
        SpecNode content = paragraph(List.of(text(cellText)));
        cells.add(SpecNode.container(ids.get(), NodeType.TABLE_CELL, List.of(content)));
      }
      NodeType rowType = r == 0 ? NodeType.TABLE_HEADER_ROW : NodeType.TABLE_ROW;
      rowNodes.add(SpecNode.container(ids.get(), rowType, cells));
    }
    return Optional.of(SpecNode.container(ids.get(), NodeType.TABLE, rowNodes));
  }
}
