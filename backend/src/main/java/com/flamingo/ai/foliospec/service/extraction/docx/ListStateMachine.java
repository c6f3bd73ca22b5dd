package com.flamingo.ai.foliospec.service.extraction.docx;

import com.flamingo.ai.foliospec.domain.model.Block;
import com.flamingo.ai.foliospec.domain.model.ListItem;
import java.util.ArrayList;
import java.util.List;

/**
 * Pure transitions of the DOCX list accumulator.
 *
 * <p>Every transition takes the current {@link ListState} and one body element and returns the
 * next state together with the blocks that became final. Nothing is mutated.
 */
public final class ListStateMachine {

  private ListStateMachine() {}

  /**
   * Result of a transition.
   *
   * @param next state after the element was consumed
   * @param emitted completed blocks, in document order
   */
  public record Step(ListState next, List<Block> emitted) {

    public Step {
      emitted = List.copyOf(emitted);
    }
  }

  /** An empty paragraph: closes any open list. */
  public static Step onBreak(ListState state) {
    return new Step(ListState.NO_LIST, finish(state));
  }

  /** A table, heading or plain paragraph: closes any open list, then emits {@code block}. */
  public static Step onBlock(ListState state, Block block) {
    List<Block> emitted = new ArrayList<>(finish(state));
    emitted.add(block);
    return new Step(ListState.NO_LIST, emitted);
  }

  /**
   * A list-like paragraph: extends the open list when the type matches, otherwise closes it and
   * opens a new one.
   */
  public static Step onListItem(ListState state, ListType type, ListItem item) {
    if (state instanceof ListState.Building building && building.type() == type) {
      List<ListItem> items = new ArrayList<>(building.items());
      items.add(item);
      return new Step(new ListState.Building(type, items), List.of());
    }
    return new Step(new ListState.Building(type, List.of(item)), finish(state));
  }

  /** Blocks still pending in {@code state}; called at end of input. */
  public static List<Block> finish(ListState state) {
    if (state instanceof ListState.Building building) {
      return List.of(Block.list(building.type() == ListType.ORDERED, building.items()));
    }
    return List.of();
  }
}
