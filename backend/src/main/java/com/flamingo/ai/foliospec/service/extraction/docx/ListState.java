package com.flamingo.ai.foliospec.service.extraction.docx;

import com.flamingo.ai.foliospec.domain.model.ListItem;
import java.util.List;

/**
 * State of list accumulation while the DOCX body is walked.
 *
 * <p>Either no list is open, or a list of one {@link ListType} is being built from consecutive
 * list-like paragraphs. Transitions live in {@link ListStateMachine}.
 */
public sealed interface ListState permits ListState.NoList, ListState.Building {

  ListState NO_LIST = new NoList();

  /** No list is open. */
  record NoList() implements ListState {}

  /**
   * A list is open.
   *
   * @param type type shared by every accumulated item
   * @param items items collected so far, never empty
   */
  record Building(ListType type, List<ListItem> items) implements ListState {

    public Building {
      items = List.copyOf(items);
    }
  }
}
