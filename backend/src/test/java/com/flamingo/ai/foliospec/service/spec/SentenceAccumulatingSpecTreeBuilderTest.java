package com.flamingo.ai.foliospec.service.spec;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.foliospec.config.ConversionConfig;
import com.flamingo.ai.foliospec.domain.model.Block;
import com.flamingo.ai.foliospec.domain.model.ListItem;
import com.flamingo.ai.foliospec.domain.model.Mark;
import com.flamingo.ai.foliospec.domain.model.Run;
import com.flamingo.ai.foliospec.domain.spec.NodeType;
import com.flamingo.ai.foliospec.domain.spec.SpecNode;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("SentenceAccumulatingSpecTreeBuilder Tests")
class SentenceAccumulatingSpecTreeBuilderTest {

  private SentenceAccumulatingSpecTreeBuilder builder;

  @BeforeEach
  void setUp() {
    builder =
        new SentenceAccumulatingSpecTreeBuilder(
            new ConversionConfig(), () -> UUID.randomUUID().toString());
  }

  private static List<String> paragraphTexts(SpecNode root) {
    return root.children().stream()
        .filter(n -> n.is(NodeType.PARAGRAPH))
        .map(n -> n.children().get(0).text())
        .toList();
  }

  @Test
  @DisplayName("should merge lines until a sentence ends")
  void shouldMergeLinesUntilSentenceEnds() {
    SpecNode root =
        builder.build(
            List.of(
                Block.paragraph("This sentence spans", null),
                Block.paragraph("two lines.", null),
                Block.paragraph("Question?", null),
                Block.paragraph("Trailing", null)),
            1);

    assertThat(paragraphTexts(root))
        .containsExactly("This sentence spans two lines.", "Question?", "Trailing");
  }

  @Test
  @DisplayName("should flush pending text at a heading")
  void shouldFlushAtHeading() {
    SpecNode root =
        builder.build(
            List.of(
                Block.paragraph("Unfinished", null),
                Block.heading(2, "Next", null),
                Block.paragraph("After:", null)),
            1);

    assertThat(root.children())
        .extracting(SpecNode::type)
        .containsExactly(NodeType.PARAGRAPH, NodeType.HEADING, NodeType.PARAGRAPH);
    assertThat(root.children().get(1).level()).isEqualTo(20);
  }

  @Test
  @DisplayName("should flush once the accumulated text exceeds the maximum length")
  void shouldFlushOnLength() {
    String chunk = "x".repeat(300);
    SpecNode root =
        builder.build(
            List.of(
                Block.paragraph(chunk, null),
                Block.paragraph(chunk, null),
                Block.paragraph("tail", null)),
            1);

    assertThat(paragraphTexts(root)).containsExactly(chunk + " " + chunk, "tail");
  }

  @Test
  @DisplayName("should flow list items as text and drop tables and marks")
  void shouldFlattenListsAndDropTables() {
    SpecNode root =
        builder.build(
            List.of(
                Block.list(false, List.of(new ListItem("one", null), new ListItem("two.", null))),
                Block.table(List.of(List.of("ignored"))),
                Block.paragraph("Bold", List.of(new Run("Bold", Set.of(Mark.BOLD))))),
            1);

    assertThat(paragraphTexts(root)).containsExactly("one two.", "Bold");
    assertThat(root.children().get(1).children().get(0).marks()).isEmpty();
    assertThat(builder.policy()).isEqualTo(BuildPolicy.SENTENCE_ACCUMULATION);
  }

  @Test
  @DisplayName("should fall back to the page count message when nothing was extracted")
  void shouldFallBack() {
    BuiltTree built = builder.buildTree(List.of(Block.table(List.of(List.of("x")))), 2);

    assertThat(built.fallback()).isTrue();
    assertThat(paragraphTexts(built.root()))
        .containsExactly(
            "Dit document bevat 2 pagina's maar de tekst kon niet worden geëxtraheerd.");
  }
}
