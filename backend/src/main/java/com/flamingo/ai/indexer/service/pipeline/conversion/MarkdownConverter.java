package com.flamingo.ai.indexer.service.pipeline.conversion;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.commonmark.node.AbstractVisitor;
import org.commonmark.node.FencedCodeBlock;
import org.commonmark.node.IndentedCodeBlock;
import org.commonmark.node.Node;
import org.commonmark.parser.Parser;
import org.commonmark.renderer.text.TextContentRenderer;

/**
 * Renders Markdown uploads to plain text with commonmark-java. Code blocks are removed unless
 * {@link ConverterSettings#removeCodeSnippets()} is off.
 */
public class MarkdownConverter extends FileConverter {

  private static final Parser PARSER = Parser.builder().build();
  private static final TextContentRenderer TEXT_RENDERER = TextContentRenderer.builder().build();

  public MarkdownConverter(ConverterSettings settings, LanguageValidator languageValidator) {
    super(settings, languageValidator);
  }

  @Override
  protected String extractText(Path file) throws IOException {
    String markdown = decode(file);
    Node document = PARSER.parse(markdown);

    if (settings.removeCodeSnippets()) {
      CodeBlockCollector collector = new CodeBlockCollector();
      document.accept(collector);
      collector.blocks.forEach(Node::unlink);
    }
    return TEXT_RENDERER.render(document);
  }

  private static final class CodeBlockCollector extends AbstractVisitor {

    // unlinking while visiting would break the traversal
    private final List<Node> blocks = new ArrayList<>();

    @Override
    public void visit(FencedCodeBlock fencedCodeBlock) {
      blocks.add(fencedCodeBlock);
    }

    @Override
    public void visit(IndentedCodeBlock indentedCodeBlock) {
      blocks.add(indentedCodeBlock);
    }
  }
}
