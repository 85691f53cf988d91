package io.nestor.parser.api;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import org.junit.jupiter.api.Test;

class TreeRendererTest {
  private static final String NL = System.lineSeparator();

  @Test
  void rendersIndentedKeysWithDepth() throws Exception {
    String input = "a(b(c))d";
    Node root = NestedParser.parse(input, TokenRegistry.builder().pair("(", ")").build());
    TreeRenderer renderer = new TreeRenderer(ParserOptions.builder().renderWidth(10).build());

    String expected =
        "KEY        DEPTH"
            + NL
            + "-".repeat(20)
            + NL
            + "  a(b(c))d 1"
            + NL
            + "    b(c)   2"
            + NL
            + "      c    3"
            + NL;

    assertEquals(expected, renderer.render(root, input));
  }

  @Test
  void subtreeStartsAtLevelOne() throws Exception {
    String input = "x[y]";
    Node root = NestedParser.parse(input, TokenRegistry.builder().pair("[", "]").build());

    String rendered = new TreeRenderer().render(root.child(0), input);

    String[] lines = rendered.split(NL);
    assertEquals(3, lines.length);
    assertEquals("  y" + " ".repeat(38) + "1", lines[2]);
  }

  @Test
  void writesToAppendable() throws Exception {
    String input = "(z)";
    Node root = NestedParser.parse(input, TokenRegistry.builder().pair("(", ")").build());
    StringWriter out = new StringWriter();

    new TreeRenderer().render(root, input, out);

    assertTrue(out.toString().startsWith("KEY"));
    assertTrue(out.toString().contains("    z"));
  }

  @Test
  void wrapsWriteFailures() throws Exception {
    String input = "(z)";
    Node root = NestedParser.parse(input, TokenRegistry.builder().pair("(", ")").build());
    Writer broken =
        new Writer() {
          @Override
          public void write(char[] cbuf, int off, int len) throws IOException {
            throw new IOException("closed");
          }

          @Override
          public void flush() {}

          @Override
          public void close() {}
        };

    assertThrows(UncheckedIOException.class, () -> new TreeRenderer().render(root, input, broken));
  }
}
