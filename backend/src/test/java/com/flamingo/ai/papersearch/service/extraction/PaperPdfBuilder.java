package com.flamingo.ai.papersearch.service.extraction;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.apache.pdfbox.pdmodel.graphics.image.LosslessFactory;
import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;

/**
 * Typesets synthetic research papers on US Letter pages.
 *
 * <p>Coordinates passed to the builder are top-left based, like the extraction model. Columns sit
 * at x 72-288 and 324-540; a full-width block spans 72-540.
 */
final class PaperPdfBuilder {

  static final float PAGE_HEIGHT = PDRectangle.LETTER.getHeight();
  static final float PAGE_WIDTH = PDRectangle.LETTER.getWidth();
  static final float TOP = 72f;

  private static final float BOTTOM = 720f;
  private static final float BODY_SIZE = 9f;
  private static final float HEADING_SIZE = 10f;
  private static final float LEADING = 11f;

  private static final String[] WORDS = {
    "retrieval", "semantic", "structure", "layout", "column", "vector", "embedding", "ranking",
    "corpus", "query", "document", "passage", "signal", "model", "index", "score", "latency",
    "dense", "sparse", "benchmark", "precision", "recall", "graph", "token", "window", "overlap",
    "extraction", "heuristic", "parser", "robust", "efficient", "large", "small", "novel",
    "simple", "we", "propose", "observe", "measure", "the", "a", "of", "for", "with", "and",
    "across", "under", "quickly", "jointly", "whose", "typical", "wide", "narrow", "keyword"
  };

  private final PDDocument document = new PDDocument();
  private final PDFont regular = new PDType1Font(Standard14Fonts.FontName.HELVETICA);
  private final PDFont bold = new PDType1Font(Standard14Fonts.FontName.HELVETICA_BOLD);
  private final List<PDPageContentStream> streams = new ArrayList<>();

  PaperPdfBuilder infoTitle(String title) {
    PDDocumentInformation info = new PDDocumentInformation();
    info.setTitle(title);
    document.setDocumentInformation(info);
    return this;
  }

  Page page() throws IOException {
    PDPage page = new PDPage(PDRectangle.LETTER);
    document.addPage(page);
    PDPageContentStream stream = new PDPageContentStream(document, page);
    streams.add(stream);
    return new Page(stream);
  }

  byte[] build() throws IOException {
    for (PDPageContentStream stream : streams) {
      stream.close();
    }
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    document.save(out);
    document.close();
    return out.toByteArray();
  }

  /** Deterministic filler sentences ending with a period. */
  static String sentences(int count, long seed) {
    Random random = new Random(seed);
    StringBuilder sb = new StringBuilder();
    for (int s = 0; s < count; s++) {
      int length = 8 + random.nextInt(8);
      for (int w = 0; w < length; w++) {
        String word = WORDS[random.nextInt(WORDS.length)];
        if (w == 0) {
          word = Character.toUpperCase(word.charAt(0)) + word.substring(1);
          if (sb.length() > 0) {
            sb.append(' ');
          }
        } else {
          sb.append(' ');
        }
        sb.append(word);
      }
      sb.append('.');
    }
    return sb.toString();
  }

  private static BufferedImage image(int width, int height, int seed) {
    BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
    Graphics2D g = image.createGraphics();
    g.setColor(new Color(40 + seed * 20 % 200, 90, 160));
    g.fillRect(0, 0, width, height);
    g.setColor(Color.WHITE);
    g.fillOval(width / 4, height / 4, width / 2, height / 2);
    g.dispose();
    return image;
  }

  private void showText(
      PDPageContentStream stream, PDFont font, float size, float x, float y, String text)
      throws IOException {
    stream.beginText();
    stream.setFont(font, size);
    stream.newLineAtOffset(x, PAGE_HEIGHT - y);
    stream.showText(text);
    stream.endText();
  }

  private float width(PDFont font, float size, String text) throws IOException {
    return font.getStringWidth(text) / 1000f * size;
  }

  /** One page; draw order follows call order. */
  final class Page {

    private final PDPageContentStream stream;

    private Page(PDPageContentStream stream) {
      this.stream = stream;
    }

    Page centered(String text, boolean useBold, float size, float baseline) throws IOException {
      PDFont font = useBold ? bold : regular;
      float x = (PAGE_WIDTH - width(font, size, text)) / 2f;
      showText(stream, font, size, x, baseline, text);
      return this;
    }

    Column left(float firstBaseline) {
      return new Column(stream, 72f, 216f, firstBaseline);
    }

    Column right(float firstBaseline) {
      return new Column(stream, 324f, 216f, firstBaseline);
    }

    Column full(float firstBaseline) {
      return new Column(stream, 72f, 468f, firstBaseline);
    }
  }

  /** A column filled top to bottom; {@code y} is the baseline of the next line. */
  final class Column {

    private final PDPageContentStream stream;
    private final float x;
    private final float width;
    private float y;
    private final List<String> lines = new ArrayList<>();

    private Column(PDPageContentStream stream, float x, float width, float firstBaseline) {
      this.stream = stream;
      this.x = x;
      this.width = width;
      this.y = firstBaseline;
    }

    List<String> lines() {
      return lines;
    }

    Column line(String text) throws IOException {
      return write(regular, BODY_SIZE, text);
    }

    Column heading(String text) throws IOException {
      y += 4f;
      write(bold, HEADING_SIZE, text);
      y += 2f;
      return this;
    }

    Column paragraph(String text) throws IOException {
      for (String line : wrap(text)) {
        write(regular, BODY_SIZE, line);
      }
      y += 5f;
      return this;
    }

    /** Adds filler paragraphs while whole paragraphs still fit above the bottom margin. */
    Column fill(long seed) throws IOException {
      long next = seed;
      while (true) {
        List<String> wrapped = wrap(sentences(3, next++));
        if (y + wrapped.size() * LEADING > BOTTOM) {
          return this;
        }
        paragraph(String.join(" ", wrapped));
      }
    }

    Column table(String caption, String[][] cells) throws IOException {
      write(regular, BODY_SIZE, caption);
      float tableTop = y - LEADING + 6f;
      float rowHeight = 16f;
      float tableX = x + 8f;
      float tableWidth = width - 16f;
      int rows = cells.length;
      int columns = cells[0].length;
      float cellWidth = tableWidth / columns;
      float tableBottom = tableTop + rows * rowHeight;
      ensureFits(tableBottom);

      stream.setLineWidth(0.5f);
      for (int r = 0; r <= rows; r++) {
        float ry = PAGE_HEIGHT - (tableTop + r * rowHeight);
        stream.moveTo(tableX, ry);
        stream.lineTo(tableX + tableWidth, ry);
      }
      for (int c = 0; c <= columns; c++) {
        float cx = tableX + c * cellWidth;
        stream.moveTo(cx, PAGE_HEIGHT - tableTop);
        stream.lineTo(cx, PAGE_HEIGHT - tableBottom);
      }
      stream.stroke();

      for (int r = 0; r < rows; r++) {
        for (int c = 0; c < columns; c++) {
          showText(
              stream,
              regular,
              BODY_SIZE,
              tableX + c * cellWidth + 3f,
              tableTop + r * rowHeight + 12f,
              cells[r][c]);
        }
      }
      y = tableBottom + LEADING + 12f;
      return this;
    }

    Column figure(String caption, int pixelWidth, int pixelHeight, int seed) throws IOException {
      float imageTop = y - 8f;
      float imageHeight = 70f;
      float imageWidth = width - 16f;
      ensureFits(imageTop + imageHeight + LEADING);
      PDImageXObject xobject =
          LosslessFactory.createFromImage(document, image(pixelWidth, pixelHeight, seed));
      stream.drawImage(
          xobject, x + 8f, PAGE_HEIGHT - (imageTop + imageHeight), imageWidth, imageHeight);
      y = imageTop + imageHeight + 12f;
      write(regular, BODY_SIZE, caption);
      y += 12f;
      return this;
    }

    private Column write(PDFont font, float size, String text) throws IOException {
      ensureFits(y);
      showText(stream, font, size, x, y, text);
      lines.add(text);
      y += LEADING;
      return this;
    }

    private void ensureFits(float bottom) {
      if (bottom > BOTTOM) {
        throw new IllegalStateException("Column overflow at y=" + bottom);
      }
    }

    private List<String> wrap(String text) throws IOException {
      List<String> wrapped = new ArrayList<>();
      StringBuilder current = new StringBuilder();
      for (String word : text.split(" ")) {
        String candidate = current.length() == 0 ? word : current + " " + word;
        if (current.length() > 0 && width(regular, BODY_SIZE, candidate) > width) {
          wrapped.add(current.toString());
          current = new StringBuilder(word);
        } else {
          current = new StringBuilder(candidate);
        }
      }
      if (current.length() > 0) {
        wrapped.add(current.toString());
      }
      return wrapped;
    }
  }
}
