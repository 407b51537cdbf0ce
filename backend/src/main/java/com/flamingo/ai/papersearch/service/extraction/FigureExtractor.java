package com.flamingo.ai.papersearch.service.extraction;

import com.flamingo.ai.papersearch.service.extraction.model.BoundingBox;
import com.flamingo.ai.papersearch.service.extraction.model.ExtractedFigure;
import com.flamingo.ai.papersearch.service.extraction.model.PageText;
import java.awt.geom.Point2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import javax.imageio.ImageIO;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.contentstream.PDFGraphicsStreamEngine;
import org.apache.pdfbox.cos.COSName;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.graphics.image.PDImage;
import org.apache.pdfbox.util.Matrix;
import org.springframework.stereotype.Component;

/**
 * Extracts every raster image drawn on a page as a figure.
 *
 * <p>Placement comes from the current transformation matrix at the time the image is drawn, so
 * images nested in form XObjects are found as well. The pixels are re-encoded as PNG and handed to
 * {@link FigureStorage}; an image that cannot be decoded or stored is still reported, without an
 * image path.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FigureExtractor {

  private final FigureStorage figureStorage;
  private final CaptionLocator captionLocator;

  /**
   * Extracts the figures of one page.
   *
   * @param documentId owning document, used for storage
   * @param page the PDF page
   * @param pageText the assembled text of the same page
   * @return figures in drawing order with 1-based per-page ordinals
   * @throws IOException if the page content stream cannot be read
   */
  public List<ExtractedFigure> extract(UUID documentId, PDPage page, PageText pageText)
      throws IOException {
    ImageCollector collector = new ImageCollector(page);
    collector.processPage(page);

    List<ExtractedFigure> figures = new ArrayList<>();
    for (Placement placement : collector.placements) {
      int index = figures.size() + 1;
      String caption =
          captionLocator
              .locate(pageText.lines(), placement.box(), CaptionLocator.FIGURE_CAPTION)
              .orElse(null);
      String path = store(documentId, pageText.pageNumber(), index, placement.image());
      figures.add(
          new ExtractedFigure(
              pageText.pageNumber(),
              index,
              caption,
              placement.image().getWidth(),
              placement.image().getHeight(),
              placement.box(),
              path));
    }
    if (!figures.isEmpty()) {
      log.debug("Found {} figures on page {}", figures.size(), pageText.pageNumber());
    }
    return figures;
  }

  private String store(UUID documentId, int pageNumber, int index, PDImage image) {
    try {
      BufferedImage bufferedImage = image.getImage();
      if (bufferedImage == null) {
        log.warn(
            "Figure p{} #{} of document {} has no decodable pixels", pageNumber, index, documentId);
        return null;
      }
      ByteArrayOutputStream baos = new ByteArrayOutputStream();
      ImageIO.write(bufferedImage, "png", baos);
      return figureStorage.store(documentId, pageNumber, index, baos.toByteArray()).orElse(null);
    } catch (IOException | RuntimeException e) {
      log.warn(
          "Could not extract figure p{} #{} of document {}: {}",
          pageNumber,
          index,
          documentId,
          e.getMessage());
      return null;
    }
  }

  /**
   * An image and where it was drawn.
   *
   * @param image the image
   * @param box placement in top-left page coordinates
   */
  private record Placement(PDImage image, BoundingBox box) {}

  /** Records image draws; path construction and painting are ignored. */
  private static final class ImageCollector extends PDFGraphicsStreamEngine {

    private final List<Placement> placements = new ArrayList<>();
    private final float originX;
    private final float topY;

    ImageCollector(PDPage page) {
      super(page);
      PDRectangle cropBox = page.getCropBox();
      this.originX = cropBox.getLowerLeftX();
      this.topY = cropBox.getUpperRightY();
    }

    @Override
    public void drawImage(PDImage pdImage) {
      Matrix ctm = getGraphicsState().getCurrentTransformationMatrix();
      float x = ctm.getTranslateX() - originX;
      float y = ctm.getTranslateY();
      float width = Math.abs(ctm.getScalingFactorX());
      float height = Math.abs(ctm.getScalingFactorY());
      BoundingBox box = new BoundingBox(x, topY - (y + height), x + width, topY - y);
      placements.add(new Placement(pdImage, box));
    }

    @Override
    public void appendRectangle(Point2D p0, Point2D p1, Point2D p2, Point2D p3) {}

    @Override
    public void clip(int windingRule) {}

    @Override
    public void moveTo(float x, float y) {}

    @Override
    public void lineTo(float x, float y) {}

    @Override
    public void curveTo(float x1, float y1, float x2, float y2, float x3, float y3) {}

    @Override
    public Point2D getCurrentPoint() {
      return new Point2D.Float();
    }

    @Override
    public void closePath() {}

    @Override
    public void endPath() {}

    @Override
    public void strokePath() {}

    @Override
    public void fillPath(int windingRule) {}

    @Override
    public void fillAndStrokePath(int windingRule) {}

    @Override
    public void shadingFill(COSName shadingName) {}
  }
}
