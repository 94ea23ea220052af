package com.flamingo.ai.podcastcleaner.service.render.layout;

import java.awt.image.BufferedImage;
import java.io.Closeable;
import java.io.IOException;
import java.util.HashMap;
import java.util.Map;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.graphics.image.LosslessFactory;
import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;

/** {@link PageCanvas} that paints onto a PDFBox document with Standard 14 fonts. */
public class PdfBoxPageCanvas implements PageCanvas, Closeable {

  private final PDDocument document;
  private final PDRectangle pageSize;
  private final PDType1Font regularFont;
  private final PDType1Font boldFont;
  private final Map<Integer, Boolean> regularEncodable = new HashMap<>();
  private final Map<Integer, Boolean> boldEncodable = new HashMap<>();

  private PDPageContentStream contentStream;

  public PdfBoxPageCanvas(PDDocument document, LayoutConfig config) {
    this.document = document;
    PageGeometry geometry = config.pageGeometry();
    this.pageSize = new PDRectangle(geometry.width(), geometry.height());
    this.regularFont = new PDType1Font(config.fontFamily().getRegular());
    this.boldFont = new PDType1Font(config.fontFamily().getBold());
  }

  @Override
  public void newPage() throws IOException {
    closeContentStream();
    PDPage page = new PDPage(pageSize);
    document.addPage(page);
    contentStream = new PDPageContentStream(document, page);
  }

  @Override
  public float textWidth(String text, float fontSize, boolean bold) throws IOException {
    return font(bold).getStringWidth(text) / 1000f * fontSize;
  }

  @Override
  public boolean canEncode(int codePoint, boolean bold) {
    Map<Integer, Boolean> known = bold ? boldEncodable : regularEncodable;
    return known.computeIfAbsent(codePoint, cp -> encodes(font(bold), cp));
  }

  @Override
  public void drawText(String text, float x, float baseline, float fontSize, boolean bold)
      throws IOException {
    if (text.isEmpty()) {
      return;
    }
    contentStream.beginText();
    contentStream.setFont(font(bold), fontSize);
    contentStream.newLineAtOffset(x, baseline);
    contentStream.showText(text);
    contentStream.endText();
  }

  @Override
  public CanvasImage prepareImage(BufferedImage image) throws IOException {
    return new PdfImage(LosslessFactory.createFromImage(document, image));
  }

  @Override
  public void drawImage(CanvasImage image, float x, float y, float width, float height)
      throws IOException {
    contentStream.drawImage(((PdfImage) image).xObject(), x, y, width, height);
  }

  @Override
  public void drawLine(float x1, float y1, float x2, float y2, float thickness)
      throws IOException {
    contentStream.setLineWidth(thickness);
    contentStream.moveTo(x1, y1);
    contentStream.lineTo(x2, y2);
    contentStream.stroke();
  }

  @Override
  public void close() throws IOException {
    closeContentStream();
  }

  private void closeContentStream() throws IOException {
    if (contentStream != null) {
      contentStream.close();
      contentStream = null;
    }
  }

  private PDType1Font font(boolean bold) {
    return bold ? boldFont : regularFont;
  }

  private static boolean encodes(PDType1Font font, int codePoint) {
    try {
      font.encode(new String(Character.toChars(codePoint)));
      return true;
    } catch (IllegalArgumentException | IOException e) {
      return false;
    }
  }

  private record PdfImage(PDImageXObject xObject) implements CanvasImage {}
}
