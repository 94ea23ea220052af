package com.flamingo.ai.podcastcleaner.service.render;

import com.flamingo.ai.podcastcleaner.config.RenderProperties;
import com.flamingo.ai.podcastcleaner.exception.DocumentRenderException;
import com.flamingo.ai.podcastcleaner.service.render.image.RemoteImageFetcher;
import com.flamingo.ai.podcastcleaner.service.render.layout.LayoutConfig;
import com.flamingo.ai.podcastcleaner.service.render.layout.PageGeometry;
import com.flamingo.ai.podcastcleaner.service.render.layout.PageLayoutEngine;
import com.flamingo.ai.podcastcleaner.service.render.layout.PdfBoxPageCanvas;
import com.flamingo.ai.podcastcleaner.service.render.layout.Typography;
import com.flamingo.ai.podcastcleaner.service.render.markdown.MarkdownBlockParser;
import com.flamingo.ai.podcastcleaner.service.render.markdown.RenderDocument;
import io.micrometer.core.annotation.Timed;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;
import org.springframework.stereotype.Service;

/** {@link DocumentRenderService} writing PDFs with Apache PDFBox. */
@Service
@RequiredArgsConstructor
@Slf4j
public class PdfDocumentRenderer implements DocumentRenderService {

  private final MarkdownBlockParser markdownBlockParser;
  private final RemoteImageFetcher remoteImageFetcher;
  private final RenderProperties renderProperties;

  @Override
  public LayoutConfig layoutFor(String font, String zoom) {
    return LayoutConfig.of(font, zoom, PageGeometry.from(renderProperties.getPage()));
  }

  @Override
  @Timed(value = "document.render", description = "Time to render a document as PDF")
  public byte[] render(String markdown, LayoutConfig layoutConfig) {
    RenderDocument document = markdownBlockParser.parse(markdown);
    Typography typography = Typography.of(layoutConfig, renderProperties.getTypography());

    try (PDDocument pdf = new PDDocument()) {
      PDDocumentInformation info = pdf.getDocumentInformation();
      info.setCreator("podcast-cleaner");

      int pages;
      try (PdfBoxPageCanvas canvas = new PdfBoxPageCanvas(pdf, layoutConfig)) {
        PageLayoutEngine engine =
            new PageLayoutEngine(
                canvas,
                layoutConfig,
                typography,
                renderProperties.getImage().getMaxWidthRatio(),
                remoteImageFetcher::fetch);
        pages = engine.layout(document);
      }

      ByteArrayOutputStream out = new ByteArrayOutputStream();
      pdf.save(out);
      log.debug(
          "Rendered {} blocks to {} pages ({} bytes, font={}, zoom={}%)",
          document.entries().size(),
          pages,
          out.size(),
          layoutConfig.fontFamily().getDisplayName(),
          layoutConfig.zoomPercent());
      return out.toByteArray();
    } catch (IOException e) {
      throw new DocumentRenderException("Failed to render PDF: " + e.getMessage(), e);
    }
  }
}
