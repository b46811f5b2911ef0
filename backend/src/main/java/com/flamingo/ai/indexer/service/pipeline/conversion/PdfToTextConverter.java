package com.flamingo.ai.indexer.service.pipeline.conversion;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;

/** Extracts the text layer of PDF uploads page by page with PDFBox. */
@Slf4j
public class PdfToTextConverter extends FileConverter {

  public PdfToTextConverter(ConverterSettings settings, LanguageValidator languageValidator) {
    super(settings, languageValidator);
  }

  @Override
  protected String extractText(Path file) throws IOException {
    try (PDDocument pdf = Loader.loadPDF(file.toFile())) {
      PDFTextStripper stripper = new PDFTextStripper();
      stripper.setSortByPosition(true);

      int pageCount = pdf.getNumberOfPages();
      List<String> pages = new ArrayList<>(pageCount);
      for (int page = 1; page <= pageCount; page++) {
        stripper.setStartPage(page);
        stripper.setEndPage(page);
        pages.add(stripper.getText(pdf));
      }
      log.debug("Read {} page(s) from {}", pageCount, file.getFileName());
      return String.join(String.valueOf(PAGE_BREAK), pages);
    }
  }
}
