package com.flamingo.ai.indexer.api.rest;

import com.flamingo.ai.indexer.api.dto.request.FileConverterParams;
import com.flamingo.ai.indexer.api.dto.request.PreprocessorParams;
import com.flamingo.ai.indexer.service.indexing.IndexingService;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ModelAttribute;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/** REST controller for file indexing. */
@RestController
@RequiredArgsConstructor
public class IndexController {

  private final IndexingService indexingService;

  /**
   * Indexes the uploaded files into the collection named by {@code meta.index}.
   *
   * <p>Answers 200 with an empty body once every file went through the pipeline.
   */
  @PostMapping(value = "/index", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public ResponseEntity<Void> index(
      @RequestParam("files") List<MultipartFile> files,
      @RequestParam(value = "meta", required = false, defaultValue = "null") String meta,
      @ModelAttribute FileConverterParams converterParams,
      @ModelAttribute PreprocessorParams preprocessorParams) {
    indexingService.index(files, meta, converterParams, preprocessorParams);
    return ResponseEntity.ok().build();
  }
}
