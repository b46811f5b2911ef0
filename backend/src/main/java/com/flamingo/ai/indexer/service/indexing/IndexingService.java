package com.flamingo.ai.indexer.service.indexing;

import com.flamingo.ai.indexer.api.dto.request.FileConverterParams;
import com.flamingo.ai.indexer.api.dto.request.PreprocessorParams;
import java.util.List;
import org.springframework.web.multipart.MultipartFile;

/** Service interface for indexing uploaded files. */
public interface IndexingService {

  /**
   * Runs every file through the indexing pipeline and writes the passages into the collection
   * named by the {@code index} key of the first file's metadata.
   *
   * @param files the uploaded files
   * @param rawMeta request metadata as JSON text, may be {@code null}
   * @param converterParams converter overrides
   * @param preprocessorParams preprocessor overrides
   * @throws com.flamingo.ai.indexer.exception.InvalidMetadataException if the metadata is not a
   *     JSON object
   * @throws com.flamingo.ai.indexer.exception.MissingCollectionException if no collection is named
   */
  void index(
      List<MultipartFile> files,
      String rawMeta,
      FileConverterParams converterParams,
      PreprocessorParams preprocessorParams);
}
