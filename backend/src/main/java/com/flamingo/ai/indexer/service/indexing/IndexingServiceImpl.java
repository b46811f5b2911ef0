package com.flamingo.ai.indexer.service.indexing;

import com.flamingo.ai.indexer.api.dto.request.FileConverterParams;
import com.flamingo.ai.indexer.api.dto.request.PreprocessorParams;
import com.flamingo.ai.indexer.config.IndexerConfig;
import com.flamingo.ai.indexer.exception.MissingCollectionException;
import com.flamingo.ai.indexer.service.pipeline.IndexingPipelineFactory;
import com.flamingo.ai.indexer.service.pipeline.Pipeline;
import com.flamingo.ai.indexer.service.pipeline.conversion.ConverterSettings;
import com.flamingo.ai.indexer.service.pipeline.model.PipelinePayload;
import com.flamingo.ai.indexer.service.pipeline.preprocessing.PreProcessorSettings;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

/**
 * Implementation of the IndexingService.
 *
 * <p>Everything that can reject the request (metadata, overrides, collection) is checked before
 * the first upload is written to disk. Uploads are removed once the whole batch went through; a
 * failing batch leaves them in the upload directory.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IndexingServiceImpl implements IndexingService {

  static final String COLLECTION_KEY = "index";
  static final String NAME_KEY = "name";

  private final RequestMetadataParser metadataParser;
  private final UploadStorageService uploadStorageService;
  private final IndexingPipelineFactory pipelineFactory;
  private final IndexerConfig indexerConfig;
  private final MeterRegistry meterRegistry;

  @Override
  @Timed(value = "indexing.request", description = "Time to index the files of one request")
  public void index(
      List<MultipartFile> files,
      String rawMeta,
      FileConverterParams converterParams,
      PreprocessorParams preprocessorParams) {
    Map<String, Object> requestMeta = metadataParser.parse(rawMeta);
    ConverterSettings converterSettings =
        ConverterSettings.from(indexerConfig.getConverter()).withOverrides(converterParams);
    PreProcessorSettings preProcessorSettings =
        PreProcessorSettings.from(indexerConfig.getPreprocessor())
            .withOverrides(preprocessorParams)
            .validate();

    if (files == null || files.isEmpty()) {
      throw new MissingCollectionException("No files were uploaded, so no collection is named");
    }

    List<Map<String, Object>> fileMetas = new ArrayList<>(files.size());
    for (MultipartFile file : files) {
      Map<String, Object> fileMeta = new LinkedHashMap<>(requestMeta);
      fileMeta.put(NAME_KEY, UploadStorageService.originalName(file));
      fileMetas.add(fileMeta);
    }
    String collection = collectionOf(fileMetas.get(0));

    meterRegistry.counter("indexing.files.received").increment(files.size());
    log.info("Indexing {} file(s) into collection '{}'", files.size(), collection);

    List<PipelinePayload> payloads = new ArrayList<>(files.size());
    for (int i = 0; i < files.size(); i++) {
      Path stored = uploadStorageService.store(files.get(i));
      payloads.add(PipelinePayload.forFile(stored, fileMetas.get(i)));
    }

    try (Pipeline pipeline =
        pipelineFactory.create(collection, converterSettings, preProcessorSettings)) {
      for (PipelinePayload payload : payloads) {
        pipeline.run(payload);
      }
    }

    payloads.forEach(payload -> uploadStorageService.delete(payload.filePath()));
    log.info("Finished indexing {} file(s) into collection '{}'", payloads.size(), collection);
  }

  private static String collectionOf(Map<String, Object> firstFileMeta) {
    Object index = firstFileMeta.get(COLLECTION_KEY);
    if (index == null || index.toString().isBlank()) {
      throw new MissingCollectionException(
          "The meta field must name the target collection under the '" + COLLECTION_KEY + "' key");
    }
    return index.toString();
  }
}
