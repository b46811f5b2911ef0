package com.flamingo.ai.indexer.service.pipeline.classifier;

import com.flamingo.ai.indexer.exception.PipelineConfigurationException;
import com.flamingo.ai.indexer.service.pipeline.ComponentOutput;
import com.flamingo.ai.indexer.service.pipeline.PipelineComponent;
import com.flamingo.ai.indexer.service.pipeline.model.PipelinePayload;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Routes each file to the converter branch of its type.
 *
 * <p>The output channel of a type is its 1-based position in the supported type list, so with the
 * default {@code [txt, pdf, md]} plain text leaves on {@code output_1}, PDF on {@code output_2} and
 * Markdown on {@code output_3}. Files of any other type produce no output and are counted as
 * dropped.
 */
@Slf4j
public class FileTypeClassifier implements PipelineComponent {

  private final FileTypeDetector detector;
  private final List<FileType> supportedTypes;
  private final MeterRegistry meterRegistry;

  public FileTypeClassifier(
      FileTypeDetector detector, List<String> supportedExtensions, MeterRegistry meterRegistry) {
    this.detector = detector;
    this.meterRegistry = meterRegistry;
    this.supportedTypes = new ArrayList<>();
    for (String extension : supportedExtensions) {
      FileType type = FileType.fromExtension(extension);
      if (type == FileType.UNKNOWN || supportedTypes.contains(type)) {
        throw new PipelineConfigurationException(
            "Unsupported or repeated classifier type: '" + extension + "'");
      }
      supportedTypes.add(type);
    }
  }

  /** Returns the routed types in channel order. */
  public List<FileType> supportedTypes() {
    return List.copyOf(supportedTypes);
  }

  @Override
  public int outgoingEdges() {
    return supportedTypes.size();
  }

  /**
   * Returns the output channel files of the given type leave on.
   *
   * @throws PipelineConfigurationException if the type is not supported
   */
  public int channelOf(FileType type) {
    int index = supportedTypes.indexOf(type);
    if (index < 0) {
      throw new PipelineConfigurationException("File type " + type + " is not routed");
    }
    return index + 1;
  }

  @Override
  public Optional<ComponentOutput> run(PipelinePayload payload) {
    FileType type = detector.detect(payload.filePath());
    switch (type) {
      case TEXT, PDF, MARKDOWN -> {
        if (supportedTypes.contains(type)) {
          log.debug("Classified {} as {}", payload.filePath().getFileName(), type);
          return Optional.of(ComponentOutput.on(channelOf(type), payload));
        }
        return drop(payload, "unsupported_type");
      }
      default -> {
        return drop(payload, "unknown_type");
      }
    }
  }

  private Optional<ComponentOutput> drop(PipelinePayload payload, String reason) {
    log.warn(
        "Dropping file '{}': type is not one of {}", payload.meta().get("name"), supportedTypes);
    meterRegistry.counter("indexing.files.dropped", "reason", reason).increment();
    return Optional.empty();
  }
}
