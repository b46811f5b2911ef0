package com.flamingo.ai.indexer.service.indexing;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.indexer.config.IndexerConfig;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.mock.web.MockMultipartFile;

@DisplayName("UploadStorageService Tests")
class UploadStorageServiceTest {

  @TempDir Path tempDir;

  private UploadStorageService storageService;
  private Path uploadDir;

  @BeforeEach
  void setUp() {
    uploadDir = tempDir.resolve("uploads");
    IndexerConfig config = new IndexerConfig();
    config.setUploadPath(uploadDir.toString());
    storageService = new UploadStorageService(config);
  }

  @Test
  @DisplayName("Should store uploads under a random prefix in the upload directory")
  void shouldStoreUpload() throws IOException {
    MockMultipartFile file =
        new MockMultipartFile(
            "files", "notes.txt", "text/plain", "hello".getBytes(StandardCharsets.UTF_8));

    Path first = storageService.store(file);
    Path second = storageService.store(file);

    assertThat(first.getParent()).isEqualTo(uploadDir);
    assertThat(first.getFileName().toString()).matches("[0-9a-f]{32}_notes\\.txt");
    assertThat(Files.readString(first)).isEqualTo("hello");
    assertThat(second).isNotEqualTo(first);
  }

  @Test
  @DisplayName("Should drop directories from client file names")
  void shouldUseBaseName() {
    MockMultipartFile nested =
        new MockMultipartFile("files", "../../etc/report.pdf", "application/pdf", new byte[] {1});
    MockMultipartFile unnamed = new MockMultipartFile("files", "", null, new byte[] {1});

    assertThat(UploadStorageService.originalName(nested)).isEqualTo("report.pdf");
    assertThat(UploadStorageService.originalName(unnamed))
        .isEqualTo(UploadStorageService.FALLBACK_NAME);
    assertThat(storageService.store(nested).getParent()).isEqualTo(uploadDir);
  }

  @Test
  @DisplayName("Should delete stored uploads and tolerate missing ones")
  void shouldDeleteUpload() {
    Path stored =
        storageService.store(new MockMultipartFile("files", "a.md", null, new byte[] {'#'}));

    storageService.delete(stored);
    storageService.delete(stored);

    assertThat(stored).doesNotExist();
  }
}
