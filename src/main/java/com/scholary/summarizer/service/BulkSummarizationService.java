package com.scholary.summarizer.service;

import com.scholary.summarizer.aggregate.AggregateResult;
import com.scholary.summarizer.config.SummarizerProperties;
import com.scholary.summarizer.config.SummarizerProperties.BulkProperties;
import com.scholary.summarizer.webhook.ChunkDispatcher;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.function.BooleanSupplier;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Summarizes every supported file of a folder, one after another.
 *
 * <p>Summaries go to a sibling folder named after the source folder plus a suffix, e.g. {@code
 * notes/a.txt} produces {@code notes - Summarized/a_summary.txt}. Each file is sent with its real
 * on-disk size so the piece count is exact. A file that cannot be read, is empty or gets no result
 * is counted as failed and the run moves on.
 *
 * <p>Only folders below the configured root are accepted, so a client cannot point a run at
 * arbitrary files on the host.
 */
@Service
public class BulkSummarizationService {

  private static final Logger LOGGER = LoggerFactory.getLogger(BulkSummarizationService.class);

  static final String SUMMARY_FILE_SUFFIX = "_summary.txt";
  private static final int MAX_REASON_CHARS = 60;

  private final SummarizationService summarizationService;
  private final BulkProperties properties;

  public BulkSummarizationService(
      SummarizationService summarizationService, SummarizerProperties properties) {
    this.summarizationService = summarizationService;
    this.properties = properties.bulk();
  }

  /**
   * Listener notified after each file.
   *
   * <p>Used by the job runner to update progress.
   */
  @FunctionalInterface
  public interface ProgressListener {
    void onFileProcessed(int processed, int total, String fileName);
  }

  /**
   * Find the files a bulk run would process.
   *
   * @param folder the source folder
   * @return regular files with a supported extension, sorted by name
   * @throws BulkSummaryException if the folder does not exist, lies outside the configured root
   *     or cannot be listed
   */
  public List<Path> discoverFiles(Path folder) {
    return listSupported(resolveFolder(folder));
  }

  /**
   * Resolve a requested folder against the configured root.
   *
   * <p>Symbolic links and {@code ..} segments are resolved first. The folder must lie strictly
   * below the root, because its output folder is created next to it.
   *
   * @throws BulkSummaryException if the folder is missing or outside the root
   */
  Path resolveFolder(Path folder) {
    if (!Files.isDirectory(folder)) {
      throw new BulkSummaryException("Not a directory: " + folder);
    }
    Path root;
    Path resolved;
    try {
      root = Path.of(properties.rootFolder()).toRealPath();
      resolved = folder.toRealPath();
    } catch (IOException e) {
      throw new BulkSummaryException("Cannot resolve folder: " + folder, e);
    }
    if (!resolved.startsWith(root) || resolved.equals(root)) {
      LOGGER.warn("Rejected folder outside bulk root {}: {}", root, resolved);
      throw new BulkSummaryException("Folder is outside the allowed root: " + folder);
    }
    return resolved;
  }

  private List<Path> listSupported(Path folder) {
    try (Stream<Path> entries = Files.list(folder)) {
      List<Path> files =
          entries
              .filter(Files::isRegularFile)
              .filter(this::isSupported)
              .sorted(Comparator.comparing(p -> p.getFileName().toString()))
              .toList();
      LOGGER.info("Discovered {} supported files in {}", files.size(), folder);
      return files;
    } catch (IOException e) {
      throw new BulkSummaryException("Failed to list folder: " + folder, e);
    }
  }

  /**
   * Summarize every supported file in a folder.
   *
   * @param folder the source folder
   * @param shouldContinue checked before each file and between pieces of a file
   * @param listener notified after each file
   * @return counts of succeeded and failed files
   * @throws BulkSummaryException if the folder is outside the configured root, cannot be listed or
   *     the output folder cannot be created
   * @throws com.scholary.summarizer.webhook.WebhookConfigurationException if the webhook URL is
   *     missing or invalid
   */
  public BulkSummaryReport summarizeFolder(
      Path folder, BooleanSupplier shouldContinue, ProgressListener listener) {
    ChunkDispatcher.requireEndpoint(summarizationService.currentSettings());
    Path source = resolveFolder(folder);
    List<Path> files = listSupported(source);
    Path outputFolder = createOutputFolder(source);
    int total = files.size();

    LOGGER.info("Bulk processing started: {} files, output: {}", total, outputFolder);

    int succeeded = 0;
    List<String> failedFiles = new ArrayList<>();
    boolean cancelled = false;
    int processed = 0;

    for (Path file : files) {
      if (!shouldContinue.getAsBoolean()) {
        LOGGER.warn("Processing stopped by user after {}/{} files", processed, total);
        cancelled = true;
        break;
      }

      String fileName = file.getFileName().toString();
      try {
        summarizeFile(file, outputFolder, shouldContinue);
        succeeded++;
        LOGGER.info("Successfully processed {}", fileName);
      } catch (IOException | RuntimeException e) {
        LOGGER.error("Error processing {}: {}", fileName, e.getMessage());
        failedFiles.add(fileName + ": " + shorten(e.getMessage()));
      }

      processed++;
      listener.onFileProcessed(processed, total, fileName);
    }

    LOGGER.info(
        "Bulk processing finished: {} succeeded, {} failed, {} total",
        succeeded,
        failedFiles.size(),
        total);
    return new BulkSummaryReport(
        outputFolder.toString(), total, succeeded, failedFiles.size(), failedFiles, cancelled);
  }

  private void summarizeFile(Path file, Path outputFolder, BooleanSupplier shouldContinue)
      throws IOException {
    byte[] bytes = Files.readAllBytes(file);
    String content = new String(bytes, StandardCharsets.UTF_8);
    if (content.isBlank()) {
      throw new IOException("File is empty");
    }

    String stem = stem(file);
    LOGGER.info(
        "Processing {} ({} chars, {} bytes)", file.getFileName(), content.length(), bytes.length);

    AggregateResult result =
        summarizationService.send(stem, content, (long) bytes.length, null, shouldContinue);
    if (result.cancelled()) {
      throw new IOException("Cancelled before all chunks were sent");
    }
    if (!result.success() || result.combinedText() == null) {
      throw new IOException(
          result.errorSummary() != null ? result.errorSummary() : "No result from webhook");
    }

    Path summaryFile = outputFolder.resolve(stem + SUMMARY_FILE_SUFFIX);
    Files.writeString(summaryFile, result.combinedText(), StandardCharsets.UTF_8);
    LOGGER.info("Saved summary: {}", summaryFile);
  }

  private Path createOutputFolder(Path folder) {
    Path absolute = folder.toAbsolutePath().normalize();
    Path parent = absolute.getParent();
    if (parent == null || absolute.getFileName() == null) {
      throw new BulkSummaryException("Cannot create an output folder next to " + folder);
    }
    Path output = parent.resolve(absolute.getFileName() + properties.outputFolderSuffix());
    try {
      Files.createDirectories(output);
      LOGGER.info("Created output folder: {}", output);
      return output;
    } catch (IOException e) {
      throw new BulkSummaryException("Failed to create output folder: " + output, e);
    }
  }

  private boolean isSupported(Path file) {
    String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
    return properties.supportedExtensions().stream()
        .anyMatch(ext -> name.endsWith(ext.toLowerCase(Locale.ROOT)));
  }

  private static String stem(Path file) {
    String name = file.getFileName().toString();
    int dot = name.lastIndexOf('.');
    return dot > 0 ? name.substring(0, dot) : name;
  }

  private static String shorten(String message) {
    if (message == null) {
      return "Unknown error";
    }
    return message.length() > MAX_REASON_CHARS ? message.substring(0, MAX_REASON_CHARS) : message;
  }
}
