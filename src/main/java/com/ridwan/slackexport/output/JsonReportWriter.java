package com.ridwan.slackexport.output;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;

import org.springframework.stereotype.Service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ridwan.slackexport.model.DigestReport;
import com.ridwan.slackexport.model.ExportDocument;

import lombok.extern.slf4j.Slf4j;

/** Writes reports as pretty-printed JSON, replacing the target file atomically. */
@Slf4j
@Service
public class JsonReportWriter {

  private final ObjectMapper objectMapper;

  public JsonReportWriter(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public Path writeExport(String outputPath, ExportDocument document) throws IOException {
    log.info(
        "Writing export to {}: {} threads, {} standalone messages, {} channels",
        outputPath,
        document.getThreads().size(),
        document.getStandaloneMessages().size(),
        document.getChannels().size());
    return write(Paths.get(outputPath), document);
  }

  public Path writeDigest(String outputPath, DigestReport report) throws IOException {
    log.info(
        "Writing digest to {}: {} mentions ({} unhandled), {} replies",
        outputPath,
        report.getSummary().getTotalMentions(),
        report.getSummary().getUnhandledMentions(),
        report.getSummary().getTotalReplies());
    return write(Paths.get(outputPath), report);
  }

  private Path write(Path path, Object value) throws IOException {
    Path target = path.toAbsolutePath();
    Files.createDirectories(target.getParent());

    // Write next to the target so the final move stays on one filesystem
    Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
    objectMapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), value);
    Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);

    log.debug("Report written to {}", target);
    return target;
  }
}
