package com.ridwan.slackexport.checkpoint;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.Optional;

import org.springframework.stereotype.Service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ridwan.slackexport.config.ExportConfig;
import com.ridwan.slackexport.model.ExportJob;

import lombok.extern.slf4j.Slf4j;

/** Stores each workspace's job as pretty-printed JSON under the configured state directory. */
@Service
@Slf4j
public class FileExportStateStore implements ExportStateStore {

  private final ObjectMapper objectMapper;
  private final Path stateDir;

  public FileExportStateStore(ObjectMapper objectMapper, ExportConfig exportConfig) {
    this.objectMapper = objectMapper;
    this.stateDir = Paths.get(exportConfig.getStateDir());
  }

  @Override
  public Optional<ExportJob> load(String workspace) {
    Path path = jobPath(workspace);

    if (!Files.exists(path)) {
      log.info("No export state found at: {}", path);
      return Optional.empty();
    }

    try {
      log.info("Loading export state from: {}", path);
      ExportJob job = objectMapper.readValue(path.toFile(), ExportJob.class);
      log.info(
          "Export state loaded: job {} is {} (page {}/{}, {}/{} threads)",
          job.getId(),
          job.getStatus().getValue(),
          job.getSearchProgress().getCurrentPage(),
          job.getSearchProgress().getTotalPages(),
          job.getThreadProgress().getFetched().size(),
          job.getThreadProgress().getPending().size());
      return Optional.of(job);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read export state " + path, e);
    }
  }

  @Override
  public void save(String workspace, ExportJob job) {
    job.setUpdatedAt(Instant.now());
    Path path = jobPath(workspace);
    Path tmp = path.resolveSibling(path.getFileName() + ".tmp");

    try {
      Files.createDirectories(stateDir);

      byte[] json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(job);
      Files.write(tmp, json);
      try (FileChannel channel = FileChannel.open(tmp, StandardOpenOption.WRITE)) {
        channel.force(true);
      }
      Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);

      log.debug(
          "Checkpoint saved for job {} ({}): {} threads, {} standalone messages",
          job.getId(),
          job.getStatus().getValue(),
          job.getAccumulatedData().getThreads().size(),
          job.getAccumulatedData().getStandaloneMessages().size());
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to save export state " + path, e);
    }
  }

  @Override
  public void delete(String workspace) {
    Path path = jobPath(workspace);
    try {
      if (Files.deleteIfExists(path)) {
        log.info("Export state deleted: {}", path);
      }
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to delete export state " + path, e);
    }
  }

  @Override
  public Optional<WorkspaceLock> tryLock(String workspace) {
    Path lockPath = stateDir.resolve(fileName(workspace) + ".lock");
    FileChannel channel = null;
    try {
      Files.createDirectories(stateDir);
      channel =
          FileChannel.open(lockPath, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
      FileLock lock = channel.tryLock();
      if (lock == null) {
        channel.close();
        return Optional.empty();
      }
      return Optional.of(new FileWorkspaceLock(channel, lock, lockPath));
    } catch (OverlappingFileLockException e) {
      closeQuietly(channel);
      return Optional.empty();
    } catch (IOException e) {
      closeQuietly(channel);
      throw new UncheckedIOException("Failed to lock " + lockPath, e);
    }
  }

  Path jobPath(String workspace) {
    return stateDir.resolve(fileName(workspace) + ".json");
  }

  private static String fileName(String workspace) {
    return "export_" + workspace.replaceAll("[^A-Za-z0-9._-]", "_");
  }

  private static void closeQuietly(FileChannel channel) {
    if (channel == null) {
      return;
    }
    try {
      channel.close();
    } catch (IOException e) {
      log.debug("Failed to close lock channel: {}", e.getMessage());
    }
  }

  private static final class FileWorkspaceLock implements WorkspaceLock {

    private final FileChannel channel;
    private final FileLock lock;
    private final Path path;

    private FileWorkspaceLock(FileChannel channel, FileLock lock, Path path) {
      this.channel = channel;
      this.lock = lock;
      this.path = path;
    }

    @Override
    public void close() {
      try {
        lock.release();
        channel.close();
      } catch (IOException e) {
        throw new UncheckedIOException("Failed to release " + path, e);
      }
    }
  }
}
