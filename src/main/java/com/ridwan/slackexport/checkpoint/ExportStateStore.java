package com.ridwan.slackexport.checkpoint;

import java.util.Optional;

import com.ridwan.slackexport.model.ExportJob;

/**
 * Durable, workspace-keyed record of export jobs. It is the pipeline's only persisted memory.
 *
 * <p>Single writer per workspace: callers must hold the lock from {@link #tryLock(String)} while
 * running a job, so two processes never checkpoint the same workspace concurrently.
 */
public interface ExportStateStore {

  Optional<ExportJob> load(String workspace);

  /** Overwrites the stored job. The write is durable when this method returns. */
  void save(String workspace, ExportJob job);

  void delete(String workspace);

  /**
   * Takes the advisory lock for a workspace.
   *
   * @return the held lock, or empty when another run already holds it
   */
  Optional<WorkspaceLock> tryLock(String workspace);

  interface WorkspaceLock extends AutoCloseable {
    @Override
    void close();
  }
}
