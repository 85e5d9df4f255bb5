package com.ridwan.slackexport.testsupport;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ridwan.slackexport.checkpoint.ExportStateStore;
import com.ridwan.slackexport.model.ExportJob;

/**
 * Keeps jobs as JSON strings, so a loaded job is a detached copy exactly like one read back
 * from disk.
 */
public class InMemoryExportStateStore implements ExportStateStore {

  private final ObjectMapper objectMapper = TestObjectMappers.create();
  private final Map<String, String> jobs = new HashMap<>();
  private final Set<String> locked = new HashSet<>();
  private int saveCount;

  @Override
  public Optional<ExportJob> load(String workspace) {
    String json = jobs.get(workspace);
    if (json == null) {
      return Optional.empty();
    }
    try {
      return Optional.of(objectMapper.readValue(json, ExportJob.class));
    } catch (JsonProcessingException e) {
      throw new IllegalStateException(e);
    }
  }

  @Override
  public void save(String workspace, ExportJob job) {
    try {
      jobs.put(workspace, objectMapper.writeValueAsString(job));
      saveCount++;
    } catch (JsonProcessingException e) {
      throw new IllegalStateException(e);
    }
  }

  @Override
  public void delete(String workspace) {
    jobs.remove(workspace);
  }

  @Override
  public Optional<WorkspaceLock> tryLock(String workspace) {
    if (!locked.add(workspace)) {
      return Optional.empty();
    }
    WorkspaceLock lock = () -> locked.remove(workspace);
    return Optional.of(lock);
  }

  public boolean isLocked(String workspace) {
    return locked.contains(workspace);
  }

  public int getSaveCount() {
    return saveCount;
  }
}
