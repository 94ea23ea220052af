package com.flamingo.ai.podcastcleaner.service.cache;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.podcastcleaner.config.PipelineProperties;
import com.flamingo.ai.podcastcleaner.domain.TranscriptResult;
import com.flamingo.ai.podcastcleaner.exception.CacheWriteException;
import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Durable map from video ID to completed result, persisted as one JSON file.
 *
 * <p>Reads are lock-free. Writes are serialized so that each flush writes a complete snapshot to a
 * sibling temporary file and atomically moves it over the cache file; a crash mid-write never
 * leaves a truncated cache behind.
 */
@Component
@Slf4j
public class ResultCache {

  private static final TypeReference<Map<String, TranscriptResult>> CACHE_TYPE =
      new TypeReference<>() {};

  private final ObjectMapper objectMapper;
  private final Path cacheFile;
  private final Map<String, TranscriptResult> entries = new ConcurrentHashMap<>();
  private final ReentrantLock writeLock = new ReentrantLock();

  public ResultCache(ObjectMapper objectMapper, PipelineProperties pipelineProperties) {
    this.objectMapper = objectMapper;
    this.cacheFile = Paths.get(pipelineProperties.getCache().getFile()).toAbsolutePath();
  }

  @PostConstruct
  public void load() {
    if (!Files.exists(cacheFile)) {
      log.info("No result cache at {}, starting empty", cacheFile);
      return;
    }
    try {
      Map<String, TranscriptResult> stored = objectMapper.readValue(cacheFile.toFile(), CACHE_TYPE);
      if (stored != null) {
        stored.forEach(
            (videoId, result) -> {
              if (videoId != null && result != null) {
                entries.put(videoId, result);
              }
            });
      }
      log.info("Loaded {} cached results from {}", entries.size(), cacheFile);
    } catch (IOException e) {
      log.warn("Result cache {} is unreadable, starting empty: {}", cacheFile, e.getMessage());
    }
  }

  public Optional<TranscriptResult> get(String videoId) {
    return Optional.ofNullable(entries.get(videoId));
  }

  public int size() {
    return entries.size();
  }

  /**
   * Stores a result and flushes the cache to disk before returning.
   *
   * @throws CacheWriteException if the file cannot be written; the in-memory entry is rolled back
   */
  public void put(String videoId, TranscriptResult result) {
    writeLock.lock();
    try {
      TranscriptResult previous = entries.put(videoId, result);
      try {
        writeSnapshot();
      } catch (IOException e) {
        if (previous == null) {
          entries.remove(videoId);
        } else {
          entries.put(videoId, previous);
        }
        throw new CacheWriteException("Failed to save result cache: " + e.getMessage(), e);
      }
    } finally {
      writeLock.unlock();
    }
  }

  /** Writes the current contents to disk. */
  public void flush() {
    writeLock.lock();
    try {
      writeSnapshot();
    } catch (IOException e) {
      throw new CacheWriteException("Failed to save result cache: " + e.getMessage(), e);
    } finally {
      writeLock.unlock();
    }
  }

  private void writeSnapshot() throws IOException {
    Path parent = cacheFile.getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    Path temp = cacheFile.resolveSibling(cacheFile.getFileName() + ".tmp");
    objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), new TreeMap<>(entries));
    try {
      Files.move(
          temp, cacheFile, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException e) {
      Files.move(temp, cacheFile, StandardCopyOption.REPLACE_EXISTING);
    }
    log.debug("Flushed {} cached results to {}", entries.size(), cacheFile);
  }
}
