/*
 * Copyright © 2025 ANEO (armonik@aneo.fr)
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package fr.aneo.imagepublisher.client.upload;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import fr.aneo.imagepublisher.client.exception.UploadException;
import fr.aneo.imagepublisher.client.retry.RequestContext;
import fr.aneo.imagepublisher.client.retry.RequestExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static fr.aneo.imagepublisher.client.internal.concurrent.Futures.unwrap;
import static java.util.Objects.requireNonNull;

/**
 * Uploads the chunks of an {@link UploadSession} in parallel and commits the blob once all of
 * them are uploaded.
 * <p>
 * At most {@link UploadSession#concurrencyLimit()} chunks are in flight at any time. Each chunk is
 * read once on a reader pool owned by the upload, then sent through the {@link RequestExecutor}
 * with a retry budget of {@link UploadSession#maxAttemptsPerChunk()}. Chunks of a
 * {@link ChunkReader#sequential() sequential} reader are read one at a time, in chunk order.
 * When a chunk fails permanently no further chunk is dispatched and in-flight chunks are allowed
 * to finish. The blob is then never committed and the upload fails with an {@link UploadException}.
 * </p>
 * An upload holding a single chunk is sent in one shot through {@link BlobUploadTarget#uploadSingle}.
 */
public final class ConcurrentUploader {
  private static final Logger logger = LoggerFactory.getLogger(ConcurrentUploader.class);

  private final RequestExecutor executor;
  private final Clock clock;

  public ConcurrentUploader(RequestExecutor executor) {
    this(executor, Clock.systemUTC());
  }

  ConcurrentUploader(RequestExecutor executor, Clock clock) {
    this.executor = requireNonNull(executor, "executor must not be null");
    this.clock = requireNonNull(clock, "clock must not be null");
  }

  /**
   * Uploads a session.
   *
   * @param session the chunks to upload; must not have been uploaded before
   * @param target  the destination blob
   * @param reader  source of the chunk bytes
   * @return a stage completing once the blob is committed, or exceptionally with an
   * {@link UploadException} when a chunk failed, or with the failure of the prepare or commit call.
   * Cancelling the stage stops dispatching new chunks.
   */
  public CompletionStage<UploadResult> upload(UploadSession session, BlobUploadTarget target, ChunkReader reader) {
    requireNonNull(session, "session must not be null");
    requireNonNull(target, "target must not be null");
    requireNonNull(reader, "reader must not be null");

    var startedAt = clock.instant();
    logger.atInfo()
          .addKeyValue("blob", session.blobName())
          .addKeyValue("size", session.size())
          .addKeyValue("chunks", session.chunks().size())
          .addKeyValue("concurrency", session.concurrencyLimit())
          .log("Starting upload");

    if (session.chunks().size() == 1) {
      return uploadSingle(session, target, reader).thenApply(ignored -> completed(session, startedAt));
    }

    var dispatch = new Dispatch(session, target, reader);
    var result = executor.executeAuthenticated(
                           token -> target.prepare(session.size(), token),
                           RequestContext.of("prepare blob " + session.blobName(), target.tokenScope()))
                         .thenCompose(ignored -> dispatch.run())
                         .thenCompose(ignored -> executor.executeAuthenticated(
                           token -> target.commit(session.chunks(), token),
                           RequestContext.of("commit blob " + session.blobName(), target.tokenScope())))
                         .thenApply(ignored -> completed(session, startedAt))
                         .toCompletableFuture();
    result.whenComplete((ignored, error) -> dispatch.stop());
    return result;
  }

  private UploadResult completed(UploadSession session, Instant startedAt) {
    var result = new UploadResult(session.blobName(), session.size(), session.chunks().size(), Duration.between(startedAt, clock.instant()));
    logger.atInfo()
          .addKeyValue("blob", result.blobName())
          .addKeyValue("elapsedMs", result.elapsed().toMillis())
          .log("Upload committed");
    return result;
  }

  private CompletionStage<Void> uploadSingle(UploadSession session, BlobUploadTarget target, ChunkReader reader) {
    var chunk = session.chunks().get(0);
    var context = chunkContext(session, chunk, target);
    var readers = readerPool(session, 1);
    chunk.markInFlight();
    return CompletableFuture.supplyAsync(() -> read(reader, chunk), readers)
                            .thenCompose(data -> executor.executeAuthenticated(token -> target.uploadSingle(chunk, data, token), context))
                            .handle((ignored, error) -> {
                              readers.shutdown();
                              if (error == null) {
                                chunk.markCommitted(context.attemptCount());
                                return null;
                              }
                              chunk.markFailed(context.attemptCount(), unwrap(error));
                              throw new UploadException(session.blobName(), false, session.failedChunks());
                            });
  }

  private static ExecutorService readerPool(UploadSession session, int size) {
    return Executors.newFixedThreadPool(size, new ThreadFactoryBuilder()
      .setNameFormat("chunk-reader-" + session.blobName() + "-%d")
      .setDaemon(true)
      .build());
  }

  private RequestContext chunkContext(UploadSession session, Chunk chunk, BlobUploadTarget target) {
    var policy = executor.defaultPolicy().withMaxAttempts(session.maxAttemptsPerChunk());
    return RequestContext.of("upload chunk " + chunk.index() + " of " + session.blobName(), target.tokenScope()).withPolicy(policy);
  }

  private static byte[] read(ChunkReader reader, Chunk chunk) {
    try {
      return reader.read(chunk.range());
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  /**
   * Dispatch loop of one chunked upload. Reads are blocking and run on a pool sized to the
   * concurrency limit, or on a single thread for a sequential reader; the pool is shut down once
   * the upload ends.
   */
  private final class Dispatch {
    private final UploadSession session;
    private final BlobUploadTarget target;
    private final ChunkReader reader;
    private final Iterator<Chunk> pending;
    private final ExecutorService readers;
    private final CompletableFuture<Void> done = new CompletableFuture<>();
    private boolean aborted;

    private Dispatch(UploadSession session, BlobUploadTarget target, ChunkReader reader) {
      this.session = session;
      this.target = target;
      this.reader = reader;
      this.pending = session.chunks().iterator();
      this.readers = readerPool(session, reader.sequential() ? 1 : session.concurrencyLimit());
    }

    private CompletableFuture<Void> run() {
      pump();
      return done;
    }

    private synchronized void stop() {
      aborted = true;
      done.cancel(false);
      readers.shutdown();
    }

    private synchronized void pump() {
      while (!aborted && !done.isDone() && pending.hasNext() && session.inFlight().get() < session.concurrencyLimit()) {
        var chunk = pending.next();
        session.inFlight().incrementAndGet();
        chunk.markInFlight();
        send(chunk);
      }

      if (session.inFlight().get() == 0 && (aborted || !pending.hasNext())) {
        var failed = session.failedChunks();
        if (failed.isEmpty()) {
          done.complete(null);
        } else {
          done.completeExceptionally(new UploadException(session.blobName(), true, failed));
        }
      }
    }

    private void send(Chunk chunk) {
      var context = chunkContext(session, chunk, target);
      CompletionStage<Void> stage;
      try {
        stage = CompletableFuture.supplyAsync(() -> read(reader, chunk), readers)
                                 .thenCompose(data -> executor.executeAuthenticated(token -> target.uploadChunk(chunk, data, token), context));
      } catch (RuntimeException e) {
        stage = CompletableFuture.failedFuture(e);
      }

      stage.whenComplete((ignored, error) -> {
        if (error == null) {
          chunk.markCommitted(context.attemptCount());
          logger.atDebug()
                .addKeyValue("blob", session.blobName())
                .addKeyValue("chunk", chunk.index())
                .addKeyValue("attempts", context.attemptCount())
                .log("Chunk uploaded");
        } else {
          chunk.markFailed(context.attemptCount(), unwrap(error));
          logger.atError()
                .addKeyValue("blob", session.blobName())
                .addKeyValue("chunk", chunk.index())
                .addKeyValue("attempts", context.attemptCount())
                .setCause(unwrap(error))
                .log("Chunk upload failed, aborting upload");
          synchronized (this) {
            aborted = true;
          }
        }
        session.inFlight().decrementAndGet();
        pump();
      });
    }
  }
}
