package com.mycompany.kvfs.storage;

import com.mycompany.kvfs.POJO.ChunkSlice;
import com.mycompany.kvfs.POJO.ReadPlan;
import io.vertx.core.Handler;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.streams.ReadStream;
import lombok.extern.slf4j.Slf4j;

import java.util.Iterator;

/**
 * Emits a {@link ReadPlan} one chunk slice at a time. Every slice is fetched on a worker thread,
 * the next one only after the previous buffer was handed to the consumer and the stream is not paused.
 */
@Slf4j
public class ChunkReadStream implements ReadStream<Buffer> {

    private final Vertx vertx;
    private final RangeReader reader;
    private final String path;
    private final Iterator<ChunkSlice> sliceIterator;
    private final int length;

    private boolean paused = false;
    private boolean ended = false;
    private boolean failed = false;
    // one worker read at a time
    private boolean readInProgress = false;

    private Handler<Buffer> dataHandler;
    private Handler<Void> endHandler;
    private Handler<Throwable> exceptionHandler;

    public ChunkReadStream(Vertx vertx, RangeReader reader, ReadPlan plan) {
        this.vertx = vertx;
        this.reader = reader;
        this.path = plan.getPath();
        this.sliceIterator = plan.getSlices().iterator();
        this.length = plan.getLength();
    }

    /**
     * Total number of bytes the stream emits.
     */
    public int getLength() {
        return length;
    }

    private void doRead() {
        if (paused || ended || failed || dataHandler == null || readInProgress) {
            return;
        }

        if (!sliceIterator.hasNext()) {
            ended = true;
            if (endHandler != null) {
                endHandler.handle(null);
            }
            return;
        }

        readInProgress = true;
        ChunkSlice slice = sliceIterator.next();

        vertx.<Buffer>executeBlocking(promise -> {
            try {
                promise.complete(Buffer.buffer(reader.readSlice(path, slice)));
            } catch (Exception e) {
                promise.fail(e);
            }
        }, res -> {
            readInProgress = false;
            if (res.succeeded()) {
                if (dataHandler != null) {
                    dataHandler.handle(res.result());
                }
                doRead();
            } else {
                failed = true;
                log.error("Streaming chunk {} of {} failed", slice.getChunkIndex(), path, res.cause());
                if (exceptionHandler != null) {
                    exceptionHandler.handle(res.cause());
                }
            }
        });
    }

    @Override
    public ReadStream<Buffer> handler(Handler<Buffer> handler) {
        this.dataHandler = handler;
        doRead();
        return this;
    }

    @Override
    public ReadStream<Buffer> pause() {
        this.paused = true;
        return this;
    }

    @Override
    public ReadStream<Buffer> resume() {
        if (this.paused) {
            this.paused = false;
            doRead();
        }
        return this;
    }

    @Override
    public ReadStream<Buffer> fetch(long amount) {
        return resume();
    }

    @Override
    public ReadStream<Buffer> endHandler(Handler<Void> endHandler) {
        this.endHandler = endHandler;
        if (ended && endHandler != null) {
            endHandler.handle(null);
        }
        return this;
    }

    @Override
    public ReadStream<Buffer> exceptionHandler(Handler<Throwable> handler) {
        this.exceptionHandler = handler;
        return this;
    }
}
