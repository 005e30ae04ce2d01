/*
* Copyright 2016 Samsung Research America. All rights reserved.
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
package org.gemini.recordstore.transport;

import org.gemini.recordstore.RecordCursor;
import org.gemini.recordstore.storage.BackingStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.util.concurrent.Executor;
import java.util.concurrent.Flow;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Publishes a cursor as NDJSON lines (one ByteBuffer per record) to a single subscriber, for non-blocking transports.
 * A record is pulled from the cursor only against outstanding demand. All cursor access happens in one drain loop
 * run on the executor, so cancel() from any thread is safe: it takes effect at the next record boundary, where the
 * cursor is closed.
 */
public class RecordStreamPublisher implements Flow.Publisher<ByteBuffer> {
    private static final Logger logger = LoggerFactory.getLogger(RecordStreamPublisher.class);

    private final RecordCursor cursor;
    private final RecordJsonCodec codec;
    private final Executor executor;
    private final AtomicBoolean subscribed = new AtomicBoolean(false);

    public RecordStreamPublisher(RecordCursor cursor, RecordJsonCodec codec, Executor executor) {
        this.cursor = cursor;
        this.codec = codec;
        this.executor = executor;
    }

    /** Cursors are not restartable: a second subscriber gets onError */
    @Override
    public void subscribe(Flow.Subscriber<? super ByteBuffer> subscriber) {
        if (!subscribed.compareAndSet(false, true)) {
            subscriber.onSubscribe(new Flow.Subscription() {
                @Override
                public void request(long n) {}

                @Override
                public void cancel() {}
            });
            subscriber.onError(new IllegalStateException("record stream already has a subscriber"));
            return;
        }
        RecordSubscription subscription = new RecordSubscription(subscriber);
        subscriber.onSubscribe(subscription);
    }

    private class RecordSubscription implements Flow.Subscription {
        private final Flow.Subscriber<? super ByteBuffer> subscriber;
        private final AtomicLong demand = new AtomicLong();
        private final AtomicInteger wip = new AtomicInteger();
        private volatile boolean cancelled = false;
        private volatile Throwable badRequest = null;
        private boolean done = false;
        private long emitted = 0;

        RecordSubscription(Flow.Subscriber<? super ByteBuffer> subscriber) {
            this.subscriber = subscriber;
        }

        @Override
        public void request(long n) {
            if (n <= 0) {
                badRequest = new IllegalArgumentException("non-positive request " + n);
            } else {
                demand.getAndUpdate(d -> d + n < 0 ? Long.MAX_VALUE : d + n);
            }
            schedule();
        }

        @Override
        public void cancel() {
            cancelled = true;
            schedule();
        }

        private void schedule() {
            if (wip.getAndIncrement() == 0) {
                executor.execute(this::drain);
            }
        }

        private void drain() {
            int missed = 1;
            do {
                drainOnce();
                missed = wip.addAndGet(-missed);
            } while (missed != 0);
        }

        private void drainOnce() {
            if (done) return;
            if (cancelled) {
                finish();
                logger.debug("subscription cancelled after {} records", emitted);
                return;
            }
            if (badRequest != null) {
                finish();
                subscriber.onError(badRequest);
                return;
            }
            try {
                while (demand.get() > 0 && !cancelled) {
                    if (!cursor.hasNext()) {
                        finish();
                        subscriber.onComplete();
                        return;
                    }
                    ByteBuffer line = ByteBuffer.wrap(codec.encodeLine(cursor.next()));
                    demand.decrementAndGet();
                    ++emitted;
                    subscriber.onNext(line);
                }
                if (!cancelled && demand.get() == 0 && !cursor.hasNext()) {
                    finish();
                    subscriber.onComplete();
                }
            } catch (Exception e) {
                finish();
                Throwable cause = e instanceof RuntimeException && e.getCause() instanceof BackingStoreException
                        ? e.getCause()
                        : e;
                subscriber.onError(cause);
            }
        }

        private void finish() {
            done = true;
            cursor.close();
        }
    }
}
