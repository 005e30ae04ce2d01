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

import java.io.IOException;
import java.io.OutputStream;
import java.util.function.BooleanSupplier;

/**
 * Streams a cursor to a blocking output stream as newline-delimited JSON, one record per line. Records are pulled
 * only as fast as the stream accepts bytes, so a slow client throttles the scan instead of growing a buffer.
 *
 * <p>The cursor is always closed: on completion, when the cancellation signal fires (checked before every record),
 * and when the stream fails, which is how a client disconnect shows up.</p>
 */
public class NdjsonRecordWriter {
    private static final Logger logger = LoggerFactory.getLogger(NdjsonRecordWriter.class);

    private final RecordJsonCodec codec;
    private final int flushEveryRecords;

    /** @param flushEveryRecords  flush the stream after this many records; 1 flushes every line */
    public NdjsonRecordWriter(RecordJsonCodec codec, int flushEveryRecords) {
        if (flushEveryRecords < 1) {
            throw new IllegalArgumentException("flush cadence must be >= 1");
        }
        this.codec = codec;
        this.flushEveryRecords = flushEveryRecords;
    }

    public NdjsonRecordWriter() {
        this(new RecordJsonCodec(), 1);
    }

    /** Stream every record of cursor */
    public long write(RecordCursor cursor, OutputStream out) throws IOException, BackingStoreException {
        return write(cursor, out, () -> false);
    }

    /**
     * @param cancelled  polled before each record; once true, streaming stops and the cursor is closed
     * @return number of records written
     * @throws IOException  if the stream fails (e.g. the client went away); the cursor is closed first
     */
    public long write(RecordCursor cursor, OutputStream out, BooleanSupplier cancelled)
            throws IOException, BackingStoreException {
        long written = 0;
        try (RecordCursor c = cursor) {
            while (c.hasNext()) {
                if (cancelled.getAsBoolean()) {
                    logger.debug("stream cancelled after {} records", written);
                    break;
                }
                out.write(codec.encodeLine(c.next()));
                if (++written % flushEveryRecords == 0) {
                    out.flush();
                }
            }
            out.flush();
        } catch (RuntimeException e) {
            if (e.getCause() instanceof BackingStoreException) {
                throw (BackingStoreException) e.getCause();
            } else {
                throw e;
            }
        }
        return written;
    }
}
