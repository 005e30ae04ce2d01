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

import com.fasterxml.jackson.databind.ObjectMapper;
import org.gemini.recordstore.Record;
import org.gemini.recordstore.RecordCursor;
import org.gemini.recordstore.storage.BackingStoreException;
import org.junit.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class NdjsonRecordWriterTest {
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicInteger produced = new AtomicInteger();

    /** Cursor that produces records on demand and counts them */
    private RecordCursor cursor(int n) {
        Iterator<Record> it = new Iterator<Record>() {
            @Override
            public boolean hasNext() {
                return produced.get() < n;
            }

            @Override
            public Record next() {
                return RecordJsonCodecTest.sensor(produced.getAndIncrement());
            }
        };
        return RecordCursor.of(it, () -> closed.set(true));
    }

    @Test
    public void oneObjectPerLine() throws Exception {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        long written = new NdjsonRecordWriter().write(cursor(5), out);
        assertEquals(5, written);
        assertTrue(closed.get());

        String[] lines = new String(out.toByteArray(), StandardCharsets.UTF_8).split("\n");
        assertEquals(5, lines.length);
        ObjectMapper mapper = new ObjectMapper();
        for (int i = 0; i < lines.length; ++i) {
            assertEquals(i, mapper.readTree(lines[i]).get("sensor_data").get("i").asInt());
        }
    }

    @Test
    public void emptyResultWritesNothing() throws Exception {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        assertEquals(0, new NdjsonRecordWriter().write(cursor(0), out));
        assertEquals(0, out.size());
        assertTrue(closed.get());
    }

    @Test
    public void cancellationStopsProduction() throws Exception {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        long written = new NdjsonRecordWriter().write(cursor(1000), out, () -> produced.get() >= 3);
        assertEquals(3, written);
        assertEquals(3, produced.get());
        assertTrue(closed.get());
    }

    @Test
    public void flushCadence() throws Exception {
        List<Integer> flushedAt = new ArrayList<>();
        ByteArrayOutputStream sink = new ByteArrayOutputStream();
        OutputStream out = new OutputStream() {
            @Override
            public void write(int b) {
                sink.write(b);
            }

            @Override
            public void write(byte[] b, int off, int len) {
                sink.write(b, off, len);
            }

            @Override
            public void flush() {
                flushedAt.add(produced.get());
            }
        };
        new NdjsonRecordWriter(new RecordJsonCodec(), 4).write(cursor(10), out);
        // every 4 records, then once at the end
        assertEquals(3, flushedAt.size());
        assertEquals(4, (int) flushedAt.get(0));
        assertEquals(8, (int) flushedAt.get(1));
        assertEquals(10, (int) flushedAt.get(2));
    }

    @Test
    public void brokenStreamClosesCursor() throws Exception {
        OutputStream out = new OutputStream() {
            @Override
            public void write(int b) throws IOException {
                throw new IOException("connection reset");
            }
        };
        try {
            new NdjsonRecordWriter().write(cursor(10), out);
            fail("expected IOException");
        } catch (IOException expected) {
        }
        assertTrue(closed.get());
        assertEquals(1, produced.get());
    }

    @Test
    public void backingStoreFailureIsUnwrapped() throws Exception {
        Iterator<Record> failing = new Iterator<Record>() {
            @Override
            public boolean hasNext() {
                throw new RuntimeException(new BackingStoreException("disk gone"));
            }

            @Override
            public Record next() {
                throw new IllegalStateException();
            }
        };
        try {
            new NdjsonRecordWriter().write(RecordCursor.of(failing, () -> closed.set(true)),
                    new ByteArrayOutputStream());
            fail("expected BackingStoreException");
        } catch (BackingStoreException e) {
            assertEquals("disk gone", e.getMessage());
        }
        assertTrue(closed.get());
    }

    @Test(expected = IllegalArgumentException.class)
    public void flushCadenceMustBePositive() {
        new NdjsonRecordWriter(new RecordJsonCodec(), 0);
    }
}
