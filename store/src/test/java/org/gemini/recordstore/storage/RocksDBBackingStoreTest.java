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
package org.gemini.recordstore.storage;

import org.gemini.recordstore.DuplicateRecordException;
import org.gemini.recordstore.Record;
import org.gemini.recordstore.RecordCursor;
import org.gemini.recordstore.RecordKind;
import org.gemini.recordstore.Utilities;
import org.gemini.recordstore.views.RecordSummaryView;
import org.gemini.recordstore.views.RecordView;
import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.nio.ByteBuffer;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class RocksDBBackingStoreTest {
    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private final RecordSummaryView summary = new RecordSummaryView(RecordKind.TRAIT);
    private String path;
    private RocksDBBackingStore backingStore;
    private RecordTableManager traits;

    @Before
    public void setUp() throws Exception {
        path = folder.getRoot().getAbsolutePath() + "/rocksdb";
        open();
    }

    private void open() throws Exception {
        backingStore = new RocksDBBackingStore(path, 8L << 20, 500, 3);
        traits = new RecordTableManager(RecordKind.TRAIT, Collections.<RecordView<?>>singletonList(summary),
                backingStore);
    }

    @After
    public void tearDown() throws Exception {
        backingStore.close();
    }

    private static Record trait(long seconds, String site, double value) {
        return Record.builder(RecordKind.TRAIT)
                .id(UUID.randomUUID())
                .timestamp(Instant.ofEpochSecond(seconds))
                .collectionDate(LocalDate.parse("2023-09-05"))
                .dataset(UUID.nameUUIDFromBytes(new byte[]{1}), "D1")
                .entity(UUID.nameUUIDFromBytes(new byte[]{2}), "Plant Height")
                .site(site == null ? null : UUID.nameUUIDFromBytes(site.getBytes()), site)
                .value(value)
                .build();
    }

    private static List<Record> drain(RecordCursor cursor) {
        List<Record> ret = new ArrayList<>();
        try (RecordCursor c = cursor) {
            while (c.hasNext()) {
                ret.add(c.next());
            }
        }
        return ret;
    }

    @Test
    public void preEpochTimestampsSortFirst() throws Exception {
        traits.insert(trait(10, "S", 1));
        traits.insert(trait(-10, "S", 2));
        traits.insert(trait(0, "S", 3));
        List<Record> all = drain(traits.scan(Long.MIN_VALUE, Long.MAX_VALUE, ScanPredicate.all()));
        assertEquals(3, all.size());
        assertEquals(Instant.ofEpochSecond(-10), all.get(0).getTimestamp());
        assertEquals(Instant.ofEpochSecond(0), all.get(1).getTimestamp());
        assertEquals(Instant.ofEpochSecond(10), all.get(2).getTimestamp());
    }

    @Test
    public void nameConstraintsArePushedDown() throws Exception {
        for (int i = 0; i < 100; ++i) {
            traits.insert(trait(i, i % 10 == 0 ? "A" : (i % 3 == 0 ? null : "B"), i));
        }
        ScanPredicate onlyA = ScanPredicate.of(
                Collections.singletonMap(Column.SITE_NAME, new HashSet<>(Collections.singletonList("A"))), null);
        List<Record> rows = drain(traits.scan(Long.MIN_VALUE, Long.MAX_VALUE, onlyA));
        assertEquals(10, rows.size());
        for (Record r : rows) {
            assertEquals("A", r.getSiteName());
        }

        ScanPredicate residual = ScanPredicate.of(Collections.<Column, HashSet<String>>emptyMap(),
                r -> r.getValue() >= 50);
        assertEquals(50, drain(traits.scan(Utilities.toEpochMicros(Instant.ofEpochSecond(0)), Long.MAX_VALUE,
                residual)).size());
        assertEquals(25, drain(traits.scan(Utilities.toEpochMicros(Instant.ofEpochSecond(0)),
                Utilities.toEpochMicros(Instant.ofEpochSecond(75)), residual)).size());
    }

    @Test
    public void cursorSeesSnapshot() throws Exception {
        traits.insert(trait(1, "S", 1));
        traits.insert(trait(2, "S", 2));
        RecordCursor cursor = traits.scan(Long.MIN_VALUE, Long.MAX_VALUE, ScanPredicate.all());
        traits.insert(trait(3, "S", 3));
        List<Record> seen = drain(cursor);
        assertEquals(2, seen.size());
        assertEquals(3, traits.getNumRecords());
    }

    @Test
    public void persistsAcrossReopen() throws Exception {
        Record a = trait(1, "S", 1.5), b = trait(2, null, 2.5);
        traits.insert(a);
        traits.insert(b);
        backingStore.close();
        open();

        assertEquals(a, traits.get(a.getId()));
        assertEquals(b, traits.get(b.getId()));
        assertEquals(2, traits.getNumRecords());
        assertEquals(a.getId(), traits.findIdByNaturalKey(trait(1, "S", 9)));
        try {
            traits.insert(trait(1, "S", 9));
            fail("expected DuplicateRecordException");
        } catch (DuplicateRecordException e) {
            assertEquals(a.getId(), e.getExistingId());
        }
        Map<ByteBuffer, byte[]> groups = traits.getViewState(summary);
        assertEquals(2, groups.size());
    }

    @Test
    public void deleteRemovesEveryKey() throws Exception {
        Record a = trait(1, "S", 1.5);
        traits.insert(a);
        assertEquals(a, traits.delete(a.getId()));
        assertNull(traits.get(a.getId()));
        assertNull(traits.delete(a.getId()));
        assertNull(traits.findIdByNaturalKey(a));
        assertEquals(0, traits.getNumRecords());
        assertTrue(traits.getViewState(summary).isEmpty());
        try (RecordCursor cursor = traits.scan(Long.MIN_VALUE, Long.MAX_VALUE, ScanPredicate.all())) {
            assertFalse(cursor.hasNext());
        }
    }

    @Test
    public void rebuildReplacesViewState() throws Exception {
        List<Record> rows = new ArrayList<>();
        for (int i = 0; i < 5; ++i) {
            Record r = trait(i, i < 3 ? "A" : "B", i);
            rows.add(r);
            traits.insert(r);
        }
        traits.delete(rows.get(3).getId());
        traits.delete(rows.get(4).getId());
        traits.rebuildView(summary);

        Map<ByteBuffer, byte[]> state = traits.getViewState(summary);
        assertEquals(1, state.size());
        Map.Entry<ByteBuffer, byte[]> only = state.entrySet().iterator().next();
        assertEquals("A", summary.decodeGroup(only.getKey().array(), only.getValue()).getSiteName());
        assertEquals(3, summary.deserialize(only.getValue()).getCount());
    }
}
