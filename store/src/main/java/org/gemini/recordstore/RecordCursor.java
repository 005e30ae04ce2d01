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
package org.gemini.recordstore;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Forward-only, lazily evaluated sequence of records in timestamp order. Rows are produced on demand, so a cursor
 * over an arbitrarily large result holds a bounded amount of memory. Must be closed; closing early releases the
 * underlying scan, after which {@link #hasNext()} returns false. Closing twice is a no-op.
 *
 * <p>Storage failures during iteration surface as a RuntimeException whose cause is a BackingStoreException.</p>
 */
public interface RecordCursor extends Iterator<Record>, AutoCloseable {
    @Override
    void close();

    /** Cursor over an in-memory iterator. onClose may be null. */
    static RecordCursor of(Iterator<Record> iterator, Runnable onClose) {
        return new RecordCursor() {
            private boolean closed = false;

            @Override
            public boolean hasNext() {
                return !closed && iterator.hasNext();
            }

            @Override
            public Record next() {
                if (!hasNext()) throw new NoSuchElementException();
                return iterator.next();
            }

            @Override
            public void close() {
                if (!closed) {
                    closed = true;
                    if (onClose != null) onClose.run();
                }
            }
        };
    }
}
