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
package org.gemini.recordstore.views;

import org.gemini.recordstore.Utilities;

import java.io.Serializable;
import java.time.Instant;

/**
 * Aggregate for one group of a summary view. Immutable.
 *
 * <p>Count and sum are exact under inserts and deletes. First/last timestamp and min/max value cannot be maintained
 * under deletes in constant work, so a delete that removes a current extreme sets {@link #isStale()}; the exact values
 * come back with the next view rebuild.</p>
 */
public final class RecordSummary implements Serializable {
    static final RecordSummary EMPTY = new RecordSummary(0, Long.MAX_VALUE, Long.MIN_VALUE, 0, 0,
            Double.POSITIVE_INFINITY, Double.NEGATIVE_INFINITY, false);

    final long count;
    final long firstMicros, lastMicros;
    /** number of records that carried a value */
    final long valueCount;
    final double sum, min, max;
    final boolean stale;

    RecordSummary(long count, long firstMicros, long lastMicros, long valueCount, double sum, double min, double max,
                  boolean stale) {
        this.count = count;
        this.firstMicros = firstMicros;
        this.lastMicros = lastMicros;
        this.valueCount = valueCount;
        this.sum = sum;
        this.min = min;
        this.max = max;
        this.stale = stale;
    }

    public long getCount() {
        return count;
    }

    public Instant getFirstTimestamp() {
        return count > 0 ? Utilities.fromEpochMicros(firstMicros) : null;
    }

    public Instant getLastTimestamp() {
        return count > 0 ? Utilities.fromEpochMicros(lastMicros) : null;
    }

    public long getValueCount() {
        return valueCount;
    }

    public double getSum() {
        return sum;
    }

    /** NaN if no record in the group carried a value */
    public double getMean() {
        return valueCount > 0 ? sum / valueCount : Double.NaN;
    }

    public double getMin() {
        return valueCount > 0 ? min : Double.NaN;
    }

    public double getMax() {
        return valueCount > 0 ? max : Double.NaN;
    }

    /** True if first/last/min/max may be wider than the group's actual contents */
    public boolean isStale() {
        return stale;
    }

    @Override
    public String toString() {
        return String.format("<summary: %d records, [%s, %s], sum %s, min %s, max %s%s>", count,
                getFirstTimestamp(), getLastTimestamp(), sum, getMin(), getMax(), stale ? ", stale" : "");
    }
}
