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
package org.gemini.recordstore.files;

import org.junit.Test;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

public class RecordFileTest {
    @Test
    public void parsesPointers() {
        RecordFile explicit = RecordFile.parse("s3://archive/sensor_data/a.csv", "gemini");
        assertEquals("archive", explicit.getBucket());
        assertEquals("sensor_data/a.csv", explicit.getKey());
        assertEquals("s3://archive/sensor_data/a.csv", explicit.toPointer());

        assertEquals(new RecordFile("gemini", "sensor_data/a.csv"), RecordFile.parse("sensor_data/a.csv", "gemini"));
        assertEquals(new RecordFile("gemini", "sensor_data/a.csv"), RecordFile.parse("/sensor_data/a.csv", "gemini"));
    }

    @Test
    public void bareKeyNeedsDefaultBucket() {
        assertEquals("archive", RecordFile.parse("s3://archive/sensor_data/a.csv", null).getBucket());
        try {
            RecordFile.parse("sensor_data/a.csv", null);
            fail("expected IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            assertThat(e.getMessage(), containsString("object-storage.bucket"));
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void pointerWithoutKey() {
        RecordFile.parse("s3://archive/", "gemini");
    }

    @Test(expected = IllegalArgumentException.class)
    public void blankPointer() {
        RecordFile.parse(" ", "gemini");
    }
}
