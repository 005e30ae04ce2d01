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
package org.gemini.recordstore.config;

import org.gemini.recordstore.RecordStore;
import org.gemini.recordstore.files.S3ObjectStorage;
import org.junit.Test;

import java.io.ByteArrayInputStream;
import java.io.File;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class RecordStoreConfigurationTest {
    private static RecordStoreConfiguration load(String toml) {
        return new RecordStoreConfiguration(new ByteArrayInputStream(toml.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    public void fullConfig() throws Exception {
        RecordStoreConfiguration conf;
        try (InputStream in = getClass().getClassLoader().getResourceAsStream("recordstore-test.toml")) {
            conf = new RecordStoreConfiguration(in);
        }
        assertEquals("/tmp/gemini-records", conf.getDataDirectory());
        assertEquals(ZoneId.of("America/Los_Angeles"), conf.getZone());
        assertEquals(2500, conf.getLockTimeoutMs());
        assertEquals(5, conf.getInsertLockRetries());
        assertEquals(64L * 1024 * 1024, conf.getBlockCacheBytes());
        assertEquals(100, conf.getFlushEveryRecords());

        RecordStore.StoreOptions options = conf.getStoreOptions();
        assertEquals(ZoneId.of("America/Los_Angeles"), options.getClock().getZone());
        assertEquals(2500, options.getLockTimeoutMs());
        assertEquals(5, options.getInsertLockRetries());

        assertTrue(conf.hasObjectStorage());
        assertEquals(Duration.ofMinutes(30), conf.getDownloadUrlExpiry());
        try (S3ObjectStorage storage = conf.getObjectStorage()) {
            assertEquals("gemini", storage.getDefaultBucket());
        }
    }

    @Test
    public void defaults() {
        RecordStoreConfiguration conf = load("");
        assertNull(conf.getDataDirectory());
        assertEquals(ZoneOffset.UTC, conf.getZone().normalized());
        assertEquals(1000, conf.getLockTimeoutMs());
        assertEquals(3, conf.getInsertLockRetries());
        assertEquals(256L * 1024 * 1024, conf.getBlockCacheBytes());
        assertEquals(1, conf.getFlushEveryRecords());
        assertFalse(conf.hasObjectStorage());
        assertEquals(Duration.ofMinutes(15), conf.getDownloadUrlExpiry());
    }

    @Test(expected = IllegalArgumentException.class)
    public void badFlushCadence() {
        load("[streaming]\nflush-every-records = 0\n").getFlushEveryRecords();
    }

    @Test(expected = IllegalArgumentException.class)
    public void missingConfigFile() {
        new RecordStoreConfiguration(new File("/nonexistent/recordstore.toml"));
    }
}
