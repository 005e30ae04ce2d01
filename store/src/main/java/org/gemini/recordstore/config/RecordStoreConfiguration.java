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

import com.moandjiezana.toml.Toml;
import org.gemini.recordstore.RecordStore;
import org.gemini.recordstore.files.S3ObjectStorage;

import java.io.File;
import java.io.InputStream;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;

/**
 * Reads record store settings from a TOML file. Raises IllegalArgumentException on some parse errors but is generally
 * optimistic and expects the file is a legal config.
 */
public class RecordStoreConfiguration {
    private final Toml toml;

    public RecordStoreConfiguration(File file) {
        if (!file.isFile()) throw new IllegalArgumentException("invalid or non-existent config file " + file);
        toml = new Toml().read(file);
    }

    public RecordStoreConfiguration(InputStream in) {
        toml = new Toml().read(in);
    }

    /** Where all record tables are stored; null means a transient in-memory store */
    public String getDataDirectory() {
        return toml.getString("data-dir");
    }

    /** Zone the collection_date default is computed in */
    public ZoneId getZone() {
        return ZoneId.of(toml.getString("zone", "UTC"));
    }

    public long getLockTimeoutMs() {
        return toml.getLong("rocksdb.lock-timeout-ms", 1000L);
    }

    public int getInsertLockRetries() {
        return toml.getLong("rocksdb.insert-lock-retries", 3L).intValue();
    }

    public long getBlockCacheBytes() {
        return toml.getLong("rocksdb.block-cache-mb", 256L) * 1024 * 1024;
    }

    /** NDJSON flush cadence in records */
    public int getFlushEveryRecords() {
        int n = toml.getLong("streaming.flush-every-records", 1L).intValue();
        if (n < 1) throw new IllegalArgumentException("streaming.flush-every-records must be >= 1");
        return n;
    }

    public RecordStore.StoreOptions getStoreOptions() {
        return new RecordStore.StoreOptions()
                .setClock(Clock.system(getZone()))
                .setLockTimeoutMs(getLockTimeoutMs())
                .setInsertLockRetries(getInsertLockRetries())
                .setBlockCacheBytes(getBlockCacheBytes());
    }

    public boolean hasObjectStorage() {
        return toml.containsTable("object-storage");
    }

    public Duration getDownloadUrlExpiry() {
        return Duration.ofMinutes(toml.getLong("object-storage.url-expiry-minutes", 15L));
    }

    /** Object storage client for record files, built from the [object-storage] table */
    public S3ObjectStorage getObjectStorage() {
        Toml conf = toml.getTable("object-storage");
        if (conf == null) throw new IllegalArgumentException("config has no [object-storage] table");
        return new S3ObjectStorage(
                conf.getString("endpoint"),
                conf.getString("region", "us-east-1"),
                conf.getString("bucket"),
                conf.getString("access-key"),
                conf.getString("secret-key"));
    }
}
