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

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;

import java.util.Objects;

/**
 * Parsed record_file pointer: a bucket and an object key. Pointers are stored either as "s3://bucket/key" or as a
 * bare key, which lives in the store's default bucket.
 */
public final class RecordFile {
    private static final String SCHEME = "s3://";

    private final String bucket;
    private final String key;

    public RecordFile(String bucket, String key) {
        this.bucket = Validate.notBlank(bucket, "bucket");
        this.key = Validate.notBlank(key, "key");
    }

    public static RecordFile parse(String pointer, String defaultBucket) {
        Validate.notBlank(pointer, "record_file");
        if (pointer.startsWith(SCHEME)) {
            String rest = pointer.substring(SCHEME.length());
            int slash = rest.indexOf('/');
            if (slash <= 0 || slash == rest.length() - 1) {
                throw new IllegalArgumentException("record_file " + pointer + " has no object key");
            }
            return new RecordFile(rest.substring(0, slash), rest.substring(slash + 1));
        }
        if (StringUtils.isBlank(defaultBucket)) {
            throw new IllegalArgumentException("record_file " + pointer
                    + " is a bare key but no default bucket is configured (object-storage.bucket)");
        }
        return new RecordFile(defaultBucket, StringUtils.removeStart(pointer, "/"));
    }

    public String getBucket() {
        return bucket;
    }

    public String getKey() {
        return key;
    }

    /** "s3://bucket/key" */
    public String toPointer() {
        return SCHEME + bucket + "/" + key;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof RecordFile)) return false;
        RecordFile other = (RecordFile) o;
        return bucket.equals(other.bucket) && key.equals(other.key);
    }

    @Override
    public int hashCode() {
        return Objects.hash(bucket, key);
    }

    @Override
    public String toString() {
        return toPointer();
    }
}
