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

import org.gemini.recordstore.Record;
import org.gemini.recordstore.RecordKind;
import org.gemini.recordstore.config.SeedData;

/**
 * Canonical object keys for uploaded record files:
 * <pre>
 *   &lt;kind&gt;_data/&lt;experiment&gt;/&lt;entity&gt;/&lt;dataset&gt;/&lt;collection date&gt;/&lt;site&gt;/&lt;season&gt;/&lt;epoch millis&gt;&lt;ext&gt;
 * </pre>
 * For dataset records the entity segment is the dataset itself. Missing names are rendered as "None", matching keys
 * written by earlier uploaders.
 */
public class RecordFileKeys {
    private RecordFileKeys() {}

    /**
     * @param record  a record of a kind that carries files
     * @param sourceFileName  name of the uploaded file; only its extension is used
     */
    public static String keyFor(Record record, String sourceFileName) {
        RecordKind kind = record.getKind();
        if (!kind.hasRecordFile()) {
            throw new IllegalArgumentException(kind.getTableName() + " do not carry files");
        }
        StringBuilder sb = new StringBuilder()
                .append(kind.getEntityName()).append("_data/")
                .append(segment(record.getExperimentName())).append('/');
        if (kind.hasSeparateEntity()) {
            sb.append(segment(record.getEntityName())).append('/');
        }
        return sb.append(segment(record.getDatasetName())).append('/')
                .append(record.getCollectionDate()).append('/')
                .append(segment(record.getSiteName())).append('/')
                .append(segment(record.getSeasonName())).append('/')
                .append(record.getTimestamp().toEpochMilli())
                .append(SeedData.extensionOf(sourceFileName))
                .toString();
    }

    private static String segment(String name) {
        return name == null ? "None" : name;
    }
}
