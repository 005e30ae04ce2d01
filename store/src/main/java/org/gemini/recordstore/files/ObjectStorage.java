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

import java.net.URL;
import java.time.Duration;

/** External object storage holding record files. The record store never streams file bytes itself. */
public interface ObjectStorage extends AutoCloseable {
    /** Bucket that bare record_file keys live in */
    String getDefaultBucket();

    /**
     * Short-lived, pre-authorized GET URL for a file.
     *
     * @param contentType  response content type the URL should force, or null to keep the stored one
     */
    URL presignedDownloadUrl(RecordFile file, Duration expiry, String contentType);

    @Override
    void close();
}
