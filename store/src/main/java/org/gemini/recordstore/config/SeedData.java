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
import org.apache.commons.lang3.StringUtils;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Default lookup values every deployment starts with: data types, data formats, dataset types and sensor types.
 * Immutable; read once from the classpath resource {@value #RESOURCE}.
 */
public final class SeedData {
    public static final String RESOURCE = "seed-data.toml";

    /** A named file format with its MIME type and the file extensions (with leading dot) that map to it */
    public static final class DataFormat {
        private final String name;
        private final String mimeType;
        private final List<String> extensions;

        DataFormat(String name, String mimeType, List<String> extensions) {
            this.name = name;
            this.mimeType = mimeType;
            this.extensions = Collections.unmodifiableList(new ArrayList<>(extensions));
        }

        public String getName() {
            return name;
        }

        public String getMimeType() {
            return mimeType;
        }

        public List<String> getExtensions() {
            return extensions;
        }

        @Override
        public String toString() {
            return name + " (" + mimeType + ")";
        }
    }

    private static volatile SeedData defaults;

    private final List<String> dataTypes;
    private final List<DataFormat> dataFormats;
    private final List<String> datasetTypes;
    private final List<String> sensorTypes;

    SeedData(Toml toml) {
        dataTypes = Collections.unmodifiableList(new ArrayList<>(toml.<String>getList("data-types")));
        datasetTypes = Collections.unmodifiableList(new ArrayList<>(toml.<String>getList("dataset-types")));
        sensorTypes = Collections.unmodifiableList(new ArrayList<>(toml.<String>getList("sensor-types")));
        List<DataFormat> formats = new ArrayList<>();
        for (Toml format : toml.getTables("data-formats")) {
            List<String> extensions = format.getList("extensions", Collections.emptyList());
            formats.add(new DataFormat(format.getString("name"), format.getString("mime-type"), extensions));
        }
        dataFormats = Collections.unmodifiableList(formats);
    }

    /** The seed data bundled with this library */
    public static SeedData getDefault() {
        if (defaults == null) {
            synchronized (SeedData.class) {
                if (defaults == null) {
                    try (InputStream in = SeedData.class.getClassLoader().getResourceAsStream(RESOURCE)) {
                        if (in == null) {
                            throw new IllegalStateException("missing classpath resource " + RESOURCE);
                        }
                        defaults = new SeedData(new Toml().read(in));
                    } catch (IOException e) {
                        throw new UncheckedIOException(e);
                    }
                }
            }
        }
        return defaults;
    }

    public List<String> getDataTypes() {
        return dataTypes;
    }

    public List<DataFormat> getDataFormats() {
        return dataFormats;
    }

    public List<String> getDatasetTypes() {
        return datasetTypes;
    }

    public List<String> getSensorTypes() {
        return sensorTypes;
    }

    /** Format whose extension list contains the file's extension (case-insensitive) */
    public Optional<DataFormat> findFormatForFile(String fileName) {
        String extension = extensionOf(fileName);
        if (extension.isEmpty()) return Optional.empty();
        for (DataFormat format : dataFormats) {
            if (format.getExtensions().contains(extension)) {
                return Optional.of(format);
            }
        }
        return Optional.empty();
    }

    /** MIME type for a file, falling back to the Default format's type */
    public String getContentType(String fileName) {
        return findFormatForFile(fileName)
                .map(DataFormat::getMimeType)
                .orElseGet(() -> dataFormats.isEmpty() ? "application/octet-stream" : dataFormats.get(0).getMimeType());
    }

    /** ".jpg" for "a/b/c.JPG"; empty if the last path segment has no dot */
    public static String extensionOf(String fileName) {
        String base = StringUtils.substringAfterLast("/" + fileName, "/");
        int dot = base.lastIndexOf('.');
        return dot <= 0 ? "" : base.substring(dot).toLowerCase(Locale.ROOT);
    }
}
