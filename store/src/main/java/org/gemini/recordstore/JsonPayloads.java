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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.util.Map;

/**
 * Brings caller-supplied maps to the JSON value types a stored payload decodes to: integral numbers become Integer,
 * Long or BigInteger by magnitude, floating point numbers become Double, nested maps become LinkedHashMaps. Every
 * backing store then holds the same map for the same insert.
 */
class JsonPayloads {
    private static final ObjectMapper mapper = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<Map<String, Object>>() {};

    private JsonPayloads() {}

    /** @throws InvalidRecordException if the map does not serialize as a JSON object */
    static Map<String, Object> canonical(String field, Map<String, Object> map) throws InvalidRecordException {
        if (map == null) return null;
        try {
            return mapper.readValue(mapper.writeValueAsBytes(map), MAP_TYPE);
        } catch (JsonProcessingException e) {
            throw new InvalidRecordException(field + " is not representable as JSON: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new InvalidRecordException(field + " is not representable as JSON", e);
        }
    }
}
