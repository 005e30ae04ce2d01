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
package org.gemini.recordstore.resolve;

/** Entity tables the record store refers to. The record store never writes to any of them. */
public enum EntityType {
    DATASET("dataset"),
    EXPERIMENT("experiment"),
    SEASON("season"),
    SITE("site"),
    PLOT("plot"),
    CULTIVAR("cultivar"),
    SENSOR("sensor"),
    TRAIT("trait"),
    PROCEDURE("procedure"),
    SCRIPT("script"),
    MODEL("model");

    private final String name;

    EntityType(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
