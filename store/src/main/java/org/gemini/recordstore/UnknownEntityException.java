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

import org.gemini.recordstore.resolve.EntityType;

/** A name referenced on the write path does not resolve to an entity. */
public class UnknownEntityException extends RecordStoreException {
    private final EntityType entityType;
    private final String name;

    public UnknownEntityException(EntityType entityType, String name) {
        this(entityType, name, "no " + entityType.getName() + " named " + name);
    }

    public UnknownEntityException(EntityType entityType, String name, String msg) {
        super(msg);
        this.entityType = entityType;
        this.name = name;
    }

    public EntityType getEntityType() {
        return entityType;
    }

    public String getName() {
        return name;
    }
}
