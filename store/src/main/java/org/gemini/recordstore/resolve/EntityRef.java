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

import org.apache.commons.lang3.Validate;
import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;

import java.io.Serializable;
import java.util.UUID;

/** Canonical id and current name of an entity, as reported by the entity catalog. */
public final class EntityRef implements Serializable {
    private final EntityType type;
    private final UUID id;
    private final String name;

    public EntityRef(EntityType type, UUID id, String name) {
        this.type = Validate.notNull(type, "type");
        this.id = Validate.notNull(id, "id");
        this.name = Validate.notNull(name, "name");
    }

    public EntityType getType() {
        return type;
    }

    public UUID getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EntityRef)) return false;
        EntityRef that = (EntityRef) o;
        return new EqualsBuilder().append(type, that.type).append(id, that.id).append(name, that.name).isEquals();
    }

    @Override
    public int hashCode() {
        return new HashCodeBuilder(17, 37).append(type).append(id).append(name).toHashCode();
    }

    @Override
    public String toString() {
        return type.getName() + " " + name + " (" + id + ")";
    }
}
