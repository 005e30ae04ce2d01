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

import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;

import java.io.Serializable;
import java.util.UUID;

/** Denormalized plot reference carried by sensor and trait records. */
public final class PlotLocation implements Serializable {
    private final UUID plotId;
    private final int plotNumber, plotRowNumber, plotColumnNumber;

    public PlotLocation(UUID plotId, int plotNumber, int plotRowNumber, int plotColumnNumber) {
        this.plotId = plotId;
        this.plotNumber = plotNumber;
        this.plotRowNumber = plotRowNumber;
        this.plotColumnNumber = plotColumnNumber;
    }

    public UUID getPlotId() {
        return plotId;
    }

    public int getPlotNumber() {
        return plotNumber;
    }

    public int getPlotRowNumber() {
        return plotRowNumber;
    }

    public int getPlotColumnNumber() {
        return plotColumnNumber;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PlotLocation)) return false;
        PlotLocation that = (PlotLocation) o;
        return new EqualsBuilder()
                .append(plotId, that.plotId)
                .append(plotNumber, that.plotNumber)
                .append(plotRowNumber, that.plotRowNumber)
                .append(plotColumnNumber, that.plotColumnNumber)
                .isEquals();
    }

    @Override
    public int hashCode() {
        return new HashCodeBuilder(17, 37)
                .append(plotId).append(plotNumber).append(plotRowNumber).append(plotColumnNumber)
                .toHashCode();
    }

    @Override
    public String toString() {
        return String.format("<plot %d (row %d, col %d)>", plotNumber, plotRowNumber, plotColumnNumber);
    }
}
