package org.neuralchilli.chadoxml.core;

import javax.annotation.Nonnull;

/**
 * What a ChadoXML write emitted.
 *
 * @param entities   full entity bodies, one per distinct entity reached
 * @param references macro references written in place of a repeated body
 * @param backEdges  references to an entity whose body was still open (graph cycles)
 */
public record WriteSummary(int entities, int references, int backEdges) {

    @Nonnull
    @Override
    public String toString() {
        return String.format("WriteSummary[entities=%d, references=%d, back_edges=%d]",
                entities, references, backEdges);
    }
}
