package org.neuralchilli.chadoxml.domain;

import org.neuralchilli.chadoxml.cache.CachedHandle;

/**
 * Location of a feature on a source feature (typically a chromosome), interbase coordinates.
 */
public record FeatureLoc(
        CachedHandle<Feature> srcfeature,
        Integer fmin,
        Integer fmax,
        Integer strand,
        int rank
) {

    public FeatureLoc {
        if (fmin != null && fmax != null && fmin > fmax) {
            throw new IllegalArgumentException("fmin " + fmin + " is after fmax " + fmax);
        }
    }

    void describe(FieldSink sink) {
        sink.reference("srcfeature_id", srcfeature);
        sink.scalar("fmin", fmin);
        sink.scalar("fmax", fmax);
        sink.scalar("strand", strand);
        sink.scalar("rank", rank);
    }
}
