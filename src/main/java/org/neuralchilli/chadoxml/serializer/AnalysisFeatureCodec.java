package org.neuralchilli.chadoxml.serializer;

import com.hazelcast.nio.ObjectDataInput;
import com.hazelcast.nio.ObjectDataOutput;
import org.neuralchilli.chadoxml.cache.HandleResolver;
import org.neuralchilli.chadoxml.domain.Analysis;
import org.neuralchilli.chadoxml.domain.AnalysisFeature;
import org.neuralchilli.chadoxml.domain.Feature;

import java.io.IOException;

import static org.neuralchilli.chadoxml.serializer.CodecSupport.*;

public class AnalysisFeatureCodec implements EntityCodec<AnalysisFeature> {

    private static final int TYPE_ID = 2008;

    @Override
    public String typeTag() {
        return "analysisfeature";
    }

    @Override
    public Class<AnalysisFeature> entityClass() {
        return AnalysisFeature.class;
    }

    @Override
    public int typeId() {
        return TYPE_ID;
    }

    @Override
    public AnalysisFeature blank(String id) {
        return AnalysisFeature.blank(id);
    }

    @Override
    public void write(ObjectDataOutput out, AnalysisFeature af) throws IOException {
        writeDoubleOrNull(out, af.rawscore());
        writeDoubleOrNull(out, af.normscore());
        writeDoubleOrNull(out, af.significance());
        writeDoubleOrNull(out, af.identity());
        writeHandle(out, af.feature());
        writeHandle(out, af.analysis());
    }

    @Override
    public AnalysisFeature read(ObjectDataInput in, String id, HandleResolver handles) throws IOException {
        Double rawscore = readDoubleOrNull(in);
        Double normscore = readDoubleOrNull(in);
        Double significance = readDoubleOrNull(in);
        Double identity = readDoubleOrNull(in);

        return new AnalysisFeature(
                id,
                rawscore,
                normscore,
                significance,
                identity,
                readHandle(in, handles, Feature.class),
                readHandle(in, handles, Analysis.class)
        );
    }
}
