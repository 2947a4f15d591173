package org.neuralchilli.chadoxml.serializer;

import com.hazelcast.nio.ObjectDataInput;
import com.hazelcast.nio.ObjectDataOutput;
import org.neuralchilli.chadoxml.cache.CachedHandle;
import org.neuralchilli.chadoxml.cache.HandleResolver;
import org.neuralchilli.chadoxml.domain.*;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import static org.neuralchilli.chadoxml.serializer.CodecSupport.*;

/**
 * Features are by far the most numerous entities, so locations and relationships are
 * written inline rather than as separate cache entries.
 */
public class FeatureCodec implements EntityCodec<Feature> {

    private static final int TYPE_ID = 2007;

    @Override
    public String typeTag() {
        return "feature";
    }

    @Override
    public Class<Feature> entityClass() {
        return Feature.class;
    }

    @Override
    public int typeId() {
        return TYPE_ID;
    }

    @Override
    public Feature blank(String id) {
        return Feature.blank(id);
    }

    @Override
    public void write(ObjectDataOutput out, Feature feature) throws IOException {
        out.writeString(feature.name());
        out.writeString(feature.uniquename());
        out.writeString(feature.residues());
        writeIntegerOrNull(out, feature.seqlen());
        writeHandle(out, feature.type());
        writeHandle(out, feature.organism());
        writeHandle(out, feature.dbxref());

        out.writeInt(feature.locations().size());
        for (FeatureLoc loc : feature.locations()) {
            writeHandle(out, loc.srcfeature());
            writeIntegerOrNull(out, loc.fmin());
            writeIntegerOrNull(out, loc.fmax());
            writeIntegerOrNull(out, loc.strand());
            out.writeInt(loc.rank());
        }

        out.writeInt(feature.relationships().size());
        for (FeatureRelationship relationship : feature.relationships()) {
            writeHandle(out, relationship.type());
            writeHandle(out, relationship.object());
            out.writeInt(relationship.rank());
        }

        writeHandles(out, feature.analysisFeatures());
    }

    @Override
    public Feature read(ObjectDataInput in, String id, HandleResolver handles) throws IOException {
        String name = in.readString();
        String uniquename = in.readString();
        String residues = in.readString();
        Integer seqlen = readIntegerOrNull(in);
        CachedHandle<CVTerm> type = readHandle(in, handles, CVTerm.class);
        CachedHandle<Organism> organism = readHandle(in, handles, Organism.class);
        CachedHandle<DBXref> dbxref = readHandle(in, handles, DBXref.class);

        int locCount = in.readInt();
        List<FeatureLoc> locations = new ArrayList<>(locCount);
        for (int i = 0; i < locCount; i++) {
            CachedHandle<Feature> srcfeature = readHandle(in, handles, Feature.class);
            Integer fmin = readIntegerOrNull(in);
            Integer fmax = readIntegerOrNull(in);
            Integer strand = readIntegerOrNull(in);
            int rank = in.readInt();
            locations.add(new FeatureLoc(srcfeature, fmin, fmax, strand, rank));
        }

        int relationshipCount = in.readInt();
        List<FeatureRelationship> relationships = new ArrayList<>(relationshipCount);
        for (int i = 0; i < relationshipCount; i++) {
            CachedHandle<CVTerm> relationshipType = readHandle(in, handles, CVTerm.class);
            CachedHandle<Feature> object = readHandle(in, handles, Feature.class);
            int rank = in.readInt();
            relationships.add(new FeatureRelationship(relationshipType, object, rank));
        }

        List<CachedHandle<AnalysisFeature>> analysisFeatures = readHandles(in, handles, AnalysisFeature.class);

        return new Feature(id, name, uniquename, residues, seqlen, type, organism, dbxref,
                locations, relationships, analysisFeatures);
    }
}
