package org.neuralchilli.chadoxml.serializer;

import com.hazelcast.nio.ObjectDataInput;
import com.hazelcast.nio.ObjectDataOutput;
import org.neuralchilli.chadoxml.cache.CachedHandle;
import org.neuralchilli.chadoxml.cache.HandleResolver;
import org.neuralchilli.chadoxml.domain.*;

import java.io.IOException;

import static org.neuralchilli.chadoxml.serializer.CodecSupport.*;

/**
 * Codecs for the small descriptive entities: experiment properties, protocols,
 * attributes, analyses and organisms.
 */
public final class MetadataSerializers {

    private MetadataSerializers() {
    }

    public static class ExperimentPropCodec implements EntityCodec<ExperimentProp> {
        private static final int TYPE_ID = 2002;

        @Override
        public String typeTag() {
            return "experiment_prop";
        }

        @Override
        public Class<ExperimentProp> entityClass() {
            return ExperimentProp.class;
        }

        @Override
        public int typeId() {
            return TYPE_ID;
        }

        @Override
        public ExperimentProp blank(String id) {
            return ExperimentProp.blank(id);
        }

        @Override
        public void write(ObjectDataOutput out, ExperimentProp prop) throws IOException {
            out.writeString(prop.name());
            out.writeString(prop.value());
            writeIntegerOrNull(out, prop.rank());
            writeHandle(out, prop.type());
            writeHandle(out, prop.dbxref());
        }

        @Override
        public ExperimentProp read(ObjectDataInput in, String id, HandleResolver handles) throws IOException {
            String name = in.readString();
            String value = in.readString();
            Integer rank = readIntegerOrNull(in);
            CachedHandle<CVTerm> type = readHandle(in, handles, CVTerm.class);
            CachedHandle<DBXref> dbxref = readHandle(in, handles, DBXref.class);

            return new ExperimentProp(id, name, value, rank, type, dbxref);
        }
    }

    public static class ProtocolCodec implements EntityCodec<Protocol> {
        private static final int TYPE_ID = 2003;

        @Override
        public String typeTag() {
            return "protocol";
        }

        @Override
        public Class<Protocol> entityClass() {
            return Protocol.class;
        }

        @Override
        public int typeId() {
            return TYPE_ID;
        }

        @Override
        public Protocol blank(String id) {
            return Protocol.blank(id);
        }

        @Override
        public void write(ObjectDataOutput out, Protocol protocol) throws IOException {
            out.writeString(protocol.name());
            out.writeString(protocol.description());
            writeIntegerOrNull(out, protocol.version());
            writeHandle(out, protocol.dbxref());
            writeHandles(out, protocol.attributes());
        }

        @Override
        public Protocol read(ObjectDataInput in, String id, HandleResolver handles) throws IOException {
            String name = in.readString();
            String description = in.readString();
            Integer version = readIntegerOrNull(in);
            CachedHandle<DBXref> dbxref = readHandle(in, handles, DBXref.class);

            return new Protocol(id, name, description, version, dbxref,
                    readHandles(in, handles, Attribute.class));
        }
    }

    public static class AttributeCodec implements EntityCodec<Attribute> {
        private static final int TYPE_ID = 2006;

        @Override
        public String typeTag() {
            return "attribute";
        }

        @Override
        public Class<Attribute> entityClass() {
            return Attribute.class;
        }

        @Override
        public int typeId() {
            return TYPE_ID;
        }

        @Override
        public Attribute blank(String id) {
            return Attribute.blank(id);
        }

        @Override
        public void write(ObjectDataOutput out, Attribute attribute) throws IOException {
            out.writeString(attribute.name());
            out.writeString(attribute.heading());
            out.writeString(attribute.value());
            writeIntegerOrNull(out, attribute.rank());
            writeHandle(out, attribute.type());
            writeHandle(out, attribute.dbxref());
        }

        @Override
        public Attribute read(ObjectDataInput in, String id, HandleResolver handles) throws IOException {
            String name = in.readString();
            String heading = in.readString();
            String value = in.readString();
            Integer rank = readIntegerOrNull(in);
            CachedHandle<CVTerm> type = readHandle(in, handles, CVTerm.class);
            CachedHandle<DBXref> dbxref = readHandle(in, handles, DBXref.class);

            return new Attribute(id, name, heading, value, rank, type, dbxref);
        }
    }

    public static class AnalysisCodec implements EntityCodec<Analysis> {
        private static final int TYPE_ID = 2009;

        @Override
        public String typeTag() {
            return "analysis";
        }

        @Override
        public Class<Analysis> entityClass() {
            return Analysis.class;
        }

        @Override
        public int typeId() {
            return TYPE_ID;
        }

        @Override
        public Analysis blank(String id) {
            return Analysis.blank(id);
        }

        @Override
        public void write(ObjectDataOutput out, Analysis analysis) throws IOException {
            out.writeString(analysis.name());
            out.writeString(analysis.program());
            out.writeString(analysis.programversion());
            out.writeString(analysis.sourcename());
            out.writeString(analysis.description());
        }

        @Override
        public Analysis read(ObjectDataInput in, String id, HandleResolver handles) throws IOException {
            String name = in.readString();
            String program = in.readString();
            String programversion = in.readString();
            String sourcename = in.readString();
            String description = in.readString();

            return new Analysis(id, name, program, programversion, sourcename, description);
        }
    }

    public static class OrganismCodec implements EntityCodec<Organism> {
        private static final int TYPE_ID = 2010;

        @Override
        public String typeTag() {
            return "organism";
        }

        @Override
        public Class<Organism> entityClass() {
            return Organism.class;
        }

        @Override
        public int typeId() {
            return TYPE_ID;
        }

        @Override
        public Organism blank(String id) {
            return Organism.blank(id);
        }

        @Override
        public void write(ObjectDataOutput out, Organism organism) throws IOException {
            out.writeString(organism.genus());
            out.writeString(organism.species());
        }

        @Override
        public Organism read(ObjectDataInput in, String id, HandleResolver handles) throws IOException {
            String genus = in.readString();
            String species = in.readString();
            return new Organism(id, genus, species);
        }
    }
}
