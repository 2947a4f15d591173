package org.neuralchilli.chadoxml.serializer;

import com.hazelcast.nio.ObjectDataInput;
import com.hazelcast.nio.ObjectDataOutput;
import org.neuralchilli.chadoxml.cache.CachedHandle;
import org.neuralchilli.chadoxml.cache.HandleResolver;
import org.neuralchilli.chadoxml.domain.CV;
import org.neuralchilli.chadoxml.domain.CVTerm;
import org.neuralchilli.chadoxml.domain.DB;
import org.neuralchilli.chadoxml.domain.DBXref;

import java.io.IOException;

import static org.neuralchilli.chadoxml.serializer.CodecSupport.readHandle;
import static org.neuralchilli.chadoxml.serializer.CodecSupport.writeHandle;

/**
 * Codecs for term references: CV terms and their vocabularies, database
 * cross-references and the databases (term sources) they point into.
 */
public final class VocabularySerializers {

    private VocabularySerializers() {
    }

    public static class CVTermCodec implements EntityCodec<CVTerm> {
        private static final int TYPE_ID = 2011;

        @Override
        public String typeTag() {
            return "cvterm";
        }

        @Override
        public Class<CVTerm> entityClass() {
            return CVTerm.class;
        }

        @Override
        public int typeId() {
            return TYPE_ID;
        }

        @Override
        public CVTerm blank(String id) {
            return CVTerm.blank(id);
        }

        @Override
        public void write(ObjectDataOutput out, CVTerm term) throws IOException {
            out.writeString(term.name());
            out.writeString(term.definition());
            out.writeBoolean(term.obsolete());
            writeHandle(out, term.cv());
            writeHandle(out, term.dbxref());
        }

        @Override
        public CVTerm read(ObjectDataInput in, String id, HandleResolver handles) throws IOException {
            String name = in.readString();
            String definition = in.readString();
            boolean obsolete = in.readBoolean();
            CachedHandle<CV> cv = readHandle(in, handles, CV.class);
            CachedHandle<DBXref> dbxref = readHandle(in, handles, DBXref.class);

            return new CVTerm(id, name, definition, obsolete, cv, dbxref);
        }
    }

    public static class CVCodec implements EntityCodec<CV> {
        private static final int TYPE_ID = 2012;

        @Override
        public String typeTag() {
            return "cv";
        }

        @Override
        public Class<CV> entityClass() {
            return CV.class;
        }

        @Override
        public int typeId() {
            return TYPE_ID;
        }

        @Override
        public CV blank(String id) {
            return CV.blank(id);
        }

        @Override
        public void write(ObjectDataOutput out, CV cv) throws IOException {
            out.writeString(cv.name());
            out.writeString(cv.definition());
        }

        @Override
        public CV read(ObjectDataInput in, String id, HandleResolver handles) throws IOException {
            String name = in.readString();
            String definition = in.readString();
            return new CV(id, name, definition);
        }
    }

    public static class DBXrefCodec implements EntityCodec<DBXref> {
        private static final int TYPE_ID = 2013;

        @Override
        public String typeTag() {
            return "dbxref";
        }

        @Override
        public Class<DBXref> entityClass() {
            return DBXref.class;
        }

        @Override
        public int typeId() {
            return TYPE_ID;
        }

        @Override
        public DBXref blank(String id) {
            return DBXref.blank(id);
        }

        @Override
        public void write(ObjectDataOutput out, DBXref dbxref) throws IOException {
            out.writeString(dbxref.accession());
            out.writeString(dbxref.version());
            writeHandle(out, dbxref.db());
        }

        @Override
        public DBXref read(ObjectDataInput in, String id, HandleResolver handles) throws IOException {
            String accession = in.readString();
            String version = in.readString();
            return new DBXref(id, accession, version, readHandle(in, handles, DB.class));
        }
    }

    public static class DBCodec implements EntityCodec<DB> {
        private static final int TYPE_ID = 2014;

        @Override
        public String typeTag() {
            return "db";
        }

        @Override
        public Class<DB> entityClass() {
            return DB.class;
        }

        @Override
        public int typeId() {
            return TYPE_ID;
        }

        @Override
        public DB blank(String id) {
            return DB.blank(id);
        }

        @Override
        public void write(ObjectDataOutput out, DB db) throws IOException {
            out.writeString(db.name());
            out.writeString(db.url());
            out.writeString(db.description());
        }

        @Override
        public DB read(ObjectDataInput in, String id, HandleResolver handles) throws IOException {
            String name = in.readString();
            String url = in.readString();
            String description = in.readString();
            return new DB(id, name, url, description);
        }
    }
}
