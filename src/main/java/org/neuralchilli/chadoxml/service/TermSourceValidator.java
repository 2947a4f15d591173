package org.neuralchilli.chadoxml.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.chadoxml.cache.CachedHandle;
import org.neuralchilli.chadoxml.cache.ObjectCache;
import org.neuralchilli.chadoxml.core.GraphInspector;
import org.neuralchilli.chadoxml.domain.CV;
import org.neuralchilli.chadoxml.domain.CVTerm;
import org.neuralchilli.chadoxml.domain.DB;
import org.neuralchilli.chadoxml.domain.DBXref;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Resolves term references against the term sources the description declared.
 * <p>
 * Every vocabulary used by a CV term must be named by a declared term source, and every
 * DBXref must point into one. A CV term without a DBXref gets one attached, with the term
 * name as accession in the term source named like its vocabulary. Whether a term really
 * exists in its vocabulary is not checked here.
 */
@ApplicationScoped
public class TermSourceValidator implements ExperimentValidator {

    private static final Logger log = LoggerFactory.getLogger(TermSourceValidator.class);

    @Inject
    ObjectCache cache;

    @Inject
    GraphInspector inspector;

    @Override
    public String stageName() {
        return "Validating CVTerms and DBXrefs";
    }

    @Override
    public ValidationResult validate(ParsedSubmission submission) {
        Set<CachedHandle<DB>> declared = Collections.newSetFromMap(new IdentityHashMap<>());
        declared.addAll(submission.termSources());

        Map<String, CachedHandle<DB>> sourcesByName = new HashMap<>();
        for (CachedHandle<DB> source : submission.termSources()) {
            DB db = cache.materialize(source);
            sourcesByName.put(db.name() != null ? db.name() : db.id(), source);
        }

        List<String> problems = new ArrayList<>();
        int attached = 0;

        for (CachedHandle<CVTerm> termHandle : inspector.reachable(submission.experiment(), CVTerm.class)) {
            if (termHandle.isPlaceholder()) {
                continue;
            }
            CVTerm term = cache.materialize(termHandle);
            if (term.cv() == null) {
                problems.add("CV term '" + term.id() + "' has no controlled vocabulary");
                continue;
            }

            CV cv = cache.materialize(term.cv());
            String vocabulary = cv.name() != null ? cv.name() : cv.id();
            CachedHandle<DB> source = sourcesByName.get(vocabulary);
            if (source == null) {
                problems.add("Controlled vocabulary '" + vocabulary + "' of term '" + term.name() +
                        "' is not a declared term source");
                continue;
            }

            if (term.dbxref() == null) {
                cache.put(term.withDbxref(termDbxref(vocabulary, term.name(), source)));
                attached++;
            }
        }

        for (CachedHandle<DBXref> xrefHandle : inspector.reachable(submission.experiment(), DBXref.class)) {
            if (xrefHandle.isPlaceholder()) {
                continue;
            }
            DBXref xref = cache.materialize(xrefHandle);
            if (xref.db() == null) {
                problems.add("DBXref '" + xref.id() + "' has no term source");
            } else if (!declared.contains(xref.db())) {
                problems.add("DBXref '" + xref.accession() + "' refers to undeclared term source '" +
                        xref.db().id() + "'");
            }
        }

        if (!problems.isEmpty()) {
            problems.forEach(problem -> log.error("  ✗ {}", problem));
            return ValidationResult.failure(problems);
        }

        log.debug("Attached DBXrefs to {} CV terms", attached);
        return ValidationResult.success(submission.experiment());
    }

    private CachedHandle<DBXref> termDbxref(String vocabulary, String accession, CachedHandle<DB> source) {
        String id = vocabulary + ":" + accession;
        CachedHandle<DBXref> handle = cache.getOrCreate(DBXref.class, id);
        if (handle.isPlaceholder()) {
            cache.put(new DBXref(id, accession, null, source));
        }
        return handle;
    }
}
