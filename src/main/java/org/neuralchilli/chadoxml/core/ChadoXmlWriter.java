package org.neuralchilli.chadoxml.core;

import org.neuralchilli.chadoxml.cache.CachedHandle;
import org.neuralchilli.chadoxml.cache.ObjectCache;
import org.neuralchilli.chadoxml.domain.Entity;
import org.neuralchilli.chadoxml.domain.FieldSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.xml.stream.XMLOutputFactory;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamWriter;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Writes the experiment graph as ChadoXML.
 * <p>
 * The first time an entity is reached its body is written in full, tagged with a macro id
 * ({@code feature_12}). Every later reference to the same handle, including references from
 * inside its own body, writes just the macro id. Macro ids are assigned before descending, so
 * cycles terminate and each entity has exactly one body in the document.
 * <p>
 * Relationship order comes from {@link Entity#describe(FieldSink)}, so the same graph always
 * produces the same bytes.
 */
public class ChadoXmlWriter {

    private static final Logger log = LoggerFactory.getLogger(ChadoXmlWriter.class);

    static final String ROOT_ELEMENT = "chadoxml";
    private static final String INDENT = "  ";

    private final ObjectCache cache;
    private final XMLOutputFactory outputFactory = XMLOutputFactory.newInstance();

    public ChadoXmlWriter(ObjectCache cache) {
        if (cache == null) {
            throw new IllegalArgumentException("Object cache cannot be null");
        }
        this.cache = cache;
    }

    /**
     * Write the document to a file. The file only appears once the whole document is written.
     *
     * @throws ChadoXmlWriteException if the destination cannot be written
     */
    public WriteSummary write(CachedHandle<? extends Entity> root, Path output) {
        Path target = output.toAbsolutePath();
        Path temp;
        try {
            temp = Files.createTempFile(target.getParent(), target.getFileName().toString(), ".partial");
        } catch (IOException e) {
            throw new ChadoXmlWriteException("Cannot open " + target + " for writing", e);
        }

        boolean complete = false;
        try {
            WriteSummary summary;
            try (OutputStream out = new BufferedOutputStream(Files.newOutputStream(temp))) {
                summary = write(root, out);
            }
            moveIntoPlace(temp, target);
            complete = true;

            log.info("Wrote ChadoXML to {}: {}", target, summary);
            return summary;

        } catch (IOException e) {
            throw new ChadoXmlWriteException("Failed writing " + target, e);
        } finally {
            if (!complete) {
                discard(temp);
            }
        }
    }

    /**
     * Write the document to a stream. The stream is flushed but not closed.
     *
     * @throws ChadoXmlWriteException if writing fails
     */
    public WriteSummary write(CachedHandle<? extends Entity> root, OutputStream out) {
        if (root == null) {
            throw new IllegalArgumentException("Root handle cannot be null");
        }

        try {
            XMLStreamWriter xml = outputFactory.createXMLStreamWriter(out, "UTF-8");
            Emission emission = new Emission(xml);

            xml.writeStartDocument("UTF-8", "1.0");
            xml.writeCharacters("\n");
            xml.writeStartElement(ROOT_ELEMENT);
            emission.root(root);
            xml.writeCharacters("\n");
            xml.writeEndElement();
            xml.writeCharacters("\n");
            xml.writeEndDocument();
            xml.flush();
            xml.close();
            out.flush();
            if (out instanceof PrintStream printStream && printStream.checkError()) {
                throw new ChadoXmlWriteException("Output stream reported an error; the document is incomplete");
            }

            WriteSummary summary = emission.summary();
            log.debug("Emitted {}", summary);
            return summary;

        } catch (XMLStreamException e) {
            throw new ChadoXmlWriteException("Failed writing ChadoXML", e);
        } catch (IOException e) {
            throw new ChadoXmlWriteException("Failed flushing ChadoXML output", e);
        }
    }

    /**
     * Drop characters XML 1.0 does not allow in content, such as most C0 control characters.
     */
    static String xmlText(String text) {
        StringBuilder legal = null;
        for (int i = 0; i < text.length(); ) {
            int codePoint = text.codePointAt(i);
            int width = Character.charCount(codePoint);
            if (isXmlChar(codePoint)) {
                if (legal != null) {
                    legal.appendCodePoint(codePoint);
                }
            } else if (legal == null) {
                legal = new StringBuilder(text.length()).append(text, 0, i);
            }
            i += width;
        }
        if (legal == null) {
            return text;
        }
        log.warn("Dropped {} character(s) not allowed in XML", text.length() - legal.length());
        return legal.toString();
    }

    private static boolean isXmlChar(int c) {
        return c == 0x9 || c == 0xA || c == 0xD
                || (c >= 0x20 && c <= 0xD7FF)
                || (c >= 0xE000 && c <= 0xFFFD)
                || (c >= 0x10000 && c <= 0x10FFFF);
    }

    private void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void discard(Path temp) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Could not remove partial output {}", temp, e);
        }
    }

    @FunctionalInterface
    private interface XmlStep {
        void run() throws XMLStreamException;
    }

    /**
     * One traversal of the graph. Holds the macro table for a single document.
     */
    private final class Emission implements FieldSink {

        private final XMLStreamWriter xml;
        private final Map<CachedHandle<?>, String> macros = new IdentityHashMap<>();
        private final Set<CachedHandle<?>> emitting = Collections.newSetFromMap(new IdentityHashMap<>());

        private int depth;
        private int references;
        private int backEdges;

        Emission(XMLStreamWriter xml) {
            this.xml = xml;
        }

        void root(CachedHandle<? extends Entity> root) {
            depth = 1;
            body(root);
        }

        WriteSummary summary() {
            return new WriteSummary(macros.size(), references, backEdges);
        }

        @Override
        public void scalar(String name, Object value) {
            if (value == null) {
                return;
            }
            step(() -> {
                newline();
                xml.writeStartElement(name);
                xml.writeCharacters(xmlText(String.valueOf(value)));
                xml.writeEndElement();
            });
        }

        @Override
        public void reference(String name, CachedHandle<? extends Entity> handle) {
            if (handle == null) {
                return;
            }

            String macro = macros.get(handle);
            if (macro != null) {
                references++;
                if (emitting.contains(handle)) {
                    backEdges++;
                }
                step(() -> {
                    newline();
                    xml.writeStartElement(name);
                    xml.writeCharacters(macro);
                    xml.writeEndElement();
                });
                return;
            }

            step(() -> {
                newline();
                xml.writeStartElement(name);
            });
            depth++;
            body(handle);
            depth--;
            step(() -> {
                newline();
                xml.writeEndElement();
            });
        }

        @Override
        public void group(String name, Consumer<FieldSink> body) {
            step(() -> {
                newline();
                xml.writeStartElement(name);
            });
            depth++;
            body.accept(this);
            depth--;
            step(() -> {
                newline();
                xml.writeEndElement();
            });
        }

        private void body(CachedHandle<? extends Entity> handle) {
            String macro = handle.type() + "_" + (macros.size() + 1);
            macros.put(handle, macro);
            emitting.add(handle);

            Entity entity = cache.materialize(handle);

            step(() -> {
                newline();
                xml.writeStartElement(handle.type());
                xml.writeAttribute("id", macro);
            });
            depth++;
            entity.describe(this);
            depth--;
            step(() -> {
                newline();
                xml.writeEndElement();
            });

            emitting.remove(handle);
        }

        private void newline() throws XMLStreamException {
            xml.writeCharacters("\n" + INDENT.repeat(depth));
        }

        private void step(XmlStep step) {
            try {
                step.run();
            } catch (XMLStreamException e) {
                throw new ChadoXmlWriteException("Failed writing ChadoXML", e);
            }
        }
    }
}
