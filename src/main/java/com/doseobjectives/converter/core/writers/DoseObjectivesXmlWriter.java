package com.doseobjectives.converter.core.writers;

import com.doseobjectives.converter.document.DoseObjectivesDocument;
import com.doseobjectives.converter.model.Quantity;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import com.fasterxml.jackson.dataformat.xml.ser.ToXmlGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedOutputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Serializes a {@link DoseObjectivesDocument} to the importer's XML vocabulary with Jackson's
 * {@link XmlMapper} over the {@link DoseObjectivesXmlTree} binding.
 * <p>
 * Output is UTF-8 with an XML declaration and two-space indentation. Evaluation-point and
 * variation values are written with one decimal place, rounded half-up, always with '.' as the
 * decimal separator. Absolute volume parameters (cc) are rounded up instead.
 *
 * @inv The produced document is well-formed; every start element written is closed.
 */
public class DoseObjectivesXmlWriter {

    private static final Logger logger = LoggerFactory.getLogger(DoseObjectivesXmlWriter.class);
    private static final int BUFFER_SIZE = 64 * 1024;
    private static final String CC = "cc";

    private final XmlMapper xmlMapper;

    public DoseObjectivesXmlWriter() {
        xmlMapper = new XmlMapper();
        xmlMapper.enable(SerializationFeature.INDENT_OUTPUT);
        xmlMapper.enable(ToXmlGenerator.Feature.WRITE_XML_DECLARATION);
        xmlMapper.configure(JsonGenerator.Feature.AUTO_CLOSE_TARGET, false);
    }

    /**
     * Formats a value the way the importer reads it: one decimal place, half-up, locale-independent.
     *
     * @param value the value to format
     * @return e.g. "60.0", "2.5", "0.1"
     */
    public static String formatDecimal(BigDecimal value) {
        return value.setScale(1, RoundingMode.HALF_UP).toPlainString();
    }

    /**
     * Formats a metric parameter. A volume in cc rounds up, so {@code D2.01cc} reads 2.1;
     * every other parameter goes through {@link #formatDecimal(BigDecimal)}.
     *
     * @param parameter the TypeSpecifier quantity
     * @return the one-decimal text
     */
    public static String formatParameter(Quantity parameter) {
        if (parameter.getUnit().filter(CC::equals).isPresent()) {
            return parameter.getValue().setScale(1, RoundingMode.CEILING).toPlainString();
        }
        return formatDecimal(parameter.getValue());
    }

    /**
     * Writes the document to the given stream. The stream is flushed but not closed.
     *
     * @param document the document tree
     * @param out the target stream
     * @throws IOException if writing fails
     */
    public void write(DoseObjectivesDocument document, OutputStream out) throws IOException {
        xmlMapper.writeValue(out, DoseObjectivesXmlTree.from(document));
        out.flush();
    }

    /**
     * @return the serialized document as UTF-8 bytes
     */
    public byte[] toBytes(DoseObjectivesDocument document) throws IOException {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        write(document, buffer);
        return buffer.toByteArray();
    }

    /**
     * Writes the document to a file, creating parent directories as needed.
     *
     * @param document the document tree
     * @param target the output file
     * @param overwrite whether an existing file may be replaced
     * @throws IOException if the file exists and overwrite is false, or writing fails
     * @post target holds the complete document
     */
    public void writeFile(DoseObjectivesDocument document, Path target, boolean overwrite) throws IOException {
        if (Files.exists(target) && !overwrite) {
            throw new IOException("Output file " + target + " already exists and overwrite is false.");
        }
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (OutputStream out = new BufferedOutputStream(Files.newOutputStream(target), BUFFER_SIZE)) {
            write(document, out);
        }
        logger.info("Written {} ({} template group(s), {} measure items).",
                target, document.getGroups().size(), document.getItemCount());
    }
}
