package com.doseobjectives.converter.strategy;

import com.doseobjectives.converter.core.SheetRowCollector;
import com.doseobjectives.converter.core.poi.ConstraintSheetContentsHandler;
import com.doseobjectives.converter.exception.ConversionException;
import com.doseobjectives.converter.exception.MissingSheetException;
import com.doseobjectives.converter.model.ConstraintSheet;
import org.apache.poi.openxml4j.exceptions.OpenXML4JException;
import org.apache.poi.openxml4j.opc.OPCPackage;
import org.apache.poi.openxml4j.opc.PackageAccess;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.xssf.eventusermodel.ReadOnlySharedStringsTable;
import org.apache.poi.xssf.eventusermodel.XSSFReader;
import org.apache.poi.xssf.eventusermodel.XSSFSheetXMLHandler;
import org.apache.poi.xssf.model.StylesTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.XMLReader;

import javax.xml.parsers.ParserConfigurationException;
import javax.xml.parsers.SAXParserFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Reads an XLSX worksheet with Apache POI's event API (XSSFReader + SAX), without building the
 * workbook object model.
 *
 * @pre the input is an OOXML (.xlsx) workbook
 * @post the OPC package is released whether or not reading succeeds
 */
public class PoiEventRowSource implements RowSource {

    private static final Logger LOG = LoggerFactory.getLogger(PoiEventRowSource.class);

    @Override
    public ConstraintSheet read(Path input, String sheetName) throws IOException {
        LOG.info("Reading sheet '{}' of {} with the POI event model.", sheetName, input);
        OPCPackage pkg;
        try {
            pkg = OPCPackage.open(input.toFile(), PackageAccess.READ);
        } catch (OpenXML4JException e) {
            throw ConversionException.unopenable(input, e);
        }
        try {
            return readSheet(pkg, sheetName);
        } catch (OpenXML4JException | SAXException | ParserConfigurationException e) {
            throw ConversionException.unreadable(input, sheetName, e);
        } finally {
            // READ packages are released with revert(); close() would try to save
            pkg.revert();
        }
    }

    private ConstraintSheet readSheet(OPCPackage pkg, String sheetName)
            throws IOException, OpenXML4JException, SAXException, ParserConfigurationException {
        XSSFReader xssfReader = new XSSFReader(pkg);
        StylesTable styles = xssfReader.getStylesTable();
        ReadOnlySharedStringsTable sharedStrings = new ReadOnlySharedStringsTable(pkg);

        List<String> availableSheetNames = new ArrayList<>();
        XSSFReader.SheetIterator sheets = (XSSFReader.SheetIterator) xssfReader.getSheetsData();
        while (sheets.hasNext()) {
            try (InputStream sheetStream = sheets.next()) {
                String name = sheets.getSheetName();
                availableSheetNames.add(name);
                if (name.equalsIgnoreCase(sheetName)) {
                    LOG.debug("Processing sheet '{}'.", name);
                    return parse(sheetStream, name, styles, sharedStrings);
                }
            }
        }
        throw new MissingSheetException(sheetName, "was not found. Available sheets: " + availableSheetNames);
    }

    private ConstraintSheet parse(InputStream sheetStream, String name, StylesTable styles,
                                  ReadOnlySharedStringsTable sharedStrings)
            throws IOException, SAXException, ParserConfigurationException {
        SheetRowCollector collector = new SheetRowCollector(name);
        SAXParserFactory factory = SAXParserFactory.newInstance();
        factory.setNamespaceAware(true);
        factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
        XMLReader sheetParser = factory.newSAXParser().getXMLReader();
        sheetParser.setContentHandler(new XSSFSheetXMLHandler(styles, null, sharedStrings,
                new ConstraintSheetContentsHandler(collector), new DataFormatter(Locale.US), false));
        sheetParser.parse(new InputSource(sheetStream));
        return collector.toSheet();
    }
}
