package com.abcft.pdfedit.core.validation;

import com.abcft.pdfedit.core.MalformedDocumentException;
import com.abcft.pdfedit.core.model.FontUtils;
import com.google.common.collect.ImmutableList;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.pdfbox.cos.COSBase;
import org.apache.pdfbox.cos.COSName;
import org.apache.pdfbox.cos.COSObject;
import org.apache.pdfbox.cos.COSObjectKey;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDResources;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.pdfbox.text.PDFTextStripperByArea;

import java.awt.geom.Rectangle2D;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * {@link DocumentContext} over a PDFBox document. The document stays owned by the caller.
 */
public class PdfDocumentContext implements DocumentContext {

    private static final Logger LOGGER = LogManager.getLogger();

    private static final String AREA_REGION = "area";

    private final PDDocument document;
    private List<FontReference> fonts;
    private List<COSObjectKey> objectKeys;

    public PdfDocumentContext(PDDocument document) {
        this.document = document;
    }

    public PDDocument getDocument() {
        return document;
    }

    @Override
    public int getPageCount() {
        return document.getNumberOfPages();
    }

    @Override
    public boolean isPageAccessible(int pageIndex) {
        try {
            return document.getPage(pageIndex).getCOSObject() != null;
        } catch (RuntimeException e) {
            LOGGER.debug("Page #{}: not accessible", pageIndex + 1, e);
            return false;
        }
    }

    @Override
    public List<FontReference> getFonts() {
        if (null == fonts) {
            fonts = loadFonts();
        }
        return fonts;
    }

    private List<FontReference> loadFonts() {
        List<FontReference> result = new ArrayList<>();
        int pageIndex = 0;
        for (PDPage page : document.getPages()) {
            PDResources resources = page.getResources();
            if (resources != null) {
                for (COSName name : resources.getFontNames()) {
                    result.add(loadFont(resources, name, pageIndex));
                }
            }
            ++pageIndex;
        }
        return ImmutableList.copyOf(result);
    }

    private static FontReference loadFont(PDResources resources, COSName name, int pageIndex) {
        try {
            PDFont font = resources.getFont(name);
            if (font != null) {
                String fontName = FontUtils.getFontName(font);
                if (fontName == null) {
                    fontName = name.getName();
                }
                return new FontReference(fontName, pageIndex, font.isEmbedded(), FontUtils.isStrictSubsetName(fontName));
            }
        } catch (IOException e) {
            LOGGER.warn("Page #{}: failed to load font {}", pageIndex + 1, name.getName(), e);
        }
        // unreadable fonts are reported under their resource name, as not embedded
        return new FontReference(name.getName(), pageIndex, false, false);
    }

    @Override
    public String getPageText(int pageIndex) throws IOException {
        try {
            PDFTextStripper stripper = new PDFTextStripper();
            stripper.setStartPage(pageIndex + 1);
            stripper.setEndPage(pageIndex + 1);
            return stripper.getText(document);
        } catch (IOException | RuntimeException e) {
            throw new MalformedDocumentException(
                    String.format("Page #%d: failed to extract text", pageIndex + 1), pageIndex, e);
        }
    }

    @Override
    public String getTextInArea(int pageIndex, Rectangle2D area) throws IOException {
        try {
            PDFTextStripperByArea stripper = new PDFTextStripperByArea();
            stripper.addRegion(AREA_REGION, area);
            stripper.extractRegions(document.getPage(pageIndex));
            return stripper.getTextForRegion(AREA_REGION);
        } catch (IOException | RuntimeException e) {
            throw new MalformedDocumentException(
                    String.format("Page #%d: failed to extract text in %s", pageIndex + 1, area), pageIndex, e);
        }
    }

    private List<COSObjectKey> getObjectKeys() {
        if (null == objectKeys) {
            List<COSObjectKey> keys = new ArrayList<>(document.getDocument().getXrefTable().keySet());
            keys.sort(Comparator.comparingLong(COSObjectKey::getNumber)
                    .thenComparingInt(COSObjectKey::getGeneration));
            objectKeys = keys;
        }
        return objectKeys;
    }

    @Override
    public int getObjectCount() {
        return getObjectKeys().size();
    }

    @Override
    public Object dereference(int objectIndex) throws IOException {
        List<COSObjectKey> keys = getObjectKeys();
        if (objectIndex < 0 || objectIndex >= keys.size()) {
            throw new MalformedDocumentException(String.format("Object index %d out of range", objectIndex));
        }
        COSObjectKey key = keys.get(objectIndex);
        COSObject object = document.getDocument().getObjectFromPool(key);
        COSBase base = object.getObject();
        if (null == base) {
            throw new MalformedDocumentException(String.format("Object %s cannot be read", key));
        }
        return base;
    }

    @Override
    public boolean hasSignatures() throws IOException {
        return !document.getSignatureDictionaries().isEmpty();
    }
}
