package com.starscape.offlineocr.features.ocrjob.infra.format;

import com.starscape.offlineocr.common.exception.UnsupportedFormatException;
import com.starscape.offlineocr.features.ocrjob.domain.IntakeDocument;
import com.starscape.offlineocr.features.ocrjob.domain.ResolvedDocument;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

import static org.junit.jupiter.api.Assertions.*;

class DocxDocumentDecoderTest {
    
    private static final String BODY = """
        <?xml version="1.0" encoding="UTF-8" standalone="yes"?>
        <w:document xmlns:w="http://schemas.openxmlformats.org/wordprocessingml/2006/main">
          <w:body>
            <w:p><w:r><w:t>Quarterly</w:t></w:r><w:r><w:t xml:space="preserve"> report</w:t></w:r></w:p>
            <w:p></w:p>
            <w:p><w:r><w:t>Name</w:t><w:tab/><w:t>Value</w:t></w:r></w:p>
          </w:body>
        </w:document>
        """;
    
    private final DocxDocumentDecoder decoder = new DocxDocumentDecoder(DecoderTestSupport.preprocessor(4000));
    
    @Test
    void shouldExtractTextAndEmbeddedImages() throws Exception {
        Map<String, byte[]> entries = new LinkedHashMap<>();
        entries.put("[Content_Types].xml", "<Types/>".getBytes(StandardCharsets.UTF_8));
        entries.put("word/document.xml", BODY.getBytes(StandardCharsets.UTF_8));
        entries.put("word/media/image1.png", DecoderTestSupport.png(30, 20));
        entries.put("word/media/image2.png", DecoderTestSupport.png(50, 40));
        
        try (ResolvedDocument resolved = decoder.decode(docx(entries))) {
            assertEquals("Quarterly report\n\nName\tValue", resolved.extractedText());
            assertEquals(2, resolved.pageCount());
            assertTrue(resolved.warnings().isEmpty());
            assertEquals(30, resolved.pages().render(0).getWidth());
            assertEquals(50, resolved.pages().render(1).getWidth());
        }
    }
    
    @Test
    void shouldWarnWhenThereAreNoImages() throws Exception {
        Map<String, byte[]> entries = Map.of("word/document.xml", BODY.getBytes(StandardCharsets.UTF_8));
        
        try (ResolvedDocument resolved = decoder.decode(docx(entries))) {
            assertEquals(0, resolved.pageCount());
            assertTrue(resolved.text().isPresent());
            assertEquals(List.of(DocxDocumentDecoder.NO_IMAGES_WARNING), resolved.warnings());
        }
    }
    
    @Test
    void shouldSkipUnreadableMediaWithWarning() throws Exception {
        Map<String, byte[]> entries = new LinkedHashMap<>();
        entries.put("word/document.xml", BODY.getBytes(StandardCharsets.UTF_8));
        entries.put("word/media/image1.emf", new byte[]{1, 2, 3});
        entries.put("word/media/image2.png", DecoderTestSupport.png(10, 10));
        
        try (ResolvedDocument resolved = decoder.decode(docx(entries))) {
            assertEquals(1, resolved.pageCount());
            assertEquals(1, resolved.warnings().size());
            assertTrue(resolved.warnings().get(0).contains("image1.emf"));
        }
    }
    
    @Test
    void shouldRejectArchiveWithoutDocumentBody() throws Exception {
        Map<String, byte[]> entries = Map.of("word/media/image1.png", DecoderTestSupport.png(10, 10));
        
        assertThrows(UnsupportedFormatException.class, () -> decoder.decode(docx(entries)));
    }
    
    @Test
    void shouldRejectBytesThatAreNotAnArchive() {
        IntakeDocument document = new IntakeDocument("memo.docx", "application/octet-stream",
            "plain text".getBytes(StandardCharsets.UTF_8));
        
        assertThrows(UnsupportedFormatException.class, () -> decoder.decode(document));
    }
    
    @Test
    void shouldNotResolveExternalEntities() {
        String hostile = """
            <?xml version="1.0"?>
            <!DOCTYPE w:document [<!ENTITY xxe SYSTEM "file:///etc/passwd">]>
            <w:document xmlns:w="http://schemas.openxmlformats.org/wordprocessingml/2006/main">
              <w:body><w:p><w:r><w:t>safe &xxe;</w:t></w:r></w:p></w:body>
            </w:document>
            """;
        
        String text;
        try {
            text = DocxDocumentDecoder.extractText(hostile.getBytes(StandardCharsets.UTF_8), "hostile.docx");
        } catch (UnsupportedFormatException e) {
            return;
        }
        assertFalse(text.contains("root:"));
    }
    
    private static IntakeDocument docx(Map<String, byte[]> entries) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (ZipOutputStream zip = new ZipOutputStream(out)) {
            for (Map.Entry<String, byte[]> entry : entries.entrySet()) {
                zip.putNextEntry(new ZipEntry(entry.getKey()));
                zip.write(entry.getValue());
                zip.closeEntry();
            }
        }
        return new IntakeDocument("memo.docx", "application/vnd.openxmlformats-officedocument.wordprocessingml.document",
            out.toByteArray());
    }
}
