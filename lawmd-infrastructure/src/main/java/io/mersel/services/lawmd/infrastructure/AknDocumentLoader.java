package io.mersel.services.lawmd.infrastructure;

import io.mersel.services.lawmd.application.interfaces.DocumentParseException;
import net.sf.saxon.s9api.DocumentBuilder;
import net.sf.saxon.s9api.Processor;
import net.sf.saxon.s9api.SaxonApiException;
import net.sf.saxon.s9api.WhitespaceStrippingPolicy;
import net.sf.saxon.s9api.XdmNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.XMLReader;

import javax.xml.parsers.ParserConfigurationException;
import javax.xml.parsers.SAXParserFactory;
import javax.xml.transform.sax.SAXSource;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Akoma Ntoso XML belgesini Saxon {@link XdmNode} ağacına yükler.
 * <p>
 * Belgenin tamamı belleğe alınır. Yalnızca boşluktan oluşan metin düğümleri
 * atılır; iyi biçimlilik dışında şema doğrulaması yapılmaz.
 */
@Component
public class AknDocumentLoader {

    private static final Logger log = LoggerFactory.getLogger(AknDocumentLoader.class);

    private final Processor processor;

    public AknDocumentLoader() {
        this.processor = new Processor(false);
    }

    /**
     * Bellekteki XML içeriğini yükler.
     *
     * @throws DocumentParseException İçerik boş veya iyi biçimli değil
     */
    public XdmNode load(byte[] xmlContent) throws DocumentParseException {
        if (xmlContent == null || xmlContent.length == 0) {
            throw new DocumentParseException("XML içeriği boş");
        }
        return build(new InputSource(new ByteArrayInputStream(xmlContent)), xmlContent.length + " byte");
    }

    /**
     * Diskteki XML dosyasını yükler.
     *
     * @throws DocumentParseException Dosya okunamıyor veya iyi biçimli değil
     */
    public XdmNode load(Path xmlFile) throws DocumentParseException {
        if (xmlFile == null || !Files.isRegularFile(xmlFile) || !Files.isReadable(xmlFile)) {
            throw new DocumentParseException("XML dosyası okunamıyor: " + xmlFile);
        }
        try (InputStream in = Files.newInputStream(xmlFile)) {
            var input = new InputSource(in);
            input.setSystemId(xmlFile.toUri().toString());
            return build(input, xmlFile.toString());
        } catch (IOException e) {
            throw new DocumentParseException("XML dosyası okunamadı: " + xmlFile + ": " + e.getMessage(), e);
        }
    }

    private XdmNode build(InputSource input, String origin) throws DocumentParseException {
        try {
            SAXParserFactory factory = SAXParserFactory.newInstance();
            factory.setNamespaceAware(true);
            // XXE koruma
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
            factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
            XMLReader reader = factory.newSAXParser().getXMLReader();

            DocumentBuilder builder = processor.newDocumentBuilder();
            builder.setWhitespaceStrippingPolicy(WhitespaceStrippingPolicy.ALL);

            long start = System.nanoTime();
            XdmNode document = builder.build(new SAXSource(reader, input));
            log.debug("XML belgesi yüklendi, kaynak: {}, süre: {} ms",
                    origin, (System.nanoTime() - start) / 1_000_000);
            return document;

        } catch (SaxonApiException e) {
            throw new DocumentParseException("XML parse hatası: " + e.getMessage(), e);
        } catch (ParserConfigurationException | SAXException e) {
            throw new DocumentParseException("XML ayrıştırıcı yapılandırılamadı: " + e.getMessage(), e);
        }
    }
}
