package org.miniworker.config.utils;

import jakarta.xml.bind.JAXBContext;
import jakarta.xml.bind.JAXBException;
import jakarta.xml.bind.Unmarshaller;

import javax.xml.transform.stream.StreamSource;
import java.nio.file.Path;

public class XmlUtil {

    /**
     * Convert an XML file into an instance of {@code type}.
     * JAXBContext is created per call; config files are read rarely.
     */
    public static <T> T unmarshal(Path xmlFile, Class<T> type) throws JAXBException {
        JAXBContext ctx = JAXBContext.newInstance(type);
        Unmarshaller um = ctx.createUnmarshaller();
        return um.unmarshal(new StreamSource(xmlFile.toFile()), type).getValue();
    }
}
