package org.dxworks.hybridnote;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;

public class DocumentTypeDetector {

    public static Optional<DocumentType> detectType(Path filePath) {
        String fileName = filePath.getFileName().toString().toLowerCase(Locale.ROOT);

        if (fileName.endsWith(".md") || fileName.endsWith(".markdown")) {
            return Optional.of(DocumentType.MARKDOWN);
        } else if (fileName.endsWith(".org")) {
            return Optional.of(DocumentType.ORG);
        }

        return Optional.empty();
    }
}
