package org.dxworks.phpast;

import java.nio.file.Path;
import java.util.Locale;

public class SourceFileDetector {

    private static final String[] PHP_EXTENSIONS = {".php", ".phtml", ".inc"};

    public static boolean isPhpSource(Path filePath) {
        Path fileName = filePath.getFileName();
        if (fileName == null) {
            return false;
        }
        String name = fileName.toString().toLowerCase(Locale.ROOT);
        for (String extension : PHP_EXTENSIONS) {
            if (name.endsWith(extension)) {
                return true;
            }
        }
        return false;
    }
}
