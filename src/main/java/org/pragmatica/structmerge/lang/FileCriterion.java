package org.pragmatica.structmerge.lang;

import java.nio.file.Path;

/**
 * Selects the files handled by a language.
 */
public sealed interface FileCriterion {

    boolean matches(Path path);

    /**
     * Pattern in the syntax of gitattributes files.
     */
    String pattern();

    static FileCriterion byExtension(String extension) {
        return new ByExtension(extension);
    }

    static FileCriterion byName(String name) {
        return new ByName(name);
    }

    /**
     * File names ending with a particular extension, compared case-insensitively.
     */
    record ByExtension(String extension) implements FileCriterion {
        @Override
        public boolean matches(Path path) {
            var fileName = path.getFileName();
            if (fileName == null) {
                return false;
            }
            var name = fileName.toString();
            int dot = name.lastIndexOf('.');
            return dot > 0 && name.substring(dot + 1).equalsIgnoreCase(extension);
        }

        @Override
        public String pattern() {
            return "*." + extension;
        }
    }

    /**
     * Exactly this file name.
     */
    record ByName(String name) implements FileCriterion {
        @Override
        public boolean matches(Path path) {
            var fileName = path.getFileName();
            return fileName != null && fileName.toString().equals(name);
        }

        @Override
        public String pattern() {
            return name;
        }
    }
}
