package com.e2eq.l10n.resource;

import com.e2eq.l10n.model.Namespace;
import org.apache.commons.lang3.StringUtils;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;

/**
 * Where each namespace lives under a language root and what its files look like.
 *
 * @param typedDirectory sub-directory of the typed namespace
 * @param flatDirectory  sub-directory of the flat namespace
 * @param fileExtension  extension of structured-data files, without the dot
 * @param rootElement    root element written into new files
 */
public record ResourceLayout(String typedDirectory, String flatDirectory, String fileExtension, String rootElement) {

    public static final String DEFAULT_EXTENSION = "xml";
    public static final String DEFAULT_ROOT_ELEMENT = "LanguageData";

    public ResourceLayout {
        if (StringUtils.isAnyBlank(typedDirectory, flatDirectory, fileExtension, rootElement)) {
            throw new IllegalArgumentException("Resource layout values must not be blank");
        }
        fileExtension = StringUtils.removeStart(fileExtension, ".");
    }

    public static ResourceLayout defaults() {
        return new ResourceLayout(Namespace.TYPED.defaultDirectory(), Namespace.FLAT.defaultDirectory(),
                DEFAULT_EXTENSION, DEFAULT_ROOT_ELEMENT);
    }

    public String directoryFor(Namespace namespace) {
        Objects.requireNonNull(namespace, "namespace");
        return namespace == Namespace.TYPED ? typedDirectory : flatDirectory;
    }

    public Path resolve(Path languageRoot, Namespace namespace) {
        return languageRoot.resolve(directoryFor(namespace));
    }

    public String fileName(String baseName) {
        return baseName + "." + fileExtension;
    }

    public boolean isResourceFile(Path path) {
        return Files.isRegularFile(path)
                && path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith("." + fileExtension.toLowerCase(Locale.ROOT));
    }
}
