package com.e2eq.l10n.source;

import com.e2eq.l10n.classify.DirectoryClassifier;
import com.e2eq.l10n.model.Namespace;
import com.e2eq.l10n.model.SourceEntry;
import com.e2eq.l10n.model.TargetEntry;
import com.e2eq.l10n.model.TreePresence;
import com.e2eq.l10n.resource.LoadResult;
import com.e2eq.l10n.resource.ResourceLayout;
import com.e2eq.l10n.resource.ResourceParser;
import org.apache.commons.lang3.StringUtils;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Reads source text from a source-language tree laid out like the target, e.g.
 * {@code Languages/English/DefInjected/ThingDef/Weapons.xml}.
 */
public class LanguageTreeSourceProvider implements SourceSnapshotProvider {

    static final String FLAT_TAG = "Keyed";

    private final Path root;
    private final ResourceLayout layout;
    private final ResourceParser parser;
    private final DirectoryClassifier classifier;

    public LanguageTreeSourceProvider(Path root, ResourceLayout layout, int parallelism) {
        this.root = Objects.requireNonNull(root, "root");
        this.layout = Objects.requireNonNull(layout, "layout");
        this.parser = new ResourceParser(layout, parallelism);
        this.classifier = new DirectoryClassifier(layout);
    }

    @Override
    public String getId() {
        return "tree:" + root;
    }

    @Override
    public TreePresence presence(Namespace namespace) {
        return classifier.classify(layout.resolve(root, namespace));
    }

    @Override
    public SourceSnapshot load(Namespace namespace) throws IOException {
        LoadResult result = parser.load(layout.resolve(root, namespace));
        List<SourceEntry> entries = result.entries().stream()
                .map(e -> new SourceEntry(e.key(), e.translatedText(), tagOf(namespace, e), e.originFile()))
                .toList();
        return new SourceSnapshot(entries, result.errors(), List.of());
    }

    /**
     * Typed entries are tagged {@code <DefType>.<field>}, the def type being the first directory of the file.
     */
    static String tagOf(Namespace namespace, TargetEntry entry) {
        if (namespace == Namespace.FLAT) {
            return FLAT_TAG;
        }
        String file = entry.originFile();
        String type = file.contains("/")
                ? StringUtils.substringBefore(file, "/")
                : StringUtils.substringBeforeLast(file, ".");
        return type + "." + entry.tag();
    }
}
