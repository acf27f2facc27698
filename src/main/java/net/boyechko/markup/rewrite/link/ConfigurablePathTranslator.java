/*
 * Markup-Rewrite - Document Tree Rewrite Engine
 * Copyright (C) 2025 Richard Boyechko
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published
 * by the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package net.boyechko.markup.rewrite.link;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import net.boyechko.markup.rewrite.ast.ExternalTarget;
import net.boyechko.markup.rewrite.ast.Path;
import net.boyechko.markup.rewrite.ast.RelativePath;
import net.boyechko.markup.rewrite.ast.ResolvedInternalTarget;
import net.boyechko.markup.rewrite.ast.Target;
import net.boyechko.markup.rewrite.config.Versions;

/**
 * Translates paths for one output format, as seen from the document at {@code refPath}.
 *
 * <p>Markup documents get the suffix of the output format, static documents keep theirs. When
 * rendering html, versioned documents and static files move below the path segment of the current
 * version. Relative paths are translated by translating both ends as absolute paths first. Links
 * to documents not rendered to the current format become external links if a site base URL is
 * configured.
 */
public class ConfigurablePathTranslator implements PathTranslator {

    private final Optional<Versions> versions;
    private final Optional<String> siteBaseURL;
    private final String outputFormat;
    private final String outputSuffix;
    private final Path refPath;
    private final Function<Path, Optional<TranslatorSpec>> targetLookup;

    public ConfigurablePathTranslator(
            Optional<Versions> versions,
            Optional<String> siteBaseURL,
            String outputFormat,
            Path refPath,
            Function<Path, Optional<TranslatorSpec>> targetLookup) {
        this.versions = versions;
        this.siteBaseURL = siteBaseURL;
        this.outputFormat = outputFormat;
        this.outputSuffix = suffixFor(outputFormat);
        this.refPath = refPath;
        this.targetLookup = targetLookup;
    }

    /** The file suffix of documents rendered to the given format. */
    public static String suffixFor(String format) {
        switch (format) {
            case "html":
                return "html";
            case "epub":
            case "xhtml":
                return "epub.xhtml";
            case "fo":
            case "pdf":
                return "fo";
            default:
                return format;
        }
    }

    @Override
    public Path translate(Path input) {
        return translate(input, "html".equals(outputFormat), outputSuffix);
    }

    private Path translate(Path input, boolean isHtmlTarget, String suffix) {
        Optional<TranslatorSpec> spec = targetLookup.apply(input.withoutFragment());
        if (spec.isEmpty()) return input;
        Path shifted = input;
        if (spec.get().isVersioned() && isHtmlTarget && versions.isPresent()) {
            List<String> segments = new ArrayList<>();
            segments.add(versions.get().currentVersion().pathSegment());
            segments.addAll(input.segments());
            shifted = Path.of(segments).withFragment(input.fragment().orElse(null));
        }
        return spec.get().isStatic() ? shifted : shifted.withSuffix(suffix);
    }

    @Override
    public RelativePath translate(RelativePath input) {
        if (input.isCurrentDocument()) return input;
        Path absolute = refPath.parent().resolve(input);
        Path translatedRef = translate(refPath);
        return translate(absolute).relativeTo(translatedRef.parent());
    }

    @Override
    public Target translate(Target target) {
        if (target instanceof ResolvedInternalTarget resolved
                && siteBaseURL.isPresent()
                && !resolved.internalFormats().contains(outputFormat)) {
            String base = siteBaseURL.get();
            if (base.endsWith("/")) base = base.substring(0, base.length() - 1);
            Path htmlPath = translate(resolved.absolutePath(), true, "html");
            return new ExternalTarget(base + htmlPath);
        }
        return PathTranslator.super.translate(target);
    }
}
