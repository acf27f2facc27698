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

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;
import net.boyechko.markup.rewrite.ast.DocumentCursor;
import net.boyechko.markup.rewrite.ast.GlobalLink;
import net.boyechko.markup.rewrite.ast.InternalTarget;
import net.boyechko.markup.rewrite.ast.InvalidSpan;
import net.boyechko.markup.rewrite.ast.Path;
import net.boyechko.markup.rewrite.ast.ResolvedInternalTarget;
import net.boyechko.markup.rewrite.ast.Span;
import net.boyechko.markup.rewrite.ast.Target;
import net.boyechko.markup.rewrite.ast.TargetFormats;
import net.boyechko.markup.rewrite.config.ConfigException;
import net.boyechko.markup.rewrite.config.ConfigKeys;
import net.boyechko.markup.rewrite.config.Versions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Validates internal links against the targets they point to. A target may exist for all output
 * formats or only some of them, and it may live in a path excluded from validation.
 *
 * <p>A target that exists but does not support all formats of the linking document can still be
 * reached through an external link if {@code laika.siteBaseURL} is set and the target is rendered
 * to html. Whether a link can switch to an external target is decided by the link itself: images
 * cannot.
 */
public class LinkValidator {
    private static final Logger logger = LoggerFactory.getLogger(LinkValidator.class);

    private static final String RECOVERY_CONDITION =
            " unless html is one of the formats and siteBaseUrl is defined";

    private final DocumentCursor cursor;
    private final Function<Path, Optional<TargetFormats>> findTargetFormats;
    private final Optional<String> outputFormat;
    private final Optional<String> siteBaseURL;
    private final LinkValidationMode mode;
    private final Set<Path> excludedPaths = new HashSet<>();

    /**
     * @param findTargetFormats the formats of the document or static file at a path, empty if
     *     there is no such target
     */
    public LinkValidator(
            DocumentCursor cursor, Function<Path, Optional<TargetFormats>> findTargetFormats) {
        this(cursor, findTargetFormats, LinkValidationMode.fromConfig(cursor.config()));
    }

    public LinkValidator(
            DocumentCursor cursor,
            Function<Path, Optional<TargetFormats>> findTargetFormats,
            LinkValidationMode mode) {
        this.cursor = cursor;
        this.findTargetFormats = findTargetFormats;
        this.outputFormat = cursor.root().outputFormat();
        this.siteBaseURL = cursor.config().getString(ConfigKeys.SITE_BASE_URL);
        this.mode = mode;
        versionsOf(cursor)
                .ifPresent(
                        versions ->
                                versions.allVersions()
                                        .forEach(v -> excludedPaths.add(Path.of(v.pathSegment()))));
        cursor.config()
                .getStringList(ConfigKeys.LINK_VALIDATION_EXCLUDED)
                .orElse(List.of())
                .forEach(p -> excludedPaths.add(Path.parse(p)));
    }

    /** The configured versions, or none if the version configuration cannot be read. */
    static Optional<Versions> versionsOf(DocumentCursor cursor) {
        try {
            return Versions.fromConfig(cursor.config());
        } catch (ConfigException e) {
            logger.warn("{} in {}, ignoring versions", e.getMessage(), cursor.path());
            return Optional.empty();
        }
    }

    public TargetValidation validate(Target target) {
        ResolvedInternalTarget resolved;
        if (target instanceof ResolvedInternalTarget r) {
            resolved = r;
        } else if (target instanceof InternalTarget internal) {
            resolved = internal.relativeTo(cursor.path());
        } else {
            return TargetValidation.VALID;
        }

        switch (mode) {
            case OFF:
                return TargetValidation.VALID;
            case LOCAL:
                if (!resolved.relativePath().isCurrentDocument()) return TargetValidation.VALID;
                return validateTarget(resolved, false);
            default:
                return validateTarget(resolved, true);
        }
    }

    private TargetValidation validateTarget(ResolvedInternalTarget target, boolean useExclusions) {
        Path absolute = target.absolutePath();
        Optional<TargetFormats> formats = findTargetFormats.apply(absolute);
        if (formats.isPresent()) return validateFormats(target, formats.get());
        if (useExclusions && isExcluded(absolute)) {
            TargetFormats treeFormats =
                    TargetFormats.fromList(
                            cursor.root()
                                    .selectTreeConfig(absolute.parent())
                                    .getStringList(ConfigKeys.TARGET_FORMATS)
                                    .orElse(null));
            return validateFormats(target, treeFormats);
        }
        return new TargetValidation.InvalidTarget(
                "unresolved internal reference: " + target.relativePath());
    }

    private boolean isExcluded(Path path) {
        return excludedPaths.stream().anyMatch(path::isSubPath);
    }

    private TargetValidation validateFormats(
            ResolvedInternalTarget target, TargetFormats targetFormats) {
        String invalidRef = "cannot reference document '" + target.relativePath() + "'";
        if (targetFormats instanceof TargetFormats.All) return TargetValidation.VALID;
        if (targetFormats instanceof TargetFormats.None) {
            return new TargetValidation.InvalidTarget(
                    invalidRef + " as it is excluded from rendering");
        }

        TargetFormats sourceFormats = cursor.targetFormats();
        if (sourceFormats instanceof TargetFormats.None) {
            // validated where the document gets included
            return TargetValidation.VALID;
        }
        if (outputFormat.isPresent()) {
            String output = outputFormat.get();
            if (targetFormats.contains(output)) return TargetValidation.VALID;
            return attemptRecovery(
                    target,
                    "document for output format "
                            + output
                            + " "
                            + invalidRef
                            + " that does not support this format",
                    targetFormats);
        }
        if (sourceFormats instanceof TargetFormats.Selected selected) {
            List<String> missing =
                    selected.formats().stream()
                            .filter(f -> !targetFormats.contains(f))
                            .collect(Collectors.toList());
            if (missing.isEmpty()) return TargetValidation.VALID;
            return attemptRecovery(
                    target,
                    invalidRef
                            + " that does not support some of the formats of this document ("
                            + String.join(", ", missing)
                            + ")",
                    targetFormats);
        }
        return attemptRecovery(
                target,
                "document for all output formats " + invalidRef + " with restricted output formats",
                targetFormats);
    }

    private TargetValidation attemptRecovery(
            ResolvedInternalTarget target, String message, TargetFormats targetFormats) {
        if (targetFormats.contains("html") && siteBaseURL.isPresent()) {
            return new TargetValidation.RecoveredTarget(
                    message, target.withInternalFormats(targetFormats));
        }
        return new TargetValidation.InvalidTarget(message + RECOVERY_CONDITION);
    }

    /**
     * Validates the target of a link. Returns the link itself, a copy pointing to a recovered
     * target, or an error message.
     */
    public ValidatedLink validate(GlobalLink link) {
        TargetValidation validation = validate(link.target());
        if (validation instanceof TargetValidation.InvalidTarget invalid) {
            return ValidatedLink.invalid(invalid.message());
        }
        if (validation instanceof TargetValidation.RecoveredTarget recovered) {
            if (!link.supportsExternalTargets()) return ValidatedLink.invalid(recovered.message());
            return ValidatedLink.valid(link.withTarget(recovered.recoveredTarget()));
        }
        return ValidatedLink.valid(link);
    }

    /** Like {@link #validate(GlobalLink)}, replacing invalid links with an invalid span. */
    public Span validateAndRecover(GlobalLink link, String source) {
        ValidatedLink result = validate(link);
        return result.link() != null ? result.link() : InvalidSpan.of(result.error(), source);
    }

    /** Either a link or an error message. */
    public record ValidatedLink(GlobalLink link, String error) {
        static ValidatedLink valid(GlobalLink link) {
            return new ValidatedLink(link, null);
        }

        static ValidatedLink invalid(String error) {
            return new ValidatedLink(null, error);
        }

        public boolean isValid() {
            return link != null;
        }
    }
}
