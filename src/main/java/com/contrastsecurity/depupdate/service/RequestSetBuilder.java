package com.contrastsecurity.depupdate.service;

import com.contrastsecurity.depupdate.model.RequestSet;
import com.contrastsecurity.depupdate.model.VersionToken;
import com.contrastsecurity.depupdate.version.VersionTokenParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns command line selectors ({@code name} or {@code name@token}) into the
 * initial request set.
 */
public class RequestSetBuilder {
    private static final Logger logger = LoggerFactory.getLogger(RequestSetBuilder.class);

    /**
     * Optional scope, a name without "@", then an optional "@token".
     * Examples: rxjs, rxjs@6, @angular/core@next
     */
    private static final Pattern SELECTOR_PATTERN =
            Pattern.compile("^((?:@[^/]{1,100}/)?[^@]{1,100})(?:@(.{1,100}))?$");

    public static final String LATEST_TAG = "latest";
    public static final String NEXT_TAG = "next";

    private final ManifestCatalog catalog;

    public RequestSetBuilder(ManifestCatalog catalog) {
        this.catalog = catalog;
    }

    /**
     * Build the request set.
     *
     * Explicit selectors take precedence over bulk mode. In bulk mode every
     * catalog package is selected, except those declared with a URL, path or
     * git reference instead of a version range.
     *
     * @param selectors Package selectors from the command line, may be empty
     * @param all Select every declared package when no selector is given
     * @param next Default to the "next" dist-tag instead of "latest"
     * @return the request set, empty when nothing was selected
     */
    public RequestSet build(List<String> selectors, boolean all, boolean next) {
        boolean bulk = (selectors == null || selectors.isEmpty()) && all;
        List<String> effectiveSelectors = new ArrayList<>();
        if (selectors != null && !selectors.isEmpty()) {
            effectiveSelectors.addAll(selectors);
        } else if (all) {
            effectiveSelectors.addAll(catalog.names());
        }

        String defaultTag = next ? NEXT_TAG : LATEST_TAG;
        RequestSet.Builder builder = RequestSet.builder();

        for (String selector : effectiveSelectors) {
            Matcher matcher = SELECTOR_PATTERN.matcher(selector);
            if (!matcher.matches()) {
                logger.warn("Invalid package argument: \"{}\". Skipping.", selector);
                continue;
            }
            String name = matcher.group(1);
            String requested = matcher.group(2);

            String declaredRange = catalog.getRange(name);
            if (declaredRange == null || declaredRange.isEmpty()) {
                logger.warn("Package not installed: \"{}\". Skipping.", name);
                continue;
            }

            // Only bulk selection skips custom locators; an explicit selector means the user asked for it
            if (bulk && VersionTokenParser.isNonSemanticLocator(declaredRange)) {
                logger.warn("Package \"{}\" has a custom version: \"{}\". Skipping.", name, declaredRange);
                continue;
            }

            VersionToken token = requested != null
                    ? VersionTokenParser.parse(requested)
                    : VersionToken.tag(defaultTag);
            builder.put(name, token);
            logger.debug("Requested {} -> {}", name, token);
        }

        return builder.build();
    }
}
