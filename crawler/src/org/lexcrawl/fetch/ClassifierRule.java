package org.lexcrawl.fetch;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import org.jetbrains.annotations.Nullable;
import org.lexcrawl.util.Url;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * A URL pattern mapped to a fetch strategy. The rule type is deduced from which matching property is present.
 */
@JsonSubTypes({
        @JsonSubTypes.Type(value = ClassifierRule.Extension.class),
        @JsonSubTypes.Type(value = ClassifierRule.PathSegment.class),
        @JsonSubTypes.Type(value = ClassifierRule.PathPattern.class),
        @JsonSubTypes.Type(value = ClassifierRule.QueryParam.class)
})
@JsonTypeInfo(use = JsonTypeInfo.Id.DEDUCTION)
public sealed interface ClassifierRule permits ClassifierRule.Extension, ClassifierRule.PathSegment,
        ClassifierRule.PathPattern, ClassifierRule.QueryParam {

    boolean matches(Url url);

    Strategy strategy();

    double confidence();

    String reason();

    default Classification classification() {
        return new Classification(strategy(), confidence(), reason());
    }

    /**
     * Matches when the path ends with one of the given file extensions (without the dot).
     */
    record Extension(List<String> extension, Strategy strategy, double confidence, String reason)
            implements ClassifierRule {
        @Override
        public boolean matches(Url url) {
            String path = url.path().toLowerCase(Locale.ROOT);
            for (String ext : extension) {
                if (path.endsWith("." + ext.toLowerCase(Locale.ROOT))) return true;
            }
            return false;
        }
    }

    /**
     * Matches when any path segment equals one of the given names.
     */
    record PathSegment(List<String> pathSegment, Strategy strategy, double confidence, String reason)
            implements ClassifierRule {
        @Override
        public boolean matches(Url url) {
            var segments = url.pathSegments();
            for (String name : pathSegment) {
                if (segments.contains(name.toLowerCase(Locale.ROOT))) return true;
            }
            return false;
        }
    }

    /**
     * Matches when the regex is found anywhere in the path.
     */
    record PathPattern(String pathPattern, Strategy strategy, double confidence, String reason)
            implements ClassifierRule {
        @Override
        public boolean matches(Url url) {
            return Pattern.compile(pathPattern).matcher(url.path()).find();
        }
    }

    /**
     * Matches when one of the named query parameters is present, and equal to {@code value} if that is set.
     */
    record QueryParam(List<String> queryParam, @Nullable String value, Strategy strategy, double confidence,
                      String reason) implements ClassifierRule {
        @Override
        public boolean matches(Url url) {
            var params = url.queryParams();
            for (String name : queryParam) {
                String actual = params.get(name);
                if (actual != null && (value == null || value.equals(actual))) return true;
            }
            return false;
        }
    }
}
