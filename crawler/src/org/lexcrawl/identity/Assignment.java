package org.lexcrawl.identity;

/**
 * Result of {@link IdentityService#assignOrLookup}.
 *
 * @param isNew false when the source URL already had a global id
 */
public record Assignment(String sourceUrl, String globalId, boolean isNew) {
}
