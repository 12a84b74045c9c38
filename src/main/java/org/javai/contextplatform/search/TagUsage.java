package org.javai.contextplatform.search;

import org.javai.contextplatform.asset.TagCategory;

/**
 * @param tag normalised tag name
 * @param category category from the tag catalog, {@code DOMAIN} when unregistered
 * @param usageCount number of distinct active asset identities carrying the tag
 */
public record TagUsage(String tag, TagCategory category, int usageCount) {
}
