package org.javai.contextplatform.context;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import java.util.List;
import org.javai.contextplatform.asset.AssetContent;
import org.javai.contextplatform.asset.AssetKey;
import org.javai.contextplatform.asset.AssetPatch;
import org.javai.contextplatform.asset.AssetType;
import org.javai.contextplatform.asset.ContextAsset;
import org.javai.contextplatform.asset.GlossaryContent;
import org.javai.contextplatform.asset.InstructionContent;
import org.javai.contextplatform.asset.LifecycleState;
import org.javai.contextplatform.asset.SemanticVersion;
import org.javai.contextplatform.asset.SkillContent;
import org.javai.contextplatform.asset.TableDescriptionContent;
import org.javai.contextplatform.asset.TableDescriptionContent.ColumnDescription;
import org.javai.contextplatform.asset.TagCatalog;
import org.javai.contextplatform.asset.store.InMemoryAssetStore;
import org.javai.contextplatform.lifecycle.DefaultLifecycleManager;
import org.javai.contextplatform.lifecycle.NewAsset;
import org.javai.contextplatform.search.InMemorySearchIndex;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class SqlContextFormatterTest {

	private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

	private static ContextAsset asset(String key, String name, AssetContent content, LifecycleState state) {
		return new ContextAsset(key + "-id", AssetKey.of("warehouse", content.assetType(), key),
				SemanticVersion.INITIAL, name, "", content, null, null, "alice", state, null, NOW, NOW, 0L);
	}

	@Test
	@DisplayName("renders tables, glossary, instructions and skills in that order")
	void rendersSections() {
		String markdown = SqlContextFormatter.format(List.of(
				asset("revenue", "Revenue", new GlossaryContent("Revenue", "Completed order amounts",
						List.of("turnover"), "SUM(amount)"), LifecycleState.PUBLISHED),
				asset("fiscal", "Fiscal year", new InstructionContent("the user mentions a fiscal year",
						List.of("Fiscal years start on 1 April")), LifecycleState.PUBLISHED),
				asset("orders", "orders", new TableDescriptionContent("orders", "One row per order", List.of(
						new ColumnDescription("amount", "numeric", "Order total"),
						new ColumnDescription("status", null, null))), LifecycleState.PUBLISHED),
				asset("yoy", "Year over year", new SkillContent("Compare a metric between years",
						List.of("Aggregate per year", "Join on year - 1"), null), LifecycleState.VERIFIED)));

		assertThat(markdown).startsWith("## Tables");
		assertThat(markdown).contains("- orders: One row per order")
				.contains("  • amount (type=numeric; Order total)")
				.contains("  • status\n")
				.contains("- Revenue: Completed order amounts (aka: turnover)\n  SQL: `SUM(amount)`")
				.contains("- When the user mentions a fiscal year:\n  • Fiscal years start on 1 April")
				.contains("- Year over year: Compare a metric between years\n  1. Aggregate per year")
				.endsWith("use that expression for the term.");
		assertThat(markdown.indexOf("## Glossary")).isLessThan(markdown.indexOf("## Instructions"));
		assertThat(markdown.indexOf("## Instructions")).isLessThan(markdown.indexOf("## Skills"));
	}

	@Test
	@DisplayName("deprecated assets are never rendered")
	void skipsDeprecated() {
		assertThat(SqlContextFormatter.format(List.of(asset("old", "Old", new GlossaryContent("Old", "Gone"),
				LifecycleState.DEPRECATED)))).isEmpty();
		assertThat(SqlContextFormatter.format(List.of())).isEmpty();
	}

	@Test
	@DisplayName("a connection's context holds only the latest published tables and terms")
	void formatsPublishedConnectionContext() {
		DefaultLifecycleManager lifecycle = new DefaultLifecycleManager(new InMemoryAssetStore(),
				new InMemorySearchIndex(new TagCatalog()));
		ContextAsset v1 = lifecycle.create(NewAsset.builder("warehouse", AssetType.GLOSSARY, "revenue")
				.name("Revenue")
				.content(new GlossaryContent("Revenue", "Gross amounts"))
				.author("alice")
				.build());
		lifecycle.promote(v1.id(), LifecycleState.VERIFIED, "bob", null);
		lifecycle.promote(v1.id(), LifecycleState.PUBLISHED, "bob", null);
		ContextAsset v2 = lifecycle.createRevision(v1.id(), "alice");
		lifecycle.update(v2.id(), AssetPatch.content(
				new GlossaryContent("Revenue", "Net amounts")));
		lifecycle.promote(v2.id(), LifecycleState.VERIFIED, "bob", null);
		lifecycle.promote(v2.id(), LifecycleState.PUBLISHED, "bob", null);
		lifecycle.create(NewAsset.builder("warehouse", AssetType.GLOSSARY, "margin")
				.content(new GlossaryContent("Margin", "Draft only"))
				.author("alice")
				.build());

		String markdown = new SqlContextFormatter(lifecycle).formatForSqlContext("warehouse");

		assertThat(markdown).contains("- Revenue: Net amounts")
				.doesNotContain("Gross amounts")
				.doesNotContain("Draft only");
		assertThat(new SqlContextFormatter(lifecycle).formatForSqlContext("crm")).isEmpty();
	}
}
