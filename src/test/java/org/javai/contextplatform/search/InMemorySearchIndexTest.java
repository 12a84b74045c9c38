package org.javai.contextplatform.search;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.time.Instant;
import java.util.List;
import java.util.Set;
import org.javai.contextplatform.asset.AssetKey;
import org.javai.contextplatform.asset.AssetType;
import org.javai.contextplatform.asset.ContextAsset;
import org.javai.contextplatform.asset.GlossaryContent;
import org.javai.contextplatform.asset.LifecycleState;
import org.javai.contextplatform.asset.SemanticVersion;
import org.javai.contextplatform.asset.TagCatalog;
import org.javai.contextplatform.asset.TagCategory;
import org.javai.contextplatform.asset.TagDefinition;
import org.javai.contextplatform.testsupport.FixedSimilarity;
import org.javai.contextplatform.testsupport.LogCapture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("InMemorySearchIndex")
class InMemorySearchIndexTest {

	private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

	private TagCatalog tagCatalog;

	@BeforeEach
	void setUp() {
		tagCatalog = new TagCatalog();
	}

	private static ContextAsset glossary(String id, String key, String name, String definition, LifecycleState state,
			Set<String> tags) {
		return new ContextAsset(id, AssetKey.of("warehouse", AssetType.GLOSSARY, key), SemanticVersion.INITIAL, name,
				"", new GlossaryContent(name, definition), null, tags, "alice", state, null, T0, T0, 0L);
	}

	@Nested
	@DisplayName("upsert")
	class Upsert {

		@Test
		@DisplayName("is idempotent for the same version")
		void idempotent() {
			InMemorySearchIndex index = new InMemorySearchIndex(tagCatalog);
			ContextAsset asset = glossary("g1", "revenue", "Revenue", "Net order amount", LifecycleState.DRAFT,
					Set.of());

			index.upsert(IndexedAsset.of(asset));
			SearchResults once = index.search(SearchQuery.of("warehouse", "revenue"));
			index.upsert(IndexedAsset.of(asset));
			SearchResults twice = index.search(SearchQuery.of("warehouse", "revenue"));

			assertThat(index.size()).isEqualTo(1);
			assertThat(twice).isEqualTo(once);
			assertThat(twice.hits()).hasSize(1);
		}

		@Test
		@DisplayName("ignores an older revision arriving late")
		void ignoresStaleRevision() {
			InMemorySearchIndex index = new InMemorySearchIndex(tagCatalog);
			ContextAsset draft = glossary("g1", "revenue", "Revenue", "Net order amount", LifecycleState.DRAFT,
					Set.of());
			ContextAsset verified = draft.withState(LifecycleState.VERIFIED, T0.plusSeconds(5));

			index.upsert(IndexedAsset.of(verified));
			index.upsert(IndexedAsset.of(draft));

			assertThat(index.get("g1")).map(e -> e.asset().lifecycleState()).contains(LifecycleState.VERIFIED);
		}
	}

	@Nested
	@DisplayName("ranking")
	class Ranking {

		@Test
		@DisplayName("exact name match scores highest")
		void exactNameMatch() {
			InMemorySearchIndex index = new InMemorySearchIndex(tagCatalog);
			index.upsert(IndexedAsset.of(glossary("g1", "revenue", "Revenue", "Net order amount",
					LifecycleState.DRAFT, Set.of())));
			index.upsert(IndexedAsset.of(glossary("g2", "gross-margin", "Gross margin",
					"Revenue minus cost of goods", LifecycleState.DRAFT, Set.of())));

			SearchResults results = index.search(SearchQuery.of("warehouse", "Revenue"));

			assertThat(results.hits()).extracting(h -> h.asset().id()).containsExactly("g1", "g2");
			assertThat(results.hits().get(0).score()).isEqualTo(1.0);
			assertThat(results.hits().get(0).matchKind()).isEqualTo(MatchKind.KEYWORD);
		}

		@Test
		@DisplayName("an exact name match keeps score 1 and leads even when semantic similarity favours others")
		void exactNameMatchIsNotBlendedDown() {
			FixedSimilarity similarity = new FixedSimilarity().when("revenue", "metric", 1.0);
			InMemorySearchIndex index = new InMemorySearchIndex(tagCatalog, similarity, SearchConfig.defaults());
			for (int i = 0; i < 10; i++) {
				index.upsert(IndexedAsset.of(glossary("m" + i, "revenue-metric-" + i, "Revenue metric " + i,
						"A revenue metric variant", LifecycleState.DRAFT, Set.of())));
			}
			index.upsert(IndexedAsset.of(glossary("target", "revenue", "Revenue", "Net order amount",
					LifecycleState.DRAFT, Set.of())));

			SearchResults results = index.search(SearchQuery.of("warehouse", "Revenue"));

			assertThat(results.hits()).hasSize(SearchQuery.DEFAULT_LIMIT);
			SearchHit first = results.hits().get(0);
			assertThat(first.asset().id()).isEqualTo("target");
			assertThat(first.score()).isEqualTo(1.0);
			assertThat(first.semanticScore()).isEqualTo(0.0);
			assertThat(first.exactMatch()).isTrue();
			assertThat(results.hits().get(1).exactMatch()).isFalse();
		}

		@Test
		@DisplayName("deprecated and superseded versions rank after active ones and are flagged")
		void inactiveRankLast() {
			InMemorySearchIndex index = new InMemorySearchIndex(tagCatalog);
			index.upsert(IndexedAsset.of(glossary("old", "revenue", "Revenue", "Gross order amount",
					LifecycleState.DEPRECATED, Set.of())));
			index.upsert(new IndexedAsset(glossary("superseded", "net-revenue", "Net revenue", "Revenue after refunds",
					LifecycleState.PUBLISHED, Set.of()), true));
			index.upsert(IndexedAsset.of(glossary("weak", "orders", "Orders", "Orders placed, basis of revenue",
					LifecycleState.DRAFT, Set.of())));

			SearchResults results = index.search(SearchQuery.of("warehouse", "revenue"));

			assertThat(results.hits()).extracting(h -> h.asset().id()).first().isEqualTo("weak");
			assertThat(results.hits()).filteredOn(SearchHit::deprecated).extracting(h -> h.asset().id())
					.containsExactly("old");
			assertThat(results.hits()).filteredOn(SearchHit::superseded).extracting(h -> h.asset().id())
					.containsExactly("superseded");
			assertThat(index.search(SearchQuery.of("warehouse", "revenue").activeOnly()).hits())
					.extracting(h -> h.asset().id()).containsExactly("weak");
		}

		@Test
		@DisplayName("finds assets through the semantic signal alone")
		void semanticOnlyMatch() {
			FixedSimilarity similarity = new FixedSimilarity().when("earnings", "net order amount", 0.8);
			InMemorySearchIndex index = new InMemorySearchIndex(tagCatalog, similarity, SearchConfig.defaults());
			index.upsert(IndexedAsset.of(glossary("g1", "revenue", "Revenue", "Net order amount",
					LifecycleState.PUBLISHED, Set.of())));

			SearchResults results = index.search(SearchQuery.of("warehouse", "earnings"));

			assertThat(results.degraded()).isFalse();
			assertThat(results.hits()).singleElement().satisfies(hit -> {
				assertThat(hit.matchKind()).isEqualTo(MatchKind.SEMANTIC);
				assertThat(hit.score()).isCloseTo(0.4, within(1e-9));
			});
		}

		@Test
		@DisplayName("stays within one connection")
		void scopedToConnection() {
			InMemorySearchIndex index = new InMemorySearchIndex(tagCatalog);
			index.upsert(IndexedAsset.of(glossary("g1", "revenue", "Revenue", "Net order amount",
					LifecycleState.PUBLISHED, Set.of())));

			assertThat(index.search(SearchQuery.of("crm", "revenue")).isEmpty()).isTrue();
		}
	}

	@Nested
	@DisplayName("degraded mode")
	class Degraded {

		@Test
		@DisplayName("answers keyword-only with a warning when the semantic signal fails")
		void keywordOnlyWhenSemanticFails() {
			FixedSimilarity similarity = new FixedSimilarity()
					.when("revenue", "net order amount", 0.9)
					.failWith(new IllegalStateException("embedding service down"));
			InMemorySearchIndex index = new InMemorySearchIndex(tagCatalog, similarity, SearchConfig.defaults());
			index.upsert(IndexedAsset.of(glossary("g1", "revenue", "Revenue", "Net order amount",
					LifecycleState.PUBLISHED, Set.of())));
			index.upsert(IndexedAsset.of(glossary("g2", "turnover", "Turnover", "Net order amount",
					LifecycleState.PUBLISHED, Set.of())));

			try (LogCapture logs = LogCapture.of(InMemorySearchIndex.class)) {
				SearchResults results = index.search(SearchQuery.of("warehouse", "revenue"));

				assertThat(results.degraded()).isTrue();
				assertThat(results.warning()).contains("embedding service down");
				assertThat(results.hits()).extracting(h -> h.asset().id()).containsExactly("g1");
				assertThat(results.hits().get(0).semanticScore()).isZero();
				assertThat(logs.warnings()).anyMatch(m -> m.contains("degrading to keyword search"));
			}
		}
	}

	@Test
	@DisplayName("tags count distinct active identities per tag")
	void tagUsage() {
		tagCatalog.define(new TagDefinition("finance", TagCategory.DOMAIN, "Finance"));
		tagCatalog.define(new TagDefinition("kpi", TagCategory.USE_CASE, "Headline metrics"));
		InMemorySearchIndex index = new InMemorySearchIndex(tagCatalog);
		index.upsert(IndexedAsset.of(glossary("g1", "revenue", "Revenue", "Net", LifecycleState.PUBLISHED,
				Set.of("finance", "kpi"))));
		index.upsert(IndexedAsset.of(glossary("g2", "margin", "Margin", "Net", LifecycleState.DRAFT,
				Set.of("Finance"))));
		index.upsert(IndexedAsset.of(glossary("g3", "legacy", "Legacy", "Old", LifecycleState.DEPRECATED,
				Set.of("finance"))));

		List<TagUsage> all = index.tags("warehouse", null);
		List<TagUsage> useCases = index.tags("warehouse", TagCategory.USE_CASE);

		assertThat(all).containsExactly(
				new TagUsage("finance", TagCategory.DOMAIN, 2),
				new TagUsage("kpi", TagCategory.USE_CASE, 1));
		assertThat(useCases).containsExactly(new TagUsage("kpi", TagCategory.USE_CASE, 1));
	}
}
