package org.javai.contextplatform.context;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;
import java.util.stream.Stream;
import org.javai.contextplatform.asset.AssetKey;
import org.javai.contextplatform.asset.AssetType;
import org.javai.contextplatform.asset.ContextAsset;
import org.javai.contextplatform.asset.GlossaryContent;
import org.javai.contextplatform.asset.InstructionContent;
import org.javai.contextplatform.asset.LifecycleState;
import org.javai.contextplatform.asset.SkillContent;
import org.javai.contextplatform.asset.TableDescriptionContent;
import org.javai.contextplatform.lifecycle.LifecycleManager;

/**
 * Renders context assets as a markdown block for SQL-generation prompts.
 *
 * <p>Tables come first, then glossary terms, instructions and skills. Deprecated assets are never
 * rendered.</p>
 */
public final class SqlContextFormatter {

	private static final String FOOTER = """

			SQL table and column names MUST be taken from the tables above exactly as shown.
			Where a glossary term has an SQL expression, use that expression for the term.""";

	private final LifecycleManager lifecycleManager;

	public SqlContextFormatter(LifecycleManager lifecycleManager) {
		this.lifecycleManager = Objects.requireNonNull(lifecycleManager, "lifecycleManager must not be null");
	}

	/**
	 * Formats the current published table descriptions and glossary terms of a connection.
	 *
	 * @return the markdown block, empty if the connection has no published tables or terms
	 */
	public String formatForSqlContext(String connectionId) {
		List<ContextAsset> published = Stream.of(AssetType.TABLE_DESCRIPTION, AssetType.GLOSSARY)
				.flatMap(type -> lifecycleManager.list(connectionId, type, LifecycleState.PUBLISHED).stream())
				.toList();
		return format(latestPerIdentity(published));
	}

	/**
	 * Formats the given assets, whatever their state, skipping deprecated ones.
	 */
	public static String format(List<ContextAsset> assets) {
		List<ContextAsset> usable = assets.stream().filter(a -> !a.isDeprecated()).toList();
		if (usable.isEmpty()) {
			return "";
		}
		StringBuilder sb = new StringBuilder();
		appendTables(sb, usable);
		appendGlossary(sb, usable);
		appendInstructions(sb, usable);
		appendSkills(sb, usable);
		sb.append(FOOTER);
		return sb.toString().trim();
	}

	private static void appendTables(StringBuilder sb, List<ContextAsset> assets) {
		List<TableDescriptionContent> tables = contents(assets, TableDescriptionContent.class);
		if (tables.isEmpty()) {
			return;
		}
		sb.append("## Tables\n");
		for (TableDescriptionContent table : tables) {
			sb.append("- ").append(table.tableName());
			if (notBlank(table.summary())) {
				sb.append(": ").append(table.summary());
			}
			sb.append("\n");
			for (TableDescriptionContent.ColumnDescription column : table.columns()) {
				sb.append("  • ").append(column.name());
				StringJoiner details = new StringJoiner("; ");
				if (notBlank(column.dataType())) {
					details.add("type=" + column.dataType());
				}
				if (notBlank(column.description())) {
					details.add(column.description());
				}
				if (details.length() > 0) {
					sb.append(" (").append(details).append(")");
				}
				sb.append("\n");
			}
		}
		sb.append("\n");
	}

	private static void appendGlossary(StringBuilder sb, List<ContextAsset> assets) {
		List<GlossaryContent> terms = contents(assets, GlossaryContent.class);
		if (terms.isEmpty()) {
			return;
		}
		sb.append("## Glossary\n");
		for (GlossaryContent term : terms) {
			sb.append("- ").append(term.term()).append(": ").append(term.definition());
			if (!term.synonyms().isEmpty()) {
				sb.append(" (aka: ").append(String.join(", ", term.synonyms())).append(")");
			}
			if (notBlank(term.sqlExpression())) {
				sb.append("\n  SQL: `").append(term.sqlExpression()).append("`");
			}
			sb.append("\n");
		}
		sb.append("\n");
	}

	private static void appendInstructions(StringBuilder sb, List<ContextAsset> assets) {
		List<InstructionContent> instructions = contents(assets, InstructionContent.class);
		if (instructions.isEmpty()) {
			return;
		}
		sb.append("## Instructions\n");
		for (InstructionContent instruction : instructions) {
			sb.append("- When ").append(instruction.condition()).append(":\n");
			instruction.rules().forEach(rule -> sb.append("  • ").append(rule).append("\n"));
		}
		sb.append("\n");
	}

	private static void appendSkills(StringBuilder sb, List<ContextAsset> assets) {
		List<ContextAsset> skills = assets.stream()
				.filter(a -> a.content() instanceof SkillContent)
				.toList();
		if (skills.isEmpty()) {
			return;
		}
		sb.append("## Skills\n");
		for (ContextAsset asset : skills) {
			SkillContent skill = (SkillContent) asset.content();
			sb.append("- ").append(asset.name()).append(": ").append(skill.description()).append("\n");
			for (int i = 0; i < skill.steps().size(); i++) {
				sb.append("  ").append(i + 1).append(". ").append(skill.steps().get(i)).append("\n");
			}
			if (notBlank(skill.sqlTemplate())) {
				sb.append("  Template: `").append(skill.sqlTemplate()).append("`\n");
			}
		}
		sb.append("\n");
	}

	private static <T> List<T> contents(List<ContextAsset> assets, Class<T> type) {
		return assets.stream()
				.map(ContextAsset::content)
				.filter(type::isInstance)
				.map(type::cast)
				.toList();
	}

	private static List<ContextAsset> latestPerIdentity(List<ContextAsset> assets) {
		Map<AssetKey, ContextAsset> latest = new LinkedHashMap<>();
		assets.stream()
				.sorted(Comparator.comparing((ContextAsset a) -> a.key().toString()))
				.forEach(asset -> latest.merge(asset.key(), asset,
						(a, b) -> a.version().isAfter(b.version()) ? a : b));
		return List.copyOf(latest.values());
	}

	private static boolean notBlank(String value) {
		return value != null && !value.isBlank();
	}
}
