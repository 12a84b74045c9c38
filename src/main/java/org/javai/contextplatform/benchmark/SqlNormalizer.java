package org.javai.contextplatform.benchmark;

import java.util.Locale;
import net.sf.jsqlparser.JSQLParserException;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.statement.Statement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Normalises SQL for textual comparison.
 *
 * <p>Parsable SQL is first re-rendered from its JSqlParser AST, which irons out formatting and
 * optional syntax (keyword case, redundant whitespace, quoting of some identifiers). The result,
 * or the raw text if it does not parse, is then lower-cased, whitespace-collapsed and stripped
 * of trailing semicolons. This is textual equality, not semantic equivalence.</p>
 */
public final class SqlNormalizer {

	private static final Logger logger = LoggerFactory.getLogger(SqlNormalizer.class);

	private SqlNormalizer() {
	}

	public static String normalize(String sql) {
		if (sql == null) {
			return "";
		}
		String text = stripTrailingSemicolons(sql.trim());
		if (text.isEmpty()) {
			return "";
		}
		String rendered = render(text);
		return stripTrailingSemicolons(rendered.replaceAll("\\s+", " ").trim()).toLowerCase(Locale.ROOT);
	}

	private static String render(String sql) {
		try {
			Statement statement = CCJSqlParserUtil.parse(sql);
			return statement.toString();
		} catch (JSQLParserException e) {
			logger.trace("SQL does not parse, comparing as text: {}", e.getMessage());
			return sql;
		}
	}

	public static boolean equivalent(String left, String right) {
		String a = normalize(left);
		return !a.isEmpty() && a.equals(normalize(right));
	}

	private static String stripTrailingSemicolons(String text) {
		String result = text.trim();
		while (result.endsWith(";")) {
			result = result.substring(0, result.length() - 1).trim();
		}
		return result;
	}
}
