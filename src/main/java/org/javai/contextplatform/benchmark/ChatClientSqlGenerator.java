package org.javai.contextplatform.benchmark;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.javai.contextplatform.asset.ContextAsset;
import org.javai.contextplatform.context.SqlContextFormatter;
import org.springframework.ai.chat.client.ChatClient;

/**
 * {@link SqlGenerator} backed by a Spring AI {@link ChatClient}.
 *
 * <p>The fixture assets are rendered into the system prompt; the answer may be bare SQL or a
 * fenced {@code sql} block.</p>
 */
public class ChatClientSqlGenerator implements SqlGenerator {

	private static final Pattern SQL_BLOCK_PATTERN = Pattern.compile("```(?:sql)?\\s*\\n?(.*?)\\s*```",
			Pattern.DOTALL | Pattern.CASE_INSENSITIVE);

	private static final String SYSTEM_PROMPT = """
			You translate questions about a relational database into a single ANSI SQL SELECT statement.
			Answer with the SQL only, without explanation.
			""";

	private final ChatClient chatClient;

	public ChatClientSqlGenerator(ChatClient chatClient) {
		this.chatClient = Objects.requireNonNull(chatClient, "chatClient must not be null");
	}

	@Override
	public GeneratedSql generate(String question, List<ContextAsset> context) {
		String systemPrompt = buildSystemPrompt(context);
		String response = chatClient.prompt()
				.system(systemPrompt)
				.user(question)
				.call()
				.content();
		return new GeneratedSql(extractSql(response), Map.of("contextAssets", context.size()));
	}

	static String buildSystemPrompt(List<ContextAsset> context) {
		String catalog = SqlContextFormatter.format(context);
		return catalog.isEmpty() ? SYSTEM_PROMPT : SYSTEM_PROMPT + "\n" + catalog;
	}

	/**
	 * @return the SQL inside the first fenced block, else the trimmed response; {@code null} for
	 *         an empty response
	 */
	static String extractSql(String response) {
		if (response == null || response.isBlank()) {
			return null;
		}
		Matcher matcher = SQL_BLOCK_PATTERN.matcher(response);
		if (matcher.find()) {
			return matcher.group(1).trim();
		}
		return response.trim();
	}
}
